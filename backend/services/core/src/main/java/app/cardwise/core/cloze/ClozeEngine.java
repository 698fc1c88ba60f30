package app.cardwise.core.cloze;

import app.cardwise.core.text.PlainText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and rewrites {@code {{cN::content::hint}}} markers.
 * <p>
 * Markers may nest and their content may carry arbitrary markup, so closing braces are matched by
 * balancing {@code {{}/{@code }}} pairs instead of by a single regular expression. Every method is
 * pure and never throws on malformed input; problems are reported through {@link #validate(String)}.
 */
@Component
public class ClozeEngine {

    public static final String PLACEHOLDER = "...";

    private static final Pattern OPENING_PATTERN = Pattern.compile("\\{\\{c(\\d*)::");
    private static final String HIDDEN = "[...]";

    public List<ClozeMarker> parse(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return parse(text, 0, text.length(), new ArrayList<>());
    }

    /**
     * Distinct indices in ascending order.
     */
    public List<Integer> listIndices(String text) {
        SortedSet<Integer> indices = new TreeSet<>();
        for (ClozeMarker marker : flatten(parse(text))) {
            indices.add(marker.index());
        }
        return List.copyOf(indices);
    }

    public int count(String text) {
        return listIndices(text).size();
    }

    public int nextIndex(String text) {
        List<Integer> indices = listIndices(text);
        return indices.isEmpty() ? 1 : indices.get(indices.size() - 1) + 1;
    }

    /**
     * Rewrites indices to the contiguous range {@code 1..K}. Text whose indices already form that
     * range is returned unchanged; otherwise indices are assigned in order of first appearance.
     */
    public String renumber(String text) {
        List<ClozeMarker> markers = flatten(parse(text));
        if (markers.isEmpty()) {
            return text;
        }
        List<Integer> indices = listIndices(text);
        if (isContiguous(indices)) {
            return text;
        }

        markers.sort(Comparator.comparingInt(ClozeMarker::start));
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        for (ClozeMarker marker : markers) {
            mapping.putIfAbsent(marker.index(), mapping.size() + 1);
        }

        StringBuilder out = new StringBuilder(text);
        List<ClozeMarker> reversed = new ArrayList<>(markers);
        Collections.reverse(reversed);
        for (ClozeMarker marker : reversed) {
            int digitsStart = marker.start() + 3;
            int digitsEnd = marker.contentStart() - 2;
            out.replace(digitsStart, digitsEnd, String.valueOf(mapping.get(marker.index())));
        }
        return out.toString();
    }

    /**
     * One plain-text preview per index: that index's occurrences are masked as {@code [...]} (or
     * {@code [hint]}), every other cloze shows its content.
     */
    public List<ClozePreview> extractPreviews(String text) {
        List<ClozeMarker> markers = parse(text);
        if (markers.isEmpty()) {
            return List.of();
        }
        List<ClozePreview> previews = new ArrayList<>();
        for (Integer index : listIndices(text)) {
            String rendered = render(text, 0, text.length(), markers, index);
            previews.add(new ClozePreview(index, PlainText.strip(rendered)));
        }
        return previews;
    }

    public List<ClozeIssue> validate(String text) {
        List<ClozeIssue> issues = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return issues;
        }
        List<ClozeMarker> markers = flatten(parse(text, 0, text.length(), issues));
        for (ClozeMarker marker : markers) {
            if (PlainText.strip(marker.content()).isEmpty()) {
                issues.add(new ClozeIssue(ClozeIssue.Type.EMPTY_CONTENT, marker.index(),
                        "Cloze c" + marker.index() + " has empty content"));
            }
        }

        List<Integer> indices = listIndices(text);
        int previous = 0;
        for (Integer index : indices) {
            if (index > previous + 1) {
                issues.add(new ClozeIssue(ClozeIssue.Type.GAP, index,
                        "Gap in cloze numbering: " + previous + " to " + index));
            }
            previous = index;
        }
        return issues;
    }

    public ClozeInsertion insertAt(String text, TextSelection selection, Integer explicitIndex) {
        return insert(text, selection, explicitIndex, null);
    }

    public ClozeInsertion insertWithHint(String text, TextSelection selection, String hint, Integer explicitIndex) {
        return insert(text, selection, explicitIndex, hint);
    }

    private ClozeInsertion insert(String text, TextSelection selection, Integer explicitIndex, String hint) {
        String source = text == null ? "" : text;
        if (selection.end() > source.length()) {
            throw new IllegalArgumentException("Selection exceeds text length: end=" + selection.end()
                    + ", length=" + source.length());
        }
        if (explicitIndex != null && explicitIndex < 1) {
            throw new IllegalArgumentException("Cloze index must be positive: " + explicitIndex);
        }
        int index = explicitIndex != null ? explicitIndex : nextIndex(source);
        String selected = source.substring(selection.start(), selection.end());
        String content = selected.isEmpty() ? PLACEHOLDER : selected;

        String prefix = "{{c" + index + "::";
        StringBuilder marker = new StringBuilder(prefix).append(content);
        if (hint != null && !hint.isBlank()) {
            marker.append("::").append(hint);
        }
        marker.append("}}");

        String updated = source.substring(0, selection.start()) + marker + source.substring(selection.end());
        int contentStart = selection.start() + prefix.length();
        return new ClozeInsertion(updated, new TextSelection(contentStart, contentStart + content.length()), index);
    }

    private List<ClozeMarker> parse(String text, int from, int to, List<ClozeIssue> issues) {
        List<ClozeMarker> markers = new ArrayList<>();
        Matcher matcher = OPENING_PATTERN.matcher(text);
        int position = from;
        while (position < to && matcher.find(position)) {
            if (matcher.end() > to) {
                break;
            }
            int start = matcher.start();
            int contentStart = matcher.end();
            int close = findClose(text, contentStart, to);
            Integer index = parseIndex(matcher.group(1));

            if (index == null || close < 0) {
                String reason = index == null ? "missing or invalid index" : "missing closing braces";
                issues.add(new ClozeIssue(ClozeIssue.Type.MALFORMED, index == null ? 0 : index,
                        "Malformed cloze at offset " + start + ": " + reason));
                position = contentStart;
                continue;
            }

            int separator = findHintSeparator(text, contentStart, close);
            int contentEnd = separator < 0 ? close : separator;
            String hint = separator < 0 ? null : text.substring(separator + 2, close);
            List<ClozeMarker> children = parse(text, contentStart, contentEnd, issues);
            markers.add(new ClozeMarker(index, start, close + 2, contentStart, contentEnd,
                    text.substring(contentStart, contentEnd), hint, children));
            position = close + 2;
        }
        return markers;
    }

    private String render(String text, int from, int to, List<ClozeMarker> markers, int target) {
        StringBuilder out = new StringBuilder();
        int position = from;
        for (ClozeMarker marker : markers) {
            out.append(text, position, marker.start());
            if (marker.index() == target) {
                out.append(marker.hasHint() ? "[" + marker.hint() + "]" : HIDDEN);
            } else {
                out.append(render(text, marker.contentStart(), marker.contentEnd(), marker.children(), target));
            }
            position = marker.end();
        }
        out.append(text, position, to);
        return out.toString();
    }

    private static int findClose(String text, int from, int to) {
        int depth = 0;
        int i = from;
        while (i < to - 1) {
            if (text.startsWith("{{", i)) {
                depth++;
                i += 2;
            } else if (text.startsWith("}}", i)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
                i += 2;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static int findHintSeparator(String text, int from, int to) {
        int depth = 0;
        int i = from;
        while (i < to - 1) {
            if (text.startsWith("{{", i)) {
                depth++;
                i += 2;
            } else if (text.startsWith("}}", i)) {
                depth--;
                i += 2;
            } else if (depth == 0 && text.startsWith("::", i)) {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static Integer parseIndex(String digits) {
        if (digits == null || digits.isEmpty()) {
            return null;
        }
        try {
            int value = Integer.parseInt(digits);
            return value > 0 ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static boolean isContiguous(List<Integer> sortedIndices) {
        for (int i = 0; i < sortedIndices.size(); i++) {
            if (sortedIndices.get(i) != i + 1) {
                return false;
            }
        }
        return true;
    }

    private static List<ClozeMarker> flatten(List<ClozeMarker> markers) {
        List<ClozeMarker> out = new ArrayList<>();
        for (ClozeMarker marker : markers) {
            out.add(marker);
            out.addAll(flatten(marker.children()));
        }
        return out;
    }
}
