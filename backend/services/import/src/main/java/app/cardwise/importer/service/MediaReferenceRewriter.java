package app.cardwise.importer.service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites media references in field HTML so they point at the names used in local storage.
 */
public class MediaReferenceRewriter {

    private static final Pattern IMAGE_PATTERN = Pattern.compile("<img[^>]+src=[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SOUND_PATTERN = Pattern.compile("\\[sound:([^\\]]+)]", Pattern.CASE_INSENSITIVE);
    private static final Pattern AUDIO_TAG_PATTERN = Pattern.compile("<audio[^>]+src=[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern VIDEO_TAG_PATTERN = Pattern.compile("<video[^>]+src=[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SOURCE_TAG_PATTERN = Pattern.compile("<source[^>]+src=[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> PATTERNS = List.of(
            IMAGE_PATTERN,
            SOUND_PATTERN,
            AUDIO_TAG_PATTERN,
            VIDEO_TAG_PATTERN,
            SOURCE_TAG_PATTERN
    );

    private final Map<String, String> renames;

    /**
     * @param renames referenced name (archive token or original file name) to stored name
     */
    public MediaReferenceRewriter(Map<String, String> renames) {
        this.renames = Map.copyOf(renames);
    }

    public List<String> rewriteAll(List<String> values) {
        if (renames.isEmpty()) {
            return values;
        }
        return values.stream().map(this::rewrite).toList();
    }

    public String rewrite(String value) {
        if (value == null || value.isEmpty() || renames.isEmpty()) {
            return value;
        }
        String out = value;
        for (Pattern pattern : PATTERNS) {
            out = rewrite(pattern, out);
        }
        return out;
    }

    private String rewrite(Pattern pattern, String value) {
        Matcher matcher = pattern.matcher(value);
        StringBuilder out = null;
        int last = 0;
        while (matcher.find()) {
            String reference = matcher.group(1);
            String target = lookup(reference);
            if (target == null || target.equals(reference)) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(value.length());
            }
            out.append(value, last, matcher.start(1)).append(target);
            last = matcher.end(1);
        }
        if (out == null) {
            return value;
        }
        out.append(value, last, value.length());
        return out.toString();
    }

    private String lookup(String reference) {
        String trimmed = reference.trim();
        String direct = renames.get(trimmed);
        if (direct != null) {
            return direct;
        }
        try {
            return renames.get(URLDecoder.decode(trimmed, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
