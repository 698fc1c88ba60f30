package app.cardwise.core.text;

import java.util.regex.Pattern;

/**
 * Markup-to-text helpers shared by cloze previews, search indexing and note previews.
 */
public final class PlainText {

    public static final String FIELD_SEPARATOR = "\u001f";

    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private PlainText() {
    }

    /**
     * Replaces tags with a space so adjacent cells don't merge into one word, decodes the common
     * entities and collapses whitespace.
     */
    public static String strip(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String text = TAG_PATTERN.matcher(value).replaceAll(" ");
        text = decodeEntities(text);
        return collapse(text);
    }

    public static String collapse(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE_PATTERN.matcher(value).replaceAll(" ").trim();
    }

    static String decodeEntities(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        return value.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
