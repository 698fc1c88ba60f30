package app.cardwise.core.media.storage;

import java.util.regex.Pattern;

public final class MediaFileNames {

    static final int MAX_LENGTH = 255;

    private static final Pattern UNSAFE_PATTERN = Pattern.compile("[^A-Za-z0-9._-]");

    private MediaFileNames() {
    }

    /**
     * Keeps only the last path component, drops {@code ..}, replaces anything outside
     * {@code [A-Za-z0-9._-]} with {@code _} and caps the length while keeping the extension.
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "media";
        }
        String base = name.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        base = base.replace("..", "");
        base = UNSAFE_PATTERN.matcher(base).replaceAll("_");
        while (base.startsWith(".")) {
            base = base.substring(1);
        }
        if (base.isEmpty()) {
            return "media";
        }
        if (base.length() > MAX_LENGTH) {
            String extension = extension(base);
            base = base.substring(0, MAX_LENGTH - extension.length()) + extension;
        }
        return base;
    }

    /**
     * {@code name} with {@code _n} inserted before the extension.
     */
    public static String withSuffix(String name, int n) {
        String extension = extension(name);
        String stem = name.substring(0, name.length() - extension.length());
        String suffix = "_" + n;
        if (stem.length() + suffix.length() + extension.length() > MAX_LENGTH) {
            stem = stem.substring(0, MAX_LENGTH - suffix.length() - extension.length());
        }
        return stem + suffix + extension;
    }

    static String extension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || name.length() - dot > 10) {
            return "";
        }
        return name.substring(dot);
    }
}
