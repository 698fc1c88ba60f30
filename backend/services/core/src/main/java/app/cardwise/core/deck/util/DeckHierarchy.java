package app.cardwise.core.deck.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deck hierarchy helpers. Parent/child relations are never stored; they follow from the
 * {@code ::}-separated path in the deck name. Comparisons ignore case.
 */
public final class DeckHierarchy {

    public static final String SEPARATOR = "::";

    private DeckHierarchy() {
    }

    public static boolean isSameOrDescendant(String name, String ancestor) {
        if (name == null || ancestor == null) {
            return false;
        }
        String n = name.toLowerCase(Locale.ROOT);
        String a = ancestor.toLowerCase(Locale.ROOT);
        return n.equals(a) || n.startsWith(a + SEPARATOR);
    }

    public static String parentName(String name) {
        int idx = name.lastIndexOf(SEPARATOR);
        return idx < 0 ? null : name.substring(0, idx);
    }

    public static String leafName(String name) {
        int idx = name.lastIndexOf(SEPARATOR);
        return idx < 0 ? name : name.substring(idx + SEPARATOR.length());
    }

    /**
     * Proper ancestors from the root down, e.g. {@code A::B::C -> [A, A::B]}.
     */
    public static List<String> ancestors(String name) {
        List<String> out = new ArrayList<>();
        int idx = name.indexOf(SEPARATOR);
        while (idx >= 0) {
            out.add(name.substring(0, idx));
            idx = name.indexOf(SEPARATOR, idx + SEPARATOR.length());
        }
        return out;
    }

    /**
     * Trims every path component and drops empty ones.
     */
    public static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Deck name is required");
        }
        List<String> parts = new ArrayList<>();
        for (String part : name.split(SEPARATOR, -1)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Deck name is required");
        }
        return String.join(SEPARATOR, parts);
    }

    /**
     * Replaces the {@code from} prefix of {@code name} with {@code to}; {@code name} must be {@code from}
     * itself or one of its descendants.
     */
    public static String rebase(String name, String from, String to) {
        return to + name.substring(from.length());
    }
}
