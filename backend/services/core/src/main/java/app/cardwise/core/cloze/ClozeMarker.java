package app.cardwise.core.cloze;

import java.util.List;

/**
 * One parsed {@code {{cN::content::hint}}} marker. Offsets are absolute positions in the source text:
 * {@code start}/{@code end} span the whole marker, {@code contentStart}/{@code contentEnd} the content
 * without the hint.
 */
public record ClozeMarker(
        int index,
        int start,
        int end,
        int contentStart,
        int contentEnd,
        String content,
        String hint,
        List<ClozeMarker> children
) {
    public boolean hasHint() {
        return hint != null && !hint.isBlank();
    }
}
