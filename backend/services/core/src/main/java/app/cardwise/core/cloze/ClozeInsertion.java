package app.cardwise.core.cloze;

/**
 * Result of wrapping a selection in a cloze marker: the new text and the selection covering the
 * marker's content, so an editor can keep the inserted words highlighted.
 */
public record ClozeInsertion(String text, TextSelection selection, int index) {
}
