package app.cardwise.core.cloze;

public record ClozeIssue(Type type, int index, String message) {

    public enum Type {
        GAP,
        EMPTY_CONTENT,
        MALFORMED
    }
}
