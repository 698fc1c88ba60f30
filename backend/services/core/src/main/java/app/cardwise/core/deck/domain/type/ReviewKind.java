package app.cardwise.core.deck.domain.type;

public enum ReviewKind {
    LEARN(0),
    REVIEW(1),
    RELEARN(2),
    FILTERED(3);

    private final int code;

    ReviewKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ReviewKind fromCode(int code) {
        for (ReviewKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return REVIEW;
    }
}
