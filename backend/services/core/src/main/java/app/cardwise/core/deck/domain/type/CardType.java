package app.cardwise.core.deck.domain.type;

public enum CardType {
    NEW(0),
    LEARNING(1),
    REVIEW(2),
    RELEARNING(3);

    private final int code;

    CardType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static CardType fromCode(int code) {
        for (CardType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown card type: " + code);
    }
}
