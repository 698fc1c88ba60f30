package app.cardwise.core.deck.domain.type;

public enum ModelType {
    STANDARD(0),
    CLOZE(1);

    private final int code;

    ModelType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
