package app.cardwise.core.review.domain;

public enum Rating {
    AGAIN(1), HARD(2), GOOD(3), EASY(4);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    public static Rating fromCode(int code) {
        for (Rating rating : values()) {
            if (rating.code == code) {
                return rating;
            }
        }
        throw new IllegalArgumentException("Unknown rating code: " + code);
    }
}
