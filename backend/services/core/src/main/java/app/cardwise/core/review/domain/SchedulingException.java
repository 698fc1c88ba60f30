package app.cardwise.core.review.domain;

/**
 * Raised when a card cannot be answered; the card is left unchanged.
 */
public class SchedulingException extends RuntimeException {

    private final long cardId;

    public SchedulingException(long cardId, String message) {
        super(message);
        this.cardId = cardId;
    }

    public long cardId() {
        return cardId;
    }
}
