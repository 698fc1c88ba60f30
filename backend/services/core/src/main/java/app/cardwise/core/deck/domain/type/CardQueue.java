package app.cardwise.core.deck.domain.type;

/**
 * Queue codes follow the package format so imported rows keep their meaning.
 * Negative codes are inactive queues.
 */
public enum CardQueue {
    USER_BURIED(-3),
    SCHED_BURIED(-2),
    SUSPENDED(-1),
    NEW(0),
    LEARNING(1),
    REVIEW(2),
    DAY_LEARNING(3);

    private final int code;

    CardQueue(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isActive() {
        return code >= 0;
    }

    public static CardQueue fromCode(int code) {
        for (CardQueue queue : values()) {
            if (queue.code == code) {
                return queue;
            }
        }
        throw new IllegalArgumentException("Unknown card queue: " + code);
    }
}
