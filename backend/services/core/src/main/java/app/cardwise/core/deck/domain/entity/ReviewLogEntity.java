package app.cardwise.core.deck.domain.entity;

import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;

/**
 * One answer. {@code id} is the answer time in epoch milliseconds.
 */
public class ReviewLogEntity {

    private long id;
    private long cardId;
    private int rating;
    private int interval;
    private int lastInterval;
    private int easeFactor;
    private long durationMs;
    private ReviewKind kind;
    private CardType previousType;

    public ReviewLogEntity() {
    }

    public ReviewLogEntity(
            long id,
            long cardId,
            int rating,
            int interval,
            int lastInterval,
            int easeFactor,
            long durationMs,
            ReviewKind kind,
            CardType previousType
    ) {
        this.id = id;
        this.cardId = cardId;
        this.rating = rating;
        this.interval = interval;
        this.lastInterval = lastInterval;
        this.easeFactor = easeFactor;
        this.durationMs = durationMs;
        this.kind = kind;
        this.previousType = previousType;
    }

    public ReviewLogEntity copy() {
        ReviewLogEntity copy = new ReviewLogEntity();
        copy.id = id;
        copy.cardId = cardId;
        copy.rating = rating;
        copy.interval = interval;
        copy.lastInterval = lastInterval;
        copy.easeFactor = easeFactor;
        copy.durationMs = durationMs;
        copy.kind = kind;
        copy.previousType = previousType;
        return copy;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getCardId() {
        return cardId;
    }

    public void setCardId(long cardId) {
        this.cardId = cardId;
    }

    public int getRating() {
        return rating;
    }

    public void setRating(int rating) {
        this.rating = rating;
    }

    public int getInterval() {
        return interval;
    }

    public void setInterval(int interval) {
        this.interval = interval;
    }

    public int getLastInterval() {
        return lastInterval;
    }

    public void setLastInterval(int lastInterval) {
        this.lastInterval = lastInterval;
    }

    public int getEaseFactor() {
        return easeFactor;
    }

    public void setEaseFactor(int easeFactor) {
        this.easeFactor = easeFactor;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public ReviewKind getKind() {
        return kind;
    }

    public void setKind(ReviewKind kind) {
        this.kind = kind;
    }

    public CardType getPreviousType() {
        return previousType;
    }

    public void setPreviousType(CardType previousType) {
        this.previousType = previousType;
    }

}
