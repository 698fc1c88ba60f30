package app.cardwise.core.review.algorithm;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.review.domain.Rating;

import java.time.Instant;

/**
 * A scheduling algorithm. Implementations work on a copy of the card and never touch the store.
 * <p>
 * Learning cards carry a due time in epoch seconds, review cards a day number and an interval in days.
 */
public interface SrsAlgorithm {

    String id();

    /**
     * @param today study day number of {@code now}
     * @param fuzz  whether review intervals get random spread; previews pass {@code false}
     */
    Transition apply(CardEntity card, Rating rating, Instant now, long today, boolean fuzz);

    default Transition apply(CardEntity card, Rating rating, Instant now, long today) {
        return apply(card, rating, now, today, true);
    }

    /**
     * @param loggedInterval interval written to the review log: days when positive, seconds when negative
     * @param leech          the answer pushed the lapse count to the leech threshold
     */
    record Transition(CardEntity card, ReviewKind kind, int lastInterval, int loggedInterval, boolean leech) {
    }
}
