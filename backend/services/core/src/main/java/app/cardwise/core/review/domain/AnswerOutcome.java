package app.cardwise.core.review.domain;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;

/**
 * @param leech the card's lapse count has reached the leech threshold; the card is not suspended
 */
public record AnswerOutcome(CardEntity card, ReviewLogEntity reviewLog, boolean leech) {
}
