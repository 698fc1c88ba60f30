package app.cardwise.core.review.algorithm.impl;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.review.algorithm.IntervalFuzzer;
import app.cardwise.core.review.algorithm.SrsAlgorithm;
import app.cardwise.core.review.domain.Rating;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class Sm2AlgorithmTest {

    private static final Instant NOW = Instant.parse("2024-03-05T10:00:00Z");
    private static final long TODAY = 100;

    private final SchedulerProps props = SchedulerProps.defaults().withFuzzFraction(0);
    private final Sm2Algorithm algorithm = new Sm2Algorithm(props, new IntervalFuzzer(new Random(7), props));

    @Test
    void apply_newCardGoodTwiceGraduatesWithOneDay() {
        CardEntity card = newCard();

        SrsAlgorithm.Transition first = algorithm.apply(card, Rating.GOOD, NOW, TODAY);
        assertThat(first.card().getType()).isEqualTo(CardType.LEARNING);
        assertThat(first.card().getQueue()).isEqualTo(CardQueue.LEARNING);
        assertThat(first.card().getRemainingSteps()).isEqualTo(1);
        assertThat(first.card().getDue()).isEqualTo(NOW.getEpochSecond() + 600);
        assertThat(first.loggedInterval()).isEqualTo(-600);
        assertThat(first.kind()).isEqualTo(ReviewKind.LEARN);

        SrsAlgorithm.Transition second = algorithm.apply(first.card(), Rating.GOOD, NOW.plusSeconds(600), TODAY);
        CardEntity graduated = second.card();
        assertThat(graduated.getType()).isEqualTo(CardType.REVIEW);
        assertThat(graduated.getQueue()).isEqualTo(CardQueue.REVIEW);
        assertThat(graduated.getInterval()).isEqualTo(1);
        assertThat(graduated.getEaseFactor()).isEqualTo(2500);
        assertThat(graduated.getDue()).isEqualTo(TODAY + 1);
        assertThat(graduated.getReps()).isEqualTo(2);
    }

    @Test
    void apply_leavesInputCardUntouched() {
        CardEntity card = newCard();

        algorithm.apply(card, Rating.EASY, NOW, TODAY);

        assertThat(card.getType()).isEqualTo(CardType.NEW);
        assertThat(card.getReps()).isZero();
    }

    @Test
    void apply_easyOnNewCardGraduatesWithEasyInterval() {
        CardEntity card = algorithm.apply(newCard(), Rating.EASY, NOW, TODAY).card();

        assertThat(card.getQueue()).isEqualTo(CardQueue.REVIEW);
        assertThat(card.getInterval()).isEqualTo(4);
        assertThat(card.getDue()).isEqualTo(TODAY + 4);
    }

    @Test
    void apply_againInLearningRestartsSteps() {
        CardEntity stepped = algorithm.apply(newCard(), Rating.GOOD, NOW, TODAY).card();

        CardEntity again = algorithm.apply(stepped, Rating.AGAIN, NOW, TODAY).card();

        assertThat(again.getRemainingSteps()).isEqualTo(2);
        assertThat(again.getDue()).isEqualTo(NOW.getEpochSecond() + 60);
    }

    @Test
    void apply_noLearningStepsGraduatesImmediately() {
        SchedulerProps noSteps = props.withLearningSteps(List.of(), List.of());
        Sm2Algorithm direct = new Sm2Algorithm(noSteps, new IntervalFuzzer(new Random(7), noSteps));

        CardEntity card = direct.apply(newCard(), Rating.GOOD, NOW, TODAY).card();

        assertThat(card.getType()).isEqualTo(CardType.REVIEW);
        assertThat(card.getInterval()).isEqualTo(1);
    }

    @Test
    void apply_goodOnReviewMultipliesByEase() {
        SrsAlgorithm.Transition transition = algorithm.apply(reviewCard(10, 2500, 0), Rating.GOOD, NOW, TODAY);

        assertThat(transition.card().getInterval()).isEqualTo(25);
        assertThat(transition.card().getEaseFactor()).isEqualTo(2500);
        assertThat(transition.lastInterval()).isEqualTo(10);
        assertThat(transition.card().getDue()).isEqualTo(TODAY + 25);
    }

    @Test
    void apply_hardOnReviewUsesHardMultiplier() {
        CardEntity card = algorithm.apply(reviewCard(10, 2500, 0), Rating.HARD, NOW, TODAY).card();

        assertThat(card.getInterval()).isEqualTo(12);
        assertThat(card.getEaseFactor()).isEqualTo(2350);
    }

    @Test
    void apply_easyOnReviewAddsBonusAndEase() {
        CardEntity card = algorithm.apply(reviewCard(10, 2500, 0), Rating.EASY, NOW, TODAY).card();

        assertThat(card.getEaseFactor()).isEqualTo(2650);
        assertThat(card.getInterval()).isEqualTo(35);
    }

    @Test
    void apply_lapseHalvesIntervalAndEntersRelearning() {
        SrsAlgorithm.Transition transition = algorithm.apply(reviewCard(10, 2500, 0), Rating.AGAIN, NOW, TODAY);
        CardEntity card = transition.card();

        assertThat(card.getInterval()).isEqualTo(5);
        assertThat(card.getLapses()).isEqualTo(1);
        assertThat(card.getEaseFactor()).isEqualTo(2300);
        assertThat(card.getType()).isEqualTo(CardType.RELEARNING);
        assertThat(card.getQueue()).isEqualTo(CardQueue.LEARNING);
        assertThat(card.getDue()).isEqualTo(NOW.getEpochSecond() + 600);
        assertThat(transition.leech()).isFalse();

        CardEntity relearned = algorithm.apply(card, Rating.GOOD, NOW.plusSeconds(600), TODAY).card();
        assertThat(relearned.getType()).isEqualTo(CardType.REVIEW);
        assertThat(relearned.getInterval()).isEqualTo(5);
        assertThat(relearned.getDue()).isEqualTo(TODAY + 5);
    }

    @Test
    void apply_easeNeverDropsBelowMinimum() {
        CardEntity card = algorithm.apply(reviewCard(3, 1350, 0), Rating.AGAIN, NOW, TODAY).card();

        assertThat(card.getEaseFactor()).isEqualTo(1300);
        assertThat(card.getInterval()).isEqualTo(1);
    }

    @Test
    void apply_reportsLeechAtThreshold() {
        SrsAlgorithm.Transition transition = algorithm.apply(reviewCard(20, 2000, 7), Rating.AGAIN, NOW, TODAY);

        assertThat(transition.leech()).isTrue();
        assertThat(transition.card().getQueue()).isEqualTo(CardQueue.LEARNING);
    }

    private static CardEntity newCard() {
        CardEntity card = new CardEntity(1, 1, 1, 0);
        card.setType(CardType.NEW);
        card.setQueue(CardQueue.NEW);
        return card;
    }

    private static CardEntity reviewCard(int interval, int ease, int lapses) {
        CardEntity card = new CardEntity(1, 1, 1, 0);
        card.setType(CardType.REVIEW);
        card.setQueue(CardQueue.REVIEW);
        card.setInterval(interval);
        card.setEaseFactor(ease);
        card.setLapses(lapses);
        card.setDue(TODAY);
        return card;
    }
}
