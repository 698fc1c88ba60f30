package app.cardwise.core.review.algorithm.impl;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.review.algorithm.IntervalFuzzer;
import app.cardwise.core.review.algorithm.SrsAlgorithm;
import app.cardwise.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * SM-2 with learning and relearning steps. Learning cards keep the number of steps left in
 * {@code remainingSteps}; review cards grow their interval by the ease factor.
 */
@Component
public class Sm2Algorithm implements SrsAlgorithm {

    public static final String ID = "sm2";

    private final SchedulerProps props;
    private final IntervalFuzzer fuzzer;

    public Sm2Algorithm(SchedulerProps props, IntervalFuzzer fuzzer) {
        this.props = props;
        this.fuzzer = fuzzer;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Transition apply(CardEntity card, Rating rating, Instant now, long today, boolean fuzz) {
        CardEntity next = card.copy();
        int lastInterval = card.getInterval();
        next.setReps(card.getReps() + 1);
        next.setMod(now.getEpochSecond());

        return switch (card.getType()) {
            case NEW -> {
                next.setType(CardType.LEARNING);
                next.setQueue(CardQueue.LEARNING);
                next.setEaseFactor(props.initialEase());
                next.setRemainingSteps(props.learningSteps().size());
                yield handleLearning(next, rating, now, today, lastInterval);
            }
            case LEARNING -> handleLearning(next, rating, now, today, lastInterval);
            case RELEARNING -> handleRelearning(next, rating, now, today, lastInterval);
            case REVIEW -> handleReview(next, rating, now, today, lastInterval, fuzz);
        };
    }

    private Transition handleLearning(CardEntity card, Rating rating, Instant now, long today, int lastInterval) {
        if (card.getEaseFactor() <= 0) {
            card.setEaseFactor(props.initialEase());
        }
        List<Integer> steps = props.learningSteps();
        if (steps.isEmpty() || rating == Rating.EASY) {
            int days = rating == Rating.EASY ? props.easyInterval() : props.graduatingInterval();
            return graduate(card, days, today, ReviewKind.LEARN, lastInterval);
        }
        return step(card, steps, rating, now, today, ReviewKind.LEARN, lastInterval, props.graduatingInterval());
    }

    private Transition handleRelearning(CardEntity card, Rating rating, Instant now, long today, int lastInterval) {
        List<Integer> steps = props.relearningSteps();
        int lapseInterval = Math.max(1, card.getInterval());
        if (steps.isEmpty() || rating == Rating.EASY) {
            int days = rating == Rating.EASY ? Math.min(props.maximumInterval(), lapseInterval + 1) : lapseInterval;
            return graduate(card, days, today, ReviewKind.RELEARN, lastInterval);
        }
        return step(card, steps, rating, now, today, ReviewKind.RELEARN, lastInterval, lapseInterval);
    }

    private Transition step(CardEntity card,
                            List<Integer> steps,
                            Rating rating,
                            Instant now,
                            long today,
                            ReviewKind kind,
                            int lastInterval,
                            int graduatingDays) {
        int total = steps.size();
        int left = card.getRemainingSteps();
        if (left < 1 || left > total) {
            left = total;
        }

        switch (rating) {
            case AGAIN -> left = total;
            case GOOD -> left--;
            default -> {
            }
        }
        if (left == 0) {
            return graduate(card, graduatingDays, today, kind, lastInterval);
        }

        int delayMinutes = Math.max(1, steps.get(total - left));
        card.setRemainingSteps(left);
        card.setQueue(CardQueue.LEARNING);
        card.setDue(now.getEpochSecond() + delayMinutes * 60L);
        return new Transition(card, kind, lastInterval, -delayMinutes * 60, false);
    }

    private Transition graduate(CardEntity card, int days, long today, ReviewKind kind, int lastInterval) {
        int interval = Math.max(1, Math.min(props.maximumInterval(), days));
        card.setType(CardType.REVIEW);
        card.setQueue(CardQueue.REVIEW);
        card.setInterval(interval);
        card.setRemainingSteps(0);
        card.setDue(today + interval);
        return new Transition(card, kind, lastInterval, interval, false);
    }

    private Transition handleReview(CardEntity card, Rating rating, Instant now, long today, int lastInterval, boolean fuzz) {
        int interval = Math.max(1, card.getInterval());
        int ease = card.getEaseFactor() > 0 ? card.getEaseFactor() : props.initialEase();

        if (rating == Rating.AGAIN) {
            ease = Math.max(props.minimumEase(), ease + props.againEaseDelta());
            int lapses = card.getLapses() + 1;
            int lapseInterval = Math.max(props.minimumLapseInterval(), (int) Math.floor(interval * props.lapseMultiplier()));
            card.setEaseFactor(ease);
            card.setLapses(lapses);
            card.setInterval(lapseInterval);
            boolean leech = lapses >= props.leechThreshold();

            List<Integer> steps = props.relearningSteps();
            if (steps.isEmpty()) {
                card.setType(CardType.REVIEW);
                card.setQueue(CardQueue.REVIEW);
                card.setDue(today + lapseInterval);
                return new Transition(card, ReviewKind.REVIEW, lastInterval, lapseInterval, leech);
            }
            int delayMinutes = Math.max(1, steps.get(0));
            card.setType(CardType.RELEARNING);
            card.setQueue(CardQueue.LEARNING);
            card.setRemainingSteps(steps.size());
            card.setDue(now.getEpochSecond() + delayMinutes * 60L);
            return new Transition(card, ReviewKind.REVIEW, lastInterval, -delayMinutes * 60, leech);
        }

        double raw = switch (rating) {
            case HARD -> {
                ease = Math.max(props.minimumEase(), ease + props.hardEaseDelta());
                yield interval * props.hardMultiplier();
            }
            case EASY -> {
                ease = ease + props.easyEaseDelta();
                yield interval * (ease / 1000.0) * props.easyBonus();
            }
            default -> interval * (ease / 1000.0);
        };
        // the epsilon keeps 10 * 1.2 = 12.000000000000002 from rounding up to 13
        int next = (int) Math.ceil(raw * props.intervalModifier() - 1e-9);
        if (fuzz) {
            next = fuzzer.fuzz(next);
        }
        next = Math.min(props.maximumInterval(), Math.max(interval + 1, next));

        card.setEaseFactor(ease);
        card.setInterval(next);
        card.setType(CardType.REVIEW);
        card.setQueue(CardQueue.REVIEW);
        card.setDue(today + next);
        return new Transition(card, ReviewKind.REVIEW, lastInterval, next, false);
    }
}
