package app.cardwise.core.review.algorithm.impl;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.review.algorithm.CardStateCodec;
import app.cardwise.core.review.algorithm.IntervalFuzzer;
import app.cardwise.core.review.algorithm.SrsAlgorithm;
import app.cardwise.core.review.domain.Rating;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * FSRS-6 memory model. Each card keeps a stability {@code s} in days, a difficulty {@code d} in
 * {@code [1, 10]} and the time of its last answer; review intervals are the days until the predicted
 * recall probability drops to {@code desiredRetention}.
 * <p>
 * Learning and relearning steps come from the same settings SM-2 uses and do not change the memory state.
 */
@Component
public class FsrsAlgorithm implements SrsAlgorithm {

    public static final String ID = "fsrs";

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final SchedulerProps props;
    private final IntervalFuzzer fuzzer;
    private final CardStateCodec codec;
    private final double[] w;

    public FsrsAlgorithm(SchedulerProps props, IntervalFuzzer fuzzer, CardStateCodec codec) {
        this.props = props;
        this.fuzzer = fuzzer;
        this.codec = codec;
        this.w = props.fsrsWeights().stream().mapToDouble(Double::doubleValue).toArray();
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
        if (next.getEaseFactor() <= 0) {
            next.setEaseFactor(props.initialEase());
        }
        int g = grade(rating);
        FsrsState stored = codec.read(card, ID).map(FsrsState::from).orElse(null);

        return switch (card.getType()) {
            case NEW -> {
                next.setType(CardType.LEARNING);
                next.setQueue(CardQueue.LEARNING);
                next.setRemainingSteps(props.learningSteps().size());
                FsrsState initial = new FsrsState(initialStability(g), initialDifficulty(g), now.getEpochSecond());
                yield handleLearning(next, rating, now, today, initial, lastInterval);
            }
            case LEARNING -> handleLearning(next, rating, now, today,
                    stored != null ? stored : new FsrsState(initialStability(g), initialDifficulty(g), now.getEpochSecond()),
                    lastInterval);
            case RELEARNING -> handleRelearning(next, rating, now, today, orFromCard(stored, card, now), lastInterval);
            case REVIEW -> handleReview(next, rating, now, today, orFromCard(stored, card, now), lastInterval, fuzz);
        };
    }

    private Transition handleLearning(CardEntity card, Rating rating, Instant now, long today, FsrsState st, int lastInterval) {
        List<Integer> steps = props.learningSteps();
        if (steps.isEmpty() || rating == Rating.EASY) {
            int days = rating == Rating.EASY ? props.easyInterval() : props.graduatingInterval();
            return graduate(card, st.answeredAt(now), days, today, ReviewKind.LEARN, lastInterval);
        }
        return step(card, steps, rating, now, today, st, ReviewKind.LEARN, lastInterval, props.graduatingInterval());
    }

    private Transition handleRelearning(CardEntity card, Rating rating, Instant now, long today, FsrsState st, int lastInterval) {
        List<Integer> steps = props.relearningSteps();
        int days = intervalFor(st.s());
        if (steps.isEmpty() || rating == Rating.EASY) {
            return graduate(card, st.answeredAt(now), days, today, ReviewKind.RELEARN, lastInterval);
        }
        return step(card, steps, rating, now, today, st, ReviewKind.RELEARN, lastInterval, days);
    }

    private Transition step(CardEntity card,
                            List<Integer> steps,
                            Rating rating,
                            Instant now,
                            long today,
                            FsrsState st,
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
            return graduate(card, st.answeredAt(now), graduatingDays, today, kind, lastInterval);
        }

        int delayMinutes = Math.max(1, steps.get(total - left));
        card.setRemainingSteps(left);
        card.setQueue(CardQueue.LEARNING);
        card.setDue(now.getEpochSecond() + delayMinutes * 60L);
        store(card, st.answeredAt(now));
        return new Transition(card, kind, lastInterval, -delayMinutes * 60, false);
    }

    private Transition graduate(CardEntity card, FsrsState st, int days, long today, ReviewKind kind, int lastInterval) {
        int interval = Math.max(1, Math.min(props.maximumInterval(), days));
        card.setType(CardType.REVIEW);
        card.setQueue(CardQueue.REVIEW);
        card.setInterval(interval);
        card.setRemainingSteps(0);
        card.setDue(today + interval);
        store(card, st);
        return new Transition(card, kind, lastInterval, interval, false);
    }

    private Transition handleReview(CardEntity card, Rating rating, Instant now, long today, FsrsState st,
                                    int lastInterval, boolean fuzz) {
        int g = grade(rating);
        double elapsedDays = Math.max(0.0, (now.getEpochSecond() - st.last()) / SECONDS_PER_DAY);
        double s = st.s() > 0 ? st.s() : initialStability(3);
        double d = st.d() > 0 ? st.d() : initialDifficulty(3);

        double r = retrievability(elapsedDays, s);
        double newD = updateDifficulty(d, g);

        if (g == 1) {
            double newS = stabilityAfterForgetting(newD, s, r);
            FsrsState next = new FsrsState(newS, newD, now.getEpochSecond());
            int lapses = card.getLapses() + 1;
            int lapseInterval = intervalFor(newS);
            card.setLapses(lapses);
            card.setInterval(lapseInterval);
            boolean leech = lapses >= props.leechThreshold();

            List<Integer> steps = props.relearningSteps();
            if (steps.isEmpty()) {
                card.setType(CardType.REVIEW);
                card.setQueue(CardQueue.REVIEW);
                card.setDue(today + lapseInterval);
                store(card, next);
                return new Transition(card, ReviewKind.REVIEW, lastInterval, lapseInterval, leech);
            }
            int delayMinutes = Math.max(1, steps.get(0));
            card.setType(CardType.RELEARNING);
            card.setQueue(CardQueue.LEARNING);
            card.setRemainingSteps(steps.size());
            card.setDue(now.getEpochSecond() + delayMinutes * 60L);
            store(card, next);
            return new Transition(card, ReviewKind.REVIEW, lastInterval, -delayMinutes * 60, leech);
        }

        double newS = elapsedDays < 1.0
                ? stabilitySameDay(s, g)
                : stabilityAfterRecall(newD, s, r, g);
        int interval = intervalFor(newS);
        if (fuzz) {
            interval = Math.max(1, Math.min(props.maximumInterval(), fuzzer.fuzz(interval)));
        }

        card.setType(CardType.REVIEW);
        card.setQueue(CardQueue.REVIEW);
        card.setInterval(interval);
        card.setDue(today + interval);
        store(card, new FsrsState(newS, newD, now.getEpochSecond()));
        return new Transition(card, ReviewKind.REVIEW, lastInterval, interval, false);
    }

    /**
     * State for cards that have no FSRS section yet: the current interval stands in for stability and
     * the last answer is assumed one interval ago.
     */
    private FsrsState orFromCard(FsrsState stored, CardEntity card, Instant now) {
        if (stored != null && stored.last() > 0) {
            return stored;
        }
        int interval = Math.max(0, card.getInterval());
        double s = interval > 0 ? interval : initialStability(3);
        return new FsrsState(s, initialDifficulty(3), now.getEpochSecond() - (long) (interval * SECONDS_PER_DAY));
    }

    private void store(CardEntity card, FsrsState st) {
        ObjectNode node = codec.createObject();
        node.put("s", st.s());
        node.put("d", st.d());
        node.put("last", st.last());
        codec.write(card, ID, node);
    }

    int intervalFor(double stability) {
        double days = intervalFromRetention(stability, props.desiredRetention());
        return (int) Math.max(1, Math.min(props.maximumInterval(), Math.round(days)));
    }

    private double retrievability(double tDays, double s) {
        double w20 = safeW20(w[20]);
        double factor = Math.pow(0.9, -1.0 / w20) - 1.0;
        return Math.pow(1.0 + factor * (tDays / s), -w20);
    }

    private double intervalFromRetention(double s, double r) {
        double w20 = safeW20(w[20]);
        double factor = Math.pow(0.9, -1.0 / w20) - 1.0;
        return (s / factor) * (Math.pow(r, -1.0 / w20) - 1.0);
    }

    private double stabilitySameDay(double s, int g) {
        double inc = Math.exp(w[17] * (g - 3.0 + w[18])) * Math.pow(s, -w[19]);
        if (g >= 3) inc = Math.max(1.0, inc);
        return Math.max(0.1, s * inc);
    }

    private double stabilityAfterRecall(double d, double s, double r, int g) {
        double hardMul = (g == 2) ? w[15] : 1.0;
        double easyMul = (g == 4) ? w[16] : 1.0;

        double term = Math.exp(w[8])
                * (11.0 - d)
                * Math.pow(s, -w[9])
                * (Math.exp(w[10] * (1.0 - r)) - 1.0)
                * hardMul
                * easyMul;

        return Math.max(0.1, s * (term + 1.0));
    }

    private double stabilityAfterForgetting(double d, double s, double r) {
        double out = w[11]
                * Math.pow(d, -w[12])
                * (Math.pow(s + 1.0, w[13]) - 1.0)
                * Math.exp(w[14] * (1.0 - r));
        return Math.max(0.1, Math.min(s, out));
    }

    double initialStability(int g) {
        int idx = Math.max(0, Math.min(3, g - 1));
        return Math.max(0.1, w[idx]);
    }

    double initialDifficulty(int g) {
        double d = w[4] - Math.exp(w[5] * (g - 1.0)) + 1.0;
        return clamp(d, 1.0, 10.0);
    }

    private double updateDifficulty(double d, int g) {
        double delta = -w[6] * (g - 3.0);
        double d1 = d + delta * (10.0 - d) / 9.0;
        double d2 = w[7] * initialDifficulty(4) + (1.0 - w[7]) * d1;
        return clamp(d2, 1.0, 10.0);
    }

    private static int grade(Rating rating) {
        return switch (rating) {
            case AGAIN -> 1;
            case HARD -> 2;
            case GOOD -> 3;
            case EASY -> 4;
        };
    }

    private static double safeW20(double w20) {
        return (w20 <= 0.0) ? 1.0 : w20;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    record FsrsState(double s, double d, long last) {
        static FsrsState from(JsonNode n) {
            return new FsrsState(n.path("s").asDouble(0.0), n.path("d").asDouble(0.0), n.path("last").asLong(0L));
        }

        FsrsState answeredAt(Instant now) {
            return new FsrsState(s, d, now.getEpochSecond());
        }
    }
}
