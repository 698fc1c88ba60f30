package app.cardwise.core.review.algorithm.impl;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.review.algorithm.CardStateCodec;
import app.cardwise.core.review.algorithm.SrsAlgorithm;
import app.cardwise.core.review.domain.Rating;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Box system: Good moves a card up one box, Easy two, Hard keeps it and Again drops it back by
 * {@code leitnerDropBoxes} (to the first box when that is 0). Each box has a fixed delay; delays under a
 * day keep the card in the learning queue.
 */
@Component
public class LeitnerAlgorithm implements SrsAlgorithm {

    public static final String ID = "leitner";

    private static final Duration ONE_DAY = Duration.ofDays(1);

    private final SchedulerProps props;
    private final CardStateCodec codec;

    public LeitnerAlgorithm(SchedulerProps props, CardStateCodec codec) {
        this.props = props;
        this.codec = codec;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Transition apply(CardEntity card, Rating rating, Instant now, long today, boolean fuzz) {
        List<Duration> boxes = props.leitnerIntervals();
        int lastBox = boxes.size() - 1;
        int box = codec.read(card, ID)
                .map(state -> state.path("box").asInt(0))
                .orElseGet(() -> boxForInterval(card, boxes));
        box = Math.max(0, Math.min(lastBox, box));

        int nextBox = switch (rating) {
            case AGAIN -> props.leitnerDropBoxes() == 0 ? 0 : Math.max(0, box - props.leitnerDropBoxes());
            case HARD -> box;
            case GOOD -> Math.min(lastBox, box + 1);
            case EASY -> Math.min(lastBox, box + 2);
        };

        CardEntity next = card.copy();
        int lastInterval = card.getInterval();
        next.setReps(card.getReps() + 1);
        next.setMod(now.getEpochSecond());
        next.setRemainingSteps(0);
        if (next.getEaseFactor() <= 0) {
            next.setEaseFactor(props.initialEase());
        }
        boolean leech = false;
        if (rating == Rating.AGAIN) {
            next.setLapses(card.getLapses() + 1);
            leech = card.getType() == CardType.REVIEW && next.getLapses() >= props.leechThreshold();
        }

        ObjectNode state = codec.createObject();
        state.put("box", nextBox);
        state.put("last", now.getEpochSecond());
        codec.write(next, ID, state);

        ReviewKind kind = kindOf(card.getType());
        Duration delay = boxes.get(nextBox);
        if (delay.compareTo(ONE_DAY) < 0) {
            long minutes = Math.max(1, delay.toMinutes());
            next.setType(card.getType() == CardType.NEW || card.getType() == CardType.LEARNING
                    ? CardType.LEARNING
                    : CardType.RELEARNING);
            next.setQueue(CardQueue.LEARNING);
            next.setInterval(0);
            next.setDue(now.getEpochSecond() + minutes * 60);
            return new Transition(next, kind, lastInterval, (int) -(minutes * 60), leech);
        }

        int interval = (int) Math.max(1, Math.min(props.maximumInterval(), Math.round(delay.toHours() / 24.0)));
        next.setType(CardType.REVIEW);
        next.setQueue(CardQueue.REVIEW);
        next.setInterval(interval);
        next.setDue(today + interval);
        return new Transition(next, kind, lastInterval, interval, leech);
    }

    /**
     * Cards scheduled by another algorithm start in the highest box whose delay does not exceed their
     * current interval.
     */
    private static int boxForInterval(CardEntity card, List<Duration> boxes) {
        if (card.getType() != CardType.REVIEW || card.getInterval() <= 0) {
            return 0;
        }
        Duration current = Duration.ofDays(card.getInterval());
        int box = 0;
        for (int i = 0; i < boxes.size(); i++) {
            if (boxes.get(i).compareTo(current) <= 0) {
                box = i;
            }
        }
        return box;
    }

    private static ReviewKind kindOf(CardType type) {
        return switch (type) {
            case NEW, LEARNING -> ReviewKind.LEARN;
            case RELEARNING -> ReviewKind.RELEARN;
            case REVIEW -> ReviewKind.REVIEW;
        };
    }
}
