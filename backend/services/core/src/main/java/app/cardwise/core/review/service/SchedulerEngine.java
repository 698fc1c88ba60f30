package app.cardwise.core.review.service;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.review.algorithm.AlgorithmRegistry;
import app.cardwise.core.review.algorithm.SrsAlgorithm;
import app.cardwise.core.review.domain.AnswerOutcome;
import app.cardwise.core.review.domain.DueCounts;
import app.cardwise.core.review.domain.Rating;
import app.cardwise.core.review.domain.SchedulingException;
import app.cardwise.core.review.domain.StudySession;
import app.cardwise.core.review.util.StudyDays;
import app.cardwise.core.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Study sessions, answers and filtered-deck relocation. Each card is scheduled by the algorithm its
 * home deck selects, so cards borrowed by a filtered deck keep their own algorithm.
 */
@Service
public class SchedulerEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    private final EntityStore store;
    private final AlgorithmRegistry algorithms;
    private final StudyDays studyDays;

    public SchedulerEngine(EntityStore store, AlgorithmRegistry algorithms, StudyDays studyDays) {
        this.store = store;
        this.algorithms = algorithms;
        this.studyDays = studyDays;
    }

    /**
     * Picks the scheduling algorithm for cards whose home is {@code deckId}. A blank id returns the deck
     * to the collection default. Existing cards keep their due dates until they are next answered.
     */
    public DeckEntity setDeckAlgorithm(long deckId, String algorithmId) {
        DeckEntity deck = store.requireDeck(deckId);
        if (deck.isFiltered()) {
            throw new IllegalArgumentException("Deck " + deckId + " is a filtered deck; its cards follow their home deck");
        }
        String id = algorithmId == null ? "" : algorithmId.trim();
        if (!id.isEmpty()) {
            algorithms.require(id);
        }
        deck.setAlgorithm(id);
        store.replaceDeck(deck);
        log.info("Deck algorithm changed deckId={} algorithm={}", deckId, id.isEmpty() ? algorithms.defaultId() : id);
        return store.requireDeck(deckId);
    }

    public SrsAlgorithm algorithmFor(CardEntity card) {
        return algorithms.forDeck(store.requireDeck(card.homeDeckId()));
    }

    /**
     * Opens a session for the deck and its descendants. Today's new and review counters are rebuilt
     * from the review log, so a restarted process picks up where it stopped.
     */
    public StudySession startSession(long deckId, Instant now) {
        DeckEntity deck = store.requireDeck(deckId);
        Set<Long> deckIds = store.deckTreeIds(deckId);
        long today = studyDays.today(now);
        long since = studyDays.startOf(today).toEpochMilli();

        int newDone = 0;
        int reviewsDone = 0;
        for (ReviewLogEntity entry : store.reviewLogsSince(since)) {
            Optional<CardEntity> card = store.findCard(entry.getCardId());
            if (card.isEmpty() || !deckIds.contains(card.get().homeDeckId()) && !deckIds.contains(card.get().getDeckId())) {
                continue;
            }
            if (entry.getPreviousType() == CardType.NEW) {
                newDone++;
            } else if (entry.getPreviousType() == CardType.REVIEW) {
                reviewsDone++;
            }
        }
        return new StudySession(deckId, deckIds, today, deck.getNewPerDay(), deck.getReviewsPerDay(), newDone, reviewsDone);
    }

    /**
     * Cards to study now: learning cards due by {@code now}, then review cards due today, then new
     * cards, each group capped by what is left of the day's limits.
     */
    public List<CardEntity> fetchDue(StudySession session, Instant now) {
        long nowSeconds = now.getEpochSecond();
        long today = studyDays.today(now);

        List<CardEntity> candidates = store.findCards(card -> !card.isDeleted() && session.contains(card.getDeckId()));

        List<CardEntity> learning = candidates.stream()
                .filter(card -> card.getQueue() == CardQueue.LEARNING && card.getDue() <= nowSeconds
                        || card.getQueue() == CardQueue.DAY_LEARNING && card.getDue() <= today)
                .sorted(Comparator.comparingLong(SchedulerEngine::learningSortKey).thenComparingLong(CardEntity::getId))
                .toList();

        List<CardEntity> reviews = candidates.stream()
                .filter(card -> card.getQueue() == CardQueue.REVIEW && card.getDue() <= today)
                .filter(card -> !session.isBuried(card.getNoteId()))
                .sorted(Comparator.comparingLong(CardEntity::getDue).thenComparingLong(CardEntity::getId))
                .limit(session.remainingReviews())
                .toList();

        List<CardEntity> fresh = candidates.stream()
                .filter(card -> card.getQueue() == CardQueue.NEW)
                .filter(card -> !session.isBuried(card.getNoteId()))
                .sorted(Comparator.comparingLong(CardEntity::getId))
                .limit(session.remainingNew())
                .toList();

        List<CardEntity> out = new ArrayList<>(learning.size() + reviews.size() + fresh.size());
        out.addAll(learning);
        out.addAll(reviews);
        out.addAll(fresh);
        return out;
    }

    public Optional<CardEntity> nextCard(StudySession session, Instant now) {
        List<CardEntity> due = fetchDue(session, now);
        return due.isEmpty() ? Optional.empty() : Optional.of(due.get(0));
    }

    public AnswerOutcome answer(StudySession session, long cardId, Rating rating, Instant now) {
        return answer(session, cardId, rating, now, 0L);
    }

    /**
     * Applies a rating. The card is copied, the copy rescheduled and swapped into the store in one
     * replace; a rejected answer leaves the stored card untouched.
     */
    public AnswerOutcome answer(StudySession session, long cardId, Rating rating, Instant now, long durationMs) {
        CardEntity card = requireAnswerable(session, cardId);
        long today = studyDays.today(now);

        SrsAlgorithm.Transition transition = algorithmFor(card).apply(card, rating, now, today);
        CardEntity next = transition.card();
        if (next.inFilteredDeck()) {
            if (next.getQueue() == CardQueue.REVIEW) {
                next.setDeckId(next.getOriginalDeckId());
                next.setOriginalDeckId(0);
                next.setOriginalDue(0);
            } else {
                next.setOriginalDue(next.getDue());
            }
        }
        store.replaceCard(next);

        ReviewLogEntity entry = new ReviewLogEntity(
                now.toEpochMilli(),
                cardId,
                rating.code(),
                transition.loggedInterval(),
                transition.lastInterval(),
                next.getEaseFactor(),
                durationMs,
                transition.kind(),
                card.getType()
        );
        ReviewLogEntity stored = store.appendReviewLog(entry);
        session.recordAnswer(card.getNoteId(), card.getType());

        if (transition.leech()) {
            log.warn("Leech detected cardId={} noteId={} lapses={}", cardId, card.getNoteId(), next.getLapses());
        }
        return new AnswerOutcome(store.requireCard(cardId), stored, transition.leech());
    }

    /**
     * When each rating would make the card due next, without changing anything. Learning steps give a
     * time of day, review intervals the start of the due study day.
     */
    public Map<Rating, Instant> previewIntervals(StudySession session, long cardId, Instant now) {
        CardEntity card = requireAnswerable(session, cardId);
        long today = studyDays.today(now);
        SrsAlgorithm algorithm = algorithmFor(card);
        Map<Rating, Instant> out = new EnumMap<>(Rating.class);
        for (Rating rating : Rating.values()) {
            CardEntity next = algorithm.apply(card, rating, now, today, false).card();
            Instant due = next.getQueue() == CardQueue.REVIEW
                    ? studyDays.startOf(next.getDue())
                    : Instant.ofEpochSecond(next.getDue());
            out.put(rating, due);
        }
        return out;
    }

    /**
     * Counts for today: learning cards due before the day ends, plus reviews and new cards within the
     * remaining limits.
     */
    public DueCounts counts(long deckId, Instant now) {
        StudySession session = startSession(deckId, now);
        long today = studyDays.today(now);
        long dayEnd = studyDays.startOf(today + 1).getEpochSecond();

        int learning = 0;
        int review = 0;
        int fresh = 0;
        for (CardEntity card : store.findCards(card -> !card.isDeleted() && session.contains(card.getDeckId()))) {
            switch (card.getQueue()) {
                case LEARNING -> learning += card.getDue() < dayEnd ? 1 : 0;
                case DAY_LEARNING -> learning += card.getDue() <= today ? 1 : 0;
                case REVIEW -> review += card.getDue() <= today ? 1 : 0;
                case NEW -> fresh++;
                default -> {
                }
            }
        }
        return new DueCounts(learning, Math.min(review, session.remainingReviews()), Math.min(fresh, session.remainingNew()));
    }

    /**
     * Moves cards into a filtered deck, remembering their home deck and due value. Suspended, buried
     * and soft-deleted cards are skipped; cards already in a filtered deck keep their first snapshot.
     *
     * @return number of cards moved
     */
    public int moveToFilteredDeck(Collection<Long> cardIds, long filteredDeckId) {
        DeckEntity target = store.requireDeck(filteredDeckId);
        if (!target.isFiltered()) {
            throw new IllegalArgumentException("Deck " + filteredDeckId + " is not a filtered deck");
        }
        List<CardEntity> moved = new ArrayList<>();
        for (Long id : cardIds) {
            CardEntity card = store.requireCard(id);
            if (card.isDeleted() || !card.getQueue().isActive() || card.getDeckId() == filteredDeckId) {
                continue;
            }
            if (!card.inFilteredDeck()) {
                card.setOriginalDue(card.getDue());
                card.setOriginalDeckId(card.getDeckId());
            }
            card.setDeckId(filteredDeckId);
            moved.add(card);
        }
        if (!moved.isEmpty()) {
            store.replaceCards(moved);
        }
        log.debug("Moved cards to filtered deck deckId={} moved={}", filteredDeckId, moved.size());
        return moved.size();
    }

    /**
     * Sends cards back to their home deck, restoring the due value they had when they left.
     *
     * @return number of cards returned
     */
    public int returnFromFilteredDeck(Collection<Long> cardIds) {
        List<CardEntity> returned = new ArrayList<>();
        for (Long id : cardIds) {
            CardEntity card = store.requireCard(id);
            if (!card.inFilteredDeck()) {
                continue;
            }
            card.setDeckId(card.getOriginalDeckId());
            card.setDue(card.getOriginalDue());
            card.setOriginalDeckId(0);
            card.setOriginalDue(0);
            returned.add(card);
        }
        if (!returned.isEmpty()) {
            store.replaceCards(returned);
        }
        return returned.size();
    }

    public int emptyFilteredDeck(long filteredDeckId) {
        List<Long> ids = store.findCards(card -> card.getDeckId() == filteredDeckId && card.inFilteredDeck()).stream()
                .map(CardEntity::getId)
                .toList();
        return returnFromFilteredDeck(ids);
    }

    private CardEntity requireAnswerable(StudySession session, long cardId) {
        CardEntity card = store.findCard(cardId)
                .orElseThrow(() -> new SchedulingException(cardId, "Card not found: " + cardId));
        if (card.isDeleted()) {
            throw new SchedulingException(cardId, "Card " + cardId + " is deleted");
        }
        if (!card.getQueue().isActive()) {
            throw new SchedulingException(cardId, "Card " + cardId + " is " + card.getQueue().name().toLowerCase());
        }
        if (!session.contains(card.getDeckId())) {
            throw new SchedulingException(cardId, "Card " + cardId + " is not part of the session for deck " + session.deckId());
        }
        return card;
    }

    private static long learningSortKey(CardEntity card) {
        return card.getQueue() == CardQueue.DAY_LEARNING ? Long.MIN_VALUE + card.getDue() : card.getDue();
    }
}
