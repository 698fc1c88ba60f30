package app.cardwise.core.review.domain;

import app.cardwise.core.deck.domain.type.CardType;

import java.util.HashSet;
import java.util.Set;

/**
 * Study state for one deck tree on one day. Counters start from what the review log says was already
 * studied today and advance with every answer given through the session.
 */
public class StudySession {

    private final long deckId;
    private final Set<Long> deckIds;
    private final long day;
    private final int newLimit;
    private final int reviewLimit;
    private final Set<Long> buriedNotes = new HashSet<>();
    private int newDone;
    private int reviewsDone;

    public StudySession(long deckId, Set<Long> deckIds, long day, int newLimit, int reviewLimit, int newDone, int reviewsDone) {
        this.deckId = deckId;
        this.deckIds = Set.copyOf(deckIds);
        this.day = day;
        this.newLimit = newLimit;
        this.reviewLimit = reviewLimit;
        this.newDone = newDone;
        this.reviewsDone = reviewsDone;
    }

    public long deckId() {
        return deckId;
    }

    public Set<Long> deckIds() {
        return deckIds;
    }

    public long day() {
        return day;
    }

    public int newDone() {
        return newDone;
    }

    public int reviewsDone() {
        return reviewsDone;
    }

    public int remainingNew() {
        return Math.max(0, newLimit - newDone);
    }

    public int remainingReviews() {
        return Math.max(0, reviewLimit - reviewsDone);
    }

    public boolean contains(long cardDeckId) {
        return deckIds.contains(cardDeckId);
    }

    public boolean isBuried(long noteId) {
        return buriedNotes.contains(noteId);
    }

    /**
     * Counts an answer and hides the rest of the note's new and review cards for this session.
     */
    public void recordAnswer(long noteId, CardType previousType) {
        if (previousType == CardType.NEW) {
            newDone++;
        } else if (previousType == CardType.REVIEW) {
            reviewsDone++;
        }
        buriedNotes.add(noteId);
    }
}
