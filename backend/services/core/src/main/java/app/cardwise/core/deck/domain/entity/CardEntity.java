package app.cardwise.core.deck.domain.entity;

import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;

/**
 * Schedulable card. {@code due} is a creation position for new cards, epoch seconds for (re)learning
 * cards and a collection day number for review cards.
 */
public class CardEntity {

    private long id;
    private long noteId;
    private long deckId;
    private int ord;
    private CardQueue queue = CardQueue.NEW;
    private CardType type = CardType.NEW;
    private long due;
    private int interval;
    private int easeFactor;
    private int reps;
    private int lapses;
    private int remainingSteps;
    private long originalDue;
    private long originalDeckId;
    private int flags;
    private boolean deleted;
    private long mod;
    private String data = "";

    public CardEntity() {
    }

    public CardEntity(
            long id,
            long noteId,
            long deckId,
            int ord
    ) {
        this.id = id;
        this.noteId = noteId;
        this.deckId = deckId;
        this.ord = ord;
    }

    public CardEntity copy() {
        CardEntity copy = new CardEntity();
        copy.id = id;
        copy.noteId = noteId;
        copy.deckId = deckId;
        copy.ord = ord;
        copy.queue = queue;
        copy.type = type;
        copy.due = due;
        copy.interval = interval;
        copy.easeFactor = easeFactor;
        copy.reps = reps;
        copy.lapses = lapses;
        copy.remainingSteps = remainingSteps;
        copy.originalDue = originalDue;
        copy.originalDeckId = originalDeckId;
        copy.flags = flags;
        copy.deleted = deleted;
        copy.mod = mod;
        copy.data = data;
        return copy;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getNoteId() {
        return noteId;
    }

    public void setNoteId(long noteId) {
        this.noteId = noteId;
    }

    public long getDeckId() {
        return deckId;
    }

    public void setDeckId(long deckId) {
        this.deckId = deckId;
    }

    public int getOrd() {
        return ord;
    }

    public void setOrd(int ord) {
        this.ord = ord;
    }

    public CardQueue getQueue() {
        return queue;
    }

    public void setQueue(CardQueue queue) {
        this.queue = queue;
    }

    public CardType getType() {
        return type;
    }

    public void setType(CardType type) {
        this.type = type;
    }

    public long getDue() {
        return due;
    }

    public void setDue(long due) {
        this.due = due;
    }

    public int getInterval() {
        return interval;
    }

    public void setInterval(int interval) {
        this.interval = interval;
    }

    public int getEaseFactor() {
        return easeFactor;
    }

    public void setEaseFactor(int easeFactor) {
        this.easeFactor = easeFactor;
    }

    public int getReps() {
        return reps;
    }

    public void setReps(int reps) {
        this.reps = reps;
    }

    public int getLapses() {
        return lapses;
    }

    public void setLapses(int lapses) {
        this.lapses = lapses;
    }

    public int getRemainingSteps() {
        return remainingSteps;
    }

    public void setRemainingSteps(int remainingSteps) {
        this.remainingSteps = remainingSteps;
    }

    public long getOriginalDue() {
        return originalDue;
    }

    public void setOriginalDue(long originalDue) {
        this.originalDue = originalDue;
    }

    public long getOriginalDeckId() {
        return originalDeckId;
    }

    public void setOriginalDeckId(long originalDeckId) {
        this.originalDeckId = originalDeckId;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public long getMod() {
        return mod;
    }

    public void setMod(long mod) {
        this.mod = mod;
    }

    /**
     * Per-algorithm scheduling state as a JSON object keyed by algorithm id; empty when no algorithm
     * has stored anything yet.
     */
    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data == null ? "" : data;
    }

    public boolean inFilteredDeck() {
        return originalDeckId != 0;
    }

    /**
     * Deck the card belongs to outside of any filtered deck.
     */
    public long homeDeckId() {
        return originalDeckId != 0 ? originalDeckId : deckId;
    }
}
