package app.cardwise.core.store;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.util.DeckHierarchy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * In-memory tables for models, decks, notes, cards and the review log.
 * <p>
 * Every read hands out a copy and every write validates references before touching any table, so a
 * rejected write leaves the store exactly as it was. Rows are replaced whole ({@code replaceX}), which
 * lets callers mutate a copy and swap it in as one step. Not thread-safe; callers serialize access.
 */
public class EntityStore {

    public static final long DEFAULT_DECK_ID = 1L;
    public static final String DEFAULT_DECK_NAME = "Default";
    public static final int DEFAULT_NEW_PER_DAY = 20;
    public static final int DEFAULT_REVIEWS_PER_DAY = 200;

    private final Map<Long, ModelEntity> models = new LinkedHashMap<>();
    private final Map<Long, DeckEntity> decks = new LinkedHashMap<>();
    private final Map<Long, NoteEntity> notes = new LinkedHashMap<>();
    private final Map<Long, CardEntity> cards = new LinkedHashMap<>();
    private final TreeMap<Long, ReviewLogEntity> reviewLogs = new TreeMap<>();

    private final Map<Long, Map<Integer, Long>> cardsByNote = new HashMap<>();
    private final Map<Long, Set<Long>> notesByModel = new HashMap<>();
    private final Map<Long, Long> noteVersions = new HashMap<>();

    private long createdAt;
    private long lastId;
    private long lastPosition;
    private long version;
    private long resetVersion;

    /**
     * @param createdAt collection creation time in epoch seconds; day numbers count from its day
     */
    public EntityStore(long createdAt) {
        this.createdAt = createdAt;
        DeckEntity defaultDeck = new DeckEntity(DEFAULT_DECK_ID, DEFAULT_DECK_NAME, DEFAULT_NEW_PER_DAY, DEFAULT_REVIEWS_PER_DAY);
        defaultDeck.setMod(createdAt);
        decks.put(DEFAULT_DECK_ID, defaultDeck);
        lastId = DEFAULT_DECK_ID;
    }

    public static EntityStore fromSnapshot(StoreSnapshot snapshot) {
        EntityStore store = new EntityStore(snapshot.createdAt());
        store.restore(snapshot);
        return store;
    }

    public long createdAt() {
        return createdAt;
    }

    /**
     * Incremented by every successful write.
     */
    public long version() {
        return version;
    }

    /**
     * Version of the last wholesale replacement of the tables ({@link #restore}). Per-note change
     * tracking only covers writes made after it.
     */
    public long resetVersion() {
        return resetVersion;
    }

    /**
     * Ids of notes inserted, rewritten or removed after {@code sinceVersion}. Removed ids are included
     * and no longer resolve through {@link #findNote}.
     */
    public Set<Long> notesChangedSince(long sinceVersion) {
        Set<Long> changed = new HashSet<>();
        noteVersions.forEach((noteId, changedAt) -> {
            if (changedAt > sinceVersion) {
                changed.add(noteId);
            }
        });
        return changed;
    }

    public long nextId() {
        return ++lastId;
    }

    /**
     * Highest id handed out or inserted so far, across all tables.
     */
    public long maxId() {
        return lastId;
    }

    public long nextPosition() {
        return ++lastPosition;
    }

    /**
     * Highest new-card position handed out or inserted so far.
     */
    public long lastPosition() {
        return lastPosition;
    }

    // models

    public ModelEntity insertModel(ModelEntity model) {
        validateModel(model);
        ModelEntity row = model.copy();
        if (row.getId() == 0) {
            row.setId(nextId());
        } else if (models.containsKey(row.getId())) {
            throw new IllegalStateException("Model already exists: " + row.getId());
        }
        models.put(row.getId(), row);
        trackId(row.getId());
        touch();
        return row.copy();
    }

    public Optional<ModelEntity> findModel(long id) {
        return Optional.ofNullable(models.get(id)).map(ModelEntity::copy);
    }

    public ModelEntity requireModel(long id) {
        return findModel(id).orElseThrow(() -> new IllegalArgumentException("Model not found: " + id));
    }

    public List<ModelEntity> models() {
        return models.values().stream().map(ModelEntity::copy).toList();
    }

    /**
     * Replaces a model row. Field additions must be applied to existing notes by the caller in the
     * same step, see {@link #replaceModelAndNotes(ModelEntity, List)}.
     */
    public void replaceModel(ModelEntity model) {
        ModelEntity current = models.get(model.getId());
        if (current == null) {
            throw new IllegalArgumentException("Model not found: " + model.getId());
        }
        validateModel(model);
        if (model.getFields().size() != current.getFields().size()
                && !notesByModel.getOrDefault(model.getId(), Set.of()).isEmpty()) {
            throw new IllegalStateException("Field count of model " + model.getId() + " cannot change while notes exist");
        }
        models.put(model.getId(), model.copy());
        touch();
    }

    /**
     * Replaces a model together with rewritten rows of all of its notes, validating the notes against
     * the new field count before anything is written.
     */
    public void replaceModelAndNotes(ModelEntity model, List<NoteEntity> updatedNotes) {
        if (!models.containsKey(model.getId())) {
            throw new IllegalArgumentException("Model not found: " + model.getId());
        }
        validateModel(model);
        Set<Long> expected = notesByModel.getOrDefault(model.getId(), Set.of());
        Set<Long> provided = new HashSet<>();
        for (NoteEntity note : updatedNotes) {
            if (note.getModelId() != model.getId() || !expected.contains(note.getId())) {
                throw new IllegalArgumentException("Note " + note.getId() + " does not belong to model " + model.getId());
            }
            requireFieldCount(note, model);
            provided.add(note.getId());
        }
        if (!provided.equals(expected)) {
            throw new IllegalArgumentException("Every note of model " + model.getId() + " must be rewritten");
        }
        models.put(model.getId(), model.copy());
        for (NoteEntity note : updatedNotes) {
            notes.put(note.getId(), note.copy());
        }
        touch();
        updatedNotes.forEach(note -> noteVersions.put(note.getId(), version));
    }

    public void removeModel(long id) {
        if (!notesByModel.getOrDefault(id, Set.of()).isEmpty()) {
            throw new IllegalStateException("Model " + id + " still has notes");
        }
        if (models.remove(id) != null) {
            notesByModel.remove(id);
            touch();
        }
    }

    // decks

    public DeckEntity insertDeck(DeckEntity deck) {
        String name = DeckHierarchy.normalize(deck.getName());
        if (findDeckByName(name).isPresent()) {
            throw new IllegalStateException("Deck already exists: " + name);
        }
        DeckEntity row = deck.copy();
        row.setName(name);
        if (row.getId() == 0) {
            row.setId(nextId());
        } else if (decks.containsKey(row.getId())) {
            throw new IllegalStateException("Deck already exists: " + row.getId());
        }
        decks.put(row.getId(), row);
        trackId(row.getId());
        touch();
        return row.copy();
    }

    public Optional<DeckEntity> findDeck(long id) {
        return Optional.ofNullable(decks.get(id)).map(DeckEntity::copy);
    }

    public DeckEntity requireDeck(long id) {
        return findDeck(id).orElseThrow(() -> new IllegalArgumentException("Deck not found: " + id));
    }

    public Optional<DeckEntity> findDeckByName(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return decks.values().stream()
                .filter(deck -> deck.getName().toLowerCase(Locale.ROOT).equals(key))
                .findFirst()
                .map(DeckEntity::copy);
    }

    public List<DeckEntity> decks() {
        return decks.values().stream().map(DeckEntity::copy).toList();
    }

    /**
     * Ids of the deck and every deck below it in the name hierarchy.
     */
    public Set<Long> deckTreeIds(long deckId) {
        DeckEntity root = decks.get(deckId);
        if (root == null) {
            return Set.of();
        }
        Set<Long> ids = new HashSet<>();
        for (DeckEntity deck : decks.values()) {
            if (DeckHierarchy.isSameOrDescendant(deck.getName(), root.getName())) {
                ids.add(deck.getId());
            }
        }
        return ids;
    }

    public void replaceDeck(DeckEntity deck) {
        if (!decks.containsKey(deck.getId())) {
            throw new IllegalArgumentException("Deck not found: " + deck.getId());
        }
        String name = DeckHierarchy.normalize(deck.getName());
        Optional<DeckEntity> sameName = findDeckByName(name);
        if (sameName.isPresent() && sameName.get().getId() != deck.getId()) {
            throw new IllegalStateException("Deck already exists: " + name);
        }
        DeckEntity row = deck.copy();
        row.setName(name);
        decks.put(row.getId(), row);
        touch();
    }

    /**
     * Replaces several deck rows at once, e.g. a rename that moves a whole subtree. Names are checked
     * against the resulting table so that swapped names are accepted.
     */
    public void replaceDecks(List<DeckEntity> updated) {
        Map<Long, DeckEntity> next = new LinkedHashMap<>(decks);
        for (DeckEntity deck : updated) {
            if (!decks.containsKey(deck.getId())) {
                throw new IllegalArgumentException("Deck not found: " + deck.getId());
            }
            DeckEntity row = deck.copy();
            row.setName(DeckHierarchy.normalize(deck.getName()));
            next.put(row.getId(), row);
        }
        Set<String> names = new HashSet<>();
        for (DeckEntity deck : next.values()) {
            if (!names.add(deck.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Deck already exists: " + deck.getName());
            }
        }
        decks.clear();
        decks.putAll(next);
        touch();
    }

    public void removeDeck(long id) {
        if (id == DEFAULT_DECK_ID) {
            throw new IllegalArgumentException("The default deck cannot be removed");
        }
        for (CardEntity card : cards.values()) {
            if (card.getDeckId() == id || card.getOriginalDeckId() == id) {
                throw new IllegalStateException("Deck " + id + " still has cards");
            }
        }
        if (decks.remove(id) != null) {
            touch();
        }
    }

    // notes

    public NoteEntity insertNote(NoteEntity note) {
        ModelEntity model = models.get(note.getModelId());
        if (model == null) {
            throw new IllegalArgumentException("Model not found: " + note.getModelId());
        }
        requireFieldCount(note, model);
        NoteEntity row = note.copy();
        if (row.getId() == 0) {
            row.setId(nextId());
        } else if (notes.containsKey(row.getId())) {
            throw new IllegalStateException("Note already exists: " + row.getId());
        }
        notes.put(row.getId(), row);
        notesByModel.computeIfAbsent(row.getModelId(), key -> new HashSet<>()).add(row.getId());
        trackId(row.getId());
        touchNote(row.getId());
        return row.copy();
    }

    public Optional<NoteEntity> findNote(long id) {
        return Optional.ofNullable(notes.get(id)).map(NoteEntity::copy);
    }

    public NoteEntity requireNote(long id) {
        return findNote(id).orElseThrow(() -> new IllegalArgumentException("Note not found: " + id));
    }

    public List<NoteEntity> notes() {
        return notes.values().stream().map(NoteEntity::copy).toList();
    }

    public List<NoteEntity> notesOfModel(long modelId) {
        return notesByModel.getOrDefault(modelId, Set.of()).stream()
                .sorted()
                .map(notes::get)
                .map(NoteEntity::copy)
                .toList();
    }

    public void replaceNote(NoteEntity note) {
        NoteEntity current = notes.get(note.getId());
        if (current == null) {
            throw new IllegalArgumentException("Note not found: " + note.getId());
        }
        if (current.getModelId() != note.getModelId()) {
            throw new IllegalArgumentException("Note " + note.getId() + " cannot change its model");
        }
        requireFieldCount(note, models.get(note.getModelId()));
        notes.put(note.getId(), note.copy());
        touchNote(note.getId());
    }

    /**
     * Removes a note and every card it owns.
     */
    public void removeNote(long id) {
        NoteEntity note = notes.remove(id);
        if (note == null) {
            return;
        }
        Map<Integer, Long> owned = cardsByNote.remove(id);
        if (owned != null) {
            owned.values().forEach(cards::remove);
        }
        Set<Long> modelNotes = notesByModel.get(note.getModelId());
        if (modelNotes != null) {
            modelNotes.remove(id);
        }
        touchNote(id);
    }

    // cards

    public CardEntity insertCard(CardEntity card) {
        validateCardReferences(card);
        Map<Integer, Long> owned = cardsByNote.get(card.getNoteId());
        if (owned != null && owned.containsKey(card.getOrd())) {
            throw new IllegalStateException("Note " + card.getNoteId() + " already has a card with ord " + card.getOrd());
        }
        CardEntity row = card.copy();
        if (row.getId() == 0) {
            row.setId(nextId());
        } else if (cards.containsKey(row.getId())) {
            throw new IllegalStateException("Card already exists: " + row.getId());
        }
        cards.put(row.getId(), row);
        cardsByNote.computeIfAbsent(row.getNoteId(), key -> new TreeMap<>()).put(row.getOrd(), row.getId());
        trackId(row.getId());
        if (row.getType() == CardType.NEW) {
            lastPosition = Math.max(lastPosition, row.getDue());
        }
        touch();
        return row.copy();
    }

    public Optional<CardEntity> findCard(long id) {
        return Optional.ofNullable(cards.get(id)).map(CardEntity::copy);
    }

    public CardEntity requireCard(long id) {
        return findCard(id).orElseThrow(() -> new IllegalArgumentException("Card not found: " + id));
    }

    public List<CardEntity> cards() {
        return cards.values().stream().map(CardEntity::copy).toList();
    }

    public List<CardEntity> findCards(Predicate<CardEntity> filter) {
        List<CardEntity> out = new ArrayList<>();
        for (CardEntity card : cards.values()) {
            if (filter.test(card)) {
                out.add(card.copy());
            }
        }
        return out;
    }

    /**
     * Cards of a note ordered by ord, soft-deleted ones included.
     */
    public List<CardEntity> cardsOfNote(long noteId) {
        Map<Integer, Long> owned = cardsByNote.get(noteId);
        if (owned == null) {
            return List.of();
        }
        return owned.values().stream().map(cards::get).map(CardEntity::copy).toList();
    }

    /**
     * Swaps in a modified card. Identity ({@code noteId}, {@code ord}) cannot change.
     */
    public void replaceCard(CardEntity card) {
        CardEntity current = cards.get(card.getId());
        if (current == null) {
            throw new IllegalArgumentException("Card not found: " + card.getId());
        }
        if (current.getNoteId() != card.getNoteId() || current.getOrd() != card.getOrd()) {
            throw new IllegalArgumentException("Card " + card.getId() + " cannot change its note or ord");
        }
        validateCardReferences(card);
        cards.put(card.getId(), card.copy());
        touch();
    }

    public void replaceCards(List<CardEntity> updated) {
        for (CardEntity card : updated) {
            CardEntity current = cards.get(card.getId());
            if (current == null) {
                throw new IllegalArgumentException("Card not found: " + card.getId());
            }
            if (current.getNoteId() != card.getNoteId() || current.getOrd() != card.getOrd()) {
                throw new IllegalArgumentException("Card " + card.getId() + " cannot change its note or ord");
            }
            validateCardReferences(card);
        }
        for (CardEntity card : updated) {
            cards.put(card.getId(), card.copy());
        }
        touch();
    }

    public void removeCard(long id) {
        CardEntity card = cards.remove(id);
        if (card == null) {
            return;
        }
        Map<Integer, Long> owned = cardsByNote.get(card.getNoteId());
        if (owned != null) {
            owned.remove(card.getOrd());
        }
        touch();
    }

    // review log

    public ReviewLogEntity appendReviewLog(ReviewLogEntity entry) {
        if (!cards.containsKey(entry.getCardId())) {
            throw new IllegalArgumentException("Card not found: " + entry.getCardId());
        }
        ReviewLogEntity row = entry.copy();
        while (reviewLogs.containsKey(row.getId())) {
            row.setId(row.getId() + 1);
        }
        reviewLogs.put(row.getId(), row);
        touch();
        return row.copy();
    }

    public List<ReviewLogEntity> reviewLogs() {
        return reviewLogs.values().stream().map(ReviewLogEntity::copy).toList();
    }

    public List<ReviewLogEntity> reviewLogsSince(long epochMillis) {
        return reviewLogs.tailMap(epochMillis, true).values().stream()
                .map(ReviewLogEntity::copy)
                .toList();
    }

    // snapshots

    public StoreSnapshot snapshot() {
        return new StoreSnapshot(
                createdAt,
                lastId,
                lastPosition,
                models(),
                decks(),
                notes(),
                cards(),
                reviewLogs()
        );
    }

    /**
     * Replaces every table with the snapshot's rows.
     */
    public void restore(StoreSnapshot snapshot) {
        models.clear();
        decks.clear();
        notes.clear();
        cards.clear();
        reviewLogs.clear();
        cardsByNote.clear();
        notesByModel.clear();
        noteVersions.clear();

        createdAt = snapshot.createdAt();
        snapshot.models().forEach(model -> models.put(model.getId(), model.copy()));
        snapshot.decks().forEach(deck -> decks.put(deck.getId(), deck.copy()));
        for (NoteEntity note : snapshot.notes()) {
            notes.put(note.getId(), note.copy());
            notesByModel.computeIfAbsent(note.getModelId(), key -> new HashSet<>()).add(note.getId());
        }
        for (CardEntity card : snapshot.cards()) {
            cards.put(card.getId(), card.copy());
            cardsByNote.computeIfAbsent(card.getNoteId(), key -> new TreeMap<>()).put(card.getOrd(), card.getId());
        }
        snapshot.reviewLogs().forEach(entry -> reviewLogs.put(entry.getId(), entry.copy()));
        if (!decks.containsKey(DEFAULT_DECK_ID)) {
            DeckEntity defaultDeck = new DeckEntity(DEFAULT_DECK_ID, DEFAULT_DECK_NAME, DEFAULT_NEW_PER_DAY, DEFAULT_REVIEWS_PER_DAY);
            defaultDeck.setMod(createdAt);
            decks.put(DEFAULT_DECK_ID, defaultDeck);
        }
        lastId = Math.max(snapshot.lastId(), DEFAULT_DECK_ID);
        lastPosition = snapshot.lastPosition();
        touch();
        resetVersion = version;
    }

    private void validateModel(ModelEntity model) {
        if (model.getName() == null || model.getName().isBlank()) {
            throw new IllegalArgumentException("Model name is required");
        }
        if (model.getFields().isEmpty()) {
            throw new IllegalArgumentException("Model " + model.getName() + " needs at least one field");
        }
        if (model.getTemplates().isEmpty()) {
            throw new IllegalArgumentException("Model " + model.getName() + " needs at least one template");
        }
        Set<String> names = new HashSet<>();
        for (String field : model.getFields()) {
            if (field == null || field.isBlank() || !names.add(field.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Model " + model.getName() + " has a blank or duplicate field: " + field);
            }
        }
    }

    private void validateCardReferences(CardEntity card) {
        if (!notes.containsKey(card.getNoteId())) {
            throw new IllegalArgumentException("Note not found: " + card.getNoteId());
        }
        if (!decks.containsKey(card.getDeckId())) {
            throw new IllegalArgumentException("Deck not found: " + card.getDeckId());
        }
        if (card.getOriginalDeckId() != 0 && !decks.containsKey(card.getOriginalDeckId())) {
            throw new IllegalArgumentException("Deck not found: " + card.getOriginalDeckId());
        }
        if (card.getOrd() < 0) {
            throw new IllegalArgumentException("Card ord must not be negative: " + card.getOrd());
        }
    }

    private static void requireFieldCount(NoteEntity note, ModelEntity model) {
        int actual = note.fieldValues().size();
        if (actual != model.getFields().size()) {
            throw new IllegalArgumentException("Note " + note.getId() + " has " + actual + " fields, model "
                    + model.getId() + " expects " + model.getFields().size());
        }
    }

    private void trackId(long id) {
        lastId = Math.max(lastId, id);
    }

    private void touch() {
        version++;
    }

    private void touchNote(long noteId) {
        touch();
        noteVersions.put(noteId, version);
    }
}
