package app.cardwise.core.deck.service;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Creates and edits notes and keeps their cards in step with the model.
 * <p>
 * Cloze notes own one card per cloze index. When an edit removes the last occurrence of an index the
 * card is soft-deleted so its history survives; putting the index back revives the same card.
 */
@Service
public class NoteService {

    private static final Logger log = LoggerFactory.getLogger(NoteService.class);

    private final EntityStore store;
    private final ClozeEngine clozeEngine;
    private final Clock clock;

    public NoteService(EntityStore store, ClozeEngine clozeEngine, Clock clock) {
        this.store = store;
        this.clozeEngine = clozeEngine;
        this.clock = clock;
    }

    public NoteEntity createNote(long modelId, long deckId, List<String> fields, Collection<String> tags) {
        ModelEntity model = store.requireModel(modelId);
        DeckEntity deck = store.requireDeck(deckId);
        if (deck.isFiltered()) {
            throw new IllegalArgumentException("Notes cannot be added to filtered deck " + deckId);
        }
        if (fields.size() != model.getFields().size()) {
            throw new IllegalArgumentException("Model " + modelId + " expects " + model.getFields().size()
                    + " fields, got " + fields.size());
        }
        long now = clock.instant().getEpochSecond();
        NoteEntity draft = new NoteEntity(0, UUID.randomUUID().toString(), modelId, NoteEntity.pack(fields),
                NoteEntity.joinTags(tags == null ? List.of() : tags));
        draft.setMod(now);

        List<Integer> ords = NewCards.expectedOrds(model, draft, clozeEngine);
        if (ords.isEmpty()) {
            throw new IllegalArgumentException("Cloze note needs at least one cloze deletion");
        }

        NoteEntity note = store.insertNote(draft);
        long position = store.nextPosition();
        for (Integer ord : ords) {
            store.insertCard(NewCards.create(note.getId(), deckId, ord, position, now));
        }
        return note;
    }

    public NoteEntity getNote(long noteId) {
        return store.requireNote(noteId);
    }

    /**
     * Replaces every field value. Cloze notes gain, lose or revive cards to match the new indices.
     */
    public NoteEntity updateFields(long noteId, List<String> fields) {
        NoteEntity note = store.requireNote(noteId);
        ModelEntity model = store.requireModel(note.getModelId());
        if (fields.size() != model.getFields().size()) {
            throw new IllegalArgumentException("Model " + model.getId() + " expects " + model.getFields().size()
                    + " fields, got " + fields.size());
        }
        long now = clock.instant().getEpochSecond();
        NoteEntity updated = note.copy();
        updated.setFields(NoteEntity.pack(fields));
        updated.setMod(now);

        if (!model.usesCloze()) {
            store.replaceNote(updated);
            return store.requireNote(noteId);
        }

        List<Integer> ords = NewCards.expectedOrds(model, updated, clozeEngine);
        if (ords.isEmpty()) {
            throw new IllegalArgumentException("Cloze note needs at least one cloze deletion");
        }
        store.replaceNote(updated);
        syncClozeCards(updated, new HashSet<>(ords), now);
        return store.requireNote(noteId);
    }

    public NoteEntity updateTags(long noteId, Collection<String> tags) {
        NoteEntity note = store.requireNote(noteId);
        note.setTags(NoteEntity.joinTags(tags));
        note.setMod(clock.instant().getEpochSecond());
        store.replaceNote(note);
        return store.requireNote(noteId);
    }

    public void deleteNote(long noteId) {
        store.requireNote(noteId);
        store.removeNote(noteId);
    }

    /**
     * Active (not soft-deleted) cards of a note.
     */
    public List<CardEntity> activeCards(long noteId) {
        return store.cardsOfNote(noteId).stream().filter(card -> !card.isDeleted()).toList();
    }

    private void syncClozeCards(NoteEntity note, Set<Integer> wanted, long now) {
        List<CardEntity> existing = store.cardsOfNote(note.getId());
        Map<Integer, CardEntity> byOrd = new HashMap<>();
        for (CardEntity card : existing) {
            byOrd.put(card.getOrd(), card);
        }
        long deckId = existing.stream()
                .filter(card -> !card.isDeleted())
                .findFirst()
                .or(() -> existing.stream().findFirst())
                .map(CardEntity::homeDeckId)
                .orElse(EntityStore.DEFAULT_DECK_ID);

        List<CardEntity> changed = new ArrayList<>();
        for (CardEntity card : existing) {
            boolean keep = wanted.contains(card.getOrd());
            if (keep == !card.isDeleted()) {
                continue;
            }
            card.setDeleted(!keep);
            card.setMod(now);
            changed.add(card);
        }
        if (!changed.isEmpty()) {
            store.replaceCards(changed);
        }

        long position = 0;
        for (Integer ord : wanted.stream().sorted().toList()) {
            if (byOrd.containsKey(ord)) {
                continue;
            }
            if (position == 0) {
                position = store.nextPosition();
            }
            store.insertCard(NewCards.create(note.getId(), deckId, ord, position, now));
        }
        log.debug("Synced cloze cards noteId={} wanted={} changed={}", note.getId(), wanted.size(), changed.size());
    }
}
