package app.cardwise.core.store;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;

import java.util.List;

/**
 * Detached copy of every table, used for import rollback and for persistence.
 */
public record StoreSnapshot(
        long createdAt,
        long lastId,
        long lastPosition,
        List<ModelEntity> models,
        List<DeckEntity> decks,
        List<NoteEntity> notes,
        List<CardEntity> cards,
        List<ReviewLogEntity> reviewLogs
) {
    public StoreSnapshot {
        models = models == null ? List.of() : List.copyOf(models);
        decks = decks == null ? List.of() : List.copyOf(decks);
        notes = notes == null ? List.of() : List.copyOf(notes);
        cards = cards == null ? List.of() : List.copyOf(cards);
        reviewLogs = reviewLogs == null ? List.of() : List.copyOf(reviewLogs);
    }
}
