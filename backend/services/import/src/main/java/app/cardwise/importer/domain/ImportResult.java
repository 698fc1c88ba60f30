package app.cardwise.importer.domain;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;

import java.util.List;
import java.util.Map;

/**
 * What an archive contributes, with ids already remapped into the target store.
 *
 * @param decks    decks created by the import; archive decks whose name already existed are not listed
 * @param mediaMap archive media token to the file name used in local media storage
 * @param applied  whether the rows were written to the store
 */
public record ImportResult(
        ImportMode mode,
        List<ModelEntity> models,
        List<DeckEntity> decks,
        List<NoteEntity> notes,
        List<CardEntity> cards,
        List<ReviewLogEntity> reviewLogs,
        Map<String, String> mediaMap,
        List<ImportWarning> warnings,
        boolean applied
) {
    public ImportResult {
        models = List.copyOf(models);
        decks = List.copyOf(decks);
        notes = List.copyOf(notes);
        cards = List.copyOf(cards);
        reviewLogs = List.copyOf(reviewLogs);
        mediaMap = Map.copyOf(mediaMap);
        warnings = List.copyOf(warnings);
    }
}
