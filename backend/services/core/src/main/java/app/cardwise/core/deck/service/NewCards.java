package app.cardwise.core.deck.service;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.CardTemplate;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;

import java.util.List;

public final class NewCards {

    private NewCards() {
    }

    public static CardEntity create(long noteId, long deckId, int ord, long position, long mod) {
        CardEntity card = new CardEntity(0, noteId, deckId, ord);
        card.setType(CardType.NEW);
        card.setQueue(CardQueue.NEW);
        card.setDue(position);
        card.setMod(mod);
        return card;
    }

    /**
     * Ordinals a note should have cards for: one per template, or one per cloze index for cloze models.
     */
    public static List<Integer> expectedOrds(ModelEntity model, NoteEntity note, ClozeEngine clozeEngine) {
        if (model.usesCloze()) {
            List<String> values = note.fieldValues();
            int clozeField = model.clozeFieldIndex();
            String text = clozeField < values.size() ? values.get(clozeField) : "";
            return clozeEngine.listIndices(text).stream().map(index -> index - 1).toList();
        }
        return model.getTemplates().stream().map(CardTemplate::ord).toList();
    }
}
