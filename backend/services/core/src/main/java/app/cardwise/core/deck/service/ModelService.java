package app.cardwise.core.deck.service;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.CardTemplate;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.type.ModelType;
import app.cardwise.core.store.EntityStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Note types. Once notes exist a model may only grow: new fields are appended to every note, new
 * templates produce a card for every note.
 */
@Service
public class ModelService {

    private final EntityStore store;
    private final Clock clock;

    public ModelService(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public ModelEntity createModel(String name, ModelType type, List<String> fields, List<CardTemplate> templates) {
        if (type == ModelType.CLOZE && templates.size() != 1) {
            throw new IllegalArgumentException("Cloze models have exactly one template");
        }
        if (fields.isEmpty() || templates.isEmpty()) {
            throw new IllegalArgumentException("A model needs at least one field and one template");
        }
        Set<String> seen = new HashSet<>();
        for (String field : fields) {
            if (field == null || field.isBlank() || !seen.add(field.trim().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Field name is blank or already used: " + field);
            }
        }
        ModelEntity model = new ModelEntity(0, name, type, fields, templates);
        model.setMod(clock.instant().getEpochSecond());
        return store.insertModel(model);
    }

    public ModelEntity createBasicModel(String name) {
        return createModel(name, ModelType.STANDARD, List.of("Front", "Back"),
                List.of(new CardTemplate("Card 1", 0, "{{Front}}", "{{FrontSide}}<hr id=answer>{{Back}}")));
    }

    public ModelEntity createClozeModel(String name) {
        return createModel(name, ModelType.CLOZE, List.of("Text", "Back Extra"),
                List.of(new CardTemplate("Cloze", 0, "{{cloze:Text}}", "{{cloze:Text}}<br>{{Back Extra}}")));
    }

    public ModelEntity addField(long modelId, String fieldName) {
        ModelEntity model = store.requireModel(modelId);
        if (fieldName == null || fieldName.isBlank() || model.fieldIndex(fieldName) >= 0) {
            throw new IllegalArgumentException("Field name is blank or already used: " + fieldName);
        }
        long now = clock.instant().getEpochSecond();
        List<String> fields = new ArrayList<>(model.getFields());
        fields.add(fieldName.trim());
        model.setFields(fields);
        model.setMod(now);

        List<NoteEntity> notes = new ArrayList<>();
        for (NoteEntity note : store.notesOfModel(modelId)) {
            List<String> values = new ArrayList<>(note.fieldValues());
            values.add("");
            note.setFields(NoteEntity.pack(values));
            note.setMod(now);
            notes.add(note);
        }
        store.replaceModelAndNotes(model, notes);
        return store.requireModel(modelId);
    }

    public ModelEntity addTemplate(long modelId, String name, String questionFormat, String answerFormat) {
        ModelEntity model = store.requireModel(modelId);
        if (model.usesCloze()) {
            throw new IllegalArgumentException("Cloze models cannot have more than one template");
        }
        long now = clock.instant().getEpochSecond();
        int ord = model.getTemplates().stream().mapToInt(CardTemplate::ord).max().orElse(-1) + 1;
        List<CardTemplate> templates = new ArrayList<>(model.getTemplates());
        templates.add(new CardTemplate(name, ord, questionFormat, answerFormat));
        model.setTemplates(templates);
        model.setMod(now);
        store.replaceModel(model);

        for (NoteEntity note : store.notesOfModel(modelId)) {
            List<CardEntity> siblings = store.cardsOfNote(note.getId());
            long deckId = siblings.isEmpty() ? EntityStore.DEFAULT_DECK_ID : siblings.get(0).homeDeckId();
            store.insertCard(NewCards.create(note.getId(), deckId, ord, store.nextPosition(), now));
        }
        return store.requireModel(modelId);
    }
}
