package app.cardwise.core.deck.service;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.store.EntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoteServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private EntityStore store;
    private NoteService noteService;
    private ModelEntity basic;
    private ModelEntity cloze;

    @BeforeEach
    void setUp() {
        store = new EntityStore(CLOCK.instant().getEpochSecond());
        ModelService modelService = new ModelService(store, CLOCK);
        noteService = new NoteService(store, new ClozeEngine(), CLOCK);
        basic = modelService.createBasicModel("Basic");
        cloze = modelService.createClozeModel("Cloze");
    }

    @Test
    void createNote_standardModelGetsOneNewCardPerTemplate() {
        NoteEntity note = noteService.createNote(basic.getId(), EntityStore.DEFAULT_DECK_ID, List.of("Hola", "Hello"), List.of("spanish"));

        List<CardEntity> cards = store.cardsOfNote(note.getId());
        assertThat(cards).hasSize(1);
        assertThat(cards.get(0).getOrd()).isZero();
        assertThat(cards.get(0).getDue()).isEqualTo(1);
        assertThat(note.tagSet()).containsExactly("spanish");
        assertThat(note.getGuid()).isNotBlank();
    }

    @Test
    void createNote_clozeModelGetsOneCardPerIndexSharingPosition() {
        NoteEntity note = noteService.createNote(cloze.getId(), EntityStore.DEFAULT_DECK_ID,
                List.of("{{c1::Paris}} is in {{c3::France}}", ""), List.of());

        List<CardEntity> cards = store.cardsOfNote(note.getId());
        assertThat(cards).extracting(CardEntity::getOrd).containsExactly(0, 2);
        assertThat(cards).extracting(CardEntity::getDue).containsOnly(cards.get(0).getDue());
    }

    @Test
    void createNote_rejectsClozeWithoutDeletionAndWrongFieldCount() {
        assertThatThrownBy(() -> noteService.createNote(cloze.getId(), EntityStore.DEFAULT_DECK_ID, List.of("plain", ""), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one cloze");
        assertThatThrownBy(() -> noteService.createNote(basic.getId(), EntityStore.DEFAULT_DECK_ID, List.of("one"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.notes()).isEmpty();
    }

    @Test
    void updateFields_removingIndexOrphansOnlyThatCard() {
        NoteEntity note = noteService.createNote(cloze.getId(), EntityStore.DEFAULT_DECK_ID, List.of("{{c1::a}} {{c2::b}}", ""), List.of());
        CardEntity first = store.cardsOfNote(note.getId()).get(0);

        noteService.updateFields(note.getId(), List.of("{{c1::a}} b", ""));

        List<CardEntity> cards = store.cardsOfNote(note.getId());
        assertThat(cards).hasSize(2);
        assertThat(cards.get(0)).usingRecursiveComparison().ignoringFields("mod").isEqualTo(first);
        assertThat(cards.get(1).isDeleted()).isTrue();
        assertThat(noteService.activeCards(note.getId())).extracting(CardEntity::getOrd).containsExactly(0);
    }

    @Test
    void updateFields_reAddingIndexRevivesSameCard() {
        NoteEntity note = noteService.createNote(cloze.getId(), EntityStore.DEFAULT_DECK_ID, List.of("{{c1::a}} {{c2::b}}", ""), List.of());
        long secondId = store.cardsOfNote(note.getId()).get(1).getId();

        noteService.updateFields(note.getId(), List.of("{{c1::a}}", ""));
        noteService.updateFields(note.getId(), List.of("{{c1::a}} {{c2::again}}", ""));

        assertThat(noteService.activeCards(note.getId())).extracting(CardEntity::getId).contains(secondId);
        assertThat(store.cardsOfNote(note.getId())).hasSize(2);
    }

    @Test
    void updateFields_newHighestIndexAddsCard() {
        NoteEntity note = noteService.createNote(cloze.getId(), EntityStore.DEFAULT_DECK_ID, List.of("{{c1::a}}", ""), List.of());

        noteService.updateFields(note.getId(), List.of("{{c1::a}} {{c2::b}} {{c3::c}}", ""));

        assertThat(noteService.activeCards(note.getId())).extracting(CardEntity::getOrd).containsExactly(0, 1, 2);
    }

    @Test
    void updateFields_rejectsEditToZeroIndices() {
        NoteEntity note = noteService.createNote(cloze.getId(), EntityStore.DEFAULT_DECK_ID, List.of("{{c1::a}}", ""), List.of());

        assertThatThrownBy(() -> noteService.updateFields(note.getId(), List.of("no cloze left", "")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.requireNote(note.getId()).fieldValues().get(0)).isEqualTo("{{c1::a}}");
    }

    @Test
    void updateTags_andDeleteNote() {
        NoteEntity note = noteService.createNote(basic.getId(), EntityStore.DEFAULT_DECK_ID, List.of("a", "b"), List.of());

        NoteEntity tagged = noteService.updateTags(note.getId(), Set.of("verbs"));
        assertThat(tagged.getTags()).isEqualTo(" verbs ");

        noteService.deleteNote(note.getId());
        assertThat(store.findNote(note.getId())).isEmpty();
        assertThat(store.cards()).isEmpty();
    }
}
