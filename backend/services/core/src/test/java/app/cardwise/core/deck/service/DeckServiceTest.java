package app.cardwise.core.deck.service;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.store.EntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeckServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private EntityStore store;
    private DeckService deckService;
    private NoteService noteService;
    private ModelEntity basic;

    @BeforeEach
    void setUp() {
        store = new EntityStore(CLOCK.instant().getEpochSecond());
        deckService = new DeckService(store, SchedulerProps.defaults(), CLOCK);
        noteService = new NoteService(store, new ClozeEngine(), CLOCK);
        basic = new ModelService(store, CLOCK).createBasicModel("Basic");
    }

    @Test
    void createDeck_createsMissingAncestorsAndIsIdempotent() {
        DeckEntity verbs = deckService.createDeck("Spanish::Verbs");
        DeckEntity again = deckService.createDeck(" spanish :: verbs ");

        assertThat(again.getId()).isEqualTo(verbs.getId());
        assertThat(deckService.listDecks()).extracting(DeckEntity::getName)
                .containsExactly("Default", "Spanish", "Spanish::Verbs");
        assertThat(verbs.getNewPerDay()).isEqualTo(20);
    }

    @Test
    void renameDeck_movesSubtree() {
        DeckEntity parent = deckService.createDeck("Lang");
        deckService.createDeck("Lang::French::Verbs");

        deckService.renameDeck(parent.getId(), "Languages");

        assertThat(deckService.listDecks()).extracting(DeckEntity::getName)
                .containsExactly("Default", "Languages", "Languages::French", "Languages::French::Verbs");
    }

    @Test
    void renameDeck_rejectsMovingBelowItselfAndRenamingDefault() {
        DeckEntity parent = deckService.createDeck("Lang");

        assertThatThrownBy(() -> deckService.renameDeck(parent.getId(), "Lang::Sub"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> deckService.renameDeck(EntityStore.DEFAULT_DECK_ID, "Other"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteDeck_movesCardsToDefaultWhenKeepingThem() {
        DeckEntity deck = deckService.createDeck("Temp");
        NoteEntity note = noteService.createNote(basic.getId(), deck.getId(), List.of("a", "b"), List.of());

        deckService.deleteDeck(deck.getId(), false);

        assertThat(store.findDeck(deck.getId())).isEmpty();
        assertThat(store.cardsOfNote(note.getId())).extracting(CardEntity::getDeckId).containsOnly(EntityStore.DEFAULT_DECK_ID);
    }

    @Test
    void deleteDeck_removesCardsAndEmptyNotes() {
        DeckEntity deck = deckService.createDeck("Temp::Child");
        NoteEntity note = noteService.createNote(basic.getId(), deck.getId(), List.of("a", "b"), List.of());
        DeckEntity parent = store.findDeckByName("Temp").orElseThrow();

        deckService.deleteDeck(parent.getId(), true);

        assertThat(store.findNote(note.getId())).isEmpty();
        assertThat(store.decks()).extracting(DeckEntity::getName).containsExactly("Default");
    }

    @Test
    void setLimits_validatesAndStores() {
        DeckEntity deck = deckService.createDeck("Limited");

        assertThat(deckService.setLimits(deck.getId(), 5, 50).getReviewsPerDay()).isEqualTo(50);
        assertThatThrownBy(() -> deckService.setLimits(deck.getId(), -1, 50)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deckTree_listsDeckAndDescendants() {
        DeckEntity parent = deckService.createDeck("Parent");
        deckService.createDeck("Parent::Child");
        deckService.createDeck("Other");

        assertThat(deckService.deckTree(parent.getId())).extracting(DeckEntity::getName)
                .containsExactly("Parent", "Parent::Child");
    }
}
