package app.cardwise.core.store;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.CardTemplate;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ModelType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityStoreTest {

    private EntityStore store;
    private ModelEntity basic;

    @BeforeEach
    void setUp() {
        store = new EntityStore(1_700_000_000L);
        basic = store.insertModel(new ModelEntity(0, "Basic", ModelType.STANDARD, List.of("Front", "Back"),
                List.of(new CardTemplate("Card 1", 0, "{{Front}}", "{{Back}}"))));
    }

    @Test
    void newStore_hasDefaultDeck() {
        assertThat(store.decks()).extracting(DeckEntity::getName).containsExactly(EntityStore.DEFAULT_DECK_NAME);
        assertThat(store.findDeck(EntityStore.DEFAULT_DECK_ID)).isPresent();
        assertThat(store.createdAt()).isEqualTo(1_700_000_000L);
    }

    @Test
    void insert_assignsIncreasingIdsAndTracksExplicitOnes() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g1", basic.getId(), "a\u001fb", ""));
        assertThat(note.getId()).isGreaterThan(basic.getId());

        store.insertNote(new NoteEntity(500, "g2", basic.getId(), "c\u001fd", ""));
        assertThat(store.maxId()).isEqualTo(500);
        assertThat(store.nextId()).isEqualTo(501);
    }

    @Test
    void insertNote_rejectsUnknownModelAndWrongFieldCount() {
        long before = store.version();

        assertThatThrownBy(() -> store.insertNote(new NoteEntity(0, "g", 999, "a\u001fb", "")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Model not found");
        assertThatThrownBy(() -> store.insertNote(new NoteEntity(0, "g", basic.getId(), "only one", "")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(store.notes()).isEmpty();
        assertThat(store.version()).isEqualTo(before);
    }

    @Test
    void insertCard_rejectsMissingReferencesAndDuplicateOrd() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0));

        assertThatThrownBy(() -> store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.insertCard(new CardEntity(0, 12345, EntityStore.DEFAULT_DECK_ID, 1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.insertCard(new CardEntity(0, note.getId(), 777, 1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.cards()).hasSize(1);
    }

    @Test
    void insertDeck_rejectsDuplicateNamesIgnoringCase() {
        store.insertDeck(new DeckEntity(0, "Spanish::Verbs", 20, 200));

        assertThatThrownBy(() -> store.insertDeck(new DeckEntity(0, "spanish :: verbs", 20, 200)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deckTreeIds_followsNamePrefix() {
        DeckEntity parent = store.insertDeck(new DeckEntity(0, "Parent", 20, 200));
        DeckEntity child = store.insertDeck(new DeckEntity(0, "Parent::Child", 20, 200));
        store.insertDeck(new DeckEntity(0, "Parenthood", 20, 200));

        assertThat(store.deckTreeIds(parent.getId())).containsExactlyInAnyOrder(parent.getId(), child.getId());
    }

    @Test
    void reads_returnCopies() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        CardEntity card = store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0));

        store.requireCard(card.getId()).setInterval(99);

        assertThat(store.requireCard(card.getId()).getInterval()).isZero();
    }

    @Test
    void removeNote_cascadesToCards() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0));

        store.removeNote(note.getId());

        assertThat(store.cards()).isEmpty();
        assertThat(store.cardsOfNote(note.getId())).isEmpty();
    }

    @Test
    void notesChangedSince_tracksNoteWritesOnly() {
        NoteEntity first = store.insertNote(new NoteEntity(0, "g1", basic.getId(), "a\u001fb", ""));
        NoteEntity second = store.insertNote(new NoteEntity(0, "g2", basic.getId(), "c\u001fd", ""));
        long mark = store.version();

        store.insertDeck(new DeckEntity(0, "Other", 20, 200));
        assertThat(store.notesChangedSince(mark)).isEmpty();

        first.setFields("x\u001fy");
        store.replaceNote(first);
        store.removeNote(second.getId());

        assertThat(store.notesChangedSince(mark)).containsExactlyInAnyOrder(first.getId(), second.getId());
        assertThat(store.notesChangedSince(store.version())).isEmpty();
    }

    @Test
    void replaceCard_keepsIdentity() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        CardEntity card = store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0));
        card.setOrd(3);

        assertThatThrownBy(() -> store.replaceCard(card)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replaceModel_rejectsFieldCountChangeWhileNotesExist() {
        store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        ModelEntity changed = store.requireModel(basic.getId());
        changed.setFields(List.of("Front", "Back", "Extra"));

        assertThatThrownBy(() -> store.replaceModel(changed)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void appendReviewLog_movesCollidingIdsForward() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        CardEntity card = store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0));

        ReviewLogEntity first = store.appendReviewLog(log(1000, card.getId()));
        ReviewLogEntity second = store.appendReviewLog(log(1000, card.getId()));

        assertThat(first.getId()).isEqualTo(1000);
        assertThat(second.getId()).isEqualTo(1001);
        assertThat(store.reviewLogsSince(1001)).extracting(ReviewLogEntity::getId).containsExactly(1001L);
    }

    @Test
    void snapshotAndRestore_roundTripAllTables() {
        NoteEntity note = store.insertNote(new NoteEntity(0, "g", basic.getId(), "a\u001fb", ""));
        CardEntity card = store.insertCard(new CardEntity(0, note.getId(), EntityStore.DEFAULT_DECK_ID, 0));
        store.appendReviewLog(log(1000, card.getId()));
        StoreSnapshot snapshot = store.snapshot();

        store.removeNote(note.getId());
        store.insertDeck(new DeckEntity(0, "Scratch", 20, 200));
        store.restore(snapshot);

        assertThat(store.requireNote(note.getId()).getFields()).isEqualTo("a\u001fb");
        assertThat(store.cardsOfNote(note.getId())).extracting(CardEntity::getId).containsExactly(card.getId());
        assertThat(store.findDeckByName("Scratch")).isEmpty();
        assertThat(store.reviewLogs()).hasSize(1);
        assertThat(store.maxId()).isEqualTo(snapshot.lastId());
    }

    private static ReviewLogEntity log(long id, long cardId) {
        return new ReviewLogEntity(id, cardId, 3, 1, 0, 2500, 1200, ReviewKind.LEARN, CardType.NEW);
    }
}
