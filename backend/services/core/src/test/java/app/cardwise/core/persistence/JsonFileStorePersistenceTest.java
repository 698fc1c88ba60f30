package app.cardwise.core.persistence;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.deck.service.DeckService;
import app.cardwise.core.deck.service.ModelService;
import app.cardwise.core.deck.service.NoteService;
import app.cardwise.core.store.EntityStore;
import app.cardwise.core.store.StoreSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileStorePersistenceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void saveThenLoad_restoresEveryTable() {
        EntityStore store = populatedStore();
        JsonFileStorePersistence persistence = new JsonFileStorePersistence(new ObjectMapper(), dir.resolve("nested/collection.json"));

        assertThat(persistence.save(store)).isTrue();
        Optional<StoreSnapshot> loaded = persistence.load();

        assertThat(loaded).isPresent();
        EntityStore restored = EntityStore.fromSnapshot(loaded.get());
        assertThat(restored.snapshot()).usingRecursiveComparison().isEqualTo(store.snapshot());
        assertThat(restored.nextId()).isEqualTo(store.maxId() + 1);
    }

    @Test
    void load_missingFileIsEmpty() {
        JsonFileStorePersistence persistence = new JsonFileStorePersistence(new ObjectMapper(), dir.resolve("none.json"));

        assertThat(persistence.load()).isEmpty();
    }

    @Test
    void load_corruptFileIsEmpty() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThat(new JsonFileStorePersistence(new ObjectMapper(), file).load()).isEmpty();
    }

    @Test
    void save_leavesNoTemporaryFiles() throws Exception {
        JsonFileStorePersistence persistence = new JsonFileStorePersistence(new ObjectMapper(), dir.resolve("c.json"));

        persistence.save(populatedStore());
        persistence.save(populatedStore());

        try (var files = Files.list(dir)) {
            assertThat(files.map(path -> path.getFileName().toString()).toList()).containsExactly("c.json");
        }
    }

    private static EntityStore populatedStore() {
        EntityStore store = new EntityStore(CLOCK.instant().getEpochSecond());
        ModelService models = new ModelService(store, CLOCK);
        ModelEntity cloze = models.createClozeModel("Cloze");
        DeckEntity deck = new DeckService(store, SchedulerProps.defaults(), CLOCK).createDeck("Geo::Europe");
        var note = new NoteService(store, new ClozeEngine(), CLOCK)
                .createNote(cloze.getId(), deck.getId(), List.of("{{c1::Paris}} is in {{c2::France}}", "capital"), List.of("geo"));
        CardEntity card = store.cardsOfNote(note.getId()).get(0);
        deck.setAlgorithm("fsrs");
        store.replaceDeck(deck);
        card.setData("{\"fsrs\":{\"s\":2.3,\"d\":5.1,\"last\":1709287200}}");
        store.replaceCard(card);
        store.appendReviewLog(new ReviewLogEntity(1_709_287_200_000L, card.getId(), 3, -600, 0, 2500, 3_000,
                ReviewKind.LEARN, CardType.NEW));
        return store;
    }
}
