package app.cardwise.core.review.algorithm;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.review.algorithm.impl.FsrsAlgorithm;
import app.cardwise.core.review.algorithm.impl.LeitnerAlgorithm;
import app.cardwise.core.review.algorithm.impl.Sm2Algorithm;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlgorithmRegistryTest {

    private final SchedulerProps props = SchedulerProps.defaults();
    private final IntervalFuzzer fuzzer = new IntervalFuzzer(new Random(3), props);
    private final CardStateCodec codec = new CardStateCodec(new ObjectMapper());
    private final List<SrsAlgorithm> all = List.of(
            new Sm2Algorithm(props, fuzzer),
            new FsrsAlgorithm(props, fuzzer, codec),
            new LeitnerAlgorithm(props, codec)
    );

    @Test
    void forDeck_blankSettingFallsBackToDefault() {
        AlgorithmRegistry registry = new AlgorithmRegistry(all, props);
        DeckEntity deck = new DeckEntity(1, "Default", 20, 200);

        assertThat(registry.forDeck(deck).id()).isEqualTo("sm2");

        deck.setAlgorithm("leitner");
        assertThat(registry.forDeck(deck).id()).isEqualTo("leitner");
    }

    @Test
    void forDeck_honoursConfiguredDefault() {
        AlgorithmRegistry registry = new AlgorithmRegistry(all, withDefault("fsrs"));

        assertThat(registry.forDeck(new DeckEntity(1, "Default", 20, 200)).id()).isEqualTo("fsrs");
        assertThat(registry.ids()).containsExactly("fsrs", "leitner", "sm2");
    }

    @Test
    void require_rejectsUnknownIds() {
        AlgorithmRegistry registry = new AlgorithmRegistry(all, props);

        assertThatThrownBy(() -> registry.require("hlr"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported algorithm: hlr");
        assertThatThrownBy(() -> new AlgorithmRegistry(all, withDefault("hlr")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static SchedulerProps withDefault(String algorithm) {
        return new SchedulerProps(null, null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, algorithm, null, null, null, null);
    }
}
