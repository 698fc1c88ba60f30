package app.cardwise.core.review.algorithm;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Component
public class AlgorithmRegistry {

    private final Map<String, SrsAlgorithm> algorithms;
    private final String defaultId;

    public AlgorithmRegistry(List<SrsAlgorithm> list, SchedulerProps props) {
        Map<String, SrsAlgorithm> map = new HashMap<>();
        for (var a : list) map.put(a.id(), a);
        this.algorithms = Map.copyOf(map);
        this.defaultId = props.defaultAlgorithm();
        require(defaultId);
    }

    public SrsAlgorithm require(String id) {
        var a = algorithms.get(id);
        if (a == null) throw new IllegalArgumentException("Unsupported algorithm: " + id);
        return a;
    }

    /**
     * The deck's own algorithm, or the collection default when the deck leaves it blank.
     */
    public SrsAlgorithm forDeck(DeckEntity deck) {
        String id = deck.getAlgorithm();
        return require(id == null || id.isBlank() ? defaultId : id);
    }

    public String defaultId() {
        return defaultId;
    }

    public Set<String> ids() {
        return new TreeSet<>(algorithms.keySet());
    }
}
