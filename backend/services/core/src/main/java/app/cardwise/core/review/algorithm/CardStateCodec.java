package app.cardwise.core.review.algorithm;

import app.cardwise.core.deck.domain.entity.CardEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads and writes one algorithm's section of {@link CardEntity#getData()}. Sections of other
 * algorithms are kept, so switching a deck back and forth does not lose state.
 */
@Component
public class CardStateCodec {

    private static final Logger log = LoggerFactory.getLogger(CardStateCodec.class);

    private final ObjectMapper om;

    public CardStateCodec(ObjectMapper om) {
        this.om = om;
    }

    public Optional<JsonNode> read(CardEntity card, String section) {
        JsonNode node = root(card).get(section);
        return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    }

    public void write(CardEntity card, String section, JsonNode state) {
        ObjectNode root = root(card);
        root.set(section, state);
        try {
            card.setData(om.writeValueAsString(root));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode scheduling state of card " + card.getId(), ex);
        }
    }

    public ObjectNode createObject() {
        return om.createObjectNode();
    }

    private ObjectNode root(CardEntity card) {
        String data = card.getData();
        if (data == null || data.isBlank()) {
            return om.createObjectNode();
        }
        try {
            JsonNode node = om.readTree(data);
            if (node != null && node.isObject()) {
                return (ObjectNode) node;
            }
            log.warn("Ignoring non-object scheduling state cardId={}", card.getId());
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unreadable scheduling state cardId={} error={}", card.getId(), ex.getOriginalMessage());
        }
        return om.createObjectNode();
    }
}
