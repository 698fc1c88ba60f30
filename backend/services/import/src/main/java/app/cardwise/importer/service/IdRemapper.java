package app.cardwise.importer.service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Fresh ids for archive rows, allocated above a floor. Within a table, callers assign ids in
 * ascending order of the original ids, so the same archive imported into the same store state always
 * gets the same ids.
 */
public class IdRemapper {

    public enum Table {
        MODEL, DECK, NOTE, CARD
    }

    private final Map<Table, Map<Long, Long>> tables = new EnumMap<>(Table.class);
    private long lastId;

    public IdRemapper(long floor) {
        this.lastId = floor;
        for (Table table : Table.values()) {
            tables.put(table, new HashMap<>());
        }
    }

    /**
     * @return the id already assigned to {@code originalId}, or the next free one
     */
    public long assign(Table table, long originalId) {
        return tables.get(table).computeIfAbsent(originalId, key -> ++lastId);
    }

    /**
     * Points {@code originalId} at a row that already exists in the store.
     */
    public void alias(Table table, long originalId, long existingId) {
        tables.get(table).put(originalId, existingId);
    }

    /**
     * @return the mapped id, or {@code null} when the original id was never assigned
     */
    public Long resolve(Table table, long originalId) {
        return tables.get(table).get(originalId);
    }
}
