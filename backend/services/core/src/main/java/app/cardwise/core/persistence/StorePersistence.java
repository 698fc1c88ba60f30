package app.cardwise.core.persistence;

import app.cardwise.core.store.EntityStore;
import app.cardwise.core.store.StoreSnapshot;

import java.util.Optional;

/**
 * Durability for the entity store. The core never opens files itself.
 */
public interface StorePersistence {

    boolean save(EntityStore store);

    Optional<StoreSnapshot> load();
}
