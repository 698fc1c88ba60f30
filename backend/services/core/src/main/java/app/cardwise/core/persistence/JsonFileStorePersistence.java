package app.cardwise.core.persistence;

import app.cardwise.core.store.EntityStore;
import app.cardwise.core.store.StoreSnapshot;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Writes the whole store as one JSON document. Saves go to a temporary file first and are moved over
 * the previous file, so a crash mid-write keeps the old snapshot readable.
 */
public class JsonFileStorePersistence implements StorePersistence {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStorePersistence.class);

    private final ObjectMapper objectMapper;
    private final Path file;

    public JsonFileStorePersistence(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.file = file.toAbsolutePath();
    }

    public Path file() {
        return file;
    }

    @Override
    public boolean save(EntityStore store) {
        StoreSnapshot snapshot = store.snapshot();
        Path temp = null;
        try {
            Path dir = file.getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved store file={} notes={} cards={}", file, snapshot.notes().size(), snapshot.cards().size());
            return true;
        } catch (IOException ex) {
            log.error("Failed to save store file={} error={}", file, ex.getMessage(), ex);
            deleteTemp(temp);
            return false;
        }
    }

    @Override
    public Optional<StoreSnapshot> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), StoreSnapshot.class));
        } catch (IOException ex) {
            log.error("Failed to load store file={} error={}", file, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Failed to remove temporary store file={} error={}", temp, ex.getMessage());
        }
    }
}
