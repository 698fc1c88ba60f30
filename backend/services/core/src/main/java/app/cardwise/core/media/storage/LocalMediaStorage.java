package app.cardwise.core.media.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Media files kept flat in one directory.
 */
public class LocalMediaStorage implements MediaStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalMediaStorage.class);
    private static final int MAX_SUFFIX = 10_000;

    private final Path root;

    public LocalMediaStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public StoredMedia store(String desiredName, InputStream data) throws IOException {
        Files.createDirectories(root);
        Path staged = Files.createTempFile(root, ".incoming-", ".tmp");
        try {
            Files.copy(data, staged, StandardCopyOption.REPLACE_EXISTING);
            String base = MediaFileNames.sanitize(desiredName);
            for (int n = 0; n < MAX_SUFFIX; n++) {
                String candidate = n == 0 ? base : MediaFileNames.withSuffix(base, n);
                Path target = root.resolve(candidate);
                if (!Files.exists(target)) {
                    Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
                    log.debug("Stored media name={} size={}", candidate, Files.size(target));
                    return new StoredMedia(candidate, true);
                }
                if (Files.mismatch(staged, target) == -1L) {
                    return new StoredMedia(candidate, false);
                }
            }
            throw new IOException("No free media name for " + base);
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    @Override
    public boolean exists(String name) {
        Path path = pathOf(name);
        return path != null && Files.isRegularFile(path);
    }

    @Override
    public void delete(String name) throws IOException {
        Path path = pathOf(name);
        if (path != null) {
            Files.deleteIfExists(path);
        }
    }

    @Override
    public Optional<MediaReference> resolve(String name) {
        Path path = pathOf(name);
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new MediaReference(name, path, Files.size(path), Files.probeContentType(path)));
        } catch (IOException ex) {
            log.warn("Failed to resolve media name={} error={}", name, ex.getMessage());
            return Optional.empty();
        }
    }

    private Path pathOf(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        Path path = root.resolve(name).normalize();
        return path.startsWith(root) && !path.equals(root) ? path : null;
    }
}
