package app.cardwise.core.media.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

public interface MediaStorage {

    /**
     * Stores the bytes under a safe version of {@code desiredName} and reports the name actually used.
     * Identical content already stored under that name is reused; different content gets a suffixed name.
     */
    StoredMedia store(String desiredName, InputStream data) throws IOException;

    boolean exists(String name);

    void delete(String name) throws IOException;

    Optional<MediaReference> resolve(String name);
}
