package app.cardwise.importer.service.parser;

import app.cardwise.importer.domain.ImportWarning;
import com.github.luben.zstd.ZstdInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * An opened package: the zip, the extracted collection database and the media manifest. Closing it
 * releases the database and deletes the extraction directory.
 */
public class ApkgArchive implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApkgArchive.class);

    private final Path tempDir;
    private final ZipFile zipFile;
    private final Connection connection;
    private final Set<String> tables;
    private final Map<String, String> media;
    private final boolean compressedMedia;
    private final List<ImportWarning> warnings;

    ApkgArchive(Path tempDir,
                ZipFile zipFile,
                Connection connection,
                Set<String> tables,
                Map<String, String> media,
                boolean compressedMedia,
                List<ImportWarning> warnings) {
        this.tempDir = tempDir;
        this.zipFile = zipFile;
        this.connection = connection;
        this.tables = Set.copyOf(tables);
        this.media = media;
        this.compressedMedia = compressedMedia;
        this.warnings = List.copyOf(warnings);
    }

    Connection connection() {
        return connection;
    }

    public boolean hasTable(String name) {
        return tables.contains(name);
    }

    /**
     * Media token (the zip entry name) to the file name the notes refer to, ordered by token.
     */
    public Map<String, String> media() {
        return media;
    }

    /**
     * Problems found while opening that do not prevent the import, such as an unreadable manifest.
     */
    public List<ImportWarning> warnings() {
        return warnings;
    }

    /**
     * @return the media file's content, or {@code null} when the archive has no entry for the token
     */
    public InputStream openMedia(String token) throws IOException {
        ZipEntry entry = zipFile.getEntry(token);
        if (entry == null) {
            return null;
        }
        InputStream in = zipFile.getInputStream(entry);
        return compressedMedia ? new ZstdInputStream(in) : in;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException ex) {
            log.warn("Failed to close archive database dir={} error={}", tempDir, ex.getMessage());
        }
        try {
            zipFile.close();
        } catch (IOException ex) {
            log.warn("Failed to close archive zip dir={} error={}", tempDir, ex.getMessage());
        }
        deleteRecursively(tempDir);
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException ex) {
            log.warn("Failed to delete archive extraction dir={} error={}", dir, ex.getMessage());
        }
    }
}
