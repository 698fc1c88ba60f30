package app.cardwise.importer.service.parser;

import app.cardwise.core.deck.domain.entity.CardTemplate;
import app.cardwise.core.deck.util.DeckHierarchy;
import app.cardwise.core.text.PlainText;
import app.cardwise.importer.domain.ImportWarning;
import app.cardwise.importer.service.ImportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.luben.zstd.ZstdInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads Anki packages: the zip container, the SQLite collection inside it and the media manifest.
 * Knows both the legacy {@code col} JSON columns and the newer per-table schema.
 */
@Component
public class ApkgImportParser {

    private static final Logger log = LoggerFactory.getLogger(ApkgImportParser.class);

    private static final String COLLECTION_V21B_NAME = "collection.anki21b";
    private static final String COLLECTION_V21_NAME = "collection.anki21";
    private static final String COLLECTION_V2_NAME = "collection.anki2";
    private static final String MEDIA_NAME = "media";
    private static final byte[] ZSTD_MAGIC = {(byte) 0x28, (byte) 0xB5, (byte) 0x2F, (byte) 0xFD};

    public static final String NOTES_TABLE = "notes";
    public static final String CARDS_TABLE = "cards";
    public static final String REVLOG_TABLE = "revlog";

    private final ObjectMapper objectMapper;

    public ApkgImportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ApkgArchive open(Path archivePath) throws ImportException {
        Path tempDir;
        try {
            tempDir = Files.createTempDirectory("cardwise-apkg-");
        } catch (IOException ex) {
            throw new ImportException("Failed to create extraction directory", ex);
        }
        ZipFile zipFile = null;
        Connection connection = null;
        try {
            zipFile = openZip(archivePath);
            Path collectionFile = extractCollection(zipFile, tempDir);
            List<ImportWarning> warnings = new ArrayList<>();
            MediaManifest manifest = readMediaManifest(zipFile, warnings);

            connection = DriverManager.getConnection("jdbc:sqlite:" + collectionFile.toAbsolutePath());
            Set<String> tables = listTables(connection);
            requireTable(tables, NOTES_TABLE);
            requireTable(tables, CARDS_TABLE);
            if (!tables.contains("col") && !tables.contains("notetypes")) {
                throw new ImportException("Archive database has neither a col nor a notetypes table");
            }
            return new ApkgArchive(tempDir, zipFile, connection, tables, manifest.entries(), manifest.compressed(), warnings);
        } catch (ImportException ex) {
            release(connection, zipFile, tempDir);
            throw ex;
        } catch (SQLException ex) {
            release(connection, zipFile, tempDir);
            throw new ImportException("Archive database is unreadable: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            release(connection, zipFile, tempDir);
            throw new ImportException("Failed to read archive: " + ex.getMessage(), ex);
        }
    }

    /**
     * Collection metadata: creation time, note types and decks.
     *
     * @throws ImportException when no note type can be read
     */
    public ApkgCollection readCollection(ApkgArchive archive) throws ImportException {
        Connection connection = archive.connection();
        try {
            long createdAt = 0;
            String modelsJson = null;
            String decksJson = null;
            String dconfJson = null;
            if (archive.hasTable("col")) {
                try (PreparedStatement stmt = connection.prepareStatement("select crt, models, decks, dconf from col limit 1");
                     ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        createdAt = rs.getLong("crt");
                        modelsJson = rs.getString("models");
                        decksJson = rs.getString("decks");
                        dconfJson = rs.getString("dconf");
                    }
                }
            }

            List<ApkgModel> models = parseModelsJson(modelsJson);
            if (models.isEmpty() && archive.hasTable("notetypes")) {
                models = loadModelTables(connection, archive.hasTable("fields"), archive.hasTable("templates"));
            }
            if (models.isEmpty()) {
                throw new ImportException("Archive has no note types");
            }

            List<ApkgDeck> decks = parseDecksJson(decksJson, dconfJson);
            if (decks.isEmpty() && archive.hasTable("decks")) {
                decks = loadDeckTables(connection, archive.hasTable("deck_config"));
            }
            return new ApkgCollection(createdAt, models, decks);
        } catch (SQLException ex) {
            throw new ImportException("Failed to read collection metadata: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ImportException("Collection metadata is not valid JSON: " + ex.getMessage(), ex);
        }
    }

    public int count(ApkgArchive archive, String table) throws ImportException {
        if (!archive.hasTable(table)) {
            return 0;
        }
        return countQuery(archive, "select count(*) from " + table);
    }

    /**
     * Cards that have been answered at least once or left the new queue.
     */
    public int countStudiedCards(ApkgArchive archive) throws ImportException {
        return countQuery(archive, "select count(*) from cards where type <> 0 or reps > 0");
    }

    public void forEachNote(ApkgArchive archive, int batchSize, BatchHandler<ApkgNote> handler) throws ImportException {
        readBatches(archive, NOTES_TABLE, "select id, guid, mid, mod, tags, flds from notes order by id", batchSize, handler,
                rs -> new ApkgNote(
                        rs.getLong("id"),
                        rs.getString("guid"),
                        rs.getLong("mid"),
                        rs.getString("flds"),
                        rs.getString("tags"),
                        rs.getLong("mod")
                ));
    }

    public void forEachCard(ApkgArchive archive, int batchSize, BatchHandler<ApkgCard> handler) throws ImportException {
        readBatches(archive, CARDS_TABLE,
                "select id, nid, did, ord, type, queue, due, ivl, factor, reps, lapses, left, odue, odid, flags, mod "
                        + "from cards order by id",
                batchSize, handler,
                rs -> new ApkgCard(
                        rs.getLong("id"),
                        rs.getLong("nid"),
                        rs.getLong("did"),
                        rs.getInt("ord"),
                        rs.getInt("type"),
                        rs.getInt("queue"),
                        rs.getLong("due"),
                        rs.getInt("ivl"),
                        rs.getInt("factor"),
                        rs.getInt("reps"),
                        rs.getInt("lapses"),
                        rs.getInt("left"),
                        rs.getLong("odue"),
                        rs.getLong("odid"),
                        rs.getInt("flags"),
                        rs.getLong("mod")
                ));
    }

    public void forEachReview(ApkgArchive archive, int batchSize, BatchHandler<ApkgReview> handler) throws ImportException {
        if (!archive.hasTable(REVLOG_TABLE)) {
            return;
        }
        readBatches(archive, REVLOG_TABLE, "select id, cid, ease, ivl, lastIvl, factor, time, type from revlog order by id",
                batchSize, handler,
                rs -> new ApkgReview(
                        rs.getLong("id"),
                        rs.getLong("cid"),
                        rs.getInt("ease"),
                        rs.getInt("ivl"),
                        rs.getInt("lastIvl"),
                        rs.getInt("factor"),
                        rs.getLong("time"),
                        rs.getInt("type")
                ));
    }

    private <T> void readBatches(ApkgArchive archive,
                                 String table,
                                 String sql,
                                 int batchSize,
                                 BatchHandler<T> handler,
                                 RowMapper<T> mapper) throws ImportException {
        int size = Math.max(1, batchSize);
        try (PreparedStatement stmt = archive.connection().prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            List<T> batch = new ArrayList<>(size);
            while (rs.next()) {
                batch.add(mapper.map(rs));
                if (batch.size() >= size) {
                    handler.accept(batch);
                    batch = new ArrayList<>(size);
                }
            }
            if (!batch.isEmpty()) {
                handler.accept(batch);
            }
        } catch (SQLException ex) {
            throw new ImportException("Failed to read " + table + ": " + ex.getMessage(), ex);
        }
    }

    private int countQuery(ApkgArchive archive, String sql) throws ImportException {
        try (PreparedStatement stmt = archive.connection().prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException ex) {
            throw new ImportException("Failed to count rows: " + ex.getMessage(), ex);
        }
    }

    private ZipFile openZip(Path archivePath) throws ImportException {
        try {
            return new ZipFile(archivePath.toFile());
        } catch (ZipException ex) {
            throw new ImportException("Not a zip archive: " + archivePath.getFileName(), ex);
        } catch (IOException ex) {
            throw new ImportException("Failed to open archive: " + archivePath, ex);
        }
    }

    private Path extractCollection(ZipFile zipFile, Path tempDir) throws IOException {
        ZipEntry entry = zipFile.getEntry(COLLECTION_V21B_NAME);
        String chosenName = COLLECTION_V21B_NAME;
        if (entry == null) {
            entry = zipFile.getEntry(COLLECTION_V21_NAME);
            chosenName = COLLECTION_V21_NAME;
        }
        if (entry == null) {
            entry = zipFile.getEntry(COLLECTION_V2_NAME);
            chosenName = COLLECTION_V2_NAME;
        }
        if (entry == null) {
            throw new ImportException("Missing collection.anki21b/collection.anki21/collection.anki2 in archive");
        }
        Path collectionFile = tempDir.resolve("collection.db");
        try (InputStream in = zipFile.getInputStream(entry);
             InputStream data = COLLECTION_V21B_NAME.equals(chosenName) ? new ZstdInputStream(in) : in) {
            Files.copy(data, collectionFile, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Extracted collection entry={} size={}", chosenName, Files.size(collectionFile));
        return collectionFile;
    }

    private MediaManifest readMediaManifest(ZipFile zipFile, List<ImportWarning> warnings) throws IOException {
        ZipEntry entry = zipFile.getEntry(MEDIA_NAME);
        if (entry == null) {
            return new MediaManifest(Map.of(), false);
        }
        byte[] raw;
        try (InputStream in = zipFile.getInputStream(entry)) {
            raw = in.readAllBytes();
        }
        if (raw.length == 0) {
            return new MediaManifest(Map.of(), false);
        }
        if (startsWithZstdMagic(raw)) {
            return readProtobufManifest(raw, warnings);
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                warnings.add(new ImportWarning("media", MEDIA_NAME, "Media manifest is not a JSON object"));
                return new MediaManifest(Map.of(), false);
            }
            Map<String, String> entries = new TreeMap<>(ApkgImportParser::compareTokens);
            node.fields().forEachRemaining(e -> entries.put(e.getKey(), e.getValue().asText()));
            return new MediaManifest(entries, false);
        } catch (IOException ex) {
            log.warn("Unreadable media manifest error={}", ex.getMessage());
            warnings.add(new ImportWarning("media", MEDIA_NAME, "Unsupported media manifest"));
            return new MediaManifest(Map.of(), false);
        }
    }

    /**
     * Newer packages store the manifest as zstd-compressed protobuf entries; entry {@code i} lives in
     * the zip under the name {@code i} and is zstd-compressed as well.
     */
    private MediaManifest readProtobufManifest(byte[] raw, List<ImportWarning> warnings) {
        byte[] decoded;
        try (InputStream in = new ZstdInputStream(new ByteArrayInputStream(raw))) {
            decoded = in.readAllBytes();
        } catch (IOException ex) {
            log.warn("Unreadable compressed media manifest error={}", ex.getMessage());
            warnings.add(new ImportWarning("media", MEDIA_NAME, "Unsupported media manifest"));
            return new MediaManifest(Map.of(), false);
        }
        ProtoFields manifest = ProtoFields.decode(decoded);
        if (manifest.truncated()) {
            warnings.add(new ImportWarning("media", MEDIA_NAME, "Unsupported media manifest"));
            return new MediaManifest(Map.of(), false);
        }
        Map<String, String> entries = new TreeMap<>(ApkgImportParser::compareTokens);
        List<byte[]> items = manifest.messages(1);
        for (int i = 0; i < items.size(); i++) {
            String name = ProtoFields.decode(items.get(i)).string(1);
            if (name != null && !name.isBlank()) {
                entries.put(String.valueOf(i), name);
            }
        }
        return new MediaManifest(entries, true);
    }

    private List<ApkgModel> parseModelsJson(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root = objectMapper.readTree(json);
        List<ApkgModel> models = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode node = entry.getValue();
            long id = node.path("id").asLong(parseId(entry.getKey()));

            List<String> fields = new ArrayList<>();
            for (JsonNode field : node.path("flds")) {
                fields.add(field.path("name").asText(""));
            }
            List<CardTemplate> templates = new ArrayList<>();
            int index = 0;
            for (JsonNode template : node.path("tmpls")) {
                templates.add(new CardTemplate(
                        template.path("name").asText("Card " + (index + 1)),
                        template.path("ord").asInt(index),
                        template.path("qfmt").asText(""),
                        template.path("afmt").asText("")
                ));
                index++;
            }
            models.add(new ApkgModel(
                    id,
                    node.path("name").asText(""),
                    node.path("type").asInt(0) == 1,
                    fields,
                    templates,
                    node.path("sortf").asInt(0),
                    node.path("css").asText("")
            ));
        }
        return models;
    }

    private List<ApkgModel> loadModelTables(Connection connection, boolean hasFields, boolean hasTemplates) throws SQLException {
        Map<Long, List<String>> fieldsByModel = new HashMap<>();
        if (hasFields) {
            try (PreparedStatement stmt = connection.prepareStatement("select ntid, ord, name from fields order by ntid, ord");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    fieldsByModel.computeIfAbsent(rs.getLong("ntid"), key -> new ArrayList<>()).add(rs.getString("name"));
                }
            }
        }
        Map<Long, List<CardTemplate>> templatesByModel = new HashMap<>();
        if (hasTemplates) {
            try (PreparedStatement stmt = connection.prepareStatement(
                    "select ntid, ord, name, config from templates order by ntid, ord");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ProtoFields config = ProtoFields.decode(rs.getBytes("config"));
                    templatesByModel.computeIfAbsent(rs.getLong("ntid"), key -> new ArrayList<>()).add(new CardTemplate(
                            rs.getString("name"),
                            rs.getInt("ord"),
                            nullToEmpty(config.string(1)),
                            nullToEmpty(config.string(2))
                    ));
                }
            }
        }
        List<ApkgModel> models = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement("select id, name, config from notetypes order by id");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                long id = rs.getLong("id");
                ProtoFields config = ProtoFields.decode(rs.getBytes("config"));
                models.add(new ApkgModel(
                        id,
                        rs.getString("name"),
                        config.varint(1, 0) == 1,
                        fieldsByModel.getOrDefault(id, List.of()),
                        templatesByModel.getOrDefault(id, List.of()),
                        (int) config.varint(2, 0),
                        nullToEmpty(config.string(3))
                ));
            }
        }
        return models;
    }

    private List<ApkgDeck> parseDecksJson(String decksJson, String dconfJson) throws IOException {
        if (decksJson == null || decksJson.isBlank()) {
            return List.of();
        }
        Map<Long, int[]> limits = new HashMap<>();
        if (dconfJson != null && !dconfJson.isBlank()) {
            Iterator<Map.Entry<String, JsonNode>> it = objectMapper.readTree(dconfJson).fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode conf = entry.getValue();
                limits.put(conf.path("id").asLong(parseId(entry.getKey())), new int[]{
                        conf.path("new").path("perDay").asInt(-1),
                        conf.path("rev").path("perDay").asInt(-1)
                });
            }
        }
        List<ApkgDeck> decks = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = objectMapper.readTree(decksJson).fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode node = entry.getValue();
            int[] deckLimits = limits.get(node.path("conf").asLong(1));
            decks.add(new ApkgDeck(
                    node.path("id").asLong(parseId(entry.getKey())),
                    node.path("name").asText(""),
                    node.path("dyn").asInt(0) != 0,
                    node.path("desc").asText(""),
                    limitOrNull(deckLimits, 0),
                    limitOrNull(deckLimits, 1)
            ));
        }
        return decks;
    }

    private List<ApkgDeck> loadDeckTables(Connection connection, boolean hasDeckConfig) throws SQLException {
        Map<Long, int[]> limits = new HashMap<>();
        if (hasDeckConfig) {
            try (PreparedStatement stmt = connection.prepareStatement("select id, config from deck_config");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ProtoFields config = ProtoFields.decode(rs.getBytes("config"));
                    limits.put(rs.getLong("id"), new int[]{
                            (int) config.varint(9, -1),
                            (int) config.varint(10, -1)
                    });
                }
            }
        }
        List<ApkgDeck> decks = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement("select id, name, kind from decks order by id");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ProtoFields kind = ProtoFields.decode(rs.getBytes("kind"));
                boolean filtered = kind.has(2);
                long configId = 1;
                List<byte[]> normal = kind.messages(1);
                if (!normal.isEmpty()) {
                    configId = ProtoFields.decode(normal.get(0)).varint(1, 1);
                }
                int[] deckLimits = limits.get(configId);
                String name = nullToEmpty(rs.getString("name")).replace(PlainText.FIELD_SEPARATOR, DeckHierarchy.SEPARATOR);
                decks.add(new ApkgDeck(
                        rs.getLong("id"),
                        name,
                        filtered,
                        "",
                        limitOrNull(deckLimits, 0),
                        limitOrNull(deckLimits, 1)
                ));
            }
        }
        return decks;
    }

    private static Set<String> listTables(Connection connection) throws SQLException {
        Set<String> tables = new HashSet<>();
        try (PreparedStatement stmt = connection.prepareStatement("select name from sqlite_master where type = 'table'");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        }
        return tables;
    }

    private static void requireTable(Set<String> tables, String table) throws ImportException {
        if (!tables.contains(table)) {
            throw new ImportException("Archive database is missing the " + table + " table");
        }
    }

    private static void release(Connection connection, ZipFile zipFile, Path tempDir) {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException ex) {
                log.debug("Failed to close archive database error={}", ex.getMessage());
            }
        }
        if (zipFile != null) {
            try {
                zipFile.close();
            } catch (IOException ex) {
                log.debug("Failed to close archive zip error={}", ex.getMessage());
            }
        }
        ApkgArchive.deleteRecursively(tempDir);
    }

    private static boolean startsWithZstdMagic(byte[] raw) {
        if (raw.length < ZSTD_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < ZSTD_MAGIC.length; i++) {
            if (raw[i] != ZSTD_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    private static int compareTokens(String a, String b) {
        long left = parseId(a);
        long right = parseId(b);
        if (left >= 0 && right >= 0 && left != right) {
            return Long.compare(left, right);
        }
        return a.compareTo(b);
    }

    private static long parseId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static Integer limitOrNull(int[] limits, int index) {
        if (limits == null || limits[index] < 0) {
            return null;
        }
        return limits[index];
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private record MediaManifest(Map<String, String> entries, boolean compressed) {
    }
}
