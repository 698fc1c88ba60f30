package app.cardwise.importer.service;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ModelType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.deck.service.NewCards;
import app.cardwise.core.deck.util.DeckHierarchy;
import app.cardwise.core.media.storage.MediaFileNames;
import app.cardwise.core.media.storage.MediaStorage;
import app.cardwise.core.media.storage.StoredMedia;
import app.cardwise.core.review.util.StudyDays;
import app.cardwise.core.store.EntityStore;
import app.cardwise.core.store.StoreSnapshot;
import app.cardwise.importer.config.ImportProps;
import app.cardwise.importer.domain.ImportInspection;
import app.cardwise.importer.domain.ImportMode;
import app.cardwise.importer.domain.ImportOptions;
import app.cardwise.importer.domain.ImportPhase;
import app.cardwise.importer.domain.ImportProgress;
import app.cardwise.importer.domain.ImportResult;
import app.cardwise.importer.domain.ImportWarning;
import app.cardwise.importer.service.IdRemapper.Table;
import app.cardwise.importer.service.parser.ApkgArchive;
import app.cardwise.importer.service.parser.ApkgCard;
import app.cardwise.importer.service.parser.ApkgCollection;
import app.cardwise.importer.service.parser.ApkgDeck;
import app.cardwise.importer.service.parser.ApkgImportParser;
import app.cardwise.importer.service.parser.ApkgModel;
import app.cardwise.importer.service.parser.ApkgNote;
import app.cardwise.importer.service.parser.ApkgReview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Imports Anki packages into the {@link EntityStore}. Every archive id is remapped above the ids the
 * store already holds; malformed rows are skipped with a warning, structural problems abort and
 * leave the store as it was.
 */
@Service
public class PackageImporter {

    private static final Logger log = LoggerFactory.getLogger(PackageImporter.class);

    private static final long EPOCH_SECONDS_THRESHOLD = 1_000_000_000L;
    private static final int REVLOG_MANUAL = 4;

    private final ApkgImportParser parser;
    private final EntityStore store;
    private final MediaStorage mediaStorage;
    private final ClozeEngine clozeEngine;
    private final StudyDays studyDays;
    private final SchedulerProps schedulerProps;
    private final ImportProps props;
    private final Clock clock;

    public PackageImporter(ApkgImportParser parser,
                           EntityStore store,
                           MediaStorage mediaStorage,
                           ClozeEngine clozeEngine,
                           StudyDays studyDays,
                           SchedulerProps schedulerProps,
                           ImportProps props,
                           Clock clock) {
        this.parser = parser;
        this.store = store;
        this.mediaStorage = mediaStorage;
        this.clozeEngine = clozeEngine;
        this.studyDays = studyDays;
        this.schedulerProps = schedulerProps;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Counts what the archive holds without importing anything.
     */
    public ImportInspection inspect(Path archivePath) throws ImportException {
        try (ApkgArchive archive = parser.open(archivePath)) {
            int notes = parser.count(archive, ApkgImportParser.NOTES_TABLE);
            int cards = parser.count(archive, ApkgImportParser.CARDS_TABLE);
            int reviews = parser.count(archive, ApkgImportParser.REVLOG_TABLE);
            int studied = parser.countStudiedCards(archive);
            return new ImportInspection(notes, cards, studied, reviews, archive.media().size(), studied > 0 || reviews > 0);
        }
    }

    /**
     * Reads and remaps the archive as an import would, without writing to the store or copying media.
     * The media map holds the names the files would be stored under.
     */
    public ImportResult parse(Path archivePath, ImportOptions options) throws ImportException {
        return run(archivePath, options, false);
    }

    public ImportResult importPackage(Path archivePath, ImportOptions options) throws ImportException {
        return run(archivePath, options, true);
    }

    private ImportResult run(Path archivePath, ImportOptions options, boolean apply) throws ImportException {
        long versionBefore = store.version();
        StoreSnapshot before = apply ? store.snapshot() : null;
        Instant started = clock.instant();
        ImportRun run = new ImportRun(options, apply);
        try (ApkgArchive archive = parser.open(archivePath)) {
            run.progress(ImportPhase.OPENING, 0, -1);
            archive.warnings().forEach(run::warn);
            ApkgCollection collection = parser.readCollection(archive);
            run.importModels(collection.models());
            run.importDecks(collection.decks());
            run.importMedia(archive);
            run.importNotes(archive);
            run.importCards(archive, collection);
            if (options.mode() == ImportMode.WITH_PROGRESS) {
                run.importReviews(archive);
            }
            run.dropNotesWithoutCards();
            run.commit();
        } catch (ImportException ex) {
            rollback(apply, versionBefore, before, run.createdMedia());
            log.warn("Import failed file={} error={}", archivePath.getFileName(), ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            rollback(apply, versionBefore, before, run.createdMedia());
            log.error("Import failed file={}", archivePath.getFileName(), ex);
            throw new ImportException("Import failed: " + ex.getMessage(), ex);
        }
        options.listener().onProgress(ImportProgress.of(ImportPhase.COMPLETED));

        ImportResult result = run.result();
        log.info("Import {} file={} mode={} notes={} cards={} reviews={} media={} warnings={} durationMs={}",
                apply ? "committed" : "parsed",
                archivePath.getFileName(),
                options.mode(),
                result.notes().size(),
                result.cards().size(),
                result.reviewLogs().size(),
                result.mediaMap().size(),
                result.warnings().size(),
                Duration.between(started, clock.instant()).toMillis());
        return result;
    }

    private void rollback(boolean apply, long versionBefore, StoreSnapshot before, List<String> createdMedia) {
        if (!apply) {
            return;
        }
        if (store.version() != versionBefore) {
            store.restore(before);
        }
        for (String name : createdMedia) {
            try {
                mediaStorage.delete(name);
            } catch (IOException ex) {
                log.warn("Failed to remove imported media name={} error={}", name, ex.getMessage());
            }
        }
        log.info("Import rolled back media={}", createdMedia.size());
    }

    /**
     * State of one import. In streaming mode rows are written as their batch is accepted; otherwise
     * everything is staged and written by {@link #commit()}.
     */
    private final class ImportRun {

        private final ImportOptions options;
        private final boolean apply;
        private final boolean writeAsYouGo;
        private final int batchSize;
        private final long now;
        private final IdRemapper remapper;
        private final long positionBase;

        private final List<ImportWarning> warnings = new ArrayList<>();
        private final List<String> createdMedia = new ArrayList<>();
        private final Map<String, String> mediaMap = new LinkedHashMap<>();
        private final Map<Long, ModelEntity> modelsByOriginalId = new HashMap<>();
        private final Map<String, Long> deckIdsByName = new HashMap<>();
        private final Set<Long> filteredDeckIds = new HashSet<>();
        private final Map<Long, StagedNote> stagedNotes = new LinkedHashMap<>();
        private final Map<Long, Set<Integer>> usedOrds = new HashMap<>();
        private final Set<Long> learnedCards = new HashSet<>();

        private final List<ModelEntity> models = new ArrayList<>();
        private final List<DeckEntity> decks = new ArrayList<>();
        private final List<NoteEntity> notes = new ArrayList<>();
        private final List<CardEntity> cards = new ArrayList<>();
        private final List<ReviewLogEntity> reviewLogs = new ArrayList<>();

        private MediaReferenceRewriter rewriter = new MediaReferenceRewriter(Map.of());
        private long noteCount;

        ImportRun(ImportOptions options, boolean apply) {
            this.options = options;
            this.apply = apply;
            this.writeAsYouGo = apply && options.streaming();
            this.batchSize = props.batchSize();
            this.now = clock.instant().getEpochSecond();
            this.remapper = new IdRemapper(store.maxId());
            this.positionBase = store.lastPosition();
        }

        List<String> createdMedia() {
            return createdMedia;
        }

        void progress(ImportPhase phase, int processed, int total) throws ImportCancelledException {
            ImportProgress progress = new ImportProgress(phase, processed, total);
            log.debug("Import progress phase={} processed={} total={}", phase, processed, total);
            if (!options.listener().onProgress(progress)) {
                log.info("Import cancelled phase={} processed={}", phase, processed);
                throw new ImportCancelledException(phase);
            }
        }

        /**
         * One event per phase when not streaming; one per batch when streaming.
         */
        void phaseStarted(ImportPhase phase, int total) throws ImportCancelledException {
            if (!options.streaming()) {
                progress(phase, 0, total);
            }
        }

        void batchDone(ImportPhase phase, int processed, int total) throws ImportCancelledException {
            if (options.streaming()) {
                progress(phase, processed, total);
            }
        }

        void warn(ImportWarning warning) {
            warnings.add(warning);
            log.warn("Import warning type={} id={} reason={}", warning.recordType(), warning.recordId(), warning.reason());
        }

        void warn(String recordType, Object recordId, String reason) {
            warn(new ImportWarning(recordType, String.valueOf(recordId), reason));
        }

        // models

        void importModels(List<ApkgModel> archiveModels) throws ImportCancelledException {
            phaseStarted(ImportPhase.MODELS, archiveModels.size());
            List<ApkgModel> sorted = archiveModels.stream().sorted(Comparator.comparingLong(ApkgModel::id)).toList();
            for (ApkgModel raw : sorted) {
                String problem = modelProblem(raw);
                if (problem != null) {
                    warn("model", raw.id(), problem);
                    continue;
                }
                ModelEntity model = new ModelEntity(
                        remapper.assign(Table.MODEL, raw.id()),
                        raw.name().isBlank() ? "Imported " + raw.id() : raw.name().trim(),
                        raw.cloze() ? ModelType.CLOZE : ModelType.STANDARD,
                        raw.fields(),
                        raw.templates()
                );
                model.setSortField(raw.sortField() >= 0 && raw.sortField() < raw.fields().size() ? raw.sortField() : 0);
                model.setCss(raw.css());
                model.setMod(now);
                modelsByOriginalId.put(raw.id(), model);
                models.add(model);
                if (writeAsYouGo) {
                    store.insertModel(model);
                }
            }
            batchDone(ImportPhase.MODELS, models.size(), archiveModels.size());
        }

        private String modelProblem(ApkgModel raw) {
            if (raw.fields().isEmpty()) {
                return "Note type has no fields";
            }
            if (raw.templates().isEmpty()) {
                return "Note type has no card templates";
            }
            Set<String> names = new HashSet<>();
            for (String field : raw.fields()) {
                if (field == null || field.isBlank() || !names.add(field.toLowerCase(Locale.ROOT))) {
                    return "Note type has a blank or duplicate field name: " + field;
                }
            }
            return null;
        }

        // decks

        void importDecks(List<ApkgDeck> archiveDecks) throws ImportCancelledException {
            phaseStarted(ImportPhase.DECKS, archiveDecks.size());
            List<ApkgDeck> sorted = archiveDecks.stream().sorted(Comparator.comparingLong(ApkgDeck::id)).toList();
            for (ApkgDeck raw : sorted) {
                if (raw.filtered()) {
                    filteredDeckIds.add(raw.id());
                    log.debug("Skipping filtered deck id={} name={}", raw.id(), raw.name());
                    continue;
                }
                String name;
                try {
                    name = DeckHierarchy.normalize(raw.name());
                } catch (IllegalArgumentException ex) {
                    warn("deck", raw.id(), "Deck has no name");
                    continue;
                }
                String key = name.toLowerCase(Locale.ROOT);
                Long existing = deckIdsByName.get(key);
                if (existing == null) {
                    existing = store.findDeckByName(name).map(DeckEntity::getId).orElse(null);
                }
                if (existing != null) {
                    remapper.alias(Table.DECK, raw.id(), existing);
                    deckIdsByName.put(key, existing);
                    continue;
                }
                DeckEntity deck = new DeckEntity(
                        remapper.assign(Table.DECK, raw.id()),
                        name,
                        raw.newPerDay() != null ? raw.newPerDay() : schedulerProps.newPerDay(),
                        raw.reviewsPerDay() != null ? raw.reviewsPerDay() : schedulerProps.reviewsPerDay()
                );
                deck.setDescription(raw.description());
                deck.setMod(now);
                deckIdsByName.put(key, deck.getId());
                decks.add(deck);
                if (writeAsYouGo) {
                    store.insertDeck(deck);
                }
            }
            batchDone(ImportPhase.DECKS, archiveDecks.size(), archiveDecks.size());
        }

        // media

        void importMedia(ApkgArchive archive) throws ImportCancelledException {
            Map<String, String> manifest = archive.media();
            int total = manifest.size();
            phaseStarted(ImportPhase.MEDIA, total);
            Map<String, String> renames = new HashMap<>();
            Set<String> predicted = new HashSet<>();
            int processed = 0;
            for (Map.Entry<String, String> entry : manifest.entrySet()) {
                String token = entry.getKey();
                String originalName = entry.getValue();
                String stored = apply ? copyMedia(archive, token, originalName) : predictMedia(archive, token, originalName, predicted);
                if (stored != null) {
                    mediaMap.put(token, stored);
                    renames.put(token, stored);
                    if (!stored.equals(originalName)) {
                        renames.put(originalName, stored);
                    }
                }
                processed++;
                if (processed % batchSize == 0) {
                    batchDone(ImportPhase.MEDIA, processed, total);
                }
            }
            if (total > 0 && processed % batchSize != 0) {
                batchDone(ImportPhase.MEDIA, processed, total);
            }
            rewriter = new MediaReferenceRewriter(renames);
        }

        private String copyMedia(ApkgArchive archive, String token, String originalName) {
            try (InputStream in = archive.openMedia(token)) {
                if (in == null) {
                    warn("media", token, "Archive has no entry for " + originalName);
                    return null;
                }
                StoredMedia stored = mediaStorage.store(originalName, in);
                if (stored.created()) {
                    createdMedia.add(stored.name());
                }
                return stored.name();
            } catch (IOException ex) {
                warn("media", token, "Unreadable media file " + originalName + ": " + ex.getMessage());
                return null;
            }
        }

        /**
         * Name the file would get on import. Names already in storage are skipped, so when the stored
         * file has identical content the real import reuses it and the prediction is off; a warning
         * marks those predictions as tentative.
         */
        private String predictMedia(ApkgArchive archive, String token, String originalName, Set<String> predicted) {
            try (InputStream in = archive.openMedia(token)) {
                if (in == null) {
                    warn("media", token, "Archive has no entry for " + originalName);
                    return null;
                }
            } catch (IOException ex) {
                warn("media", token, "Unreadable media file " + originalName + ": " + ex.getMessage());
                return null;
            }
            String base = MediaFileNames.sanitize(originalName);
            String candidate = base;
            boolean clashed = false;
            for (int n = 1; ; n++) {
                if (mediaStorage.exists(candidate)) {
                    clashed = true;
                } else if (predicted.add(candidate)) {
                    break;
                }
                candidate = MediaFileNames.withSuffix(base, n);
            }
            if (clashed) {
                warn("media", token, "Tentative name " + candidate + " for " + originalName
                        + ": a stored file named " + base + " may be reused instead");
            }
            return candidate;
        }

        // notes

        void importNotes(ApkgArchive archive) throws ImportException {
            int total = parser.count(archive, ApkgImportParser.NOTES_TABLE);
            phaseStarted(ImportPhase.NOTES, total);
            int[] processed = {0};
            parser.forEachNote(archive, batchSize, batch -> {
                for (ApkgNote raw : batch) {
                    stageNote(raw);
                }
                processed[0] += batch.size();
                batchDone(ImportPhase.NOTES, processed[0], total);
            });
        }

        private void stageNote(ApkgNote raw) {
            ModelEntity model = modelsByOriginalId.get(raw.modelId());
            if (model == null) {
                warn("note", raw.id(), "Unknown note type " + raw.modelId());
                return;
            }
            List<String> values = NoteEntity.unpack(raw.fields());
            if (values.size() != model.getFields().size()) {
                warn("note", raw.id(), "Note has " + values.size() + " fields, note type expects " + model.getFields().size());
                return;
            }
            NoteEntity note = new NoteEntity(
                    remapper.assign(Table.NOTE, raw.id()),
                    raw.guid(),
                    model.getId(),
                    NoteEntity.pack(rewriter.rewriteAll(values)),
                    normalizeTags(raw.tags())
            );
            note.setMod(raw.mod() > 0 ? raw.mod() : now);
            Set<Integer> ords = new HashSet<>(NewCards.expectedOrds(model, note, clozeEngine));
            stagedNotes.put(raw.id(), new StagedNote(note, ords, positionBase + ++noteCount));
        }

        // cards

        void importCards(ApkgArchive archive, ApkgCollection collection) throws ImportException {
            int total = parser.count(archive, ApkgImportParser.CARDS_TABLE);
            phaseStarted(ImportPhase.CARDS, total);
            LocalDate archiveStart = studyDays.studyDate(Instant.ofEpochSecond(collection.createdAt()));
            int[] processed = {0};
            parser.forEachCard(archive, batchSize, batch -> {
                for (ApkgCard raw : batch) {
                    acceptCard(raw, archiveStart);
                }
                processed[0] += batch.size();
                batchDone(ImportPhase.CARDS, processed[0], total);
            });
        }

        private void acceptCard(ApkgCard raw, LocalDate archiveStart) {
            StagedNote staged = stagedNotes.get(raw.noteId());
            if (staged == null) {
                warn("card", raw.id(), "Unknown note " + raw.noteId());
                return;
            }
            long homeDeck = raw.originalDeckId() != 0 ? raw.originalDeckId() : raw.deckId();
            Long deckId = remapper.resolve(Table.DECK, homeDeck);
            if (deckId == null) {
                String reason = filteredDeckIds.contains(homeDeck)
                        ? "Card is in filtered deck " + homeDeck + " without a home deck"
                        : "Unknown deck " + homeDeck;
                warn("card", raw.id(), reason);
                return;
            }
            if (!staged.ords().contains(raw.ord())) {
                warn("card", raw.id(), "Card ordinal " + raw.ord() + " does not match a template or cloze deletion");
                return;
            }
            Set<Integer> used = usedOrds.computeIfAbsent(raw.noteId(), key -> new HashSet<>());
            if (used.contains(raw.ord())) {
                warn("card", raw.id(), "Duplicate card for note " + raw.noteId() + " ordinal " + raw.ord());
                return;
            }

            CardEntity card = new CardEntity(0, staged.note().getId(), deckId, raw.ord());
            card.setFlags(raw.flags());
            if (options.mode() == ImportMode.WITH_PROGRESS) {
                try {
                    applyProgress(card, raw, staged.position(), archiveStart);
                } catch (IllegalArgumentException ex) {
                    warn("card", raw.id(), ex.getMessage());
                    return;
                }
            } else {
                card.setType(CardType.NEW);
                card.setQueue(CardQueue.NEW);
                card.setDue(staged.position());
                card.setMod(now);
            }

            used.add(raw.ord());
            card.setId(remapper.assign(Table.CARD, raw.id()));
            if (!staged.written()) {
                notes.add(staged.note());
                staged.markWritten();
                if (writeAsYouGo) {
                    store.insertNote(staged.note());
                }
            }
            cards.add(card);
            if (writeAsYouGo) {
                store.insertCard(card);
            }
        }

        private void applyProgress(CardEntity card, ApkgCard raw, long position, LocalDate archiveStart) {
            CardType type = CardType.fromCode(raw.type());
            CardQueue queue = CardQueue.fromCode(raw.queue());
            long rawDue = raw.originalDeckId() != 0 && raw.originalDue() != 0 ? raw.originalDue() : raw.due();
            long due = switch (dueUnit(type, queue, rawDue)) {
                case POSITION -> position;
                case SECONDS -> rawDue;
                case DAY -> studyDays.dayNumber(archiveStart.plusDays(rawDue));
            };
            card.setType(type);
            card.setQueue(queue);
            card.setDue(due);
            card.setInterval(Math.max(0, raw.interval()));
            card.setEaseFactor(raw.factor());
            card.setReps(raw.reps());
            card.setLapses(raw.lapses());
            card.setRemainingSteps(raw.left() % 1000);
            card.setMod(raw.mod() > 0 ? raw.mod() : now);
        }

        // review log

        void importReviews(ApkgArchive archive) throws ImportException {
            int total = parser.count(archive, ApkgImportParser.REVLOG_TABLE);
            phaseStarted(ImportPhase.REVIEW_LOG, total);
            int[] processed = {0};
            parser.forEachReview(archive, batchSize, batch -> {
                List<ReviewLogEntity> accepted = new ArrayList<>();
                for (ApkgReview raw : batch) {
                    ReviewLogEntity entry = toReviewLog(raw);
                    if (entry != null) {
                        accepted.add(entry);
                    }
                }
                reviewLogs.addAll(accepted);
                if (writeAsYouGo) {
                    accepted.forEach(store::appendReviewLog);
                }
                processed[0] += batch.size();
                batchDone(ImportPhase.REVIEW_LOG, processed[0], total);
            });
        }

        private ReviewLogEntity toReviewLog(ApkgReview raw) {
            Long cardId = remapper.resolve(Table.CARD, raw.cardId());
            if (cardId == null) {
                warn("review", raw.id(), "Unknown card " + raw.cardId());
                return null;
            }
            if (raw.type() >= REVLOG_MANUAL) {
                log.debug("Skipping manual review log entry id={} type={}", raw.id(), raw.type());
                return null;
            }
            if (raw.ease() < 1 || raw.ease() > 4) {
                warn("review", raw.id(), "Rating " + raw.ease() + " is out of range");
                return null;
            }
            ReviewKind kind = ReviewKind.fromCode(raw.type());
            CardType previousType = switch (kind) {
                case LEARN -> learnedCards.add(cardId) ? CardType.NEW : CardType.LEARNING;
                case RELEARN -> CardType.RELEARNING;
                case REVIEW, FILTERED -> CardType.REVIEW;
            };
            return new ReviewLogEntity(
                    raw.id(),
                    cardId,
                    raw.ease(),
                    raw.interval(),
                    raw.lastInterval(),
                    raw.factor(),
                    raw.timeMs(),
                    kind,
                    previousType
            );
        }

        // finishing

        void dropNotesWithoutCards() {
            for (Map.Entry<Long, StagedNote> entry : stagedNotes.entrySet()) {
                if (!entry.getValue().written()) {
                    warn("note", entry.getKey(), "Note has no valid cards");
                }
            }
        }

        void commit() throws ImportCancelledException {
            progress(ImportPhase.COMMITTING, 0, cards.size());
            if (!apply || writeAsYouGo) {
                return;
            }
            models.forEach(store::insertModel);
            decks.forEach(store::insertDeck);
            notes.forEach(store::insertNote);
            cards.forEach(store::insertCard);
            reviewLogs.forEach(store::appendReviewLog);
        }

        ImportResult result() {
            return new ImportResult(
                    options.mode(),
                    models,
                    decks,
                    notes.stream().sorted(Comparator.comparingLong(NoteEntity::getId)).toList(),
                    cards,
                    reviewLogs,
                    mediaMap,
                    warnings,
                    apply
            );
        }
    }

    private static DueUnit dueUnit(CardType type, CardQueue queue, long rawDue) {
        if (queue.isActive()) {
            return switch (queue) {
                case NEW -> DueUnit.POSITION;
                case LEARNING -> DueUnit.SECONDS;
                default -> DueUnit.DAY;
            };
        }
        return switch (type) {
            case NEW -> DueUnit.POSITION;
            case REVIEW -> DueUnit.DAY;
            case LEARNING, RELEARNING -> rawDue >= EPOCH_SECONDS_THRESHOLD ? DueUnit.SECONDS : DueUnit.DAY;
        };
    }

    private static String normalizeTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return "";
        }
        return NoteEntity.joinTags(Arrays.asList(tags.trim().split("\\s+")));
    }

    private enum DueUnit {
        POSITION, SECONDS, DAY
    }

    private static final class StagedNote {

        private final NoteEntity note;
        private final Set<Integer> ords;
        private final long position;
        private boolean written;

        StagedNote(NoteEntity note, Set<Integer> ords, long position) {
            this.note = note;
            this.ords = ords;
            this.position = position;
        }

        NoteEntity note() {
            return note;
        }

        Set<Integer> ords() {
            return ords;
        }

        long position() {
            return position;
        }

        boolean written() {
            return written;
        }

        void markWritten() {
            written = true;
        }
    }
}
