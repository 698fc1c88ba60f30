package app.cardwise.importer.cli;

import app.cardwise.core.persistence.StorePersistence;
import app.cardwise.core.store.EntityStore;
import app.cardwise.importer.config.ImportProps;
import app.cardwise.importer.domain.ImportMode;
import app.cardwise.importer.domain.ImportOptions;
import app.cardwise.importer.domain.ImportResult;
import app.cardwise.importer.domain.ImportWarning;
import app.cardwise.importer.service.ImportException;
import app.cardwise.importer.service.PackageImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Imports the archives given as {@code --import=<path>} and saves the store afterwards.
 * {@code --mode=with_progress} keeps scheduling state; {@code --dry-run} only parses.
 * An unknown mode is logged and nothing is imported.
 */
@Component
public class ImportCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ImportCommandRunner.class);

    private final PackageImporter importer;
    private final StorePersistence persistence;
    private final EntityStore store;
    private final ImportProps props;

    public ImportCommandRunner(PackageImporter importer, StorePersistence persistence, EntityStore store, ImportProps props) {
        this.importer = importer;
        this.persistence = persistence;
        this.store = store;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getOptionValues("import");
        if (files == null || files.isEmpty()) {
            return;
        }
        Optional<ImportMode> resolved = resolveMode(args);
        if (resolved.isEmpty()) {
            return;
        }
        ImportMode mode = resolved.get();
        boolean dryRun = args.containsOption("dry-run");
        ImportOptions options = ImportOptions.streaming(mode, progress -> {
            log.info("{}", progress.message());
            return true;
        });

        int imported = 0;
        for (String file : files) {
            Path path = Path.of(file);
            try {
                ImportResult result = dryRun ? importer.parse(path, options) : importer.importPackage(path, options);
                for (ImportWarning warning : result.warnings()) {
                    log.info("Import warning file={} warning={}", path.getFileName(), warning);
                }
                imported += result.applied() ? 1 : 0;
            } catch (ImportException ex) {
                log.error("Import aborted file={} error={}", path.getFileName(), ex.getMessage());
            }
        }
        if (imported > 0 && !persistence.save(store)) {
            log.error("Imported archives could not be saved count={}", imported);
        }
    }

    private Optional<ImportMode> resolveMode(ApplicationArguments args) {
        List<String> values = args.getOptionValues("mode");
        if (values == null || values.isEmpty()) {
            return Optional.of(props.defaultMode());
        }
        String raw = values.get(0);
        try {
            return Optional.of(ImportMode.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            log.error("Unknown import mode value={} allowed={}", raw,
                    Arrays.stream(ImportMode.values()).map(m -> m.name().toLowerCase(Locale.ROOT)).toList());
            return Optional.empty();
        }
    }
}
