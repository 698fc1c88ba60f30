package app.cardwise.importer.service;

import app.cardwise.importer.domain.ImportPhase;

/**
 * The progress listener asked to stop. The store and media directory are back to their state before
 * the import started.
 */
public class ImportCancelledException extends ImportException {

    private final ImportPhase phase;

    public ImportCancelledException(ImportPhase phase) {
        super("Import cancelled during " + phase.name().toLowerCase());
        this.phase = phase;
    }

    public ImportPhase phase() {
        return phase;
    }
}
