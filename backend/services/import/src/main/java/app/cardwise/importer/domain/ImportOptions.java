package app.cardwise.importer.domain;

import app.cardwise.importer.service.ImportProgressListener;

/**
 * @param streaming read and commit per batch, reporting progress after each one
 */
public record ImportOptions(boolean streaming, ImportMode mode, ImportProgressListener listener) {

    public ImportOptions {
        if (mode == null) {
            mode = ImportMode.FRESH;
        }
        if (listener == null) {
            listener = ImportProgressListener.NONE;
        }
    }

    public static ImportOptions defaults() {
        return new ImportOptions(false, ImportMode.FRESH, null);
    }

    public static ImportOptions streaming(ImportMode mode, ImportProgressListener listener) {
        return new ImportOptions(true, mode, listener);
    }
}
