package app.cardwise.importer.service;

import app.cardwise.importer.domain.ImportProgress;

/**
 * Receives progress between batches. Returning {@code false} aborts the import.
 */
@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = progress -> true;

    boolean onProgress(ImportProgress progress);
}
