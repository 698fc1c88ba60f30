package app.cardwise.importer.service;

import java.io.IOException;

/**
 * The archive cannot be imported at all: unreadable container or database, or required tables missing.
 * Nothing from the archive has been applied when this is thrown.
 */
public class ImportException extends IOException {

    public ImportException(String message) {
        super(message);
    }

    public ImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
