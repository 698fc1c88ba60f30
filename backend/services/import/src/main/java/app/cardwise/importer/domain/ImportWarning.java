package app.cardwise.importer.domain;

/**
 * A record skipped during import, or a dry-run prediction that may not hold.
 *
 * @param recordType {@code model}, {@code deck}, {@code note}, {@code card}, {@code review} or {@code media}
 * @param recordId   the record's id or token in the archive
 */
public record ImportWarning(String recordType, String recordId, String reason) {

    @Override
    public String toString() {
        return recordType + " " + recordId + ": " + reason;
    }
}
