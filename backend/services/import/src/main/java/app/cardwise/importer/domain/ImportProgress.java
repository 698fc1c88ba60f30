package app.cardwise.importer.domain;

/**
 * @param processed records handled so far in this phase
 * @param total     records in this phase, {@code -1} when unknown
 */
public record ImportProgress(ImportPhase phase, int processed, int total) {

    public static ImportProgress of(ImportPhase phase) {
        return new ImportProgress(phase, 0, -1);
    }

    /**
     * Human readable form, e.g. {@code Importing notes 400/412…}.
     */
    public String message() {
        if (processed <= 0 && total < 0) {
            return phase.label() + "…";
        }
        if (total < 0) {
            return phase.label() + " " + processed + "…";
        }
        return phase.label() + " " + processed + "/" + total + "…";
    }
}
