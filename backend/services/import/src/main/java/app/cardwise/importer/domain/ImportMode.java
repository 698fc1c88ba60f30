package app.cardwise.importer.domain;

public enum ImportMode {
    /**
     * Every card starts over as new; the review log is not imported.
     */
    FRESH,
    /**
     * Queue, interval, ease, due and review log are kept as the archive has them.
     */
    WITH_PROGRESS
}
