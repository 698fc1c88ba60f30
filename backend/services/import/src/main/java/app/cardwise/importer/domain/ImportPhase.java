package app.cardwise.importer.domain;

public enum ImportPhase {
    OPENING("Opening archive"),
    MODELS("Importing note types"),
    DECKS("Importing decks"),
    MEDIA("Importing media files"),
    NOTES("Importing notes"),
    CARDS("Importing cards"),
    REVIEW_LOG("Importing review history"),
    COMMITTING("Saving"),
    COMPLETED("Import finished");

    private final String label;

    ImportPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
