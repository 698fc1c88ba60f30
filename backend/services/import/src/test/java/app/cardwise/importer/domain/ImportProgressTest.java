package app.cardwise.importer.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ImportProgressTest {

    @Test
    void message_formatsKnownAndUnknownTotals() {
        assertEquals("Opening archive…", ImportProgress.of(ImportPhase.OPENING).message());
        assertEquals("Importing cards 400/412…", new ImportProgress(ImportPhase.CARDS, 400, 412).message());
        assertEquals("Importing review history 50…", new ImportProgress(ImportPhase.REVIEW_LOG, 50, -1).message());
    }
}
