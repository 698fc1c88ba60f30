package app.cardwise.importer.service.parser;

/**
 * @param newPerDay     daily new limit from the deck's options group, {@code null} when unknown
 * @param reviewsPerDay daily review limit from the deck's options group, {@code null} when unknown
 */
public record ApkgDeck(long id, String name, boolean filtered, String description, Integer newPerDay, Integer reviewsPerDay) {
}
