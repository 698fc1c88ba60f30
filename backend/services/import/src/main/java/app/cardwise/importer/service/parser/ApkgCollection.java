package app.cardwise.importer.service.parser;

import java.util.List;

/**
 * @param createdAt collection creation time in epoch seconds; review due days count from its day
 */
public record ApkgCollection(long createdAt, List<ApkgModel> models, List<ApkgDeck> decks) {
}
