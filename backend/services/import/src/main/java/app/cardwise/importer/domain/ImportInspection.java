package app.cardwise.importer.domain;

/**
 * Quick look at an archive before importing it.
 *
 * @param hasProgress some card has been studied, so {@link ImportMode#WITH_PROGRESS} makes a difference
 */
public record ImportInspection(int notes, int cards, int studiedCards, int reviewLogEntries, int mediaFiles, boolean hasProgress) {
}
