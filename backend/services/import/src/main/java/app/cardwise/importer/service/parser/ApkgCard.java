package app.cardwise.importer.service.parser;

/**
 * Raw card row; {@code type} and {@code queue} are the archive's integer codes.
 */
public record ApkgCard(
        long id,
        long noteId,
        long deckId,
        int ord,
        int type,
        int queue,
        long due,
        int interval,
        int factor,
        int reps,
        int lapses,
        int left,
        long originalDue,
        long originalDeckId,
        int flags,
        long mod
) {
}
