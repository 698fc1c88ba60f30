package app.cardwise.core.search;

/**
 * @param deckId only notes with a card in this deck or one of its descendants
 * @param tag    only notes carrying this tag
 * @param limit  maximum number of results, {@value #DEFAULT_LIMIT} when {@code null}
 */
public record SearchOptions(Long deckId, String tag, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;

    public SearchOptions {
        if (limit == null || limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(null, null, null);
    }

    public static SearchOptions inDeck(long deckId) {
        return new SearchOptions(deckId, null, null);
    }

    public static SearchOptions withTag(String tag) {
        return new SearchOptions(null, tag, null);
    }
}
