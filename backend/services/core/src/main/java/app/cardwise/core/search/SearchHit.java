package app.cardwise.core.search;

public record SearchHit(long noteId, int score) {
}
