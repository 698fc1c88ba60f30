package app.cardwise.core.search;

public record SearchStats(int notes, int distinctTokens) {
}
