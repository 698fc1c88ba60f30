package app.cardwise.core.cloze;

public record ClozePreview(int index, String preview) {
}
