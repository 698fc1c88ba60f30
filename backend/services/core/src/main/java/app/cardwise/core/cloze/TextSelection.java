package app.cardwise.core.cloze;

public record TextSelection(int start, int end) {

    public TextSelection {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid selection: start=" + start + ", end=" + end);
        }
    }
}
