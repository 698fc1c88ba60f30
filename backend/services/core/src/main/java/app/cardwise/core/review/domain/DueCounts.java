package app.cardwise.core.review.domain;

public record DueCounts(int learning, int review, int newCards) {

    public int total() {
        return learning + review + newCards;
    }
}
