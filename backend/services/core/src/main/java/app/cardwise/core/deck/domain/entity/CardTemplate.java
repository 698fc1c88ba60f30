package app.cardwise.core.deck.domain.entity;

public record CardTemplate(String name, int ord, String questionFormat, String answerFormat) {
}
