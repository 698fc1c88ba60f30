package app.cardwise.importer.service.parser;

public record ApkgReview(long id, long cardId, int ease, int interval, int lastInterval, int factor, long timeMs, int type) {
}
