package app.cardwise.importer.service.parser;

public record ApkgNote(long id, String guid, long modelId, String fields, String tags, long mod) {
}
