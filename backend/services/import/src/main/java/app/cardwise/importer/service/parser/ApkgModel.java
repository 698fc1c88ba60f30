package app.cardwise.importer.service.parser;

import app.cardwise.core.deck.domain.entity.CardTemplate;

import java.util.List;

public record ApkgModel(long id, String name, boolean cloze, List<String> fields, List<CardTemplate> templates, int sortField, String css) {
}
