package app.cardwise.importer.service.parser;

import app.cardwise.importer.service.ImportException;

import java.util.List;

@FunctionalInterface
public interface BatchHandler<T> {

    void accept(List<T> batch) throws ImportException;
}
