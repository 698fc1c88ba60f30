package app.cardwise.core.media.storage;

import java.nio.file.Path;

public record MediaReference(String name, Path path, long size, String contentType) {
}
