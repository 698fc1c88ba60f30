package app.cardwise.core.media.storage;

/**
 * @param name    file name used in storage
 * @param created {@code false} when identical content was already stored under {@code name}
 */
public record StoredMedia(String name, boolean created) {
}
