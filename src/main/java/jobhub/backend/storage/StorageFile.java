package jobhub.backend.storage;

/** A stored object's key and size in bytes. */
public record StorageFile(String key, long size) {
}
