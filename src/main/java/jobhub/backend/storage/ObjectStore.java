package jobhub.backend.storage;

import jobhub.backend.error.StorageException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Namespaced key-value blob store every backend component is built on.
 * <p>
 * Keys are {@code /}-separated paths. Writes are last-writer-wins per key.
 * A {@code put} is not guaranteed to be visible in a {@code list} issued by another process
 * right away; callers must not depend on it for correctness.
 */
public interface ObjectStore {

    void put(String key, byte[] content);

    /**
     * Write only when the key is absent.
     *
     * @return false if the key already existed (nothing written)
     */
    default boolean putIfAbsent(String key, byte[] content) {
        if (exists(key)) {
            return false;
        }
        put(key, content);
        return true;
    }

    Optional<byte[]> get(String key);

    default boolean exists(String key) {
        return get(key).isPresent();
    }

    /** Delete a key. Deleting an absent key is not an error. */
    void delete(String key);

    /** Delete every key starting with the prefix */
    default int deletePrefix(String prefix) {
        List<String> keys = list(prefix);
        keys.forEach(this::delete);
        return keys.size();
    }

    /** Keys starting with the prefix, ordered by key */
    List<String> list(String prefix);

    /** Keys and sizes starting with the prefix, ordered by key */
    List<StorageFile> listFiles(String prefix);

    default void putFile(String key, Path source) {
        try {
            put(key, Files.readAllBytes(source));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + source, e);
        }
    }

    /**
     * Download an object into {@code destination}, creating parent directories.
     *
     * @return false when the object does not exist
     */
    default boolean getFile(String key, Path destination) {
        Optional<byte[]> content = get(key);
        if (content.isEmpty()) {
            return false;
        }
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(destination, content.get());
            return true;
        } catch (IOException e) {
            throw new StorageException("Cannot write " + destination, e);
        }
    }

    /** URL granting {@code mode} access to one key for a bounded time */
    URL signedUrl(String key, SignedUrlMode mode);
}
