package jobhub.backend.storage;

import jobhub.backend.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * ObjectStore over a local directory tree: key {@code a/b/c} is file {@code <root>/a/b/c}.
 * Writes go through a temporary file and an atomic move so readers never see partial content.
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);
    private static final String TMP_SUFFIX = ".jobhub-tmp";

    private final Path root;
    private final UrlSigner urlSigner;

    public FileSystemObjectStore(Path root, UrlSigner urlSigner) {
        this.root = root.toAbsolutePath().normalize();
        this.urlSigner = urlSigner;
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage root " + this.root, e);
        }
        log.info("File system object store at {}", this.root);
    }

    public Path root() {
        return root;
    }

    @Override
    public void put(String key, byte[] content) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TMP_SUFFIX);
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to put object " + key, e);
        }
        log.debug("Put object {} ({} bytes)", key, content.length);
    }

    @Override
    public boolean putIfAbsent(String key, byte[] content) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("Object {} already exists", key);
            return false;
        } catch (IOException e) {
            throw new StorageException("Failed to create object " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path path = resolve(key);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (Files.isDirectory(path)) {
                return Optional.empty();
            }
            throw new StorageException("Failed to get object " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete object " + key, e);
        }
        log.debug("Deleted object {}", key);
    }

    @Override
    public List<String> list(String prefix) {
        return listFiles(prefix).stream().map(StorageFile::key).toList();
    }

    @Override
    public List<StorageFile> listFiles(String prefix) {
        // Walk from the deepest directory fully named by the prefix
        int slash = prefix.lastIndexOf('/');
        Path start = slash >= 0 ? resolve(prefix.substring(0, slash)) : root;
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        List<StorageFile> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(start)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().endsWith(TMP_SUFFIX))
                    .forEach(p -> {
                        String key = toKey(p);
                        long size = key.startsWith(prefix) ? sizeOf(p) : -1;
                        if (size >= 0) {
                            files.add(new StorageFile(key, size));
                        }
                    });
        } catch (IOException e) {
            throw new StorageException("Failed to list " + prefix, e);
        }
        files.sort(Comparator.comparing(StorageFile::key));
        return files;
    }

    @Override
    public void putFile(String key, Path source) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TMP_SUFFIX);
            Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to upload " + source + " to " + key, e);
        }
    }

    @Override
    public boolean getFile(String key, Path destination) {
        Path source = resolve(key);
        if (!Files.isRegularFile(source)) {
            return false;
        }
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new StorageException("Failed to download " + key + " to " + destination, e);
        }
    }

    @Override
    public URL signedUrl(String key, SignedUrlMode mode) {
        resolve(key);
        return urlSigner.sign(key, mode);
    }

    // --- Helpers ---

    private Path resolve(String key) {
        if (key.isEmpty() || key.startsWith("/")) {
            throw new IllegalArgumentException("Invalid object key: '" + key + "'");
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Object key escapes storage root: " + key);
        }
        return path;
    }

    private String toKey(Path path) {
        return root.relativize(path).toString().replace(path.getFileSystem().getSeparator(), "/");
    }

    /** Size in bytes, -1 when the file vanished concurrently */
    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (NoSuchFileException e) {
            return -1;
        } catch (IOException e) {
            throw new StorageException("Cannot stat " + path, e);
        }
    }
}
