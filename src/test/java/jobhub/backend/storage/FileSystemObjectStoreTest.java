package jobhub.backend.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemObjectStoreTest {

    @TempDir
    Path root;

    private FileSystemObjectStore store;

    @BeforeEach
    void setup() {
        UrlSigner signer = new UrlSigner("http://localhost:8080/objects", "secret".getBytes(StandardCharsets.UTF_8),
                Duration.ofMinutes(10));
        store = new FileSystemObjectStore(root.resolve("store"), signer);
    }

    @Test
    void keysMapToFiles() throws Exception {
        store.put("jobs/repo/job-1", "{}".getBytes(StandardCharsets.UTF_8));

        assertTrue(Files.isRegularFile(store.root().resolve("jobs/repo/job-1")));
        assertEquals("{}", new String(store.get("jobs/repo/job-1").orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void listWalksNestedDirectories() {
        store.put("artifacts/repo/job-1/out/a.txt", new byte[3]);
        store.put("artifacts/repo/job-1/out/sub/b.txt", new byte[5]);
        store.put("artifacts/repo/job-2/out/c.txt", new byte[1]);

        assertEquals(List.of("artifacts/repo/job-1/out/a.txt", "artifacts/repo/job-1/out/sub/b.txt"),
                store.list("artifacts/repo/job-1/"));
        assertEquals(List.of(new StorageFile("artifacts/repo/job-2/out/c.txt", 1)),
                store.listFiles("artifacts/repo/job-2"));
        assertTrue(store.list("nothing/").isEmpty());
    }

    @Test
    void putIfAbsent() {
        assertTrue(store.putIfAbsent("run-names/repo/a-1", new byte[0]));
        assertFalse(store.putIfAbsent("run-names/repo/a-1", new byte[0]));
    }

    @Test
    void deletePrefixRemovesEverything() {
        store.put("cache/repo/alice/train/a", new byte[1]);
        store.put("cache/repo/alice/train/b/c", new byte[1]);

        assertEquals(2, store.deletePrefix("cache/repo/alice/train/"));
        assertFalse(store.exists("cache/repo/alice/train/a"));
        store.delete("cache/repo/alice/train/a");
    }

    @Test
    void keysCannotEscapeRoot() {
        assertThrows(IllegalArgumentException.class, () -> store.put("../outside", new byte[1]));
        assertThrows(IllegalArgumentException.class, () -> store.get("/etc/passwd"));
    }
}
