package jobhub.backend.service;

import jobhub.backend.error.NotFoundException;
import jobhub.backend.error.StorageException;
import jobhub.backend.model.Artifact;
import jobhub.backend.model.ArtifactFile;
import jobhub.backend.repository.ObjectStoreJobRepository;
import jobhub.backend.storage.FileSystemObjectStore;
import jobhub.backend.storage.Keys;
import jobhub.backend.storage.UrlSigner;
import jobhub.backend.support.FakeCompute;
import jobhub.backend.support.Jobs;
import jobhub.backend.support.Stores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactManagerTest {

    @TempDir
    Path dir;

    private FileSystemObjectStore store;
    private ArtifactManager artifacts;

    @BeforeEach
    void setup() {
        store = Stores.fileSystem(dir);
        ObjectStoreJobRepository repository = new ObjectStoreJobRepository(store);
        JobStore jobStore = new JobStore(repository, new FakeCompute(), Clock.systemUTC());
        jobStore.createJob(Jobs.job("repo", "run-1", "job-1").build());
        jobStore.createJob(Jobs.job("repo", "run-1", "job-2").build());
        artifacts = new ArtifactManager(store, repository, 2);
    }

    @AfterEach
    void teardown() {
        artifacts.close();
    }

    @Test
    void listsFilesPerJobAndArtifact() {
        put("job-1", "output", "model.bin", 10);
        put("job-1", "output", "logs/train.log", 4);
        put("job-2", "output", "model.bin", 7);
        put("job-1", "checkpoints", "step-1.pt", 3);

        List<Artifact> result = artifacts.listRunArtifactFiles("repo", "run-1", null, true);

        assertEquals(3, result.size());
        assertEquals(new Artifact("job-1", "checkpoints", List.of(ArtifactFile.file("step-1.pt", 3))), result.get(0));
        assertEquals(new Artifact("job-1", "output", List.of(
                ArtifactFile.file("logs/train.log", 4),
                ArtifactFile.file("model.bin", 10))), result.get(1));
        assertEquals("job-2", result.get(2).jobId());
    }

    @Test
    void prefixFiltersAndEmptyArtifactsAreOmitted() {
        put("job-1", "output", "logs/train.log", 4);
        put("job-1", "output", "model.bin", 10);
        put("job-2", "output", "model.bin", 7);

        List<Artifact> result = artifacts.listRunArtifactFiles("repo", "run-1", "logs/", true);

        assertEquals(1, result.size());
        assertEquals(List.of(ArtifactFile.file("logs/train.log", 4)), result.get(0).files());
    }

    @Test
    void nonRecursiveGroupsDirectories() {
        put("job-1", "output", "model.bin", 10);
        put("job-1", "output", "logs/train.log", 4);
        put("job-1", "output", "logs/eval/eval.log", 6);

        List<ArtifactFile> top = artifacts.listRunArtifactFiles("repo", "run-1", "", false).get(0).files();
        assertEquals(List.of(ArtifactFile.directory("logs/", 10), ArtifactFile.file("model.bin", 10)), top);

        List<ArtifactFile> logs = artifacts.listRunArtifactFiles("repo", "run-1", "logs/", false).get(0).files();
        assertEquals(List.of(ArtifactFile.directory("logs/eval/", 6), ArtifactFile.file("logs/train.log", 4)), logs);
    }

    @Test
    void downloadWritesUnderArtifactName(@TempDir Path out) throws Exception {
        put("job-1", "output", "model.bin", 10);
        put("job-1", "output", "logs/train.log", 4);

        DownloadReport report = artifacts.downloadRunArtifactFiles("repo", "run-1", out, null);

        assertTrue(report.isComplete());
        assertEquals(2, report.downloaded().size());
        assertEquals(10, Files.size(out.resolve("output/model.bin")));
        assertEquals(4, Files.size(out.resolve("output/logs/train.log")));
    }

    @Test
    void vanishedAndFailingObjectsAreReported(@TempDir Path out) throws Exception {
        String vanished = Keys.artifact("repo", "job-1", "output", "gone.bin");
        String broken = Keys.artifact("repo", "job-2", "output", "broken.bin");
        FlakyStore flaky = new FlakyStore(dir.resolve("flaky"), Stores.signer(), vanished, broken);
        ObjectStoreJobRepository repository = new ObjectStoreJobRepository(flaky);
        JobStore jobStore = new JobStore(repository, new FakeCompute(), Clock.systemUTC());
        jobStore.createJob(Jobs.job("repo", "run-1", "job-1").build());
        jobStore.createJob(Jobs.job("repo", "run-1", "job-2").build());
        flaky.put(Keys.artifact("repo", "job-1", "output", "model.bin"), new byte[5]);
        flaky.put(vanished, new byte[2]);
        flaky.put(broken, new byte[3]);

        try (ArtifactManager manager = new ArtifactManager(flaky, repository, 2)) {
            DownloadReport report = manager.downloadRunArtifactFiles("repo", "run-1", out, null);

            assertFalse(report.isComplete());
            assertEquals(List.of(Keys.artifact("repo", "job-1", "output", "model.bin")), report.downloaded());
            assertEquals(List.of(vanished), report.missing());
            assertEquals(Map.of(broken, "disk error"), report.failed());
            assertEquals(5, Files.size(out.resolve("output/model.bin")));
            assertFalse(Files.exists(out.resolve("output/gone.bin")));
        }
    }

    @Test
    void downloadOfRunWithoutArtifactsIsEmpty(@TempDir Path out) {
        DownloadReport report = artifacts.downloadRunArtifactFiles("repo", "run-1", out, null);

        assertTrue(report.isComplete());
        assertTrue(report.downloaded().isEmpty());
    }

    @Test
    void uploadDirectoryTree(@TempDir Path local) throws Exception {
        Files.createDirectories(local.resolve("sub"));
        Files.writeString(local.resolve("a.txt"), "a");
        Files.writeString(local.resolve("sub/b.txt"), "bb");

        List<String> keys = artifacts.uploadJobArtifactFiles("repo", "job-1", "output", "data", local);

        assertEquals(List.of(
                Keys.artifact("repo", "job-1", "output", "data/a.txt"),
                Keys.artifact("repo", "job-1", "output", "data/sub/b.txt")), keys);
        assertEquals("bb", new String(store.get(keys.get(1)).orElseThrow(), StandardCharsets.UTF_8));
        assertEquals(keys, artifacts.listJobArtifactKeys("repo", "job-1"));
    }

    @Test
    void uploadSingleFile(@TempDir Path local) throws Exception {
        Path file = Files.writeString(local.resolve("weights.bin"), "w");

        List<String> keys = artifacts.uploadJobArtifactFiles("repo", "job-2", "model", null, file);

        assertEquals(List.of(Keys.artifact("repo", "job-2", "model", "weights.bin")), keys);
    }

    @Test
    void uploadOfMissingPathFails(@TempDir Path local) {
        assertThrows(NotFoundException.class,
                () -> artifacts.uploadJobArtifactFiles("repo", "job-1", "output", null, local.resolve("nope")));
    }

    @Test
    void deleteWorkflowCacheOnlyTouchesThatWorkflow() {
        store.put(Keys.workflowCachePrefix("repo", "alice", "train") + "pip/a", new byte[1]);
        store.put(Keys.workflowCachePrefix("repo", "alice", "eval") + "pip/a", new byte[1]);

        artifacts.deleteWorkflowCache("repo", "alice", "train");

        assertTrue(store.list(Keys.workflowCachePrefix("repo", "alice", "train")).isEmpty());
        assertEquals(1, store.list(Keys.workflowCachePrefix("repo", "alice", "eval")).size());
    }

    private void put(String jobId, String name, String path, int size) {
        store.put(Keys.artifact("repo", jobId, name, path), new byte[size]);
    }

    /** Deletes one object right before it is downloaded and fails another */
    private static final class FlakyStore extends FileSystemObjectStore {
        private final String vanishing;
        private final String failing;

        FlakyStore(Path root, UrlSigner signer, String vanishing, String failing) {
            super(root, signer);
            this.vanishing = vanishing;
            this.failing = failing;
        }

        @Override
        public boolean getFile(String key, Path destination) {
            if (key.equals(failing)) {
                throw new StorageException("disk error", null);
            }
            if (key.equals(vanishing)) {
                delete(key);
            }
            return super.getFile(key, destination);
        }
    }
}
