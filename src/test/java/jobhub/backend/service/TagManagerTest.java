package jobhub.backend.service;

import jobhub.backend.error.RunNotFoundException;
import jobhub.backend.model.ArtifactHead;
import jobhub.backend.model.Job;
import jobhub.backend.model.JobStatus;
import jobhub.backend.model.TagHead;
import jobhub.backend.repository.ObjectStoreJobRepository;
import jobhub.backend.storage.FileSystemObjectStore;
import jobhub.backend.storage.Keys;
import jobhub.backend.support.FakeCompute;
import jobhub.backend.support.Jobs;
import jobhub.backend.support.Stores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dir;

    private FileSystemObjectStore store;
    private ObjectStoreJobRepository repository;
    private JobStore jobStore;
    private ArtifactManager artifacts;
    private TagManager tags;

    @BeforeEach
    void setup() {
        store = Stores.fileSystem(dir);
        repository = new ObjectStoreJobRepository(store);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        jobStore = new JobStore(repository, new FakeCompute(), clock);
        jobStore.createJob(Jobs.job("repo", "run-1", "job-1").build());
        jobStore.createJob(Jobs.job("repo", "run-2", "job-2").build());
        artifacts = new ArtifactManager(store, repository, 2);
        tags = new TagManager(store, jobStore, artifacts, clock);
        store.put(Keys.artifact("repo", "job-1", "output", "model.bin"), new byte[3]);
    }

    @AfterEach
    void teardown() {
        artifacts.close();
    }

    @Test
    void tagFromRunCapturesArtifacts() {
        TagHead tag = tags.createTagFromRun("repo", "v1", "run-1", null);

        assertEquals("run-1", tag.runName());
        assertEquals(NOW, tag.createdAt());
        assertFalse(tag.local());
        assertEquals(List.of("job-1"), tag.jobIds());
        assertEquals(List.of(new ArtifactHead("job-1", "output")), tag.artifactHeads());
        assertEquals(List.of(Keys.artifact("repo", "job-1", "output", "model.bin")), tag.objectKeys());
        assertEquals("v1", repository.findById("repo", "job-1").orElseThrow().tagName());
        assertEquals(tag, tags.getTagHead("repo", "v1").orElseThrow());
    }

    @Test
    void tagOfUnknownRunFails() {
        assertThrows(RunNotFoundException.class, () -> tags.createTagFromRun("repo", "v1", "missing", null));
    }

    @Test
    void retaggingMovesTheName() {
        tags.createTagFromRun("repo", "latest", "run-1", null);
        tags.createTagFromRun("repo", "latest", "run-2", null);

        assertNull(repository.findById("repo", "job-1").orElseThrow().tagName());
        assertEquals("latest", repository.findById("repo", "job-2").orElseThrow().tagName());
        assertEquals(1, tags.listTagHeads("repo").size());
    }

    @Test
    void deleteTagKeepsArtifacts() {
        TagHead tag = tags.createTagFromRun("repo", "v1", "run-1", null);

        tags.deleteTag("repo", tag);

        assertTrue(tags.getTagHead("repo", "v1").isEmpty());
        assertNull(repository.findById("repo", "job-1").orElseThrow().tagName());
        assertTrue(store.exists(Keys.artifact("repo", "job-1", "output", "model.bin")));
    }

    @Test
    void tagFromLocalDirs(@TempDir Path local) throws Exception {
        Path data = Files.createDirectories(local.resolve("data"));
        Files.writeString(data.resolve("train.csv"), "x,y");
        Path weights = Files.createDirectories(local.resolve("weights"));
        Files.writeString(weights.resolve("w.bin"), "w");

        TagHead tag = tags.createTagFromLocalDirs("repo", "alice", "dataset", List.of(data, weights),
                List.of("data", "weights"));

        assertTrue(tag.local());
        assertNull(tag.runName());
        assertEquals(List.of("tag-dataset-0", "tag-dataset-1"), tag.jobIds());
        assertEquals(List.of(
                Keys.artifact("repo", "tag-dataset-0", "data", "train.csv"),
                Keys.artifact("repo", "tag-dataset-1", "weights", "w.bin")), tag.objectKeys());
    }

    @Test
    void replacingLocalTagKeepsPreviousObjects(@TempDir Path local) throws Exception {
        Path first = Files.createDirectories(local.resolve("first"));
        Files.writeString(first.resolve("old.txt"), "old");
        TagHead previous = tags.createTagFromLocalDirs("repo", "alice", "dataset", List.of(first), List.of("data"));

        Path second = Files.createDirectories(local.resolve("second"));
        Files.writeString(second.resolve("new.txt"), "new");
        TagHead tag = tags.createTagFromLocalDirs("repo", "alice", "dataset", List.of(second), List.of("data"));

        assertEquals(List.of("tag-dataset-1"), tag.jobIds());
        assertEquals(List.of(Keys.artifact("repo", "tag-dataset-1", "data", "new.txt")), tag.objectKeys());
        for (String key : previous.objectKeys()) {
            assertTrue(store.exists(key), key);
        }
        assertEquals(tag, tags.getTagHead("repo", "dataset").orElseThrow());
    }

    @Test
    void tagFromStaleRunJobsKeepsCurrentStatus() {
        List<Job> snapshot = jobStore.listJobs("repo", "run-1");
        jobStore.updateStatus("repo", "job-1", JobStatus.FAILED);

        tags.createTagFromRun("repo", "v1", "run-1", snapshot);

        Job stored = repository.findById("repo", "job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, stored.status());
        assertEquals("v1", stored.tagName());
        assertEquals(JobStatus.FAILED, jobStore.listJobHeads("repo", "run-1").get(0).status());
    }

    @Test
    void retaggingKeepsStatusOfReleasedJobs() {
        tags.createTagFromRun("repo", "latest", "run-1", null);
        jobStore.updateStatus("repo", "job-1", JobStatus.FAILED);

        tags.createTagFromRun("repo", "latest", "run-2", null);

        Job released = repository.findById("repo", "job-1").orElseThrow();
        assertNull(released.tagName());
        assertEquals(JobStatus.FAILED, released.status());
    }

    @Test
    void mismatchedLocalDirsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> tags.createTagFromLocalDirs("repo", "alice", "t", List.of(dir), List.of()));
    }

    @Test
    void invalidTagNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> tags.createTagFromRun("repo", "a/b", "run-1", null));
    }
}
