package jobhub.backend.service;

import jobhub.backend.error.NotFoundException;
import jobhub.backend.error.StorageException;
import jobhub.backend.model.Artifact;
import jobhub.backend.model.ArtifactFile;
import jobhub.backend.model.JobHead;
import jobhub.backend.repository.JobRepository;
import jobhub.backend.storage.Keys;
import jobhub.backend.storage.ObjectStore;
import jobhub.backend.storage.StorageFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Files produced by jobs, stored under
 * {@code artifacts/<repoId>/<jobId>/<artifactName>/<path>}.
 * Transfers run on a bounded pool of {@code transferThreads} threads.
 */
public class ArtifactManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArtifactManager.class);

    private final ObjectStore store;
    private final JobRepository jobRepository;
    private final ExecutorService transfers;

    public ArtifactManager(ObjectStore store, JobRepository jobRepository, int transferThreads) {
        this.store = store;
        this.jobRepository = jobRepository;
        AtomicInteger counter = new AtomicInteger();
        this.transfers = Executors.newFixedThreadPool(transferThreads, r -> {
            Thread t = new Thread(r, "artifact-transfer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * List the artifacts of every job of a run.
     *
     * @param prefix    only files whose path (relative to the artifact name) starts with it; null for all
     * @param recursive false to list one level below the prefix, grouping deeper files into
     *                  directory entries ending with {@code /}
     */
    public List<Artifact> listRunArtifactFiles(String repoId, String runName, String prefix, boolean recursive) {
        String filter = prefix != null ? prefix : "";
        List<Artifact> artifacts = new ArrayList<>();
        for (String jobId : runJobIds(repoId, runName)) {
            listJobArtifacts(repoId, jobId).forEach((name, files) -> {
                List<StorageFile> matching = files.stream()
                        .filter(f -> relativePath(repoId, jobId, name, f).startsWith(filter))
                        .toList();
                if (matching.isEmpty()) {
                    return;
                }
                List<ArtifactFile> entries = recursive
                        ? matching.stream().map(f -> ArtifactFile.file(relativePath(repoId, jobId, name, f), f.size())).toList()
                        : oneLevel(repoId, jobId, name, matching, filter);
                artifacts.add(new Artifact(jobId, name, entries));
            });
        }
        return artifacts;
    }

    /**
     * Download the artifacts of a run into {@code outputDir/<artifactName>/<path>}.
     *
     * @param filesPath only files whose path starts with it; null for all
     */
    public DownloadReport downloadRunArtifactFiles(String repoId, String runName, Path outputDir, String filesPath) {
        Path root = outputDir.toAbsolutePath().normalize();
        List<String> downloaded = Collections.synchronizedList(new ArrayList<>());
        List<String> missing = Collections.synchronizedList(new ArrayList<>());
        Map<String, String> failed = new ConcurrentHashMap<>();
        List<Future<?>> pending = new ArrayList<>();

        for (Artifact artifact : listRunArtifactFiles(repoId, runName, filesPath, true)) {
            for (ArtifactFile file : artifact.files()) {
                String key = Keys.artifact(repoId, artifact.jobId(), artifact.name(), file.path());
                Path target = root.resolve(artifact.name()).resolve(file.path()).normalize();
                if (!target.startsWith(root)) {
                    failed.put(key, "path escapes output directory");
                    continue;
                }
                pending.add(transfers.submit(() -> {
                    try {
                        if (store.getFile(key, target)) {
                            downloaded.add(key);
                        } else {
                            missing.add(key);
                        }
                    } catch (RuntimeException e) {
                        failed.put(key, String.valueOf(e.getMessage()));
                    }
                }));
            }
        }
        awaitAll(pending, "download artifacts of " + repoId + "/" + runName);

        if (!missing.isEmpty() || !failed.isEmpty()) {
            log.warn("Downloaded {} artifact files of {}/{}, {} missing, {} failed",
                    downloaded.size(), repoId, runName, missing.size(), failed.size());
        } else {
            log.info("Downloaded {} artifact files of {}/{} to {}", downloaded.size(), repoId, runName, root);
        }
        Collections.sort(downloaded);
        Collections.sort(missing);
        return new DownloadReport(downloaded, missing, failed);
    }

    /**
     * Upload a file or a directory tree to {@code <artifactName>/<artifactPath>/<relative path>}.
     * Existing objects are overwritten.
     *
     * @param artifactPath path inside the artifact, null or empty for its root
     * @return the uploaded object keys
     */
    public List<String> uploadJobArtifactFiles(String repoId, String jobId, String artifactName,
                                               String artifactPath, Path localPath) {
        if (!Files.exists(localPath)) {
            throw new NotFoundException("Local path not found: " + localPath);
        }
        String base = artifactPath == null || artifactPath.isEmpty()
                ? ""
                : (artifactPath.endsWith("/") ? artifactPath : artifactPath + "/");

        Map<String, Path> uploads = new TreeMap<>();
        if (Files.isDirectory(localPath)) {
            try (Stream<Path> walk = Files.walk(localPath)) {
                walk.filter(Files::isRegularFile).forEach(p -> uploads.put(
                        Keys.artifact(repoId, jobId, artifactName, base + toKeyPath(localPath.relativize(p))), p));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot walk " + localPath, e);
            }
        } else {
            uploads.put(Keys.artifact(repoId, jobId, artifactName, base + localPath.getFileName()), localPath);
        }

        List<Future<?>> pending = new ArrayList<>();
        uploads.forEach((key, path) -> pending.add(transfers.submit(() -> store.putFile(key, path))));
        awaitAll(pending, "upload " + localPath);

        log.info("Uploaded {} files from {} to artifact {} of job {}", uploads.size(), localPath, artifactName, jobId);
        return List.copyOf(uploads.keySet());
    }

    /** Every object key stored for the job's artifacts, ordered */
    public List<String> listJobArtifactKeys(String repoId, String jobId) {
        return store.list(Keys.jobArtifactsPrefix(repoId, jobId));
    }

    public void deleteWorkflowCache(String repoId, String hubUserName, String workflowName) {
        int deleted = store.deletePrefix(Keys.workflowCachePrefix(repoId, hubUserName, workflowName));
        log.info("Deleted {} cache objects of workflow {} ({}/{})", deleted, workflowName, repoId, hubUserName);
    }

    @Override
    public void close() {
        transfers.shutdown();
    }

    // --- Helpers ---

    private List<String> runJobIds(String repoId, String runName) {
        return jobRepository.findHeads(repoId, runName).stream().map(JobHead::jobId).sorted().toList();
    }

    /** Files of one job grouped by artifact name, both ordered */
    private Map<String, List<StorageFile>> listJobArtifacts(String repoId, String jobId) {
        String prefix = Keys.jobArtifactsPrefix(repoId, jobId);
        Map<String, List<StorageFile>> byName = new TreeMap<>();
        for (StorageFile file : store.listFiles(prefix)) {
            String rest = file.key().substring(prefix.length());
            int slash = rest.indexOf('/');
            if (slash <= 0) {
                continue;
            }
            byName.computeIfAbsent(rest.substring(0, slash), k -> new ArrayList<>()).add(file);
        }
        return byName;
    }

    private static String relativePath(String repoId, String jobId, String artifactName, StorageFile file) {
        return file.key().substring(Keys.artifact(repoId, jobId, artifactName, "").length());
    }

    /** Entries one level below the directory part of the prefix */
    private static List<ArtifactFile> oneLevel(String repoId, String jobId, String artifactName,
                                               List<StorageFile> files, String prefix) {
        String dir = prefix.substring(0, prefix.lastIndexOf('/') + 1);
        Map<String, long[]> entries = new TreeMap<>();
        for (StorageFile file : files) {
            String path = relativePath(repoId, jobId, artifactName, file);
            String rest = path.substring(dir.length());
            int slash = rest.indexOf('/');
            String entry = slash >= 0 ? dir + rest.substring(0, slash + 1) : path;
            entries.computeIfAbsent(entry, k -> new long[1])[0] += file.size();
        }
        List<ArtifactFile> result = new ArrayList<>();
        entries.forEach((path, size) -> result.add(path.endsWith("/")
                ? ArtifactFile.directory(path, size[0])
                : ArtifactFile.file(path, size[0])));
        return result;
    }

    private static String toKeyPath(Path relative) {
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }

    private static void awaitAll(List<Future<?>> futures, String operation) {
        RuntimeException failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageException("Interrupted while waiting to " + operation, e);
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause() instanceof RuntimeException re
                            ? re
                            : new StorageException("Failed to " + operation, e.getCause());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
