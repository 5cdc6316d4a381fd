package jobhub.backend.repository;

import jobhub.backend.model.Job;
import jobhub.backend.model.JobHead;
import jobhub.backend.storage.Json;
import jobhub.backend.storage.Keys;
import jobhub.backend.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JobRepository over an {@link ObjectStore}: jobs under {@code jobs/<repoId>/<jobId>},
 * heads under {@code job-heads/<repoId>/<runName>/<jobId>}.
 */
public class ObjectStoreJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreJobRepository.class);

    private final ObjectStore store;

    public ObjectStoreJobRepository(ObjectStore store) {
        this.store = store;
    }

    @Override
    public boolean create(Job job) {
        if (!store.putIfAbsent(Keys.job(job.repoId(), job.jobId()), Json.write(job))) {
            return false;
        }
        store.put(Keys.jobHead(job.repoId(), job.runName(), job.jobId()), Json.write(job.head()));
        log.debug("Created job {}/{}", job.repoId(), job.jobId());
        return true;
    }

    @Override
    public void save(Job job) {
        store.put(Keys.job(job.repoId(), job.jobId()), Json.write(job));
        store.put(Keys.jobHead(job.repoId(), job.runName(), job.jobId()), Json.write(job.head()));
    }

    @Override
    public Optional<Job> findById(String repoId, String jobId) {
        return Json.read(store, Keys.job(repoId, jobId), Job.class);
    }

    @Override
    public List<Job> findByRun(String repoId, String runName) {
        List<Job> jobs = new ArrayList<>();
        for (JobHead head : findHeads(repoId, runName)) {
            Optional<Job> job = findById(repoId, head.jobId());
            if (job.isPresent()) {
                jobs.add(job.get());
            } else {
                log.warn("Job head {}/{} has no job record", repoId, head.jobId());
            }
        }
        return jobs;
    }

    @Override
    public List<JobHead> findHeads(String repoId, String runName) {
        String prefix = runName != null ? Keys.jobHeadsPrefix(repoId, runName) : Keys.jobHeadsPrefix(repoId);
        List<JobHead> heads = new ArrayList<>();
        for (String key : store.list(prefix)) {
            // A head deleted between list and get is skipped
            Json.read(store, key, JobHead.class).ifPresent(heads::add);
        }
        return heads;
    }

    @Override
    public boolean deleteHead(String repoId, String jobId) {
        Optional<String> key = findById(repoId, jobId)
                .map(job -> Keys.jobHead(repoId, job.runName(), jobId))
                .or(() -> store.list(Keys.jobHeadsPrefix(repoId)).stream()
                        .filter(k -> Keys.lastSegment(k).equals(jobId))
                        .findFirst());
        if (key.isEmpty() || !store.exists(key.get())) {
            return false;
        }
        store.delete(key.get());
        log.debug("Deleted job head {}/{}", repoId, jobId);
        return true;
    }

    @Override
    public void deleteAll(String repoId) {
        int heads = store.deletePrefix(Keys.jobHeadsPrefix(repoId));
        int jobs = store.deletePrefix(Keys.jobsPrefix(repoId));
        log.info("Deleted {} jobs and {} job heads of repo {}", jobs, heads, repoId);
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID();
    }
}
