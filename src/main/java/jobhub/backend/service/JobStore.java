package jobhub.backend.service;

import jobhub.backend.compute.Compute;
import jobhub.backend.error.AlreadyExistsException;
import jobhub.backend.error.LaunchException;
import jobhub.backend.error.NotFoundException;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import jobhub.backend.model.JobErrorCode;
import jobhub.backend.model.JobHead;
import jobhub.backend.model.JobStatus;
import jobhub.backend.model.StatusTransition;
import jobhub.backend.repository.JobRepository;
import jobhub.backend.storage.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Business logic for the job lifecycle: creation, status changes, launching on
 * {@link Compute} and stopping.
 * <p>
 * Read-modify-write sequences on one job are serialized in this process by a striped lock,
 * so a status reported by a runner cannot be overwritten by a concurrent launch or stop.
 */
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);
    private static final int LOCK_STRIPES = 64;

    private final JobRepository jobRepository;
    private final Compute compute;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public JobStore(JobRepository jobRepository, Compute compute, Clock clock) {
        this.jobRepository = jobRepository;
        this.compute = compute;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Persist a new job in {@code SUBMITTED}.
     *
     * @throws AlreadyExistsException when {@code (repoId, jobId)} is taken
     */
    public Job createJob(Job job) {
        Instant now = clock.instant();
        Job submitted = job.toBuilder()
                .status(JobStatus.SUBMITTED)
                .submittedAt(job.submittedAt() != null ? job.submittedAt() : now)
                .transitions(List.of(new StatusTransition(JobStatus.SUBMITTED, now)))
                .build();
        if (!jobRepository.create(submitted)) {
            throw new AlreadyExistsException(Keys.job(job.repoId(), job.jobId()));
        }
        log.info("Created job {} of run {}/{}", job.jobId(), job.repoId(), job.runName());
        return submitted;
    }

    public Optional<Job> getJob(String repoId, String jobId) {
        return jobRepository.findById(repoId, jobId);
    }

    public List<Job> listJobs(String repoId, String runName) {
        return jobRepository.findByRun(repoId, runName);
    }

    /** @param runName run filter, null for every run of the repository */
    public List<JobHead> listJobHeads(String repoId, String runName) {
        return jobRepository.findHeads(repoId, runName);
    }

    /** Overwrite the job and its head as given */
    public void updateJob(Job job) {
        withLock(job.repoId(), job.jobId(), () -> {
            jobRepository.save(job);
            return null;
        });
    }

    /**
     * Move a job to a new status.
     *
     * @throws NotFoundException     when the job does not exist
     * @throws IllegalStateException when the transition is not allowed
     */
    public Job updateStatus(String repoId, String jobId, JobStatus status) {
        return withLock(repoId, jobId, () -> {
            Job job = require(repoId, jobId);
            Job updated = job.withStatus(status, clock.instant());
            if (updated != job) {
                jobRepository.save(updated);
                log.info("Job {} {} -> {}", jobId, job.status(), status);
            }
            return updated;
        });
    }

    /**
     * Apply a status observed by a runner. Unlike {@link #updateStatus} a status that may
     * no longer be applied (the job was stopped meanwhile) is ignored.
     *
     * @return true when the status was applied
     */
    public boolean reportStatus(String repoId, String jobId, JobStatus status,
                                JobErrorCode errorCode, Integer exitCode) {
        return withLock(repoId, jobId, () -> {
            Optional<Job> stored = jobRepository.findById(repoId, jobId);
            if (stored.isEmpty()) {
                log.warn("Status {} reported for unknown job {}/{}", status, repoId, jobId);
                return false;
            }
            Job job = stored.get();
            if (job.status() == status || !job.status().canTransitionTo(status)) {
                log.debug("Ignoring reported status {} of job {} in {}", status, jobId, job.status());
                return false;
            }
            Job updated = job.withStatus(status, clock.instant()).toBuilder()
                    .errorCode(errorCode != null ? errorCode : job.errorCode())
                    .containerExitCode(exitCode != null ? exitCode : job.containerExitCode())
                    .build();
            jobRepository.save(updated);
            log.info("Job {} {} -> {} (reported)", jobId, job.status(), status);
            return true;
        });
    }

    /** Remove the job from listings. The job record itself is kept. */
    public void deleteJobHead(String repoId, String jobId) {
        if (jobRepository.deleteHead(repoId, jobId)) {
            log.info("Deleted head of job {}/{}", repoId, jobId);
        }
    }

    /**
     * Point the stored job at a tag. Only the tag name changes.
     *
     * @return false when the job no longer exists
     */
    public boolean setTagName(String repoId, String jobId, String tagName) {
        return withLock(repoId, jobId, () -> {
            Optional<Job> stored = jobRepository.findById(repoId, jobId);
            if (stored.isEmpty()) {
                log.warn("Cannot tag unknown job {}/{} as {}", repoId, jobId, tagName);
                return false;
            }
            if (!Objects.equals(stored.get().tagName(), tagName)) {
                jobRepository.save(stored.get().toBuilder().tagName(tagName).build());
            }
            return true;
        });
    }

    /** Clear the job's tag name if it still points at {@code tagName} */
    public void clearTagName(String repoId, String jobId, String tagName) {
        withLock(repoId, jobId, () -> {
            jobRepository.findById(repoId, jobId)
                    .filter(job -> Objects.equals(job.tagName(), tagName))
                    .ifPresent(job -> jobRepository.save(job.toBuilder().tagName(null).build()));
            return null;
        });
    }

    public Optional<InstanceType> predictInstanceType(Job job) {
        return compute.predictInstanceType(job);
    }

    /**
     * Launch a submitted job. Never waits for it to start running.
     *
     * @param failedToStartNewStatus status to record when the provider cannot provision the instance,
     *                               null for {@code FAILED}
     * @return the job as stored afterwards
     * @throws IllegalStateException when the job is not {@code SUBMITTED}
     */
    public Job runJob(Job job, JobStatus failedToStartNewStatus) {
        return withLock(job.repoId(), job.jobId(), () -> {
            Job current = require(job.repoId(), job.jobId());
            if (current.status() != JobStatus.SUBMITTED) {
                throw new IllegalStateException("Job " + job.jobId() + " is " + current.status() + ", not SUBMITTED");
            }

            Optional<InstanceType> instanceType = compute.predictInstanceType(current);
            if (instanceType.isEmpty()) {
                Job failed = fail(current, JobStatus.FAILED, JobErrorCode.NO_INSTANCE_MATCHING_REQUIREMENTS);
                log.warn("No instance type matches requirements of job {}", job.jobId());
                return failed;
            }

            Job withType = current.toBuilder().instanceType(instanceType.get()).build();
            try {
                String requestId = compute.launch(withType, instanceType.get());
                Job pending = withType.toBuilder().requestId(requestId).build()
                        .withStatus(JobStatus.PENDING, clock.instant());
                jobRepository.save(pending);
                log.info("Launched job {} on {} (request {})", job.jobId(), instanceType.get().name(), requestId);
                return pending;
            } catch (LaunchException e) {
                log.warn("Job {} failed to start ({}): {}", job.jobId(), e.reason(), e.getMessage());
                JobStatus next = failedToStartNewStatus != null ? failedToStartNewStatus : JobStatus.FAILED;
                return fail(withType, next, JobErrorCode.FAILED_TO_START_DUE_TO_NO_CAPACITY);
            }
        });
    }

    /**
     * Stop a job. Stopping a finished job succeeds without doing anything.
     *
     * @param abort stop immediately instead of letting the job finish its uploads
     */
    public Job stopJob(String repoId, String jobId, boolean abort) {
        return withLock(repoId, jobId, () -> {
            Job job = require(repoId, jobId);
            if (job.isTerminal()) {
                log.debug("Job {} already {}", jobId, job.status());
                return job;
            }

            if (job.requestId() != null) {
                compute.terminate(job.requestId());
            }

            JobStatus next;
            if (abort) {
                next = JobStatus.ABORTED;
            } else if (job.requestId() == null || !compute.isAlive(job.requestId())) {
                next = JobStatus.STOPPED;
            } else {
                next = JobStatus.STOPPING;
            }
            Job stopped = job.withStatus(next, clock.instant());
            jobRepository.save(stopped);
            log.info("Job {} {} -> {}", jobId, job.status(), next);
            return stopped;
        });
    }

    // --- Helpers ---

    private Job fail(Job job, JobStatus status, JobErrorCode errorCode) {
        Job failed = job.withStatus(status, clock.instant()).toBuilder().errorCode(errorCode).build();
        jobRepository.save(failed);
        return failed;
    }

    private Job require(String repoId, String jobId) {
        return jobRepository.findById(repoId, jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + repoId + "/" + jobId));
    }

    private <T> T withLock(String repoId, String jobId, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod((repoId + "/" + jobId).hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
