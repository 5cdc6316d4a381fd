package jobhub.backend.repository;

import jobhub.backend.model.Job;
import jobhub.backend.model.JobHead;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * Every job is stored twice: the full record and a {@link JobHead} index entry.
 */
public interface JobRepository {

    /**
     * Save a new job and its head.
     *
     * @param job the job to save
     * @return false if a job with the same {@code (repoId, jobId)} already exists
     */
    boolean create(Job job);

    /**
     * Overwrite a job and its head.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param repoId the repository
     * @param jobId  the job ID
     * @return the job if found
     */
    Optional<Job> findById(String repoId, String jobId);

    /**
     * Get the jobs of one run, ordered by job ID.
     */
    List<Job> findByRun(String repoId, String runName);

    /**
     * Get job heads of a repository, optionally of one run only.
     *
     * @param runName run filter, null for all runs
     */
    List<JobHead> findHeads(String repoId, String runName);

    /**
     * Delete the head of a job. The job record itself is kept.
     *
     * @return true if a head was deleted
     */
    boolean deleteHead(String repoId, String jobId);

    /**
     * Delete all jobs and heads of a repository.
     */
    void deleteAll(String repoId);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
