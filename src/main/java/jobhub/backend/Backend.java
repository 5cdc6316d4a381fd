package jobhub.backend;

import jobhub.backend.logs.LogReader;
import jobhub.backend.model.Artifact;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import jobhub.backend.model.JobHead;
import jobhub.backend.model.JobStatus;
import jobhub.backend.model.LogEvent;
import jobhub.backend.model.RemoteRepoCredentials;
import jobhub.backend.model.RepoHead;
import jobhub.backend.model.RunHead;
import jobhub.backend.model.Secret;
import jobhub.backend.model.TagHead;
import jobhub.backend.secrets.SecretsManager;
import jobhub.backend.service.ArtifactManager;
import jobhub.backend.service.DownloadReport;
import jobhub.backend.service.JobStore;
import jobhub.backend.service.RepoManager;
import jobhub.backend.service.RunNames;
import jobhub.backend.service.RunReconciler;
import jobhub.backend.service.TagManager;
import jobhub.backend.storage.ObjectStore;
import jobhub.backend.storage.SignedUrlMode;

import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One configured provider account. Everything a caller does with jobs, runs, artifacts,
 * tags, secrets, logs and repositories goes through here; the methods only delegate.
 * Built by {@link jobhub.backend.config.Dependencies}.
 */
public class Backend {

    private final String name;
    private final JobStatus defaultInterruptedJobStatus;
    private final ObjectStore objectStore;
    private final JobStore jobStore;
    private final RunReconciler runReconciler;
    private final ArtifactManager artifactManager;
    private final TagManager tagManager;
    private final SecretsManager secretsManager;
    private final LogReader logReader;
    private final RepoManager repoManager;
    private final RunNames runNames;

    public Backend(String name, JobStatus defaultInterruptedJobStatus, ObjectStore objectStore, JobStore jobStore,
                   RunReconciler runReconciler, ArtifactManager artifactManager, TagManager tagManager,
                   SecretsManager secretsManager, LogReader logReader, RepoManager repoManager, RunNames runNames) {
        this.name = name;
        this.defaultInterruptedJobStatus = defaultInterruptedJobStatus;
        this.objectStore = objectStore;
        this.jobStore = jobStore;
        this.runReconciler = runReconciler;
        this.artifactManager = artifactManager;
        this.tagManager = tagManager;
        this.secretsManager = secretsManager;
        this.logReader = logReader;
        this.repoManager = repoManager;
        this.runNames = runNames;
    }

    public String name() {
        return name;
    }

    // ===== Runs and jobs =====

    public String createRun(String repoId) {
        return runNames.createRun(repoId);
    }

    /** Store a new job and bump the repository's last run time */
    public Job createJob(Job job) {
        Job created = jobStore.createJob(job);
        repoManager.updateRepoLastRunAt(created.repoId(), created.submittedAt());
        return created;
    }

    public Optional<Job> getJob(String repoId, String jobId) {
        return jobStore.getJob(repoId, jobId);
    }

    public List<Job> listJobs(String repoId, String runName) {
        return jobStore.listJobs(repoId, runName);
    }

    public List<JobHead> listJobHeads(String repoId, String runName) {
        return jobStore.listJobHeads(repoId, runName);
    }

    public void deleteJobHead(String repoId, String jobId) {
        jobStore.deleteJobHead(repoId, jobId);
    }

    public Optional<InstanceType> predictInstanceType(Job job) {
        return jobStore.predictInstanceType(job);
    }

    public Job runJob(Job job, JobStatus failedToStartNewStatus) {
        return jobStore.runJob(job, failedToStartNewStatus);
    }

    public Job stopJob(String repoId, String jobId, boolean abort) {
        return jobStore.stopJob(repoId, jobId, abort);
    }

    /**
     * @param runName                 run filter, null for all runs
     * @param interruptedJobNewStatus null for the configured default
     */
    public List<RunHead> listRunHeads(String repoId, String runName, boolean includeRequestHeads,
                                      JobStatus interruptedJobNewStatus) {
        JobStatus interrupted = interruptedJobNewStatus != null ? interruptedJobNewStatus : defaultInterruptedJobStatus;
        return runReconciler.getRunHeads(jobStore.listJobHeads(repoId, runName), includeRequestHeads, interrupted);
    }

    // ===== Logs =====

    public Stream<LogEvent> pollLogs(String repoId, String runName, Instant startTime, Instant endTime,
                                     boolean descending, boolean diagnose) {
        return logReader.pollLogs(repoId, runName, startTime, endTime, descending, diagnose);
    }

    // ===== Artifacts =====

    public List<Artifact> listRunArtifactFiles(String repoId, String runName, String prefix, boolean recursive) {
        return artifactManager.listRunArtifactFiles(repoId, runName, prefix, recursive);
    }

    public DownloadReport downloadRunArtifactFiles(String repoId, String runName, Path outputDir, String filesPath) {
        return artifactManager.downloadRunArtifactFiles(repoId, runName, outputDir, filesPath);
    }

    public List<String> uploadJobArtifactFiles(String repoId, String jobId, String artifactName,
                                               String artifactPath, Path localPath) {
        return artifactManager.uploadJobArtifactFiles(repoId, jobId, artifactName, artifactPath, localPath);
    }

    public void deleteWorkflowCache(String repoId, String hubUserName, String workflowName) {
        artifactManager.deleteWorkflowCache(repoId, hubUserName, workflowName);
    }

    public URL getSignedDownloadUrl(String objectKey) {
        return objectStore.signedUrl(objectKey, SignedUrlMode.GET);
    }

    public URL getSignedUploadUrl(String objectKey) {
        return objectStore.signedUrl(objectKey, SignedUrlMode.PUT);
    }

    // ===== Tags =====

    public List<TagHead> listTagHeads(String repoId) {
        return tagManager.listTagHeads(repoId);
    }

    public Optional<TagHead> getTagHead(String repoId, String tagName) {
        return tagManager.getTagHead(repoId, tagName);
    }

    public TagHead addTagFromRun(String repoId, String tagName, String runName, List<Job> runJobs) {
        return tagManager.createTagFromRun(repoId, tagName, runName, runJobs);
    }

    public TagHead addTagFromLocalDirs(String repoId, String hubUserName, String tagName,
                                       List<Path> localDirs, List<String> artifactPaths) {
        return tagManager.createTagFromLocalDirs(repoId, hubUserName, tagName, localDirs, artifactPaths);
    }

    public void deleteTagHead(String repoId, TagHead tagHead) {
        tagManager.deleteTag(repoId, tagHead);
    }

    // ===== Repositories =====

    public List<RepoHead> listRepoHeads() {
        return repoManager.listRepoHeads();
    }

    public RepoHead updateRepoLastRunAt(String repoId, Instant lastRunAt) {
        return repoManager.updateRepoLastRunAt(repoId, lastRunAt);
    }

    public void deleteRepo(String repoId) {
        repoManager.deleteRepo(repoId);
    }

    public void saveRepoCredentials(String repoId, RemoteRepoCredentials credentials) {
        repoManager.saveRepoCredentials(repoId, credentials);
    }

    public Optional<RemoteRepoCredentials> getRepoCredentials(String repoId) {
        return repoManager.getRepoCredentials(repoId);
    }

    // ===== Secrets =====

    public List<String> listSecretNames(String repoId) {
        return secretsManager.listSecretNames(repoId);
    }

    public Optional<Secret> getSecret(String repoId, String secretName) {
        return secretsManager.getSecret(repoId, secretName);
    }

    public void addSecret(String repoId, Secret secret) {
        secretsManager.addSecret(repoId, secret);
    }

    public void updateSecret(String repoId, Secret secret) {
        secretsManager.updateSecret(repoId, secret);
    }

    public void deleteSecret(String repoId, String secretName) {
        secretsManager.deleteSecret(repoId, secretName);
    }
}
