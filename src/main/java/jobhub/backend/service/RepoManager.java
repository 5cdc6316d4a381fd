package jobhub.backend.service;

import jobhub.backend.model.RemoteRepoCredentials;
import jobhub.backend.model.RepoHead;
import jobhub.backend.repository.JobRepository;
import jobhub.backend.secrets.SecretsManager;
import jobhub.backend.storage.Json;
import jobhub.backend.storage.Keys;
import jobhub.backend.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repository bookkeeping: heads under {@code repos/<repoId>}, credentials in the vault.
 */
public class RepoManager {

    private static final Logger log = LoggerFactory.getLogger(RepoManager.class);

    private final ObjectStore store;
    private final JobRepository jobRepository;
    private final SecretsManager secretsManager;

    public RepoManager(ObjectStore store, JobRepository jobRepository, SecretsManager secretsManager) {
        this.store = store;
        this.jobRepository = jobRepository;
        this.secretsManager = secretsManager;
    }

    public List<RepoHead> listRepoHeads() {
        List<RepoHead> heads = new ArrayList<>();
        for (String key : store.list(Keys.REPOS_PREFIX)) {
            Json.read(store, key, RepoHead.class).ifPresent(heads::add);
        }
        return heads;
    }

    public Optional<RepoHead> getRepoHead(String repoId) {
        return Json.read(store, Keys.repo(repoId), RepoHead.class);
    }

    /** Record a run submission; an older instant than the stored one is ignored */
    public RepoHead updateRepoLastRunAt(String repoId, Instant lastRunAt) {
        Optional<RepoHead> current = getRepoHead(repoId);
        if (current.isPresent() && current.get().lastRunAt() != null
                && !lastRunAt.isAfter(current.get().lastRunAt())) {
            return current.get();
        }
        RepoHead head = new RepoHead(repoId, lastRunAt);
        store.put(Keys.repo(repoId), Json.write(head));
        return head;
    }

    /** Delete the repository head, its jobs and job heads */
    public void deleteRepo(String repoId) {
        jobRepository.deleteAll(repoId);
        store.delete(Keys.repo(repoId));
        log.info("Deleted repo {}", repoId);
    }

    public void saveRepoCredentials(String repoId, RemoteRepoCredentials credentials) {
        secretsManager.saveRepoCredentials(repoId, credentials);
    }

    public Optional<RemoteRepoCredentials> getRepoCredentials(String repoId) {
        return secretsManager.getRepoCredentials(repoId);
    }
}
