package jobhub.backend.service;

import jobhub.backend.error.RunNotFoundException;
import jobhub.backend.model.ArtifactHead;
import jobhub.backend.model.Job;
import jobhub.backend.model.TagHead;
import jobhub.backend.storage.Json;
import jobhub.backend.storage.Keys;
import jobhub.backend.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Named snapshots of artifacts, stored under {@code tags/<repoId>/<tagName>}.
 * Creating a tag with an existing name replaces it. Deleting a tag never deletes artifacts.
 */
public class TagManager {

    private static final Logger log = LoggerFactory.getLogger(TagManager.class);

    private final ObjectStore store;
    private final JobStore jobStore;
    private final ArtifactManager artifactManager;
    private final Clock clock;

    public TagManager(ObjectStore store, JobStore jobStore, ArtifactManager artifactManager, Clock clock) {
        this.store = store;
        this.jobStore = jobStore;
        this.artifactManager = artifactManager;
        this.clock = clock;
    }

    /**
     * Tag the artifacts of a run.
     *
     * @param runJobs the run's jobs when the caller already has them, null to look them up.
     *                Only their ids and definitions are used; stored jobs are re-read before tagging.
     * @throws RunNotFoundException when the run has no jobs
     */
    public TagHead createTagFromRun(String repoId, String tagName, String runName, List<Job> runJobs) {
        checkName(tagName);
        List<Job> jobs = runJobs != null ? runJobs : jobStore.listJobs(repoId, runName);
        if (jobs.isEmpty()) {
            throw new RunNotFoundException(repoId, runName);
        }
        getTagHead(repoId, tagName).ifPresent(previous -> release(repoId, previous));

        List<ArtifactHead> artifactHeads = new ArrayList<>();
        List<String> objectKeys = new ArrayList<>();
        for (Job job : jobs) {
            job.artifactSpecs().forEach(spec -> artifactHeads.add(new ArtifactHead(job.jobId(), spec.artifactPath())));
            objectKeys.addAll(artifactManager.listJobArtifactKeys(repoId, job.jobId()));
        }

        Job first = jobs.get(0);
        TagHead tag = new TagHead(
                repoId,
                tagName,
                runName,
                first.workflowName(),
                first.providerName(),
                first.hubUserName(),
                clock.instant(),
                false,
                jobs.stream().map(Job::jobId).toList(),
                artifactHeads,
                objectKeys);
        store.put(Keys.tag(repoId, tagName), Json.write(tag));

        for (Job job : jobs) {
            jobStore.setTagName(repoId, job.jobId(), tagName);
        }
        log.info("Created tag {} from run {}/{} ({} objects)", tagName, repoId, runName, objectKeys.size());
        return tag;
    }

    /**
     * Upload local directories and tag them. Each directory becomes artifact
     * {@code artifactPaths[i]} of a synthetic job {@code tag-<tagName>-<n>}, where {@code n}
     * is the next index with no stored artifacts. Objects of a replaced tag are kept.
     */
    public TagHead createTagFromLocalDirs(String repoId, String hubUserName, String tagName,
                                          List<Path> localDirs, List<String> artifactPaths) {
        checkName(tagName);
        if (localDirs.size() != artifactPaths.size()) {
            throw new IllegalArgumentException("Got " + localDirs.size() + " dirs for "
                    + artifactPaths.size() + " artifact paths");
        }
        getTagHead(repoId, tagName).ifPresent(previous -> release(repoId, previous));

        List<String> jobIds = new ArrayList<>();
        List<ArtifactHead> artifactHeads = new ArrayList<>();
        List<String> objectKeys = new ArrayList<>();
        int next = 0;
        for (int i = 0; i < localDirs.size(); i++) {
            next = freeLocalIndex(repoId, tagName, next);
            String jobId = localJobId(tagName, next++);
            objectKeys.addAll(artifactManager.uploadJobArtifactFiles(repoId, jobId, artifactPaths.get(i), null, localDirs.get(i)));
            jobIds.add(jobId);
            artifactHeads.add(new ArtifactHead(jobId, artifactPaths.get(i)));
        }

        TagHead tag = new TagHead(repoId, tagName, null, null, null, hubUserName, clock.instant(),
                true, jobIds, artifactHeads, objectKeys);
        store.put(Keys.tag(repoId, tagName), Json.write(tag));
        log.info("Created local tag {} in repo {} from {} dirs", tagName, repoId, localDirs.size());
        return tag;
    }

    /** Tags of the repository ordered by name */
    public List<TagHead> listTagHeads(String repoId) {
        List<TagHead> tags = new ArrayList<>();
        for (String key : store.list(Keys.tagsPrefix(repoId))) {
            Json.read(store, key, TagHead.class).ifPresent(tags::add);
        }
        return tags;
    }

    public Optional<TagHead> getTagHead(String repoId, String tagName) {
        return Json.read(store, Keys.tag(repoId, tagName), TagHead.class);
    }

    /** Delete the tag head and clear the tag from the run's jobs. Artifacts stay. */
    public void deleteTag(String repoId, TagHead tagHead) {
        store.delete(Keys.tag(repoId, tagHead.tagName()));
        release(repoId, tagHead);
        log.info("Deleted tag {} of repo {}", tagHead.tagName(), repoId);
    }

    /** Clear the tag name from jobs still pointing at it */
    private void release(String repoId, TagHead tag) {
        if (tag.local()) {
            return;
        }
        for (String jobId : tag.jobIds()) {
            jobStore.clearTagName(repoId, jobId, tag.tagName());
        }
    }

    private int freeLocalIndex(String repoId, String tagName, int from) {
        int n = from;
        while (!artifactManager.listJobArtifactKeys(repoId, localJobId(tagName, n)).isEmpty()) {
            n++;
        }
        return n;
    }

    private static String localJobId(String tagName, int n) {
        return "tag-" + tagName + "-" + n;
    }

    private static void checkName(String tagName) {
        if (tagName == null || tagName.isBlank() || tagName.contains("/")) {
            throw new IllegalArgumentException("Invalid tag name: '" + tagName + "'");
        }
    }
}
