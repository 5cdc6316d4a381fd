package jobhub.backend.storage;

/**
 * Object key layout. Every key is namespaced by repository id.
 */
public final class Keys {

    public static final String REPOS_PREFIX = "repos/";

    private Keys() {
    }

    public static String job(String repoId, String jobId) {
        return "jobs/" + repoId + "/" + jobId;
    }

    public static String jobsPrefix(String repoId) {
        return "jobs/" + repoId + "/";
    }

    public static String jobHead(String repoId, String runName, String jobId) {
        return jobHeadsPrefix(repoId, runName) + jobId;
    }

    public static String jobHeadsPrefix(String repoId) {
        return "job-heads/" + repoId + "/";
    }

    public static String jobHeadsPrefix(String repoId, String runName) {
        return jobHeadsPrefix(repoId) + runName + "/";
    }

    public static String jobArtifactsPrefix(String repoId, String jobId) {
        return "artifacts/" + repoId + "/" + jobId + "/";
    }

    public static String artifact(String repoId, String jobId, String artifactName, String relativePath) {
        return jobArtifactsPrefix(repoId, jobId) + artifactName + "/" + relativePath;
    }

    public static String tag(String repoId, String tagName) {
        return tagsPrefix(repoId) + tagName;
    }

    public static String tagsPrefix(String repoId) {
        return "tags/" + repoId + "/";
    }

    public static String secretIndex(String repoId, String secretName) {
        return secretIndexPrefix(repoId) + secretName;
    }

    public static String secretIndexPrefix(String repoId) {
        return "secrets-index/" + repoId + "/";
    }

    public static String repo(String repoId) {
        return REPOS_PREFIX + repoId;
    }

    public static String runName(String repoId, String runName) {
        return "run-names/" + repoId + "/" + runName;
    }

    public static String workflowCachePrefix(String repoId, String hubUserName, String workflowName) {
        return "cache/" + repoId + "/" + hubUserName + "/" + workflowName + "/";
    }

    /** Last path segment of a key */
    public static String lastSegment(String key) {
        int idx = key.lastIndexOf('/');
        return idx >= 0 ? key.substring(idx + 1) : key;
    }
}
