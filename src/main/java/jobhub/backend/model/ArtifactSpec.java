package jobhub.backend.model;

/**
 * A path inside the job's working directory whose content is uploaded as an artifact.
 *
 * @param artifactPath relative path of the artifact directory
 * @param mount        whether the directory is mounted (synced continuously) instead of uploaded at the end
 */
public record ArtifactSpec(String artifactPath, boolean mount) {
}
