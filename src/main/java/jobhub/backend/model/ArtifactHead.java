package jobhub.backend.model;

public record ArtifactHead(String jobId, String artifactPath) {
}
