package jobhub.backend.model;

public record AppHead(String jobId, String appName) {
}
