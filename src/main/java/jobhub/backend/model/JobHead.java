package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Lightweight index entry of a job, used for listing without loading the full job.
 * Stored under {@code job-heads/<repoId>/<runName>/<jobId>}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobHead(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("repoId") String repoId,
        @JsonProperty("runName") String runName,
        @JsonProperty("workflowName") String workflowName,
        @JsonProperty("providerName") String providerName,
        @JsonProperty("hubUserName") String hubUserName,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("errorCode") JobErrorCode errorCode,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("requestId") String requestId,
        @JsonProperty("instanceType") String instanceType,
        @JsonProperty("artifactPaths") List<String> artifactPaths,
        @JsonProperty("appNames") List<String> appNames,
        @JsonProperty("tagName") String tagName) {

    public JobHead {
        artifactPaths = artifactPaths != null ? List.copyOf(artifactPaths) : List.of();
        appNames = appNames != null ? List.copyOf(appNames) : List.of();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Copy with an effective status and error code, leaving everything else as stored */
    public JobHead withStatus(JobStatus newStatus, JobErrorCode newErrorCode) {
        return new JobHead(jobId, repoId, runName, workflowName, providerName, hubUserName,
                newStatus, newErrorCode, submittedAt, requestId, instanceType,
                artifactPaths, appNames, tagName);
    }
}
