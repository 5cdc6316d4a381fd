package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Derived, never persisted view of a run: all jobs sharing {@code (repoId, runName)}.
 * Job heads carry their effective status, which may differ from the stored one
 * when the job was found interrupted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunHead(
        @JsonProperty("repoId") String repoId,
        @JsonProperty("runName") String runName,
        @JsonProperty("workflowName") String workflowName,
        @JsonProperty("providerName") String providerName,
        @JsonProperty("hubUserName") String hubUserName,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("tagName") String tagName,
        @JsonProperty("jobHeads") List<JobHead> jobHeads,
        @JsonProperty("artifactHeads") List<ArtifactHead> artifactHeads,
        @JsonProperty("appHeads") List<AppHead> appHeads,
        @JsonProperty("requestHeads") List<RequestHead> requestHeads,
        @JsonProperty("interrupted") boolean interrupted) {

    public RunHead {
        jobHeads = List.copyOf(jobHeads);
        artifactHeads = List.copyOf(artifactHeads);
        appHeads = List.copyOf(appHeads);
        requestHeads = List.copyOf(requestHeads);
    }
}
