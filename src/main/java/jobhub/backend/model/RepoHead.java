package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Per-repository bookkeeping: when the last run was submitted.
 */
public record RepoHead(
        @JsonProperty("repoId") String repoId,
        @JsonProperty("lastRunAt") Instant lastRunAt) {
}
