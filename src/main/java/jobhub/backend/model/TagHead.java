package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Named snapshot of a set of artifact objects. Stored under {@code tags/<repoId>/<tagName>}.
 *
 * @param runName    run the tag was created from, null for tags created from local dirs
 * @param local      true when the artifacts were uploaded from local dirs
 * @param objectKeys the artifact object keys captured by the tag
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TagHead(
        @JsonProperty("repoId") String repoId,
        @JsonProperty("tagName") String tagName,
        @JsonProperty("runName") String runName,
        @JsonProperty("workflowName") String workflowName,
        @JsonProperty("providerName") String providerName,
        @JsonProperty("hubUserName") String hubUserName,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("local") boolean local,
        @JsonProperty("jobIds") List<String> jobIds,
        @JsonProperty("artifactHeads") List<ArtifactHead> artifactHeads,
        @JsonProperty("objectKeys") List<String> objectKeys) {

    public TagHead {
        jobIds = jobIds != null ? List.copyOf(jobIds) : List.of();
        artifactHeads = artifactHeads != null ? List.copyOf(artifactHeads) : List.of();
        objectKeys = objectKeys != null ? List.copyOf(objectKeys) : List.of();
    }
}
