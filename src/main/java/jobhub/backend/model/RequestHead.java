package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Live state of a job's compute request, as reported by the backend's Compute.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestHead(String jobId, RequestStatus status, String message) {
}
