package jobhub.backend.model;

import java.time.Instant;

/** One entry of a job's status history. */
public record StatusTransition(JobStatus status, Instant at) {
}
