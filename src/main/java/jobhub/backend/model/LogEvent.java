package jobhub.backend.model;

import java.time.Instant;

/**
 * One log line of a run.
 *
 * @param timestamp when the line was produced
 * @param jobId     stream the line belongs to (the job, or the runner of the job)
 * @param message   the line without trailing newline
 * @param source    where the line came from
 */
public record LogEvent(Instant timestamp, String jobId, String message, LogEventSource source) {
}
