package jobhub.backend.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a single job.
 */
public enum JobStatus {
    /** Job record written, no compute requested yet */
    SUBMITTED,
    /** Compute requested, waiting for the instance */
    PENDING,
    /** Fetching code, dependencies or input artifacts */
    DOWNLOADING,
    /** User process running */
    RUNNING,
    /** Uploading output artifacts */
    UPLOADING,
    /** Graceful stop requested, instance still alive */
    STOPPING,
    /** Stopped gracefully */
    STOPPED,
    /** Stopped by the user without cleanup guarantees */
    ABORTED,
    /** Failed to start, crashed or was interrupted */
    FAILED,
    /** Finished successfully */
    DONE;

    public boolean isTerminal() {
        return this == STOPPED || this == ABORTED || this == FAILED || this == DONE;
    }

    public boolean isUnfinished() {
        return !isTerminal();
    }

    /**
     * Whether a job in this status may move to {@code next}.
     * Terminal statuses never transition; staying in the same status is always allowed.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (next == this) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<JobStatus> successors() {
        return switch (this) {
            case SUBMITTED -> EnumSet.of(PENDING, DOWNLOADING, RUNNING, STOPPING, STOPPED, ABORTED, FAILED);
            case PENDING -> EnumSet.of(DOWNLOADING, RUNNING, STOPPING, STOPPED, ABORTED, FAILED);
            case DOWNLOADING, RUNNING -> EnumSet.of(DOWNLOADING, RUNNING, UPLOADING, DONE,
                    STOPPING, STOPPED, ABORTED, FAILED);
            case UPLOADING -> EnumSet.of(DONE, STOPPING, STOPPED, ABORTED, FAILED);
            case STOPPING -> EnumSet.of(STOPPED, ABORTED, FAILED);
            case STOPPED, ABORTED, FAILED, DONE -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
