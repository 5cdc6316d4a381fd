package jobhub.backend.model;

/**
 * Machine-readable reason attached to a failed or interrupted job.
 */
public enum JobErrorCode {
    NO_INSTANCE_MATCHING_REQUIREMENTS,
    FAILED_TO_START_DUE_TO_NO_CAPACITY,
    INTERRUPTED_BY_NO_CAPACITY,
    INSTANCE_TERMINATED,
    CONTAINER_EXITED_WITH_ERROR,
    PORTS_BINDING_FAILED,
    BUILD_NOT_FOUND
}
