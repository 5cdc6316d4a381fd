package jobhub.backend.model;

/**
 * What a Compute backend reports about a job's compute request.
 */
public enum RequestStatus {
    /** Instance (or process) is alive */
    RUNNING,
    /** Instance is gone: terminated, preempted, crashed or unknown to the provider */
    TERMINATED,
    /** Provider could not find capacity for the request */
    NO_CAPACITY
}
