package jobhub.backend.error;

import jobhub.backend.model.RequestStatus;

/**
 * Provisioning failed. An expected outcome: the caller may retry with the same or
 * another instance type, and the run as a whole is not failed by it.
 */
public class LaunchException extends Exception {

    private final RequestStatus reason;

    public LaunchException(String message, RequestStatus reason) {
        super(message);
        this.reason = reason;
    }

    public LaunchException(String message, RequestStatus reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** {@link RequestStatus#NO_CAPACITY} when the provider ran out of capacity */
    public RequestStatus reason() {
        return reason;
    }
}
