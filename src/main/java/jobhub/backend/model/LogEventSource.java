package jobhub.backend.model;

public enum LogEventSource {
    STDOUT,
    STDERR,
    /** Backend-internal events: provisioning, status changes, runner errors */
    DIAGNOSTIC
}
