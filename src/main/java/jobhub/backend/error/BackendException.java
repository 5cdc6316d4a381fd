package jobhub.backend.error;

/**
 * Base of all unchecked errors raised by backend components.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
