package jobhub.backend.error;

/**
 * The provider refused the operation. Fatal to the operation and never retried.
 */
public class BackendPermissionException extends BackendException {

    public BackendPermissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
