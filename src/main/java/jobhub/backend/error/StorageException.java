package jobhub.backend.error;

/**
 * Object store, vault or log sink failure that survived the adapter's retries.
 */
public class StorageException extends BackendException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
