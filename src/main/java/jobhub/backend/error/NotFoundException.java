package jobhub.backend.error;

/**
 * Entity absent where an operation requires it to exist.
 * Reads return {@code Optional.empty()} instead of raising this.
 */
public class NotFoundException extends BackendException {

    public NotFoundException(String message) {
        super(message);
    }
}
