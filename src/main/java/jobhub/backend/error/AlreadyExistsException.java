package jobhub.backend.error;

/**
 * Conflicting create: the key is already present.
 */
public class AlreadyExistsException extends BackendException {

    private final String key;

    public AlreadyExistsException(String key) {
        super("Already exists: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
