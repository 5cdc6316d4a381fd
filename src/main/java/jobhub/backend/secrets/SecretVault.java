package jobhub.backend.secrets;

import java.util.Optional;

/**
 * Named secret values held outside the object store.
 */
public interface SecretVault {

    /** Create or overwrite a value */
    void put(String name, String value);

    Optional<String> get(String name);

    /** Absent names are not an error */
    void delete(String name);
}
