package jobhub.backend.secrets;

import jobhub.backend.error.AlreadyExistsException;
import jobhub.backend.error.NotFoundException;
import jobhub.backend.model.RemoteRepoCredentials;
import jobhub.backend.model.Secret;
import jobhub.backend.storage.Json;
import jobhub.backend.storage.Keys;
import jobhub.backend.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Per-repository secrets: values live in the {@link SecretVault}, names in an index in the
 * object store so they can be listed without touching the vault.
 * <p>
 * The two stores are not updated atomically. Writes go to the vault first, so a crash can
 * leave a vault value without an index entry (invisible, overwritten by the next add) but
 * never an index entry pointing at nothing that was not deleted on purpose.
 */
public class SecretsManager {

    private static final Logger log = LoggerFactory.getLogger(SecretsManager.class);

    private final ObjectStore store;
    private final SecretVault vault;
    private final String namespace;

    public SecretsManager(ObjectStore store, SecretVault vault, String namespace) {
        this.store = store;
        this.vault = vault;
        this.namespace = namespace;
    }

    public void addSecret(String repoId, Secret secret) {
        String indexKey = Keys.secretIndex(repoId, checkName(secret.name()));
        if (store.exists(indexKey)) {
            throw new AlreadyExistsException(indexKey);
        }
        vault.put(vaultName(repoId, secret.name()), secret.value());
        store.put(indexKey, secret.name().getBytes(StandardCharsets.UTF_8));
        log.info("Added secret {} to repo {}", secret.name(), repoId);
    }

    public void updateSecret(String repoId, Secret secret) {
        String indexKey = Keys.secretIndex(repoId, checkName(secret.name()));
        if (!store.exists(indexKey)) {
            throw new NotFoundException("Secret not found: " + repoId + "/" + secret.name());
        }
        vault.put(vaultName(repoId, secret.name()), secret.value());
        log.info("Updated secret {} of repo {}", secret.name(), repoId);
    }

    public Optional<Secret> getSecret(String repoId, String secretName) {
        if (!store.exists(Keys.secretIndex(repoId, checkName(secretName)))) {
            return Optional.empty();
        }
        return vault.get(vaultName(repoId, secretName)).map(value -> new Secret(secretName, value));
    }

    public void deleteSecret(String repoId, String secretName) {
        vault.delete(vaultName(repoId, checkName(secretName)));
        store.delete(Keys.secretIndex(repoId, secretName));
        log.info("Deleted secret {} of repo {}", secretName, repoId);
    }

    /** Secret names of the repository, sorted */
    public List<String> listSecretNames(String repoId) {
        return store.list(Keys.secretIndexPrefix(repoId)).stream()
                .map(Keys::lastSegment)
                .sorted()
                .toList();
    }

    public void saveRepoCredentials(String repoId, RemoteRepoCredentials credentials) {
        vault.put(credentialsName(repoId), new String(Json.write(credentials), StandardCharsets.UTF_8));
        log.info("Saved {} credentials of repo {}", credentials.protocol(), repoId);
    }

    public Optional<RemoteRepoCredentials> getRepoCredentials(String repoId) {
        return vault.get(credentialsName(repoId))
                .map(json -> Json.read(json.getBytes(StandardCharsets.UTF_8), RemoteRepoCredentials.class));
    }

    public void deleteRepoCredentials(String repoId) {
        vault.delete(credentialsName(repoId));
    }

    /** Remove every secret of the repository together with its credentials */
    public void deleteAll(String repoId) {
        listSecretNames(repoId).forEach(name -> deleteSecret(repoId, name));
        deleteRepoCredentials(repoId);
    }

    String vaultName(String repoId, String secretName) {
        return namespace + "/secrets/" + repoId + "/" + secretName;
    }

    String credentialsName(String repoId) {
        return namespace + "/credentials/" + repoId;
    }

    private static String checkName(String name) {
        if (name == null || name.isBlank() || name.contains("/")) {
            throw new IllegalArgumentException("Invalid secret name: '" + name + "'");
        }
        return name;
    }
}
