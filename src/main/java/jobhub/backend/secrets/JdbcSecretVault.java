package jobhub.backend.secrets;

import jobhub.backend.error.BackendConfigException;
import jobhub.backend.error.StorageException;
import jobhub.backend.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Vault over the {@code vault_secrets} table.
 * With a master key, values are stored as {@code enc:v1:<base64(iv | AES-GCM ciphertext)>};
 * without one they are stored as plain text, which is only meant for local use.
 */
public class JdbcSecretVault implements SecretVault {

    private static final Logger log = LoggerFactory.getLogger(JdbcSecretVault.class);
    private static final String ENCRYPTED_PREFIX = "enc:v1:";
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final Database db;
    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public JdbcSecretVault(Database db, byte[] masterKey) {
        this.db = db;
        this.key = masterKey != null ? new SecretKeySpec(masterKey, "AES") : null;
        if (key == null) {
            log.warn("No vault master key configured, secrets are stored unencrypted");
        }
    }

    @Override
    public void put(String name, String value) {
        String stored = encrypt(value);
        String updateSql = "UPDATE vault_secrets SET secret_value = ?, version = version + 1, updated_at = ? WHERE secret_name = ?";
        String insertSql = "INSERT INTO vault_secrets (secret_name, secret_value, version, updated_at) VALUES (?, ?, 1, ?)";

        db.inTransaction("put secret " + name, conn -> {
            Timestamp now = Timestamp.from(Instant.now());
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setString(1, stored);
                ps.setTimestamp(2, now);
                ps.setString(3, name);
                if (ps.executeUpdate() > 0) {
                    return null;
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, name);
                ps.setString(2, stored);
                ps.setTimestamp(3, now);
                ps.executeUpdate();
            }
            return null;
        });
        log.debug("Stored secret {}", name);
    }

    @Override
    public Optional<String> get(String name) {
        String sql = "SELECT secret_value FROM vault_secrets WHERE secret_name = ?";

        Optional<String> stored = db.inTransaction("get secret " + name, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getString("secret_value")) : Optional.<String>empty();
                }
            }
        });
        return stored.map(this::decrypt);
    }

    @Override
    public void delete(String name) {
        String sql = "DELETE FROM vault_secrets WHERE secret_name = ?";

        db.inTransaction("delete secret " + name, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, name);
                return ps.executeUpdate();
            }
        });
        log.debug("Deleted secret {}", name);
    }

    // --- Encryption ---

    private String encrypt(String value) {
        if (key == null) {
            return value;
        }
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(value.getBytes(StandardCharsets.UTF_8));
            byte[] payload = ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array();
            return ENCRYPTED_PREFIX + Base64.getEncoder().encodeToString(payload);
        } catch (GeneralSecurityException e) {
            throw new StorageException("Cannot encrypt secret", e);
        }
    }

    private String decrypt(String stored) {
        if (!stored.startsWith(ENCRYPTED_PREFIX)) {
            return stored;
        }
        if (key == null) {
            throw BackendConfigException.missing("SECRETS.master_key");
        }
        try {
            byte[] payload = Base64.getDecoder().decode(stored.substring(ENCRYPTED_PREFIX.length()));
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, payload, 0, IV_BYTES));
            byte[] plain = cipher.doFinal(payload, IV_BYTES, payload.length - IV_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new BackendConfigException("Cannot decrypt secret, wrong master key?",
                    BackendConfigException.INVALID_VALUE, List.of("SECRETS.master_key"), e);
        }
    }
}
