package jobhub.backend.config;

import jobhub.backend.error.BackendConfigException;
import jobhub.backend.model.JobStatus;
import jobhub.backend.util.Retry;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Configuration of one backend (one provider account).
 * All settings have defaults; {@link #validate()} checks the combination eagerly.
 */
public final class BackendConfig {

    public enum StorageKind {
        JDBC,
        FILESYSTEM
    }

    // Backend identity
    private BackendType type = BackendType.LOCAL;
    private String name = "local";
    private String namespace = "jobhub";

    // Storage settings
    private StorageKind storageKind = StorageKind.JDBC;
    private String databaseUrl = "jdbc:h2:file:./data/jobhub;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private Path storageRoot = Path.of("./data/objects");
    private String signedUrlBaseUrl = "http://localhost:8080/objects";
    private String signingKey = null;
    private Duration signedUrlTtl = Duration.ofHours(1);
    private int storageRetryAttempts = 3;

    // Secrets
    private String vaultMasterKey = null; // Base64 AES key; values stored unencrypted when absent

    // Runs and logs
    private JobStatus interruptedJobStatus = JobStatus.FAILED;
    private List<JobStatus> runStatusPrecedence = null; // null -> StatusPrecedence default order
    private int logPageSize = 100;
    private int transferThreads = 4;

    // Local compute
    private Path localWorkDir = Path.of("./data/work");

    // Yandex Cloud settings
    private String oauthTokenEnv = "OAUTH_TOKEN";
    private String cloudId;
    private String folderId;
    private String zoneId;
    private String subnetId;
    private String securityGroupId;
    private boolean assignPublicIp = true;
    private String imageId;
    private String platformId = "standard-v3";
    private int diskGb = 30;
    private boolean preemptible = true;
    private String sshUser = "jobhub";
    private String sshPublicKey;

    private BackendConfig() {
    }

    public static BackendConfig defaults() {
        return new BackendConfig();
    }

    public static BackendConfig fromEnv() {
        BackendConfig config = new BackendConfig();

        // Override from environment variables
        String type = System.getenv("JOBHUB_BACKEND");
        if (type != null && !type.isBlank()) {
            config.type = BackendType.parse(type);
        }

        String dbUrl = System.getenv("JOBHUB_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String namespace = System.getenv("JOBHUB_NAMESPACE");
        if (namespace != null && !namespace.isBlank()) {
            config.namespace = namespace;
        }

        String signingKey = System.getenv("JOBHUB_SIGNING_KEY");
        if (signingKey != null && !signingKey.isBlank()) {
            config.signingKey = signingKey;
        }

        String vaultKey = System.getenv("JOBHUB_VAULT_KEY");
        if (vaultKey != null && !vaultKey.isBlank()) {
            config.vaultMasterKey = vaultKey;
        }

        String folderId = System.getenv("JOBHUB_YC_FOLDER_ID");
        if (folderId != null && !folderId.isBlank()) {
            config.folderId = folderId;
        }

        return config;
    }

    /**
     * Check that the settings are usable together.
     *
     * @return this config
     * @throws BackendConfigException naming the offending fields
     */
    public BackendConfig validate() {
        if (namespace == null || namespace.isBlank() || namespace.contains("/")) {
            throw BackendConfigException.invalid("BACKEND.namespace", "must be a non-empty name without '/'");
        }
        if (storageKind == StorageKind.JDBC && (databaseUrl == null || !databaseUrl.startsWith("jdbc:"))) {
            throw BackendConfigException.invalid("STORAGE.database_url", "must be a JDBC URL");
        }
        if (databasePoolSize < 1) {
            throw BackendConfigException.invalid("STORAGE.pool_size", "must be positive");
        }
        if (signedUrlTtl.isNegative() || signedUrlTtl.isZero()) {
            throw BackendConfigException.invalid("STORAGE.signed_url_ttl", "must be positive");
        }
        if (vaultMasterKey != null) {
            int length = decodeKey("SECRETS.master_key", vaultMasterKey).length;
            if (length != 16 && length != 24 && length != 32) {
                throw BackendConfigException.invalid("SECRETS.master_key", "AES key must be 16, 24 or 32 bytes");
            }
        }
        if (interruptedJobStatus == null) {
            throw BackendConfigException.missing("RUNS.interrupted_job_status");
        }
        if (logPageSize < 1) {
            throw BackendConfigException.invalid("RUNS.log_page_size", "must be positive");
        }
        if (transferThreads < 1) {
            throw BackendConfigException.invalid("STORAGE.transfer_threads", "must be positive");
        }
        if (type == BackendType.YANDEX) {
            List<String> missing = new ArrayList<>();
            if (isBlank(folderId)) missing.add("CLOUD.folder_id");
            if (isBlank(zoneId)) missing.add("CLOUD.zone_id");
            if (isBlank(subnetId)) missing.add("NETWORK.subnet_id");
            if (isBlank(imageId)) missing.add("VM.image_id");
            if (isBlank(sshPublicKey)) missing.add("SSH.public_key");
            if (!missing.isEmpty()) {
                throw new BackendConfigException("Missing Yandex Cloud settings: " + missing,
                        BackendConfigException.MISSING_FIELD, missing);
            }
        }
        return this;
    }

    // Getters
    public BackendType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String namespace() {
        return namespace;
    }

    public StorageKind storageKind() {
        return storageKind;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Path storageRoot() {
        return storageRoot;
    }

    public String signedUrlBaseUrl() {
        return signedUrlBaseUrl;
    }

    /** Signing key bytes; when unset a key derived from the namespace is used (local use only) */
    public byte[] signingKeyBytes() {
        String key = signingKey != null ? signingKey : "jobhub-local-" + namespace;
        return key.getBytes(StandardCharsets.UTF_8);
    }

    public Duration signedUrlTtl() {
        return signedUrlTtl;
    }

    public Retry storageRetry() {
        return new Retry(storageRetryAttempts, Duration.ofMillis(200), 2.0, Duration.ofSeconds(5));
    }

    public byte[] vaultMasterKeyBytes() {
        return vaultMasterKey == null ? null : decodeKey("SECRETS.master_key", vaultMasterKey);
    }

    public JobStatus interruptedJobStatus() {
        return interruptedJobStatus;
    }

    public List<JobStatus> runStatusPrecedence() {
        return runStatusPrecedence;
    }

    public int logPageSize() {
        return logPageSize;
    }

    public int transferThreads() {
        return transferThreads;
    }

    public Path localWorkDir() {
        return localWorkDir;
    }

    public String oauthTokenEnv() {
        return oauthTokenEnv;
    }

    public String cloudId() {
        return cloudId;
    }

    public String folderId() {
        return folderId;
    }

    public String zoneId() {
        return zoneId;
    }

    public String subnetId() {
        return subnetId;
    }

    public String securityGroupId() {
        return securityGroupId;
    }

    public boolean assignPublicIp() {
        return assignPublicIp;
    }

    public String imageId() {
        return imageId;
    }

    public String platformId() {
        return platformId;
    }

    public int diskGb() {
        return diskGb;
    }

    public boolean preemptible() {
        return preemptible;
    }

    public String sshUser() {
        return sshUser;
    }

    public String sshPublicKey() {
        return sshPublicKey;
    }

    // Fluent setters for testing/customization
    public BackendConfig withType(BackendType type) {
        this.type = type;
        return this;
    }

    public BackendConfig withName(String name) {
        this.name = name;
        return this;
    }

    public BackendConfig withNamespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    public BackendConfig withStorageKind(StorageKind storageKind) {
        this.storageKind = storageKind;
        return this;
    }

    public BackendConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public BackendConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public BackendConfig withStorageRoot(Path storageRoot) {
        this.storageRoot = storageRoot;
        return this;
    }

    public BackendConfig withSignedUrlBaseUrl(String baseUrl) {
        this.signedUrlBaseUrl = baseUrl;
        return this;
    }

    public BackendConfig withSigningKey(String signingKey) {
        this.signingKey = signingKey;
        return this;
    }

    public BackendConfig withSignedUrlTtl(Duration ttl) {
        this.signedUrlTtl = ttl;
        return this;
    }

    public BackendConfig withStorageRetryAttempts(int attempts) {
        this.storageRetryAttempts = attempts;
        return this;
    }

    public BackendConfig withVaultMasterKey(String base64Key) {
        this.vaultMasterKey = base64Key;
        return this;
    }

    public BackendConfig withInterruptedJobStatus(JobStatus status) {
        this.interruptedJobStatus = status;
        return this;
    }

    public BackendConfig withRunStatusPrecedence(List<JobStatus> precedence) {
        this.runStatusPrecedence = precedence == null ? null : List.copyOf(precedence);
        return this;
    }

    public BackendConfig withLogPageSize(int pageSize) {
        this.logPageSize = pageSize;
        return this;
    }

    public BackendConfig withTransferThreads(int threads) {
        this.transferThreads = threads;
        return this;
    }

    public BackendConfig withLocalWorkDir(Path workDir) {
        this.localWorkDir = workDir;
        return this;
    }

    public BackendConfig withOauthTokenEnv(String envName) {
        this.oauthTokenEnv = envName;
        return this;
    }

    public BackendConfig withCloudId(String cloudId) {
        this.cloudId = cloudId;
        return this;
    }

    public BackendConfig withFolderId(String folderId) {
        this.folderId = folderId;
        return this;
    }

    public BackendConfig withZoneId(String zoneId) {
        this.zoneId = zoneId;
        return this;
    }

    public BackendConfig withSubnetId(String subnetId) {
        this.subnetId = subnetId;
        return this;
    }

    public BackendConfig withSecurityGroupId(String securityGroupId) {
        this.securityGroupId = securityGroupId;
        return this;
    }

    public BackendConfig withAssignPublicIp(boolean assignPublicIp) {
        this.assignPublicIp = assignPublicIp;
        return this;
    }

    public BackendConfig withImageId(String imageId) {
        this.imageId = imageId;
        return this;
    }

    public BackendConfig withPlatformId(String platformId) {
        this.platformId = platformId;
        return this;
    }

    public BackendConfig withDiskGb(int diskGb) {
        this.diskGb = diskGb;
        return this;
    }

    public BackendConfig withPreemptible(boolean preemptible) {
        this.preemptible = preemptible;
        return this;
    }

    public BackendConfig withSshUser(String sshUser) {
        this.sshUser = sshUser;
        return this;
    }

    public BackendConfig withSshPublicKey(String sshPublicKey) {
        this.sshPublicKey = sshPublicKey;
        return this;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static byte[] decodeKey(String field, String base64) {
        try {
            return Base64.getDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw BackendConfigException.invalid(field, "not valid Base64");
        }
    }

    @Override
    public String toString() {
        return "BackendConfig{" +
                "type=" + type +
                ", name='" + name + '\'' +
                ", namespace='" + namespace + '\'' +
                ", storage=" + storageKind +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", folderId='" + folderId + '\'' +
                ", zoneId='" + zoneId + '\'' +
                ", vaultKeySet=" + (vaultMasterKey != null) +
                '}';
    }
}
