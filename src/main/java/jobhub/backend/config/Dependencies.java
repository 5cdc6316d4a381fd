package jobhub.backend.config;

import jobhub.backend.Backend;
import jobhub.backend.compute.Compute;
import jobhub.backend.compute.LocalCompute;
import jobhub.backend.logs.JdbcLogSink;
import jobhub.backend.logs.LogReader;
import jobhub.backend.model.Job;
import jobhub.backend.model.JobErrorCode;
import jobhub.backend.model.JobStatus;
import jobhub.backend.repository.JobRepository;
import jobhub.backend.repository.ObjectStoreJobRepository;
import jobhub.backend.secrets.JdbcSecretVault;
import jobhub.backend.secrets.SecretVault;
import jobhub.backend.secrets.SecretsManager;
import jobhub.backend.service.ArtifactManager;
import jobhub.backend.service.JobStore;
import jobhub.backend.service.RepoManager;
import jobhub.backend.service.RunNames;
import jobhub.backend.service.RunReconciler;
import jobhub.backend.service.StatusPrecedence;
import jobhub.backend.service.TagManager;
import jobhub.backend.storage.Database;
import jobhub.backend.storage.FileSystemObjectStore;
import jobhub.backend.storage.JdbcObjectStore;
import jobhub.backend.storage.ObjectStore;
import jobhub.backend.storage.UrlSigner;
import jobhub.backend.util.Retry;
import jobhub.cloud.auth.AuthService;
import jobhub.cloud.compute.YandexCompute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

/**
 * Manual dependency injection container.
 * Creates and wires the components of one backend for its configured provider.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(BackendConfig.fromEnv())) {
 *     Backend backend = deps.backend();
 *     String runName = backend.createRun("my-repo");
 *     // ... create and run jobs, poll run heads and logs ...
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final BackendConfig config;
    private final Clock clock;
    private final Database database;
    private final ObjectStore objectStore;
    private final JdbcLogSink logSink;
    private final SecretVault secretVault;
    private final JobRepository jobRepository;
    private final Compute compute;
    private final JobStore jobStore;
    private final ArtifactManager artifactManager;
    private final Backend backend;

    private Dependencies(BackendConfig config, Clock clock) {
        this.config = config.validate();
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        UrlSigner urlSigner = new UrlSigner(config.signedUrlBaseUrl(), config.signingKeyBytes(), config.signedUrlTtl(), clock);
        this.objectStore = switch (config.storageKind()) {
            case JDBC -> new JdbcObjectStore(database, urlSigner);
            case FILESYSTEM -> new FileSystemObjectStore(config.storageRoot(), urlSigner);
        };
        this.logSink = new JdbcLogSink(database);
        this.secretVault = new JdbcSecretVault(database, config.vaultMasterKeyBytes());

        // Repositories
        this.jobRepository = new ObjectStoreJobRepository(objectStore);

        // Provider
        this.compute = switch (config.type()) {
            case LOCAL -> new LocalCompute(config.localWorkDir(), config.namespace(), logSink, this::onLocalStatus);
            case YANDEX -> new YandexCompute(
                    new AuthService(config.oauthTokenEnv(), Duration.ofMinutes(1)), config, Retry.defaults());
        };

        // Services
        this.jobStore = new JobStore(jobRepository, compute, clock);
        this.artifactManager = new ArtifactManager(objectStore, jobRepository, config.transferThreads());
        SecretsManager secretsManager = new SecretsManager(objectStore, secretVault, config.namespace());
        RunReconciler runReconciler = new RunReconciler(compute, jobRepository,
                StatusPrecedence.of(config.runStatusPrecedence()));
        TagManager tagManager = new TagManager(objectStore, jobStore, artifactManager, clock);
        LogReader logReader = new LogReader(logSink, jobRepository, config.namespace(), config.logPageSize());
        RepoManager repoManager = new RepoManager(objectStore, jobRepository, secretsManager);
        RunNames runNames = new RunNames(objectStore, new SecureRandom());

        this.backend = new Backend(config.name(), config.interruptedJobStatus(), objectStore, jobStore,
                runReconciler, artifactManager, tagManager, secretsManager, logReader, repoManager, runNames);

        log.info("Backend {} ({}) initialized", config.name(), config.type());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(BackendConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    public static Dependencies create(BackendConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(BackendConfig.fromEnv());
    }

    // Getters
    public BackendConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ObjectStore objectStore() {
        return objectStore;
    }

    public JdbcLogSink logSink() {
        return logSink;
    }

    public Compute compute() {
        return compute;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public Backend backend() {
        return backend;
    }

    /** Status changes observed by local processes */
    private void onLocalStatus(Job job, JobStatus status, JobErrorCode errorCode, Integer exitCode) {
        jobStore.reportStatus(job.repoId(), job.jobId(), status, errorCode, exitCode);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (compute instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing compute: {}", e.getMessage());
            }
        }

        artifactManager.close();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
