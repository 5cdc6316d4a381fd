package jobhub.backend.config;

import jobhub.backend.error.BackendConfigException;
import jobhub.backend.model.JobStatus;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads backend settings from an INI file.
 * Sections: [BACKEND], [STORAGE], [SECRETS], [RUNS], [LOCAL], [CLOUD], [NETWORK], [VM], [SSH].
 *
 * <pre>
 * [BACKEND]
 * type = yandex
 * namespace = team-a
 *
 * [CLOUD]
 * folder_id = b1g...
 * zone_id = ru-central1-a
 * </pre>
 */
public class IniBackendConfigurator implements Configurator {

    private static final Logger log = LoggerFactory.getLogger(IniBackendConfigurator.class);

    /** Read the file and configure from its values */
    public BackendConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file)) {
            Ini ini = new Ini(reader);
            Map<String, String> values = flatten(ini);
            log.info("Loaded backend settings from {} ({} values)", file, values.size());
            return configure(values);
        } catch (IOException e) {
            throw new BackendConfigException("Cannot read " + file + ": " + e.getMessage(),
                    BackendConfigException.INVALID_CONFIG, List.of(), e);
        }
    }

    @Override
    public BackendConfig configure(Map<String, String> values) {
        BackendConfig cfg = BackendConfig.defaults();

        // BACKEND
        apply(values, "BACKEND.type", BackendType::parse, cfg::withType);
        apply(values, "BACKEND.name", Function.identity(), cfg::withName);
        apply(values, "BACKEND.namespace", Function.identity(), cfg::withNamespace);

        // STORAGE
        apply(values, "STORAGE.kind", v -> parseEnum("STORAGE.kind", v, BackendConfig.StorageKind.class),
                cfg::withStorageKind);
        apply(values, "STORAGE.database_url", Function.identity(), cfg::withDatabaseUrl);
        apply(values, "STORAGE.pool_size", v -> parseInt("STORAGE.pool_size", v), cfg::withDatabasePoolSize);
        apply(values, "STORAGE.root", Path::of, cfg::withStorageRoot);
        apply(values, "STORAGE.signed_url_base", Function.identity(), cfg::withSignedUrlBaseUrl);
        apply(values, "STORAGE.signing_key", Function.identity(), cfg::withSigningKey);
        apply(values, "STORAGE.signed_url_ttl", v -> parseDuration("STORAGE.signed_url_ttl", v),
                cfg::withSignedUrlTtl);
        apply(values, "STORAGE.retry_attempts", v -> parseInt("STORAGE.retry_attempts", v),
                cfg::withStorageRetryAttempts);
        apply(values, "STORAGE.transfer_threads", v -> parseInt("STORAGE.transfer_threads", v),
                cfg::withTransferThreads);

        // SECRETS
        apply(values, "SECRETS.master_key", Function.identity(), cfg::withVaultMasterKey);

        // RUNS
        apply(values, "RUNS.interrupted_job_status",
                v -> parseEnum("RUNS.interrupted_job_status", v, JobStatus.class), cfg::withInterruptedJobStatus);
        apply(values, "RUNS.status_precedence", v -> parsePrecedence("RUNS.status_precedence", v),
                cfg::withRunStatusPrecedence);
        apply(values, "RUNS.log_page_size", v -> parseInt("RUNS.log_page_size", v), cfg::withLogPageSize);

        // LOCAL
        apply(values, "LOCAL.work_dir", Path::of, cfg::withLocalWorkDir);

        // CLOUD
        apply(values, "CLOUD.oauth_token_env", Function.identity(), cfg::withOauthTokenEnv);
        apply(values, "CLOUD.cloud_id", Function.identity(), cfg::withCloudId);
        apply(values, "CLOUD.folder_id", Function.identity(), cfg::withFolderId);
        apply(values, "CLOUD.zone_id", Function.identity(), cfg::withZoneId);

        // NETWORK
        apply(values, "NETWORK.subnet_id", Function.identity(), cfg::withSubnetId);
        apply(values, "NETWORK.security_group_id", Function.identity(), cfg::withSecurityGroupId);
        apply(values, "NETWORK.public_ip", v -> parseBoolean("NETWORK.public_ip", v), cfg::withAssignPublicIp);

        // VM
        apply(values, "VM.image_id", Function.identity(), cfg::withImageId);
        apply(values, "VM.platform_id", Function.identity(), cfg::withPlatformId);
        apply(values, "VM.disk_gb", v -> parseInt("VM.disk_gb", v), cfg::withDiskGb);
        apply(values, "VM.preemptible", v -> parseBoolean("VM.preemptible", v), cfg::withPreemptible);

        // SSH: key text wins over key file
        apply(values, "SSH.user", Function.identity(), cfg::withSshUser);
        String keyText = opt(values, "SSH.public_key");
        String keyPath = opt(values, "SSH.public_key_path");
        if (keyText == null && keyPath != null) {
            keyText = readKey(keyPath);
        }
        if (keyText != null) {
            cfg.withSshPublicKey(keyText.trim());
        }

        return cfg.validate();
    }

    // ===== helpers =====

    static Map<String, String> flatten(Ini ini) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Profile.Section section : ini.values()) {
            for (Map.Entry<String, String> entry : section.entrySet()) {
                values.put(section.getName().toUpperCase() + "." + entry.getKey(), entry.getValue());
            }
        }
        return values;
    }

    private static <T> void apply(Map<String, String> values, String field,
                                  Function<String, T> parser, Consumer<T> setter) {
        String raw = opt(values, field);
        if (raw != null) {
            setter.accept(parser.apply(raw));
        }
    }

    private static String opt(Map<String, String> values, String field) {
        String v = values.get(field);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static int parseInt(String field, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw BackendConfigException.invalid(field, "not an integer: " + value);
        }
    }

    private static boolean parseBoolean(String field, String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        throw BackendConfigException.invalid(field, "expected true or false: " + value);
    }

    /** ISO-8601 ({@code PT30M}) or plain seconds */
    private static Duration parseDuration(String field, String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw BackendConfigException.invalid(field, "not a duration: " + value);
        }
    }

    private static <E extends Enum<E>> E parseEnum(String field, String value, Class<E> type) {
        try {
            return Enum.valueOf(type, value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw BackendConfigException.invalid(field, "unknown value " + value);
        }
    }

    private static List<JobStatus> parsePrecedence(String field, String value) {
        return Arrays.stream(value.split("[,>\\s]+"))
                .filter(s -> !s.isBlank())
                .map(s -> parseEnum(field, s, JobStatus.class))
                .toList();
    }

    private static String readKey(String keyPath) {
        try {
            return Files.readString(Path.of(keyPath)).trim();
        } catch (IOException e) {
            throw new BackendConfigException("Cannot read SSH key " + keyPath,
                    BackendConfigException.INVALID_VALUE, List.of("SSH.public_key_path"), e);
        }
    }
}
