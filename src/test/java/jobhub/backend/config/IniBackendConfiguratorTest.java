package jobhub.backend.config;

import jobhub.backend.error.BackendConfigException;
import jobhub.backend.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IniBackendConfiguratorTest {

    private final IniBackendConfigurator configurator = new IniBackendConfigurator();

    @TempDir
    Path dir;

    @Test
    void emptyInputGivesDefaults() {
        BackendConfig config = configurator.configure(Map.of());

        assertEquals(BackendType.LOCAL, config.type());
        assertEquals("jobhub", config.namespace());
        assertEquals(JobStatus.FAILED, config.interruptedJobStatus());
        assertNull(config.runStatusPrecedence());
    }

    @Test
    void loadsIniFile() throws Exception {
        Path key = Files.writeString(dir.resolve("id.pub"), "ssh-ed25519 AAAA user@host\n");
        Path file = Files.writeString(dir.resolve("backend.ini"), """
                [BACKEND]
                type = yandex
                name = yc-main
                namespace = team-a

                [STORAGE]
                database_url = jdbc:h2:mem:cfg
                signed_url_ttl = PT30M
                transfer_threads = 8

                [RUNS]
                interrupted_job_status = stopped
                log_page_size = 50

                [CLOUD]
                folder_id = b1gfolder
                zone_id = ru-central1-a

                [NETWORK]
                subnet_id = e9bsubnet
                public_ip = false

                [VM]
                image_id = fd8image
                disk_gb = 50
                preemptible = false

                [SSH]
                public_key_path = %s
                """.formatted(key.toString().replace("\\", "/")));

        BackendConfig config = configurator.load(file);

        assertEquals(BackendType.YANDEX, config.type());
        assertEquals("yc-main", config.name());
        assertEquals("team-a", config.namespace());
        assertEquals("jdbc:h2:mem:cfg", config.databaseUrl());
        assertEquals(Duration.ofMinutes(30), config.signedUrlTtl());
        assertEquals(8, config.transferThreads());
        assertEquals(JobStatus.STOPPED, config.interruptedJobStatus());
        assertEquals(50, config.logPageSize());
        assertEquals("b1gfolder", config.folderId());
        assertEquals("e9bsubnet", config.subnetId());
        assertFalse(config.assignPublicIp());
        assertEquals(50, config.diskGb());
        assertFalse(config.preemptible());
        assertEquals("ssh-ed25519 AAAA user@host", config.sshPublicKey());
    }

    @Test
    void yandexWithoutCloudSettingsListsMissingFields() {
        BackendConfigException e = assertThrows(BackendConfigException.class,
                () -> configurator.configure(Map.of("BACKEND.type", "yandex", "CLOUD.folder_id", "b1g")));

        assertEquals(BackendConfigException.MISSING_FIELD, e.code());
        assertEquals(List.of("CLOUD.zone_id", "NETWORK.subnet_id", "VM.image_id", "SSH.public_key"), e.fields());
    }

    @Test
    void badValuesNameTheirField() {
        assertField("STORAGE.pool_size", Map.of("STORAGE.pool_size", "many"));
        assertField("NETWORK.public_ip", Map.of("NETWORK.public_ip", "yes"));
        assertField("STORAGE.signed_url_ttl", Map.of("STORAGE.signed_url_ttl", "soon"));
        assertField("BACKEND.type", Map.of("BACKEND.type", "aws"));
        assertField("RUNS.interrupted_job_status", Map.of("RUNS.interrupted_job_status", "gone"));
        assertField("BACKEND.namespace", Map.of("BACKEND.namespace", "a/b"));
        assertField("SECRETS.master_key", Map.of("SECRETS.master_key", "c2hvcnQ="));
    }

    @Test
    void ttlInSeconds() {
        assertEquals(Duration.ofSeconds(90),
                configurator.configure(Map.of("STORAGE.signed_url_ttl", "90")).signedUrlTtl());
    }

    @Test
    void statusPrecedenceList() {
        BackendConfig config = configurator.configure(Map.of("RUNS.status_precedence",
                "running > pending, submitted downloading uploading stopping failed aborted stopped done"));

        assertEquals(JobStatus.RUNNING, config.runStatusPrecedence().get(0));
        assertEquals(JobStatus.PENDING, config.runStatusPrecedence().get(1));
        assertEquals(10, config.runStatusPrecedence().size());
    }

    @Test
    void unreadableKeyFile() {
        BackendConfigException e = assertThrows(BackendConfigException.class,
                () -> configurator.configure(Map.of("SSH.public_key_path", dir.resolve("none.pub").toString())));
        assertEquals(List.of("SSH.public_key_path"), e.fields());
    }

    @Test
    void missingFileIsConfigError() {
        BackendConfigException e = assertThrows(BackendConfigException.class,
                () -> configurator.load(dir.resolve("absent.ini")));
        assertEquals(BackendConfigException.INVALID_CONFIG, e.code());
    }

    private void assertField(String field, Map<String, String> values) {
        BackendConfigException e = assertThrows(BackendConfigException.class, () -> configurator.configure(values));
        assertEquals(List.of(field), e.fields(), e.getMessage());
    }
}
