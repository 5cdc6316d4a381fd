package jobhub.cloud.compute;

import jobhub.backend.model.Job;
import jobhub.backend.support.Jobs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CloudInitBuilderTest {

    @Test
    void userDataCreatesUserAndRunsCommands() {
        Job job = Jobs.job("repo", "run-1", "job-1")
                .commands(List.of("pip install -r requirements.txt", "python train.py"))
                .workingDir("src")
                .build();

        String userData = CloudInitBuilder.buildUserData("runner", "ssh-ed25519 AAAA\n", job);

        assertTrue(userData.startsWith("#cloud-config\n"));
        assertTrue(userData.contains("  - name: runner\n"));
        assertTrue(userData.contains("      - ssh-ed25519 AAAA\n"));
        assertTrue(userData.contains("cd '/opt/jobhub/job-1/src'"));
        assertTrue(userData.contains("      set -e\n      pip install -r requirements.txt\n      python train.py\n"));
        assertTrue(userData.contains("> /var/log/jobhub/job-1.log 2>&1"));
    }

    @Test
    void envIsQuotedIntoEnvFile() {
        Job job = Jobs.job("repo", "run-1", "job-1").env(Map.of("MSG", "it's fine")).build();

        String userData = CloudInitBuilder.buildUserData("runner", "key", job);

        assertTrue(userData.contains("      MSG='it'\"'\"'s fine'\n"));
        assertTrue(userData.contains("      JOBHUB_RUN_NAME='run-1'\n"));
        assertTrue(userData.contains("permissions: '0600'"));
    }

    @Test
    void shellQuote() {
        assertEquals("'plain'", CloudInitBuilder.shellQuote("plain"));
        assertEquals("'$HOME'", CloudInitBuilder.shellQuote("$HOME"));
    }
}
