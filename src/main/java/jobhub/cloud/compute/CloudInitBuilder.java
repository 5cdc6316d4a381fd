package jobhub.cloud.compute;

import jobhub.backend.model.Job;

import java.util.Map;
import java.util.TreeMap;

/**
 * cloud-init user data that creates the SSH user and runs the job's commands once at boot.
 * Output goes to {@code /var/log/jobhub/<jobId>.log} on the instance.
 */
public final class CloudInitBuilder {

    static final String JOB_ROOT = "/opt/jobhub/";
    static final String ENV_FILE = "/etc/default/jobhub-job";

    private CloudInitBuilder() {}

    public static String buildUserData(String user, String sshPublicKey, Job job) {
        StringBuilder sb = new StringBuilder();
        sb.append("#cloud-config\n");
        sb.append("ssh_pwauth: no\n");
        sb.append("users:\n");
        sb.append("  - name: ").append(user).append("\n");
        sb.append("    sudo: ALL=(ALL) NOPASSWD:ALL\n");
        sb.append("    shell: /bin/bash\n");
        sb.append("    ssh_authorized_keys:\n");
        sb.append("      - ").append(sshPublicKey.trim()).append("\n");

        Map<String, String> env = new TreeMap<>(job.env());
        env.put("JOBHUB_REPO_ID", job.repoId());
        env.put("JOBHUB_RUN_NAME", job.runName());
        env.put("JOBHUB_JOB_ID", job.jobId());
        sb.append("write_files:\n");
        sb.append("  - path: ").append(ENV_FILE).append("\n");
        sb.append("    permissions: '0600'\n");
        sb.append("    content: |\n");
        env.forEach((k, v) -> sb.append("      ").append(k).append("=").append(shellQuote(v)).append("\n"));

        String workDir = JOB_ROOT + job.jobId() + (job.workingDir() != null ? "/" + job.workingDir() : "");
        sb.append("runcmd:\n");
        sb.append("  - |\n");
        sb.append("    mkdir -p /var/log/jobhub ").append(shellQuote(workDir)).append("\n");
        sb.append("    cd ").append(shellQuote(workDir)).append("\n");
        sb.append("    set -a; . ").append(ENV_FILE).append("; set +a\n");
        sb.append("    (\n");
        sb.append("      set -e\n");
        for (String command : job.commands()) {
            for (String line : command.split("\n")) {
                sb.append("      ").append(line).append("\n");
            }
        }
        sb.append("    ) > /var/log/jobhub/").append(job.jobId()).append(".log 2>&1\n");
        return sb.toString();
    }

    /** Single-quote a value for POSIX sh */
    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
