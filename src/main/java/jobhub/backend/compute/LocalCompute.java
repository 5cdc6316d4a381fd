package jobhub.backend.compute;

import jobhub.backend.error.LaunchException;
import jobhub.backend.error.NotFoundException;
import jobhub.backend.logs.JdbcLogSink;
import jobhub.backend.logs.LogGroups;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import jobhub.backend.model.JobErrorCode;
import jobhub.backend.model.JobStatus;
import jobhub.backend.model.LogEvent;
import jobhub.backend.model.LogEventSource;
import jobhub.backend.model.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compute that runs each job as a local shell process in {@code <workDir>/<jobId>}.
 * Output lines go to the job log group, lifecycle notes to the runner group, and
 * status changes are reported through a {@link StatusListener} from a watcher thread.
 */
public class LocalCompute implements Compute, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalCompute.class);
    private static final long STOP_GRACE_SECONDS = 5;
    private static final Duration DEFAULT_SHELL_TIMEOUT = Duration.ofSeconds(60);

    /** Receives status changes of launched jobs */
    @FunctionalInterface
    public interface StatusListener {
        void onStatus(Job job, JobStatus status, JobErrorCode errorCode, Integer exitCode);
    }

    private final Path workDir;
    private final String namespace;
    private final JdbcLogSink logSink;
    private final StatusListener listener;
    private final InstanceType localInstance;
    private final Duration shellTimeout;
    private final Map<String, LocalProcess> processes = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public LocalCompute(Path workDir, String namespace, JdbcLogSink logSink, StatusListener listener) {
        this(workDir, namespace, logSink, listener, DEFAULT_SHELL_TIMEOUT);
    }

    public LocalCompute(Path workDir, String namespace, JdbcLogSink logSink, StatusListener listener,
                        Duration shellTimeout) {
        this.shellTimeout = shellTimeout;
        this.workDir = workDir.toAbsolutePath().normalize();
        this.namespace = namespace;
        this.logSink = logSink;
        this.listener = listener;
        this.localInstance = detectLocalInstance();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "local-compute-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Local compute in {} offering {}", this.workDir, localInstance);
    }

    @Override
    public Optional<InstanceType> predictInstanceType(Job job) {
        return job.requirements().isSatisfiedBy(localInstance) ? Optional.of(localInstance) : Optional.empty();
    }

    @Override
    public String launch(Job job, InstanceType instanceType) throws LaunchException {
        if (job.commands().isEmpty()) {
            throw new LaunchException("Job " + job.jobId() + " has no commands", RequestStatus.TERMINATED);
        }
        Path jobDir = workDir.resolve(job.jobId());
        Path cwd = job.workingDir() != null ? jobDir.resolve(job.workingDir()).normalize() : jobDir;
        if (!cwd.startsWith(jobDir)) {
            throw new LaunchException("Working dir escapes job dir: " + job.workingDir(), RequestStatus.TERMINATED);
        }

        Process process;
        try {
            Files.createDirectories(cwd);
            ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", String.join(" && ", job.commands()));
            pb.directory(cwd.toFile());
            pb.environment().putAll(job.env());
            pb.environment().put("JOBHUB_REPO_ID", job.repoId());
            pb.environment().put("JOBHUB_RUN_NAME", job.runName());
            pb.environment().put("JOBHUB_JOB_ID", job.jobId());
            process = pb.start();
        } catch (IOException e) {
            throw new LaunchException("Cannot start job " + job.jobId() + ": " + e.getMessage(),
                    RequestStatus.TERMINATED, e);
        }

        String requestId = "local-" + UUID.randomUUID();
        LocalProcess local = new LocalProcess(job, process, cwd);
        processes.put(requestId, local);
        diagnostic(job, "Started process " + process.pid() + " for request " + requestId);
        log.info("Launched job {} as process {} ({})", job.jobId(), process.pid(), requestId);

        // Status is reported from another thread so the launching caller can record the request first
        executor.submit(() -> pump(job, process.getInputStream(), LogEventSource.STDOUT));
        executor.submit(() -> pump(job, process.getErrorStream(), LogEventSource.STDERR));
        executor.submit(() -> watch(requestId, local));
        return requestId;
    }

    @Override
    public void terminate(String requestId) {
        LocalProcess local = processes.get(requestId);
        if (local == null || !local.process.isAlive()) {
            log.debug("Request {} already gone", requestId);
            return;
        }
        local.stopRequested = true;
        local.process.destroy();
        try {
            if (!local.process.waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Process {} ignored SIGTERM, killing", local.process.pid());
                local.process.destroyForcibly().waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            local.process.destroyForcibly();
        }
        diagnostic(local.job, "Terminated request " + requestId);
        log.info("Terminated request {}", requestId);
    }

    @Override
    public RequestStatus requestStatus(String requestId) {
        LocalProcess local = processes.get(requestId);
        return local != null && local.process.isAlive() ? RequestStatus.RUNNING : RequestStatus.TERMINATED;
    }

    @Override
    public ShellResult runShell(String requestId, List<String> commands) {
        LocalProcess local = processes.get(requestId);
        if (local == null || !local.process.isAlive()) {
            throw new NotFoundException("No live request " + requestId);
        }
        Process shell;
        try {
            shell = new ProcessBuilder("/bin/sh", "-c", String.join(" && ", commands))
                    .directory(local.cwd.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new IllegalStateException("Shell on " + requestId + " failed: " + e.getMessage(), e);
        }
        Future<String> output = executor.submit(
                () -> new String(shell.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
        try {
            if (!shell.waitFor(shellTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Shell on {} timed out after {}", requestId, shellTimeout);
                shell.destroyForcibly();
                return new ShellResult(-1, collect(output, requestId));
            }
            return new ShellResult(shell.exitValue(), collect(output, requestId));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shell.destroyForcibly();
            throw new IllegalStateException("Interrupted running shell on " + requestId, e);
        }
    }

    /** Number of requests whose process has not been reaped yet */
    int trackedRequests() {
        return processes.size();
    }

    @Override
    public void close() {
        processes.forEach((requestId, local) -> {
            if (local.process.isAlive()) {
                local.stopRequested = true;
                local.process.destroyForcibly();
            }
        });
        executor.shutdownNow();
        log.info("Local compute closed");
    }

    // --- Internals ---

    private void watch(String requestId, LocalProcess local) {
        Job job = local.job;
        notify(job, JobStatus.RUNNING, null, null);
        try {
            int exitCode = local.process.waitFor();
            diagnostic(job, "Process exited with code " + exitCode);
            if (local.stopRequested) {
                notify(job, JobStatus.STOPPED, null, exitCode);
            } else if (exitCode == 0) {
                notify(job, JobStatus.DONE, null, exitCode);
            } else {
                notify(job, JobStatus.FAILED, JobErrorCode.CONTAINER_EXITED_WITH_ERROR, exitCode);
            }
            log.info("Job {} ({}) exited with code {}", job.jobId(), requestId, exitCode);
            processes.remove(requestId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Watcher of {} interrupted", requestId);
        }
    }

    /** Output read so far; a grandchild still holding the pipe open yields what was read before the grace period */
    private String collect(Future<String> output, String requestId) throws InterruptedException {
        try {
            return output.get(STOP_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cannot read shell output on " + requestId, e.getCause());
        } catch (TimeoutException e) {
            output.cancel(true);
            log.warn("Shell output on {} still open, discarding it", requestId);
            return "";
        }
    }

    private void notify(Job job, JobStatus status, JobErrorCode errorCode, Integer exitCode) {
        try {
            listener.onStatus(job, status, errorCode, exitCode);
        } catch (RuntimeException e) {
            log.warn("Status listener failed for job {} -> {}: {}", job.jobId(), status, e.getMessage());
        }
    }

    private void pump(Job job, InputStream stream, LogEventSource source) {
        String group = LogGroups.jobs(namespace, job.repoId());
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logSink.append(group, job.runName(), new LogEvent(Instant.now(), job.jobId(), line, source));
            }
        } catch (IOException e) {
            log.debug("Output of job {} closed: {}", job.jobId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Cannot store output of job {}: {}", job.jobId(), e.getMessage());
        }
    }

    private void diagnostic(Job job, String message) {
        try {
            logSink.append(LogGroups.runners(namespace), job.jobId(),
                    new LogEvent(Instant.now(), job.jobId(), message, LogEventSource.DIAGNOSTIC));
        } catch (RuntimeException e) {
            log.warn("Cannot store diagnostic of job {}: {}", job.jobId(), e.getMessage());
        }
    }

    private static InstanceType detectLocalInstance() {
        int cpus = Runtime.getRuntime().availableProcessors();
        long memoryBytes = Runtime.getRuntime().maxMemory();
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            memoryBytes = os.getTotalMemorySize();
        }
        return new InstanceType("local", cpus, (int) (memoryBytes / (1024 * 1024)), 0, false);
    }

    private static final class LocalProcess {
        final Job job;
        final Process process;
        final Path cwd;
        volatile boolean stopRequested;

        LocalProcess(Job job, Process process, Path cwd) {
            this.job = job;
            this.process = process;
            this.cwd = cwd;
        }
    }
}
