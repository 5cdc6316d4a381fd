package jobhub.backend.service;

import jobhub.backend.compute.Compute;
import jobhub.backend.model.AppHead;
import jobhub.backend.model.ArtifactHead;
import jobhub.backend.model.JobErrorCode;
import jobhub.backend.model.JobHead;
import jobhub.backend.model.JobStatus;
import jobhub.backend.model.RequestHead;
import jobhub.backend.model.RequestStatus;
import jobhub.backend.model.RunHead;
import jobhub.backend.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Folds job heads into run heads.
 * <p>
 * Optionally asks {@link Compute} about every unfinished job's request; a job whose request
 * is gone is reported with an effective status instead of its stored one. Nothing is
 * written back, so calling this repeatedly on the same input gives the same output.
 */
public class RunReconciler {

    private static final Logger log = LoggerFactory.getLogger(RunReconciler.class);

    private static final Comparator<RunHead> NEWEST_FIRST = Comparator
            .comparing(RunHead::submittedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(RunHead::runName);

    private final Compute compute;
    private final JobRepository jobRepository;
    private final StatusPrecedence precedence;

    public RunReconciler(Compute compute, JobRepository jobRepository, StatusPrecedence precedence) {
        this.compute = compute;
        this.jobRepository = jobRepository;
        this.precedence = precedence;
    }

    /**
     * @param includeRequestHeads     check live request state of unfinished jobs
     * @param interruptedJobNewStatus effective status of interrupted jobs (except STOPPING ones,
     *                                which become STOPPED)
     * @return run heads, newest submission first, ties by run name
     */
    public List<RunHead> getRunHeads(List<JobHead> jobHeads, boolean includeRequestHeads,
                                     JobStatus interruptedJobNewStatus) {
        Map<String, List<JobHead>> byRun = new LinkedHashMap<>();
        for (JobHead head : jobHeads) {
            byRun.computeIfAbsent(head.runName(), k -> new ArrayList<>()).add(head);
        }

        List<RunHead> runs = new ArrayList<>();
        for (List<JobHead> heads : byRun.values()) {
            runs.add(toRunHead(heads, includeRequestHeads, interruptedJobNewStatus));
        }
        runs.sort(NEWEST_FIRST);
        return runs;
    }

    private RunHead toRunHead(List<JobHead> heads, boolean includeRequestHeads, JobStatus interruptedJobNewStatus) {
        List<JobHead> effective = new ArrayList<>();
        List<RequestHead> requestHeads = new ArrayList<>();
        List<ArtifactHead> artifactHeads = new ArrayList<>();
        List<AppHead> appHeads = new ArrayList<>();
        boolean interrupted = false;

        for (JobHead head : heads) {
            JobHead current = head;
            if (includeRequestHeads && !head.isTerminal()) {
                JobHead checked = checkInterrupted(head, requestHeads, interruptedJobNewStatus);
                interrupted |= checked != head;
                current = checked;
            }
            effective.add(current);
            head.artifactPaths().forEach(path -> artifactHeads.add(new ArtifactHead(head.jobId(), path)));
            head.appNames().forEach(app -> appHeads.add(new AppHead(head.jobId(), app)));
        }

        JobHead first = heads.get(0);
        return new RunHead(
                first.repoId(),
                first.runName(),
                firstNonNull(heads, JobHead::workflowName),
                firstNonNull(heads, JobHead::providerName),
                firstNonNull(heads, JobHead::hubUserName),
                precedence.highest(effective.stream().map(JobHead::status).toList()),
                heads.stream().map(JobHead::submittedAt).filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null),
                firstNonNull(heads, JobHead::tagName),
                effective,
                artifactHeads,
                appHeads,
                requestHeads,
                interrupted);
    }

    /** The head with its effective status, or the same instance when not interrupted */
    private JobHead checkInterrupted(JobHead head, List<RequestHead> requestHeads, JobStatus interruptedJobNewStatus) {
        if (head.requestId() != null) {
            RequestStatus status;
            try {
                status = compute.requestStatus(head.requestId());
            } catch (RuntimeException e) {
                log.warn("Cannot check request {} of job {}, keeping {}: {}",
                        head.requestId(), head.jobId(), head.status(), e.getMessage());
                return head;
            }
            requestHeads.add(new RequestHead(head.jobId(), status, message(status)));
            if (status != RequestStatus.RUNNING) {
                JobErrorCode code = status == RequestStatus.NO_CAPACITY
                        ? JobErrorCode.INTERRUPTED_BY_NO_CAPACITY
                        : JobErrorCode.INSTANCE_TERMINATED;
                return interrupt(head, interruptedJobNewStatus, code);
            }
        }
        if (head.status() != JobStatus.SUBMITTED && jobRepository.findById(head.repoId(), head.jobId()).isEmpty()) {
            log.debug("Job {} has a head but no record", head.jobId());
            return interrupt(head, interruptedJobNewStatus, head.errorCode());
        }
        return head;
    }

    private static JobHead interrupt(JobHead head, JobStatus interruptedJobNewStatus, JobErrorCode code) {
        JobStatus next = head.status() == JobStatus.STOPPING ? JobStatus.STOPPED : interruptedJobNewStatus;
        log.debug("Job {} interrupted: {} -> {} ({})", head.jobId(), head.status(), next, code);
        return head.withStatus(next, next == JobStatus.STOPPED ? head.errorCode() : code);
    }

    private static String message(RequestStatus status) {
        return switch (status) {
            case RUNNING -> null;
            case TERMINATED -> "Instance is gone";
            case NO_CAPACITY -> "Provider ran out of capacity";
        };
    }

    private static <T> T firstNonNull(List<JobHead> heads, Function<JobHead, T> field) {
        return heads.stream().map(field).filter(Objects::nonNull).findFirst().orElse(null);
    }
}
