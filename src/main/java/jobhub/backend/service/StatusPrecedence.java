package jobhub.backend.service;

import jobhub.backend.error.BackendConfigException;
import jobhub.backend.model.JobStatus;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Total order over job statuses used to pick a run's status from its jobs' statuses:
 * the run takes the status ranked highest among its members.
 */
public final class StatusPrecedence {

    private static final List<JobStatus> DEFAULT_ORDER = List.of(
            JobStatus.RUNNING,
            JobStatus.DOWNLOADING,
            JobStatus.UPLOADING,
            JobStatus.STOPPING,
            JobStatus.PENDING,
            JobStatus.SUBMITTED,
            JobStatus.FAILED,
            JobStatus.ABORTED,
            JobStatus.STOPPED,
            JobStatus.DONE);

    private final List<JobStatus> order;
    private final Map<JobStatus, Integer> rank = new EnumMap<>(JobStatus.class);

    /**
     * @param highestFirst every status exactly once, highest precedence first
     * @throws BackendConfigException when a status is missing or repeated
     */
    public StatusPrecedence(List<JobStatus> highestFirst) {
        EnumSet<JobStatus> seen = EnumSet.noneOf(JobStatus.class);
        for (JobStatus status : highestFirst) {
            if (status == null || !seen.add(status)) {
                throw BackendConfigException.invalid("RUNS.status_precedence", "repeated status " + status);
            }
        }
        if (seen.size() != JobStatus.values().length) {
            Set<JobStatus> missing = EnumSet.complementOf(seen);
            throw BackendConfigException.invalid("RUNS.status_precedence", "missing statuses " + missing);
        }
        this.order = List.copyOf(highestFirst);
        for (int i = 0; i < order.size(); i++) {
            rank.put(order.get(i), order.size() - i);
        }
    }

    public static StatusPrecedence defaults() {
        return new StatusPrecedence(DEFAULT_ORDER);
    }

    /** Use the configured order, or the default one when none is configured */
    public static StatusPrecedence of(List<JobStatus> highestFirst) {
        return highestFirst == null ? defaults() : new StatusPrecedence(highestFirst);
    }

    public List<JobStatus> order() {
        return order;
    }

    public int rank(JobStatus status) {
        return rank.get(status);
    }

    /**
     * @throws IllegalArgumentException for an empty collection
     */
    public JobStatus highest(Collection<JobStatus> statuses) {
        return statuses.stream()
                .max((a, b) -> Integer.compare(rank(a), rank(b)))
                .orElseThrow(() -> new IllegalArgumentException("No statuses to rank"));
    }
}
