package jobhub.backend.logs;

import jobhub.backend.error.LogGroupNotFoundException;
import jobhub.backend.model.Job;
import jobhub.backend.model.JobHead;
import jobhub.backend.model.LogEvent;
import jobhub.backend.model.LogEventSource;
import jobhub.backend.model.StatusTransition;
import jobhub.backend.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the logs of a run as one time-ordered stream.
 * <p>
 * Job output comes from stream {@code <runName>} of group {@code jobs/<namespace>/<repoId>}.
 * With {@code diagnose}, each job's stream in {@code runners/<namespace>} is merged in.
 * When the job group does not exist the run's status history is returned instead.
 */
public class LogReader {

    private static final Logger log = LoggerFactory.getLogger(LogReader.class);

    private final LogSink sink;
    private final JobRepository jobRepository;
    private final String namespace;
    private final int pageSize;

    public LogReader(LogSink sink, JobRepository jobRepository, String namespace, int pageSize) {
        this.sink = sink;
        this.jobRepository = jobRepository;
        this.namespace = namespace;
        this.pageSize = pageSize;
    }

    /**
     * Events of the run within {@code [startTime, endTime)}. Pages are fetched lazily as the
     * stream is consumed; to resume, poll again with the last seen timestamp as start.
     *
     * @param endTime    exclusive upper bound, null for open-ended
     * @param descending newest first
     * @param diagnose   also include runner diagnostics
     */
    public Stream<LogEvent> pollLogs(String repoId, String runName, Instant startTime, Instant endTime,
                                     boolean descending, boolean diagnose) {
        List<Iterator<LogEvent>> sources = new ArrayList<>();

        LogQuery jobQuery = new LogQuery(LogGroups.jobs(namespace, repoId), runName,
                startTime, endTime, descending, null, pageSize);
        PagedLogIterator jobEvents = new PagedLogIterator(sink, jobQuery, false);
        try {
            // Fetch the first page now to find out whether the group exists
            jobEvents.hasNext();
            sources.add(jobEvents);
        } catch (LogGroupNotFoundException e) {
            log.debug("No job log group for {}/{}, falling back to status history", repoId, runName);
            sources.add(statusHistory(repoId, runName, startTime, endTime, descending).iterator());
        }

        if (diagnose) {
            for (JobHead head : jobRepository.findHeads(repoId, runName)) {
                LogQuery runnerQuery = new LogQuery(LogGroups.runners(namespace), head.jobId(),
                        startTime, endTime, descending, null, pageSize);
                sources.add(new PagedLogIterator(sink, runnerQuery, true));
            }
        }

        Iterator<LogEvent> merged = sources.size() == 1 ? sources.get(0) : new MergingLogIterator(sources, descending);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(merged, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Status changes of the run's jobs rendered as diagnostic events */
    List<LogEvent> statusHistory(String repoId, String runName, Instant startTime, Instant endTime,
                                 boolean descending) {
        List<LogEvent> events = new ArrayList<>();
        for (Job job : jobRepository.findByRun(repoId, runName)) {
            for (StatusTransition transition : job.transitions()) {
                Instant at = transition.at();
                if (at == null || at.isBefore(startTime) || (endTime != null && !at.isBefore(endTime))) {
                    continue;
                }
                events.add(new LogEvent(at, job.jobId(),
                        "Job " + job.jobId() + " is " + transition.status(), LogEventSource.DIAGNOSTIC));
            }
        }
        Comparator<LogEvent> byTime = Comparator.comparing(LogEvent::timestamp);
        events.sort(descending ? byTime.reversed() : byTime);
        return events;
    }
}
