package jobhub.backend.logs;

import jobhub.backend.model.JobStatus;
import jobhub.backend.model.LogEvent;
import jobhub.backend.model.LogEventSource;
import jobhub.backend.repository.ObjectStoreJobRepository;
import jobhub.backend.service.JobStore;
import jobhub.backend.storage.Database;
import jobhub.backend.support.FakeCompute;
import jobhub.backend.support.Jobs;
import jobhub.backend.support.Stores;
import jobhub.backend.support.TestDatabases;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LogReaderTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static Database db;
    private static JdbcLogSink sink;

    @TempDir
    Path dir;

    private ObjectStoreJobRepository repository;
    private LogReader reader;

    @BeforeAll
    static void setupDatabase() {
        db = TestDatabases.create("log-reader");
        sink = new JdbcLogSink(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        TestDatabases.clean(db);
        repository = new ObjectStoreJobRepository(Stores.fileSystem(dir));
        reader = new LogReader(sink, repository, "ns", 2);
        JobStore jobStore = new JobStore(repository, new FakeCompute(), Clock.fixed(T0, ZoneOffset.UTC));
        jobStore.createJob(Jobs.job("repo", "run-1", "job-1").build());
    }

    @Test
    void readsJobStreamAcrossPages() {
        sink.appendAll(LogGroups.jobs("ns", "repo"), "run-1", List.of(
                out(1, "a"), out(2, "b"), out(3, "c"), out(4, "d"), out(5, "e")));

        assertEquals(List.of("a", "b", "c", "d", "e"), messages(reader.pollLogs("repo", "run-1", T0, null, false, false)));
    }

    @Test
    void resumesFromStartTime() {
        sink.appendAll(LogGroups.jobs("ns", "repo"), "run-1", List.of(out(1, "a"), out(2, "b"), out(3, "c")));

        List<String> tail = messages(reader.pollLogs("repo", "run-1", T0.plusSeconds(2), null, false, false));

        assertEquals(List.of("b", "c"), tail);
    }

    @Test
    void diagnoseMergesRunnerStreams() {
        sink.appendAll(LogGroups.jobs("ns", "repo"), "run-1", List.of(out(1, "out-1"), out(4, "out-4")));
        sink.appendAll(LogGroups.runners("ns"), "job-1", List.of(
                diag(0, "diag-0"), diag(2, "diag-2"), diag(3, "diag-3"), diag(5, "diag-5")));

        assertEquals(List.of("diag-0", "out-1", "diag-2", "diag-3", "out-4", "diag-5"),
                messages(reader.pollLogs("repo", "run-1", T0, null, false, true)));
        assertEquals(List.of("out-1", "out-4"),
                messages(reader.pollLogs("repo", "run-1", T0, null, false, false)));
    }

    @Test
    void diagnoseWithoutRunnerGroupShowsJobOutput() {
        sink.append(LogGroups.jobs("ns", "repo"), "run-1", out(1, "only"));

        assertEquals(List.of("only"), messages(reader.pollLogs("repo", "run-1", T0, null, false, true)));
    }

    @Test
    void descendingMerge() {
        sink.appendAll(LogGroups.jobs("ns", "repo"), "run-1", List.of(out(1, "out-1"), out(3, "out-3")));
        sink.append(LogGroups.runners("ns"), "job-1", diag(2, "diag-2"));

        assertEquals(List.of("out-3", "diag-2", "out-1"),
                messages(reader.pollLogs("repo", "run-1", T0, null, true, true)));
    }

    @Test
    void missingGroupFallsBackToStatusHistory() {
        List<LogEvent> events = reader.pollLogs("repo", "run-1", T0.minusSeconds(1), null, false, false).toList();

        assertEquals(1, events.size());
        assertEquals("Job job-1 is " + JobStatus.SUBMITTED, events.get(0).message());
        assertEquals(LogEventSource.DIAGNOSTIC, events.get(0).source());
    }

    @Test
    void statusHistoryRespectsRange() {
        assertTrue(reader.pollLogs("repo", "run-1", T0.plusSeconds(1), null, false, false).toList().isEmpty());
    }

    private static LogEvent out(int second, String message) {
        return new LogEvent(T0.plusSeconds(second), "job-1", message, LogEventSource.STDOUT);
    }

    private static LogEvent diag(int second, String message) {
        return new LogEvent(T0.plusSeconds(second), "job-1", message, LogEventSource.DIAGNOSTIC);
    }

    private static List<String> messages(Stream<LogEvent> events) {
        return events.map(LogEvent::message).collect(Collectors.toList());
    }
}
