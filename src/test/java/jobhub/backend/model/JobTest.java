package jobhub.backend.model;

import jobhub.backend.storage.Json;
import jobhub.backend.support.Jobs;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    @Test
    void withStatusRecordsTransition() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        Job job = Jobs.job("repo", "run-1", "job-1").build();

        Job pending = job.withStatus(JobStatus.PENDING, at);

        assertEquals(JobStatus.SUBMITTED, job.status());
        assertEquals(JobStatus.PENDING, pending.status());
        assertEquals(List.of(new StatusTransition(JobStatus.PENDING, at)), pending.transitions());
    }

    @Test
    void withSameStatusReturnsSameInstance() {
        Job job = Jobs.job("repo", "run-1", "job-1").build();
        assertSame(job, job.withStatus(JobStatus.SUBMITTED, Instant.now()));
    }

    @Test
    void invalidTransitionThrows() {
        Job done = Jobs.job("repo", "run-1", "job-1").status(JobStatus.DONE).build();
        assertThrows(IllegalStateException.class, () -> done.withStatus(JobStatus.RUNNING, Instant.now()));
    }

    @Test
    void requiredFieldsEnforced() {
        assertThrows(NullPointerException.class, () -> Job.builder().repoId("r").runName("x").build());
    }

    @Test
    void headCarriesIndexFields() {
        Job job = Jobs.job("repo", "run-1", "job-1")
                .appSpecs(List.of(new AppSpec(8888, null, "notebook", Map.of())))
                .instanceType(new InstanceType("small", 2, 4096, 0, false))
                .requestId("req-1")
                .build();

        JobHead head = job.head();

        assertEquals("run-1", head.runName());
        assertEquals(List.of("output"), head.artifactPaths());
        assertEquals(List.of("notebook"), head.appNames());
        assertEquals("small", head.instanceType());
        assertEquals("req-1", head.requestId());
    }

    @Test
    void storedJobReadsBackWithLifecycleFields() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        Job job = Jobs.job("repo", "run-1", "job-1")
                .env(Map.of("SEED", "42"))
                .requirements(new Requirements(4, 8192, null, true))
                .submittedAt(at)
                .build()
                .withStatus(JobStatus.PENDING, at.plusSeconds(5));

        Job read = Json.read(Json.write(job), Job.class);

        assertEquals(job, read);
        assertEquals(JobStatus.PENDING, read.status());
        assertEquals(Map.of("SEED", "42"), read.env());
        assertEquals(4, read.requirements().cpus());
        assertTrue(read.requirements().interruptible());
        assertEquals(job.transitions(), read.transitions());
        assertEquals(at, read.submittedAt());
    }

    @Test
    void requirementsMatching() {
        Requirements req = new Requirements(4, 8192, 1, false);
        assertFalse(req.isSatisfiedBy(new InstanceType("a", 2, 8192, 1, false)));
        assertFalse(req.isSatisfiedBy(new InstanceType("b", 4, 8192, 0, false)));
        assertTrue(req.isSatisfiedBy(new InstanceType("c", 8, 16384, 1, true)));
        assertFalse(new Requirements(null, null, null, true).isSatisfiedBy(new InstanceType("d", 2, 1024, 0, false)));
        assertTrue(Requirements.none().isSatisfiedBy(new InstanceType("e", 1, 512, 0, false)));
    }
}
