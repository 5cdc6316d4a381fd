package jobhub.backend.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void terminalStatuses() {
        assertTrue(JobStatus.DONE.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.ABORTED.isTerminal());
        assertTrue(JobStatus.STOPPED.isTerminal());
        assertTrue(JobStatus.STOPPING.isUnfinished());
        assertTrue(JobStatus.SUBMITTED.isUnfinished());
    }

    @Test
    void forwardTransitionsAllowed() {
        assertTrue(JobStatus.SUBMITTED.canTransitionTo(JobStatus.PENDING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.DOWNLOADING));
        assertTrue(JobStatus.DOWNLOADING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.UPLOADING));
        assertTrue(JobStatus.UPLOADING.canTransitionTo(JobStatus.DONE));
        assertTrue(JobStatus.STOPPING.canTransitionTo(JobStatus.STOPPED));
    }

    @Test
    void anyUnfinishedStatusCanBeStopped() {
        for (JobStatus status : JobStatus.values()) {
            if (status.isUnfinished()) {
                assertTrue(status.canTransitionTo(JobStatus.ABORTED), status + " -> ABORTED");
                assertTrue(status.canTransitionTo(JobStatus.FAILED), status + " -> FAILED");
                assertTrue(status.canTransitionTo(JobStatus.STOPPED), status + " -> STOPPED");
            }
        }
    }

    @Test
    void terminalStatusesNeverMove() {
        for (JobStatus from : JobStatus.values()) {
            if (!from.isTerminal()) {
                continue;
            }
            for (JobStatus to : JobStatus.values()) {
                if (to != from) {
                    assertFalse(from.canTransitionTo(to), from + " -> " + to);
                }
            }
        }
    }

    @Test
    void backwardTransitionsRejected() {
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SUBMITTED));
        assertFalse(JobStatus.UPLOADING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.STOPPING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.SUBMITTED.canTransitionTo(JobStatus.DONE));
    }

    @Test
    void sameStatusIsAlwaysAllowed() {
        assertTrue(JobStatus.DONE.canTransitionTo(JobStatus.DONE));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.RUNNING));
    }
}
