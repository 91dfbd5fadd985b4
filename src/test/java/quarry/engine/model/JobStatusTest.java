package quarry.engine.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void terminalStatesAreNeverLeft() {
        for (JobStatus terminal : EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED)) {
            assertTrue(terminal.isTerminal(), terminal + " should be terminal");
            for (JobStatus next : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next + " should be illegal");
            }
        }
    }

    @Test
    void onlyForwardEdgesAreLegal() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED), "PENDING must start before finishing");
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING), "no way back to PENDING");
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED));
    }

    @Test
    void parseSetAcceptsCommaSeparatedStatuses() {
        assertEquals(EnumSet.of(JobStatus.RUNNING, JobStatus.FAILED), JobStatus.parseSet("running, FAILED"));
        assertTrue(JobStatus.parseSet("  ").isEmpty(), "blank means no filter");
        assertThrows(IllegalArgumentException.class, () -> JobStatus.parseSet("running,bogus"));
    }

    @Test
    void progressDeltaMovesOneChildBetweenBuckets() {
        ProgressDelta delta = ProgressDelta.transition(JobStatus.RUNNING, JobStatus.FAILED);

        assertEquals(0, delta.total());
        assertEquals(-1, delta.running());
        assertEquals(1, delta.failed());
        assertFalse(delta.isZero());
    }
}
