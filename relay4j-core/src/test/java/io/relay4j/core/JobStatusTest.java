package io.relay4j.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStatusTest {

    @Test
    void onlyPendingAndRetryingAreDispatchable() {
        for (JobStatus status : JobStatus.values()) {
            boolean expected = status == JobStatus.PENDING || status == JobStatus.RETRYING;
            assertEquals(expected, status.isDispatchable(), status.name());
        }
    }

    @Test
    void terminalStatesHaveNoSuccessors() {
        assertTrue(JobStatus.ACKNOWLEDGED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.EXPIRED.isTerminal());
        assertFalse(JobStatus.DISPATCHED.isTerminal());
    }

    @Test
    void retryingNeverSkipsDispatch() {
        assertFalse(JobStatus.RETRYING.canTransitionTo(JobStatus.ACKNOWLEDGED));
        assertFalse(JobStatus.RETRYING.canTransitionTo(JobStatus.EXPIRED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.RETRYING));
    }

    @Test
    void outcomeParsesWireNames() {
        assertEquals(Outcome.SUCCESS, Outcome.fromWire("success"));
        assertEquals(Outcome.FAILURE, Outcome.fromWire(" FAILURE "));
        assertThrows(IllegalArgumentException.class, () -> Outcome.fromWire("done"));
        assertThrows(IllegalArgumentException.class, () -> Outcome.fromWire(null));
    }
}
