package io.relay4j.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a tracked job.
 *
 * <pre>
 * PENDING    --dispatch--------------------> DISPATCHED
 * DISPATCHED --success result--------------> ACKNOWLEDGED (terminal)
 * DISPATCHED --failure result--------------> FAILED       (terminal)
 * DISPATCHED --deadline, attempts remain---> RETRYING
 * DISPATCHED --deadline, attempts spent----> EXPIRED      (terminal)
 * RETRYING   --redispatch------------------> DISPATCHED
 * </pre>
 */
public enum JobStatus {
    PENDING {
        @Override
        public Set<JobStatus> successors() {
            return EnumSet.of(DISPATCHED);
        }
    },
    DISPATCHED {
        @Override
        public Set<JobStatus> successors() {
            return EnumSet.of(ACKNOWLEDGED, FAILED, RETRYING, EXPIRED);
        }
    },
    RETRYING {
        @Override
        public Set<JobStatus> successors() {
            return EnumSet.of(DISPATCHED);
        }
    },
    ACKNOWLEDGED {
        @Override
        public Set<JobStatus> successors() {
            return EnumSet.noneOf(JobStatus.class);
        }
    },
    FAILED {
        @Override
        public Set<JobStatus> successors() {
            return EnumSet.noneOf(JobStatus.class);
        }
    },
    EXPIRED {
        @Override
        public Set<JobStatus> successors() {
            return EnumSet.noneOf(JobStatus.class);
        }
    };

    public abstract Set<JobStatus> successors();

    public boolean canTransitionTo(JobStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * True for the states a publisher may pick up: never dispatched yet, or waiting for a retry.
     */
    public boolean isDispatchable() {
        return canTransitionTo(DISPATCHED);
    }
}
