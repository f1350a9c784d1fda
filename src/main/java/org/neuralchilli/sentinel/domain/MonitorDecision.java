package org.neuralchilli.sentinel.domain;

/**
 * Outcome of a single liveness check.
 */
public enum MonitorDecision {
    /**
     * Work is queued or a worker is mid-task; keep the allocation alive
     */
    ACTIVE,

    /**
     * Nothing queued and nobody working
     */
    IDLE;

    public boolean isActive() {
        return this == ACTIVE;
    }

    public static MonitorDecision of(boolean active) {
        return active ? ACTIVE : IDLE;
    }
}
