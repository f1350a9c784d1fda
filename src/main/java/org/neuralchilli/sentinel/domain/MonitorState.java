package org.neuralchilli.sentinel.domain;

/**
 * Counters gathered during one liveness check. Never outlives the check.
 */
public record MonitorState(
        long totalJobs,
        int totalConsumers,
        int attemptCount
) {

    public MonitorState {
        if (totalJobs < 0) {
            throw new IllegalArgumentException("Total jobs cannot be negative");
        }
        if (totalConsumers < 0) {
            throw new IllegalArgumentException("Total consumers cannot be negative");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("Attempt count cannot be negative");
        }
    }
}
