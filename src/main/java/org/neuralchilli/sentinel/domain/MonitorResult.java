package org.neuralchilli.sentinel.domain;

/**
 * Decision of a liveness check together with the counters it was based on.
 */
public record MonitorResult(MonitorState state, MonitorDecision decision) {

    public MonitorResult {
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null");
        }
    }

    public boolean isActive() {
        return decision.isActive();
    }
}
