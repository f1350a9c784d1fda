package org.neuralchilli.sentinel.domain;

/**
 * Point-in-time counters for a single named queue, as reported by the task queue backend.
 * Produced fresh on every poll.
 */
public record QueueStatus(
        String name,
        long pendingJobs,
        int consumerCount
) {

    public QueueStatus {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (pendingJobs < 0) {
            throw new IllegalArgumentException("Pending jobs cannot be negative");
        }
        if (consumerCount < 0) {
            throw new IllegalArgumentException("Consumer count cannot be negative");
        }
    }

    /**
     * Empty queue with nobody watching it
     */
    public static QueueStatus empty(String name) {
        return new QueueStatus(name, 0, 0);
    }

    public boolean hasBacklog() {
        return pendingJobs > 0;
    }
}
