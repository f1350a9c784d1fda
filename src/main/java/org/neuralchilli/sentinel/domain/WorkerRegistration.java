package org.neuralchilli.sentinel.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * A worker process as announced to the backend.
 * Identifiers take the form {@code <name>@<host>}.
 */
public record WorkerRegistration(
        String id,
        Set<String> queues,
        int activeTasks,
        Instant lastHeartbeat,
        Instant startedAt
) {

    public WorkerRegistration {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Worker ID cannot be null or empty");
        }
        if (queues == null) {
            throw new IllegalArgumentException("Queues cannot be null");
        }
        if (activeTasks < 0) {
            throw new IllegalArgumentException("Active tasks cannot be negative");
        }
        if (lastHeartbeat == null) {
            throw new IllegalArgumentException("Last heartbeat cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Started at cannot be null");
        }
        queues = Set.copyOf(queues);
    }

    /**
     * Create a new registration for a worker that has just come up
     */
    public static WorkerRegistration create(String name, String host, Set<String> queues) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Worker name cannot be null or empty");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Worker host cannot be null or empty");
        }
        Instant now = Instant.now();
        return new WorkerRegistration(name + "@" + host, queues, 0, now, now);
    }

    public WorkerRegistration heartbeat() {
        return new WorkerRegistration(id, queues, activeTasks, Instant.now(), startedAt);
    }

    public WorkerRegistration withActiveTasks(int newActiveTasks) {
        return new WorkerRegistration(id, queues, newActiveTasks, lastHeartbeat, startedAt);
    }

    /**
     * Logical worker name, the part before {@code @}
     */
    public String name() {
        int at = id.indexOf('@');
        return at < 0 ? id : id.substring(0, at);
    }

    public String host() {
        int at = id.indexOf('@');
        return at < 0 ? "" : id.substring(at + 1);
    }

    public boolean watches(String queue) {
        return queues.contains(queue);
    }

    public boolean isProcessing() {
        return activeTasks > 0;
    }

    /**
     * Check if the worker has sent a heartbeat within the threshold
     */
    public boolean isAlive(Duration threshold) {
        Duration sinceHeartbeat = Duration.between(lastHeartbeat, Instant.now());
        return sinceHeartbeat.compareTo(threshold) <= 0;
    }
}
