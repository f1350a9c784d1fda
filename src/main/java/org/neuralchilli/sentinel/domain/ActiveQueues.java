package org.neuralchilli.sentinel.domain;

import java.util.Map;

/**
 * Result of asking the backend which queues are being watched.
 * The registration map carries per-worker detail alongside the queue view.
 */
public record ActiveQueues(
        ActiveQueueMap queueMap,
        Map<String, WorkerRegistration> workers
) {

    public ActiveQueues {
        queueMap = queueMap != null ? queueMap : ActiveQueueMap.empty();
        workers = workers != null ? Map.copyOf(workers) : Map.of();
    }

    public static ActiveQueues of(ActiveQueueMap queueMap) {
        return new ActiveQueues(queueMap, Map.of());
    }
}
