package org.neuralchilli.sentinel.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Queue name to the identifiers of the workers currently subscribed to it.
 * Immutable; a new instance is built for every poll.
 */
public final class ActiveQueueMap {

    private static final ActiveQueueMap EMPTY = new ActiveQueueMap(Map.of());

    private final Map<String, Set<String>> workersByQueue;

    public ActiveQueueMap(Map<String, ? extends Set<String>> workersByQueue) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (workersByQueue != null) {
            workersByQueue.forEach((queue, workers) -> {
                if (queue == null || queue.isBlank()) {
                    throw new IllegalArgumentException("Queue name cannot be null or empty");
                }
                copy.put(queue, workers != null ? Set.copyOf(workers) : Set.of());
            });
        }
        this.workersByQueue = Collections.unmodifiableMap(copy);
    }

    public static ActiveQueueMap empty() {
        return EMPTY;
    }

    public static ActiveQueueMap of(Map<String, ? extends Set<String>> workersByQueue) {
        return new ActiveQueueMap(workersByQueue);
    }

    /**
     * Workers watching the given queue, empty if the queue has no subscribers.
     */
    public Set<String> workersOn(String queue) {
        return workersByQueue.getOrDefault(queue, Set.of());
    }

    public Set<String> queueNames() {
        return workersByQueue.keySet();
    }

    /**
     * Distinct worker identifiers across every queue in the map.
     */
    public Set<String> allWorkers() {
        Set<String> all = new LinkedHashSet<>();
        workersByQueue.values().forEach(all::addAll);
        return Collections.unmodifiableSet(all);
    }

    public boolean isEmpty() {
        return workersByQueue.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        ActiveQueueMap that = (ActiveQueueMap) obj;
        return Objects.equals(this.workersByQueue, that.workersByQueue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workersByQueue);
    }

    @Override
    public String toString() {
        return "ActiveQueueMap" + workersByQueue;
    }
}
