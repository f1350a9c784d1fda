package org.neuralchilli.sentinel.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.sentinel.domain.ActiveQueueMap;
import org.neuralchilli.sentinel.domain.QueueStatus;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Reduces raw backend snapshots to the two numbers the liveness decision needs.
 *
 * Jobs are summed, consumers are counted as a set union: a worker subscribed to
 * several of the job's queues is one consumer, not several.
 */
@ApplicationScoped
public class StatusAggregator {

    /**
     * Total pending jobs over every reported queue.
     */
    public long aggregateJobs(Collection<QueueStatus> queueStatuses) {
        if (queueStatuses == null) {
            return 0;
        }
        return queueStatuses.stream()
                .mapToLong(QueueStatus::pendingJobs)
                .sum();
    }

    /**
     * Total pending jobs over the reported queues that belong to the job.
     */
    public long aggregateJobs(Collection<QueueStatus> queueStatuses, Set<String> relevantQueues) {
        if (queueStatuses == null || relevantQueues == null) {
            return 0;
        }
        return queueStatuses.stream()
                .filter(status -> relevantQueues.contains(status.name()))
                .mapToLong(QueueStatus::pendingJobs)
                .sum();
    }

    /**
     * Number of distinct workers watching at least one relevant queue.
     * Workers on queues outside the job are ignored.
     */
    public int aggregateConsumers(ActiveQueueMap activeQueueMap, Set<String> relevantQueues) {
        if (activeQueueMap == null || relevantQueues == null) {
            return 0;
        }

        Set<String> consumers = new HashSet<>();
        for (String queue : activeQueueMap.queueNames()) {
            if (relevantQueues.contains(queue)) {
                consumers.addAll(activeQueueMap.workersOn(queue));
            }
        }
        return consumers.size();
    }
}
