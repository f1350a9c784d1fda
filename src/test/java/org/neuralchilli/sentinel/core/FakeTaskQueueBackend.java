package org.neuralchilli.sentinel.core;

import org.neuralchilli.sentinel.backend.BackendUnavailableException;
import org.neuralchilli.sentinel.backend.TaskQueueBackend;
import org.neuralchilli.sentinel.domain.ActiveQueueMap;
import org.neuralchilli.sentinel.domain.ActiveQueues;
import org.neuralchilli.sentinel.domain.QueueStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scriptable in-memory backend that records how it was called.
 */
class FakeTaskQueueBackend implements TaskQueueBackend {

    final Map<String, QueueStatus> queues = new LinkedHashMap<>();
    ActiveQueueMap activeQueues = ActiveQueueMap.empty();
    final Deque<List<String>> workerPolls = new ArrayDeque<>();
    List<String> workers = List.of();
    boolean processing = false;
    boolean unavailable = false;

    int queueStatusCalls = 0;
    int activeQueueCalls = 0;
    int workerIdentifierCalls = 0;
    int processingCalls = 0;
    final List<Collection<String>> processingQueries = new ArrayList<>();

    FakeTaskQueueBackend queue(String name, long jobs, int consumers) {
        queues.put(name, new QueueStatus(name, jobs, consumers));
        return this;
    }

    FakeTaskQueueBackend active(Map<String, Set<String>> map) {
        activeQueues = ActiveQueueMap.of(map);
        return this;
    }

    /**
     * Successive answers for worker identifier polls; the last one repeats.
     */
    FakeTaskQueueBackend workerPolls(List<List<String>> polls) {
        workerPolls.addAll(polls);
        return this;
    }

    @Override
    public Map<String, QueueStatus> queryQueueStatus(Collection<String> queueNames) {
        queueStatusCalls++;
        failIfUnavailable();
        return Map.copyOf(queues);
    }

    @Override
    public ActiveQueues queryActiveQueues() {
        activeQueueCalls++;
        failIfUnavailable();
        return ActiveQueues.of(activeQueues);
    }

    @Override
    public List<String> queryWorkerIdentifiers() {
        workerIdentifierCalls++;
        failIfUnavailable();
        if (workerPolls.size() > 1) {
            return workerPolls.poll();
        }
        if (workerPolls.size() == 1) {
            return workerPolls.peek();
        }
        return workers;
    }

    @Override
    public boolean queryWorkersProcessing(Collection<String> relevantQueues) {
        processingCalls++;
        processingQueries.add(List.copyOf(relevantQueues));
        failIfUnavailable();
        return processing;
    }

    private void failIfUnavailable() {
        if (unavailable) {
            throw new BackendUnavailableException("broker down");
        }
    }
}
