package org.neuralchilli.sentinel.backend;

import org.neuralchilli.sentinel.domain.ActiveQueues;
import org.neuralchilli.sentinel.domain.QueueStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the task queue system that executes the work.
 * Every call is a single round trip; failures surface as {@link BackendUnavailableException}
 * and are never retried here.
 */
public interface TaskQueueBackend {

    /**
     * Backlog and consumer counts for the named queues, keyed by queue name.
     */
    Map<String, QueueStatus> queryQueueStatus(Collection<String> queueNames);

    /**
     * Queues that currently have subscribers, with the workers watching each one.
     */
    ActiveQueues queryActiveQueues();

    /**
     * Identifiers of every connected worker, in {@code <name>@<host>} form.
     */
    List<String> queryWorkerIdentifiers();

    /**
     * Whether any worker servicing the given queues is executing a task right now.
     */
    boolean queryWorkersProcessing(Collection<String> relevantQueues);
}
