package org.neuralchilli.sentinel.domain;

import java.util.List;

/**
 * Read-only view of the job being monitored.
 */
public interface JobSpecView {

    /**
     * Every queue that belongs to the job, in declaration order.
     */
    List<String> relevantQueues();

    /**
     * Logical worker names expected to service the job's queues.
     */
    List<String> expectedWorkerNames();

    /**
     * Queues whose backlog is polled. Defaults to all relevant queues.
     */
    default List<String> statusQueues() {
        return relevantQueues();
    }

    static JobSpecView of(List<String> relevantQueues, List<String> expectedWorkerNames) {
        List<String> queues = List.copyOf(relevantQueues);
        List<String> workers = List.copyOf(expectedWorkerNames);
        return new JobSpecView() {
            @Override
            public List<String> relevantQueues() {
                return queues;
            }

            @Override
            public List<String> expectedWorkerNames() {
                return workers;
            }

            @Override
            public String toString() {
                return "JobSpecView[queues=" + queues + ", workers=" + workers + "]";
            }
        };
    }
}
