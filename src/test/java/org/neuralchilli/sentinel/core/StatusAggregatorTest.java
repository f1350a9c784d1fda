package org.neuralchilli.sentinel.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.sentinel.domain.ActiveQueueMap;
import org.neuralchilli.sentinel.domain.QueueStatus;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StatusAggregatorTest {

    private final StatusAggregator aggregator = new StatusAggregator();

    @Test
    void shouldSumPendingJobsOverAllQueues() {
        List<QueueStatus> statuses = List.of(
                new QueueStatus("a", 5, 1),
                new QueueStatus("b", 0, 0),
                new QueueStatus("unrelated", 7, 3)
        );

        assertThat(aggregator.aggregateJobs(statuses)).isEqualTo(12);
    }

    @Test
    void shouldReturnZeroJobsForEmptyInput() {
        assertThat(aggregator.aggregateJobs(List.of())).isZero();
        assertThat(aggregator.aggregateJobs(null)).isZero();
    }

    @Test
    void shouldSumOnlyRelevantQueuesWhenFiltered() {
        List<QueueStatus> statuses = List.of(
                new QueueStatus("a", 5, 1),
                new QueueStatus("unrelated", 7, 3)
        );

        assertThat(aggregator.aggregateJobs(statuses, Set.of("a"))).isEqualTo(5);
    }

    @Test
    void shouldCountWorkerOnSeveralRelevantQueuesOnce() {
        ActiveQueueMap map = ActiveQueueMap.of(Map.of(
                "a", Set.of("w1@host", "w2@host"),
                "b", Set.of("w1@host")
        ));

        assertThat(aggregator.aggregateConsumers(map, Set.of("a", "b"))).isEqualTo(2);
    }

    @Test
    void shouldIgnoreWorkersOnUnrelatedQueues() {
        ActiveQueueMap map = ActiveQueueMap.of(Map.of(
                "a", Set.of("w1@host"),
                "other-job", Set.of("w9@host", "w8@host")
        ));

        assertThat(aggregator.aggregateConsumers(map, Set.of("a"))).isEqualTo(1);
        assertThat(aggregator.aggregateConsumers(map, Set.of("missing"))).isZero();
    }

    @Test
    void shouldNeverExceedDistinctWorkerCount() {
        ActiveQueueMap map = ActiveQueueMap.of(Map.of(
                "a", Set.of("w1@host", "w2@host"),
                "b", Set.of("w2@host", "w3@host"),
                "c", Set.of("w1@host", "w3@host")
        ));

        int consumers = aggregator.aggregateConsumers(map, Set.of("a", "b", "c"));

        assertThat(consumers).isEqualTo(3);
        assertThat(consumers).isLessThanOrEqualTo(map.allWorkers().size());
    }

    @Test
    void shouldReturnZeroConsumersForEmptyMap() {
        assertThat(aggregator.aggregateConsumers(ActiveQueueMap.empty(), Set.of("a"))).isZero();
        assertThat(aggregator.aggregateConsumers(null, Set.of("a"))).isZero();
    }
}
