package org.neuralchilli.sentinel.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.neuralchilli.sentinel.backend.TaskQueueBackend;
import org.neuralchilli.sentinel.core.StatusAggregator;
import org.neuralchilli.sentinel.domain.ActiveQueues;
import org.neuralchilli.sentinel.domain.QueueStatus;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only status queries against the task queue backend.
 */
@Path("/monitor")
@Produces(MediaType.APPLICATION_JSON)
public class MonitorResource {

    @Inject
    TaskQueueBackend backend;

    @Inject
    StatusAggregator aggregator;

    @GET
    @Path("/queues")
    public QueueReport queues(@QueryParam("queue") List<String> queueNames) {
        if (queueNames == null || queueNames.isEmpty()) {
            throw new BadRequestException("At least one 'queue' parameter is required");
        }

        Set<String> requested = new LinkedHashSet<>(queueNames);
        Map<String, QueueStatus> statuses = backend.queryQueueStatus(requested);
        ActiveQueues active = backend.queryActiveQueues();

        return new QueueReport(
                List.copyOf(statuses.values()),
                aggregator.aggregateJobs(statuses.values()),
                aggregator.aggregateConsumers(active.queueMap(), requested)
        );
    }

    @GET
    @Path("/workers")
    public List<String> workers() {
        return backend.queryWorkerIdentifiers();
    }

    /**
     * Queue counters plus the totals the liveness check would compute for them.
     */
    public record QueueReport(
            List<QueueStatus> queues,
            long totalJobs,
            int totalConsumers
    ) {
    }
}
