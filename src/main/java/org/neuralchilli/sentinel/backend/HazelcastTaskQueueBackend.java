package org.neuralchilli.sentinel.backend;

import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.neuralchilli.sentinel.domain.ActiveQueueMap;
import org.neuralchilli.sentinel.domain.ActiveQueues;
import org.neuralchilli.sentinel.domain.QueueStatus;
import org.neuralchilli.sentinel.domain.WorkerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Task queue backend on top of Hazelcast.
 *
 * Each named queue is an {@code IQueue}; workers announce themselves in the
 * {@value #WORKERS_MAP} map through {@link WorkerRegistry}. A worker whose heartbeat is
 * older than the configured timeout is treated as gone.
 */
public class HazelcastTaskQueueBackend implements TaskQueueBackend {

    private static final Logger log = LoggerFactory.getLogger(HazelcastTaskQueueBackend.class);

    public static final String WORKERS_MAP = "workers";

    private final HazelcastInstance hazelcast;
    private final Duration heartbeatTimeout;

    public HazelcastTaskQueueBackend(HazelcastInstance hazelcast, Duration heartbeatTimeout) {
        this.hazelcast = hazelcast;
        this.heartbeatTimeout = heartbeatTimeout;
    }

    @Override
    public Map<String, QueueStatus> queryQueueStatus(Collection<String> queueNames) {
        return call("query queue status", () -> {
            Collection<WorkerRegistration> alive = aliveWorkers().values();
            Map<String, QueueStatus> result = new LinkedHashMap<>();

            for (String queue : queueNames) {
                int size = hazelcast.getQueue(queue).size();
                int consumers = (int) alive.stream().filter(w -> w.watches(queue)).count();
                result.put(queue, new QueueStatus(queue, size, consumers));
            }
            return result;
        });
    }

    @Override
    public ActiveQueues queryActiveQueues() {
        return call("query active queues", () -> {
            Map<String, WorkerRegistration> alive = aliveWorkers();
            Map<String, Set<String>> byQueue = new TreeMap<>();

            for (WorkerRegistration worker : alive.values()) {
                for (String queue : worker.queues()) {
                    byQueue.computeIfAbsent(queue, q -> new TreeSet<>()).add(worker.id());
                }
            }
            return new ActiveQueues(ActiveQueueMap.of(byQueue), alive);
        });
    }

    @Override
    public List<String> queryWorkerIdentifiers() {
        return call("query workers", () -> List.copyOf(new TreeSet<>(aliveWorkers().keySet())));
    }

    @Override
    public boolean queryWorkersProcessing(Collection<String> relevantQueues) {
        return call("query workers processing", () -> aliveWorkers().values().stream()
                .filter(WorkerRegistration::isProcessing)
                .anyMatch(w -> relevantQueues.stream().anyMatch(w::watches)));
    }

    private Map<String, WorkerRegistration> aliveWorkers() {
        IMap<String, WorkerRegistration> workers = hazelcast.getMap(WORKERS_MAP);
        Map<String, WorkerRegistration> alive = new TreeMap<>();

        for (Map.Entry<String, WorkerRegistration> entry : workers.entrySet()) {
            if (entry.getValue().isAlive(heartbeatTimeout)) {
                alive.put(entry.getKey(), entry.getValue());
            } else {
                log.trace("Skipping stale worker {}", entry.getKey());
            }
        }
        return alive;
    }

    /**
     * Run a single backend round trip, translating Hazelcast failures.
     * HazelcastInstanceNotActiveException is an IllegalStateException.
     */
    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (HazelcastException | IllegalStateException e) {
            log.error("Backend call failed: {}", operation, e);
            throw new BackendUnavailableException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
