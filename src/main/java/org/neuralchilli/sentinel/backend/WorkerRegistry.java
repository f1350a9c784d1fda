package org.neuralchilli.sentinel.backend;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.sentinel.domain.WorkerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Write side of the worker map read by {@link HazelcastTaskQueueBackend}.
 * Workers register on startup, heartbeat periodically and report task start/finish.
 *
 * Updates use optimistic replace so concurrent heartbeats and task updates don't clobber each other.
 */
@ApplicationScoped
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private static final int MAX_UPDATE_RETRIES = 50;

    @Inject
    HazelcastInstance hazelcast;

    private IMap<String, WorkerRegistration> workers;

    public WorkerRegistry() {
    }

    WorkerRegistry(HazelcastInstance hazelcast) {
        this.hazelcast = hazelcast;
        init();
    }

    @PostConstruct
    void init() {
        workers = hazelcast.getMap(HazelcastTaskQueueBackend.WORKERS_MAP);
    }

    /**
     * Register a worker and return its {@code name@host} identifier
     */
    public String register(String name, String host, Set<String> queues) {
        WorkerRegistration registration = WorkerRegistration.create(name, host, queues);
        workers.put(registration.id(), registration);
        log.info("Registered worker {} on queues {}", registration.id(), registration.queues());
        return registration.id();
    }

    public void heartbeat(String workerId) {
        update(workerId, WorkerRegistration::heartbeat);
    }

    public void taskStarted(String workerId) {
        update(workerId, w -> w.heartbeat().withActiveTasks(w.activeTasks() + 1));
    }

    public void taskFinished(String workerId) {
        update(workerId, w -> w.heartbeat().withActiveTasks(Math.max(0, w.activeTasks() - 1)));
    }

    public void deregister(String workerId) {
        if (workers.remove(workerId) != null) {
            log.info("Deregistered worker {}", workerId);
        }
    }

    public Optional<WorkerRegistration> find(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    private void update(String workerId, UnaryOperator<WorkerRegistration> change) {
        for (int attempt = 1; attempt <= MAX_UPDATE_RETRIES; attempt++) {
            WorkerRegistration current = workers.get(workerId);
            if (current == null) {
                throw new IllegalStateException("Worker not registered: " + workerId);
            }
            if (workers.replace(workerId, current, change.apply(current))) {
                return;
            }
            log.debug("Concurrent update of worker {}, retry {}", workerId, attempt);
        }
        throw new IllegalStateException(
                "Failed to update worker " + workerId + " after " + MAX_UPDATE_RETRIES + " attempts");
    }
}
