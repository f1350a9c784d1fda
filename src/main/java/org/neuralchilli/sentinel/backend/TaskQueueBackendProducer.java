package org.neuralchilli.sentinel.backend;

import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.sentinel.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the task queue backend once, at startup, from {@code monitor.backend}.
 * New backends are added here; the monitor only sees {@link TaskQueueBackend}.
 */
@ApplicationScoped
public class TaskQueueBackendProducer {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueBackendProducer.class);

    public static final String HAZELCAST = "hazelcast";

    @Inject
    HazelcastInstance hazelcast;

    @Inject
    MonitorConfig config;

    @Produces
    @Singleton
    @Startup
    public TaskQueueBackend taskQueueBackend() {
        return create(config.backend(), hazelcast, config);
    }

    static TaskQueueBackend create(String backend, HazelcastInstance hazelcast, MonitorConfig config) {
        String name = backend == null ? "" : backend.trim().toLowerCase(Locale.ROOT);

        if (HAZELCAST.equals(name)) {
            log.info("Using Hazelcast task queue backend (heartbeat timeout: {})",
                    config.workerHeartbeatTimeout());
            return new HazelcastTaskQueueBackend(hazelcast, config.workerHeartbeatTimeout());
        }

        log.error("Unsupported task queue backend: '{}'", backend);
        throw new UnsupportedBackendException(
                "Unsupported task queue backend '" + backend + "', supported: " + HAZELCAST);
    }
}
