package org.neuralchilli.sentinel.backend;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.sentinel.config.HazelcastTestConfig;
import org.neuralchilli.sentinel.domain.WorkerRegistration;

import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerRegistryTest {

    private static HazelcastInstance hazelcast;

    private WorkerRegistry registry;

    @BeforeAll
    static void setupClass() {
        Config config = HazelcastTestConfig.testConfig("test-registry-" + System.currentTimeMillis());

        hazelcast = Hazelcast.newHazelcastInstance(config);
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @BeforeEach
    void setup() {
        hazelcast.getMap(HazelcastTaskQueueBackend.WORKERS_MAP).clear();
        registry = new WorkerRegistry(hazelcast);
    }

    @Test
    void shouldRegisterAndDeregister() {
        String id = registry.register("step1", "node07", Set.of("q1"));

        assertThat(id).isEqualTo("step1@node07");
        assertThat(registry.find(id)).hasValueSatisfying(w -> assertThat(w.queues()).containsExactly("q1"));

        registry.deregister(id);

        assertThat(registry.find(id)).isEmpty();
    }

    @Test
    void shouldTrackTaskStartAndFinish() {
        String id = registry.register("w", "host", Set.of("q1"));

        registry.taskStarted(id);
        registry.taskStarted(id);
        registry.taskFinished(id);

        assertThat(registry.find(id).map(WorkerRegistration::activeTasks)).contains(1);

        registry.taskFinished(id);
        registry.taskFinished(id);

        assertThat(registry.find(id).map(WorkerRegistration::activeTasks)).contains(0);
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws InterruptedException {
        String id = registry.register("w", "host", Set.of("q1", "q2", "q3"));
        ExecutorService executor = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 8; i++) {
            executor.submit(() -> registry.taskStarted(id));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(registry.find(id).map(WorkerRegistration::activeTasks)).contains(8);
    }

    @Test
    void shouldRejectUpdatesForUnknownWorker() {
        assertThatThrownBy(() -> registry.heartbeat("nobody@nowhere"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Worker not registered");
    }
}
