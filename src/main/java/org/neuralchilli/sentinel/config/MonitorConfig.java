package org.neuralchilli.sentinel.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "monitor")
public interface MonitorConfig {

    /**
     * Task queue backend to talk to. Only {@code hazelcast} is implemented.
     */
    @WithDefault("hazelcast")
    String backend();

    /**
     * Pause between worker polls and between consecutive checks of the monitor loop.
     */
    @WithDefault("PT60S")
    Duration sleep();

    @WithName("max-worker-polls")
    @WithDefault("10")
    int maxWorkerPolls();

    @WithName("jobs-scope")
    @WithDefault("ALL_REPORTED")
    JobsScope jobsScope();

    @WithName("worker-heartbeat-timeout")
    @WithDefault("PT90S")
    Duration workerHeartbeatTimeout();

    @WithName("spec-file")
    Optional<String> specFile();
}
