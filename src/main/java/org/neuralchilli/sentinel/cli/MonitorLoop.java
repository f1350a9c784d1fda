package org.neuralchilli.sentinel.cli;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.sentinel.backend.BackendUnavailableException;
import org.neuralchilli.sentinel.core.CancellationToken;
import org.neuralchilli.sentinel.core.LivenessMonitor;
import org.neuralchilli.sentinel.core.MonitorCancelledException;
import org.neuralchilli.sentinel.core.NoWorkersAvailableException;
import org.neuralchilli.sentinel.domain.JobSpecView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Keeps checking a job until it goes idle, then lets the allocation end.
 * The exit code tells "workers never started" apart from "backend unreachable".
 */
@ApplicationScoped
public class MonitorLoop {

    private static final Logger log = LoggerFactory.getLogger(MonitorLoop.class);

    public static final int EXIT_IDLE = 0;
    public static final int EXIT_NO_WORKERS = 1;
    public static final int EXIT_BACKEND_UNAVAILABLE = 2;
    public static final int EXIT_CANCELLED = 130;

    @Inject
    LivenessMonitor monitor;

    private final CancellationToken shutdownToken = CancellationToken.create();

    void onStop(@Observes ShutdownEvent event) {
        log.info("Shutdown requested, cancelling monitor");
        shutdownToken.cancel();
    }

    public int run(JobSpecView job, Duration sleep) {
        return run(job, sleep, shutdownToken);
    }

    public int run(JobSpecView job, Duration sleep, CancellationToken token) {
        if (sleep == null || sleep.isNegative()) {
            throw new IllegalArgumentException("sleep must be zero or positive, got " + sleep);
        }
        log.info("Monitoring {} every {}", job, sleep);
        int checks = 0;

        while (true) {
            boolean active;
            try {
                active = monitor.checkStatus(job, sleep, token);
                checks++;
            } catch (NoWorkersAvailableException e) {
                log.error("Monitor: workers never started after {} polls, stopping: {}",
                        e.attempts(), e.getMessage());
                return EXIT_NO_WORKERS;
            } catch (BackendUnavailableException e) {
                log.error("Monitor: task queue backend unreachable, stopping: {}", e.getMessage());
                return EXIT_BACKEND_UNAVAILABLE;
            } catch (MonitorCancelledException e) {
                log.info("Monitor: cancelled during check {}", checks + 1);
                return EXIT_CANCELLED;
            }

            if (!active) {
                log.info("Monitor: no active work after {} checks, releasing allocation", checks);
                return EXIT_IDLE;
            }

            log.info("Monitor: work still active, next check in {}", sleep);
            try {
                if (token.await(sleep)) {
                    log.info("Monitor: cancelled after {} checks", checks);
                    return EXIT_CANCELLED;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Monitor: interrupted after {} checks", checks);
                return EXIT_CANCELLED;
            }
        }
    }
}
