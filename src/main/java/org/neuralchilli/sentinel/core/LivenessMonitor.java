package org.neuralchilli.sentinel.core;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.sentinel.backend.TaskQueueBackend;
import org.neuralchilli.sentinel.config.JobsScope;
import org.neuralchilli.sentinel.config.MonitorConfig;
import org.neuralchilli.sentinel.domain.ActiveQueues;
import org.neuralchilli.sentinel.domain.JobSpecView;
import org.neuralchilli.sentinel.domain.MonitorDecision;
import org.neuralchilli.sentinel.domain.MonitorResult;
import org.neuralchilli.sentinel.domain.MonitorState;
import org.neuralchilli.sentinel.domain.QueueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a job still has work in flight.
 *
 * One check is:
 * <ol>
 *   <li>poll queue backlog and the active queue map once each</li>
 *   <li>if no worker watches any of the job's queues, wait for an expected worker to appear
 *       (bounded; fatal when the budget runs out)</li>
 *   <li>queued jobs mean ACTIVE</li>
 *   <li>no queued jobs: ACTIVE only if some worker on the job's queues is mid-task</li>
 * </ol>
 *
 * Backend failures propagate untouched. Nothing is kept between checks.
 */
@ApplicationScoped
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    public static final int DEFAULT_MAX_WORKER_POLLS = 10;

    @Inject
    TaskQueueBackend backend;

    @Inject
    StatusAggregator aggregator;

    @Inject
    MonitorConfig config;

    int maxWorkerPolls = DEFAULT_MAX_WORKER_POLLS;
    JobsScope jobsScope = JobsScope.ALL_REPORTED;

    public LivenessMonitor() {
    }

    LivenessMonitor(TaskQueueBackend backend, StatusAggregator aggregator, int maxWorkerPolls, JobsScope jobsScope) {
        this.backend = backend;
        this.aggregator = aggregator;
        this.maxWorkerPolls = maxWorkerPolls;
        this.jobsScope = jobsScope;
    }

    @PostConstruct
    void init() {
        maxWorkerPolls = config.maxWorkerPolls();
        jobsScope = config.jobsScope();
        log.info("LivenessMonitor initialized: max worker polls {}, jobs scope {}", maxWorkerPolls, jobsScope);
    }

    /**
     * @return true if work is still active, false if the job is idle
     * @throws NoWorkersAvailableException if no expected worker appeared in time
     */
    public boolean checkStatus(List<String> relevantQueues, List<String> expectedWorkerNames, Duration sleep) {
        return checkStatus(JobSpecView.of(relevantQueues, expectedWorkerNames), sleep);
    }

    public boolean checkStatus(JobSpecView job, Duration sleep) {
        return checkStatus(job, sleep, CancellationToken.create());
    }

    public boolean checkStatus(JobSpecView job, Duration sleep, CancellationToken token) {
        return evaluate(job, sleep, token).isActive();
    }

    /**
     * Run one check and report the counters it was based on.
     */
    public MonitorResult evaluate(JobSpecView job, Duration sleep, CancellationToken token) {
        token.throwIfCancelled();

        List<String> relevantQueues = job.relevantQueues();
        Set<String> relevant = new LinkedHashSet<>(relevantQueues);

        Map<String, QueueStatus> queueStatus = backend.queryQueueStatus(job.statusQueues());
        log.debug("Monitor: queue_status: {}", queueStatus);

        long totalJobs = jobsScope == JobsScope.RELEVANT
                ? aggregator.aggregateJobs(queueStatus.values(), relevant)
                : aggregator.aggregateJobs(queueStatus.values());

        ActiveQueues activeQueues = backend.queryActiveQueues();
        log.debug("Monitor: active_queues: {}", activeQueues.queueMap());

        int totalConsumers = aggregator.aggregateConsumers(activeQueues.queueMap(), relevant);

        log.info("Monitor: found {} jobs in queues and {} workers alive", totalJobs, totalConsumers);

        int attempts = 0;
        if (totalConsumers == 0) {
            attempts = waitForWorkers(job.expectedWorkerNames(), sleep, token);
        }

        MonitorState state = new MonitorState(totalJobs, totalConsumers, attempts);

        boolean active;
        if (totalJobs > 0) {
            active = true;
        } else {
            // Queues are drained; a worker may still be running a long task
            active = backend.queryWorkersProcessing(relevantQueues);
        }

        MonitorDecision decision = MonitorDecision.of(active);
        log.debug("Monitor: decision {} ({})", decision, state);
        return new MonitorResult(state, decision);
    }

    /**
     * Poll the backend until one of the expected workers is connected.
     *
     * @return number of failed polls before a worker was seen
     */
    int waitForWorkers(List<String> expectedWorkerNames, Duration sleep, CancellationToken token) {
        log.info("Checking for the following workers: {}", expectedWorkerNames);

        RetryBackoff backoff = new RetryBackoff(maxWorkerPolls, sleep, token);
        while (true) {
            backoff.checkCancelled();

            List<String> workers = backend.queryWorkerIdentifiers();
            log.info("Monitor: checking for workers, running workers = {} ...", workers);

            if (anyExpectedWorker(expectedWorkerNames, workers)) {
                return backoff.attempts();
            }

            if (!backoff.recordFailure()) {
                log.error("Monitor: no expected workers {} after {} polls",
                        expectedWorkerNames, backoff.attempts());
                throw new NoWorkersAvailableException(
                        "Monitor: no workers available to process the non-empty queue", backoff.attempts());
            }

            log.warn("Monitor: no expected workers yet (attempt {}/{}), retrying in {}",
                    backoff.attempts(), backoff.maxAttempts(), sleep);
            backoff.pause();
        }
    }

    /**
     * Workers report as {@code name@host}; an expected name matches if it occurs in a reported id.
     */
    static boolean anyExpectedWorker(List<String> expectedWorkerNames, List<String> reportedWorkers) {
        return expectedWorkerNames.stream()
                .anyMatch(name -> reportedWorkers.stream().anyMatch(id -> id.contains(name)));
    }
}
