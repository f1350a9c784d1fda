package org.neuralchilli.sentinel.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed job specification: which queue each step feeds and which workers serve which steps.
 */
public final class JobSpec {

    public static final String ALL_STEPS = "all";

    private final String name;
    private final Map<String, String> stepQueues;
    private final Map<String, List<String>> workerSteps;

    public JobSpec(String name, Map<String, String> stepQueues, Map<String, List<String>> workerSteps) {
        if (name == null || name.isBlank()) {
            throw new InvalidJobSpecException("Job name cannot be null or empty");
        }
        if (stepQueues == null || stepQueues.isEmpty()) {
            throw new InvalidJobSpecException("Job must have at least one step");
        }

        Map<String, List<String>> workers = new LinkedHashMap<>();
        if (workerSteps != null) {
            workerSteps.forEach((worker, steps) -> {
                List<String> resolved = steps == null || steps.isEmpty() ? List.of(ALL_STEPS) : List.copyOf(steps);
                for (String step : resolved) {
                    if (!ALL_STEPS.equals(step) && !stepQueues.containsKey(step)) {
                        throw new InvalidJobSpecException(
                                "Worker '" + worker + "' refers to unknown step: " + step);
                    }
                }
                workers.put(worker, resolved);
            });
        }

        this.name = name;
        this.stepQueues = Collections.unmodifiableMap(new LinkedHashMap<>(stepQueues));
        this.workerSteps = Collections.unmodifiableMap(workers);
    }

    public String name() {
        return name;
    }

    public Map<String, String> stepQueues() {
        return stepQueues;
    }

    public Map<String, List<String>> workerSteps() {
        return workerSteps;
    }

    /**
     * Queues feeding the given steps, in step declaration order and without duplicates.
     * The step name {@value #ALL_STEPS} selects every step.
     */
    public List<String> queueList(List<String> steps) {
        if (steps == null || steps.isEmpty() || steps.contains(ALL_STEPS)) {
            return List.copyOf(new LinkedHashSet<>(stepQueues.values()));
        }

        Set<String> queues = new LinkedHashSet<>();
        for (String step : steps) {
            String queue = stepQueues.get(step);
            if (queue == null) {
                throw new InvalidJobSpecException("Unknown step '" + step + "' in job " + name);
            }
            queues.add(queue);
        }
        return List.copyOf(queues);
    }

    public List<String> workerNames() {
        return List.copyOf(workerSteps.keySet());
    }

    /**
     * View for monitoring the given steps. Backlog is polled on the selected steps' queues
     * while worker presence is judged against every queue of the job.
     */
    public JobSpecView view(List<String> steps) {
        List<String> statusQueues = queueList(steps);
        List<String> allQueues = queueList(List.of(ALL_STEPS));
        List<String> workers = workerNames();

        return new JobSpecView() {
            @Override
            public List<String> relevantQueues() {
                return allQueues;
            }

            @Override
            public List<String> expectedWorkerNames() {
                return workers;
            }

            @Override
            public List<String> statusQueues() {
                return statusQueues;
            }

            @Override
            public String toString() {
                return "JobSpecView[" + name + ", statusQueues=" + statusQueues + "]";
            }
        };
    }

    /**
     * Queues served by the given worker
     */
    public List<String> queuesForWorker(String worker) {
        List<String> steps = workerSteps.get(worker);
        if (steps == null) {
            throw new InvalidJobSpecException("Unknown worker '" + worker + "' in job " + name);
        }
        return queueList(new ArrayList<>(steps));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        JobSpec that = (JobSpec) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.stepQueues, that.stepQueues) &&
                Objects.equals(this.workerSteps, that.workerSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, stepQueues, workerSteps);
    }

    @Override
    public String toString() {
        return "JobSpec[" +
                "name=" + name + ", " +
                "stepQueues=" + stepQueues + ", " +
                "workerSteps=" + workerSteps + ']';
    }
}
