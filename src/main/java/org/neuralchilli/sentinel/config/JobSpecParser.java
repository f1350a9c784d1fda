package org.neuralchilli.sentinel.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.sentinel.domain.InvalidJobSpecException;
import org.neuralchilli.sentinel.domain.JobSpec;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses job specification YAML into a {@link JobSpec}.
 *
 * <pre>
 * name: hello
 * queue_prefix: "[sentinel]_"
 * default_queue: main
 * steps:
 *   - name: step1
 *     queue: fast
 *   - name: step2
 * workers:
 *   step1_worker:
 *     steps: [step1]
 *   other_worker:
 *     steps: [all]
 * </pre>
 */
@ApplicationScoped
public class JobSpecParser {

    static final String DEFAULT_QUEUE = "default";

    private final Yaml yaml = new Yaml();

    public JobSpec parse(String yamlContent) {
        return parseFromMap(load(() -> yaml.load(yamlContent)));
    }

    public JobSpec parse(InputStream inputStream) {
        return parseFromMap(load(() -> yaml.load(inputStream)));
    }

    public JobSpec parse(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException e) {
            throw new InvalidJobSpecException("Failed to read job spec " + path + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> load(YamlLoad loader) {
        Object data;
        try {
            data = loader.load();
        } catch (YAMLException e) {
            throw new InvalidJobSpecException("Invalid job spec YAML: " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new InvalidJobSpecException("Job spec must be a YAML mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) data;
        return map;
    }

    @SuppressWarnings("unchecked")
    private JobSpec parseFromMap(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String prefix = getString(data, "queue_prefix", false);
        String defaultQueue = getString(data, "default_queue", false);
        if (defaultQueue == null) {
            defaultQueue = DEFAULT_QUEUE;
        }

        Object stepsValue = data.get("steps");
        if (!(stepsValue instanceof List) || ((List<?>) stepsValue).isEmpty()) {
            throw new InvalidJobSpecException("Job must have at least one step");
        }

        Map<String, String> stepQueues = new LinkedHashMap<>();
        for (Object item : (List<Object>) stepsValue) {
            if (!(item instanceof Map)) {
                throw new InvalidJobSpecException("Step entries must be mappings, got: " + item);
            }
            Map<String, Object> step = (Map<String, Object>) item;
            String stepName = getString(step, "name", true);
            String queue = getString(step, "queue", false);
            if (queue == null) {
                queue = defaultQueue;
            }
            if (stepQueues.put(stepName, prefix != null ? prefix + queue : queue) != null) {
                throw new InvalidJobSpecException("Duplicate step name: " + stepName);
            }
        }

        Map<String, List<String>> workerSteps = new LinkedHashMap<>();
        Object workersValue = data.get("workers");
        if (workersValue instanceof Map) {
            ((Map<?, ?>) workersValue).forEach((worker, def) -> {
                List<String> steps = def instanceof Map
                        ? getStringList((Map<String, Object>) def, "steps", List.of(JobSpec.ALL_STEPS))
                        : List.of(JobSpec.ALL_STEPS);
                workerSteps.put(worker.toString(), steps);
            });
        } else if (workersValue != null) {
            throw new InvalidJobSpecException("'workers' must be a mapping of worker name to definition");
        }

        return new JobSpec(name, stepQueues, workerSteps);
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new InvalidJobSpecException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return List.of(value.toString());
    }

    @FunctionalInterface
    private interface YamlLoad {
        Object load();
    }
}
