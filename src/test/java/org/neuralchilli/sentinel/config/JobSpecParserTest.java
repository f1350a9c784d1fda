package org.neuralchilli.sentinel.config;

import org.junit.jupiter.api.Test;
import org.neuralchilli.sentinel.domain.InvalidJobSpecException;
import org.neuralchilli.sentinel.domain.JobSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSpecParserTest {

    private final JobSpecParser parser = new JobSpecParser();

    @Test
    void shouldParseJobSpec() {
        String yaml = """
                name: hello
                steps:
                  - name: step1
                    queue: fast
                  - name: step2
                    queue: slow
                workers:
                  step1_worker:
                    steps: [step1]
                  step2_worker:
                    steps: [step2]
                """;

        JobSpec spec = parser.parse(yaml);

        assertThat(spec.name()).isEqualTo("hello");
        assertThat(spec.queueList(List.of("all"))).containsExactly("fast", "slow");
        assertThat(spec.workerNames()).containsExactly("step1_worker", "step2_worker");
        assertThat(spec.queuesForWorker("step2_worker")).containsExactly("slow");
    }

    @Test
    void shouldApplyDefaultQueueAndPrefix() {
        String yaml = """
                name: hello
                queue_prefix: "[sentinel]_"
                default_queue: main
                steps:
                  - name: step1
                  - name: step2
                    queue: other
                workers:
                  everything:
                """;

        JobSpec spec = parser.parse(yaml);

        assertThat(spec.stepQueues())
                .containsEntry("step1", "[sentinel]_main")
                .containsEntry("step2", "[sentinel]_other");
        assertThat(spec.workerSteps().get("everything")).containsExactly(JobSpec.ALL_STEPS);
    }

    @Test
    void shouldUseDefaultQueueName() {
        JobSpec spec = parser.parse("""
                name: hello
                steps:
                  - name: only
                """);

        assertThat(spec.queueList(List.of("only"))).containsExactly(JobSpecParser.DEFAULT_QUEUE);
        assertThat(spec.workerNames()).isEmpty();
    }

    @Test
    void shouldParseFromFile() throws IOException {
        Path file = Files.createTempFile("sentinel-spec-", ".yaml");
        try {
            Files.writeString(file, """
                    name: from-file
                    steps:
                      - name: s
                        queue: q
                    """);

            assertThat(parser.parse(file).name()).isEqualTo("from-file");
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void shouldRejectInvalidSpecs() {
        assertThatThrownBy(() -> parser.parse("steps: [{name: a}]"))
                .isInstanceOf(InvalidJobSpecException.class)
                .hasMessageContaining("Missing required field: name");

        assertThatThrownBy(() -> parser.parse("name: x"))
                .isInstanceOf(InvalidJobSpecException.class)
                .hasMessageContaining("at least one step");

        assertThatThrownBy(() -> parser.parse("name: x\nsteps: [{name: a}, {name: a}]"))
                .isInstanceOf(InvalidJobSpecException.class)
                .hasMessageContaining("Duplicate step name");

        assertThatThrownBy(() -> parser.parse("- just\n- a list"))
                .isInstanceOf(InvalidJobSpecException.class)
                .hasMessageContaining("must be a YAML mapping");

        assertThatThrownBy(() -> parser.parse("name: [unclosed"))
                .isInstanceOf(InvalidJobSpecException.class)
                .hasMessageContaining("Invalid job spec YAML");
    }

    @Test
    void shouldReportMissingFile() {
        assertThatThrownBy(() -> parser.parse(Path.of("/does/not/exist.yaml")))
                .isInstanceOf(InvalidJobSpecException.class)
                .hasMessageContaining("Failed to read job spec");
    }
}
