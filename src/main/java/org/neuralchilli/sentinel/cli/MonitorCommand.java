package org.neuralchilli.sentinel.cli;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import org.neuralchilli.sentinel.config.JobSpecParser;
import org.neuralchilli.sentinel.config.MonitorConfig;
import org.neuralchilli.sentinel.domain.InvalidJobSpecException;
import org.neuralchilli.sentinel.domain.JobSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Dependent
@Command(
        name = "monitor",
        mixinStandardHelpOptions = true,
        description = "Keep the allocation alive while the job has queued or running work"
)
public class MonitorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MonitorCommand.class);

    public static final int EXIT_INVALID_SPEC = 3;
    // sysexits EX_USAGE / EX_SOFTWARE, clear of the monitor loop codes
    public static final int EXIT_USAGE = 64;
    public static final int EXIT_ERROR = 70;

    @Inject
    JobSpecParser parser;

    @Inject
    MonitorLoop loop;

    @Inject
    MonitorConfig config;

    @Parameters(index = "0", description = "Job specification YAML file")
    Path specFile;

    @Parameters(index = "1..*", description = "Steps whose queues to watch (default: all)")
    List<String> steps = new ArrayList<>();

    @Option(
            names = {"--sleep"},
            converter = SleepConverter.class,
            description = "Pause between checks and between worker polls, in seconds or ISO-8601 (PT30S)"
    )
    Duration sleep;

    /**
     * Builds the command line with usage and execution failures mapped to
     * {@link #EXIT_USAGE} and {@link #EXIT_ERROR}.
     */
    public CommandLine commandLine() {
        CommandLine cmd = new CommandLine(this);
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return EXIT_USAGE;
        });
        cmd.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            log.error("Monitor command failed", ex);
            return EXIT_ERROR;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        JobSpec spec;
        try {
            spec = parser.parse(specFile);
            Duration pause = sleep != null ? sleep : config.sleep();
            List<String> selected = steps.isEmpty() ? List.of(JobSpec.ALL_STEPS) : steps;
            return loop.run(spec.view(selected), pause);
        } catch (InvalidJobSpecException e) {
            log.error("Invalid job spec {}: {}", specFile, e.getMessage());
            return EXIT_INVALID_SPEC;
        }
    }

    static class SleepConverter implements CommandLine.ITypeConverter<Duration> {

        @Override
        public Duration convert(String value) {
            Duration parsed;
            try {
                parsed = value.startsWith("P") || value.startsWith("p")
                        ? Duration.parse(value)
                        : Duration.ofSeconds(Long.parseLong(value));
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                        "'" + value + "' is not a number of seconds or an ISO-8601 duration");
            }
            if (parsed.isNegative()) {
                throw new CommandLine.TypeConversionException("sleep must not be negative: " + value);
            }
            return parsed;
        }
    }
}
