package org.neuralchilli.sentinel.cli;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.sentinel.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. With a job spec (argument or {@code monitor.spec-file}) runs the monitor loop
 * and exits with its code; without one, serves the status endpoints until shutdown.
 */
@QuarkusMain
public class SentinelMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(SentinelMain.class);

    @Inject
    MonitorConfig config;

    @Inject
    MonitorCommand command;

    @Override
    public int run(String... args) {
        String[] effectiveArgs = args;
        if (args.length == 0 && config.specFile().isPresent()) {
            effectiveArgs = new String[]{config.specFile().get()};
        }

        if (effectiveArgs.length == 0) {
            log.info("No job spec given, serving status endpoints");
            Quarkus.waitForExit();
            return 0;
        }

        return command.commandLine().execute(effectiveArgs);
    }
}
