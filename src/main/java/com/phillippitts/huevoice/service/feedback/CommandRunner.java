package com.phillippitts.huevoice.service.feedback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a short-lived helper process to completion, killing it when it overruns.
 */
class CommandRunner {

    private static final Logger LOG = LogManager.getLogger(CommandRunner.class);

    private final ProcessFactory processFactory;
    private final Duration timeout;

    CommandRunner(ProcessFactory processFactory, Duration timeout) {
        this.processFactory = processFactory;
        this.timeout = timeout;
    }

    CommandRunner(Duration timeout) {
        this(new DefaultProcessFactory(), timeout);
    }

    /**
     * @return true when the process exited with status 0 in time
     */
    boolean run(List<String> command) {
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException e) {
            LOG.debug("Cannot start {}: {}", command.get(0), e.getMessage());
            return false;
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("{} did not finish within {}ms; killing it", command.get(0), timeout.toMillis());
                process.destroyForcibly();
                return false;
            }
            int exit = process.exitValue();
            if (exit != 0) {
                LOG.debug("{} exited with status {}", command.get(0), exit);
            }
            return exit == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return false;
        }
    }
}
