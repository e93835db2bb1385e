package org.janelia.calibration.client;

import org.janelia.calibration.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a command line tool so that every run ends with an exit log message and exit code.
 * A missing exit message in the log means the tool was killed.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    private final String[] args;

    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the tool and terminates the JVM with its exit code.
     */
    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * @return 0 if the tool completed, 1 if it threw anything.
     */
    public int runWithoutExit() {

        final String clientName = getClass().getEnclosingClass() == null ?
                                  getClass().getName() : getClass().getEnclosingClass().getSimpleName();
        final ProcessTimer processTimer = new ProcessTimer();

        LOG.info("run: entry, starting {}", clientName);

        int exitCode = 1;
        try {
            runClient(args);
            exitCode = 0;
        } catch (final Throwable t) {
            LOG.error("run: {} failed", clientName, t);
        }

        LOG.info("run: exit, {} finished with code {} after {}", clientName, exitCode, processTimer);

        return exitCode;
    }

    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
