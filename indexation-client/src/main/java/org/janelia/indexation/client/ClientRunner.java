package org.janelia.indexation.client;

import org.janelia.indexation.IndexationException;
import org.janelia.indexation.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a command line indexation client with consistent entry and exit log lines.
 *
 * A missing exit line means the client was terminated abnormally.
 * Failures to index a sample position are reported with their position and phase
 * and exit with {@link #EXIT_INDEXATION_FAILURE}, so a batch orchestrator can tell
 * bad data for one position apart from broken setups ({@link #EXIT_FAILURE}).
 */
public abstract class ClientRunner {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INDEXATION_FAILURE = 2;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting exit code.
     */
    public void run() {
        System.exit(runAndGetExitCode());
    }

    /**
     * Runs the client without exiting the JVM.
     *
     * @return {@link #EXIT_SUCCESS}, {@link #EXIT_INDEXATION_FAILURE} or {@link #EXIT_FAILURE}.
     */
    public int runAndGetExitCode() {

        LOG.info("runAndGetExitCode: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitCode;
        try {
            runClient(args);
            LOG.info("runAndGetExitCode: exit, processing completed in {}", processTimer);
            exitCode = EXIT_SUCCESS;
        } catch (final IndexationException e) {
            LOG.error("runAndGetExitCode: failed to index position {}, phase {}",
                      e.getPositionId(), e.getPhaseIndex(), e);
            LOG.info("runAndGetExitCode: exit, indexation failed after {}", processTimer);
            exitCode = EXIT_INDEXATION_FAILURE;
        } catch (final Throwable t) {
            LOG.error("runAndGetExitCode: caught exception", t);
            LOG.info("runAndGetExitCode: exit, processing failed after {}", processTimer);
            exitCode = EXIT_FAILURE;
        }

        return exitCode;
    }

    /**
     * Client specific implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws IndexationException
     *   if a sample position cannot be indexed.
     *
     * @throws Exception
     *   if the client fails for any other reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
