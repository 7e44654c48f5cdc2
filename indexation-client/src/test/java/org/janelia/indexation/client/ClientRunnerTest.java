package org.janelia.indexation.client;

import java.io.IOException;

import org.janelia.indexation.IndexationException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 */
public class ClientRunnerTest {

    @Test
    public void testExitCodes() {

        final ClientRunner successfulRunner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) {
            }
        };
        Assert.assertEquals("invalid exit code for successful run",
                            ClientRunner.EXIT_SUCCESS, successfulRunner.runAndGetExitCode());

        final ClientRunner indexationFailureRunner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) {
                throw new IndexationException("x4y2", 1, "winning phase has no runner-up");
            }
        };
        Assert.assertEquals("invalid exit code for indexation failure",
                            ClientRunner.EXIT_INDEXATION_FAILURE, indexationFailureRunner.runAndGetExitCode());

        final ClientRunner ioFailureRunner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) throws Exception {
                throw new IOException("missing library file");
            }
        };
        Assert.assertEquals("invalid exit code for other failures",
                            ClientRunner.EXIT_FAILURE, ioFailureRunner.runAndGetExitCode());
    }

}
