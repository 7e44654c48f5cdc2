package org.janelia.indexation.match.parameters;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link VectorMatchParameters} class.
 */
public class VectorMatchParametersTest {

    @Test
    public void testDefaults() {

        final VectorMatchParameters parameters = new VectorMatchParameters();
        parameters.magnitudeTolerance = 0.1;
        parameters.angleTolerance = 0.05;
        parameters.indexErrorTolerance = 0.2;

        parameters.validateAndSetDefaults("test");

        Assert.assertEquals("invalid default peak count", Integer.valueOf(6), parameters.numberOfPeaksToIndex);
        Assert.assertEquals("invalid default solution count", Integer.valueOf(3), parameters.numberOfBestSolutions);
    }

    @Test
    public void testInvalidParameters() {

        final VectorMatchParameters missingTolerance = new VectorMatchParameters();
        final IllegalArgumentException e =
                Assert.assertThrows(IllegalArgumentException.class,
                                    () -> missingTolerance.validateAndSetDefaults("test"));
        Assert.assertEquals("invalid message", "test magnitudeTolerance must be defined", e.getMessage());

        final VectorMatchParameters negativeTolerance = new VectorMatchParameters(0.1, -0.1, 0.2, 6, 3);
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> negativeTolerance.validateAndSetDefaults("test"));

        final VectorMatchParameters noPeaks = new VectorMatchParameters(0.1, 0.1, 0.2, 0, 3);
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> noPeaks.validateAndSetDefaults("test"));

        final VectorMatchParameters noSolutions = new VectorMatchParameters(0.1, 0.1, 0.2, 6, 0);
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> noSolutions.validateAndSetDefaults("test"));
    }

}
