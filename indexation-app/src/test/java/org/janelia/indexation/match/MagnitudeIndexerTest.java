package org.janelia.indexation.match;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link MagnitudeIndexer} class.
 */
public class MagnitudeIndexerTest {

    @Test
    public void testIndexMagnitudes() {

        final DiffractionProfile profile = new DiffractionProfile(
                new double[] { 1.0, 1.41, 1.73, 2.0 },
                new int[][] { { 1, 0, 0 }, { 1, 1, 0 }, { 1, 1, 1 }, { 2, 0, 0 } });

        final List<MagnitudeIndexation> indexations =
                MagnitudeIndexer.indexMagnitudes(new double[] { 1.02, 1.72, 0.0 }, profile, 3.0);

        Assert.assertEquals("invalid number of indexations", 3, indexations.size());

        final List<MagnitudeIndexation.Candidate> first = indexations.get(0).getCandidates();
        Assert.assertEquals("invalid number of candidates for first magnitude", 1, first.size());
        Assert.assertArrayEquals("invalid hkl for first magnitude", new int[] { 1, 0, 0 }, first.get(0).getHkl());
        Assert.assertEquals("invalid deviation for first magnitude",
                            0.02 / 1.02 * 100.0, first.get(0).getPercentDeviation(), 1.0e-9);

        final List<MagnitudeIndexation.Candidate> second = indexations.get(1).getCandidates();
        Assert.assertEquals("invalid number of candidates for second magnitude", 1, second.size());
        Assert.assertArrayEquals("invalid hkl for second magnitude", new int[] { 1, 1, 1 }, second.get(0).getHkl());

        Assert.assertTrue("zero magnitude should not have candidates", indexations.get(2).getCandidates().isEmpty());
        Assert.assertEquals("invalid magnitude", 1.72, indexations.get(1).getMagnitude(), 0.0);
    }

    @Test
    public void testMismatchedProfile() {
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> new DiffractionProfile(new double[] { 1.0 }, new int[0][]));
    }

}
