package org.janelia.indexation;

import java.util.List;

import org.janelia.indexation.geometry.RotationUtil;
import org.janelia.indexation.lattice.ReciprocalLattice;
import org.janelia.indexation.library.TemplateLibrary;
import org.janelia.indexation.library.VectorLibrary;
import org.janelia.indexation.map.CrystalMapEntry;
import org.janelia.indexation.match.TemplateCorrelatorTest;
import org.janelia.indexation.match.TemplateMatch;
import org.janelia.indexation.match.VectorMatchResult;
import org.janelia.indexation.match.VectorPairMatcherTest;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SamplePositionIndexer} class.
 */
public class SamplePositionIndexerTest {

    @Test
    public void testTemplateIndexation() {

        final TemplateLibrary library = new TemplateLibrary(TemplateCorrelatorTest.buildEntry("alpha", 1.0));

        final List<TemplateMatch> matches =
                SamplePositionIndexer.correlate("p1", TemplateCorrelatorTest.buildImage(), library, 3, true);
        Assert.assertEquals("invalid number of matches", 3, matches.size());

        final CrystalMapEntry entry = SamplePositionIndexer.reduceTemplateMatches("p1", matches);

        Assert.assertEquals("invalid phase", 0, entry.getPhaseIndex());
        Assert.assertArrayEquals("invalid orientation",
                                 new double[] { 10.0, 20.0, 30.0 }, entry.getOrientation(), 1.0e-9);
        Assert.assertEquals("invalid correlation",
                            65.0 / Math.sqrt(2.0), entry.getScalarMetric(CrystalMapEntry.CORRELATION), 1.0e-9);
        Assert.assertEquals("invalid orientation reliability",
                            100.0 * (1.0 - 56.0 / 65.0),
                            entry.getScalarMetric(CrystalMapEntry.ORIENTATION_RELIABILITY), 1.0e-9);
    }

    @Test
    public void testVectorIndexation() {

        final double[][] rotation = RotationUtil.fromBungeEulerAngles(VectorPairMatcherTest.SAMPLE_ORIENTATION);
        final double[][] vectors = VectorPairMatcherTest.buildSampleVectors(VectorPairMatcherTest.ORTHORHOMBIC_LATTICE,
                                                                            VectorPairMatcherTest.REFLECTIONS,
                                                                            rotation);

        final ReciprocalLattice largeLattice = new ReciprocalLattice(new double[][] {
                { 5.0, 0.0, 0.0 },
                { 0.0, 6.0, 0.0 },
                { 0.0, 0.0, 7.0 }
        });
        final VectorLibrary library =
                new VectorLibrary(VectorPairMatcherTest.buildPhase("ortho"),
                                  VectorPairMatcherTest.buildPhase("large", largeLattice,
                                                                   VectorPairMatcherTest.REFLECTIONS));

        final VectorMatchResult result =
                SamplePositionIndexer.matchVectors("p2", vectors, library, 0.01, 0.01, 0.1, 6, 2);
        Assert.assertEquals("invalid number of matches", 4, result.getMatches().size());

        final CrystalMapEntry entry = SamplePositionIndexer.reduceVectorMatches("p2", result.getMatches());

        Assert.assertEquals("invalid phase", 0, entry.getPhaseIndex());
        Assert.assertArrayEquals("invalid orientation",
                                 VectorPairMatcherTest.SAMPLE_ORIENTATION, entry.getOrientation(), 1.0e-6);
        Assert.assertEquals("invalid match rate", 1.0, entry.getScalarMetric(CrystalMapEntry.MATCH_RATE), 0.0);
        Assert.assertEquals("invalid phase reliability",
                            100.0, entry.getScalarMetric(CrystalMapEntry.PHASE_RELIABILITY), 1.0e-6);
    }

    @Test
    public void testInvalidCounts() {

        final TemplateLibrary library = new TemplateLibrary(TemplateCorrelatorTest.buildEntry("alpha", 1.0));
        Assert.assertThrows(IndexationException.class,
                            () -> SamplePositionIndexer.correlate("p3", TemplateCorrelatorTest.buildImage(),
                                                                  library, 0, true));

        final VectorLibrary vectorLibrary = new VectorLibrary(VectorPairMatcherTest.buildPhase("ortho"));
        final double[][] vectors = { { 1.0, 0.0, 0.0 }, { 0.0, 1.0, 0.0 } };
        final IndexationException e =
                Assert.assertThrows(IndexationException.class,
                                    () -> SamplePositionIndexer.matchVectors("p3", vectors, vectorLibrary,
                                                                             0.01, 0.01, 0.1, 6, 0));
        Assert.assertEquals("invalid position in exception", "p3", e.getPositionId());
    }

}
