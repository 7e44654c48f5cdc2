package org.janelia.indexation.library;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.indexation.lattice.ReciprocalLattice;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link VectorLibraryEntry} and {@link VectorLibrary} classes.
 */
public class VectorLibraryEntryTest {

    private static final ReciprocalLattice LATTICE = new ReciprocalLattice(new double[][] {
            { 1.0, 0.0, 0.0 },
            { 0.0, 1.3, 0.0 },
            { 0.0, 0.0, 1.7 }
    });

    @Test
    public void testFromIndexPairs() {

        final List<int[][]> pairs = Arrays.asList(new int[][] { { 1, 0, 0 }, { 0, 0, 1 } },
                                                  new int[][] { { 1, 1, 0 }, { 1, 0, 0 } });

        final VectorLibraryEntry entry = VectorLibraryEntry.fromIndexPairs("ortho", LATTICE, pairs);
        entry.validate("test");

        Assert.assertEquals("invalid catalog size", 2, entry.getCatalogSize());

        // shorter reflection was listed first so the pair should be reordered
        Assert.assertArrayEquals("invalid first hkl", new int[] { 0, 0, 1 }, entry.getIndexPair(0)[0]);
        Assert.assertArrayEquals("invalid second hkl", new int[] { 1, 0, 0 }, entry.getIndexPair(0)[1]);
        Assert.assertArrayEquals("invalid measurement",
                                 new double[] { 1.7, 1.0, Math.PI / 2 }, entry.getMeasurement(0), 1.0e-12);

        final double length110 = Math.sqrt(1.0 + 1.3 * 1.3);
        Assert.assertArrayEquals("invalid measurement for already ordered pair",
                                 new double[] { length110, 1.0, Math.acos(1.0 / length110) },
                                 entry.getMeasurement(1), 1.0e-12);

        Assert.assertTrue("measured pair should be within tolerance",
                          entry.isWithinTolerance(0, 1.705, 0.995, Math.PI / 2 + 0.005, 0.01, 0.01));
        Assert.assertFalse("tolerance comparison should be strict",
                           entry.isWithinTolerance(0, 1.7, 1.5, Math.PI / 2, 0.5, 0.01));
        Assert.assertFalse("angle outside tolerance should not match",
                           entry.isWithinTolerance(0, 1.7, 1.0, Math.PI / 3, 0.01, 0.01));
    }

    @Test
    public void testZeroIndex() {
        final List<int[][]> pairs = Collections.singletonList(new int[][] { { 0, 0, 0 }, { 1, 0, 0 } });
        Assert.assertThrows(IllegalArgumentException.class,
                            () -> VectorLibraryEntry.fromIndexPairs("bad", LATTICE, pairs));
    }

    @Test
    public void testValidate() {
        final VectorLibraryEntry mismatched = new VectorLibraryEntry("mismatched",
                                                                     LATTICE,
                                                                     new int[][][] { { { 1, 0, 0 }, { 0, 1, 0 } } },
                                                                     new double[0][]);
        Assert.assertThrows(IllegalArgumentException.class, () -> mismatched.validate("test"));

        final VectorLibraryEntry missingLattice = new VectorLibraryEntry("missing",
                                                                         null,
                                                                         new int[0][][],
                                                                         new double[0][]);
        Assert.assertThrows(IllegalArgumentException.class, () -> missingLattice.validate("test"));
    }

    @Test
    public void testJsonProcessing() {

        final List<int[][]> pairs = Collections.singletonList(new int[][] { { 1, 0, 0 }, { 0, 1, 0 } });
        final VectorLibrary library = new VectorLibrary(VectorLibraryEntry.fromIndexPairs("ortho", LATTICE, pairs));

        final VectorLibrary parsedLibrary = VectorLibrary.fromJson(new StringReader(library.toJson()));
        Assert.assertEquals("invalid number of phases", 1, parsedLibrary.getPhaseCount());

        final VectorLibraryEntry parsedEntry = parsedLibrary.getPhase(0);
        parsedEntry.validate("parsed entry");

        Assert.assertEquals("invalid phase name", "ortho", parsedEntry.getPhaseName());
        Assert.assertArrayEquals("invalid measurement",
                                 new double[] { 1.3, 1.0, Math.PI / 2 }, parsedEntry.getMeasurement(0), 1.0e-12);
        Assert.assertArrayEquals("parsed lattice should convert back to fractional coordinates",
                                 new double[] { 1.0, 2.0, 3.0 },
                                 parsedEntry.getReciprocalLattice().toFractional(new double[] { 1.0, 2.6, 5.1 }),
                                 1.0e-12);
    }

    @Test
    public void testSingularLatticeRejectedWhenLoaded() {

        final String json = "{ \"phases\": [ { \"phaseName\": \"flat\", " +
                            "\"reciprocalLattice\": { \"basis\": [ [1, 0, 0], [0, 1, 0], [0, 0, 0] ] }, " +
                            "\"indexPairs\": [], \"measurements\": [] } ] }";

        final IllegalArgumentException e =
                Assert.assertThrows(IllegalArgumentException.class,
                                    () -> VectorLibrary.fromJson(new StringReader(json)));
        Assert.assertTrue("message should identify singular basis: " + e.getMessage(),
                          e.getMessage().contains("singular"));
    }

    @Test
    public void testGettersReturnCopies() {

        final List<int[][]> pairs = Collections.singletonList(new int[][] { { 1, 0, 0 }, { 0, 1, 0 } });
        final VectorLibraryEntry entry = VectorLibraryEntry.fromIndexPairs("ortho", LATTICE, pairs);

        entry.getIndexPair(0)[0][0] = 7;
        entry.getMeasurement(0)[0] = 7.0;

        Assert.assertArrayEquals("index pair changed through getter", new int[] { 0, 1, 0 }, entry.getIndexPair(0)[0]);
        Assert.assertEquals("measurement changed through getter", 1.3, entry.getMeasurement(0)[0], 1.0e-12);
        Assert.assertTrue("tolerance check should use unchanged measurement",
                          entry.isWithinTolerance(0, 1.3, 1.0, Math.PI / 2, 0.01, 0.01));
    }


}
