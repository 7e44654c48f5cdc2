package org.janelia.indexation.library;

import java.io.Serializable;
import java.util.List;

import org.janelia.indexation.geometry.RotationUtil;
import org.janelia.indexation.lattice.ReciprocalLattice;

/**
 * Reference reciprocal vector pairs for one crystal phase.
 *
 * Catalog row i holds an hkl pair (longer reciprocal vector first) and the
 * measurement derived from it: [magnitude1, magnitude2, interplanar angle in radians].
 */
public class VectorLibraryEntry
        implements Serializable {

    private final String phaseName;
    private final ReciprocalLattice reciprocalLattice;

    /** [row][2][3] */
    private final int[][][] indexPairs;

    /** [row][3] */
    private final double[][] measurements;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private VectorLibraryEntry() {
        this(null, null, null, null);
    }

    public VectorLibraryEntry(final String phaseName,
                              final ReciprocalLattice reciprocalLattice,
                              final int[][][] indexPairs,
                              final double[][] measurements) {
        this.phaseName = phaseName;
        this.reciprocalLattice = reciprocalLattice;
        this.indexPairs = indexPairs;
        this.measurements = measurements;
    }

    /**
     * Builds a catalog from hkl pairs, deriving each row's measurement from the lattice.
     * Pairs are reordered so that the longer reciprocal vector comes first.
     *
     * @throws IllegalArgumentException
     *   if a pair does not consist of two non-zero hkl triples.
     */
    public static VectorLibraryEntry fromIndexPairs(final String phaseName,
                                                    final ReciprocalLattice reciprocalLattice,
                                                    final List<int[][]> pairs)
            throws IllegalArgumentException {

        final int[][][] orderedPairs = new int[pairs.size()][][];
        final double[][] measurements = new double[pairs.size()][];

        for (int row = 0; row < pairs.size(); row++) {

            final int[][] pair = pairs.get(row);
            if ((pair.length != 2) || (pair[0].length != 3) || (pair[1].length != 3)) {
                throw new IllegalArgumentException(phaseName + " pair " + row + " must contain two hkl triples");
            }

            double[] g1 = reciprocalLattice.toCartesian(pair[0]);
            double[] g2 = reciprocalLattice.toCartesian(pair[1]);
            double length1 = length(g1);
            double length2 = length(g2);
            if ((length1 == 0.0) || (length2 == 0.0)) {
                throw new IllegalArgumentException(phaseName + " pair " + row + " contains a zero hkl");
            }

            if (length1 < length2) {
                orderedPairs[row] = new int[][] { pair[1].clone(), pair[0].clone() };
                final double[] swap = g1;
                g1 = g2;
                g2 = swap;
                final double swapLength = length1;
                length1 = length2;
                length2 = swapLength;
            } else {
                orderedPairs[row] = new int[][] { pair[0].clone(), pair[1].clone() };
            }

            measurements[row] = new double[] { length1, length2, RotationUtil.angleBetween(g1, g2) };
        }

        return new VectorLibraryEntry(phaseName, reciprocalLattice, orderedPairs, measurements);
    }

    public String getPhaseName() {
        return phaseName;
    }

    public ReciprocalLattice getReciprocalLattice() {
        return reciprocalLattice;
    }

    public int getCatalogSize() {
        return indexPairs.length;
    }

    /**
     * @return copy of the row's hkl pair, longer reciprocal vector first.
     */
    public int[][] getIndexPair(final int row) {
        return new int[][] { indexPairs[row][0].clone(), indexPairs[row][1].clone() };
    }

    /**
     * @return copy of the row's [magnitude1, magnitude2, angle] measurement.
     */
    public double[] getMeasurement(final int row) {
        return measurements[row].clone();
    }

    /**
     * @return true if the catalog row's magnitudes and angle all lie strictly within
     *         the specified tolerances of the measured pair values.
     */
    public boolean isWithinTolerance(final int row,
                                     final double magnitude1,
                                     final double magnitude2,
                                     final double angle,
                                     final double magnitudeTolerance,
                                     final double angleTolerance) {
        final double[] measurement = measurements[row];
        return (Math.abs(measurement[0] - magnitude1) < magnitudeTolerance) &&
               (Math.abs(measurement[1] - magnitude2) < magnitudeTolerance) &&
               (Math.abs(measurement[2] - angle) < angleTolerance);
    }

    /**
     * @throws IllegalArgumentException
     *   if any data is missing or the catalog index pair and measurement rows disagree.
     */
    public void validate(final String context)
            throws IllegalArgumentException {

        if ((reciprocalLattice == null) || (indexPairs == null) || (measurements == null)) {
            throw new IllegalArgumentException(context + " must define reciprocalLattice, indexPairs, and measurements");
        }

        if (indexPairs.length != measurements.length) {
            throw new IllegalArgumentException(context + " has " + indexPairs.length + " index pairs but " +
                                               measurements.length + " measurements");
        }

        for (int row = 0; row < indexPairs.length; row++) {
            if ((indexPairs[row].length != 2) || (indexPairs[row][0].length != 3) || (indexPairs[row][1].length != 3)) {
                throw new IllegalArgumentException(context + " index pair " + row + " must contain two hkl triples");
            }
            if (measurements[row].length != 3) {
                throw new IllegalArgumentException(context + " measurement " + row + " must contain 3 values");
            }
        }
    }

    private static double length(final double[] v) {
        return Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    }

}
