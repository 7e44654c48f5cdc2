package org.janelia.indexation.match;

import java.io.Serializable;

/**
 * Candidate rotation derived from one experimental vector pair and one reference catalog row.
 */
public class VectorSolution
        implements Serializable {

    private final double[][] rotation;
    private final double matchRate;
    private final double[][] indexErrors;
    private final double meanError;
    private final int vectorPairIndex;

    /**
     * @param  rotation         rotation from the reference (crystal) frame to the sample frame.
     * @param  matchRate        fraction of all experimental vectors indexed within tolerance.
     * @param  indexErrors      [vector][3] absolute deviation of each vector's fractional hkl from the nearest integers.
     * @param  meanError        mean deviation over the vectors indexed within tolerance.
     * @param  vectorPairIndex  index of the experimental vector pair (in enumeration order) that produced this solution.
     */
    public VectorSolution(final double[][] rotation,
                          final double matchRate,
                          final double[][] indexErrors,
                          final double meanError,
                          final int vectorPairIndex) {
        this.rotation = copy(rotation);
        this.matchRate = matchRate;
        this.indexErrors = copy(indexErrors);
        this.meanError = meanError;
        this.vectorPairIndex = vectorPairIndex;
    }

    public double[][] getRotation() {
        return copy(rotation);
    }

    public double getMatchRate() {
        return matchRate;
    }

    public double[][] getIndexErrors() {
        return copy(indexErrors);
    }

    public double getMeanError() {
        return meanError;
    }

    public int getVectorPairIndex() {
        return vectorPairIndex;
    }

    @Override
    public String toString() {
        return "{ \"matchRate\": " + matchRate +
               ", \"meanError\": " + meanError +
               ", \"vectorPairIndex\": " + vectorPairIndex + " }";
    }

    static double[][] copy(final double[][] matrix) {
        final double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
