package org.janelia.indexation.lattice;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Arrays;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Reciprocal lattice of one crystal phase, able to convert Miller indices to cartesian
 * scattering vectors and cartesian vectors back to (fractional) Miller indices.
 *
 * The basis rows are the reciprocal basis vectors a*, b* and c* in the crystallographic
 * convention (no 2&pi; factor), so that q = h a* + k b* + l c*.
 */
public class ReciprocalLattice
        implements Serializable {

    /** rows are a*, b*, c* */
    private final double[][] basis;

    /** derived from basis on construction (including JSON deserialization) */
    @JsonIgnore
    private final double[][] inverseBasis;

    /**
     * @param  basis  3x3 matrix whose rows are the reciprocal basis vectors a*, b* and c*.
     *
     * @throws IllegalArgumentException
     *   if the basis is not 3x3 or is singular.
     */
    @JsonCreator
    public ReciprocalLattice(@JsonProperty("basis") final double[][] basis)
            throws IllegalArgumentException {
        this.basis = copy(basis);
        this.inverseBasis = invert(this.basis);
    }

    /**
     * Derives the reciprocal lattice from direct lattice parameters.
     * The direct basis is oriented with a along x and b in the xy plane.
     *
     * @param  a      direct lattice length a.
     * @param  b      direct lattice length b.
     * @param  c      direct lattice length c.
     * @param  alpha  angle between b and c in degrees.
     * @param  beta   angle between a and c in degrees.
     * @param  gamma  angle between a and b in degrees.
     */
    public static ReciprocalLattice fromLatticeParameters(final double a,
                                                          final double b,
                                                          final double c,
                                                          final double alpha,
                                                          final double beta,
                                                          final double gamma) {

        final double cosAlpha = Math.cos(Math.toRadians(alpha));
        final double cosBeta = Math.cos(Math.toRadians(beta));
        final double cosGamma = Math.cos(Math.toRadians(gamma));
        final double sinGamma = Math.sin(Math.toRadians(gamma));

        final double betaTerm = (cosAlpha - cosBeta * cosGamma) / sinGamma;
        final double gammaTerm = Math.sqrt(1.0 - cosBeta * cosBeta - betaTerm * betaTerm);

        final double[][] direct = {
                { a,            0.0,            0.0           },
                { b * cosGamma, b * sinGamma,   0.0           },
                { c * cosBeta,  c * betaTerm,   c * gammaTerm }
        };

        // reciprocal rows are the columns of the inverted direct basis
        final RealMatrix reciprocal = new LUDecomposition(new Array2DRowRealMatrix(direct, false))
                .getSolver().getInverse().transpose();

        return new ReciprocalLattice(reciprocal.getData());
    }

    public double[][] getBasis() {
        return copy(basis);
    }

    /**
     * @return cartesian reciprocal vector for the specified (possibly fractional) Miller indices.
     */
    public double[] toCartesian(final double[] hkl) {
        return rowTimesMatrix(hkl, basis);
    }

    /**
     * @return cartesian reciprocal vector for the specified Miller indices.
     */
    public double[] toCartesian(final int[] hkl) {
        return toCartesian(new double[] { hkl[0], hkl[1], hkl[2] });
    }

    /**
     * @return fractional Miller indices for the specified cartesian reciprocal vector.
     */
    public double[] toFractional(final double[] cartesian) {
        return rowTimesMatrix(cartesian, inverseBasis);
    }

    @Override
    public String toString() {
        return "{\"basis\": " + Arrays.deepToString(basis) + "}";
    }

    private static double[] rowTimesMatrix(final double[] row,
                                           final double[][] matrix) {
        final double[] result = new double[3];
        for (int j = 0; j < 3; j++) {
            result[j] = row[0] * matrix[0][j] + row[1] * matrix[1][j] + row[2] * matrix[2][j];
        }
        return result;
    }

    private static double[][] invert(final double[][] matrix)
            throws IllegalArgumentException {
        final LUDecomposition decomposition = new LUDecomposition(new Array2DRowRealMatrix(matrix, true));
        if (! decomposition.getSolver().isNonSingular()) {
            throw new IllegalArgumentException("reciprocal basis " + Arrays.deepToString(matrix) + " is singular");
        }
        return decomposition.getSolver().getInverse().getData();
    }

    private static double[][] copy(final double[][] matrix)
            throws IllegalArgumentException {
        if ((matrix == null) || (matrix.length != 3)) {
            throw new IllegalArgumentException("reciprocal basis must have 3 rows");
        }
        final double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            if (matrix[i].length != 3) {
                throw new IllegalArgumentException("reciprocal basis row " + i + " must have 3 columns");
            }
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

}
