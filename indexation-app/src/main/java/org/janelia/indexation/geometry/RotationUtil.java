package org.janelia.indexation.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Rotation helpers shared by the vector matcher and the crystal map reducer.
 *
 * All rotation matrices are 3x3 row-major arrays that act on column vectors (v' = R v).
 * Euler angles use the Bunge convention (rotating z-x-z axes) and are expressed in degrees.
 */
public class RotationUtil {

    /** Minimum cross product norm (relative to the vector lengths) for a vector pair to define a plane. */
    public static final double MIN_PAIR_SINE = 1.0e-9;

    private static final double GIMBAL_LOCK_EPSILON = 4.0 * Math.ulp(1.0);

    private RotationUtil() {
    }

    /**
     * @return a new 3x3 identity matrix.
     */
    public static double[][] identity() {
        return new double[][] {
                { 1.0, 0.0, 0.0 },
                { 0.0, 1.0, 0.0 },
                { 0.0, 0.0, 1.0 }
        };
    }

    /**
     * @return true if the two vectors are non-zero and not (anti-)parallel,
     *         meaning they span a plane that can be used for alignment.
     */
    public static boolean definesPlane(final double[] v1,
                                       final double[] v2) {
        final Vector3D a = new Vector3D(v1);
        final Vector3D b = new Vector3D(v2);
        final double normProduct = a.getNorm() * b.getNorm();
        return (normProduct > 0) && (Vector3D.crossProduct(a, b).getNorm() / normProduct > MIN_PAIR_SINE);
    }

    /**
     * @return angle in radians between the two (non-zero) vectors.
     */
    public static double angleBetween(final double[] v1,
                                      final double[] v2) {
        return Vector3D.angle(new Vector3D(v1), new Vector3D(v2));
    }

    /**
     * Solves the two-vector alignment problem: builds the rotation that maps the direction
     * of reference vector 1 exactly onto the direction of experimental vector 1 and puts
     * reference vector 2 into the half-plane spanned by experimental vector 1 and +experimental vector 2,
     * which minimizes the angular residual of the second pair member.
     *
     * Both pairs must satisfy {@link #definesPlane}.
     *
     * @return rotation matrix R with R &middot; reference = experimental (reference frame to sample frame).
     */
    public static double[][] alignPairs(final double[] experimental1,
                                        final double[] experimental2,
                                        final double[] reference1,
                                        final double[] reference2) {
        final Rotation rotation = new Rotation(new Vector3D(reference1),
                                               new Vector3D(reference2),
                                               new Vector3D(experimental1),
                                               new Vector3D(experimental2));
        final double[][] matrix = new double[3][3];
        final Vector3D[] axes = { Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K };
        for (int column = 0; column < 3; column++) {
            final Vector3D rotatedAxis = rotation.applyTo(axes[column]);
            matrix[0][column] = rotatedAxis.getX();
            matrix[1][column] = rotatedAxis.getY();
            matrix[2][column] = rotatedAxis.getZ();
        }
        return matrix;
    }

    /**
     * @return Rt &middot; v, i.e. the vector v moved from the sample frame back into the reference frame of R.
     */
    public static double[] applyInverse(final double[][] rotation,
                                        final double[] v) {
        final double[] result = new double[3];
        for (int i = 0; i < 3; i++) {
            result[i] = rotation[0][i] * v[0] + rotation[1][i] * v[1] + rotation[2][i] * v[2];
        }
        return result;
    }

    /**
     * @return R &middot; v.
     */
    public static double[] apply(final double[][] rotation,
                                 final double[] v) {
        final double[] result = new double[3];
        for (int i = 0; i < 3; i++) {
            result[i] = rotation[i][0] * v[0] + rotation[i][1] * v[1] + rotation[i][2] * v[2];
        }
        return result;
    }

    /**
     * Converts a rotation matrix to Bunge (rotating z-x-z) Euler angles.
     * When the second angle is (numerically) zero, the first angle is fixed to zero
     * and the whole in-plane rotation is reported in the third angle.
     *
     * @return [phi1, Phi, phi2] in degrees.
     */
    public static double[] toBungeEulerAngles(final double[][] m) {
        final double sinPhi = Math.sqrt(m[2][0] * m[2][0] + m[2][1] * m[2][1]);
        final double phi1;
        final double phi2;
        if (sinPhi > GIMBAL_LOCK_EPSILON) {
            phi1 = Math.atan2(m[0][2], -m[1][2]);
            phi2 = Math.atan2(m[2][0], m[2][1]);
        } else {
            phi1 = 0.0;
            phi2 = Math.atan2(-m[0][1], m[0][0]);
        }
        final double capitalPhi = Math.atan2(sinPhi, m[2][2]);
        return new double[] { Math.toDegrees(phi1), Math.toDegrees(capitalPhi), Math.toDegrees(phi2) };
    }

    /**
     * Inverse of {@link #toBungeEulerAngles}.
     *
     * @param  eulerAngles  [phi1, Phi, phi2] in degrees.
     *
     * @return corresponding rotation matrix.
     */
    public static double[][] fromBungeEulerAngles(final double[] eulerAngles) {

        final double phi1 = Math.toRadians(eulerAngles[0]);
        final double capitalPhi = Math.toRadians(eulerAngles[1]);
        final double phi2 = Math.toRadians(eulerAngles[2]);

        final double c1 = Math.cos(phi1);
        final double s1 = Math.sin(phi1);
        final double c = Math.cos(capitalPhi);
        final double s = Math.sin(capitalPhi);
        final double c2 = Math.cos(phi2);
        final double s2 = Math.sin(phi2);

        return new double[][] {
                { c1 * c2 - s1 * s2 * c,   -c1 * s2 - s1 * c2 * c,   s1 * s  },
                { s1 * c2 + c1 * s2 * c,   -s1 * s2 + c1 * c2 * c,  -c1 * s  },
                { s2 * s,                   c2 * s,                   c      }
        };
    }

    /**
     * @return maximum absolute deviation of R &middot; Rt from the identity matrix.
     */
    public static double orthonormalityError(final double[][] rotation) {
        double maxError = 0.0;
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double dot = 0.0;
                for (int k = 0; k < 3; k++) {
                    dot += rotation[i][k] * rotation[j][k];
                }
                final double expected = (i == j) ? 1.0 : 0.0;
                maxError = Math.max(maxError, Math.abs(dot - expected));
            }
        }
        return maxError;
    }

}
