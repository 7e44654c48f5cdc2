package org.janelia.indexation.geometry;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link RotationUtil} class.
 */
public class RotationUtilTest {

    @Test
    public void testEulerAngleConversion() {

        final double[] angles = { 30.0, 40.0, 50.0 };
        final double[][] rotation = RotationUtil.fromBungeEulerAngles(angles);

        Assert.assertEquals("rotation should be orthonormal",
                            0.0, RotationUtil.orthonormalityError(rotation), 1.0e-12);

        assertArrayEquals("angles should survive conversion", angles, RotationUtil.toBungeEulerAngles(rotation));

        // Rz(phi1) Rx(Phi) Rz(phi2) maps z onto (sin phi1 sin Phi, -cos phi1 sin Phi, cos Phi)
        final double[] rotatedZ = RotationUtil.apply(rotation, new double[] { 0.0, 0.0, 1.0 });
        final double phi1 = Math.toRadians(30.0);
        final double capitalPhi = Math.toRadians(40.0);
        assertArrayEquals("invalid rotated z axis",
                          new double[] {
                                  Math.sin(phi1) * Math.sin(capitalPhi),
                                  -Math.cos(phi1) * Math.sin(capitalPhi),
                                  Math.cos(capitalPhi)
                          },
                          rotatedZ);
    }

    @Test
    public void testGimbalLockConversion() {
        final double[][] rotation = RotationUtil.fromBungeEulerAngles(new double[] { 20.0, 0.0, 50.0 });
        assertArrayEquals("in-plane rotation should be reported in the third angle",
                          new double[] { 0.0, 0.0, 70.0 }, RotationUtil.toBungeEulerAngles(rotation));
    }

    @Test
    public void testAlignPairs() {

        final double[][] expectedRotation = RotationUtil.fromBungeEulerAngles(new double[] { 15.0, 75.0, 130.0 });

        final double[] reference1 = { 1.0, 0.0, 0.0 };
        final double[] reference2 = { 0.3, 1.2, 0.0 };
        final double[] experimental1 = RotationUtil.apply(expectedRotation, reference1);
        final double[] experimental2 = RotationUtil.apply(expectedRotation, reference2);

        final double[][] rotation = RotationUtil.alignPairs(experimental1, experimental2, reference1, reference2);

        for (int i = 0; i < 3; i++) {
            assertArrayEquals("invalid rotation row " + i, expectedRotation[i], rotation[i]);
        }

        assertArrayEquals("inverse should map experimental vector back onto reference",
                          reference2, RotationUtil.applyInverse(rotation, experimental2));
    }

    @Test
    public void testAlignPairsWithAngleMismatch() {

        final double[] experimental1 = { 0.0, 0.0, 2.0 };
        final double[] experimental2 = { 1.0, 0.1, 0.0 };
        final double[] reference1 = { 1.0, 0.0, 0.0 };
        final double[] reference2 = { 0.2, 1.0, 0.0 };

        final double[][] rotation = RotationUtil.alignPairs(experimental1, experimental2, reference1, reference2);

        Assert.assertEquals("rotation should be orthonormal",
                            0.0, RotationUtil.orthonormalityError(rotation), 1.0e-12);

        assertArrayEquals("first reference direction should map exactly onto first experimental direction",
                          new double[] { 0.0, 0.0, 1.0 }, RotationUtil.apply(rotation, reference1));

        final double[] rotated2 = RotationUtil.apply(rotation, reference2);
        final double[] normal = {
                experimental1[1] * experimental2[2] - experimental1[2] * experimental2[1],
                experimental1[2] * experimental2[0] - experimental1[0] * experimental2[2],
                experimental1[0] * experimental2[1] - experimental1[1] * experimental2[0]
        };
        final double outOfPlane = rotated2[0] * normal[0] + rotated2[1] * normal[1] + rotated2[2] * normal[2];
        Assert.assertEquals("second reference vector should lie in the experimental plane",
                            0.0, outOfPlane, 1.0e-12);
    }

    @Test
    public void testDefinesPlane() {
        Assert.assertTrue("perpendicular vectors should define a plane",
                          RotationUtil.definesPlane(new double[] { 1, 0, 0 }, new double[] { 0, 2, 0 }));
        Assert.assertFalse("parallel vectors should not define a plane",
                           RotationUtil.definesPlane(new double[] { 1, 1, 0 }, new double[] { 2, 2, 0 }));
        Assert.assertFalse("anti-parallel vectors should not define a plane",
                           RotationUtil.definesPlane(new double[] { 1, 1, 0 }, new double[] { -1, -1, 0 }));
        Assert.assertFalse("zero vector should not define a plane",
                           RotationUtil.definesPlane(new double[] { 0, 0, 0 }, new double[] { 0, 2, 0 }));
    }

    @Test
    public void testAngleBetween() {
        Assert.assertEquals("invalid angle",
                            Math.PI / 4,
                            RotationUtil.angleBetween(new double[] { 2, 0, 0 }, new double[] { 1, 1, 0 }),
                            1.0e-12);
    }

    private static void assertArrayEquals(final String message,
                                          final double[] expected,
                                          final double[] actual) {
        Assert.assertEquals(message + ": invalid length", expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            Assert.assertEquals(message + ": invalid value at index " + i, expected[i], actual[i], 1.0e-9);
        }
    }

}
