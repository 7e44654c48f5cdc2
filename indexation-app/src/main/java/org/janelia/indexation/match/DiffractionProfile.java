package org.janelia.indexation.match;

import java.io.Serializable;

/**
 * Simulated one-dimensional (powder-like) diffraction profile: reflection magnitudes with their hkls.
 */
public class DiffractionProfile
        implements Serializable {

    private final double[] magnitudes;
    private final int[][] hkls;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DiffractionProfile() {
        this(new double[0], new int[0][]);
    }

    public DiffractionProfile(final double[] magnitudes,
                              final int[][] hkls) {
        if (magnitudes.length != hkls.length) {
            throw new IllegalArgumentException("profile has " + magnitudes.length + " magnitudes but " +
                                               hkls.length + " hkls");
        }
        this.magnitudes = magnitudes;
        this.hkls = hkls;
    }

    public int size() {
        return magnitudes.length;
    }

    public double getMagnitude(final int index) {
        return magnitudes[index];
    }

    public int[] getHkl(final int index) {
        return hkls[index];
    }
}
