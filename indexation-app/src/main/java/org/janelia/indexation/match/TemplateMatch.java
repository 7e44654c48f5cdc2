package org.janelia.indexation.match;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One correlated template: the phase it belongs to, its orientation
 * (Bunge Euler angles in degrees, in-plane rotation already added to the third angle),
 * and its correlation score.
 *
 * Scores are only normalized by the template intensity magnitude, not by the experimental image,
 * so they are not bounded to [-1, 1].
 */
public class TemplateMatch
        implements Serializable {

    private final int phaseIndex;
    private final double[] orientation;
    private final double correlation;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TemplateMatch() {
        this(0, new double[3], 0.0);
    }

    public TemplateMatch(final int phaseIndex,
                         final double[] orientation,
                         final double correlation) {
        this.phaseIndex = phaseIndex;
        this.orientation = orientation;
        this.correlation = correlation;
    }

    public int getPhaseIndex() {
        return phaseIndex;
    }

    public double[] getOrientation() {
        return orientation.clone();
    }

    public double getCorrelation() {
        return correlation;
    }

    @Override
    public String toString() {
        return "{ \"phaseIndex\": " + phaseIndex +
               ", \"orientation\": " + Arrays.toString(orientation) +
               ", \"correlation\": " + correlation + " }";
    }
}
