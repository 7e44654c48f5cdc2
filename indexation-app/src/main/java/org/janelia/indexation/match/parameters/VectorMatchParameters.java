package org.janelia.indexation.match.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for diffraction vector pair matching.
 */
public class VectorMatchParameters
        implements Serializable {

    public VectorMatchParameters() {
        setDefaults();
    }

    public VectorMatchParameters(final double magnitudeTolerance,
                                 final double angleTolerance,
                                 final double indexErrorTolerance,
                                 final int numberOfPeaksToIndex,
                                 final int numberOfBestSolutions) {
        this.magnitudeTolerance = magnitudeTolerance;
        this.angleTolerance = angleTolerance;
        this.indexErrorTolerance = indexErrorTolerance;
        this.numberOfPeaksToIndex = numberOfPeaksToIndex;
        this.numberOfBestSolutions = numberOfBestSolutions;
    }

    @Parameter(
            names = "--vmMagnitudeTolerance",
            description = "Max allowed magnitude difference when comparing experimental and reference vectors"
    )
    public Double magnitudeTolerance;

    @Parameter(
            names = "--vmAngleTolerance",
            description = "Max allowed difference (in radians) between experimental and reference pair angles"
    )
    public Double angleTolerance;

    @Parameter(
            names = "--vmIndexErrorTolerance",
            description = "Max allowed deviation of a rotated vector's fractional hkl from the nearest integer hkl " +
                          "for the vector to count as indexed"
    )
    public Double indexErrorTolerance;

    @Parameter(
            names = "--vmNumberOfPeaksToIndex",
            description = "Maximum number of experimental vectors to pair (half longest, half shortest)"
    )
    public Integer numberOfPeaksToIndex;

    @Parameter(
            names = "--vmNumberOfBestSolutions",
            description = "Number of ranked solutions to retain for each phase"
    )
    public Integer numberOfBestSolutions;

    /**
     * @throws IllegalArgumentException
     *   if any tolerance is missing or negative or if any count is less than one.
     */
    public void validateAndSetDefaults(final String context)
            throws IllegalArgumentException {

        setDefaults();

        validateTolerance(context, "magnitudeTolerance", magnitudeTolerance);
        validateTolerance(context, "angleTolerance", angleTolerance);
        validateTolerance(context, "indexErrorTolerance", indexErrorTolerance);

        if (numberOfPeaksToIndex < 1) {
            throw new IllegalArgumentException(context + " numberOfPeaksToIndex must be at least 1");
        }
        if (numberOfBestSolutions < 1) {
            throw new IllegalArgumentException(context + " numberOfBestSolutions must be at least 1");
        }
    }

    private static void validateTolerance(final String context,
                                          final String name,
                                          final Double value)
            throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException(context + " " + name + " must be defined");
        } else if (value < 0) {
            throw new IllegalArgumentException(context + " " + name + " must not be negative");
        }
    }

    private void setDefaults() {
        if (numberOfPeaksToIndex == null) {
            numberOfPeaksToIndex = 6;
        }
        if (numberOfBestSolutions == null) {
            numberOfBestSolutions = 3;
        }
    }

}
