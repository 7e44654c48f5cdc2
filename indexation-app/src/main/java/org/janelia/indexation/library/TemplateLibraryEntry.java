package org.janelia.indexation.library;

import ij.process.ImageProcessor;

import java.io.Serializable;

/**
 * Simulated diffraction templates for one crystal phase.
 *
 * Templates are arranged on an (in-plane rotation x orientation) grid.
 * For every grid cell the entry holds the image pixel location and the simulated intensity
 * of each reflection, plus the precomputed norm of the template intensities.
 */
public class TemplateLibraryEntry
        implements Serializable {

    private final String phaseName;

    /** [orientation][3] Bunge Euler angles in degrees */
    private final double[][] orientations;

    /** [inPlaneRotation][orientation][reflection][2] image pixel (x, y) */
    private final int[][][][] pixelCoordinates;

    /** [inPlaneRotation][orientation][reflection] */
    private final double[][][] intensities;

    /** [inPlaneRotation][orientation] */
    private final double[][] patternNorms;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TemplateLibraryEntry() {
        this(null, null, null, null, null);
    }

    public TemplateLibraryEntry(final String phaseName,
                                final double[][] orientations,
                                final int[][][][] pixelCoordinates,
                                final double[][][] intensities,
                                final double[][] patternNorms) {
        this.phaseName = phaseName;
        this.orientations = orientations;
        this.pixelCoordinates = pixelCoordinates;
        this.intensities = intensities;
        this.patternNorms = patternNorms;
    }

    /**
     * Builds an entry whose pattern norms are derived from the specified intensities.
     */
    public static TemplateLibraryEntry withDerivedNorms(final String phaseName,
                                                        final double[][] orientations,
                                                        final int[][][][] pixelCoordinates,
                                                        final double[][][] intensities) {
        final double[][] norms = new double[intensities.length][];
        for (int r = 0; r < intensities.length; r++) {
            norms[r] = new double[intensities[r].length];
            for (int o = 0; o < intensities[r].length; o++) {
                double sumOfSquares = 0.0;
                for (final double intensity : intensities[r][o]) {
                    sumOfSquares += intensity * intensity;
                }
                norms[r][o] = Math.sqrt(sumOfSquares);
            }
        }
        return new TemplateLibraryEntry(phaseName, orientations, pixelCoordinates, intensities, norms);
    }

    public String getPhaseName() {
        return phaseName;
    }

    public int getInPlaneRotationCount() {
        return pixelCoordinates.length;
    }

    public int getOrientationCount() {
        return orientations.length;
    }

    public int getTemplateCount() {
        return getInPlaneRotationCount() * getOrientationCount();
    }

    public double[] getOrientation(final int orientationIndex) {
        return orientations[orientationIndex].clone();
    }

    /**
     * @return copy of the (x, y) pixel location of each reflection in the specified template.
     */
    public int[][] getPixelCoordinates(final int inPlaneIndex,
                                       final int orientationIndex) {
        final int[][] coordinates = pixelCoordinates[inPlaneIndex][orientationIndex];
        final int[][] copy = new int[coordinates.length][];
        for (int j = 0; j < coordinates.length; j++) {
            copy[j] = coordinates[j].clone();
        }
        return copy;
    }

    /**
     * @return copy of the reflection intensities of the specified template.
     */
    public double[] getIntensities(final int inPlaneIndex,
                                   final int orientationIndex) {
        return intensities[inPlaneIndex][orientationIndex].clone();
    }

    /**
     * @return sum of image intensity times template intensity over the specified template's reflection pixels.
     *         All pixel coordinates must lie within the image.
     */
    public double weightedPixelSum(final ImageProcessor image,
                                   final int inPlaneIndex,
                                   final int orientationIndex) {
        final int[][] coordinates = pixelCoordinates[inPlaneIndex][orientationIndex];
        final double[] templateIntensities = intensities[inPlaneIndex][orientationIndex];
        double sum = 0.0;
        for (int j = 0; j < templateIntensities.length; j++) {
            sum += image.getf(coordinates[j][0], coordinates[j][1]) * templateIntensities[j];
        }
        return sum;
    }

    public double getPatternNorm(final int inPlaneIndex,
                                 final int orientationIndex) {
        return patternNorms[inPlaneIndex][orientationIndex];
    }

    /**
     * @throws IllegalArgumentException
     *   if any data is missing or the grid extents of the coordinate, intensity and norm data disagree.
     */
    public void validate(final String context)
            throws IllegalArgumentException {

        if ((orientations == null) || (pixelCoordinates == null) || (intensities == null) || (patternNorms == null)) {
            throw new IllegalArgumentException(context + " must define orientations, pixelCoordinates, " +
                                               "intensities, and patternNorms");
        }

        final int rotationCount = pixelCoordinates.length;
        final int orientationCount = orientations.length;

        if ((rotationCount == 0) || (orientationCount == 0)) {
            throw new IllegalArgumentException(context + " must contain at least one template");
        }

        if ((intensities.length != rotationCount) || (patternNorms.length != rotationCount)) {
            throw new IllegalArgumentException(
                    context + " has " + rotationCount + " in-plane rotations for pixelCoordinates but " +
                    intensities.length + " for intensities and " + patternNorms.length + " for patternNorms");
        }

        for (int r = 0; r < rotationCount; r++) {
            if ((pixelCoordinates[r].length != orientationCount) ||
                (intensities[r].length != orientationCount) ||
                (patternNorms[r].length != orientationCount)) {
                throw new IllegalArgumentException(
                        context + " in-plane rotation " + r + " does not have " + orientationCount + " orientations");
            }
            for (int o = 0; o < orientationCount; o++) {
                if (pixelCoordinates[r][o].length != intensities[r][o].length) {
                    throw new IllegalArgumentException(
                            context + " template (" + r + ", " + o + ") has " + pixelCoordinates[r][o].length +
                            " pixel coordinates but " + intensities[r][o].length + " intensities");
                }
            }
        }

        for (int o = 0; o < orientationCount; o++) {
            if (orientations[o].length != 3) {
                throw new IllegalArgumentException(context + " orientation " + o + " must have 3 Euler angles");
            }
        }
    }

}
