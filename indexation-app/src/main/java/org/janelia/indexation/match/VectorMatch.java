package org.janelia.indexation.match;

import java.io.Serializable;

import org.janelia.indexation.geometry.RotationUtil;

/**
 * Ranked vector matching result slot for one phase.
 *
 * A slot either holds a real {@link VectorSolution} or is a "no solution" placeholder.
 * Placeholders keep the result shape fixed and report identity rotation, zero match rate,
 * no index errors and a total error of {@link #NO_SOLUTION_TOTAL_ERROR}.
 */
public class VectorMatch
        implements Serializable {

    public static final double NO_SOLUTION_TOTAL_ERROR = 1.0;

    private final int phaseIndex;
    private final VectorSolution solution;

    public VectorMatch(final int phaseIndex,
                       final VectorSolution solution) {
        this.phaseIndex = phaseIndex;
        this.solution = solution;
    }

    public static VectorMatch noSolution(final int phaseIndex) {
        return new VectorMatch(phaseIndex, null);
    }

    public int getPhaseIndex() {
        return phaseIndex;
    }

    public boolean hasSolution() {
        return solution != null;
    }

    /**
     * @return the solution for this slot or null if this is a placeholder.
     */
    public VectorSolution getSolution() {
        return solution;
    }

    public double[][] getRotation() {
        return hasSolution() ? solution.getRotation() : RotationUtil.identity();
    }

    public double getMatchRate() {
        return hasSolution() ? solution.getMatchRate() : 0.0;
    }

    public double[][] getIndexErrors() {
        return hasSolution() ? solution.getIndexErrors() : new double[0][];
    }

    public double getTotalError() {
        return hasSolution() ? solution.getMeanError() : NO_SOLUTION_TOTAL_ERROR;
    }

    @Override
    public String toString() {
        return "{ \"phaseIndex\": " + phaseIndex + ", \"solution\": " + solution + " }";
    }
}
