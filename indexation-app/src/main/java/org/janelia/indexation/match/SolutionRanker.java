package org.janelia.indexation.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders a phase's candidate solutions by descending match rate and keeps the best ones.
 *
 * Match rate is the only ranking key.  Equal match rates keep their input order.
 */
public class SolutionRanker {

    private SolutionRanker() {
    }

    /**
     * @return the min(numberOfBest, solutions.size()) best solutions, best first.
     */
    public static List<VectorSolution> rank(final List<VectorSolution> solutions,
                                            final int numberOfBest) {
        final List<VectorSolution> sorted = new ArrayList<>(solutions);
        // List.sort is stable
        sorted.sort(Comparator.comparingDouble(VectorSolution::getMatchRate).reversed());
        return new ArrayList<>(sorted.subList(0, Math.min(numberOfBest, sorted.size())));
    }

}
