package org.janelia.indexation.match;

import java.io.Serializable;
import java.util.List;

/**
 * Vector matching output for one sample position:
 * exactly (number of phases x number of best solutions) ranked slots in phase order,
 * plus the rounded hkls of every retained candidate (all phases, discovery order) for diagnostics.
 */
public class VectorMatchResult
        implements Serializable {

    private final List<VectorMatch> matches;
    private final List<int[][]> roundedIndexes;

    public VectorMatchResult(final List<VectorMatch> matches,
                             final List<int[][]> roundedIndexes) {
        this.matches = matches;
        this.roundedIndexes = roundedIndexes;
    }

    public List<VectorMatch> getMatches() {
        return matches;
    }

    public List<int[][]> getRoundedIndexes() {
        return roundedIndexes;
    }
}
