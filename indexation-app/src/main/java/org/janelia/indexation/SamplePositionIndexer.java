package org.janelia.indexation;

import ij.process.ImageProcessor;

import java.util.List;

import org.janelia.indexation.library.TemplateLibrary;
import org.janelia.indexation.library.VectorLibrary;
import org.janelia.indexation.map.CrystalMapEntry;
import org.janelia.indexation.map.CrystalMapReducer;
import org.janelia.indexation.match.TemplateCorrelator;
import org.janelia.indexation.match.TemplateMatch;
import org.janelia.indexation.match.VectorMatch;
import org.janelia.indexation.match.VectorMatchResult;
import org.janelia.indexation.match.VectorPairMatcher;
import org.janelia.indexation.match.parameters.VectorMatchParameters;

/**
 * Entry points for indexing one sample position.
 *
 * Every call works only on its arguments and keeps no state, so an orchestrator may index
 * different sample positions concurrently without any coordination.
 * The position id is only used to give failures context and may be null.
 */
public class SamplePositionIndexer {

    private SamplePositionIndexer() {
    }

    /**
     * Correlates the image with every template in the library.
     *
     * @return numberOfBestTemplates matches per phase (library order, descending correlation within a phase),
     *         or an empty list if shouldIndex is false.
     */
    public static List<TemplateMatch> correlate(final String positionId,
                                                final ImageProcessor image,
                                                final TemplateLibrary library,
                                                final int numberOfBestTemplates,
                                                final boolean shouldIndex)
            throws IndexationException {
        final TemplateCorrelator correlator;
        try {
            correlator = new TemplateCorrelator(numberOfBestTemplates);
        } catch (final IllegalArgumentException e) {
            throw new IndexationException(positionId, null, e.getMessage());
        }
        return correlator.correlate(positionId, image, library, shouldIndex);
    }

    /**
     * Matches the experimental vectors against every phase's reference vector pairs.
     *
     * @param  magnitudeTolerance     max magnitude difference between experimental and reference vectors.
     * @param  angleTolerance         max pair angle difference in radians.
     * @param  indexErrorTolerance    max hkl deviation for a vector to count as indexed.
     * @param  numberOfPeaksToIndex   maximum number of experimental vectors to pair.
     * @param  numberOfBestSolutions  number of ranked solutions retained for each phase.
     */
    public static VectorMatchResult matchVectors(final String positionId,
                                                 final double[][] vectors,
                                                 final VectorLibrary library,
                                                 final double magnitudeTolerance,
                                                 final double angleTolerance,
                                                 final double indexErrorTolerance,
                                                 final int numberOfPeaksToIndex,
                                                 final int numberOfBestSolutions)
            throws IndexationException {
        final VectorMatchParameters parameters = new VectorMatchParameters(magnitudeTolerance,
                                                                           angleTolerance,
                                                                           indexErrorTolerance,
                                                                           numberOfPeaksToIndex,
                                                                           numberOfBestSolutions);
        final VectorPairMatcher matcher;
        try {
            matcher = new VectorPairMatcher(parameters);
        } catch (final IllegalArgumentException e) {
            throw new IndexationException(positionId, null, e.getMessage());
        }
        return matcher.match(positionId, vectors, library);
    }

    public static CrystalMapEntry reduceTemplateMatches(final String positionId,
                                                        final List<TemplateMatch> matches)
            throws IndexationException {
        return CrystalMapReducer.reduceTemplateMatches(positionId, matches);
    }

    public static CrystalMapEntry reduceVectorMatches(final String positionId,
                                                      final List<VectorMatch> matches)
            throws IndexationException {
        return CrystalMapReducer.reduceVectorMatches(positionId, matches);
    }

}
