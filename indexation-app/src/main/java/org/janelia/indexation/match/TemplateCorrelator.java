package org.janelia.indexation.match;

import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.janelia.indexation.IndexationException;
import org.janelia.indexation.library.TemplateLibrary;
import org.janelia.indexation.library.TemplateLibraryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates every simulated template of a {@link TemplateLibrary} with one experimental diffraction pattern.
 *
 * The correlation of template T with pattern P is the normalized dot product
 * <pre>
 *     sum_j P(x_j, y_j) T(x_j, y_j) / sqrt(sum_j T(x_j, y_j)^2)
 * </pre>
 * which is normalized by the template intensities only (not by the experimental intensities),
 * so scores are not bounded to [-1, 1].
 *
 * The best templates of each phase are collected with a bounded heap over the
 * (in-plane rotation x orientation) grid.  Template pixel coordinates must lie within the image.
 *
 * References: E. F. Rauch and L. Dupuy, "Rapid Diffraction Patterns identification through template matching",
 * Archives of Metallurgy and Materials, vol. 50, no. 1, pp. 87-99, 2005.
 */
public class TemplateCorrelator {

    private final int numberOfBestTemplates;

    /**
     * @param  numberOfBestTemplates  number of best correlated templates to retain for each phase.
     */
    public TemplateCorrelator(final int numberOfBestTemplates) {
        if (numberOfBestTemplates < 1) {
            throw new IllegalArgumentException("numberOfBestTemplates must be at least 1 but was " +
                                               numberOfBestTemplates);
        }
        this.numberOfBestTemplates = numberOfBestTemplates;
    }

    /**
     * @param  positionId   identifies the sample position in error messages (may be null).
     * @param  image        experimental diffraction pattern.
     * @param  library      simulated templates for each phase.
     * @param  shouldIndex  false for masked sample positions, which are skipped.
     *
     * @return (number of phases x number of best templates) matches in library phase order,
     *         descending correlation within each phase; or an empty list when the position is skipped.
     *
     * @throws IndexationException
     *   if the library is empty or invalid or if a phase has fewer templates than should be retained.
     */
    public List<TemplateMatch> correlate(final String positionId,
                                         final ImageProcessor image,
                                         final TemplateLibrary library,
                                         final boolean shouldIndex)
            throws IndexationException {

        if (! shouldIndex) {
            LOG.debug("correlate: skipping masked position {}", positionId);
            return Collections.emptyList();
        }

        if (library.getPhaseCount() == 0) {
            throw new IndexationException(positionId, null, "template library does not contain any phases");
        }

        final List<TemplateMatch> matches = new ArrayList<>(library.getPhaseCount() * numberOfBestTemplates);

        for (int phaseIndex = 0; phaseIndex < library.getPhaseCount(); phaseIndex++) {
            matches.addAll(correlatePhase(positionId, image, phaseIndex, library.getPhase(phaseIndex)));
        }

        LOG.debug("correlate: exit, returning {} matches for position {}", matches.size(), positionId);

        return matches;
    }

    private List<TemplateMatch> correlatePhase(final String positionId,
                                               final ImageProcessor image,
                                               final int phaseIndex,
                                               final TemplateLibraryEntry entry)
            throws IndexationException {

        try {
            entry.validate("template library phase " + entry.getPhaseName());
        } catch (final IllegalArgumentException e) {
            throw new IndexationException(positionId, phaseIndex, e.getMessage());
        }

        final int inPlaneRotationCount = entry.getInPlaneRotationCount();
        final int orientationCount = entry.getOrientationCount();

        if (entry.getTemplateCount() < numberOfBestTemplates) {
            throw new IndexationException(positionId, phaseIndex,
                                          "only " + entry.getTemplateCount() + " templates available but " +
                                          numberOfBestTemplates + " should be retained");
        }

        final PriorityQueue<GridCell> bestCells = new PriorityQueue<>(numberOfBestTemplates, WORST_FIRST);

        for (int r = 0; r < inPlaneRotationCount; r++) {
            for (int o = 0; o < orientationCount; o++) {
                final GridCell cell = new GridCell(r, o, r * orientationCount + o,
                                                   correlateTemplate(image, entry, r, o));
                if (bestCells.size() < numberOfBestTemplates) {
                    bestCells.add(cell);
                } else if (WORST_FIRST.compare(cell, bestCells.peek()) > 0) {
                    bestCells.poll();
                    bestCells.add(cell);
                }
            }
        }

        final List<GridCell> sortedCells = new ArrayList<>(bestCells);
        sortedCells.sort(WORST_FIRST.reversed());

        final double inPlaneRotationAngle = 360.0 / inPlaneRotationCount;
        final List<TemplateMatch> phaseMatches = new ArrayList<>(sortedCells.size());
        for (final GridCell cell : sortedCells) {
            final double[] orientation = entry.getOrientation(cell.orientationIndex);
            orientation[2] += cell.inPlaneIndex * inPlaneRotationAngle;
            phaseMatches.add(new TemplateMatch(phaseIndex, orientation, cell.correlation));
        }

        return phaseMatches;
    }

    /**
     * @return normalized dot product of the image intensities at the template's reflection pixels
     *         with the template intensities (zero for templates with zero norm).
     */
    static double correlateTemplate(final ImageProcessor image,
                                    final TemplateLibraryEntry entry,
                                    final int inPlaneIndex,
                                    final int orientationIndex) {

        final double norm = entry.getPatternNorm(inPlaneIndex, orientationIndex);
        if (norm == 0.0) {
            return 0.0;
        }

        return entry.weightedPixelSum(image, inPlaneIndex, orientationIndex) / norm;
    }

    private static class GridCell {

        private final int inPlaneIndex;
        private final int orientationIndex;
        private final int gridIndex;
        private final double correlation;

        GridCell(final int inPlaneIndex,
                 final int orientationIndex,
                 final int gridIndex,
                 final double correlation) {
            this.inPlaneIndex = inPlaneIndex;
            this.orientationIndex = orientationIndex;
            this.gridIndex = gridIndex;
            this.correlation = correlation;
        }
    }

    /** Lower correlation is worse; for equal correlations the later grid cell is worse. */
    private static final Comparator<GridCell> WORST_FIRST =
            Comparator.<GridCell>comparingDouble(cell -> cell.correlation)
                    .thenComparing(Comparator.<GridCell>comparingInt(cell -> cell.gridIndex).reversed());

    private static final Logger LOG = LoggerFactory.getLogger(TemplateCorrelator.class);
}
