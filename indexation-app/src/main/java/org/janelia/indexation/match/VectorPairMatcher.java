package org.janelia.indexation.match;

import java.util.ArrayList;
import java.util.List;

import org.janelia.indexation.IndexationException;
import org.janelia.indexation.geometry.RotationUtil;
import org.janelia.indexation.lattice.ReciprocalLattice;
import org.janelia.indexation.library.VectorLibrary;
import org.janelia.indexation.library.VectorLibraryEntry;
import org.janelia.indexation.match.parameters.VectorMatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns hkl indices to experimental diffraction vectors by matching pairs of vectors
 * against each phase's catalog of reference vector pairs.
 *
 * For every pair of selected experimental vectors and every catalog row within tolerance,
 * a rotation aligning the reference pair with the experimental pair is derived and applied to
 * all experimental vectors.  Rotations that index more than the pair itself are kept as solutions
 * and ranked by the fraction of vectors they index.
 */
public class VectorPairMatcher {

    /** A rotation must index more than this many vectors (i.e. more than its own pair) to be a solution. */
    public static final int MIN_INDEXED_VECTORS_EXCLUSIVE = 2;

    private final double magnitudeTolerance;
    private final double angleTolerance;
    private final double indexErrorTolerance;
    private final int numberOfPeaksToIndex;
    private final int numberOfBestSolutions;

    /**
     * @throws IllegalArgumentException
     *   if the parameters are invalid.
     */
    public VectorPairMatcher(final VectorMatchParameters parameters)
            throws IllegalArgumentException {
        parameters.validateAndSetDefaults("vector match parameters");
        this.magnitudeTolerance = parameters.magnitudeTolerance;
        this.angleTolerance = parameters.angleTolerance;
        this.indexErrorTolerance = parameters.indexErrorTolerance;
        this.numberOfPeaksToIndex = parameters.numberOfPeaksToIndex;
        this.numberOfBestSolutions = parameters.numberOfBestSolutions;
    }

    /**
     * @param  positionId  identifies the sample position in error messages (may be null).
     * @param  vectors     experimental cartesian scattering vectors for the position.
     * @param  library     reference pair catalogs for each phase.
     *
     * @return exactly (number of phases x number of best solutions) ranked slots
     *         (phases without enough solutions are padded with "no solution" slots)
     *         plus rounded hkls of every retained candidate.
     *
     * @throws IndexationException
     *   if the library is empty or a phase entry is invalid.
     */
    public VectorMatchResult match(final String positionId,
                                   final double[][] vectors,
                                   final VectorLibrary library)
            throws IndexationException {

        if (library.getPhaseCount() == 0) {
            throw new IndexationException(positionId, null, "vector library does not contain any phases");
        }

        final List<VectorMatch> matches = new ArrayList<>(library.getPhaseCount() * numberOfBestSolutions);
        final List<int[][]> roundedIndexes = new ArrayList<>();

        for (int phaseIndex = 0; phaseIndex < library.getPhaseCount(); phaseIndex++) {

            final VectorLibraryEntry entry = library.getPhase(phaseIndex);
            try {
                entry.validate("vector library phase " + entry.getPhaseName());
            } catch (final IllegalArgumentException e) {
                throw new IndexationException(positionId, phaseIndex, e.getMessage());
            }

            final List<VectorSolution> solutions = findSolutions(vectors, entry, roundedIndexes);
            final List<VectorSolution> bestSolutions = SolutionRanker.rank(solutions, numberOfBestSolutions);

            LOG.debug("match: position {}, phase {} has {} candidate solutions, best is {}",
                      positionId, phaseIndex, solutions.size(), bestSolutions.isEmpty() ? null : bestSolutions.get(0));

            for (final VectorSolution solution : bestSolutions) {
                matches.add(new VectorMatch(phaseIndex, solution));
            }
            for (int i = bestSolutions.size(); i < numberOfBestSolutions; i++) {
                matches.add(VectorMatch.noSolution(phaseIndex));
            }
        }

        return new VectorMatchResult(matches, roundedIndexes);
    }

    /**
     * @return all candidate solutions for one phase (unranked, in discovery order).
     *         The rounded hkls of each candidate are appended to the specified list.
     */
    List<VectorSolution> findSolutions(final double[][] vectors,
                                       final VectorLibraryEntry entry,
                                       final List<int[][]> roundedIndexes) {

        final List<VectorSolution> solutions = new ArrayList<>();

        if (vectors.length < 2) {
            return solutions;
        }

        final ReciprocalLattice lattice = entry.getReciprocalLattice();
        final int[] selectedIndexes = PeakSelector.selectPeakIndexes(vectors, numberOfPeaksToIndex);

        int vectorPairIndex = -1;
        for (int a = 0; a < selectedIndexes.length; a++) {
            for (int b = a + 1; b < selectedIndexes.length; b++) {

                vectorPairIndex++;

                double[] q1 = vectors[selectedIndexes[a]];
                double[] q2 = vectors[selectedIndexes[b]];

                if (! RotationUtil.definesPlane(q1, q2)) {
                    continue; // zero length or collinear vectors do not define a rotation
                }

                double q1Length = PeakSelector.length(q1);
                double q2Length = PeakSelector.length(q2);

                // catalog pairs are stored longest first
                if (q1Length < q2Length) {
                    final double[] swap = q1;
                    q1 = q2;
                    q2 = swap;
                    final double swapLength = q1Length;
                    q1Length = q2Length;
                    q2Length = swapLength;
                }

                final double angle = RotationUtil.angleBetween(q1, q2);

                for (int row = 0; row < entry.getCatalogSize(); row++) {

                    if (! entry.isWithinTolerance(row, q1Length, q2Length, angle, magnitudeTolerance, angleTolerance)) {
                        continue;
                    }

                    final int[][] indexPair = entry.getIndexPair(row);
                    final double[] reference1 = lattice.toCartesian(indexPair[0]);
                    final double[] reference2 = lattice.toCartesian(indexPair[1]);

                    if (! RotationUtil.definesPlane(reference1, reference2)) {
                        continue;
                    }

                    final double[][] rotation = RotationUtil.alignPairs(q1, q2, reference1, reference2);

                    final VectorSolution solution = evaluateRotation(vectors, lattice, rotation,
                                                                     vectorPairIndex, roundedIndexes);
                    if (solution != null) {
                        solutions.add(solution);
                    }
                }
            }
        }

        return solutions;
    }

    /**
     * Indexes all experimental vectors with the specified rotation.
     *
     * @return a solution if more than {@link #MIN_INDEXED_VECTORS_EXCLUSIVE} vectors are indexed
     *         within tolerance, otherwise null.
     */
    private VectorSolution evaluateRotation(final double[][] vectors,
                                            final ReciprocalLattice lattice,
                                            final double[][] rotation,
                                            final int vectorPairIndex,
                                            final List<int[][]> roundedIndexes) {

        final int[][] rounded = new int[vectors.length][3];
        final double[][] indexErrors = new double[vectors.length][3];

        int indexedCount = 0;
        double indexedErrorSum = 0.0;

        for (int i = 0; i < vectors.length; i++) {

            final double[] hkl = lattice.toFractional(RotationUtil.applyInverse(rotation, vectors[i]));

            double maxError = 0.0;
            double errorSum = 0.0;
            for (int d = 0; d < 3; d++) {
                final double nearest = Math.rint(hkl[d]);
                rounded[i][d] = (int) nearest;
                indexErrors[i][d] = Math.abs(hkl[d] - nearest);
                maxError = Math.max(maxError, indexErrors[i][d]);
                errorSum += indexErrors[i][d];
            }

            if (maxError < indexErrorTolerance) {
                indexedCount++;
                indexedErrorSum += errorSum;
            }
        }

        final VectorSolution solution;
        if (indexedCount > MIN_INDEXED_VECTORS_EXCLUSIVE) {
            final double matchRate = vectors.length == 0 ? 0.0 : (double) indexedCount / vectors.length;
            final double meanError = indexedErrorSum / (indexedCount * 3);
            solution = new VectorSolution(rotation, matchRate, indexErrors, meanError, vectorPairIndex);
            roundedIndexes.add(rounded);
        } else {
            solution = null;
        }

        return solution;
    }

    private static final Logger LOG = LoggerFactory.getLogger(VectorPairMatcher.class);
}
