package org.janelia.indexation.map;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

import org.janelia.indexation.IndexationException;
import org.janelia.indexation.geometry.RotationUtil;
import org.janelia.indexation.match.TemplateMatch;
import org.janelia.indexation.match.VectorMatch;

/**
 * Collapses one sample position's ranked candidates (all phases) into a single {@link CrystalMapEntry}.
 *
 * <p>
 * Reliabilities are percentages: 100 * (1 - ratio).
 * For template matching (higher correlation is better) the ratio is runner-up / best.
 * For vector matching (lower total error is better) the ratio is best / runner-up.
 * When the ratio's denominator is zero the reliability is reported as 0.
 * </p>
 *
 * <p>
 * Reliability metrics need a runner-up orientation in the winning phase,
 * so callers must retain at least two candidates per phase.
 * </p>
 */
public class CrystalMapReducer {

    private CrystalMapReducer() {
    }

    /**
     * @param  positionId  identifies the sample position in error messages (may be null).
     * @param  matches     template matches, sorted by descending correlation within each phase.
     *
     * @throws IndexationException
     *   if there are no matches or the winning phase has no runner-up.
     */
    public static CrystalMapEntry reduceTemplateMatches(final String positionId,
                                                        final List<TemplateMatch> matches)
            throws IndexationException {

        validateNotEmpty(positionId, matches);

        final Map<String, Object> metrics = new LinkedHashMap<>();
        final TemplateMatch best;

        if (countPhases(matches, TemplateMatch::getPhaseIndex) == 1) {

            best = matches.get(0);
            validateRunnerUp(positionId, best.getPhaseIndex(), matches.size());
            final double runnerUp = matches.get(1).getCorrelation();

            metrics.put(CrystalMapEntry.CORRELATION, best.getCorrelation());
            metrics.put(CrystalMapEntry.ORIENTATION_RELIABILITY, reliability(runnerUp, best.getCorrelation()));

        } else {

            TemplateMatch globalBest = matches.get(0);
            for (final TemplateMatch match : matches) {
                if (match.getCorrelation() > globalBest.getCorrelation()) {
                    globalBest = match;
                }
            }
            best = globalBest;
            final int bestPhase = best.getPhaseIndex();

            final List<Double> winningPhaseScores = new ArrayList<>();
            Double bestCompetingScore = null;
            for (final TemplateMatch match : matches) {
                if (match.getPhaseIndex() == bestPhase) {
                    winningPhaseScores.add(match.getCorrelation());
                } else if ((bestCompetingScore == null) || (match.getCorrelation() > bestCompetingScore)) {
                    bestCompetingScore = match.getCorrelation();
                }
            }

            validateRunnerUp(positionId, bestPhase, winningPhaseScores.size());
            winningPhaseScores.sort((a, b) -> Double.compare(b, a));
            final double runnerUpOrientation = winningPhaseScores.get(1);

            metrics.put(CrystalMapEntry.CORRELATION, best.getCorrelation());
            metrics.put(CrystalMapEntry.ORIENTATION_RELIABILITY,
                        reliability(runnerUpOrientation, best.getCorrelation()));
            metrics.put(CrystalMapEntry.PHASE_RELIABILITY,
                        reliability(validateCompeting(positionId, bestPhase, bestCompetingScore),
                                    best.getCorrelation()));
        }

        return new CrystalMapEntry(best.getPhaseIndex(), best.getOrientation(), metrics);
    }

    /**
     * @param  positionId  identifies the sample position in error messages (may be null).
     * @param  matches     vector matches, ranked best first within each phase.
     *
     * @throws IndexationException
     *   if there are no matches or the winning phase has no runner-up.
     */
    public static CrystalMapEntry reduceVectorMatches(final String positionId,
                                                      final List<VectorMatch> matches)
            throws IndexationException {

        validateNotEmpty(positionId, matches);

        final Map<String, Object> metrics = new LinkedHashMap<>();
        final VectorMatch best;

        if (countPhases(matches, VectorMatch::getPhaseIndex) == 1) {

            best = matches.get(0);
            validateRunnerUp(positionId, best.getPhaseIndex(), matches.size());
            final double runnerUp = matches.get(1).getTotalError();

            putVectorMetrics(best, metrics);
            metrics.put(CrystalMapEntry.ORIENTATION_RELIABILITY, reliability(best.getTotalError(), runnerUp));

        } else {

            VectorMatch globalBest = matches.get(0);
            for (final VectorMatch match : matches) {
                if (match.getTotalError() < globalBest.getTotalError()) {
                    globalBest = match;
                }
            }
            best = globalBest;
            final int bestPhase = best.getPhaseIndex();

            final List<Double> winningPhaseErrors = new ArrayList<>();
            Double bestCompetingError = null;
            for (final VectorMatch match : matches) {
                if (match.getPhaseIndex() == bestPhase) {
                    winningPhaseErrors.add(match.getTotalError());
                } else if ((bestCompetingError == null) || (match.getTotalError() < bestCompetingError)) {
                    bestCompetingError = match.getTotalError();
                }
            }

            validateRunnerUp(positionId, bestPhase, winningPhaseErrors.size());
            winningPhaseErrors.sort(Double::compare);
            final double runnerUpOrientation = winningPhaseErrors.get(1);

            putVectorMetrics(best, metrics);
            metrics.put(CrystalMapEntry.ORIENTATION_RELIABILITY,
                        reliability(best.getTotalError(), runnerUpOrientation));
            metrics.put(CrystalMapEntry.PHASE_RELIABILITY,
                        reliability(best.getTotalError(),
                                    validateCompeting(positionId, bestPhase, bestCompetingError)));
        }

        return new CrystalMapEntry(best.getPhaseIndex(),
                                   RotationUtil.toBungeEulerAngles(best.getRotation()),
                                   metrics);
    }

    /**
     * @return 100 * (1 - numerator / denominator), or 0 if the denominator is 0.
     */
    static double reliability(final double numerator,
                              final double denominator) {
        return denominator == 0.0 ? 0.0 : 100.0 * (1.0 - numerator / denominator);
    }

    private static void putVectorMetrics(final VectorMatch best,
                                         final Map<String, Object> metrics) {
        metrics.put(CrystalMapEntry.MATCH_RATE, best.getMatchRate());
        // getIndexErrors returns a copy, so the entry never shares the match's array
        metrics.put(CrystalMapEntry.EHKLS, best.getIndexErrors());
        metrics.put(CrystalMapEntry.TOTAL_ERROR, best.getTotalError());
    }

    private static <T> int countPhases(final List<T> matches,
                                       final ToIntFunction<T> phaseIndexFunction) {
        return (int) matches.stream().mapToInt(phaseIndexFunction).distinct().count();
    }

    private static void validateNotEmpty(final String positionId,
                                         final List<?> matches)
            throws IndexationException {
        if ((matches == null) || matches.isEmpty()) {
            throw new IndexationException(positionId, null, "no matches to reduce");
        }
    }

    private static void validateRunnerUp(final String positionId,
                                         final int phaseIndex,
                                         final int candidateCount)
            throws IndexationException {
        if (candidateCount < 2) {
            throw new IndexationException(positionId, phaseIndex,
                                          "reliability metrics require at least 2 candidates for the winning phase " +
                                          "but only " + candidateCount + " exist");
        }
    }

    private static double validateCompeting(final String positionId,
                                            final int phaseIndex,
                                            final Double bestCompetingScore)
            throws IndexationException {
        if (bestCompetingScore == null) {
            throw new IndexationException(positionId, phaseIndex, "no competing phase candidates exist");
        }
        return bestCompetingScore;
    }

}
