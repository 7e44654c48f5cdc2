package org.janelia.indexation.match;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns candidate hkls to measured peak magnitudes by comparing them with a simulated diffraction profile.
 */
public class MagnitudeIndexer {

    private MagnitudeIndexer() {
    }

    /**
     * @param  magnitudes        measured peak magnitudes.
     * @param  profile           simulated profile.
     * @param  tolerancePercent  maximum deviation |simulated - measured| / measured in percent.
     *
     * @return one indexation per measured magnitude (in input order), each listing the profile
     *         reflections (in profile order) within tolerance.  Zero magnitudes get no candidates.
     */
    public static List<MagnitudeIndexation> indexMagnitudes(final double[] magnitudes,
                                                            final DiffractionProfile profile,
                                                            final double tolerancePercent) {

        final List<MagnitudeIndexation> indexations = new ArrayList<>(magnitudes.length);

        for (final double magnitude : magnitudes) {
            final List<MagnitudeIndexation.Candidate> candidates = new ArrayList<>();
            if (magnitude != 0.0) {
                for (int i = 0; i < profile.size(); i++) {
                    final double percentDeviation =
                            Math.abs((profile.getMagnitude(i) - magnitude) / magnitude * 100.0);
                    if (percentDeviation < tolerancePercent) {
                        candidates.add(new MagnitudeIndexation.Candidate(profile.getHkl(i), percentDeviation));
                    }
                }
            }
            indexations.add(new MagnitudeIndexation(magnitude, candidates));
        }

        return indexations;
    }

}
