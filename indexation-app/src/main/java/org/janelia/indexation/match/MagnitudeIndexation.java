package org.janelia.indexation.match;

import java.io.Serializable;
import java.util.List;

/**
 * Candidate hkl assignments for one measured peak magnitude.
 */
public class MagnitudeIndexation
        implements Serializable {

    /** A profile reflection whose magnitude lies within tolerance of the measured magnitude. */
    public static class Candidate
            implements Serializable {

        private final int[] hkl;
        private final double percentDeviation;

        public Candidate(final int[] hkl,
                         final double percentDeviation) {
            this.hkl = hkl;
            this.percentDeviation = percentDeviation;
        }

        public int[] getHkl() {
            return hkl;
        }

        public double getPercentDeviation() {
            return percentDeviation;
        }
    }

    private final double magnitude;
    private final List<Candidate> candidates;

    public MagnitudeIndexation(final double magnitude,
                               final List<Candidate> candidates) {
        this.magnitude = magnitude;
        this.candidates = candidates;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }
}
