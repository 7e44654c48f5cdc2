package org.janelia.indexation;

/**
 * Signals a violated precondition while indexing one sample position
 * (e.g. an empty library or a reduction that needs a runner-up candidate that does not exist).
 *
 * The optional sample position id and phase index are carried so that an orchestrator
 * can report per-position failures without aborting a whole batch.
 */
public class IndexationException
        extends IllegalArgumentException {

    private final String positionId;
    private final Integer phaseIndex;

    public IndexationException(final String positionId,
                               final Integer phaseIndex,
                               final String message) {
        super(buildMessage(positionId, phaseIndex, message));
        this.positionId = positionId;
        this.phaseIndex = phaseIndex;
    }

    /**
     * @return id of the sample position being indexed (or null if the caller did not provide one).
     */
    public String getPositionId() {
        return positionId;
    }

    /**
     * @return index of the phase that caused the failure (or null if the failure is not phase specific).
     */
    public Integer getPhaseIndex() {
        return phaseIndex;
    }

    private static String buildMessage(final String positionId,
                                       final Integer phaseIndex,
                                       final String message) {
        final StringBuilder sb = new StringBuilder();
        if (positionId != null) {
            sb.append("position ").append(positionId).append(": ");
        }
        if (phaseIndex != null) {
            sb.append("phase ").append(phaseIndex).append(": ");
        }
        return sb.append(message).toString();
    }

}
