package org.janelia.indexation.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Chooses a bounded, geometrically diverse subset of experimental vectors for pairing.
 *
 * The selection takes ceil(count / 2) of the longest vectors and fills the rest with the shortest ones.
 * Vectors with equal length are ordered by index.
 */
public class PeakSelector {

    private PeakSelector() {
    }

    /**
     * @param  vectors  experimental vectors.
     * @param  count    number of vectors to select (clamped to the number of vectors).
     *
     * @return distinct indexes of the selected vectors, longest first (descending length)
     *         followed by the shortest (ascending length).
     *
     * @throws IllegalArgumentException
     *   if count is less than one.
     */
    public static int[] selectPeakIndexes(final double[][] vectors,
                                          final int count)
            throws IllegalArgumentException {

        if (count < 1) {
            throw new IllegalArgumentException("number of peaks to select must be at least 1 but was " + count);
        }

        final int selectedCount = Math.min(vectors.length, count);
        final int longCount = (selectedCount + 1) / 2;
        final int shortCount = selectedCount - longCount;

        final double[] lengths = new double[vectors.length];
        final List<Integer> ascendingOrder = new ArrayList<>(vectors.length);
        for (int i = 0; i < vectors.length; i++) {
            lengths[i] = length(vectors[i]);
            ascendingOrder.add(i);
        }
        ascendingOrder.sort(Comparator.<Integer>comparingDouble(i -> lengths[i]).thenComparingInt(i -> i));

        final int[] selected = new int[selectedCount];
        for (int i = 0; i < longCount; i++) {
            selected[i] = ascendingOrder.get(vectors.length - 1 - i);
        }
        for (int i = 0; i < shortCount; i++) {
            selected[longCount + i] = ascendingOrder.get(i);
        }

        return selected;
    }

    static double length(final double[] v) {
        double sumOfSquares = 0.0;
        for (final double value : v) {
            sumOfSquares += value * value;
        }
        return Math.sqrt(sumOfSquares);
    }

}
