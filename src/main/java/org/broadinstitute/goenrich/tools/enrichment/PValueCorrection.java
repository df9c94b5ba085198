package org.broadinstitute.goenrich.tools.enrichment;

import org.broadinstitute.goenrich.exceptions.UserException;
import org.broadinstitute.goenrich.utils.MathUtils;
import org.broadinstitute.goenrich.utils.Utils;

import java.util.*;
import java.util.stream.IntStream;

/**
 * Multiple-testing corrections over all the p-values of one run, named after R's {@code p.adjust} methods.
 * <p>
 *     Adjusted values are computed on the p-values ranked in ascending order and written back to the position of
 *     each hypothesis. Equal p-values are ranked by their position in the input and each gets the value of its
 *     own rank. Every adjusted value is capped at 1.
 * </p>
 */
public enum PValueCorrection {

    /**
     * Benjamini-Hochberg false discovery rate: {@code min over k' >= k of p(k') * m / k'}.
     */
    BENJAMINI_HOCHBERG {
        @Override
        void adjustSorted(final double[] sorted, final double[] adjusted) {
            final int m = sorted.length;
            double runningMin = 1.0;
            for (int k = m; k >= 1; k--) {
                runningMin = Math.min(runningMin, Math.min(1.0, sorted[k - 1] * m / k));
                adjusted[k - 1] = runningMin;
            }
        }
    },

    /**
     * Bonferroni family-wise error rate: {@code p * m}.
     */
    BONFERRONI {
        @Override
        void adjustSorted(final double[] sorted, final double[] adjusted) {
            final int m = sorted.length;
            for (int k = 0; k < m; k++) {
                adjusted[k] = Math.min(1.0, sorted[k] * m);
            }
        }
    },

    /**
     * Holm step-down family-wise error rate: {@code max over k' <= k of p(k') * (m - k' + 1)}.
     */
    HOLM {
        @Override
        void adjustSorted(final double[] sorted, final double[] adjusted) {
            final int m = sorted.length;
            double runningMax = 0.0;
            for (int k = 1; k <= m; k++) {
                runningMax = Math.max(runningMax, Math.min(1.0, sorted[k - 1] * (m - k + 1)));
                adjusted[k - 1] = runningMax;
            }
        }
    },

    /**
     * No correction; adjusted values equal the raw ones.
     */
    NONE {
        @Override
        void adjustSorted(final double[] sorted, final double[] adjusted) {
            System.arraycopy(sorted, 0, adjusted, 0, sorted.length);
        }
    };

    /**
     * Fills {@code adjusted} with the adjusted values of {@code sorted}, rank by rank.
     */
    abstract void adjustSorted(final double[] sorted, final double[] adjusted);

    /**
     * Adjusts an array of p-values.
     *
     * @param pValues raw p-values, each in [0, 1].
     * @return a new array where element {@code i} is the adjusted value of {@code pValues[i]}.
     * @throws UserException.EmptyHypothesisSet if {@code pValues} is empty.
     * @throws IllegalArgumentException if a value is not a probability.
     */
    public double[] adjust(final double[] pValues) {
        Utils.nonNull(pValues, "the p-values cannot be null");
        if (pValues.length == 0) {
            throw new UserException.EmptyHypothesisSet();
        }
        for (int i = 0; i < pValues.length; i++) {
            final int index = i;
            Utils.validateArg(MathUtils.isValidProbability(pValues[i]), () -> "invalid p-value " + pValues[index] + " at position " + index);
        }

        // stable sort, so ties keep their input order
        final int[] order = IntStream.range(0, pValues.length).boxed()
                .sorted(Comparator.comparingDouble(i -> pValues[i]))
                .mapToInt(Integer::intValue).toArray();
        final double[] sorted = Arrays.stream(order).mapToDouble(i -> pValues[i]).toArray();
        final double[] adjustedSorted = new double[sorted.length];
        adjustSorted(sorted, adjustedSorted);

        final double[] result = new double[pValues.length];
        for (int rank = 0; rank < order.length; rank++) {
            result[order[rank]] = adjustedSorted[rank];
        }
        return result;
    }

    /**
     * Adjusts the p-values of a collection of hypotheses identified by key.
     *
     * @return key to adjusted value, in the iteration order of {@code pValues}.
     * @throws UserException.EmptyHypothesisSet if {@code pValues} is empty.
     */
    public <K> Map<K, Double> adjust(final Map<K, Double> pValues) {
        Utils.nonNull(pValues, "the p-values cannot be null");
        final List<K> keys = new ArrayList<>(pValues.keySet());
        final double[] raw = keys.stream().mapToDouble(k -> Utils.nonNull(pValues.get(k), () -> "missing p-value for " + k)).toArray();
        final double[] adjusted = adjust(raw);
        final Map<K, Double> result = new LinkedHashMap<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            result.put(keys.get(i), adjusted[i]);
        }
        return result;
    }
}
