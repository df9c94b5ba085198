package org.broadinstitute.goenrich.utils;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {

    public static final double LOG10_E = Math.log10(Math.E);

    /**
     * Private constructor.  No instantiating this class!
     */
    private MathUtils() { }

    /**
     * Converts a natural log value into log10 space.
     *
     * @param ln log(x)
     * @return log10(x)
     */
    public static double logToLog10(final double ln) {
        return ln * LOG10_E;
    }

    /**
     * Sums the real-space values of an array given in log10 space and returns the result in real space.
     */
    public static double sumLog10(final double[] log10values) {
        return Math.pow(10.0, log10SumLog10(Utils.nonNull(log10values)));
    }

    public static double log10SumLog10(final double[] log10Values) {
        return log10SumLog10(Utils.nonNull(log10Values), 0, log10Values.length);
    }

    /**
     * Computes log10(sum_i 10^x_i) for the elements between {@code start} (inclusive) and {@code finish} (exclusive)
     * scaling by the largest element so that small terms do not vanish.
     *
     * @return {@link Double#NEGATIVE_INFINITY} for an empty range.
     */
    public static double log10SumLog10(final double[] log10Values, final int start, final int finish) {
        Utils.nonNull(log10Values);
        if (start >= finish) {
            return Double.NEGATIVE_INFINITY;
        }
        final int maxElementIndex = maxElementIndex(log10Values, start, finish);
        final double maxValue = log10Values[maxElementIndex];
        if(maxValue == Double.NEGATIVE_INFINITY) {
            return maxValue;
        }
        double sum = 1.0;
        for (int i = start; i < finish; i++) {
            final double curVal = log10Values[i];
            if (i == maxElementIndex || curVal == Double.NEGATIVE_INFINITY) {
                continue;
            } else {
                final double scaled_val = curVal - maxValue;
                sum += Math.pow(10.0, scaled_val);
            }
        }
        if ( Double.isNaN(sum) || sum == Double.POSITIVE_INFINITY ) {
            throw new IllegalArgumentException("log10 p: Values must be non-infinite and non-NAN");
        }
        return maxValue + (sum != 1.0 ? Math.log10(sum) : 0.0);
    }

    public static int maxElementIndex(final double[] array, final int start, final int endIndex) {
        Utils.nonNull(array);
        Utils.validateArg(array.length > 0, "array may not be empty");
        Utils.validateArg(start <= endIndex, "Start cannot be after end.");

        int maxI = start;
        for (int i = (start+1); i < endIndex; i++) {
            if (array[i] > array[maxI])
                maxI = i;
        }
        return maxI;
    }

    public static boolean isValidProbability(final double result) {
        return result >= 0.0 && result <= 1.0;
    }
}
