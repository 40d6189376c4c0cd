package org.tessera.composite;

import java.util.Arrays;
import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Histogram matching between two sample sets.
 * <p>
 * Each distinct source value is mapped to the reference value at the same empirical cumulative quantile,
 * interpolating linearly along the reference's value-versus-quantile curve and clamping outside it.
 * Masked-out positions take no part in either distribution and pass through unchanged.
 */
public final class HistogramMatcher {

    private HistogramMatcher() {
    }

    /**
     * Matches {@code source} to {@code reference}.
     *
     * @param source          the samples to adjust.
     * @param sourceMask      positions of {@code source} to match; all others are copied unchanged.
     * @param reference       the samples whose distribution is the target.
     * @param referenceMask   positions of {@code reference} forming the target distribution.
     * @return a new array; equal to a copy of {@code source} when either mask selects nothing.
     */
    public static int[] match(int[] source, BitSet sourceMask, int[] reference, BitSet referenceMask) {
        int[] out = source.clone();
        Distribution src = Distribution.of(source, sourceMask);
        Distribution ref = Distribution.of(reference, referenceMask);
        if (src == null || ref == null) {
            return out;
        }

        double[] mapped = new double[src.values.length];
        for (int k = 0; k < mapped.length; k++) {
            mapped[k] = interpolate(src.quantiles[k], ref.quantiles, ref.values);
        }
        for (int i = sourceMask.nextSetBit(0); i >= 0 && i < source.length; i = sourceMask.nextSetBit(i + 1)) {
            int k = Arrays.binarySearch(src.values, source[i]);
            out[i] = (int) Math.round(mapped[k]);
        }
        return out;
    }

    /**
     * Piecewise-linear interpolation of {@code fp} over increasing {@code xp}, clamped to the end values.
     */
    static double interpolate(double x, double[] xp, int[] fp) {
        if (x <= xp[0]) {
            return fp[0];
        }
        int last = xp.length - 1;
        if (x >= xp[last]) {
            return fp[last];
        }
        int hi = Arrays.binarySearch(xp, x);
        if (hi >= 0) {
            return fp[hi];
        }
        hi = -hi - 1;
        int lo = hi - 1;
        double t = (x - xp[lo]) / (xp[hi] - xp[lo]);
        return fp[lo] + t * (fp[hi] - fp[lo]);
    }

    /** Distinct values in ascending order with their cumulative quantiles. */
    private static final class Distribution {
        final int[] values;
        final double[] quantiles;

        private Distribution(int[] values, double[] quantiles) {
            this.values = values;
            this.quantiles = quantiles;
        }

        static Distribution of(int[] samples, BitSet mask) {
            int n = 0;
            int[] selected = new int[Math.min(mask.cardinality(), samples.length)];
            for (int i = mask.nextSetBit(0); i >= 0 && i < samples.length; i = mask.nextSetBit(i + 1)) {
                selected[n++] = samples[i];
            }
            if (n == 0) {
                return null;
            }
            IntArrays.radixSort(selected, 0, n);

            int distinct = 1;
            for (int i = 1; i < n; i++) {
                if (selected[i] != selected[i - 1]) distinct++;
            }
            int[] values = new int[distinct];
            double[] quantiles = new double[distinct];
            int k = 0;
            for (int i = 0; i < n; i++) {
                if (i == n - 1 || selected[i] != selected[i + 1]) {
                    values[k] = selected[i];
                    quantiles[k] = (double) (i + 1) / n;
                    k++;
                }
            }
            return new Distribution(values, quantiles);
        }
    }
}
