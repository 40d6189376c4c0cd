package org.tessera.composite;

import com.typesafe.config.Config;

/**
 * Overlap thresholds that pick the colour-balance correction for a scene.
 *
 * @param minOverlap       overlap fraction at or below which no correction is attempted.
 * @param histogramOverlap overlap fraction above which histogram matching is used.
 */
public record BalanceSettings(double minOverlap, double histogramOverlap) {

    public static final BalanceSettings DEFAULTS = new BalanceSettings(0.02, 0.5);

    public BalanceSettings {
        if (minOverlap < 0 || histogramOverlap > 1 || minOverlap > histogramOverlap) {
            throw new IllegalArgumentException(String.format(
                "Invalid colour balance thresholds: min-overlap=%s, histogram-overlap=%s", minOverlap, histogramOverlap));
        }
    }

    public static BalanceSettings fromConfig(Config config) {
        return new BalanceSettings(config.getDouble("min-overlap"), config.getDouble("histogram-overlap"));
    }
}
