package org.tessera.mask;

import com.typesafe.config.Config;

/**
 * Buffer distances for {@link MaskImprovementFilter}, all in metres.
 *
 * @param dilationMeters        outward buffer around cloud and shadow classes.
 * @param erosionMeters         inward buffer trimmed from the edge of the data region.
 * @param removeDistantShadow   whether shadows far from any cloud are relabelled as water.
 * @param distantShadowMeters   distance from cloud beyond which a shadow is considered spurious.
 */
public record MaskFilterSettings(
    double dilationMeters,
    double erosionMeters,
    boolean removeDistantShadow,
    double distantShadowMeters) {

    public static final MaskFilterSettings DEFAULTS = new MaskFilterSettings(120, 3000, true, 1800);

    public MaskFilterSettings {
        if (dilationMeters < 0 || erosionMeters < 0 || distantShadowMeters < 0) {
            throw new IllegalArgumentException("Mask buffer distances must not be negative");
        }
    }

    /**
     * Reads settings from the {@code mask} block of the application configuration.
     */
    public static MaskFilterSettings fromConfig(Config config) {
        return new MaskFilterSettings(
            config.getDouble("dilation-meters"),
            config.getDouble("erosion-meters"),
            config.getBoolean("remove-distant-shadow"),
            config.getDouble("distant-shadow-meters"));
    }

    /** Converts a metric buffer into a whole number of pixel iterations (integer division). */
    static int iterations(double meters, double pixelSize) {
        return (int) Math.floor(meters / pixelSize);
    }
}
