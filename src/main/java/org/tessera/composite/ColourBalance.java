package org.tessera.composite;

import java.util.Arrays;
import java.util.Locale;

/**
 * Radiometric adjustment applied between overlapping scenes while compositing a band.
 */
public enum ColourBalance {
    /** Write scene values unchanged. */
    NONE,
    /** Histogram-match scenes whose good pixels mostly overlap already composited data. */
    BASIC,
    /** As {@link #BASIC}, plus multiplicative gain compensation for scenes with a smaller overlap. */
    AGGRESSIVE;

    /**
     * Parses a mode name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static ColourBalance fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (ColourBalance mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown colour balance mode '" + name + "', expected one of "
            + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }
}
