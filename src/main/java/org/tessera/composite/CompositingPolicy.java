package org.tessera.composite;

import java.util.Arrays;
import java.util.Locale;

/**
 * Rule deciding which scene wins when several scenes offer a good pixel at the same location.
 */
public enum CompositingPolicy {
    /** Later scenes overwrite earlier ones wherever they are good. */
    MOST_RECENT,
    /** The first scene to fill a pixel keeps it. */
    MOST_DISTANT,
    /**
     * The first scene to fill a pixel keeps it, unless a later scene has more good pixels than any scene already
     * represented in its footprint, in which case that scene takes over everywhere it is good.
     */
    TEMP_HOMOGENEITY;

    /**
     * Parses a policy name, ignoring case and accepting {@code -} for {@code _}.
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static CompositingPolicy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (CompositingPolicy policy : values()) {
                if (policy.name().equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown compositing algorithm '" + name + "', expected one of "
            + Arrays.toString(values()));
    }
}
