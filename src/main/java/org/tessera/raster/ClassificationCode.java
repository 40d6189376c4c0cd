package org.tessera.raster;

/**
 * Scene classification labels attached to every pixel of a level-2A scene.
 */
public enum ClassificationCode {
    NO_DATA(0),
    SATURATED_OR_DEFECTIVE(1),
    DARK_FEATURES(2),
    CLOUD_SHADOWS(3),
    VEGETATION(4),
    NOT_VEGETATED(5),
    WATER(6),
    UNCLASSIFIED(7),
    CLOUD_MEDIUM_PROBABILITY(8),
    CLOUD_HIGH_PROBABILITY(9),
    THIN_CIRRUS(10),
    SNOW(11);

    private static final ClassificationCode[] BY_CODE = values();

    private final int code;

    ClassificationCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Whether a raw code marks a usable land-cover pixel (vegetation, not-vegetated or water).
     *
     * @param code a raw classification value.
     * @return {@code true} for 4, 5 and 6.
     */
    public static boolean isGood(int code) {
        return code >= VEGETATION.code && code <= WATER.code;
    }

    public static ClassificationCode fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown classification code: " + code);
        }
        return BY_CODE[code];
    }
}
