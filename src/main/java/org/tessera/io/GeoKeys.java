package org.tessera.io;

/**
 * GeoTIFF key identifiers and values used when reading and writing georeferencing.
 */
final class GeoKeys {

    static final int GT_MODEL_TYPE = 1024;
    static final int GT_RASTER_TYPE = 1025;
    static final int GEOGRAPHIC_TYPE = 2048;
    static final int PROJECTED_CS_TYPE = 3072;

    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA = 1;

    private GeoKeys() {
    }

    /** Geographic EPSG codes in the 4000 range use GeographicTypeGeoKey, everything else is projected. */
    static boolean isGeographic(int epsg) {
        return epsg >= 4000 && epsg < 5000;
    }
}
