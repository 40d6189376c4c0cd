package org.tessera.io;

import mil.nga.tiff.util.TiffConstants;

/**
 * Strip compression applied to written GeoTIFFs.
 */
public enum Compression {
    NONE(TiffConstants.COMPRESSION_NO),
    DEFLATE(TiffConstants.COMPRESSION_DEFLATE);

    private final int tiffCode;

    Compression(int tiffCode) {
        this.tiffCode = tiffCode;
    }

    int tiffCode() {
        return tiffCode;
    }
}
