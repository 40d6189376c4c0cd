package org.tessera.resample;

/**
 * Interpolation used when mapping source pixels onto a destination grid.
 */
public enum ResampleMode {
    /** Value of the source pixel containing the destination pixel centre. Required for classification data. */
    NEAREST,
    /** Distance-weighted mean of the four source pixels surrounding the destination pixel centre. */
    BILINEAR
}
