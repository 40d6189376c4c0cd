package org.tessera.raster;

import java.util.BitSet;

/**
 * Output of a reprojection: the resampled values plus a validity bitmap that is set for every destination
 * pixel which received mapped source data. Pixels outside the source footprint are zero in {@code raster}
 * and clear in {@code valid}, which keeps "outside" apart from a genuine zero sample.
 *
 * @param raster values on the destination grid.
 * @param valid  one bit per destination pixel, row-major.
 */
public record ResampledRaster(Raster raster, BitSet valid) {

    public Grid grid() {
        return raster.grid();
    }

    public boolean isValid(int index) {
        return valid.get(index);
    }

    public int get(int index) {
        return raster.get(index);
    }

    public int validCount() {
        return valid.cardinality();
    }
}
