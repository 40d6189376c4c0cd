package org.tessera.resample;

import org.tessera.raster.Grid;
import org.tessera.raster.Raster;
import org.tessera.raster.ResampledRaster;

/**
 * Reprojects a raster onto a destination grid.
 * <p>
 * Implementations must report, per destination pixel, whether it received mapped source data; pixels that
 * fall outside the source footprint are left at zero and flagged invalid.
 */
public interface IResampler {

    /**
     * Reprojects {@code source} onto {@code destination}.
     *
     * @param source      the source raster, carrying its own grid and CRS.
     * @param destination the grid to resample onto.
     * @param mode        the interpolation; classification rasters must use {@link ResampleMode#NEAREST}.
     * @return the resampled values with their validity bitmap.
     */
    ResampledRaster reproject(Raster source, Grid destination, ResampleMode mode);
}
