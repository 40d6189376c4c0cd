package org.tessera.scene;

import org.tessera.raster.Raster;

/**
 * Pixel access for one scene at one resolution.
 * <p>
 * Returned rasters may be shared through a cache and must be treated as read-only.
 */
public interface ISceneSource {

    /**
     * Reads a spectral band.
     *
     * @param band the band identifier, e.g. {@code B04}.
     * @return the band on the scene's native grid.
     * @throws SceneReadException if the band is missing or unreadable.
     */
    Raster readBand(String band) throws SceneReadException;

    /**
     * Reads the scene classification.
     *
     * @param applyCorrection whether to run the mask improvement filter over the classification.
     * @return the classification on its native grid, which may be coarser than the scene's band grid.
     * @throws SceneReadException if the classification is missing or unreadable.
     */
    Raster readMask(boolean applyCorrection) throws SceneReadException;
}
