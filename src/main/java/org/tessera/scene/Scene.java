package org.tessera.scene;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

import org.tessera.raster.Extent;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;

/**
 * One geolocated, time-stamped source acquisition at one resolution.
 *
 * @param id              a unique, human readable identifier (the granule name).
 * @param tileId          the tiling-grid footprint identifier, e.g. {@code 36KWA}.
 * @param acquisitionTime the sensing time.
 * @param grid            the native grid of the scene's bands at this resolution.
 * @param nodataFraction  fraction of the footprint without usable data, in [0, 1].
 * @param source          pixel access.
 */
public record Scene(
    String id,
    String tileId,
    Instant acquisitionTime,
    Grid grid,
    double nodataFraction,
    ISceneSource source) {

    public Scene {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tileId, "tileId");
        Objects.requireNonNull(acquisitionTime, "acquisitionTime");
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(source, "source");
    }

    public String crs() {
        return grid.crs();
    }

    public Extent extent() {
        return grid.extent();
    }

    public double pixelSize() {
        return grid.pixelSize();
    }

    public LocalDate acquisitionDate() {
        return acquisitionTime.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public Raster readBand(String band) throws SceneReadException {
        return source.readBand(band);
    }

    public Raster readMask(boolean applyCorrection) throws SceneReadException {
        return source.readMask(applyCorrection);
    }

    @Override
    public String toString() {
        return "Scene[" + id + ", tile=" + tileId + ", " + acquisitionTime + "]";
    }
}
