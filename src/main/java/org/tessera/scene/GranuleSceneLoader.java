package org.tessera.scene;

import java.nio.file.Path;

import org.tessera.io.GeoTiffReader;
import org.tessera.mask.MaskImprovementFilter;

/**
 * Turns granule directories into {@link Scene}s at a given resolution.
 */
public class GranuleSceneLoader {

    private final GeoTiffReader reader;
    private final MaskImprovementFilter maskFilter;
    private final RasterCache cache;

    public GranuleSceneLoader(GeoTiffReader reader, MaskImprovementFilter maskFilter, RasterCache cache) {
        this.reader = reader;
        this.maskFilter = maskFilter;
        this.cache = cache;
    }

    /**
     * Loads a scene.
     *
     * @param granuleDir the granule directory, holding {@code MTD_TL.xml} and {@code IMG_DATA}.
     * @param resolution the resolution in metres.
     * @return the scene; pixel data is read lazily.
     * @throws SceneReadException if the metadata cannot be read or lacks the resolution's geometry.
     */
    public Scene load(Path granuleDir, int resolution) throws SceneReadException {
        GranuleMetadata metadata = GranuleMetadata.read(granuleDir);
        return new Scene(
            granuleDir.getFileName().toString(),
            metadata.tileId(),
            metadata.sensingTime(),
            metadata.grid(resolution),
            metadata.nodataFraction(),
            new GranuleSceneSource(granuleDir, resolution, reader, maskFilter, cache));
    }
}
