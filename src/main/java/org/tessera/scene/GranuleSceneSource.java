package org.tessera.scene;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.tessera.io.GeoTiffReader;
import org.tessera.mask.MaskImprovementFilter;
import org.tessera.raster.Raster;

/**
 * Reads the GeoTIFF rasters of a level-2A granule at one resolution.
 * <p>
 * Bands are looked up as {@code IMG_DATA/R<res>m/*_<BAND>_<res>m.tif}. The classification band {@code SCL}
 * is not produced at every resolution, so a missing classification falls back to the 20 m and then the
 * 60 m raster; nearest-neighbour reprojection brings it onto the destination grid later. Only the
 * classification goes through the {@link RasterCache}; bands are read once per resolution.
 */
public class GranuleSceneSource implements ISceneSource {

    static final String CLASSIFICATION_BAND = "SCL";
    private static final int[] MASK_FALLBACK_RESOLUTIONS = {20, 60};

    private final Path granuleDir;
    private final int resolution;
    private final GeoTiffReader reader;
    private final MaskImprovementFilter maskFilter;
    private final RasterCache cache;

    public GranuleSceneSource(Path granuleDir, int resolution, GeoTiffReader reader,
                              MaskImprovementFilter maskFilter, RasterCache cache) {
        this.granuleDir = granuleDir;
        this.resolution = resolution;
        this.reader = reader;
        this.maskFilter = maskFilter;
        this.cache = cache;
    }

    @Override
    public Raster readBand(String band) throws SceneReadException {
        Path file = findRaster(band, resolution);
        if (file == null) {
            throw new SceneReadException(String.format("Band %s at %d m not found in %s", band, resolution, granuleDir));
        }
        return read(file);
    }

    @Override
    public Raster readMask(boolean applyCorrection) throws SceneReadException {
        Path file = findRaster(CLASSIFICATION_BAND, resolution);
        for (int i = 0; file == null && i < MASK_FALLBACK_RESOLUTIONS.length; i++) {
            if (MASK_FALLBACK_RESOLUTIONS[i] != resolution) {
                file = findRaster(CLASSIFICATION_BAND, MASK_FALLBACK_RESOLUTIONS[i]);
            }
        }
        if (file == null) {
            throw new SceneReadException("No classification raster found in " + granuleDir);
        }
        Path maskFile = file;
        Raster mask = cache.get(maskFile.toAbsolutePath().toString(), () -> read(maskFile));
        if (!applyCorrection) {
            return mask;
        }
        return cache.get(file.toAbsolutePath() + "#corrected", () -> maskFilter.improve(mask));
    }

    private Raster read(Path file) throws SceneReadException {
        try {
            return reader.read(file);
        } catch (IOException e) {
            throw new SceneReadException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private Path findRaster(String band, int res) throws SceneReadException {
        Path dir = granuleDir.resolve("IMG_DATA").resolve("R" + res + "m");
        if (!Files.isDirectory(dir)) {
            return null;
        }
        String suffix = "_" + band + "_" + res + "m.tif";
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + suffix)) {
            for (Path p : stream) {
                matches.add(p);
            }
        } catch (IOException e) {
            throw new SceneReadException("Cannot list " + dir + ": " + e.getMessage(), e);
        }
        if (matches.size() > 1) {
            throw new SceneReadException("Ambiguous " + band + " rasters in " + dir + ": " + matches);
        }
        return matches.isEmpty() ? null : matches.get(0);
    }
}
