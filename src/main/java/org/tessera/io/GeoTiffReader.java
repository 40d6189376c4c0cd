package org.tessera.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;
import org.tessera.crs.CrsRegistry;
import org.tessera.raster.Extent;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;

/**
 * Reads the first band of a north-up GeoTIFF into a {@link Raster}.
 * <p>
 * Georeferencing comes from the ModelPixelScale and ModelTiepoint tags and the EPSG code from the
 * GeoKeyDirectory (ProjectedCSTypeGeoKey, falling back to GeographicTypeGeoKey).
 */
public class GeoTiffReader {

    /**
     * Reads a GeoTIFF.
     *
     * @param file the GeoTIFF to read.
     * @return the first band on the grid described by the file's georeferencing.
     * @throws IOException if the file cannot be read, is not a TIFF, or carries no usable georeferencing.
     */
    public Raster read(Path file) throws IOException {
        try {
            TIFFImage image = TiffReader.readTiff(file.toFile());
            FileDirectory directory = image.getFileDirectory();
            Grid grid = readGrid(directory, file);

            Rasters rasters = directory.readRasters();
            int width = rasters.getWidth();
            int height = rasters.getHeight();
            if (width != grid.cols() || height != grid.rows()) {
                throw new IOException(String.format(
                    "%s: image is %dx%d but georeferencing describes %dx%d", file, width, height, grid.cols(), grid.rows()));
            }
            int mask = directory.getBitsPerSample().get(0) <= 8 ? 0xFF : 0xFFFF;
            int[] values = new int[width * height];
            for (int y = 0; y < height; y++) {
                int offset = y * width;
                for (int x = 0; x < width; x++) {
                    values[offset + x] = rasters.getPixelSample(0, x, y).intValue() & mask;
                }
            }
            return new Raster(grid, values);
        } catch (TiffException e) {
            throw new IOException("Failed to decode GeoTIFF " + file + ": " + e.getMessage(), e);
        }
    }

    private static Grid readGrid(FileDirectory directory, Path file) throws IOException {
        double[] scale = null;
        double[] tiepoint = null;
        int epsg = 0;
        for (FileDirectoryEntry entry : directory.getEntries()) {
            FieldTagType tag = entry.getFieldTag();
            if (tag == FieldTagType.ModelPixelScale) {
                scale = toDoubles(entry.getValues());
            } else if (tag == FieldTagType.ModelTiepoint) {
                tiepoint = toDoubles(entry.getValues());
            } else if (tag == FieldTagType.GeoKeyDirectory) {
                epsg = epsgFromGeoKeys(toDoubles(entry.getValues()));
            }
        }
        if (scale == null || scale.length < 2 || tiepoint == null || tiepoint.length < 6) {
            throw new IOException(file + " carries no pixel scale / tie point georeferencing");
        }
        if (epsg <= 0) {
            throw new IOException(file + " carries no EPSG code in its GeoKeyDirectory");
        }
        int width = directory.getImageWidth().intValue();
        int height = directory.getImageHeight().intValue();
        double xmin = tiepoint[3] - tiepoint[0] * scale[0];
        double ymax = tiepoint[4] + tiepoint[1] * scale[1];
        Extent extent = new Extent(xmin, ymax - height * scale[1], xmin + width * scale[0], ymax);
        return Grid.of(extent, scale[0], CrsRegistry.epsgCode(epsg));
    }

    private static int epsgFromGeoKeys(double[] keys) {
        if (keys == null || keys.length < 4) {
            return 0;
        }
        int count = (int) keys[3];
        int geographic = 0;
        for (int k = 0, i = 4; k < count && i + 3 < keys.length; k++, i += 4) {
            int id = (int) keys[i];
            int location = (int) keys[i + 1];
            int value = (int) keys[i + 3];
            if (location != 0) continue;
            if (id == GeoKeys.PROJECTED_CS_TYPE) return value;
            if (id == GeoKeys.GEOGRAPHIC_TYPE) geographic = value;
        }
        return geographic;
    }

    private static double[] toDoubles(Object values) {
        if (values instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                out[i] = ((Number) list.get(i)).doubleValue();
            }
            return out;
        }
        if (values instanceof Number number) {
            return new double[] {number.doubleValue()};
        }
        return null;
    }
}
