package org.tessera.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;
import org.tessera.crs.CrsRegistry;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;

/**
 * Writes single-band unsigned integer GeoTIFFs with pixel-scale, tie-point and EPSG georeferencing.
 * <p>
 * Files are written to a temporary sibling first and moved into place atomically, so a partially written
 * raster is never visible under its final name.
 */
public class GeoTiffWriter {

    private final Compression compression;

    public GeoTiffWriter() {
        this(Compression.NONE);
    }

    public GeoTiffWriter(Compression compression) {
        this.compression = compression;
    }

    /**
     * Writes a raster.
     *
     * @param raster     the samples and their grid.
     * @param target     the destination file; parent directories are created.
     * @param sampleType the on-disk sample format; values are clamped into its range.
     * @throws IOException if the file cannot be encoded or written.
     */
    public void write(Raster raster, Path target, SampleType sampleType) throws IOException {
        Grid grid = raster.grid();
        int width = grid.cols();
        int height = grid.rows();
        FieldType fieldType = sampleType.fieldType();

        Rasters rasters = new Rasters(width, height, 1, fieldType);
        int rowsPerStrip = rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(fieldType.getBits());
        directory.setCompression(compression.tiffCode());
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rowsPerStrip);
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_UNSIGNED_INT);
        addGeoreferencing(directory, grid);
        directory.setWriteRasters(rasters);

        int[] values = raster.values();
        for (int y = 0; y < height; y++) {
            int offset = y * width;
            for (int x = 0; x < width; x++) {
                rasters.setFirstPixelSample(x, y, sampleType.clamp(values[offset + x]));
            }
        }

        TIFFImage image = new TIFFImage();
        image.add(directory);

        AtomicFiles.write(target, file -> {
            try {
                TiffWriter.writeTiff(file.toFile(), image);
            } catch (TiffException e) {
                throw new IOException("Failed to encode GeoTIFF " + target + ": " + e.getMessage(), e);
            }
        });
    }

    private static void addGeoreferencing(FileDirectory directory, Grid grid) {
        double[] transform = grid.geoTransform();
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE, 3,
            List.of(grid.pixelSize(), grid.pixelSize(), 0.0)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE, 6,
            List.of(0.0, 0.0, 0.0, transform[0], transform[3], 0.0)));

        int epsg = CrsRegistry.epsgNumber(grid.crs());
        boolean geographic = GeoKeys.isGeographic(epsg);
        List<Integer> keys = List.of(
            1, 1, 0, 3,
            GeoKeys.GT_MODEL_TYPE, 0, 1, geographic ? GeoKeys.MODEL_TYPE_GEOGRAPHIC : GeoKeys.MODEL_TYPE_PROJECTED,
            GeoKeys.GT_RASTER_TYPE, 0, 1, GeoKeys.RASTER_PIXEL_IS_AREA,
            geographic ? GeoKeys.GEOGRAPHIC_TYPE : GeoKeys.PROJECTED_CS_TYPE, 0, 1, epsg);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT, keys.size(), keys));
    }
}
