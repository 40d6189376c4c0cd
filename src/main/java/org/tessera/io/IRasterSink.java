package org.tessera.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.tessera.raster.Raster;

/**
 * Destination for the rasters of a mosaic product.
 */
public interface IRasterSink {

    /**
     * Persists a single-band raster with its georeferencing.
     *
     * @param raster     the samples and their grid.
     * @param path       the file to write.
     * @param sampleType the on-disk sample format.
     * @throws IOException if writing fails.
     */
    void writeRaster(Raster raster, Path path, SampleType sampleType) throws IOException;

    /**
     * Builds a lightweight three-band composite referencing already written band rasters.
     *
     * @param bandPaths  exactly three band rasters, in red, green, blue order.
     * @param outputPath the composite file to write.
     * @throws IOException if a band cannot be read or the composite cannot be written.
     */
    void writeVisualizationComposite(List<Path> bandPaths, Path outputPath) throws IOException;
}
