package org.tessera.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.raster.Raster;

/**
 * Writes rasters as GeoTIFF and visualization composites as a GDAL VRT plus an optional PNG quick look.
 */
public class GeoTiffRasterSink implements IRasterSink {

    private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterSink.class);

    private final GeoTiffWriter writer;
    private final GeoTiffReader reader;
    private final VrtWriter vrtWriter = new VrtWriter();
    private final QuickLookRenderer quickLookRenderer = new QuickLookRenderer();
    private final boolean quickLook;

    public GeoTiffRasterSink(GeoTiffWriter writer, GeoTiffReader reader, boolean quickLook) {
        this.writer = writer;
        this.reader = reader;
        this.quickLook = quickLook;
    }

    @Override
    public void writeRaster(Raster raster, Path path, SampleType sampleType) throws IOException {
        writer.write(raster, path, sampleType);
        log.debug("Wrote {}", path);
    }

    @Override
    public void writeVisualizationComposite(List<Path> bandPaths, Path outputPath) throws IOException {
        if (bandPaths.size() != 3) {
            throw new IllegalArgumentException("A visualization composite needs three bands, got " + bandPaths.size());
        }
        List<Raster> bands = new ArrayList<>(3);
        for (Path band : bandPaths) {
            bands.add(reader.read(band));
        }
        vrtWriter.write(bands.get(0).grid(), bandPaths, "UInt16", outputPath);
        log.debug("Wrote {}", outputPath);

        if (quickLook) {
            Path png = quickLookPath(outputPath);
            quickLookRenderer.write(bands.get(0), bands.get(1), bands.get(2), png);
            log.debug("Wrote {}", png);
        }
    }

    /** The PNG written next to a composite: same base name, {@code .png} extension. */
    public static Path quickLookPath(Path compositePath) {
        String name = compositePath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return compositePath.resolveSibling(base + ".png");
    }
}
