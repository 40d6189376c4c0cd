package org.tessera.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.tessera.raster.Grid;

/**
 * Writes GDAL virtual raster (VRT) documents that stack existing single-band files into one dataset.
 * Source files are referenced relative to the VRT, so the product directory can be moved as a whole.
 */
public class VrtWriter {

    private static final String[] COLOR_INTERP = {"Red", "Green", "Blue"};

    /**
     * Writes a VRT stacking the given bands.
     *
     * @param grid      the grid shared by every band.
     * @param bandPaths the source rasters, one VRT band each, in order.
     * @param dataType  GDAL data type name of the sources, e.g. {@code UInt16}.
     * @param target    the VRT file to write.
     * @throws IOException if writing fails.
     */
    public void write(Grid grid, List<Path> bandPaths, String dataType, Path target) throws IOException {
        double[] gt = grid.geoTransform();
        StringBuilder xml = new StringBuilder();
        xml.append(String.format(Locale.ROOT, "<VRTDataset rasterXSize=\"%d\" rasterYSize=\"%d\">%n",
            grid.cols(), grid.rows()));
        xml.append("  <SRS>").append(grid.crs()).append("</SRS>\n");
        xml.append(String.format(Locale.ROOT, "  <GeoTransform>%.10f, %.10f, %.1f, %.10f, %.1f, %.10f</GeoTransform>%n",
            gt[0], gt[1], gt[2], gt[3], gt[4], gt[5]));
        for (int i = 0; i < bandPaths.size(); i++) {
            Path relative = relativize(target, bandPaths.get(i));
            xml.append(String.format(Locale.ROOT, "  <VRTRasterBand dataType=\"%s\" band=\"%d\">%n", dataType, i + 1));
            if (i < COLOR_INTERP.length) {
                xml.append("    <ColorInterp>").append(COLOR_INTERP[i]).append("</ColorInterp>\n");
            }
            xml.append("    <NoDataValue>0</NoDataValue>\n");
            xml.append("    <SimpleSource>\n");
            xml.append("      <SourceFilename relativeToVRT=\"1\">").append(relative.toString().replace('\\', '/'))
                .append("</SourceFilename>\n");
            xml.append("      <SourceBand>1</SourceBand>\n");
            xml.append(String.format(Locale.ROOT, "      <SrcRect xOff=\"0\" yOff=\"0\" xSize=\"%d\" ySize=\"%d\"/>%n",
                grid.cols(), grid.rows()));
            xml.append(String.format(Locale.ROOT, "      <DstRect xOff=\"0\" yOff=\"0\" xSize=\"%d\" ySize=\"%d\"/>%n",
                grid.cols(), grid.rows()));
            xml.append("    </SimpleSource>\n");
            xml.append("  </VRTRasterBand>\n");
        }
        xml.append("</VRTDataset>\n");

        AtomicFiles.write(target, file -> Files.writeString(file, xml, StandardCharsets.UTF_8));
    }

    private static Path relativize(Path vrt, Path band) {
        Path vrtDir = vrt.toAbsolutePath().getParent();
        Path absolute = band.toAbsolutePath();
        if (vrtDir != null && absolute.startsWith(vrtDir)) {
            return vrtDir.relativize(absolute);
        }
        return absolute;
    }
}
