package org.tessera.scene;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.tessera.raster.Extent;
import org.tessera.raster.Grid;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Metadata of a level-2A granule, parsed from its {@code MTD_TL.xml}.
 *
 * @param tileId         the tile identifier derived from the granule directory name.
 * @param sensingTime    the acquisition time.
 * @param crs            the horizontal CRS code, e.g. {@code EPSG:32736}.
 * @param grids          the native grid per resolution in metres.
 * @param nodataFraction share of the footprint that is neither vegetation, bare soil nor water.
 */
public record GranuleMetadata(
    String tileId,
    Instant sensingTime,
    String crs,
    Map<Integer, Grid> grids,
    double nodataFraction) {

    public static final String FILE_NAME = "MTD_TL.xml";

    public GranuleMetadata {
        grids = Map.copyOf(grids);
    }

    /**
     * The native grid at a resolution.
     *
     * @throws SceneReadException if the granule does not describe that resolution.
     */
    public Grid grid(int resolution) throws SceneReadException {
        Grid grid = grids.get(resolution);
        if (grid == null) {
            throw new SceneReadException("Granule tile " + tileId + " has no " + resolution + " m geometry");
        }
        return grid;
    }

    /**
     * Parses the metadata of a granule directory.
     *
     * @param granuleDir a directory holding {@value #FILE_NAME}.
     * @return the parsed metadata.
     * @throws SceneReadException if the file is missing or malformed.
     */
    public static GranuleMetadata read(Path granuleDir) throws SceneReadException {
        Path file = granuleDir.resolve(FILE_NAME);
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(file.toFile());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new SceneReadException("Cannot read granule metadata " + file + ": " + e.getMessage(), e);
        }

        try {
            String tileId = tileIdFromName(granuleDir.getFileName().toString());
            Instant sensingTime = Instant.parse(text(document, "SENSING_TIME"));
            String crs = text(document, "HORIZONTAL_CS_CODE").trim();

            Map<Integer, int[]> sizes = new HashMap<>();
            NodeList sizeNodes = document.getElementsByTagNameNS("*", "Size");
            for (int i = 0; i < sizeNodes.getLength(); i++) {
                Element size = (Element) sizeNodes.item(i);
                sizes.put(Integer.parseInt(size.getAttribute("resolution")), new int[] {
                    Integer.parseInt(childText(size, "NROWS")),
                    Integer.parseInt(childText(size, "NCOLS"))
                });
            }

            Map<Integer, Grid> grids = new HashMap<>();
            NodeList positions = document.getElementsByTagNameNS("*", "Geoposition");
            for (int i = 0; i < positions.getLength(); i++) {
                Element position = (Element) positions.item(i);
                int resolution = Integer.parseInt(position.getAttribute("resolution"));
                int[] size = sizes.get(resolution);
                if (size == null) continue;
                double ulx = Double.parseDouble(childText(position, "ULX"));
                double uly = Double.parseDouble(childText(position, "ULY"));
                double xdim = Double.parseDouble(childText(position, "XDIM"));
                double ydim = Double.parseDouble(childText(position, "YDIM"));
                Extent extent = new Extent(ulx, uly + size[0] * ydim, ulx + size[1] * xdim, uly);
                grids.put(resolution, Grid.of(extent, xdim, crs));
            }
            if (grids.isEmpty()) {
                throw new SceneReadException(file + " describes no tile geometry");
            }

            double usable = number(document, "VEGETATION_PERCENTAGE")
                + number(document, "NOT_VEGETATED_PERCENTAGE")
                + number(document, "WATER_PERCENTAGE");
            double nodataFraction = Math.max(0.0, Math.min(1.0, (100.0 - usable) / 100.0));

            return new GranuleMetadata(tileId, sensingTime, crs, grids, nodataFraction);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new SceneReadException("Malformed granule metadata " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the tile identifier from a granule directory name.
     * <p>
     * Supports the current naming ({@code L2A_T36KWA_A013163_20180105T075109}) and the older long naming
     * ({@code S2A_USER_MSI_L2A_TL_SGS__20161228T105702_A007925_T36KWA_N02.04}).
     *
     * @param granuleName the directory name.
     * @return the tile identifier without the leading {@code T}, e.g. {@code 36KWA}.
     * @throws IllegalArgumentException if no tile identifier can be found.
     */
    public static String tileIdFromName(String granuleName) {
        String[] parts = granuleName.split("_");
        if (parts.length >= 2 && isTileToken(parts[1])) {
            return parts[1].substring(1);
        }
        if (parts.length >= 2 && isTileToken(parts[parts.length - 2])) {
            return parts[parts.length - 2].substring(1);
        }
        for (String part : parts) {
            if (isTileToken(part)) return part.substring(1);
        }
        throw new IllegalArgumentException("Cannot determine tile from granule name '" + granuleName + "'");
    }

    private static boolean isTileToken(String token) {
        return token.length() == 6 && token.charAt(0) == 'T'
            && Character.isDigit(token.charAt(1)) && Character.isDigit(token.charAt(2))
            && Character.isLetter(token.charAt(3)) && Character.isLetter(token.charAt(4))
            && Character.isLetter(token.charAt(5));
    }

    private static String text(Document document, String localName) {
        NodeList nodes = document.getElementsByTagNameNS("*", localName);
        if (nodes.getLength() == 0) {
            throw new IllegalArgumentException("missing element " + localName);
        }
        return nodes.item(0).getTextContent().trim();
    }

    private static double number(Document document, String localName) {
        NodeList nodes = document.getElementsByTagNameNS("*", localName);
        return nodes.getLength() == 0 ? 0.0 : Double.parseDouble(nodes.item(0).getTextContent().trim());
    }

    private static String childText(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS("*", localName);
        if (nodes.getLength() == 0) {
            throw new IllegalArgumentException("missing element " + localName);
        }
        return nodes.item(0).getTextContent().trim();
    }
}
