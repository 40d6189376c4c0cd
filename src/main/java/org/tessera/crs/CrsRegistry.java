package org.tessera.crs;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.Proj4jException;
import org.tessera.raster.Extent;

/**
 * Resolves coordinate reference systems by authority code and transforms coordinates between them.
 * <p>
 * Parsed {@link CoordinateReferenceSystem} instances are cached and shared. {@link CoordinateTransform}
 * instances keep scratch state and are not thread-safe, so {@link #createTransform(String, String)} returns
 * a fresh transform that belongs to the caller.
 */
public class CrsRegistry {

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final Map<String, CoordinateReferenceSystem> cache = new ConcurrentHashMap<>();

    /**
     * Normalises an EPSG number into the authority code form used throughout the application.
     *
     * @param epsg the EPSG number, e.g. 32736.
     * @return {@code "EPSG:32736"}.
     */
    public static String epsgCode(int epsg) {
        if (epsg <= 0) {
            throw new IllegalArgumentException("EPSG code must be positive, got " + epsg);
        }
        return "EPSG:" + epsg;
    }

    /**
     * Extracts the EPSG number from an authority code.
     *
     * @param code an {@code EPSG:nnnn} code.
     * @return the number.
     * @throws IllegalArgumentException if the code is not an EPSG code.
     */
    public static int epsgNumber(String code) {
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("EPSG:")) {
            throw new IllegalArgumentException("Not an EPSG code: " + code);
        }
        try {
            return Integer.parseInt(normalized.substring(5));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an EPSG code: " + code, e);
        }
    }

    /**
     * Resolves a CRS by authority code.
     *
     * @param code e.g. {@code EPSG:4326}.
     * @return the parsed coordinate reference system.
     * @throws IllegalArgumentException if the code is unknown.
     */
    public CoordinateReferenceSystem get(String code) {
        String key = code.trim().toUpperCase(Locale.ROOT);
        return cache.computeIfAbsent(key, k -> {
            try {
                return crsFactory.createFromName(k);
            } catch (Proj4jException e) {
                throw new IllegalArgumentException("Unknown coordinate reference system: " + code, e);
            }
        });
    }

    /**
     * Whether a CRS code is resolvable.
     */
    public boolean isKnown(String code) {
        try {
            get(code);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Whether two codes name the same coordinate reference system, in which case no transform is needed.
     */
    public static boolean sameCrs(String a, String b) {
        return a.trim().equalsIgnoreCase(b.trim());
    }

    /**
     * Creates a transform owned by the caller.
     *
     * @param sourceCode CRS of the input coordinates.
     * @param targetCode CRS of the output coordinates.
     * @return a new, non-thread-safe transform.
     */
    public CoordinateTransform createTransform(String sourceCode, String targetCode) {
        return transformFactory.createTransform(get(sourceCode), get(targetCode));
    }

    /**
     * Transforms a single point.
     *
     * @return {@code {x, y}} in the target CRS.
     */
    public double[] transformPoint(double x, double y, String sourceCode, String targetCode) {
        if (sameCrs(sourceCode, targetCode)) {
            return new double[] {x, y};
        }
        ProjCoordinate out = new ProjCoordinate();
        createTransform(sourceCode, targetCode).transform(new ProjCoordinate(x, y), out);
        return new double[] {out.x, out.y};
    }

    /**
     * Transforms an extent by projecting its four corners and taking their bounding rectangle.
     *
     * @param extent     the extent in {@code sourceCode} units.
     * @param sourceCode CRS of the extent.
     * @param targetCode CRS to express the bounding rectangle in.
     * @return the bounding rectangle of the transformed corners.
     */
    public Extent transformExtent(Extent extent, String sourceCode, String targetCode) {
        if (sameCrs(sourceCode, targetCode)) {
            return extent;
        }
        CoordinateTransform transform = createTransform(sourceCode, targetCode);
        double[][] corners = {
            {extent.xmin(), extent.ymin()},
            {extent.xmin(), extent.ymax()},
            {extent.xmax(), extent.ymin()},
            {extent.xmax(), extent.ymax()}
        };
        double xmin = Double.POSITIVE_INFINITY;
        double ymin = Double.POSITIVE_INFINITY;
        double xmax = Double.NEGATIVE_INFINITY;
        double ymax = Double.NEGATIVE_INFINITY;
        ProjCoordinate out = new ProjCoordinate();
        for (double[] corner : corners) {
            transform.transform(new ProjCoordinate(corner[0], corner[1]), out);
            xmin = Math.min(xmin, out.x);
            ymin = Math.min(ymin, out.y);
            xmax = Math.max(xmax, out.x);
            ymax = Math.max(ymax, out.y);
        }
        return new Extent(xmin, ymin, xmax, ymax);
    }
}
