package org.tessera.raster;

/**
 * Axis-aligned bounding rectangle in the units of some coordinate reference system.
 *
 * @param xmin western edge.
 * @param ymin southern edge.
 * @param xmax eastern edge.
 * @param ymax northern edge.
 */
public record Extent(double xmin, double ymin, double xmax, double ymax) {

    public Extent {
        if (!(xmin < xmax) || !(ymin < ymax)) {
            throw new IllegalArgumentException(String.format(
                "Invalid extent [%s, %s, %s, %s]: minimum must be strictly less than maximum on both axes",
                xmin, ymin, xmax, ymax));
        }
    }

    /**
     * Builds an extent from the four-value form {@code xmin ymin xmax ymax} used on the command line.
     *
     * @param values exactly four coordinates.
     * @return the extent.
     * @throws IllegalArgumentException if the array does not hold four values or describes an empty rectangle.
     */
    public static Extent of(double... values) {
        if (values == null || values.length != 4) {
            throw new IllegalArgumentException("Extent requires exactly four values (xmin ymin xmax ymax), got "
                + (values == null ? 0 : values.length));
        }
        return new Extent(values[0], values[1], values[2], values[3]);
    }

    public double width() {
        return xmax - xmin;
    }

    public double height() {
        return ymax - ymin;
    }

    public double centreX() {
        return (xmin + xmax) / 2.0;
    }

    public double centreY() {
        return (ymin + ymax) / 2.0;
    }

    /**
     * Tests whether two extents share any area. Rectangles that only touch along an edge do not intersect.
     *
     * @param other extent in the same coordinate reference system.
     * @return {@code true} unless the rectangles are disjoint.
     */
    public boolean intersects(Extent other) {
        if (other.xmin >= xmax) return false;
        if (other.xmax <= xmin) return false;
        if (other.ymin >= ymax) return false;
        return !(other.ymax <= ymin);
    }
}
