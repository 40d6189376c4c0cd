package org.tessera.raster;

import java.util.Objects;

/**
 * Immutable destination raster definition: extent, square pixel size and coordinate reference system.
 * <p>
 * Row and column counts are derived from the extent and pixel size and are never set independently:
 * {@code rows = round((ymin - ymax) / -pixelSize)}, {@code cols = round((xmax - xmin) / pixelSize)}.
 * The grid's origin is the north-west corner of the extent; rows grow southwards.
 */
public final class Grid {

    private final Extent extent;
    private final double pixelSize;
    private final String crs;
    private final int rows;
    private final int cols;

    private Grid(Extent extent, double pixelSize, String crs) {
        this.extent = Objects.requireNonNull(extent, "extent");
        this.crs = Objects.requireNonNull(crs, "crs");
        if (!(pixelSize > 0) || Double.isInfinite(pixelSize)) {
            throw new IllegalArgumentException("Pixel size must be positive, got " + pixelSize);
        }
        this.pixelSize = pixelSize;
        long derivedRows = Math.round((extent.ymin() - extent.ymax()) / -pixelSize);
        long derivedCols = Math.round((extent.xmax() - extent.xmin()) / pixelSize);
        if (derivedRows < 1 || derivedCols < 1) {
            throw new IllegalArgumentException(String.format(
                "Extent %s is smaller than one %s unit pixel", extent, pixelSize));
        }
        if (derivedRows * derivedCols > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException(String.format(
                "Grid of %d x %d pixels is too large", derivedRows, derivedCols));
        }
        this.rows = (int) derivedRows;
        this.cols = (int) derivedCols;
    }

    /**
     * Creates a grid.
     *
     * @param extent    the footprint in {@code crs} units.
     * @param pixelSize the edge length of a square pixel in {@code crs} units.
     * @param crs       an authority code understood by {@link org.tessera.crs.CrsRegistry}, e.g. {@code EPSG:32736}.
     * @return the grid.
     * @throws IllegalArgumentException if the pixel size is not positive or the extent holds no whole pixel.
     */
    public static Grid of(Extent extent, double pixelSize, String crs) {
        return new Grid(extent, pixelSize, crs);
    }

    public Extent extent() {
        return extent;
    }

    public double pixelSize() {
        return pixelSize;
    }

    public String crs() {
        return crs;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int cellCount() {
        return rows * cols;
    }

    public int index(int row, int col) {
        return row * cols + col;
    }

    /** World x coordinate of the centre of column {@code col}. */
    public double centreX(int col) {
        return extent.xmin() + (col + 0.5) * pixelSize;
    }

    /** World y coordinate of the centre of row {@code row}. */
    public double centreY(int row) {
        return extent.ymax() - (row + 0.5) * pixelSize;
    }

    /**
     * The pixel-to-world affine transform in GDAL order:
     * {@code (originX, pixelWidth, rowRotation, originY, columnRotation, -pixelHeight)}.
     *
     * @return a fresh six-element array.
     */
    public double[] geoTransform() {
        return new double[] {extent.xmin(), pixelSize, 0.0, extent.ymax(), 0.0, -pixelSize};
    }

    /**
     * Tests whether another grid describes exactly the same pixels, so data can be copied without resampling.
     *
     * @param other the grid to compare with.
     * @return {@code true} if origin, pixel size, dimensions and CRS all match.
     */
    public boolean isAlignedWith(Grid other) {
        return equals(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return Double.compare(pixelSize, other.pixelSize) == 0
            && rows == other.rows
            && cols == other.cols
            && Double.compare(extent.xmin(), other.extent.xmin()) == 0
            && Double.compare(extent.ymax(), other.extent.ymax()) == 0
            && crs.equalsIgnoreCase(other.crs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(extent.xmin(), extent.ymax(), pixelSize, rows, cols, crs.toUpperCase());
    }

    @Override
    public String toString() {
        return String.format("Grid[%s, %dx%d @ %s, origin=(%s, %s)]",
            crs, cols, rows, pixelSize, extent.xmin(), extent.ymax());
    }
}
