package org.tessera.testutil;

import java.util.Arrays;

import org.tessera.raster.Extent;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;

/**
 * Small rasters on a UTM zone 36S grid for unit tests.
 */
public final class TestRasters {

    public static final String CRS = "EPSG:32736";
    public static final double ORIGIN_X = 500000.0;
    public static final double ORIGIN_Y = 7800000.0;

    private TestRasters() {
    }

    /** A grid whose north-west corner is ({@link #ORIGIN_X}, {@link #ORIGIN_Y}). */
    public static Grid grid(int rows, int cols, double pixelSize) {
        return grid(ORIGIN_X, ORIGIN_Y, rows, cols, pixelSize);
    }

    public static Grid grid(double xmin, double ymax, int rows, int cols, double pixelSize) {
        return Grid.of(new Extent(xmin, ymax - rows * pixelSize, xmin + cols * pixelSize, ymax), pixelSize, CRS);
    }

    /** A raster from row-major values. */
    public static Raster raster(Grid grid, int... values) {
        return new Raster(grid, values.clone());
    }

    public static Raster filled(Grid grid, int value) {
        int[] values = new int[grid.cellCount()];
        Arrays.fill(values, value);
        return new Raster(grid, values);
    }

    /**
     * A raster holding {@code good} in its first {@code goodCount} pixels (row-major) and {@code other} elsewhere.
     */
    public static Raster prefix(Grid grid, int goodCount, int good, int other) {
        int[] values = new int[grid.cellCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < goodCount ? good : other;
        }
        return new Raster(grid, values);
    }
}
