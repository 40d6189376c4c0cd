package org.tessera.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dense, row-major integer raster bound to a {@link Grid}.
 * <p>
 * Sample values are stored as {@code int}, wide enough for unsigned 8 and 16 bit data. The backing array
 * is exposed through {@link #values()} for bulk processing and is owned by whoever holds the raster.
 */
public final class Raster {

    private final Grid grid;
    private final int[] values;

    public Raster(Grid grid, int[] values) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.values = Objects.requireNonNull(values, "values");
        if (values.length != grid.cellCount()) {
            throw new IllegalArgumentException(String.format(
                "Raster holds %d samples but %s needs %d", values.length, grid, grid.cellCount()));
        }
    }

    /** Creates an all-zero raster. */
    public static Raster zeros(Grid grid) {
        return new Raster(grid, new int[grid.cellCount()]);
    }

    public Grid grid() {
        return grid;
    }

    public int[] values() {
        return values;
    }

    public int get(int row, int col) {
        return values[grid.index(row, col)];
    }

    public int get(int index) {
        return values[index];
    }

    public void set(int row, int col, int value) {
        values[grid.index(row, col)] = value;
    }

    public Raster copy() {
        return new Raster(grid, values.clone());
    }

    /** Counts samples that are not zero. */
    public int countNonZero() {
        int count = 0;
        for (int v : values) {
            if (v != 0) count++;
        }
        return count;
    }

    public boolean hasData() {
        for (int v : values) {
            if (v != 0) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raster other)) return false;
        return grid.equals(other.grid) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * grid.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Raster[" + grid + "]";
    }
}
