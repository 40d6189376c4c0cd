package org.tessera.resample;

import java.util.BitSet;

import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.tessera.crs.CrsRegistry;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;
import org.tessera.raster.ResampledRaster;

/**
 * Inverse-mapping resampler: every destination pixel centre is transformed into the source CRS and sampled
 * from the source raster there.
 * <p>
 * When both grids share a CRS the coordinate transform is skipped; when they are identical the samples are
 * copied. Destination pixels the transform cannot map are reported invalid.
 */
public class ProjectiveResampler implements IResampler {

    private final CrsRegistry crsRegistry;

    public ProjectiveResampler(CrsRegistry crsRegistry) {
        this.crsRegistry = crsRegistry;
    }

    @Override
    public ResampledRaster reproject(Raster source, Grid destination, ResampleMode mode) {
        Grid sourceGrid = source.grid();
        int[] out = new int[destination.cellCount()];
        BitSet valid = new BitSet(destination.cellCount());

        if (sourceGrid.isAlignedWith(destination)) {
            System.arraycopy(source.values(), 0, out, 0, out.length);
            valid.set(0, out.length);
            return new ResampledRaster(new Raster(destination, out), valid);
        }

        CoordinateTransform transform = CrsRegistry.sameCrs(sourceGrid.crs(), destination.crs())
            ? null
            : crsRegistry.createTransform(destination.crs(), sourceGrid.crs());
        ProjCoordinate in = new ProjCoordinate();
        ProjCoordinate mapped = new ProjCoordinate();

        double sxmin = sourceGrid.extent().xmin();
        double symax = sourceGrid.extent().ymax();
        double ps = sourceGrid.pixelSize();
        int srcRows = sourceGrid.rows();
        int srcCols = sourceGrid.cols();
        int[] src = source.values();

        for (int row = 0; row < destination.rows(); row++) {
            double y = destination.centreY(row);
            for (int col = 0; col < destination.cols(); col++) {
                double x = destination.centreX(col);
                double sx;
                double sy;
                if (transform == null) {
                    sx = x;
                    sy = y;
                } else {
                    in.x = x;
                    in.y = y;
                    try {
                        transform.transform(in, mapped);
                    } catch (Proj4jException e) {
                        // Outside the projection's domain: no source data maps here.
                        continue;
                    }
                    sx = mapped.x;
                    sy = mapped.y;
                }
                double fx = (sx - sxmin) / ps;
                double fy = (symax - sy) / ps;
                int c = (int) Math.floor(fx);
                int r = (int) Math.floor(fy);
                if (r < 0 || r >= srcRows || c < 0 || c >= srcCols || Double.isNaN(fx) || Double.isNaN(fy)) {
                    continue;
                }
                int index = destination.index(row, col);
                valid.set(index);
                out[index] = mode == ResampleMode.NEAREST
                    ? src[r * srcCols + c]
                    : bilinear(src, srcRows, srcCols, fx - 0.5, fy - 0.5);
            }
        }
        return new ResampledRaster(new Raster(destination, out), valid);
    }

    private static int bilinear(int[] src, int rows, int cols, double fx, double fy) {
        int c0 = (int) Math.floor(fx);
        int r0 = (int) Math.floor(fy);
        double wx = fx - c0;
        double wy = fy - r0;
        int c1 = clamp(c0 + 1, cols);
        int r1 = clamp(r0 + 1, rows);
        c0 = clamp(c0, cols);
        r0 = clamp(r0, rows);
        double top = src[r0 * cols + c0] * (1 - wx) + src[r0 * cols + c1] * wx;
        double bottom = src[r1 * cols + c0] * (1 - wx) + src[r1 * cols + c1] * wx;
        return (int) Math.round(top * (1 - wy) + bottom * wy);
    }

    private static int clamp(int value, int size) {
        return value < 0 ? 0 : Math.min(value, size - 1);
    }
}
