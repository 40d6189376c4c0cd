package org.tessera.mask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.raster.ClassificationCode;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;

/**
 * Cleans up a scene classification before compositing:
 * <ol>
 *   <li>dark features (2) become cloud shadow (3);</li>
 *   <li>optionally, shadows farther than a fixed distance from any cloud (8, 9) become water (6);</li>
 *   <li>shadow (3), medium cloud (8) and high cloud (9) are dilated, each against the pre-dilation
 *       classification, and written in that order;</li>
 *   <li>the data region (codes other than 0) is eroded and eroded pixels are reset to 0.</li>
 * </ol>
 * Buffer distances are in metres and become iteration counts by integer division by the pixel size.
 * The filter never modifies its input.
 */
public class MaskImprovementFilter {

    private static final Logger log = LoggerFactory.getLogger(MaskImprovementFilter.class);

    private static final int[] DILATED_CLASSES = {
        ClassificationCode.CLOUD_SHADOWS.code(),
        ClassificationCode.CLOUD_MEDIUM_PROBABILITY.code(),
        ClassificationCode.CLOUD_HIGH_PROBABILITY.code()
    };

    private final MaskFilterSettings settings;

    public MaskImprovementFilter(MaskFilterSettings settings) {
        this.settings = settings;
    }

    public MaskFilterSettings settings() {
        return settings;
    }

    /**
     * Applies the filter.
     *
     * @param mask a classification raster; its grid's pixel size drives the buffer conversion.
     * @return a new, improved classification raster on the same grid.
     */
    public Raster improve(Raster mask) {
        Grid grid = mask.grid();
        int rows = grid.rows();
        int cols = grid.cols();
        int[] original = mask.values();
        int[] codes = original.clone();

        for (int i = 0; i < codes.length; i++) {
            if (codes[i] == ClassificationCode.DARK_FEATURES.code()) {
                codes[i] = ClassificationCode.CLOUD_SHADOWS.code();
            }
        }

        if (settings.removeDistantShadow()) {
            relabelDistantShadow(codes, rows, cols,
                MaskFilterSettings.iterations(settings.distantShadowMeters(), grid.pixelSize()));
        }

        int dilation = MaskFilterSettings.iterations(settings.dilationMeters(), grid.pixelSize());
        if (dilation > 0) {
            int[] snapshot = codes.clone();
            for (int code : DILATED_CLASSES) {
                boolean[] grown = Morphology.dilate(select(snapshot, code), rows, cols, dilation);
                for (int i = 0; i < codes.length; i++) {
                    if (grown[i]) codes[i] = code;
                }
            }
        }

        int erosion = MaskFilterSettings.iterations(settings.erosionMeters(), grid.pixelSize());
        if (erosion > 0) {
            boolean[] hasData = new boolean[original.length];
            for (int i = 0; i < original.length; i++) {
                hasData[i] = original[i] != ClassificationCode.NO_DATA.code();
            }
            boolean[] kept = Morphology.erode(hasData, rows, cols, erosion);
            for (int i = 0; i < codes.length; i++) {
                if (!kept[i]) codes[i] = ClassificationCode.NO_DATA.code();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Improved mask on {}: dilation {} px, erosion {} px", grid, dilation, erosion);
        }
        return new Raster(grid, codes);
    }

    private static void relabelDistantShadow(int[] codes, int rows, int cols, int iterations) {
        boolean[] cloud = new boolean[codes.length];
        for (int i = 0; i < codes.length; i++) {
            cloud[i] = codes[i] == ClassificationCode.CLOUD_MEDIUM_PROBABILITY.code()
                || codes[i] == ClassificationCode.CLOUD_HIGH_PROBABILITY.code();
        }
        boolean[] nearCloud = Morphology.dilate(cloud, rows, cols, iterations);
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] == ClassificationCode.CLOUD_SHADOWS.code() && !nearCloud[i]) {
                codes[i] = ClassificationCode.WATER.code();
            }
        }
    }

    private static boolean[] select(int[] codes, int code) {
        boolean[] selected = new boolean[codes.length];
        for (int i = 0; i < codes.length; i++) {
            selected[i] = codes[i] == code;
        }
        return selected;
    }
}
