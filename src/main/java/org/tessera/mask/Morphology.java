package org.tessera.mask;

import java.util.Arrays;

/**
 * Binary morphology with the 4-connected cross structuring element.
 * <p>
 * Repeating a cross dilation {@code n} times grows a region by every pixel within city-block distance
 * {@code n}, so both operations are computed in two passes with a city-block distance transform instead of
 * {@code n} full-image iterations. Erosion treats everything beyond the image border as background.
 */
public final class Morphology {

    private static final int FAR = Integer.MAX_VALUE / 2;

    private Morphology() {
    }

    /**
     * Dilates a binary mask.
     *
     * @param mask       row-major foreground flags.
     * @param rows       image height.
     * @param cols       image width.
     * @param iterations number of cross dilations; zero returns a copy.
     * @return the dilated mask.
     */
    public static boolean[] dilate(boolean[] mask, int rows, int cols, int iterations) {
        if (iterations <= 0) {
            return mask.clone();
        }
        int[] distance = distanceTo(mask, true, rows, cols, false);
        boolean[] out = new boolean[mask.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = distance[i] <= iterations;
        }
        return out;
    }

    /**
     * Erodes a binary mask; pixels outside the image count as background.
     *
     * @param mask       row-major foreground flags.
     * @param rows       image height.
     * @param cols       image width.
     * @param iterations number of cross erosions; zero returns a copy.
     * @return the eroded mask.
     */
    public static boolean[] erode(boolean[] mask, int rows, int cols, int iterations) {
        if (iterations <= 0) {
            return mask.clone();
        }
        int[] distance = distanceTo(mask, false, rows, cols, true);
        boolean[] out = new boolean[mask.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = distance[i] > iterations;
        }
        return out;
    }

    /**
     * City-block distance from every pixel to the nearest pixel whose flag equals {@code target}.
     *
     * @param borderIsTarget whether the area beyond the image edge counts as a target pixel.
     * @return per-pixel distances; pixels with no reachable target hold a large sentinel.
     */
    static int[] distanceTo(boolean[] mask, boolean target, int rows, int cols, boolean borderIsTarget) {
        int[] d = new int[mask.length];
        Arrays.fill(d, FAR);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int i = r * cols + c;
                if (mask[i] == target) {
                    d[i] = 0;
                } else if (borderIsTarget) {
                    d[i] = Math.min(Math.min(r + 1, rows - r), Math.min(c + 1, cols - c));
                }
            }
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int i = r * cols + c;
                if (r > 0) d[i] = Math.min(d[i], d[i - cols] + 1);
                if (c > 0) d[i] = Math.min(d[i], d[i - 1] + 1);
            }
        }
        for (int r = rows - 1; r >= 0; r--) {
            for (int c = cols - 1; c >= 0; c--) {
                int i = r * cols + c;
                if (r < rows - 1) d[i] = Math.min(d[i], d[i + cols] + 1);
                if (c < cols - 1) d[i] = Math.min(d[i], d[i + 1] + 1);
            }
        }
        return d;
    }
}
