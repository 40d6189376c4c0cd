package org.tessera.composite;

import java.util.List;

import org.tessera.raster.ClassificationCode;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;
import org.tessera.scene.Scene;

/**
 * Final classification mosaic and provenance map of one unit of work.
 * <p>
 * {@code provenance} holds 1-based indices into {@code scenes}; 0 marks an unfilled pixel. Both rasters are
 * read-only once built and are shared by every band compositor of the unit of work.
 *
 * @param classification the classification code taken from the providing scene, or 0 where unfilled.
 * @param provenance     the providing scene per pixel.
 * @param scenes         the scenes in the order they were visited.
 * @param skipped        scenes that could not be read.
 */
public record ProvenanceResult(Raster classification, Raster provenance, List<Scene> scenes, List<SkippedScene> skipped) {

    public ProvenanceResult {
        if (!classification.grid().equals(provenance.grid())) {
            throw new IllegalArgumentException("Classification and provenance must share a grid");
        }
        scenes = List.copyOf(scenes);
        skipped = List.copyOf(skipped);
    }

    public Grid grid() {
        return provenance.grid();
    }

    /**
     * Scene for a 1-based provenance index.
     */
    public Scene scene(int index) {
        return scenes.get(index - 1);
    }

    /**
     * Number of pixels each scene provides, indexed by provenance value; slot 0 counts unfilled pixels.
     */
    public int[] contributionCounts() {
        int[] counts = new int[scenes.size() + 1];
        for (int n : provenance.values()) {
            counts[n]++;
        }
        return counts;
    }

    public int filledCount() {
        return provenance.countNonZero();
    }

    public double filledFraction() {
        return (double) filledCount() / provenance.grid().cellCount();
    }

    /**
     * Checks that every provenance index names a scene and that filled and good pixels coincide.
     *
     * @throws IllegalStateException on the first violation.
     */
    public void verify() {
        int[] codes = classification.values();
        int[] sources = provenance.values();
        for (int i = 0; i < sources.length; i++) {
            int n = sources[i];
            if (n < 0 || n > scenes.size()) {
                throw new IllegalStateException(String.format(
                    "Pixel %d references scene %d but only %d scenes exist", i, n, scenes.size()));
            }
            if ((n != 0) != ClassificationCode.isGood(codes[i])) {
                throw new IllegalStateException(String.format(
                    "Pixel %d has provenance %d but classification %d", i, n, codes[i]));
            }
        }
    }
}
