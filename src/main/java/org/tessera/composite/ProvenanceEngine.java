package org.tessera.composite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.raster.ClassificationCode;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;
import org.tessera.raster.ResampledRaster;
import org.tessera.resample.IResampler;
import org.tessera.resample.ResampleMode;
import org.tessera.scene.Scene;
import org.tessera.scene.SceneReadException;

/**
 * Builds the classification mosaic and provenance map of one destination grid.
 * <p>
 * Scenes are visited strictly in order; every decision depends on the state left by earlier scenes, so
 * this step is sequential. Scenes whose classification cannot be read are logged and skipped.
 */
public class ProvenanceEngine {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceEngine.class);

    private final IResampler resampler;

    public ProvenanceEngine(IResampler resampler) {
        this.resampler = resampler;
    }

    /**
     * Builds the mosaic without cancellation support.
     *
     * @see #build(List, Grid, CompositingPolicy, boolean, BooleanSupplier)
     */
    public ProvenanceResult build(List<Scene> scenes, Grid grid, CompositingPolicy policy, boolean correctMask) {
        return build(scenes, grid, policy, correctMask, () -> false);
    }

    /**
     * Builds the mosaic.
     *
     * @param scenes      the scenes in visitation order; scene {@code n} (1-based) is recorded as {@code n}.
     * @param grid        the destination grid.
     * @param policy      the compositing policy.
     * @param correctMask whether to apply the mask improvement filter to each classification.
     * @param cancelled   polled before each scene.
     * @return the verified result; all zero when {@code scenes} is empty.
     * @throws CancellationException if {@code cancelled} reports true between scenes.
     */
    public ProvenanceResult build(List<Scene> scenes, Grid grid, CompositingPolicy policy, boolean correctMask,
                                  BooleanSupplier cancelled) {
        Objects.requireNonNull(policy, "policy");
        int[] classification = new int[grid.cellCount()];
        int[] provenance = new int[grid.cellCount()];
        List<SkippedScene> skipped = new ArrayList<>();

        for (int n = 1; n <= scenes.size(); n++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Mosaic build cancelled");
            }
            Scene scene = scenes.get(n - 1);
            ResampledRaster mask;
            try {
                mask = resampler.reproject(scene.readMask(correctMask), grid, ResampleMode.NEAREST);
            } catch (SceneReadException e) {
                log.warn("Skipping scene {}: {}", scene.id(), e.getMessage());
                skipped.add(new SkippedScene(scene.id(), "classification", e.getMessage()));
                continue;
            }

            int selected = addScene(n, mask, classification, provenance, policy, scenes.size());
            log.debug("Scene {}/{} {}: {} pixels selected", n, scenes.size(), scene.id(), selected);
        }

        ProvenanceResult result = new ProvenanceResult(
            new Raster(grid, classification), new Raster(grid, provenance), scenes, skipped);
        result.verify();
        return result;
    }

    private static int addScene(int n, ResampledRaster mask, int[] classification, int[] provenance,
                                CompositingPolicy policy, int sceneCount) {
        int[] codes = mask.raster().values();
        boolean[] good = new boolean[codes.length];
        int goodCount = 0;
        for (int i = 0; i < codes.length; i++) {
            if (mask.isValid(i) && ClassificationCode.isGood(codes[i])) {
                good[i] = true;
                goodCount++;
            }
        }

        boolean takeAllGood = switch (policy) {
            case MOST_RECENT -> true;
            case MOST_DISTANT -> false;
            case TEMP_HOMOGENEITY -> exceedsRepresentedMaximum(goodCount, codes, provenance, sceneCount);
        };

        int selected = 0;
        for (int i = 0; i < codes.length; i++) {
            if (good[i] && (takeAllGood || provenance[i] == 0)) {
                classification[i] = codes[i];
                provenance[i] = n;
                selected++;
            }
        }

        for (int i = 0; i < codes.length; i++) {
            if (!ClassificationCode.isGood(classification[i])) {
                provenance[i] = 0;
            }
        }
        return selected;
    }

    /**
     * Whether a scene's good-pixel count is larger than the pixel count of every scene already represented
     * inside this scene's footprint.
     */
    private static boolean exceedsRepresentedMaximum(int goodCount, int[] codes, int[] provenance, int sceneCount) {
        int[] counts = new int[sceneCount + 1];
        boolean any = false;
        for (int i = 0; i < codes.length; i++) {
            if (provenance[i] > 0 && codes[i] != ClassificationCode.NO_DATA.code()) {
                counts[provenance[i]]++;
                any = true;
            }
        }
        if (!any) {
            return false;
        }
        int max = 0;
        for (int count : counts) {
            max = Math.max(max, count);
        }
        return goodCount > max;
    }
}
