package org.tessera.composite;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import it.unimi.dsi.fastutil.ints.IntList;
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
 * Assembles one output band from a finished provenance map.
 * <p>
 * Each pixel is written only from the scene its provenance names. With colour balancing enabled, every
 * scene after the first one to contribute data is adjusted against the output composited so far, based on
 * how much of its good area overlaps that output:
 * <ul>
 *   <li>at most {@code minOverlap}: added unchanged;</li>
 *   <li>up to {@code histogramOverlap}, {@link ColourBalance#AGGRESSIVE} only: scaled by the ratio of the
 *       overlap means, leaving water untouched;</li>
 *   <li>above {@code histogramOverlap}: histogram matched to the existing output.</li>
 * </ul>
 * Instances hold no per-band state and can composite different bands concurrently.
 */
public class BandCompositor {

    private static final Logger log = LoggerFactory.getLogger(BandCompositor.class);

    private final IResampler resampler;
    private final ResampleMode bandResampling;
    private final BalanceSettings balanceSettings;

    public BandCompositor(IResampler resampler, ResampleMode bandResampling, BalanceSettings balanceSettings) {
        this.resampler = resampler;
        this.bandResampling = bandResampling;
        this.balanceSettings = balanceSettings;
    }

    /**
     * Composites a band.
     *
     * @param band        the band identifier.
     * @param provenance  the finished provenance map.
     * @param order       1-based scene indices in visiting order.
     * @param balance     the colour-balance mode.
     * @param correctMask whether classifications used for balancing are mask-improved, as during provenance.
     * @param cancelled   polled before each scene.
     * @return the band mosaic.
     * @throws CancellationException if {@code cancelled} reports true between scenes.
     */
    public BandComposite composite(String band, ProvenanceResult provenance, IntList order, ColourBalance balance,
                                   boolean correctMask, BooleanSupplier cancelled) {
        Grid grid = provenance.grid();
        int[] sources = provenance.provenance().values();
        int[] out = new int[grid.cellCount()];
        boolean hasData = false;
        List<SkippedScene> skipped = new ArrayList<>();

        for (int k = 0; k < order.size(); k++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Band " + band + " cancelled");
            }
            int n = order.getInt(k);
            Scene scene = provenance.scene(n);
            try {
                int[] data = resampler.reproject(scene.readBand(band), grid, bandResampling).raster().values();
                if (balance != ColourBalance.NONE && hasData) {
                    data = balance(band, scene, data, out, grid, balance, correctMask);
                }
                for (int i = 0; i < sources.length; i++) {
                    if (sources[i] == n) {
                        out[i] = data[i];
                        hasData |= data[i] != 0;
                    }
                }
            } catch (SceneReadException e) {
                log.warn("Skipping scene {} for band {}: {}", scene.id(), band, e.getMessage());
                skipped.add(new SkippedScene(scene.id(), band, e.getMessage()));
            }
        }
        return new BandComposite(band, new Raster(grid, out), skipped);
    }

    private int[] balance(String band, Scene scene, int[] data, int[] out, Grid grid, ColourBalance balance,
                          boolean correctMask) throws SceneReadException {
        ResampledRaster mask = resampler.reproject(scene.readMask(correctMask), grid, ResampleMode.NEAREST);
        int[] codes = mask.raster().values();

        BitSet good = new BitSet(codes.length);
        BitSet overlap = new BitSet(codes.length);
        for (int i = 0; i < codes.length; i++) {
            if (mask.isValid(i) && ClassificationCode.isGood(codes[i])) {
                good.set(i);
                if (out[i] != 0) overlap.set(i);
            }
        }
        int goodCount = good.cardinality();
        double fraction = goodCount == 0 ? 0.0 : (double) overlap.cardinality() / goodCount;

        if (fraction > balanceSettings.histogramOverlap()) {
            log.debug("Band {}, scene {}: histogram matching ({}% overlap)", band, scene.id(), percent(fraction));
            BitSet filled = new BitSet(out.length);
            for (int i = 0; i < out.length; i++) {
                if (out[i] != 0) filled.set(i);
            }
            return HistogramMatcher.match(data, good, out, filled);
        }
        if (balance == ColourBalance.AGGRESSIVE && fraction > balanceSettings.minOverlap()) {
            double gain = gain(data, out, overlap);
            if (gain > 0) {
                log.debug("Band {}, scene {}: gain {} ({}% overlap)", band, scene.id(), gain, percent(fraction));
                return applyGain(data, codes, good, gain);
            }
        }
        log.debug("Band {}, scene {}: no correction ({}% overlap)", band, scene.id(), percent(fraction));
        return data;
    }

    /** Ratio of mean output to mean scene value over the overlap, or 0 when undefined. */
    static double gain(int[] data, int[] out, BitSet overlap) {
        double sumOut = 0;
        double sumData = 0;
        for (int i = overlap.nextSetBit(0); i >= 0; i = overlap.nextSetBit(i + 1)) {
            sumOut += out[i];
            sumData += data[i];
        }
        return sumData == 0 ? 0.0 : sumOut / sumData;
    }

    private static int[] applyGain(int[] data, int[] codes, BitSet good, double gain) {
        int[] adjusted = data.clone();
        for (int i = good.nextSetBit(0); i >= 0; i = good.nextSetBit(i + 1)) {
            if (codes[i] != ClassificationCode.WATER.code()) {
                adjusted[i] = (int) Math.round(data[i] * gain);
            }
        }
        return adjusted;
    }

    private static long percent(double fraction) {
        return Math.round(fraction * 100);
    }
}
