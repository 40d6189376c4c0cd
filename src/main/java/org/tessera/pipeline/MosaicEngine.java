package org.tessera.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.composite.BandComposite;
import org.tessera.composite.BandCompositor;
import org.tessera.composite.ProvenanceEngine;
import org.tessera.composite.ProvenanceResult;
import org.tessera.composite.SkippedScene;
import org.tessera.composite.VisitationOrder;
import org.tessera.io.IRasterSink;
import org.tessera.io.OutputLayout;
import org.tessera.io.SampleType;
import org.tessera.raster.Grid;
import org.tessera.scene.GranuleSceneLoader;
import org.tessera.scene.Scene;
import org.tessera.scene.SceneReadException;
import org.tessera.scene.SceneSelector;
import org.tessera.pipeline.MosaicReport.ResolutionReport;

/**
 * Builds a mosaic product, one resolution at a time, coarsest first.
 * <p>
 * Per resolution: load and select scenes, build the provenance map sequentially, then composite every band
 * as an independent task on a fixed worker pool against the shared, read-only provenance map. A resolution
 * without overlapping scenes is skipped with a warning. {@link #cancel()} stops the run at the next scene
 * or band boundary.
 */
public class MosaicEngine {

    private static final Logger log = LoggerFactory.getLogger(MosaicEngine.class);

    private final GranuleSceneLoader sceneLoader;
    private final SceneSelector sceneSelector;
    private final ProvenanceEngine provenanceEngine;
    private final VisitationOrder visitationOrder;
    private final BandCompositor bandCompositor;
    private final IRasterSink sink;
    private final SentinelBands bands;

    private volatile boolean cancelled;

    public MosaicEngine(GranuleSceneLoader sceneLoader,
                        SceneSelector sceneSelector,
                        ProvenanceEngine provenanceEngine,
                        VisitationOrder visitationOrder,
                        BandCompositor bandCompositor,
                        IRasterSink sink,
                        SentinelBands bands) {
        this.sceneLoader = sceneLoader;
        this.sceneSelector = sceneSelector;
        this.provenanceEngine = provenanceEngine;
        this.visitationOrder = visitationOrder;
        this.bandCompositor = bandCompositor;
        this.sink = sink;
        this.bands = bands;
    }

    /**
     * Requests cancellation. The run stops before its next scene or band and {@link #run} throws
     * {@link CancellationException}.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Runs the request.
     *
     * @param request a validated request.
     * @return the per-resolution outcome; also written as JSON next to the product.
     * @throws IOException           if an output file cannot be written.
     * @throws CancellationException if {@link #cancel()} was called during the run.
     */
    public MosaicReport run(MosaicRequest request) throws IOException {
        OutputLayout layout = new OutputLayout(request.outputDir(), request.outputName());
        List<ResolutionReport> reports = new ArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(request.threads(), bandWorkerThreads());
        try {
            for (int resolution : request.resolutions()) {
                checkCancelled();
                reports.add(runResolution(request, resolution, layout, executor));
            }
        } finally {
            executor.shutdownNow();
        }

        MosaicReport report = new MosaicReport(
            request.outputName(), request.policy().name(), request.balance().name(), reports);
        report.writeJson(layout.reportPath());
        return report;
    }

    private ResolutionReport runResolution(MosaicRequest request, int resolution, OutputLayout layout,
                                           ExecutorService executor) throws IOException {
        Grid grid = Grid.of(request.extent(), resolution, request.crs());
        log.info("Resolution {} m: {}", resolution, grid);

        List<SkippedScene> skipped = new ArrayList<>();
        List<Scene> candidates = new ArrayList<>();
        for (Path granule : request.granules()) {
            try {
                candidates.add(sceneLoader.load(granule, resolution));
            } catch (SceneReadException e) {
                log.warn("Skipping granule {}: {}", granule.getFileName(), e.getMessage());
                skipped.add(new SkippedScene(granule.getFileName().toString(), "metadata", e.getMessage()));
            }
        }

        List<Scene> scenes = sceneSelector.select(candidates, grid, request.start(), request.end());
        if (scenes.isEmpty()) {
            log.warn("No data inside specified tile for resolution {} m. Skipping.", resolution);
            return ResolutionReport.skipped(resolution, "no scenes overlap the tile and date window", skipped);
        }
        log.info("Resolution {} m: {} of {} scenes selected", resolution, scenes.size(), candidates.size());

        ProvenanceResult provenance = provenanceEngine.build(
            scenes, grid, request.policy(), request.correctMask(), this::isCancelled);
        skipped.addAll(provenance.skipped());
        if (provenance.filledCount() == 0) {
            log.warn("Resolution {} m: no usable pixels in any selected scene", resolution);
        }
        sink.writeRaster(provenance.classification(), layout.classificationPath(resolution), SampleType.UINT8);
        sink.writeRaster(provenance.provenance(), layout.provenancePath(resolution), SampleType.UINT16);

        IntList order = visitationOrder.compute(provenance);
        Map<String, Future<BandComposite>> pending = new LinkedHashMap<>();
        for (String band : bands.bands(resolution)) {
            pending.put(band, executor.submit(() -> compositeBand(band, provenance, order, request, layout, resolution)));
        }

        List<String> written = new ArrayList<>();
        for (Map.Entry<String, Future<BandComposite>> entry : pending.entrySet()) {
            BandComposite composite = await(entry.getValue(), pending);
            skipped.addAll(composite.skipped());
            written.add(entry.getKey());
        }
        log.info("Resolution {} m: wrote bands {}", resolution, written);

        List<String> composites = new ArrayList<>();
        writeComposite("RGB", SentinelBands.trueColour(), written, resolution, layout, composites);
        writeComposite("NIR", SentinelBands.falseColour(resolution), written, resolution, layout, composites);

        return new ResolutionReport(resolution, false, null, scenes.size(), order.size(),
            provenance.filledFraction(), written, composites, skipped);
    }

    private BandComposite compositeBand(String band, ProvenanceResult provenance, IntList order,
                                        MosaicRequest request, OutputLayout layout, int resolution) throws IOException {
        checkCancelled();
        BandComposite composite = bandCompositor.composite(
            band, provenance, order, request.balance(), request.correctMask(), this::isCancelled);
        sink.writeRaster(composite.raster(), layout.bandPath(resolution, band), SampleType.UINT16);
        log.debug("Resolution {} m: band {} written", resolution, band);
        return composite;
    }

    private void writeComposite(String name, List<String> compositeBands, List<String> written, int resolution,
                                OutputLayout layout, List<String> composites) throws IOException {
        if (!written.containsAll(compositeBands)) {
            log.debug("Resolution {} m: {} composite needs {}, skipped", resolution, name, compositeBands);
            return;
        }
        List<Path> paths = compositeBands.stream().map(b -> layout.bandPath(resolution, b)).toList();
        sink.writeVisualizationComposite(paths, layout.compositePath(resolution, name));
        composites.add(name);
    }

    private static BandComposite await(Future<BandComposite> future, Map<String, Future<BandComposite>> all)
            throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.values().forEach(f -> f.cancel(true));
            throw new CancellationException("Interrupted while waiting for band tasks");
        } catch (ExecutionException e) {
            all.values().forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) throw io;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Band task failed", cause);
        }
    }

    private void checkCancelled() {
        if (cancelled) {
            throw new CancellationException("Mosaic build cancelled");
        }
    }

    private static ThreadFactory bandWorkerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "band-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
