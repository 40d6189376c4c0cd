package org.tessera.pipeline;

import java.util.Locale;

import com.typesafe.config.Config;
import org.tessera.composite.BalanceSettings;
import org.tessera.composite.BandCompositor;
import org.tessera.composite.ProvenanceEngine;
import org.tessera.composite.VisitationOrder;
import org.tessera.crs.CrsRegistry;
import org.tessera.io.Compression;
import org.tessera.io.GeoTiffRasterSink;
import org.tessera.io.GeoTiffReader;
import org.tessera.io.GeoTiffWriter;
import org.tessera.mask.MaskFilterSettings;
import org.tessera.mask.MaskImprovementFilter;
import org.tessera.resample.IResampler;
import org.tessera.resample.ProjectiveResampler;
import org.tessera.resample.ResampleMode;
import org.tessera.scene.GranuleSceneLoader;
import org.tessera.scene.RasterCache;
import org.tessera.scene.SceneSelector;

/**
 * Wires the mosaic components from the application configuration.
 */
public class MosaicEngineFactory {

    private final Config config;
    private final CrsRegistry crsRegistry = new CrsRegistry();
    private final GeoTiffReader reader = new GeoTiffReader();
    private final IResampler resampler = new ProjectiveResampler(crsRegistry);

    public MosaicEngineFactory(Config config) {
        this.config = config;
    }

    public CrsRegistry crsRegistry() {
        return crsRegistry;
    }

    public GranuleSceneLoader sceneLoader() {
        MaskImprovementFilter filter = new MaskImprovementFilter(MaskFilterSettings.fromConfig(config.getConfig("mask")));
        return new GranuleSceneLoader(reader, filter, RasterCache.fromConfig(config.getConfig("scenes.cache")));
    }

    public SceneSelector sceneSelector() {
        return new SceneSelector(crsRegistry);
    }

    public SentinelBands bands() {
        return SentinelBands.fromConfig(config.getConfig("bands"));
    }

    /**
     * Creates an engine; each engine owns its cancellation state, so create one per run.
     */
    public MosaicEngine createEngine() {
        ResampleMode bandResampling = ResampleMode.valueOf(
            config.getString("mosaic.band-resampling").toUpperCase(Locale.ROOT));
        Compression compression = Compression.valueOf(config.getString("output.compression").toUpperCase(Locale.ROOT));
        return new MosaicEngine(
            sceneLoader(),
            sceneSelector(),
            new ProvenanceEngine(resampler),
            new VisitationOrder(crsRegistry, config.getBoolean("mosaic.distance-ordering")),
            new BandCompositor(resampler, bandResampling, BalanceSettings.fromConfig(config.getConfig("colour-balance"))),
            new GeoTiffRasterSink(new GeoTiffWriter(compression), reader, config.getBoolean("output.quick-look")),
            bands());
    }
}
