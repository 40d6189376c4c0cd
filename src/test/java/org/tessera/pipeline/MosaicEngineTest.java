package org.tessera.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tessera.composite.BalanceSettings;
import org.tessera.composite.BandCompositor;
import org.tessera.composite.ColourBalance;
import org.tessera.composite.CompositingPolicy;
import org.tessera.composite.ProvenanceEngine;
import org.tessera.composite.VisitationOrder;
import org.tessera.io.GeoTiffReader;
import org.tessera.io.IRasterSink;
import org.tessera.io.OutputLayout;
import org.tessera.io.SampleType;
import org.tessera.junit.extensions.logging.ExpectLog;
import org.tessera.junit.extensions.logging.LogLevel;
import org.tessera.junit.extensions.logging.LogWatchExtension;
import org.tessera.pipeline.MosaicReport.ResolutionReport;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;
import org.tessera.resample.ProjectiveResampler;
import org.tessera.resample.ResampleMode;
import org.tessera.testutil.GranuleFixture;
import org.tessera.testutil.TestRasters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
class MosaicEngineTest {

    @TempDir
    Path tempDir;

    @Mock
    IRasterSink sink;

    private final Grid grid = TestRasters.grid(4, 4, 20);
    private Path outputDir;
    private Path january5;
    private Path january10;

    @BeforeEach
    void setUp() throws IOException {
        Path granules = Files.createDirectories(tempDir.resolve("granules"));
        outputDir = tempDir.resolve("out");

        // Clear in the top half on the 5th and in the bottom half on the 10th.
        january5 = granuleWithValue("2018-01-05T07:51:09Z", TestRasters.prefix(grid, 8, 4, 9), 100).writeTo(granules);
        january10 = granuleWithValue("2018-01-10T07:51:09Z", TestRasters.prefix(grid, 8, 9, 5), 200).writeTo(granules);
    }

    @Test
    @DisplayName("A run writes classification, provenance, bands, composites and a report")
    void writesCompleteProduct() throws IOException {
        MosaicEngine engine = factory().createEngine();

        MosaicReport report = engine.run(request(List.of(january5, january10), null, null));

        OutputLayout layout = new OutputLayout(outputDir, "mosaic");
        GeoTiffReader reader = new GeoTiffReader();
        Raster scl = reader.read(layout.classificationPath(20));
        assertThat(scl.values()).containsExactly(4, 4, 4, 4, 4, 4, 4, 4, 5, 5, 5, 5, 5, 5, 5, 5);
        assertThat(reader.read(layout.provenancePath(20)).countNonZero()).isEqualTo(16);
        Raster blue = reader.read(layout.bandPath(20, "B02"));
        assertThat(blue.get(0, 0)).isEqualTo(100);
        assertThat(blue.get(3, 3)).isEqualTo(200);
        assertThat(blue.grid().extent()).isEqualTo(grid.extent());
        assertThat(layout.bandPath(20, "B8A")).exists();
        assertThat(layout.compositePath(20, "RGB")).exists();
        assertThat(layout.compositePath(20, "NIR")).exists();
        assertThat(outputDir.resolve("mosaic_R20m_RGB.png")).exists();

        ResolutionReport r20 = report.resolutions().get(0);
        assertThat(report.resolutions()).hasSize(1);
        assertThat(r20.skipped()).isFalse();
        assertThat(r20.scenesSelected()).isEqualTo(2);
        assertThat(r20.scenesContributing()).isEqualTo(2);
        assertThat(r20.filledFraction()).isEqualTo(1.0);
        assertThat(r20.bandsWritten()).containsExactly("B02", "B03", "B04", "B8A");
        assertThat(r20.composites()).containsExactly("RGB", "NIR");
        assertThat(MosaicReport.fromJson(Files.readString(layout.reportPath()))).isEqualTo(report);
    }

    @Test
    @DisplayName("The date window drops scenes outside it")
    void dateWindowLimitsScenes() throws IOException {
        MosaicEngine engine = factory().createEngine();

        MosaicReport report = engine.run(
            request(List.of(january5, january10), LocalDate.of(2018, 1, 1), LocalDate.of(2018, 1, 6)));

        ResolutionReport r20 = report.resolutions().get(0);
        assertThat(r20.scenesSelected()).isEqualTo(1);
        assertThat(r20.filledFraction()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("A tile outside every scene footprint is skipped, not failed")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No data inside specified tile for resolution 20 m\\. Skipping\\.")
    void tileWithoutDataIsSkipped() throws IOException {
        MosaicEngine engine = factory().createEngine();
        MosaicRequest faraway = new MosaicRequest(List.of(january5, january10),
            TestRasters.grid(TestRasters.ORIGIN_X + 100_000, TestRasters.ORIGIN_Y, 4, 4, 20).extent(),
            TestRasters.CRS, 20, null, null, CompositingPolicy.MOST_RECENT, ColourBalance.NONE, false,
            outputDir, "mosaic", 2);

        MosaicReport report = engine.run(faraway);

        assertThat(report.hasOutput()).isFalse();
        assertThat(report.resolutions().get(0).skipped()).isTrue();
        assertThat(new OutputLayout(outputDir, "mosaic").classificationPath(20)).doesNotExist();
        assertThat(outputDir.resolve("mosaic_report.json")).exists();
    }

    @Test
    @DisplayName("Composites are requested only when all of their bands were written")
    void compositesNeedAllTheirBands() throws IOException {
        MosaicEngineFactory factory = new MosaicEngineFactory(config("[B02, B03, B04]"));
        ProjectiveResampler resampler = new ProjectiveResampler(factory.crsRegistry());
        MosaicEngine engine = new MosaicEngine(
            factory.sceneLoader(),
            factory.sceneSelector(),
            new ProvenanceEngine(resampler),
            new VisitationOrder(factory.crsRegistry(), true),
            new BandCompositor(resampler, ResampleMode.NEAREST, new BalanceSettings(0.02, 0.5)),
            sink,
            factory.bands());

        engine.run(request(List.of(january5, january10), null, null));

        OutputLayout layout = new OutputLayout(outputDir, "mosaic");
        verify(sink).writeRaster(any(Raster.class), eq(layout.classificationPath(20)), eq(SampleType.UINT8));
        verify(sink).writeRaster(any(Raster.class), eq(layout.provenancePath(20)), eq(SampleType.UINT16));
        verify(sink).writeRaster(any(Raster.class), eq(layout.bandPath(20, "B04")), eq(SampleType.UINT16));
        verify(sink).writeVisualizationComposite(
            eq(List.of(layout.bandPath(20, "B04"), layout.bandPath(20, "B03"), layout.bandPath(20, "B02"))),
            eq(layout.compositePath(20, "RGB")));
        verify(sink, never()).writeVisualizationComposite(any(), eq(layout.compositePath(20, "NIR")));
    }

    @Test
    @DisplayName("A cancelled engine stops before writing anything")
    void cancelledEngineStops() {
        MosaicEngine engine = factory().createEngine();
        engine.cancel();

        assertThat(engine.isCancelled()).isTrue();
        assertThatThrownBy(() -> engine.run(request(List.of(january5, january10), null, null)))
            .isInstanceOf(CancellationException.class);
        assertThat(outputDir.resolve("mosaic_report.json")).doesNotExist();
    }

    private MosaicEngineFactory factory() {
        return new MosaicEngineFactory(config("[B02, B03, B04, B8A]"));
    }

    private static Config config(String bands20) {
        return ConfigFactory.parseString("bands { \"20\" = " + bands20 + " }")
            .withFallback(ConfigFactory.defaultReference())
            .resolve();
    }

    private MosaicRequest request(List<Path> granules, LocalDate start, LocalDate end) {
        return new MosaicRequest(granules, grid.extent(), TestRasters.CRS, 20, start, end,
            CompositingPolicy.MOST_RECENT, ColourBalance.NONE, false, outputDir, "mosaic", 2);
    }

    private GranuleFixture granuleWithValue(String time, Raster scl, int value) {
        GranuleFixture fixture = GranuleFixture.granule("36KWA", time, grid).classification(scl);
        for (String band : List.of("B02", "B03", "B04", "B8A")) {
            fixture.band(band, TestRasters.filled(grid, value));
        }
        return fixture;
    }
}
