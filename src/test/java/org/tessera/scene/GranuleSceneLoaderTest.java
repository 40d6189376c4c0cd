package org.tessera.scene;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tessera.io.GeoTiffReader;
import org.tessera.mask.MaskFilterSettings;
import org.tessera.mask.MaskImprovementFilter;
import org.tessera.raster.Grid;
import org.tessera.raster.Raster;
import org.tessera.testutil.GranuleFixture;
import org.tessera.testutil.TestRasters;

@Tag("integration")
class GranuleSceneLoaderTest {

    @TempDir
    Path tempDir;

    private RasterCache cache;
    private GranuleSceneLoader loader;
    private Grid grid20;
    private Grid grid10;

    @BeforeEach
    void setUp() {
        cache = new RasterCache(1 << 20, Duration.ofMinutes(1));
        loader = new GranuleSceneLoader(new GeoTiffReader(),
            new MaskImprovementFilter(new MaskFilterSettings(20, 0, false, 0)), cache);
        grid20 = TestRasters.grid(3, 3, 20);
        grid10 = TestRasters.grid(6, 6, 10);
    }

    @Test
    @DisplayName("A granule loads as a scene whose bands and classification come from its GeoTIFFs")
    void loadsSceneFromDisk() throws IOException {
        Raster scl = TestRasters.raster(grid20, 4, 4, 4, 4, 9, 4, 4, 4, 4);
        Raster b02 = TestRasters.raster(grid20, 100, 200, 300, 400, 500, 600, 700, 800, 65535);
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20)
            .classification(scl)
            .band("B02", b02)
            .writeTo(tempDir);

        Scene scene = loader.load(dir, 20);

        assertThat(scene.id()).isEqualTo(dir.getFileName().toString());
        assertThat(scene.tileId()).isEqualTo("36KWA");
        assertThat(scene.acquisitionTime()).isEqualTo(Instant.parse("2018-01-05T07:51:09Z"));
        assertThat(scene.grid()).isEqualTo(grid20);
        assertThat(scene.readBand("B02")).isEqualTo(b02);
        assertThat(scene.readMask(false)).isEqualTo(scl);
    }

    @Test
    @DisplayName("The corrected classification is filtered once and cached separately from the raw one")
    void correctsAndCachesMask() throws IOException {
        Raster scl = TestRasters.raster(grid20, 4, 4, 4, 4, 9, 4, 4, 4, 4);
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20)
            .classification(scl)
            .writeTo(tempDir);
        Scene scene = loader.load(dir, 20);

        Raster corrected = scene.readMask(true);

        assertThat(corrected.values()).containsExactly(4, 9, 4, 9, 9, 9, 4, 9, 4);
        assertThat(scene.readMask(true)).isSameAs(corrected);
        assertThat(scene.readMask(false)).isEqualTo(scl);
        assertThat(cache.estimatedSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Spectral bands are read straight from disk and leave the classification cache untouched")
    void bandsBypassCache() throws IOException {
        Raster b02 = TestRasters.filled(grid20, 1200);
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20)
            .classification(TestRasters.filled(grid20, 4))
            .band("B02", b02)
            .writeTo(tempDir);
        Scene scene = loader.load(dir, 20);

        Raster first = scene.readBand("B02");
        Raster second = scene.readBand("B02");

        assertThat(first).isEqualTo(b02).isNotSameAs(second);
        assertThat(cache.estimatedSize()).isZero();

        scene.readMask(false);
        assertThat(cache.estimatedSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("A 10 m scene without a 10 m classification falls back to the 20 m one")
    void fallsBackToCoarserClassification() throws IOException {
        Raster scl = TestRasters.filled(grid20, 5);
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20)
            .geometry(grid10)
            .classification(scl)
            .band("B02", TestRasters.filled(grid10, 1000))
            .writeTo(tempDir);

        Scene scene = loader.load(dir, 10);

        assertThat(scene.grid()).isEqualTo(grid10);
        assertThat(scene.readMask(false).grid()).isEqualTo(grid20);
    }

    @Test
    void missingBandIsAReadError() throws IOException {
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20)
            .classification(TestRasters.filled(grid20, 4))
            .writeTo(tempDir);
        Scene scene = loader.load(dir, 20);

        assertThatThrownBy(() -> scene.readBand("B8A"))
            .isInstanceOf(SceneReadException.class)
            .hasMessageContaining("B8A");
    }

    @Test
    void missingClassificationIsAReadError() throws IOException {
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20)
            .band("B02", TestRasters.filled(grid20, 1))
            .writeTo(tempDir);
        Scene scene = loader.load(dir, 20);

        assertThatThrownBy(() -> scene.readMask(false))
            .isInstanceOf(SceneReadException.class)
            .hasMessageContaining("No classification");
    }

    @Test
    void resolutionWithoutGeometryCannotBeLoaded() throws IOException {
        Path dir = GranuleFixture.granule("36KWA", "2018-01-05T07:51:09Z", grid20).writeTo(tempDir);

        assertThatThrownBy(() -> loader.load(dir, 60)).isInstanceOf(SceneReadException.class);
    }
}
