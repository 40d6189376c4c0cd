package org.tessera.scene;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tessera.crs.CrsRegistry;
import org.tessera.raster.Extent;
import org.tessera.raster.Grid;
import org.tessera.testutil.InMemorySceneSource;
import org.tessera.testutil.TestRasters;

@Tag("unit")
class SceneSelectorTest {

    private SceneSelector selector;
    private Grid destination;

    @BeforeEach
    void setUp() {
        selector = new SceneSelector(new CrsRegistry());
        destination = TestRasters.grid(10, 10, 20);
    }

    @Test
    @DisplayName("An empty candidate list selects nothing")
    void emptyCandidates() {
        assertThat(selector.select(List.of(), destination, null, null)).isEmpty();
        assertThat(selector.select(List.of(), destination, LocalDate.of(2018, 1, 1), LocalDate.of(2018, 12, 31)))
            .isEmpty();
    }

    @Test
    @DisplayName("Scenes are ordered by tile, then acquisition time")
    void ordersByTileThenTime() {
        Scene lateA = scene("late-a", "36KWA", "2018-03-01T08:00:00Z", destination);
        Scene earlyB = scene("early-b", "36KWB", "2018-01-01T08:00:00Z", destination);
        Scene earlyA = scene("early-a", "36KWA", "2018-01-01T08:00:00Z", destination);

        List<Scene> selected = selector.select(List.of(lateA, earlyB, earlyA), destination, null, null);

        assertThat(selected).extracting(Scene::id).containsExactly("early-a", "late-a", "early-b");
    }

    @Test
    @DisplayName("Date bounds are inclusive and compared by UTC calendar date")
    void filtersByDateWindow() {
        Scene before = scene("before", "36KWA", "2017-12-31T23:59:59Z", destination);
        Scene first = scene("first", "36KWA", "2018-01-01T00:00:00Z", destination);
        Scene last = scene("last", "36KWA", "2018-01-31T23:00:00Z", destination);
        Scene after = scene("after", "36KWA", "2018-02-01T00:00:00Z", destination);

        List<Scene> selected = selector.select(List.of(before, first, last, after), destination,
            LocalDate.of(2018, 1, 1), LocalDate.of(2018, 1, 31));

        assertThat(selected).extracting(Scene::id).containsExactly("first", "last");
    }

    @Test
    void missingBoundsAreOpen() {
        Scene scene = scene("any", "36KWA", "2016-06-01T08:00:00Z", destination);

        assertThat(SceneSelector.inWindow(scene, null, null)).isTrue();
        assertThat(SceneSelector.inWindow(scene, LocalDate.of(2016, 6, 1), null)).isTrue();
        assertThat(SceneSelector.inWindow(scene, null, LocalDate.of(2016, 5, 31))).isFalse();
    }

    @Test
    @DisplayName("Scenes whose footprint misses the tile are excluded")
    void excludesDisjointFootprints() {
        Grid far = TestRasters.grid(TestRasters.ORIGIN_X + 10000, TestRasters.ORIGIN_Y, 10, 10, 20);
        Scene inside = scene("inside", "36KWA", "2018-01-05T08:00:00Z", destination);
        Scene outside = scene("outside", "36KWA", "2018-01-05T08:00:00Z", far);

        assertThat(selector.select(List.of(inside, outside), destination, null, null))
            .extracting(Scene::id).containsExactly("inside");
    }

    @Test
    @DisplayName("Footprints in another CRS are transformed before the overlap test")
    void overlapAcrossCoordinateSystems() {
        Grid tile = Grid.of(new Extent(490000, 7770000, 510000, 7800000), 60, "EPSG:32736");
        Grid nearby = Grid.of(new Extent(32.9, -20.1, 33.1, -19.9), 0.01, "EPSG:4326");
        Grid elsewhere = Grid.of(new Extent(20.0, -30.1, 20.2, -29.9), 0.01, "EPSG:4326");

        assertThat(selector.overlaps(scene("nearby", "36KWA", "2018-01-05T08:00:00Z", nearby), tile)).isTrue();
        assertThat(selector.overlaps(scene("elsewhere", "34JBM", "2018-01-05T08:00:00Z", elsewhere), tile)).isFalse();
    }

    private static Scene scene(String id, String tileId, String time, Grid grid) {
        return new Scene(id, tileId, Instant.parse(time), grid, 0.1,
            new InMemorySceneSource(TestRasters.filled(grid, 4), Map.of()));
    }
}
