package org.tessera.scene;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.crs.CrsRegistry;
import org.tessera.raster.Extent;
import org.tessera.raster.Grid;

/**
 * Filters candidate scenes by footprint overlap with a destination grid and by acquisition date, and
 * orders the survivors for compositing.
 */
public class SceneSelector {

    private static final Logger log = LoggerFactory.getLogger(SceneSelector.class);

    /** Tile identifier first, so repeat passes over one footprint are adjacent, then acquisition time. */
    public static final Comparator<Scene> PROCESSING_ORDER = Comparator
        .comparing(Scene::tileId)
        .thenComparing(Scene::acquisitionTime);

    private final CrsRegistry crsRegistry;

    public SceneSelector(CrsRegistry crsRegistry) {
        this.crsRegistry = crsRegistry;
    }

    /**
     * Selects and orders scenes.
     *
     * @param candidates  the scenes to consider; may be empty.
     * @param destination the destination grid.
     * @param start       first acquisition date to include, or {@code null} for no lower bound.
     * @param end         last acquisition date to include, or {@code null} for no upper bound.
     * @return the overlapping scenes inside the date window in {@link #PROCESSING_ORDER}; empty when none match.
     */
    public List<Scene> select(List<Scene> candidates, Grid destination, LocalDate start, LocalDate end) {
        List<Scene> selected = new ArrayList<>();
        for (Scene scene : candidates) {
            if (!inWindow(scene, start, end)) {
                log.debug("Excluding {}: acquired outside {} .. {}", scene.id(), start, end);
                continue;
            }
            if (!overlaps(scene, destination)) {
                log.debug("Excluding {}: footprint does not overlap {}", scene.id(), destination);
                continue;
            }
            selected.add(scene);
        }
        selected.sort(PROCESSING_ORDER);
        return selected;
    }

    /**
     * Tests footprint overlap by transforming the scene's corners into the destination CRS.
     */
    public boolean overlaps(Scene scene, Grid destination) {
        Extent footprint = crsRegistry.transformExtent(scene.extent(), scene.crs(), destination.crs());
        return footprint.intersects(destination.extent());
    }

    static boolean inWindow(Scene scene, LocalDate start, LocalDate end) {
        LocalDate date = scene.acquisitionDate();
        if (start != null && date.isBefore(start)) return false;
        return end == null || !date.isAfter(end);
    }
}
