package org.tessera.composite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.tessera.crs.CrsRegistry;
import org.tessera.scene.Scene;

/**
 * Orders the contributing scenes of a provenance map for band compositing, so colour balancing always has a
 * large, spatially coherent reference before peripheral scenes are matched against it.
 * <p>
 * The dominant scene is the first scene of the tile with the most contributed pixels. Scenes are sorted by
 * footprint-centre distance to the dominant scene (ascending), then tile identifier, contributed pixel
 * count and scene index (all descending). Scenes contributing nothing are dropped.
 */
public class VisitationOrder {

    private final CrsRegistry crsRegistry;
    private final boolean distanceOrdering;

    /**
     * @param crsRegistry      used to express footprint centres in the dominant scene's CRS.
     * @param distanceOrdering whether distance to the dominant scene is the primary key; when off every
     *                         distance counts as zero.
     */
    public VisitationOrder(CrsRegistry crsRegistry, boolean distanceOrdering) {
        this.crsRegistry = crsRegistry;
        this.distanceOrdering = distanceOrdering;
    }

    /**
     * Computes the order.
     *
     * @param result a finished provenance map.
     * @return 1-based scene indices in visiting order.
     */
    public IntList compute(ProvenanceResult result) {
        List<Scene> scenes = result.scenes();
        int[] counts = result.contributionCounts();

        Object2IntOpenHashMap<String> tileTotals = new Object2IntOpenHashMap<>();
        for (int n = 1; n <= scenes.size(); n++) {
            tileTotals.addTo(scenes.get(n - 1).tileId(), counts[n]);
        }

        int dominant = 0;
        int dominantTotal = -1;
        for (int n = 1; n <= scenes.size(); n++) {
            int total = tileTotals.getInt(scenes.get(n - 1).tileId());
            if (total > dominantTotal) {
                dominant = n;
                dominantTotal = total;
            }
        }

        List<Entry> entries = new ArrayList<>();
        for (int n = 1; n <= scenes.size(); n++) {
            if (counts[n] == 0) continue;
            double distance = distanceOrdering ? distance(scenes.get(n - 1), scenes.get(dominant - 1)) : 0.0;
            entries.add(new Entry(n, scenes.get(n - 1).tileId(), counts[n], distance));
        }
        entries.sort(Comparator.comparingDouble(Entry::distance)
            .thenComparing(Entry::tileId, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingInt(Entry::count).reversed())
            .thenComparing(Comparator.comparingInt(Entry::index).reversed()));

        IntList order = new IntArrayList(entries.size());
        for (Entry entry : entries) {
            order.add(entry.index());
        }
        return order;
    }

    private double distance(Scene scene, Scene dominant) {
        double[] centre = crsRegistry.transformPoint(
            scene.extent().centreX(), scene.extent().centreY(), scene.crs(), dominant.crs());
        double dx = centre[0] - dominant.extent().centreX();
        double dy = centre[1] - dominant.extent().centreY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    private record Entry(int index, String tileId, int count, double distance) {
    }
}
