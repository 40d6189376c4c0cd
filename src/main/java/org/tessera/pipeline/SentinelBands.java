package org.tessera.pipeline;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.typesafe.config.Config;

/**
 * Spectral bands composited at each output resolution, and the bands behind the visualization composites.
 */
public class SentinelBands {

    /** Supported output resolutions in metres, coarsest first. */
    public static final List<Integer> RESOLUTIONS = List.of(60, 20, 10);

    public static final SentinelBands DEFAULTS = new SentinelBands(Map.of(
        60, List.of("B01", "B02", "B03", "B04", "B05", "B06", "B07", "B8A", "B09", "B11", "B12"),
        20, List.of("B02", "B03", "B04", "B05", "B06", "B07", "B8A", "B11", "B12"),
        10, List.of("B02", "B03", "B04", "B08")));

    private final Map<Integer, List<String>> bands;

    public SentinelBands(Map<Integer, List<String>> bands) {
        TreeMap<Integer, List<String>> copy = new TreeMap<>();
        bands.forEach((res, list) -> copy.put(res, List.copyOf(list)));
        this.bands = copy;
    }

    /**
     * Reads band lists from a configuration block keyed by resolution, e.g. {@code "20" = [B02, B03]}.
     */
    public static SentinelBands fromConfig(Config config) {
        Map<Integer, List<String>> bands = new TreeMap<>();
        for (int resolution : RESOLUTIONS) {
            String key = "\"" + resolution + "\"";
            if (config.hasPath(key)) {
                bands.put(resolution, config.getStringList(key));
            }
        }
        return new SentinelBands(bands);
    }

    /**
     * Bands composited at a resolution.
     *
     * @throws IllegalArgumentException if the resolution has no band list.
     */
    public List<String> bands(int resolution) {
        List<String> list = bands.get(resolution);
        if (list == null) {
            throw new IllegalArgumentException("No bands configured for resolution " + resolution + " m");
        }
        return list;
    }

    /**
     * Expands a requested resolution into the resolutions to process: {@code 0} means all, coarsest first.
     */
    public static List<Integer> resolutions(int requested) {
        return requested == 0 ? RESOLUTIONS : List.of(requested);
    }

    /** Red, green, blue bands of the true-colour composite. */
    public static List<String> trueColour() {
        return List.of("B04", "B03", "B02");
    }

    /** Near-infrared false-colour composite; 10 m products use B08, coarser ones B8A. */
    public static List<String> falseColour(int resolution) {
        return List.of(resolution == 10 ? "B08" : "B8A", "B04", "B03");
    }
}
