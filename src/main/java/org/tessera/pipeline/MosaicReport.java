package org.tessera.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.tessera.composite.SkippedScene;
import org.tessera.io.AtomicFiles;

/**
 * Outcome of a mosaic run, one entry per processed resolution.
 *
 * @param outputName  the product name.
 * @param policy      the compositing policy used.
 * @param balance     the colour-balance mode used.
 * @param resolutions per-resolution outcome, in processing order.
 */
public record MosaicReport(String outputName, String policy, String balance, List<ResolutionReport> resolutions) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public MosaicReport {
        resolutions = List.copyOf(resolutions);
    }

    /**
     * Whether at least one resolution produced output.
     */
    public boolean hasOutput() {
        return resolutions.stream().anyMatch(r -> !r.skipped());
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static MosaicReport fromJson(String json) {
        return GSON.fromJson(json, MosaicReport.class);
    }

    public void writeJson(Path target) throws IOException {
        String json = toJson();
        AtomicFiles.write(target, file -> Files.writeString(file, json, StandardCharsets.UTF_8));
    }

    /**
     * Outcome of one resolution.
     *
     * @param resolution         the resolution in metres.
     * @param skipped            whether the resolution produced no output.
     * @param skipReason         why it was skipped, or {@code null}.
     * @param scenesSelected     scenes overlapping the tile and date window.
     * @param scenesContributing scenes that provide at least one pixel.
     * @param filledFraction     share of the tile filled with good pixels.
     * @param bandsWritten       bands written, in configuration order.
     * @param composites         visualization composites written.
     * @param skippedScenes      scenes left out because they could not be read.
     */
    public record ResolutionReport(
        int resolution,
        boolean skipped,
        String skipReason,
        int scenesSelected,
        int scenesContributing,
        double filledFraction,
        List<String> bandsWritten,
        List<String> composites,
        List<SkippedScene> skippedScenes) {

        public ResolutionReport {
            bandsWritten = List.copyOf(bandsWritten);
            composites = List.copyOf(composites);
            skippedScenes = List.copyOf(skippedScenes);
        }

        static ResolutionReport skipped(int resolution, String reason, List<SkippedScene> skippedScenes) {
            return new ResolutionReport(resolution, true, reason, 0, 0, 0.0, List.of(), List.of(), skippedScenes);
        }
    }
}
