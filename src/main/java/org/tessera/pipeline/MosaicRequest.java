package org.tessera.pipeline;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import org.tessera.composite.ColourBalance;
import org.tessera.composite.CompositingPolicy;
import org.tessera.raster.Extent;

/**
 * Everything needed to build one mosaic product. Construction validates the request so configuration
 * errors surface before any scene is read.
 *
 * @param granules    level-2A granule directories to consider.
 * @param extent      the output tile in {@code crs} units.
 * @param crs         the output CRS, e.g. {@code EPSG:32736}.
 * @param resolution  10, 20 or 60 m, or 0 for all three.
 * @param start       first acquisition date to include, or {@code null}.
 * @param end         last acquisition date to include, or {@code null}.
 * @param policy      the compositing policy.
 * @param balance     the colour-balance mode.
 * @param correctMask whether classifications are mask-improved.
 * @param outputDir   the product directory.
 * @param outputName  the product file name prefix.
 * @param threads     band worker threads.
 */
public record MosaicRequest(
    List<Path> granules,
    Extent extent,
    String crs,
    int resolution,
    LocalDate start,
    LocalDate end,
    CompositingPolicy policy,
    ColourBalance balance,
    boolean correctMask,
    Path outputDir,
    String outputName,
    int threads) {

    public MosaicRequest {
        granules = List.copyOf(granules);
        Objects.requireNonNull(extent, "extent");
        Objects.requireNonNull(crs, "crs");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(balance, "balance");
        Objects.requireNonNull(outputDir, "outputDir");
        if (resolution != 0 && !SentinelBands.RESOLUTIONS.contains(resolution)) {
            throw new IllegalArgumentException("Resolution must be 0, 10, 20 or 60, got " + resolution);
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threads);
        }
        if (outputName == null || outputName.isBlank()) {
            throw new IllegalArgumentException("Output name must not be empty");
        }
    }

    /**
     * The same request over a different set of granules.
     */
    public MosaicRequest withGranules(List<Path> newGranules) {
        return new MosaicRequest(newGranules, extent, crs, resolution, start, end, policy, balance, correctMask,
            outputDir, outputName, threads);
    }

    public List<Integer> resolutions() {
        return SentinelBands.resolutions(resolution);
    }
}
