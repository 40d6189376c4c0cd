package org.tessera.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.cli.CommandLineInterface;
import org.tessera.composite.ColourBalance;
import org.tessera.composite.CompositingPolicy;
import org.tessera.crs.CrsRegistry;
import org.tessera.pipeline.MosaicEngine;
import org.tessera.pipeline.MosaicEngineFactory;
import org.tessera.pipeline.MosaicReport;
import org.tessera.pipeline.MosaicReport.ResolutionReport;
import org.tessera.pipeline.MosaicRequest;
import org.tessera.raster.Extent;
import org.tessera.scene.SceneCatalog;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that builds a mosaic product from level-2A granules over one output tile.
 * <p>
 * Option values override the {@code mosaic} configuration block for this run.
 */
@Command(
    name = "mosaic",
    description = "Build a cloud-free mosaic of level-2A scenes over one output tile"
)
public class MosaicCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MosaicCommand.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    @Parameters(
        paramLabel = "PATH",
        arity = "0..*",
        description = "Granule directories, .SAFE products, directories containing them, or text files listing them (default: working directory)"
    )
    private List<Path> inputs;

    @Option(
        names = {"-te", "--target-extent"},
        arity = "4",
        required = true,
        paramLabel = "COORD",
        description = "Output tile extent: XMIN YMIN XMAX YMAX in the output CRS"
    )
    private double[] targetExtent;

    @Option(
        names = {"-e", "--epsg"},
        required = true,
        description = "EPSG code of the output CRS"
    )
    private int epsg;

    @Option(
        names = {"-r", "--resolution"},
        defaultValue = "0",
        description = "Output resolution in metres: 10, 20 or 60; 0 builds all three (default: ${DEFAULT-VALUE})"
    )
    private int resolution;

    @Option(
        names = {"-st", "--start"},
        paramLabel = "YYYYMMDD",
        description = "First acquisition date to include (default: mosaic.start-date)"
    )
    private String start;

    @Option(
        names = {"-en", "--end"},
        paramLabel = "YYYYMMDD",
        description = "Last acquisition date to include (default: today)"
    )
    private String end;

    @Option(
        names = {"-a", "--algorithm"},
        description = "Compositing policy: MOST_RECENT, MOST_DISTANT or TEMP_HOMOGENEITY (default: mosaic.algorithm)"
    )
    private String algorithm;

    @Option(
        names = {"-b", "--balance"},
        description = "Colour balancing: none, basic or aggressive (default: mosaic.colour-balance)"
    )
    private String balance;

    @Option(
        names = {"-m", "--correct-mask"},
        description = "Improve cloud masks before compositing (default: mosaic.correct-mask)"
    )
    private Boolean correctMask;

    @Option(
        names = {"-o", "--output-dir"},
        defaultValue = ".",
        description = "Output directory (default: working directory)"
    )
    private Path outputDir;

    @Option(
        names = {"-n", "--output-name"},
        description = "Output file name prefix (default: mosaic.output-name)"
    )
    private String outputName;

    @Option(
        names = {"-p", "--processes"},
        description = "Band worker threads (default: mosaic.threads)"
    )
    private Integer threads;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        MosaicRequest request;
        MosaicEngineFactory factory;
        try {
            Config config = parent.getConfig();
            factory = new MosaicEngineFactory(config);
            request = buildRequest(config, factory.crsRegistry());
            List<Path> granules = SceneCatalog.findGranules(effectiveInputs(), "L2A");
            if (granules.isEmpty()) {
                err.println("Error: No level-2A granules found in " + effectiveInputs());
                return 1;
            }
            request = request.withGranules(granules);
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.printf("Building mosaic '%s' from %d granules (%s, colour balance %s)%n",
            request.outputName(), request.granules().size(), request.policy(),
            request.balance().name().toLowerCase());

        MosaicEngine engine = factory.createEngine();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = shutdownHook(engine, finished, SHUTDOWN_WAIT);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            MosaicReport report = engine.run(request);
            printReport(report, out);
            return 0;
        } catch (CancellationException e) {
            err.println("Mosaic cancelled.");
            return 1;
        } catch (Exception e) {
            log.error("Mosaic failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Creates a hook that cancels the engine and holds JVM exit until the run has stopped at its next
     * scene or band boundary, or the wait has elapsed.
     */
    static Thread shutdownHook(MosaicEngine engine, CountDownLatch finished, Duration wait) {
        return new Thread(() -> {
            engine.cancel();
            try {
                if (!finished.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Mosaic did not stop within {}, exiting anyway", wait);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "mosaic-shutdown-hook");
    }

    MosaicRequest buildRequest(Config config, CrsRegistry crsRegistry) {
        Extent extent = Extent.of(targetExtent);
        String crs = CrsRegistry.epsgCode(epsg);
        if (!crsRegistry.isKnown(crs)) {
            throw new IllegalArgumentException("Unknown EPSG code: " + epsg);
        }
        Config mosaic = config.getConfig("mosaic");
        LocalDate startDate = start != null
            ? parseDate(start, "--start")
            : LocalDate.parse(mosaic.getString("start-date"));
        LocalDate endDate = end != null ? parseDate(end, "--end") : LocalDate.now();

        return new MosaicRequest(
            List.of(),
            extent,
            crs,
            resolution,
            startDate,
            endDate,
            CompositingPolicy.fromName(algorithm != null ? algorithm : mosaic.getString("algorithm")),
            ColourBalance.fromName(balance != null ? balance : mosaic.getString("colour-balance")),
            correctMask != null ? correctMask : mosaic.getBoolean("correct-mask"),
            outputDir,
            outputName != null ? outputName : mosaic.getString("output-name"),
            threads != null ? threads : mosaic.getInt("threads"));
    }

    private List<Path> effectiveInputs() {
        return inputs == null || inputs.isEmpty() ? List.of(Path.of(".")) : inputs;
    }

    static LocalDate parseDate(String value, String option) {
        try {
            return LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(option + " must be a date in YYYYMMDD format, got '" + value + "'", e);
        }
    }

    private static void printReport(MosaicReport report, PrintWriter out) {
        out.println();
        out.println("=== Summary ===");
        for (ResolutionReport r : report.resolutions()) {
            if (r.skipped()) {
                out.printf("R%dm: skipped (%s)%n", r.resolution(), r.skipReason());
                continue;
            }
            out.printf("R%dm: %.1f%% filled from %d of %d scenes%n",
                r.resolution(), r.filledFraction() * 100, r.scenesContributing(), r.scenesSelected());
            out.printf("      bands: %s%n", String.join(" ", r.bandsWritten()));
            if (!r.composites().isEmpty()) {
                out.printf("      composites: %s%n", String.join(" ", r.composites()));
            }
            if (!r.skippedScenes().isEmpty()) {
                out.printf("      %d scene read failures, see the report for details%n", r.skippedScenes().size());
            }
        }
        if (!report.hasOutput()) {
            out.println("Warning: no resolution produced output.");
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
