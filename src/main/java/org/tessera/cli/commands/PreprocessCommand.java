package org.tessera.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.cli.CommandLineInterface;
import org.tessera.process.AtmosphericCorrection;
import org.tessera.process.ExternalProcessTask;
import org.tessera.process.ProcessResult;
import org.tessera.scene.SceneCatalog;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the external atmospheric-correction processor over level-1C products, producing the level-2A
 * products that {@code mosaic} consumes. Products whose level-2A output already exists are skipped.
 */
@Command(
    name = "preprocess",
    description = "Run atmospheric correction on level-1C products"
)
public class PreprocessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PreprocessCommand.class);

    @Parameters(
        paramLabel = "PATH",
        arity = "1..*",
        description = "Level-1C .SAFE products, directories containing them, or text files listing them"
    )
    private List<Path> inputs;

    @Option(
        names = {"-r", "--resolution"},
        defaultValue = "0",
        description = "Process only this resolution: 10, 20 or 60; 0 uses the processor default (default: ${DEFAULT-VALUE})"
    )
    private int resolution;

    @Option(
        names = {"-o", "--output-dir"},
        description = "Directory for level-2A products (default: next to each input)"
    )
    private Path outputDir;

    @Option(
        names = {"-g", "--gipp"},
        description = "Processor parameter file (default: preprocess.gipp)"
    )
    private Path gipp;

    @Option(
        names = {"-p", "--processes"},
        description = "Products processed in parallel (default: preprocess.processes)"
    )
    private Integer processes;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AtmosphericCorrection correction;
        List<Path> products;
        int parallelism;
        try {
            if (resolution != 0 && resolution != 10 && resolution != 20 && resolution != 60) {
                throw new IllegalArgumentException("Resolution must be 0, 10, 20 or 60, got " + resolution);
            }
            Config config = parent.getConfig().getConfig("preprocess");
            correction = AtmosphericCorrection.fromConfig(config);
            if (gipp != null) {
                if (!Files.isRegularFile(gipp)) {
                    throw new IllegalArgumentException("Parameter file not found: " + gipp);
                }
                correction = new AtmosphericCorrection(correction.executable(), gipp, null, correction.timeout());
            }
            if (outputDir != null) {
                Files.createDirectories(outputDir);
                if (!Files.isWritable(outputDir)) {
                    throw new IllegalArgumentException("Output directory is not writable: " + outputDir);
                }
                correction = correction.withOutputDir(outputDir);
            }
            parallelism = processes != null ? processes : config.getInt("processes");
            if (parallelism < 1) {
                throw new IllegalArgumentException("Process count must be at least 1, got " + parallelism);
            }
            products = SceneCatalog.findProducts(inputs, "L1C");
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (products.isEmpty()) {
            err.println("Error: No level-1C products found in " + inputs);
            return 1;
        }

        List<ExternalProcessTask> tasks = new CopyOnWriteArrayList<>();
        Map<Path, Future<ProcessResult>> pending = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        Thread shutdownHook = new Thread(() -> {
            tasks.forEach(ExternalProcessTask::cancel);
            executor.shutdownNow();
        }, "preprocess-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        int failed = 0;
        try {
            for (Path product : products) {
                if (correction.isProcessed(product)) {
                    out.printf("%s: already processed, skipping%n", product.getFileName());
                    continue;
                }
                ExternalProcessTask task = correction.task(product, resolution);
                tasks.add(task);
                pending.put(product, executor.submit(task::run));
            }
            for (Map.Entry<Path, Future<ProcessResult>> entry : pending.entrySet()) {
                try {
                    ProcessResult result = entry.getValue().get();
                    out.printf("%s: done in %d s%n", entry.getKey().getFileName(), result.elapsed().toSeconds());
                } catch (ExecutionException e) {
                    failed++;
                    log.warn("Preprocessing {} failed: {}", entry.getKey().getFileName(), e.getCause().getMessage());
                    err.printf("%s: failed: %s%n", entry.getKey().getFileName(), e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tasks.forEach(ExternalProcessTask::cancel);
            err.println("Preprocessing interrupted.");
            return 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            executor.shutdownNow();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown in progress, hook stays registered");
            }
        }
        return failed == 0 ? 0 : 1;
    }
}
