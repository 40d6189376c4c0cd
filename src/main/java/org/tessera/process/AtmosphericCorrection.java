package org.tessera.process;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.Config;

/**
 * Builds invocations of the external atmospheric-correction processor that turns level-1C products into
 * classified level-2A products.
 *
 * @param executable   the processor executable.
 * @param gippFile     optional processor parameter file, passed as {@code --GIP_L2A}.
 * @param outputDir    optional output directory, passed as {@code --output_dir}; {@code null} writes next to
 *                     the input product.
 * @param timeout      maximum run time per product.
 */
public record AtmosphericCorrection(String executable, Path gippFile, Path outputDir, Duration timeout) {

    /**
     * Reads the {@code preprocess} configuration block.
     */
    public static AtmosphericCorrection fromConfig(Config config) {
        Path gipp = config.hasPath("gipp") && !config.getString("gipp").isBlank()
            ? Path.of(config.getString("gipp")) : null;
        return new AtmosphericCorrection(config.getString("command"), gipp, null, config.getDuration("timeout"));
    }

    public AtmosphericCorrection withOutputDir(Path dir) {
        return new AtmosphericCorrection(executable, gippFile, dir, timeout);
    }

    /**
     * The command line for one product.
     *
     * @param product    the level-1C {@code .SAFE} directory.
     * @param resolution 10, 20 or 60 to restrict processing to one resolution, or 0 for the processor default.
     */
    public List<String> command(Path product, int resolution) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        if (gippFile != null) {
            command.add("--GIP_L2A");
            command.add(gippFile.toString());
        }
        if (resolution != 0) {
            command.add("--resolution");
            command.add(Integer.toString(resolution));
        }
        if (outputDir != null) {
            command.add("--output_dir");
            command.add(outputDir.toString());
        }
        command.add(product.toString());
        return command;
    }

    /**
     * Creates a cancellable task for one product.
     */
    public ExternalProcessTask task(Path product, int resolution) {
        return new ExternalProcessTask(
            product.getFileName().toString(), command(product, resolution), null, timeout);
    }

    /**
     * Whether a level-2A product for the given level-1C product already exists. Products match when mission,
     * sensing time, relative orbit and tile agree; processing baseline and generation time may differ.
     *
     * @param product the level-1C {@code .SAFE} directory.
     * @return {@code true} if a matching level-2A product is present in the output location.
     * @throws IOException if the output location cannot be listed.
     */
    public boolean isProcessed(Path product) throws IOException {
        String[] l1c = product.getFileName().toString().split("_");
        if (l1c.length < 6) {
            return false;
        }
        Path dir = outputDir != null ? outputDir : product.toAbsolutePath().getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            return false;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, l1c[0] + "_MSIL2A_*.SAFE")) {
            for (Path candidate : stream) {
                String[] l2a = candidate.getFileName().toString().split("_");
                if (l2a.length >= 6 && l2a[2].equals(l1c[2]) && l2a[4].equals(l1c[4]) && l2a[5].equals(l1c[5])) {
                    return true;
                }
            }
        }
        return false;
    }
}
