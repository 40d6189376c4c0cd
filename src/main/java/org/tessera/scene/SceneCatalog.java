package org.tessera.scene;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves user-supplied input paths into granule directories or {@code .SAFE} products.
 * <p>
 * An input may be a granule directory (holding {@code MTD_TL.xml}), a {@code .SAFE} product (granules
 * under {@code GRANULE/}), a directory containing products or granules, or a text file listing any of
 * those, one per line. Results are de-duplicated and sorted.
 */
public final class SceneCatalog {

    private static final Logger log = LoggerFactory.getLogger(SceneCatalog.class);

    private SceneCatalog() {
    }

    /**
     * Finds granule directories of a processing level.
     *
     * @param inputs user-supplied paths.
     * @param level  the processing level, e.g. {@code L2A}.
     * @return sorted granule directories.
     * @throws IOException if an input does not exist or cannot be listed.
     */
    public static List<Path> findGranules(List<Path> inputs, String level) throws IOException {
        Pattern levelPattern = levelPattern(level);
        TreeSet<Path> granules = new TreeSet<>();
        for (Path input : expandListFiles(inputs)) {
            collectGranules(input, granules);
        }
        List<Path> result = new ArrayList<>();
        for (Path granule : granules) {
            if (levelPattern.matcher(granule.getFileName().toString()).find()) {
                result.add(granule);
            } else {
                log.debug("Ignoring {}: not a {} granule", granule, level);
            }
        }
        return result;
    }

    /**
     * Finds {@code .SAFE} product directories of a processing level.
     *
     * @param inputs user-supplied paths.
     * @param level  the processing level, e.g. {@code L1C}.
     * @return sorted product directories.
     * @throws IOException if an input does not exist or cannot be listed.
     */
    public static List<Path> findProducts(List<Path> inputs, String level) throws IOException {
        Pattern levelPattern = levelPattern(level);
        TreeSet<Path> products = new TreeSet<>();
        for (Path input : expandListFiles(inputs)) {
            if (isSafe(input)) {
                products.add(input.toAbsolutePath().normalize());
                continue;
            }
            for (Path child : children(input)) {
                if (isSafe(child)) {
                    products.add(child.toAbsolutePath().normalize());
                }
            }
        }
        List<Path> result = new ArrayList<>();
        for (Path product : products) {
            if (levelPattern.matcher(product.getFileName().toString()).find()) {
                result.add(product);
            }
        }
        return result;
    }

    static boolean isGranule(Path dir) {
        return Files.isDirectory(dir) && Files.isRegularFile(dir.resolve(GranuleMetadata.FILE_NAME));
    }

    static boolean isSafe(Path dir) {
        return Files.isDirectory(dir) && dir.getFileName().toString().endsWith(".SAFE");
    }

    private static void collectGranules(Path input, TreeSet<Path> granules) throws IOException {
        if (isGranule(input)) {
            granules.add(input.toAbsolutePath().normalize());
        } else if (isSafe(input)) {
            Path granuleRoot = input.resolve("GRANULE");
            if (Files.isDirectory(granuleRoot)) {
                for (Path child : children(granuleRoot)) {
                    if (isGranule(child)) granules.add(child.toAbsolutePath().normalize());
                }
            }
        } else {
            for (Path child : children(input)) {
                if (isGranule(child) || isSafe(child)) {
                    collectGranules(child, granules);
                }
            }
        }
    }

    private static List<Path> expandListFiles(List<Path> inputs) throws IOException {
        List<Path> expanded = new ArrayList<>();
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new IOException("Input not found: " + input);
            }
            if (Files.isRegularFile(input)) {
                for (String line : Files.readAllLines(input, StandardCharsets.UTF_8)) {
                    String trimmed = line.trim();
                    if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                    Path listed = Path.of(trimmed);
                    if (!listed.isAbsolute() && input.toAbsolutePath().getParent() != null) {
                        listed = input.toAbsolutePath().getParent().resolve(listed);
                    }
                    if (!Files.isDirectory(listed)) {
                        throw new IOException("Input listed in " + input + " is not a directory: " + listed);
                    }
                    expanded.add(listed);
                }
            } else {
                expanded.add(input);
            }
        }
        return expanded;
    }

    private static List<Path> children(Path dir) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                children.add(child);
            }
        }
        return children;
    }

    private static Pattern levelPattern(String level) {
        return Pattern.compile("(^|_|MSI)" + Pattern.quote(level) + "(_|\\.|$)");
    }
}
