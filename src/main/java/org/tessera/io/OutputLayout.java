package org.tessera.io;

import java.nio.file.Path;
import java.util.Objects;

/**
 * File naming of a mosaic product: {@code <dir>/<name>_R<res>m_<suffix>}.
 *
 * @param directory the product directory.
 * @param name      the product name prefix.
 */
public record OutputLayout(Path directory, String name) {

    public OutputLayout {
        Objects.requireNonNull(directory, "directory");
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("Invalid output name: '" + name + "'");
        }
    }

    public Path classificationPath(int resolution) {
        return file(resolution, "SCL.tif");
    }

    public Path provenancePath(int resolution) {
        return file(resolution, "imageN.tif");
    }

    public Path bandPath(int resolution, String band) {
        return file(resolution, band + ".tif");
    }

    public Path compositePath(int resolution, String composite) {
        return file(resolution, composite + ".vrt");
    }

    public Path reportPath() {
        return directory.resolve(name + "_report.json");
    }

    private Path file(int resolution, String suffix) {
        return directory.resolve(String.format("%s_R%dm_%s", name, resolution, suffix));
    }
}
