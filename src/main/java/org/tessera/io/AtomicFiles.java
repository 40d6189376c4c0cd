package org.tessera.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes files through a temporary sibling that is atomically moved into place.
 */
public final class AtomicFiles {

    private AtomicFiles() {
    }

    /**
     * Writes content produced by {@code writer} to {@code target}.
     *
     * @param target the final file; parent directories are created.
     * @param writer writes the complete content to the temporary file it is given.
     * @throws IOException if writing or moving fails; the temporary file is removed.
     */
    public static void write(Path target, ContentWriter writer) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            writer.writeTo(temp);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Produces file content.
     */
    @FunctionalInterface
    public interface ContentWriter {
        void writeTo(Path file) throws IOException;
    }
}
