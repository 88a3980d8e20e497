package de.bsommerfeld.reddharvest.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Writes the bundled example configuration for first-time users. An
 * existing file is never overwritten.
 */
final class ExampleConfigWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ExampleConfigWriter.class);

    static final String EXAMPLE_RESOURCE = "/example.yml";

    private ExampleConfigWriter() {
    }

    /**
     * @return {@code true} if the file was written, {@code false} if it
     *         already existed
     * @throws IOException if the resource is missing or the file cannot be
     *                     written
     */
    static boolean writeIfAbsent(Path target) throws IOException {
        if (Files.exists(target)) {
            LOG.info("Config '{}' already exists, no action taken", target);
            return false;
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (InputStream in = ExampleConfigWriter.class.getResourceAsStream(EXAMPLE_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled resource " + EXAMPLE_RESOURCE + " not found");
            }
            Files.copy(in, target);
        }
        // The file carries the Reddit username; keep it private where the file system allows.
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-------"));
        }
        LOG.info("Wrote example configuration to '{}'", target);
        return true;
    }
}
