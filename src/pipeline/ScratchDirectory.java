package pipeline;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * A uniquely named working directory that is removed with everything in it on close.
 */
public final class ScratchDirectory implements AutoCloseable {

    private static final Logger logger = LoggingUtil.getLogger(ScratchDirectory.class);

    private final Path path;

    private ScratchDirectory(Path path) {
        this.path = path;
    }

    /** Creates a fresh directory below {@code parent}, creating {@code parent} if needed. */
    public static ScratchDirectory create(Path parent) throws IOException {
        Path dir = parent.toAbsolutePath().normalize().resolve(UUID.randomUUID().toString());
        Files.createDirectories(dir);
        logger.debug("Created scratch directory {}", dir);
        return new ScratchDirectory(dir);
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        try {
            FileUtils.deleteDirectory(path.toFile());
            logger.debug("Removed scratch directory {}", path);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Could not remove scratch directory '{}': {}", path, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
