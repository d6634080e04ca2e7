package fr.lapetina.inferencebench.infrastructure.metrics;

import java.nio.file.Path;

/**
 * Thrown when the metrics file cannot be written.
 */
public final class MetricsPersistenceException extends RuntimeException {

    private final Path path;

    public MetricsPersistenceException(Path path, Throwable cause) {
        super("Failed to save metrics to: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
