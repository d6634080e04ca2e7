package fr.lapetina.inferencebench.infrastructure.report;

import java.nio.file.Path;

/**
 * Thrown when a report file cannot be written.
 */
public final class ReportWriteException extends RuntimeException {

    public ReportWriteException(Path path, Throwable cause) {
        super("Failed to write report: " + path, cause);
    }
}
