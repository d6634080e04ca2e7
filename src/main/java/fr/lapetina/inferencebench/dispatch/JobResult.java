package fr.lapetina.inferencebench.dispatch;

import fr.lapetina.inferencebench.domain.model.ErrorType;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one job on one host.
 *
 * @param payload   the backend's raw document, or a synthesized {@code {"error": ...}} document
 * @param errorType set when the job failed with an exception, null otherwise
 */
public record JobResult(
        Job job,
        String hostName,
        int iteration,
        int batch,
        boolean success,
        String payload,
        ErrorType errorType,
        Duration duration
) {
    public JobResult {
        Objects.requireNonNull(job, "Job is required");
        Objects.requireNonNull(payload, "Payload is required");
        duration = duration != null ? duration : Duration.ZERO;
    }
}
