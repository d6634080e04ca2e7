package fr.lapetina.inferencebench.infrastructure.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.inferencebench.dispatch.DispatchReport;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the dispatch outputs: the summary report
 * {@code {job: {success_count, percent_success, total_runs}}} and the raw response
 * archive {@code {job: [payload, ...]}}.
 */
public final class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final Path summaryPath;
    private final Path responsesPath;
    private final ObjectMapper objectMapper;

    public ReportWriter(Path summaryPath, Path responsesPath) {
        this.summaryPath = summaryPath;
        this.responsesPath = responsesPath;
        this.objectMapper = JsonHttpClient.createObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Truncates both files to an empty JSON object, creating them if needed.
     */
    public void reset() {
        write(summaryPath, "{}");
        write(responsesPath, "{}");
    }

    /**
     * Writes both files from a finished run.
     */
    public void write(DispatchReport report) {
        write(summaryPath, render(summary(report)));
        write(responsesPath, render(responses(report)));
        log.info("Reports written: summary={}, responses={}", summaryPath, responsesPath);
    }

    ObjectNode summary(DispatchReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        report.getSummaries().forEach((job, summary) -> {
            ObjectNode entry = root.putObject(job);
            entry.put("success_count", summary.successCount());
            entry.put("percent_success", summary.percentSuccess());
            entry.put("total_runs", summary.attempts());
        });
        return root;
    }

    /**
     * Payloads are embedded as JSON when they parse, as strings otherwise.
     */
    ObjectNode responses(DispatchReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        report.getSummaries().forEach((job, summary) -> {
            ArrayNode history = root.putArray(job);
            for (String payload : summary.payloads()) {
                history.add(asJson(payload));
            }
        });
        return root;
    }

    private JsonNode asJson(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Archiving non-JSON payload as text: error={}", e.getOriginalMessage());
        }
        return objectMapper.getNodeFactory().textNode(payload);
    }

    private String render(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report", e);
        }
    }

    private static void write(Path path, String content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException(path, e);
        }
    }

    /**
     * Writes an arbitrary text export next to the reports, such as a Prometheus scrape.
     */
    public static void writeText(Path path, String content) {
        write(path, content);
    }
}
