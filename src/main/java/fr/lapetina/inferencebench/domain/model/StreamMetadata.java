package fr.lapetina.inferencebench.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Final metadata of a chat exchange, delivered once through the on-complete callback.
 * Durations are in nanoseconds.
 *
 * @param rawResponse the full body of a non-streamed exchange, or the last chunk of a streamed one
 */
public record StreamMetadata(
        String model,
        Instant createdAt,
        boolean done,
        long totalDuration,
        long loadDuration,
        int promptEvalCount,
        long promptEvalDuration,
        int evalCount,
        long evalDuration,
        List<ToolCall> toolCalls,
        JsonNode rawResponse
) {
    public StreamMetadata {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    /**
     * Generated tokens per second, 0 when no eval duration was reported.
     */
    public double tokensPerSecond() {
        if (evalDuration <= 0) {
            return 0;
        }
        return evalCount / (evalDuration / 1e9);
    }

    public Builder toBuilder() {
        return new Builder()
                .model(model)
                .createdAt(createdAt)
                .done(done)
                .totalDuration(totalDuration)
                .loadDuration(loadDuration)
                .promptEvalCount(promptEvalCount)
                .promptEvalDuration(promptEvalDuration)
                .evalCount(evalCount)
                .evalDuration(evalDuration)
                .toolCalls(toolCalls)
                .rawResponse(rawResponse);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String model;
        private Instant createdAt;
        private boolean done;
        private long totalDuration;
        private long loadDuration;
        private int promptEvalCount;
        private long promptEvalDuration;
        private int evalCount;
        private long evalDuration;
        private List<ToolCall> toolCalls;
        private JsonNode rawResponse;

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder done(boolean done) {
            this.done = done;
            return this;
        }

        public Builder totalDuration(long totalDuration) {
            this.totalDuration = totalDuration;
            return this;
        }

        public Builder loadDuration(long loadDuration) {
            this.loadDuration = loadDuration;
            return this;
        }

        public Builder promptEvalCount(int promptEvalCount) {
            this.promptEvalCount = promptEvalCount;
            return this;
        }

        public Builder promptEvalDuration(long promptEvalDuration) {
            this.promptEvalDuration = promptEvalDuration;
            return this;
        }

        public Builder evalCount(int evalCount) {
            this.evalCount = evalCount;
            return this;
        }

        public Builder evalDuration(long evalDuration) {
            this.evalDuration = evalDuration;
            return this;
        }

        public Builder toolCalls(List<ToolCall> toolCalls) {
            this.toolCalls = toolCalls;
            return this;
        }

        public Builder rawResponse(JsonNode rawResponse) {
            this.rawResponse = rawResponse;
            return this;
        }

        public StreamMetadata build() {
            return new StreamMetadata(
                    model, createdAt, done, totalDuration, loadDuration,
                    promptEvalCount, promptEvalDuration, evalCount, evalDuration,
                    toolCalls, rawResponse
            );
        }
    }
}
