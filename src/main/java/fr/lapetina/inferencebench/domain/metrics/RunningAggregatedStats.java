package fr.lapetina.inferencebench.domain.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;

/**
 * The five running statistics kept for every completed exchange.
 * {@code totalRequests} always equals the count of each statistic.
 */
@JsonPropertyOrder({"total_requests", "ttft_ms", "tokens_per_second", "input_tokens", "output_tokens", "total_duration_ms"})
public final class RunningAggregatedStats {

    @JsonProperty("total_requests")
    private long totalRequests;

    @JsonProperty("ttft_ms")
    private RunningStat ttftMillis = new RunningStat();

    @JsonProperty("tokens_per_second")
    private RunningStat tokensPerSecond = new RunningStat();

    @JsonProperty("input_tokens")
    private RunningStat inputTokens = new RunningStat();

    @JsonProperty("output_tokens")
    private RunningStat outputTokens = new RunningStat();

    @JsonProperty("total_duration_ms")
    private RunningStat totalDurationMillis = new RunningStat();

    public void record(StreamMetadata metadata, long ttftMs) {
        totalRequests++;
        ttftMillis.add(ttftMs);
        tokensPerSecond.add(metadata.tokensPerSecond());
        inputTokens.add(metadata.promptEvalCount());
        outputTokens.add(metadata.evalCount());
        totalDurationMillis.add(metadata.totalDuration() / 1_000_000L);
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public RunningStat getTtftMillis() {
        return ttftMillis;
    }

    public RunningStat getTokensPerSecond() {
        return tokensPerSecond;
    }

    public RunningStat getInputTokens() {
        return inputTokens;
    }

    public RunningStat getOutputTokens() {
        return outputTokens;
    }

    public RunningStat getTotalDurationMillis() {
        return totalDurationMillis;
    }

    /**
     * False when a statistic is missing, as happens with a hand-edited metrics file.
     */
    public boolean wellFormed() {
        return ttftMillis != null && tokensPerSecond != null && inputTokens != null
                && outputTokens != null && totalDurationMillis != null;
    }

    public RunningAggregatedStats copy() {
        RunningAggregatedStats copy = new RunningAggregatedStats();
        copy.totalRequests = totalRequests;
        copy.ttftMillis = ttftMillis.copy();
        copy.tokensPerSecond = tokensPerSecond.copy();
        copy.inputTokens = inputTokens.copy();
        copy.outputTokens = outputTokens.copy();
        copy.totalDurationMillis = totalDurationMillis.copy();
        return copy;
    }
}
