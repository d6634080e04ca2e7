package fr.lapetina.inferencebench.domain.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Performance statistics of one model: overall, and per input-token bucket.
 * Not thread-safe; the aggregator guards every instance with its lock.
 */
@JsonPropertyOrder({"model_name", "last_updated_utc", "overall_stats", "performance_buckets"})
public final class ModelMetrics {

    @JsonProperty("model_name")
    private String modelName;

    @JsonProperty("last_updated_utc")
    private Instant lastUpdatedUtc;

    @JsonProperty("overall_stats")
    private RunningAggregatedStats overallStats = new RunningAggregatedStats();

    @JsonProperty("performance_buckets")
    private List<PerformanceBucket> performanceBuckets = new ArrayList<>();

    public ModelMetrics() {
    }

    public ModelMetrics(String modelName) {
        this.modelName = modelName;
    }

    /**
     * Adds one completed exchange to the overall statistics and to its bucket.
     */
    public void record(StreamMetadata metadata, long ttftMs, Instant now) {
        lastUpdatedUtc = now;
        overallStats.record(metadata, ttftMs);
        bucketFor(InputTokenBucket.forTokens(metadata.promptEvalCount()))
                .getStats()
                .record(metadata, ttftMs);
    }

    private PerformanceBucket bucketFor(InputTokenBucket bucket) {
        return findBucket(bucket.getLabel()).orElseGet(() -> {
            PerformanceBucket created = new PerformanceBucket(InputTokenBucket.DIMENSION, bucket.getLabel());
            performanceBuckets.add(created);
            return created;
        });
    }

    public Optional<PerformanceBucket> findBucket(String label) {
        return performanceBuckets.stream()
                .filter(b -> InputTokenBucket.DIMENSION.equals(b.getDimension()) && label.equals(b.getBucket()))
                .findFirst();
    }

    public String getModelName() {
        return modelName;
    }

    public Instant getLastUpdatedUtc() {
        return lastUpdatedUtc;
    }

    public RunningAggregatedStats getOverallStats() {
        return overallStats;
    }

    public List<PerformanceBucket> getPerformanceBuckets() {
        return performanceBuckets;
    }

    /**
     * True when every section needed by {@link #record} is present.
     */
    public boolean wellFormed() {
        if (modelName == null || modelName.isBlank() || overallStats == null || !overallStats.wellFormed()) {
            return false;
        }
        return performanceBuckets != null
                && performanceBuckets.stream().allMatch(b -> b != null && b.wellFormed());
    }

    public ModelMetrics copy() {
        ModelMetrics copy = new ModelMetrics(modelName);
        copy.lastUpdatedUtc = lastUpdatedUtc;
        copy.overallStats = overallStats.copy();
        copy.performanceBuckets = new ArrayList<>(performanceBuckets.stream().map(PerformanceBucket::copy).toList());
        return copy;
    }
}
