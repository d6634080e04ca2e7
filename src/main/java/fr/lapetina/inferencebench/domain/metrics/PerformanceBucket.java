package fr.lapetina.inferencebench.domain.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Statistics for one bucket of one dimension.
 */
@JsonPropertyOrder({"dimension", "bucket", "stats"})
public final class PerformanceBucket {

    @JsonProperty("dimension")
    private String dimension;

    @JsonProperty("bucket")
    private String bucket;

    @JsonProperty("stats")
    private RunningAggregatedStats stats = new RunningAggregatedStats();

    public PerformanceBucket() {
    }

    public PerformanceBucket(String dimension, String bucket) {
        this.dimension = dimension;
        this.bucket = bucket;
    }

    public String getDimension() {
        return dimension;
    }

    public String getBucket() {
        return bucket;
    }

    public RunningAggregatedStats getStats() {
        return stats;
    }

    public boolean wellFormed() {
        return dimension != null && bucket != null && stats != null && stats.wellFormed();
    }

    public PerformanceBucket copy() {
        PerformanceBucket copy = new PerformanceBucket(dimension, bucket);
        copy.stats = stats.copy();
        return copy;
    }
}
