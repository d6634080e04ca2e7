package fr.lapetina.inferencebench.domain.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Online mean/variance/min/max using Welford's algorithm.
 * Not thread-safe; callers synchronize.
 */
@JsonPropertyOrder({"count", "mean", "m2", "min", "max"})
public final class RunningStat {

    @JsonProperty("count")
    private long count;

    @JsonProperty("mean")
    private double mean;

    @JsonProperty("m2")
    private double m2;

    @JsonProperty("min")
    private double min;

    @JsonProperty("max")
    private double max;

    public RunningStat() {
    }

    private RunningStat(long count, double mean, double m2, double min, double max) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
        this.min = min;
        this.max = max;
    }

    public void add(double value) {
        count++;
        if (count == 1) {
            min = value;
            max = value;
        } else {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getM2() {
        return m2;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * Population variance, 0 below two samples.
     */
    public double variance() {
        return count > 1 ? m2 / count : 0;
    }

    public double standardDeviation() {
        return Math.sqrt(variance());
    }

    public RunningStat copy() {
        return new RunningStat(count, mean, m2, min, max);
    }

    @Override
    public String toString() {
        return "RunningStat{count=" + count + ", mean=" + mean + ", min=" + min + ", max=" + max + '}';
    }
}
