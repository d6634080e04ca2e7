package fr.lapetina.inferencebench.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch meters using Micrometer.
 *
 * Provides:
 * - Job outcome counters per job and host
 * - Job latency timers per job and host
 * - Batch and reset barrier durations
 * - JVM metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> jobCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> jobTimers = new ConcurrentHashMap<>();
    private final Timer batchTimer;
    private final Timer barrierTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.batchTimer = Timer.builder(prefix + "_batch_duration")
                .description("Wall time of one batch, from first enqueue to last worker exit")
                .register(registry);
        this.barrierTimer = Timer.builder(prefix + "_barrier_duration")
                .description("Wall time of the reset barrier between batches")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("inference_bench");
    }

    /**
     * Counts one finished job.
     */
    public void incrementJobCount(String job, String host, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = job + ":" + host + ":" + outcome;
        jobCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_jobs_total")
                        .description("Total number of finished jobs")
                        .tag("job", job)
                        .tag("host", host)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a job took on its host.
     */
    public void recordJobLatency(String job, String host, Duration latency) {
        String key = job + ":" + host;
        jobTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_job_latency")
                        .description("Job latency")
                        .tag("job", job)
                        .tag("host", host)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    public void recordBarrierDuration(Duration duration) {
        barrierTimer.record(duration);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
