package fr.lapetina.inferencebench.infrastructure.metrics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry registry = new MetricsRegistry("bench_test");

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("should count jobs by job, host and outcome")
    void shouldCountJobs() {
        registry.incrementJobCount("llama3.2:1b", "host-01", true);
        registry.incrementJobCount("llama3.2:1b", "host-01", true);
        registry.incrementJobCount("llama3.2:1b", "host-02", false);

        assertThat(registry.getRegistry().get("bench_test_jobs_total")
                .tag("host", "host-01").tag("outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(registry.getRegistry().get("bench_test_jobs_total")
                .tag("host", "host-02").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose recorded timers in the Prometheus scrape")
    void shouldExposeTimersInScrape() {
        registry.recordJobLatency("m", "h", Duration.ofMillis(120));
        registry.recordBatchDuration(Duration.ofSeconds(2));
        registry.recordBarrierDuration(Duration.ofMillis(300));

        String scrape = registry.scrape();

        assertThat(scrape)
                .contains("bench_test_job_latency")
                .contains("bench_test_batch_duration")
                .contains("bench_test_barrier_duration");
        assertThat(registry.getRegistry().get("bench_test_batch_duration").timer().count()).isEqualTo(1);
    }
}
