package fr.lapetina.inferencebench.infrastructure.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inferencebench.domain.metrics.ModelMetrics;
import fr.lapetina.inferencebench.domain.metrics.PerformanceBucket;
import fr.lapetina.inferencebench.domain.metrics.RunningAggregatedStats;
import fr.lapetina.inferencebench.domain.metrics.RunningStat;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MetricsAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MetricsAggregator aggregator(Path path) {
        return new MetricsAggregator(path, Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static StreamMetadata metadata(String model, int promptTokens) {
        return StreamMetadata.builder()
                .model(model)
                .done(true)
                .promptEvalCount(promptTokens)
                .evalCount(40)
                .evalDuration(2_000_000_000L)
                .totalDuration(2_500_000_000L)
                .build();
    }

    private static void assertSameStats(RunningAggregatedStats actual, RunningAggregatedStats expected) {
        assertThat(actual.getTotalRequests()).isEqualTo(expected.getTotalRequests());
        assertSameStat(actual.getTtftMillis(), expected.getTtftMillis());
        assertSameStat(actual.getTokensPerSecond(), expected.getTokensPerSecond());
        assertSameStat(actual.getInputTokens(), expected.getInputTokens());
        assertSameStat(actual.getOutputTokens(), expected.getOutputTokens());
        assertSameStat(actual.getTotalDurationMillis(), expected.getTotalDurationMillis());
    }

    private static void assertSameStat(RunningStat actual, RunningStat expected) {
        assertThat(actual.getCount()).isEqualTo(expected.getCount());
        assertThat(actual.getMean()).isEqualTo(expected.getMean());
        assertThat(actual.getMin()).isEqualTo(expected.getMin());
        assertThat(actual.getMax()).isEqualTo(expected.getMax());
        assertThat(actual.getM2()).isEqualTo(expected.getM2());
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("should place a 300-token prompt in the 257-1024 bucket")
        void shouldBucketByPromptTokens() {
            MetricsAggregator aggregator = aggregator(tempDir.resolve("metrics.json"));

            aggregator.record(metadata("llama3.2:1b", 300), 85);

            ModelMetrics metrics = aggregator.get("llama3.2:1b").orElseThrow();
            assertThat(metrics.getLastUpdatedUtc()).isEqualTo(NOW);
            assertThat(metrics.getOverallStats().getTotalRequests()).isEqualTo(1);
            assertThat(metrics.getOverallStats().getTokensPerSecond().getMean()).isCloseTo(20.0, within(1e-9));
            assertThat(metrics.findBucket("257-1024")).isPresent();
            assertThat(metrics.findBucket("0-256")).isEmpty();
        }

        @Test
        @DisplayName("should file metadata without a model under unknown")
        void shouldUseUnknownModel() {
            MetricsAggregator aggregator = aggregator(tempDir.resolve("metrics.json"));

            aggregator.record(metadata(null, 10), 0);
            aggregator.record(metadata("  ", 10), 0);

            assertThat(aggregator.get(MetricsAggregator.UNKNOWN_MODEL).orElseThrow()
                    .getOverallStats().getTotalRequests()).isEqualTo(2);
        }

        @Test
        @DisplayName("should return snapshots isolated from later records")
        void shouldReturnIsolatedSnapshots() {
            MetricsAggregator aggregator = aggregator(tempDir.resolve("metrics.json"));
            aggregator.record(metadata("a", 10), 1);

            List<ModelMetrics> snapshot = aggregator.snapshot();
            aggregator.record(metadata("a", 10), 1);
            aggregator.record(metadata("b", 10), 1);

            assertThat(snapshot).hasSize(1);
            assertThat(snapshot.get(0).getOverallStats().getTotalRequests()).isEqualTo(1);
            assertThat(aggregator.snapshot()).extracting(ModelMetrics::getModelName).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should not lose updates under concurrent recording")
        void shouldNotLoseConcurrentUpdates() throws InterruptedException {
            MetricsAggregator aggregator = aggregator(tempDir.resolve("metrics.json"));
            int threads = 8;
            int perThread = 250;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            for (int t = 0; t < threads; t++) {
                String model = t % 2 == 0 ? "even" : "odd";
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        aggregator.record(metadata(model, i), i);
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

            long total = aggregator.snapshot().stream()
                    .mapToLong(m -> m.getOverallStats().getTotalRequests())
                    .sum();
            assertThat(total).isEqualTo((long) threads * perThread);
            ModelMetrics even = aggregator.get("even").orElseThrow();
            long bucketSum = even.getPerformanceBuckets().stream()
                    .mapToLong(b -> b.getStats().getTotalRequests())
                    .sum();
            assertThat(bucketSum).isEqualTo(even.getOverallStats().getTotalRequests());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("should write the documented JSON shape")
        void shouldWriteDocumentedShape() throws Exception {
            Path file = tempDir.resolve("data").resolve("metrics.json");
            MetricsAggregator aggregator = aggregator(file);
            aggregator.record(metadata("llama3.2:1b", 300), 85);

            aggregator.save();

            JsonNode root = new ObjectMapper().readTree(file.toFile());
            assertThat(root.isArray()).isTrue();
            JsonNode entry = root.get(0);
            assertThat(entry.get("model_name").asText()).isEqualTo("llama3.2:1b");
            assertThat(entry.get("last_updated_utc").asText()).isEqualTo("2026-03-01T12:00:00Z");
            JsonNode overall = entry.get("overall_stats");
            assertThat(overall.get("total_requests").asLong()).isEqualTo(1);
            assertThat(overall.get("ttft_ms").get("mean").asDouble()).isEqualTo(85.0);
            assertThat(overall.get("ttft_ms").has("m2")).isTrue();
            assertThat(overall.get("total_duration_ms").get("max").asDouble()).isEqualTo(2500.0);
            JsonNode bucket = entry.get("performance_buckets").get(0);
            assertThat(bucket.get("dimension").asText()).isEqualTo("input_tokens");
            assertThat(bucket.get("bucket").asText()).isEqualTo("257-1024");
            assertThat(bucket.get("stats").get("input_tokens").get("count").asLong()).isEqualTo(1);
        }

        @Test
        @DisplayName("should continue accumulating after a reload")
        void shouldRoundTripThroughFile() {
            Path file = tempDir.resolve("metrics.json");
            MetricsAggregator first = aggregator(file);
            first.record(metadata("m", 10), 10);
            first.record(metadata("m", 10), 30);
            first.close();

            MetricsAggregator second = aggregator(file);
            second.record(metadata("m", 10), 50);

            ModelMetrics metrics = second.get("m").orElseThrow();
            assertThat(metrics.getOverallStats().getTotalRequests()).isEqualTo(3);
            assertThat(metrics.getOverallStats().getTtftMillis().getMean()).isCloseTo(30.0, within(1e-9));
            assertThat(metrics.getOverallStats().getTtftMillis().variance()).isCloseTo(800.0 / 3, within(1e-6));
            assertThat(metrics.getOverallStats().getTtftMillis().getMin()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("should reload every model and bucket statistic exactly as saved")
        void shouldReloadSnapshotExactly() {
            Path file = tempDir.resolve("metrics.json");
            MetricsAggregator first = aggregator(file);
            int[] prompts = {12, 300, 3000, 90, 700, 20_000, 5000};
            for (int i = 0; i < prompts.length; i++) {
                first.record(metadata(i % 2 == 0 ? "alpha" : "beta", prompts[i]), 17L * (i + 1));
            }
            first.record(metadata("", 64), 3);
            List<ModelMetrics> before = first.snapshot();
            first.save();

            List<ModelMetrics> after = aggregator(file).snapshot();

            assertThat(after).extracting(ModelMetrics::getModelName)
                    .containsExactlyElementsOf(before.stream().map(ModelMetrics::getModelName).toList());
            for (int i = 0; i < before.size(); i++) {
                ModelMetrics expected = before.get(i);
                ModelMetrics actual = after.get(i);
                assertThat(actual.getLastUpdatedUtc()).isEqualTo(expected.getLastUpdatedUtc());
                assertSameStats(actual.getOverallStats(), expected.getOverallStats());
                assertThat(actual.getPerformanceBuckets()).hasSameSizeAs(expected.getPerformanceBuckets());
                for (int b = 0; b < expected.getPerformanceBuckets().size(); b++) {
                    PerformanceBucket expectedBucket = expected.getPerformanceBuckets().get(b);
                    PerformanceBucket actualBucket = actual.getPerformanceBuckets().get(b);
                    assertThat(actualBucket.getDimension()).isEqualTo(expectedBucket.getDimension());
                    assertThat(actualBucket.getBucket()).isEqualTo(expectedBucket.getBucket());
                    assertSameStats(actualBucket.getStats(), expectedBucket.getStats());
                }
            }
        }

        @Test
        @DisplayName("should drop entries with missing statistics and keep the others")
        void shouldDropMalformedEntries() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            MetricsAggregator seed = aggregator(file);
            seed.record(metadata("good", 100), 40);
            seed.save();
            String valid = Files.readString(file, StandardCharsets.UTF_8).trim();
            String document = "[" + valid.substring(1, valid.length() - 1) + ","
                    + "{\"model_name\":\"x\",\"overall_stats\":null,\"performance_buckets\":null},"
                    + "{\"model_name\":\"y\",\"overall_stats\":{\"ttft_ms\":null},\"performance_buckets\":[]},"
                    + "{\"model_name\":\"z\",\"overall_stats\":{},\"performance_buckets\":[null]},"
                    + "null]";
            Files.writeString(file, document, StandardCharsets.UTF_8);

            MetricsAggregator aggregator = aggregator(file);

            assertThat(aggregator.snapshot()).extracting(ModelMetrics::getModelName).containsExactly("good");
            aggregator.record(metadata("x", 10), 5);
            aggregator.record(metadata("good", 100), 60);
            assertThat(aggregator.get("x").orElseThrow().getOverallStats().getTotalRequests()).isEqualTo(1);
            assertThat(aggregator.get("good").orElseThrow().getOverallStats().getTtftMillis().getMean())
                    .isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("should start empty when the file is malformed")
        void shouldStartEmptyOnMalformedFile() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);

            MetricsAggregator aggregator = aggregator(file);

            assertThat(aggregator.snapshot()).isEmpty();
        }

        @Test
        @DisplayName("should leave no temporary files behind")
        void shouldLeaveNoTemporaryFiles() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            MetricsAggregator aggregator = aggregator(file);
            aggregator.record(metadata("m", 1), 1);

            aggregator.save();
            aggregator.save();

            List<Path> files = new ArrayList<>();
            try (var stream = Files.list(tempDir)) {
                stream.forEach(files::add);
            }
            assertThat(files).containsExactly(file);
        }

        @Test
        @DisplayName("should report write failures")
        void shouldReportWriteFailures() throws Exception {
            Path blocker = tempDir.resolve("not-a-directory");
            Files.writeString(blocker, "x");
            MetricsAggregator aggregator = aggregator(blocker.resolve("metrics.json"));

            assertThatThrownBy(aggregator::save).isInstanceOf(MetricsPersistenceException.class);
        }

        @Test
        @DisplayName("should save once on repeated close")
        void shouldBeIdempotentOnClose() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            MetricsAggregator aggregator = aggregator(file).start();
            aggregator.record(metadata("m", 1), 1);

            aggregator.close();
            Files.delete(file);
            aggregator.close();

            assertThat(file).doesNotExist();
        }

        @Test
        @DisplayName("should save periodically once started")
        void shouldSavePeriodically() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            MetricsAggregator aggregator = new MetricsAggregator(file, Duration.ofMillis(50));
            aggregator.record(metadata("m", 1), 1);

            aggregator.start();
            long deadline = System.currentTimeMillis() + 5000;
            while (!Files.exists(file) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            aggregator.close();

            assertThat(file).exists();
        }
    }
}
