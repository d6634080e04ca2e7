package fr.lapetina.inferencebench.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inferencebench.domain.model.ErrorType;
import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ProviderException;
import fr.lapetina.inferencebench.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class BatchDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static List<Host> hosts(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> Host.builder().name("host-0" + i).baseUrl("http://10.0.0." + i + ":11434").build())
                .toList();
    }

    private static List<Job> jobs(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> Job.forModel("model-" + i)).toList();
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("should split 7 jobs over 4 hosts into batches of 4 and 3")
        void shouldSplitIntoBatches() throws InterruptedException {
            List<String> events = new CopyOnWriteArrayList<>();
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(4))
                    .executor((ctx, host, job) -> {
                        events.add("job:" + job.id());
                        return "{}";
                    })
                    .barrier((ctx, hosts) -> events.add("barrier"))
                    .build();

            DispatchReport report = dispatcher.run(CallContext.background(), jobs(7), 1);

            assertThat(report.totalAttempts()).isEqualTo(7);
            assertThat(report.getResults()).filteredOn(r -> r.batch() == 1).hasSize(4);
            assertThat(report.getResults()).filteredOn(r -> r.batch() == 2).hasSize(3);
            assertThat(report.getResults()).extracting(JobResult::iteration).containsOnly(1);

            // barrier before the first batch, then after each batch
            assertThat(events).hasSize(10);
            assertThat(events.get(0)).isEqualTo("barrier");
            assertThat(events.subList(1, 5)).allMatch(e -> e.startsWith("job:"));
            assertThat(events.get(5)).isEqualTo("barrier");
            assertThat(events.subList(6, 9)).allMatch(e -> e.startsWith("job:"));
            assertThat(events.get(9)).isEqualTo("barrier");
        }

        @Test
        @DisplayName("should run batch jobs on batch-scoped worker threads")
        void shouldUseWorkerThreads() throws InterruptedException {
            Set<String> threads = ConcurrentHashMap.newKeySet();
            Set<String> hostNames = ConcurrentHashMap.newKeySet();
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(3))
                    .executor((ctx, host, job) -> {
                        threads.add(Thread.currentThread().getName());
                        hostNames.add(host.getName());
                        return "{}";
                    })
                    .build();

            dispatcher.run(CallContext.background(), jobs(3), 1);

            assertThat(threads).allMatch(name -> name.startsWith("dispatch-b1-w"));
            assertThat(hostNames).isSubsetOf("host-01", "host-02", "host-03");
        }

        @Test
        @DisplayName("should run batch jobs concurrently across hosts")
        void shouldRunConcurrently() throws InterruptedException {
            CountDownLatch allStarted = new CountDownLatch(3);
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(3))
                    .executor((ctx, host, job) -> {
                        allStarted.countDown();
                        try {
                            // every worker blocks until all three jobs are in flight
                            return allStarted.await(5, TimeUnit.SECONDS) ? "{}" : "timeout";
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException(e);
                        }
                    })
                    .classifier((job, payload) -> "{}".equals(payload))
                    .build();

            DispatchReport report = dispatcher.run(CallContext.background(), jobs(3), 1);

            assertThat(report.totalSuccesses()).isEqualTo(3);
        }

        @Test
        @DisplayName("should repeat every job once per iteration")
        void shouldRepeatPerIteration() throws InterruptedException {
            AtomicInteger barriers = new AtomicInteger();
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(2))
                    .executor((ctx, host, job) -> "{}")
                    .barrier((ctx, hosts) -> barriers.incrementAndGet())
                    .resetBeforeFirstBatch(false)
                    .build();

            DispatchReport report = dispatcher.run(CallContext.background(), jobs(3), 3);

            assertThat(report.totalAttempts()).isEqualTo(9);
            assertThat(report.summary("model-2").orElseThrow().attempts()).isEqualTo(3);
            assertThat(report.getResults()).extracting(JobResult::iteration).containsOnly(1, 2, 3);
            // two batches per iteration, no initial barrier
            assertThat(barriers).hasValue(6);
        }

        @Test
        @DisplayName("should do nothing without jobs or iterations")
        void shouldDoNothingWhenEmpty() throws InterruptedException {
            AtomicInteger calls = new AtomicInteger();
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(2))
                    .executor((ctx, host, job) -> {
                        calls.incrementAndGet();
                        return "{}";
                    })
                    .barrier((ctx, hosts) -> calls.incrementAndGet())
                    .build();

            assertThat(dispatcher.run(CallContext.background(), List.of(), 3).totalAttempts()).isZero();
            DispatchReport none = dispatcher.run(CallContext.background(), jobs(2), 0);

            assertThat(none.totalAttempts()).isZero();
            assertThat(none.getSummaries()).containsOnlyKeys("model-1", "model-2");
            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("should require hosts and an executor")
        void shouldValidateBuilder() {
            assertThatThrownBy(() -> BatchDispatcher.builder().executor((c, h, j) -> "").build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BatchDispatcher.builder().hosts(hosts(1)).build())
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should record a transport failure and keep going")
        void shouldRecordTransportFailure() throws Exception {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(2))
                    .executor((ctx, host, job) -> {
                        if (job.id().equals("model-1")) {
                            throw new ProviderException(ErrorType.TRANSPORT_ERROR, "ollama: /api/chat: connection refused");
                        }
                        return "{\"message\":{\"content\":\"ok\"}}";
                    })
                    .build();

            DispatchReport report = dispatcher.run(CallContext.background(), jobs(2), 1);

            JobResult failed = report.getResults().stream()
                    .filter(r -> r.job().id().equals("model-1")).findFirst().orElseThrow();
            assertThat(failed.success()).isFalse();
            assertThat(failed.errorType()).isEqualTo(ErrorType.TRANSPORT_ERROR);
            JsonNode payload = mapper.readTree(failed.payload());
            assertThat(payload.get("error").asText()).contains("connection refused");
            assertThat(payload.get("error_type").asText()).isEqualTo("TRANSPORT_ERROR");
            assertThat(report.summary("model-2").orElseThrow().successCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep a backend JSON error document as the payload")
        void shouldKeepBackendErrorDocument() {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(1))
                    .executor((ctx, host, job) -> "{}")
                    .build();

            String kept = dispatcher.errorPayload(ProviderException.badStatus("ollama: /api/chat", 404,
                    "{\"error\":\"model not found\"}"));
            String synthesized = dispatcher.errorPayload(ProviderException.badStatus("ollama: /api/chat", 502,
                    "<html>Bad Gateway</html>"));

            assertThat(kept).isEqualTo("{\"error\":\"model not found\"}");
            assertThat(synthesized).contains("\"error_type\":\"PROTOCOL_ERROR\"").contains("HTTP 502");
        }

        @Test
        @DisplayName("should report unexpected exceptions as internal errors")
        void shouldReportUnexpectedExceptions() throws InterruptedException {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(1))
                    .executor((ctx, host, job) -> {
                        throw new IllegalStateException("bug");
                    })
                    .build();

            DispatchReport report = dispatcher.run(CallContext.background(), jobs(1), 1);

            assertThat(report.getResults()).singleElement().satisfies(r -> {
                assertThat(r.success()).isFalse();
                assertThat(r.errorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
                assertThat(r.payload()).contains("IllegalStateException: bug");
            });
        }

        @Test
        @DisplayName("should turn an error thrown by a job into an internal error result")
        void shouldReportErrorsThrownByJobs() {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(2))
                    .executor((ctx, host, job) -> {
                        if (job.id().equals("model-1")) {
                            throw new AssertionError("boom");
                        }
                        return "{}";
                    })
                    .build();

            DispatchReport report = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> dispatcher.run(CallContext.background(), jobs(2), 1));

            assertThat(report.totalAttempts()).isEqualTo(2);
            JobResult failed = report.getResults().stream()
                    .filter(r -> r.job().id().equals("model-1")).findFirst().orElseThrow();
            assertThat(failed.success()).isFalse();
            assertThat(failed.errorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
            assertThat(failed.payload()).contains("AssertionError: boom");
            assertThat(report.summary("model-2").orElseThrow().successCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should turn an error thrown by the classifier into an internal error result")
        void shouldReportErrorsThrownByClassifier() {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(1))
                    .executor((ctx, host, job) -> "{}")
                    .classifier((job, payload) -> {
                        throw new StackOverflowError();
                    })
                    .build();

            DispatchReport report = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> dispatcher.run(CallContext.background(), jobs(2), 1));

            assertThat(report.getResults()).hasSize(2)
                    .allSatisfy(r -> assertThat(r.errorType()).isEqualTo(ErrorType.INTERNAL_ERROR));
        }

        @Test
        @DisplayName("should continue after a failing barrier")
        void shouldContinueAfterBarrierFailure() throws InterruptedException {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(1))
                    .executor((ctx, host, job) -> "{}")
                    .barrier((ctx, hosts) -> {
                        throw new IllegalStateException("unload failed");
                    })
                    .build();

            assertThat(dispatcher.run(CallContext.background(), jobs(2), 1).totalAttempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("should time out a job at the per-job deadline")
        void shouldTimeOutJobs() throws InterruptedException {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(1))
                    .jobTimeout(Duration.ofMillis(100))
                    .executor((ctx, host, job) -> {
                        try {
                            ctx.await(Duration.ofSeconds(10));
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        ctx.throwIfDone("stub: chat");
                        return "{}";
                    })
                    .build();

            DispatchReport report = dispatcher.run(CallContext.background(), jobs(1), 1);

            assertThat(report.getResults()).singleElement()
                    .satisfies(r -> assertThat(r.errorType()).isEqualTo(ErrorType.TIMEOUT));
        }

        @Test
        @DisplayName("should fail in-flight jobs and skip barriers once cancelled")
        void shouldStopOnCancellation() throws InterruptedException {
            CallContext ctx = CallContext.background();
            AtomicInteger barriers = new AtomicInteger();
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(2))
                    .barrier((c, hosts) -> barriers.incrementAndGet())
                    .resetBeforeFirstBatch(false)
                    .executor((jobCtx, host, job) -> {
                        ctx.cancel();
                        jobCtx.throwIfDone("stub: chat");
                        return "{}";
                    })
                    .build();

            DispatchReport report = dispatcher.run(ctx, jobs(4), 1);

            assertThat(report.getResults()).allSatisfy(r -> {
                assertThat(r.success()).isFalse();
                assertThat(r.errorType()).isEqualTo(ErrorType.CANCELLED);
            });
            assertThat(barriers).hasValue(0);
        }
    }

    @Test
    @DisplayName("should count successes per job identity")
    void shouldCountSuccessesPerJob() throws InterruptedException {
        List<String> payloads = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger attempt = new AtomicInteger();
        BatchDispatcher dispatcher = BatchDispatcher.builder()
                .hosts(hosts(1))
                .executor((ctx, host, job) -> "{\"attempt\":" + attempt.incrementAndGet() + "}")
                .classifier((job, payload) -> {
                    payloads.add(payload);
                    return !payload.contains(":2}");
                })
                .build();

        DispatchReport report = dispatcher.run(CallContext.background(), jobs(1), 4);

        DispatchReport.JobSummary summary = report.summary("model-1").orElseThrow();
        assertThat(summary.attempts()).isEqualTo(4);
        assertThat(summary.successCount()).isEqualTo(3);
        assertThat(summary.percentSuccess()).isEqualTo(75.0);
        assertThat(summary.payloads()).hasSize(4).containsExactlyElementsOf(payloads);
    }

    @Test
    @DisplayName("should record job and batch meters")
    void shouldRecordMeters() throws InterruptedException {
        try (MetricsRegistry metrics = new MetricsRegistry("dispatch_test")) {
            BatchDispatcher dispatcher = BatchDispatcher.builder()
                    .hosts(hosts(2))
                    .executor((ctx, host, job) -> "{}")
                    .metricsRegistry(metrics)
                    .build();

            dispatcher.run(CallContext.background(), jobs(3), 1);

            double jobs = metrics.getRegistry().get("dispatch_test_jobs_total").counters().stream()
                    .mapToDouble(Counter::count).sum();
            assertThat(jobs).isEqualTo(3.0);
            assertThat(metrics.getRegistry().get("dispatch_test_batch_duration").timer().count()).isEqualTo(2);
            assertThat(metrics.getRegistry().get("dispatch_test_barrier_duration").timer().count()).isEqualTo(3);
        }
    }
}
