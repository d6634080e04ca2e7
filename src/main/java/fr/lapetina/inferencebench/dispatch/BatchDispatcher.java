package fr.lapetina.inferencebench.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.inferencebench.domain.model.ErrorType;
import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ProviderException;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;
import fr.lapetina.inferencebench.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans jobs out across a fixed host pool in batches of at most one job per host.
 *
 * <p>For each batch, one worker thread is started per host; worker {@code i} serves host
 * {@code i}. The batch is enqueued and the queue closed, workers drain it, and each job
 * yields exactly one {@link JobResult}, failures included. Once every result is collected
 * and every worker has exited, the {@link BatchBarrier} runs before the next batch starts.
 *
 * <p>A job failure never aborts the run. Cancelling the caller's context aborts in-flight
 * jobs, which are then reported as failures.
 *
 * <pre>{@code
 * BatchDispatcher dispatcher = BatchDispatcher.builder()
 *         .hosts(hosts)
 *         .executor(executor)
 *         .classifier(classifier)
 *         .barrier(barrier)
 *         .build();
 * DispatchReport report = dispatcher.run(ctx, jobs, 3);
 * }</pre>
 */
public final class BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final List<Host> hosts;
    private final JobExecutor executor;
    private final SuccessClassifier classifier;
    private final BatchBarrier barrier;
    private final Duration jobTimeout;
    private final boolean resetBeforeFirstBatch;
    private final MetricsRegistry metricsRegistry;
    private final ObjectMapper objectMapper = JsonHttpClient.createObjectMapper();

    private BatchDispatcher(Builder builder) {
        this.hosts = List.copyOf(builder.hosts);
        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("At least one host is required");
        }
        this.executor = Objects.requireNonNull(builder.executor, "Job executor is required");
        this.classifier = builder.classifier != null ? builder.classifier : SuccessClassifier.ALWAYS;
        this.barrier = builder.barrier != null ? builder.barrier : BatchBarrier.NONE;
        this.jobTimeout = builder.jobTimeout;
        this.resetBeforeFirstBatch = builder.resetBeforeFirstBatch;
        this.metricsRegistry = builder.metricsRegistry;
    }

    public List<Host> getHosts() {
        return hosts;
    }

    /**
     * Runs every job {@code iterations} times.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting for a batch
     */
    public DispatchReport run(CallContext ctx, List<Job> jobs, int iterations) throws InterruptedException {
        DispatchReport.Accumulator report = DispatchReport.accumulator();
        jobs.forEach(report::register);
        if (jobs.isEmpty() || iterations <= 0) {
            log.info("Nothing to dispatch: jobs={}, iterations={}", jobs.size(), iterations);
            return report.build();
        }

        int batchSize = hosts.size();
        int batchesPerIteration = (jobs.size() + batchSize - 1) / batchSize;
        log.info("Dispatch started: jobs={}, hosts={}, iterations={}, batchesPerIteration={}",
                jobs.size(), batchSize, iterations, batchesPerIteration);

        if (resetBeforeFirstBatch) {
            runBarrier(ctx);
        }

        for (int iteration = 1; iteration <= iterations; iteration++) {
            for (int batch = 0; batch < batchesPerIteration; batch++) {
                List<Job> slice = jobs.subList(batch * batchSize, Math.min(jobs.size(), (batch + 1) * batchSize));
                runBatch(ctx, slice, iteration, batch + 1).forEach(report::add);
                runBarrier(ctx);
            }
            log.info("Iteration finished: iteration={}/{}", iteration, iterations);
        }

        DispatchReport result = report.build();
        log.info("Dispatch finished: attempts={}, successes={}", result.totalAttempts(), result.totalSuccesses());
        return result;
    }

    /**
     * Runs one batch to completion and returns one result per job, in collection order.
     */
    List<JobResult> runBatch(CallContext ctx, List<Job> batch, int iteration, int batchNumber)
            throws InterruptedException {
        long started = System.nanoTime();
        WorkQueue<Job> work = new WorkQueue<>(batch.size());
        BlockingQueue<JobResult> results = new ArrayBlockingQueue<>(batch.size());
        CountDownLatch workersExited = new CountDownLatch(hosts.size());
        ExecutorService pool = Executors.newFixedThreadPool(hosts.size(), workerThreadFactory(batchNumber));

        log.info("Batch started: iteration={}, batch={}, jobs={}", iteration, batchNumber, batch.size());
        try {
            for (int i = 0; i < hosts.size(); i++) {
                int workerId = i + 1;
                Host host = hosts.get(i);
                pool.execute(() -> {
                    try {
                        work(ctx, workerId, host, work, results, iteration, batchNumber);
                    } finally {
                        workersExited.countDown();
                    }
                });
            }
            for (Job job : batch) {
                work.put(job);
            }
            work.close();

            List<JobResult> collected = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                collected.add(results.take());
            }
            workersExited.await();

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (metricsRegistry != null) {
                metricsRegistry.recordBatchDuration(elapsed);
            }
            log.info("Batch finished: iteration={}, batch={}, results={}, durationMs={}",
                    iteration, batchNumber, collected.size(), elapsed.toMillis());
            return collected;
        } finally {
            work.close();
            pool.shutdownNow();
        }
    }

    private void work(CallContext ctx, int workerId, Host host, WorkQueue<Job> work,
                      BlockingQueue<JobResult> results, int iteration, int batchNumber) {
        try {
            Job job;
            while ((job = work.take()) != null) {
                results.put(execute(ctx, workerId, host, job, iteration, batchNumber));
            }
            log.debug("Worker exiting: worker={}, host={}", workerId, host.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted: worker={}, host={}", workerId, host.getName());
        }
    }

    private JobResult execute(CallContext ctx, int workerId, Host host, Job job, int iteration, int batchNumber) {
        MDC.put("job", job.id());
        MDC.put("host", host.getName());
        MDC.put("iteration", String.valueOf(iteration));
        MDC.put("batch", String.valueOf(batchNumber));
        long started = System.nanoTime();
        try (CallContext jobCtx = ctx.withTimeout(jobTimeout)) {
            log.info("Job started: worker={}, host={}, job={}, model={}", workerId, host.getName(), job.id(), job.model());
            String payload = executor.execute(jobCtx, host, job);
            boolean success = classifier.isSuccess(job, payload);
            log.info("Job finished: worker={}, host={}, job={}, success={}", workerId, host.getName(), job.id(), success);
            return finish(job, host, iteration, batchNumber, success, payload, null, started);
        } catch (ProviderException e) {
            log.warn("Job failed: worker={}, host={}, job={}, errorType={}, error={}",
                    workerId, host.getName(), job.id(), e.getErrorType(), e.getMessage());
            return finish(job, host, iteration, batchNumber, false, errorPayload(e), e.getErrorType(), started);
        } catch (Throwable e) {
            // anything else, errors included, still yields the job's one result
            log.error("Job failed unexpectedly: worker={}, host={}, job={}", workerId, host.getName(), job.id(), e);
            return finish(job, host, iteration, batchNumber, false,
                    errorDocument(e.getClass().getSimpleName() + ": " + e.getMessage(), ErrorType.INTERNAL_ERROR),
                    ErrorType.INTERNAL_ERROR, started);
        } finally {
            MDC.remove("job");
            MDC.remove("host");
            MDC.remove("iteration");
            MDC.remove("batch");
        }
    }

    private JobResult finish(Job job, Host host, int iteration, int batchNumber, boolean success,
                             String payload, ErrorType errorType, long started) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        if (metricsRegistry != null) {
            metricsRegistry.incrementJobCount(job.id(), host.getName(), success);
            metricsRegistry.recordJobLatency(job.id(), host.getName(), elapsed);
        }
        return new JobResult(job, host.getName(), iteration, batchNumber, success, payload, errorType, elapsed);
    }

    /**
     * Keeps the backend's own JSON error document when there is one, otherwise
     * synthesizes {@code {"error": "...", "error_type": "..."}}.
     */
    String errorPayload(ProviderException e) {
        String body = e.getResponseBody();
        if (e.getErrorType() == ErrorType.PROTOCOL_ERROR && body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node != null && node.isObject()) {
                    return body;
                }
            } catch (IOException parseFailure) {
                log.debug("Backend error body is not JSON, synthesizing: error={}", parseFailure.getMessage());
            }
        }
        return errorDocument(e.getMessage(), e.getErrorType());
    }

    private String errorDocument(String message, ErrorType errorType) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message);
        node.put("error_type", errorType.name());
        return node.toString();
    }

    private void runBarrier(CallContext ctx) {
        if (ctx.isDone()) {
            log.info("Skipping reset barrier, dispatch context ended: cause={}", ctx.cause());
            return;
        }
        long started = System.nanoTime();
        try {
            barrier.reset(ctx, hosts);
        } catch (RuntimeException e) {
            log.warn("Reset barrier failed, continuing", e);
        }
        if (metricsRegistry != null) {
            metricsRegistry.recordBarrierDuration(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private static ThreadFactory workerThreadFactory(int batchNumber) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "dispatch-b" + batchNumber + "-w" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Host> hosts = List.of();
        private JobExecutor executor;
        private SuccessClassifier classifier;
        private BatchBarrier barrier;
        private Duration jobTimeout;
        private boolean resetBeforeFirstBatch = true;
        private MetricsRegistry metricsRegistry;

        public Builder hosts(List<Host> hosts) {
            this.hosts = hosts;
            return this;
        }

        public Builder executor(JobExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder classifier(SuccessClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder barrier(BatchBarrier barrier) {
            this.barrier = barrier;
            return this;
        }

        /**
         * Deadline applied to every job. Null means no deadline beyond the caller's.
         */
        public Builder jobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
            return this;
        }

        public Builder resetBeforeFirstBatch(boolean resetBeforeFirstBatch) {
            this.resetBeforeFirstBatch = resetBeforeFirstBatch;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public BatchDispatcher build() {
            return new BatchDispatcher(this);
        }
    }
}
