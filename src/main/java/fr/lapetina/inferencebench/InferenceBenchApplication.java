package fr.lapetina.inferencebench;

import fr.lapetina.inferencebench.dispatch.DispatchReport;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.infrastructure.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the inference benchmark.
 */
public class InferenceBenchApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceBenchApplication.class);

    private final BenchFactory factory;
    private final CallContext runContext = CallContext.background();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InferenceBenchApplication(String configPath) {
        this(BenchFactory.create(configPath));
    }

    public InferenceBenchApplication(BenchFactory factory) {
        log.info("Starting inference benchmark...");
        this.factory = factory.start();
    }

    /**
     * Runs every configured job on every iteration and writes the reports.
     */
    public DispatchReport run() throws InterruptedException {
        ReportWriter reports = factory.getReportWriter();
        reports.reset();

        DispatchReport report = factory.getDispatcher()
                .run(runContext, factory.getJobs(), factory.getIterations());
        reports.write(report);

        String prometheusPath = factory.getConfig().getMetrics().getPrometheusPath();
        if (prometheusPath != null && !prometheusPath.isBlank()) {
            ReportWriter.writeText(Paths.get(prometheusPath), factory.getMetricsRegistry().scrape());
        }

        report.getSummaries().values().forEach(summary ->
                log.info("Job summary: job={}, successes={}/{}, percent={}",
                        summary.jobId(), summary.successCount(), summary.attempts(),
                        String.format("%.1f", summary.percentSuccess())));
        return report;
    }

    /**
     * Cancels the in-flight run. Jobs still executing observe the cancellation and fail with CANCELLED.
     */
    public void requestShutdown() {
        runContext.cancel();
    }

    public BenchFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down inference benchmark...");
        runContext.cancel();

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Inference benchmark shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            InferenceBenchApplication app = new InferenceBenchApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.run();
            app.close();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Inference benchmark interrupted", e);
            System.exit(1);
        } catch (Exception e) {
            log.error("Failed to run inference benchmark", e);
            System.exit(1);
        }
    }
}
