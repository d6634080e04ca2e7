package fr.lapetina.inferencebench;

import fr.lapetina.inferencebench.dispatch.BatchBarrier;
import fr.lapetina.inferencebench.dispatch.BatchDispatcher;
import fr.lapetina.inferencebench.dispatch.Job;
import fr.lapetina.inferencebench.dispatch.UnloadModelsBarrier;
import fr.lapetina.inferencebench.dispatch.toolcall.ToolCallJobExecutor;
import fr.lapetina.inferencebench.dispatch.toolcall.ToolCallScenario;
import fr.lapetina.inferencebench.dispatch.toolcall.ToolCallSuccessClassifier;
import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.provider.ChatProvider;
import fr.lapetina.inferencebench.domain.provider.MultiplexChatProvider;
import fr.lapetina.inferencebench.infrastructure.config.BenchConfig;
import fr.lapetina.inferencebench.infrastructure.config.ConfigLoader;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;
import fr.lapetina.inferencebench.infrastructure.metrics.MetricsAggregator;
import fr.lapetina.inferencebench.infrastructure.metrics.MetricsRecordingChatProvider;
import fr.lapetina.inferencebench.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inferencebench.infrastructure.provider.llamacpp.LlamaCppChatProvider;
import fr.lapetina.inferencebench.infrastructure.provider.ollama.OllamaChatProvider;
import fr.lapetina.inferencebench.infrastructure.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating a fully-wired benchmark from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BenchFactory factory = BenchFactory.create("config.yaml")) {
 *     DispatchReport report = factory.getDispatcher().run(ctx, factory.getJobs(), factory.getIterations());
 * }
 * }</pre>
 */
public class BenchFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BenchFactory.class);

    private final BenchConfig config;
    private final List<Host> hosts;
    private final List<Job> jobs;
    private final JsonHttpClient httpClient;
    private final MetricsRegistry metricsRegistry;
    private final MetricsAggregator aggregator;
    private final ChatProvider provider;
    private final ToolCallScenario scenario;
    private final BatchDispatcher dispatcher;
    private final ReportWriter reportWriter;

    protected BenchFactory(BenchConfig config, JsonHttpClient httpClientOverride) {
        this.config = config;
        BenchConfig.TimeoutsConfig timeouts = config.getTimeouts();

        this.hosts = loadHosts(config);
        this.jobs = loadJobs(config);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.aggregator = createAggregator(config.getMetrics());

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null
                ? httpClientOverride
                : new JsonHttpClient(Duration.ofMillis(timeouts.getConnectTimeoutMs()),
                        Duration.ofMillis(timeouts.getRequestTimeoutMs()));

        this.provider = createProvider(httpClient, aggregator);
        this.scenario = ToolCallScenario.weather(
                config.getToolCall().getPrompt(), config.getToolCall().getExpectedLocation());

        BatchBarrier barrier = config.getDispatch().isUnloadBetweenBatches()
                ? new UnloadModelsBarrier(provider, Duration.ofMillis(timeouts.getResetTimeoutMs()))
                : BatchBarrier.NONE;

        this.dispatcher = BatchDispatcher.builder()
                .hosts(hosts)
                .executor(new ToolCallJobExecutor(provider, scenario))
                .classifier(new ToolCallSuccessClassifier(scenario))
                .barrier(barrier)
                .resetBeforeFirstBatch(config.getDispatch().isResetBeforeFirstBatch())
                .jobTimeout(timeouts.getJobTimeoutMs() > 0 ? Duration.ofMillis(timeouts.getJobTimeoutMs()) : null)
                .metricsRegistry(metricsRegistry)
                .build();

        this.reportWriter = new ReportWriter(
                Paths.get(config.getReports().getSummaryPath()),
                Paths.get(config.getReports().getResponsesPath()));

        log.info("BenchFactory initialized: hosts={}, jobs={}, iterations={}",
                hosts.size(), jobs.size(), config.getIterations());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static BenchFactory create(String configPath) {
        log.info("Initializing BenchFactory from config: {}", configPath);
        return new BenchFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static BenchFactory create(BenchConfig config) {
        return new BenchFactory(config, null);
    }

    /**
     * Starts the periodic metrics save, if metrics are enabled.
     */
    public BenchFactory start() {
        if (aggregator != null) {
            aggregator.start();
        }
        return this;
    }

    public BenchConfig getConfig() {
        return config;
    }

    public List<Host> getHosts() {
        return hosts;
    }

    public List<Job> getJobs() {
        return jobs;
    }

    public int getIterations() {
        return config.getIterations();
    }

    public ChatProvider getProvider() {
        return provider;
    }

    public ToolCallScenario getScenario() {
        return scenario;
    }

    public BatchDispatcher getDispatcher() {
        return dispatcher;
    }

    public ReportWriter getReportWriter() {
        return reportWriter;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * Returns the performance metrics aggregator, or null when metrics are disabled.
     */
    public MetricsAggregator getAggregator() {
        return aggregator;
    }

    static List<Host> loadHosts(BenchConfig config) {
        List<Host> result = new ArrayList<>();
        for (BenchConfig.HostConfig hostConfig : config.getHosts()) {
            Host host = Host.builder()
                    .name(hostConfig.getName())
                    .baseUrl(hostConfig.getUrl())
                    .type(hostConfig.getType())
                    .models(hostConfig.getModels())
                    .systemPrompt(hostConfig.getSystemPrompt())
                    .parameters(hostConfig.getParameters())
                    .build();
            result.add(host);
            log.debug("Registered host: {}", host);
        }
        return result;
    }

    /**
     * Jobs come from the configured list, falling back to the union of the models hosts declare.
     */
    static List<Job> loadJobs(BenchConfig config) {
        List<String> models = new ArrayList<>(config.getJobs());
        if (models.isEmpty()) {
            for (BenchConfig.HostConfig host : config.getHosts()) {
                for (String model : host.getModels()) {
                    if (!models.contains(model)) {
                        models.add(model);
                    }
                }
            }
        }
        return models.stream().map(Job::forModel).toList();
    }

    static ChatProvider createProvider(JsonHttpClient httpClient, MetricsAggregator aggregator) {
        Map<String, ChatProvider> adapters = new LinkedHashMap<>();
        adapters.put(Host.TYPE_OLLAMA, new OllamaChatProvider(httpClient));
        adapters.put(Host.TYPE_LLAMA_CPP, new LlamaCppChatProvider(httpClient));
        ChatProvider multiplexer = new MultiplexChatProvider(adapters);
        return aggregator != null ? new MetricsRecordingChatProvider(multiplexer, aggregator) : multiplexer;
    }

    private static MetricsAggregator createAggregator(BenchConfig.MetricsConfig metrics) {
        if (!metrics.isEnabled()) {
            log.info("Performance metrics disabled");
            return null;
        }
        Path path = metrics.getPath() != null ? Paths.get(metrics.getPath()) : MetricsAggregator.DEFAULT_PATH;
        Duration interval = metrics.getSaveIntervalMs() > 0
                ? Duration.ofMillis(metrics.getSaveIntervalMs())
                : MetricsAggregator.DEFAULT_SAVE_INTERVAL;
        return new MetricsAggregator(path, interval);
    }

    @Override
    public void close() {
        log.info("Shutting down BenchFactory...");

        try {
            provider.close();
        } catch (Exception e) {
            log.warn("Error closing provider", e);
        }

        if (aggregator != null) {
            try {
                aggregator.close();
            } catch (Exception e) {
                log.warn("Error closing metrics aggregator", e);
            }
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("BenchFactory shut down");
    }
}
