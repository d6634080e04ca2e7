package fr.lapetina.inferencebench.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for a benchmark run.
 * Designed to be populated from YAML.
 */
public class BenchConfig {

    private List<HostConfig> hosts = new ArrayList<>();
    private List<String> jobs = new ArrayList<>();
    private int iterations = 1;
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private ToolCallConfig toolCall = new ToolCallConfig();
    private ReportsConfig reports = new ReportsConfig();

    // Getters and Setters
    public List<HostConfig> getHosts() { return hosts; }
    public void setHosts(List<HostConfig> hosts) { this.hosts = hosts; }

    /**
     * Model names to exercise, one job each.
     */
    public List<String> getJobs() { return jobs; }
    public void setJobs(List<String> jobs) { this.jobs = jobs; }

    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public ToolCallConfig getToolCall() { return toolCall; }
    public void setToolCall(ToolCallConfig toolCall) { this.toolCall = toolCall; }

    public ReportsConfig getReports() { return reports; }
    public void setReports(ReportsConfig reports) { this.reports = reports; }

    /**
     * Backend host configuration.
     */
    public static class HostConfig {
        private String name;
        private String url;
        private String type = "ollama";
        private List<String> models = new ArrayList<>();
        private String systemPrompt;
        private Map<String, Object> parameters = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public List<String> getModels() { return models; }
        public void setModels(List<String> models) { this.models = models; }

        public String getSystemPrompt() { return systemPrompt; }
        public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }

        public Map<String, Object> getParameters() { return parameters; }
        public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 600000;
        private long jobTimeoutMs = 600000;
        private long resetTimeoutMs = 60000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getJobTimeoutMs() { return jobTimeoutMs; }
        public void setJobTimeoutMs(long jobTimeoutMs) { this.jobTimeoutMs = jobTimeoutMs; }

        public long getResetTimeoutMs() { return resetTimeoutMs; }
        public void setResetTimeoutMs(long resetTimeoutMs) { this.resetTimeoutMs = resetTimeoutMs; }
    }

    /**
     * Batch dispatch configuration. The reset unloads every loaded model on every host.
     */
    public static class DispatchConfig {
        private boolean unloadBetweenBatches = true;
        private boolean resetBeforeFirstBatch = true;

        public boolean isUnloadBetweenBatches() { return unloadBetweenBatches; }
        public void setUnloadBetweenBatches(boolean unloadBetweenBatches) { this.unloadBetweenBatches = unloadBetweenBatches; }

        public boolean isResetBeforeFirstBatch() { return resetBeforeFirstBatch; }
        public void setResetBeforeFirstBatch(boolean resetBeforeFirstBatch) { this.resetBeforeFirstBatch = resetBeforeFirstBatch; }
    }

    /**
     * Performance metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String path = "reports/data/model_performance_metrics.json";
        private long saveIntervalMs = 60000;
        private String prefix = "inference_bench";
        private String prometheusPath;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public long getSaveIntervalMs() { return saveIntervalMs; }
        public void setSaveIntervalMs(long saveIntervalMs) { this.saveIntervalMs = saveIntervalMs; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getPrometheusPath() { return prometheusPath; }
        public void setPrometheusPath(String prometheusPath) { this.prometheusPath = prometheusPath; }
    }

    /**
     * Tool-calling scenario configuration.
     */
    public static class ToolCallConfig {
        private String prompt = "What is the weather in Portland, OR?";
        private String expectedLocation = "Portland, OR";

        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }

        public String getExpectedLocation() { return expectedLocation; }
        public void setExpectedLocation(String expectedLocation) { this.expectedLocation = expectedLocation; }
    }

    /**
     * Report output configuration.
     */
    public static class ReportsConfig {
        private String summaryPath = "reports/tool_call/model_tools_report.json";
        private String responsesPath = "reports/tool_call/responses.json";

        public String getSummaryPath() { return summaryPath; }
        public void setSummaryPath(String summaryPath) { this.summaryPath = summaryPath; }

        public String getResponsesPath() { return responsesPath; }
        public void setResponsesPath(String responsesPath) { this.responsesPath = responsesPath; }
    }
}
