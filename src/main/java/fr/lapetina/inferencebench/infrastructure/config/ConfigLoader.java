package fr.lapetina.inferencebench.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Validation of the loaded configuration
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(BenchConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public BenchConfig load() {
        BenchConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private BenchConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public BenchConfig loadFromStream(InputStream inputStream) {
        BenchConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private BenchConfig parse(InputStream is, String source) {
        try {
            BenchConfig config = yaml.load(is);
            return config != null ? config : new BenchConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    static void validate(BenchConfig config) {
        if (config.getHosts() == null || config.getHosts().isEmpty()) {
            throw new ConfigurationException("At least one host must be configured");
        }
        for (BenchConfig.HostConfig host : config.getHosts()) {
            if (host.getName() == null || host.getName().isBlank()) {
                throw new ConfigurationException("Every host needs a name");
            }
            if (host.getUrl() == null || host.getUrl().isBlank()) {
                throw new ConfigurationException("Host " + host.getName() + " has no url");
            }
        }
        if (config.getIterations() < 1) {
            throw new ConfigurationException("Iterations must be at least 1, got " + config.getIterations());
        }
        if (config.getJobs() == null) {
            config.setJobs(new ArrayList<>());
        }
        // an empty section in YAML reads as null
        if (config.getTimeouts() == null) {
            config.setTimeouts(new BenchConfig.TimeoutsConfig());
        }
        if (config.getDispatch() == null) {
            config.setDispatch(new BenchConfig.DispatchConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new BenchConfig.MetricsConfig());
        }
        if (config.getToolCall() == null) {
            config.setToolCall(new BenchConfig.ToolCallConfig());
        }
        if (config.getReports() == null) {
            config.setReports(new BenchConfig.ReportsConfig());
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
