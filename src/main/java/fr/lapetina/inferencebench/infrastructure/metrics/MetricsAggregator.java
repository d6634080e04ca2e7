package fr.lapetina.inferencebench.infrastructure.metrics;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.inferencebench.domain.metrics.ModelMetrics;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-model performance statistics, persisted to a JSON file.
 *
 * <p>Thread-safe: every record, snapshot and save holds the same lock. Statistics are
 * loaded from the file at construction, written every save interval once
 * {@link #start()} has been called, and written one last time on {@link #close()}.
 * Each save replaces the file atomically with a full snapshot.
 */
public final class MetricsAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    public static final Path DEFAULT_PATH = Paths.get("reports", "data", "model_performance_metrics.json");
    public static final Duration DEFAULT_SAVE_INTERVAL = Duration.ofMinutes(1);
    static final String UNKNOWN_MODEL = "unknown";

    private static final TypeReference<List<ModelMetrics>> METRICS_LIST = new TypeReference<>() {
    };

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ModelMetrics> metrics = new LinkedHashMap<>();
    private final Path path;
    private final Duration saveInterval;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MetricsAggregator(Path path, Duration saveInterval, Clock clock) {
        this.path = path;
        this.saveInterval = saveInterval;
        this.clock = clock;
        this.objectMapper = JsonHttpClient.createObjectMapper()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-saver");
            t.setDaemon(true);
            return t;
        });
        load();
    }

    public MetricsAggregator(Path path, Duration saveInterval) {
        this(path, saveInterval, Clock.systemUTC());
    }

    public MetricsAggregator() {
        this(DEFAULT_PATH, DEFAULT_SAVE_INTERVAL);
    }

    /**
     * Starts the periodic save.
     */
    public MetricsAggregator start() {
        if (running.compareAndSet(false, true)) {
            long intervalMs = saveInterval.toMillis();
            scheduler.scheduleAtFixedRate(this::periodicSave, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Metrics aggregator started: path={}, interval={}ms", path, intervalMs);
        }
        return this;
    }

    /**
     * Adds one completed exchange to the statistics of its model.
     *
     * @param metadata final metadata of the exchange
     * @param ttftMs   time to first chunk in milliseconds, 0 when no chunk arrived
     */
    public void record(StreamMetadata metadata, long ttftMs) {
        String model = metadata.model() == null || metadata.model().isBlank() ? UNKNOWN_MODEL : metadata.model();
        lock.lock();
        try {
            metrics.computeIfAbsent(model, ModelMetrics::new).record(metadata, ttftMs, clock.instant());
        } finally {
            lock.unlock();
        }
        log.debug("Recorded exchange: model={}, ttftMs={}, inputTokens={}, outputTokens={}",
                model, ttftMs, metadata.promptEvalCount(), metadata.evalCount());
    }

    /**
     * Returns a deep copy of the current statistics, in first-seen model order.
     */
    public List<ModelMetrics> snapshot() {
        lock.lock();
        try {
            return metrics.values().stream().map(ModelMetrics::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ModelMetrics> get(String model) {
        lock.lock();
        try {
            return Optional.ofNullable(metrics.get(model)).map(ModelMetrics::copy);
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * Writes all statistics to the metrics file.
     *
     * @throws MetricsPersistenceException if the file cannot be written
     */
    public void save() {
        lock.lock();
        try {
            byte[] document = objectMapper.writeValueAsBytes(List.copyOf(metrics.values()));
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, document);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Metrics saved: path={}, models={}", path, metrics.size());
        } catch (IOException e) {
            throw new MetricsPersistenceException(path, e);
        } finally {
            lock.unlock();
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported, replacing in place: path={}", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void periodicSave() {
        try {
            save();
        } catch (MetricsPersistenceException e) {
            log.warn("Periodic metrics save failed, retrying next interval: path={}", path, e);
        }
    }

    /**
     * Loads statistics from the metrics file. A missing or malformed file leaves the
     * aggregator empty; a malformed entry is dropped and the others kept.
     */
    private void load() {
        if (!Files.exists(path)) {
            log.debug("No metrics file yet, starting empty: path={}", path);
            return;
        }
        List<ModelMetrics> loaded;
        try {
            loaded = objectMapper.readValue(path.toFile(), METRICS_LIST);
        } catch (IOException e) {
            log.warn("Ignoring unreadable metrics file: path={}, error={}", path, e.getMessage());
            return;
        }
        if (loaded == null) {
            return;
        }
        lock.lock();
        try {
            for (ModelMetrics entry : loaded) {
                if (entry != null && entry.wellFormed()) {
                    metrics.put(entry.getModelName(), entry);
                } else {
                    log.warn("Dropping malformed metrics entry: path={}, model={}",
                            path, entry == null ? null : entry.getModelName());
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("Metrics loaded: path={}, models={}", path, metrics.size());
    }

    /**
     * Stops the periodic save and writes the file one last time. Idempotent.
     *
     * @throws MetricsPersistenceException if the final save fails
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        save();
        log.info("Metrics aggregator closed: path={}", path);
    }
}
