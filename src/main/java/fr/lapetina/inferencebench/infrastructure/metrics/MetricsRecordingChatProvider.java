package fr.lapetina.inferencebench.infrastructure.metrics;

import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;
import fr.lapetina.inferencebench.domain.model.StreamRequest;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ChatProvider;
import fr.lapetina.inferencebench.domain.provider.StreamCallbacks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decorator that records every completed exchange in a {@link MetricsAggregator}.
 *
 * Measures time to first chunk per call, then records the final metadata before the
 * caller's on-complete hook runs; a recording failure is logged and never fails the
 * exchange. Everything else passes through unchanged, including exceptions. A decorator
 * wrapping another recording decorator leaves the recording to the inner one.
 */
public final class MetricsRecordingChatProvider implements ChatProvider {

    private static final Logger log = LoggerFactory.getLogger(MetricsRecordingChatProvider.class);

    private static final long NO_CHUNK = -1L;

    private final ChatProvider delegate;
    private final MetricsAggregator aggregator;

    /**
     * @param aggregator may be null, in which case nothing is recorded
     */
    public MetricsRecordingChatProvider(ChatProvider delegate, MetricsAggregator aggregator) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate provider is required");
        this.aggregator = aggregator;
    }

    boolean records() {
        if (aggregator == null) {
            return false;
        }
        return !(delegate instanceof MetricsRecordingChatProvider)
                || !((MetricsRecordingChatProvider) delegate).records();
    }

    @Override
    public void stream(CallContext ctx, StreamRequest request, StreamCallbacks callbacks) {
        if (!records()) {
            delegate.stream(ctx, request, callbacks);
            return;
        }
        long start = System.nanoTime();
        AtomicLong firstChunk = new AtomicLong(NO_CHUNK);

        StreamCallbacks recording = new StreamCallbacks(
                chunk -> {
                    firstChunk.compareAndSet(NO_CHUNK, System.nanoTime());
                    callbacks.chunk(chunk);
                },
                metadata -> {
                    long first = firstChunk.get();
                    long ttftMs = first == NO_CHUNK ? 0 : TimeUnit.NANOSECONDS.toMillis(first - start);
                    try {
                        aggregator.record(withModel(metadata, request), ttftMs);
                    } catch (RuntimeException e) {
                        log.warn("Failed to record exchange metrics: model={}", request.model(), e);
                    }
                    callbacks.complete(metadata);
                });
        delegate.stream(ctx, request, recording);
    }

    private static StreamMetadata withModel(StreamMetadata metadata, StreamRequest request) {
        if (metadata.model() != null && !metadata.model().isBlank()) {
            return metadata;
        }
        return metadata.toBuilder().model(request.model()).build();
    }

    @Override
    public List<String> loadedModels(CallContext ctx, Host host) {
        return delegate.loadedModels(ctx, host);
    }

    @Override
    public void ensureModelReady(CallContext ctx, Host host, String model) {
        delegate.ensureModelReady(ctx, host, model);
    }

    @Override
    public void unloadModel(CallContext ctx, Host host, String model) {
        delegate.unloadModel(ctx, host, model);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
