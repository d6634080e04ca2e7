package fr.lapetina.inferencebench.domain.provider;

import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.model.StreamRequest;

import java.util.List;

/**
 * Capability set of a model-serving backend.
 *
 * <p>Implementations must be safe for concurrent use by several dispatcher workers.
 * Every operation honors the supplied {@link CallContext}: cancellation aborts in-flight
 * network calls and surfaces as {@link ProviderException} with
 * {@link fr.lapetina.inferencebench.domain.model.ErrorType#CANCELLED}, an expired deadline
 * as {@link fr.lapetina.inferencebench.domain.model.ErrorType#TIMEOUT}.
 */
public interface ChatProvider extends AutoCloseable {

    /**
     * Lists the models currently loaded in the host's memory.
     */
    List<String> loadedModels(CallContext ctx, Host host);

    /**
     * Loads or warms a model so the next exchange does not pay the load cost.
     * Returns without doing anything when the model is already ready.
     */
    void ensureModelReady(CallContext ctx, Host host, String model);

    /**
     * Runs a chat exchange. Chunks are delivered through {@code callbacks.onChunk()}, then
     * final metadata through {@code callbacks.onComplete()}.
     *
     * @throws ProviderException if the exchange cannot be established or is aborted
     */
    void stream(CallContext ctx, StreamRequest request, StreamCallbacks callbacks);

    /**
     * Evicts a model from the host's memory.
     */
    void unloadModel(CallContext ctx, Host host, String model);

    /**
     * Releases resources. Idempotent.
     */
    @Override
    void close();
}
