package fr.lapetina.inferencebench.domain.provider;

import fr.lapetina.inferencebench.domain.model.ErrorType;
import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.model.StreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes each call to the provider registered for the target host's type.
 *
 * <p>Registration keys are normalized with {@link Host#normalizeType(String)}, so
 * {@code "llamacpp"} and {@code "llama.cpp"} reach the same provider and a blank type
 * reaches the {@code ollama} provider.
 */
public final class MultiplexChatProvider implements ChatProvider {

    private static final Logger log = LoggerFactory.getLogger(MultiplexChatProvider.class);

    private final Map<String, ChatProvider> providers;

    public MultiplexChatProvider(Map<String, ChatProvider> providers) {
        Objects.requireNonNull(providers, "Providers are required");
        Map<String, ChatProvider> normalized = new LinkedHashMap<>();
        providers.forEach((type, provider) ->
                normalized.put(Host.normalizeType(type), Objects.requireNonNull(provider, "Provider is required")));
        this.providers = Collections.unmodifiableMap(normalized);
    }

    /**
     * Returns the provider serving the host's type.
     *
     * @throws ProviderException with {@link ErrorType#NO_PROVIDER} when none is registered
     */
    public ChatProvider providerForHost(Host host) {
        ChatProvider provider = providers.get(host.getType());
        if (provider == null) {
            throw new ProviderException(ErrorType.NO_PROVIDER, noProviderMessage(host));
        }
        return provider;
    }

    private static String noProviderMessage(Host host) {
        String message = "no provider registered for host type \"" + host.getDeclaredType() + "\"";
        if (!host.getDeclaredType().equals(host.getType())) {
            message += " (resolved as \"" + host.getType() + "\")";
        }
        return message;
    }

    public Map<String, ChatProvider> getProviders() {
        return providers;
    }

    @Override
    public List<String> loadedModels(CallContext ctx, Host host) {
        return providerForHost(host).loadedModels(ctx, host);
    }

    @Override
    public void ensureModelReady(CallContext ctx, Host host, String model) {
        providerForHost(host).ensureModelReady(ctx, host, model);
    }

    @Override
    public void stream(CallContext ctx, StreamRequest request, StreamCallbacks callbacks) {
        providerForHost(request.host()).stream(ctx, request, callbacks);
    }

    @Override
    public void unloadModel(CallContext ctx, Host host, String model) {
        providerForHost(host).unloadModel(ctx, host, model);
    }

    /**
     * Closes every distinct provider once, even when registered under several types.
     * Keeps going past failures and rethrows the first one.
     */
    @Override
    public void close() {
        Set<ChatProvider> closed = Collections.newSetFromMap(new IdentityHashMap<>());
        RuntimeException first = null;
        for (Map.Entry<String, ChatProvider> entry : providers.entrySet()) {
            ChatProvider provider = entry.getValue();
            if (!closed.add(provider)) {
                continue;
            }
            try {
                provider.close();
            } catch (RuntimeException e) {
                log.warn("Error closing provider: type={}", entry.getKey(), e);
                if (first == null) {
                    first = e;
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
