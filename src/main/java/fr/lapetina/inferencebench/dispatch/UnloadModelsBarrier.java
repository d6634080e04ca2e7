package fr.lapetina.inferencebench.dispatch;

import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ChatProvider;
import fr.lapetina.inferencebench.domain.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Reset barrier that evicts every loaded model from every host, so each batch starts
 * from cold memory. Per-host failures are logged and skipped.
 */
public final class UnloadModelsBarrier implements BatchBarrier {

    private static final Logger log = LoggerFactory.getLogger(UnloadModelsBarrier.class);

    private final ChatProvider provider;
    private final Duration timeout;

    public UnloadModelsBarrier(ChatProvider provider, Duration timeout) {
        this.provider = provider;
        this.timeout = timeout;
    }

    @Override
    public void reset(CallContext ctx, List<Host> hosts) {
        int unloaded = 0;
        for (Host host : hosts) {
            try (CallContext call = ctx.withTimeout(timeout)) {
                for (String model : provider.loadedModels(call, host)) {
                    try {
                        provider.unloadModel(call, host, model);
                        unloaded++;
                    } catch (ProviderException e) {
                        log.warn("Unload failed: host={}, model={}, errorType={}, error={}",
                                host.getName(), model, e.getErrorType(), e.getMessage());
                    }
                }
            } catch (ProviderException e) {
                log.warn("Could not list loaded models: host={}, errorType={}, error={}",
                        host.getName(), e.getErrorType(), e.getMessage());
            }
        }
        log.info("Reset barrier finished: hosts={}, modelsUnloaded={}", hosts.size(), unloaded);
    }
}
