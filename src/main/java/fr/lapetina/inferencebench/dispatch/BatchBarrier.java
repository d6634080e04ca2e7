package fr.lapetina.inferencebench.dispatch;

import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.provider.CallContext;

import java.util.List;

/**
 * Synchronization point run after every batch, once all workers have exited.
 * Implementations must not throw for per-host failures.
 */
@FunctionalInterface
public interface BatchBarrier {

    /** Does nothing. */
    BatchBarrier NONE = (ctx, hosts) -> {
    };

    void reset(CallContext ctx, List<Host> hosts);
}
