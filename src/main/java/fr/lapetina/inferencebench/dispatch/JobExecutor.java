package fr.lapetina.inferencebench.dispatch;

import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.provider.CallContext;

/**
 * Runs one job against one host and returns the backend's raw response document.
 *
 * Failures are reported by throwing; the dispatcher turns them into failed results.
 */
@FunctionalInterface
public interface JobExecutor {

    String execute(CallContext ctx, Host host, Job job);
}
