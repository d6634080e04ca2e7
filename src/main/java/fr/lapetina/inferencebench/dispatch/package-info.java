/**
 * Batch dispatch across a fixed host pool.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>{@link fr.lapetina.inferencebench.dispatch.BatchDispatcher} splits the job list into
 *       batches of at most one job per host</li>
 *   <li>one worker per host runs its jobs through a {@link fr.lapetina.inferencebench.dispatch.JobExecutor}</li>
 *   <li>a {@link fr.lapetina.inferencebench.dispatch.SuccessClassifier} judges every payload</li>
 *   <li>a {@link fr.lapetina.inferencebench.dispatch.BatchBarrier} runs between batches</li>
 * </ol>
 *
 * <p>Results accumulate per job in a {@link fr.lapetina.inferencebench.dispatch.DispatchReport}.
 * The {@code toolcall} subpackage provides the tool-calling benchmark built on this flow.
 */
package fr.lapetina.inferencebench.dispatch;
