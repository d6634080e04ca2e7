/**
 * Inference Bench - dispatches benchmark jobs across a fleet of LLM inference hosts.
 *
 * <p>Hosts may run Ollama or llama.cpp; a multiplexer routes every call to the adapter
 * for the host's type. Jobs are executed in batches of one job per host, with a reset
 * barrier (unloading every loaded model) between batches so each batch starts cold.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inferencebench.BenchFactory} - Wires providers, metrics and the
 *       dispatcher from YAML configuration</li>
 *   <li>{@link fr.lapetina.inferencebench.InferenceBenchApplication} - Command-line runner that
 *       executes the tool-calling benchmark and writes the reports</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BenchFactory factory = BenchFactory.create("config.yaml").start()) {
 *     DispatchReport report = factory.getDispatcher()
 *             .run(CallContext.background(), factory.getJobs(), factory.getIterations());
 *     factory.getReportWriter().write(report);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Per-model performance statistics persisted to JSON (Welford running stats)</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Cancellation and per-job deadlines through {@link fr.lapetina.inferencebench.domain.provider.CallContext}</li>
 * </ul>
 *
 * @see fr.lapetina.inferencebench.dispatch.BatchDispatcher
 */
package fr.lapetina.inferencebench;
