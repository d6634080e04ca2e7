/**
 * Performance measurement.
 *
 * <h2>Per-model statistics</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inferencebench.infrastructure.metrics.MetricsRecordingChatProvider} - Times every exchange</li>
 *   <li>{@link fr.lapetina.inferencebench.infrastructure.metrics.MetricsAggregator} - Aggregates and persists the timings</li>
 * </ul>
 *
 * <h2>Dispatch meters</h2>
 * <p>{@link fr.lapetina.inferencebench.infrastructure.metrics.MetricsRegistry} exposes job
 * counters, job latency and batch durations in Prometheus format.
 */
package fr.lapetina.inferencebench.infrastructure.metrics;
