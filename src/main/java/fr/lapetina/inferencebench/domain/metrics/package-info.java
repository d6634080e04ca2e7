/**
 * Per-model performance statistics.
 *
 * <p>{@link fr.lapetina.inferencebench.domain.metrics.RunningStat} keeps mean, variance,
 * min and max in constant space with Welford's update. Five of them make a
 * {@link fr.lapetina.inferencebench.domain.metrics.RunningAggregatedStats}, kept once per
 * model and once per {@link fr.lapetina.inferencebench.domain.metrics.InputTokenBucket}.
 *
 * <p>Field names are the snake_case names of the persisted metrics file.
 */
package fr.lapetina.inferencebench.domain.metrics;
