/**
 * Domain model for the inference dispatcher.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inferencebench.domain.model.Host} - A backend host and its declared type</li>
 *   <li>{@link fr.lapetina.inferencebench.domain.model.StreamRequest} - A chat exchange to run</li>
 *   <li>{@link fr.lapetina.inferencebench.domain.model.StreamMetadata} - Final timings and counts of an exchange</li>
 *   <li>{@link fr.lapetina.inferencebench.domain.model.ErrorType} - Error classification</li>
 * </ul>
 *
 * <p>All types are immutable and safe to share between dispatcher workers.
 */
package fr.lapetina.inferencebench.domain.model;
