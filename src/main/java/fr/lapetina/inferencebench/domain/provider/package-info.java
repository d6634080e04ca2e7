/**
 * Backend-agnostic provider contract.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inferencebench.domain.provider.ChatProvider} - Capabilities every backend adapter offers</li>
 *   <li>{@link fr.lapetina.inferencebench.domain.provider.StreamCallbacks} - Chunk and completion hooks</li>
 *   <li>{@link fr.lapetina.inferencebench.domain.provider.CallContext} - Cancellation and deadlines</li>
 *   <li>{@link fr.lapetina.inferencebench.domain.provider.ProviderException} - Classified failures</li>
 * </ul>
 *
 * <h2>Routing</h2>
 * <p>{@link fr.lapetina.inferencebench.domain.provider.MultiplexChatProvider} lets callers
 * address a mixed fleet through one provider, selecting the adapter by host type.
 */
package fr.lapetina.inferencebench.domain.provider;
