/**
 * Backend adapters. One {@link fr.lapetina.inferencebench.domain.provider.ChatProvider} per host type.
 *
 * <h2>Tool calls</h2>
 * <p>Structured {@code tool_calls} are preferred. Models that answer with a legacy
 * {@code <tool_call>} block in their text are parsed leniently by
 * {@link fr.lapetina.inferencebench.infrastructure.provider.ToolCallParsing}.
 */
package fr.lapetina.inferencebench.infrastructure.provider;
