package fr.lapetina.inferencebench.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A chat exchange to run against one host.
 * Immutable and thread-safe.
 *
 * @param host             target host
 * @param model            model name
 * @param messages         conversation history, oldest first
 * @param systemPrompt     optional system prompt, prepended by the adapter
 * @param tools            tool definitions offered to the model
 * @param parameters       sampling parameters keyed by their wire names ({@code temperature}, {@code top_k}...)
 * @param jsonMode         ask the backend to constrain output to JSON
 * @param disableStreaming ask for a single response document instead of a stream
 */
public record StreamRequest(
        Host host,
        String model,
        List<ChatMessage> messages,
        String systemPrompt,
        List<ToolDefinition> tools,
        Map<String, Object> parameters,
        boolean jsonMode,
        boolean disableStreaming
) {
    public StreamRequest {
        Objects.requireNonNull(host, "Host is required");
        Objects.requireNonNull(model, "Model is required");
        messages = messages != null ? List.copyOf(messages) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Host host;
        private String model;
        private final List<ChatMessage> messages = new ArrayList<>();
        private String systemPrompt;
        private List<ToolDefinition> tools;
        private Map<String, Object> parameters;
        private boolean jsonMode;
        private boolean disableStreaming;

        /**
         * Sets the host and seeds system prompt and parameters from its configuration.
         */
        public Builder host(Host host) {
            this.host = host;
            if (host != null) {
                if (systemPrompt == null) {
                    systemPrompt = host.getSystemPrompt();
                }
                if (parameters == null && !host.getParameters().isEmpty()) {
                    parameters = host.getParameters();
                }
            }
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder message(ChatMessage message) {
            this.messages.add(message);
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder tools(List<ToolDefinition> tools) {
            this.tools = tools;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder jsonMode(boolean jsonMode) {
            this.jsonMode = jsonMode;
            return this;
        }

        public Builder disableStreaming(boolean disableStreaming) {
            this.disableStreaming = disableStreaming;
            return this;
        }

        public StreamRequest build() {
            return new StreamRequest(
                    host, model, messages, systemPrompt, tools, parameters,
                    jsonMode, disableStreaming
            );
        }
    }
}
