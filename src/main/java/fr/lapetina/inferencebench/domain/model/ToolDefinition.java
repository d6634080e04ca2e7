package fr.lapetina.inferencebench.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A function the model may call, described by a JSON schema.
 */
public record ToolDefinition(String name, String description, Map<String, Object> parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "Tool name is required");
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    /**
     * Returns the OpenAI-style {@code {"type": "function", "function": {...}}} payload
     * understood by both Ollama and llama.cpp.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        if (description != null && !description.isBlank()) {
            function.put("description", description);
        }
        if (!parameters.isEmpty()) {
            function.put("parameters", parameters);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "function");
        payload.put("function", function);
        return payload;
    }
}
