package fr.lapetina.inferencebench.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool invocation requested by the model.
 * Arguments keep their JSON types (strings, numbers, nested maps).
 */
public record ToolCall(String name, Map<String, Object> arguments) {

    public ToolCall {
        name = Objects.requireNonNullElse(name, "");
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
    }

    public String argumentAsString(String key) {
        Object value = arguments.get(key);
        return value != null ? value.toString() : null;
    }
}
