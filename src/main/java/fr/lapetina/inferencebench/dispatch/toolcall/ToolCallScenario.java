package fr.lapetina.inferencebench.dispatch.toolcall;

import fr.lapetina.inferencebench.domain.model.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The prompt sent to every model and the tool call expected back.
 *
 * @param prompt           user message
 * @param tool             the single tool offered
 * @param argumentName     argument checked in the model's call
 * @param expectedArgument value that argument must carry
 */
public record ToolCallScenario(String prompt, ToolDefinition tool, String argumentName, String expectedArgument) {

    public ToolCallScenario {
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(tool, "Tool is required");
        Objects.requireNonNull(argumentName, "Argument name is required");
        Objects.requireNonNull(expectedArgument, "Expected argument is required");
    }

    /**
     * Asks for the weather in Portland, OR through {@code get_current_weather(location)}.
     */
    public static ToolCallScenario weather() {
        return weather("What is the weather in Portland, OR?", "Portland, OR");
    }

    public static ToolCallScenario weather(String prompt, String expectedLocation) {
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("type", "string");
        location.put("description", "The city and state, e.g. San Francisco, CA");

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", Map.of("location", location));
        parameters.put("required", List.of("location"));

        ToolDefinition tool = new ToolDefinition(
                "get_current_weather", "Get the current weather for a given location", parameters);
        return new ToolCallScenario(prompt, tool, "location", expectedLocation);
    }

    public String toolName() {
        return tool.name();
    }
}
