package fr.lapetina.inferencebench.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import fr.lapetina.inferencebench.domain.model.ToolCall;
import fr.lapetina.inferencebench.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Tool call extraction shared by the backend adapters.
 *
 * <p>Structured calls come from {@code tool_calls} arrays whose {@code function.arguments}
 * is either an object or a JSON-encoded string. Older models instead write
 * {@code <tool_call>...</tool_call>} blocks into the message content, often with single
 * quotes, trailing commas or alternative key names; those are parsed leniently.
 */
public final class ToolCallParsing {

    private static final String OPEN_TAG = "<tool_call>";
    private static final String CLOSE_TAG = "</tool_call>";
    private static final List<String> NAME_KEYS = List.of("name", "tool", "tool_name", "function");
    private static final List<String> ARGUMENT_KEYS = List.of("arguments", "params", "parameters");
    private static final Pattern BARE_ARGUMENT_VALUE = Pattern.compile("\"arguments\"\\s*:\\s*\\{\\s*\"[^\":}]+\"\\s*}");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build();

    private ToolCallParsing() {
    }

    /**
     * Reads a {@code tool_calls} array in the OpenAI/Ollama shape.
     */
    public static List<ToolCall> fromToolCallsNode(JsonNode toolCalls) {
        List<ToolCall> calls = new ArrayList<>();
        if (toolCalls == null || !toolCalls.isArray()) {
            return calls;
        }
        for (JsonNode entry : toolCalls) {
            JsonNode function = entry.path("function");
            calls.add(new ToolCall(function.path("name").asText(""), parseArguments(function.path("arguments"))));
        }
        return calls;
    }

    /**
     * Parses arguments given either as an object or as a JSON-encoded string.
     * Unparsable strings yield an empty map.
     */
    public static Map<String, Object> parseArguments(JsonNode arguments) {
        if (arguments == null || arguments.isMissingNode() || arguments.isNull()) {
            return Map.of();
        }
        if (arguments.isObject()) {
            return LENIENT.convertValue(arguments, MAP_TYPE);
        }
        if (arguments.isTextual()) {
            return parseLenientObject(arguments.asText()).orElse(Map.of());
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", LENIENT.convertValue(arguments, Object.class));
        return wrapped;
    }

    /**
     * Renders calls the way they are shown to a caller that runs no tools.
     */
    public static String summarize(List<ToolCall> calls) {
        List<String> lines = new ArrayList<>();
        for (ToolCall call : calls) {
            String args;
            try {
                args = LENIENT.writeValueAsString(call.arguments());
            } catch (JsonProcessingException e) {
                args = call.arguments().toString();
            }
            lines.add("[Tool call requested] " + call.name() + " args: " + args);
        }
        return String.join("\n", lines);
    }

    /**
     * Extracts calls from a {@code <tool_call>} block in message content.
     *
     * @return the calls found and the content with the block removed; no calls when the
     *         content has no block or the block cannot be read
     */
    public static LegacyResult parseLegacy(String content, List<ToolDefinition> available) {
        String text = content == null ? "" : content;
        String lower = text.toLowerCase(Locale.ROOT);
        int start = lower.indexOf(OPEN_TAG);
        if (start < 0) {
            return new LegacyResult(List.of(), text);
        }
        String before = text.substring(0, start).trim();
        String rest = text.substring(start + OPEN_TAG.length());
        int end = rest.toLowerCase(Locale.ROOT).indexOf(CLOSE_TAG);
        String payload = end < 0 ? rest : rest.substring(0, end);
        String after = end < 0 ? "" : rest.substring(end + CLOSE_TAG.length()).trim();

        List<ToolCall> calls = readLegacyPayload(payload.trim(), available, text);
        if (calls.isEmpty()) {
            return new LegacyResult(List.of(), text);
        }
        List<String> remaining = new ArrayList<>();
        if (!before.isEmpty()) {
            remaining.add(before);
        }
        if (!after.isEmpty()) {
            remaining.add(after);
        }
        return new LegacyResult(calls, String.join("\n", remaining));
    }

    private static List<ToolCall> readLegacyPayload(String payload, List<ToolDefinition> available, String content) {
        List<ToolCall> calls = new ArrayList<>();
        if (payload.isEmpty()) {
            return calls;
        }
        JsonNode root;
        try {
            root = LENIENT.readTree(BARE_ARGUMENT_VALUE.matcher(payload).replaceAll("\"arguments\":{}"));
        } catch (JsonProcessingException e) {
            return calls;
        }
        List<JsonNode> entries = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(entries::add);
        } else if (root.isObject()) {
            entries.add(root);
        }
        for (JsonNode entry : entries) {
            if (!entry.isObject()) {
                continue;
            }
            String name = legacyName(entry);
            Map<String, Object> args = legacyArguments(entry);
            JsonNode function = entry.path("function");
            if (function.isObject()) {
                String innerName = legacyName(function);
                if (!innerName.isEmpty()) {
                    name = innerName;
                }
                Map<String, Object> innerArgs = legacyArguments(function);
                if (innerArgs != null) {
                    args = innerArgs;
                }
            }
            calls.add(new ToolCall(resolveToolName(name, available, content), args));
        }
        return calls;
    }

    private static String legacyName(JsonNode node) {
        for (String key : NAME_KEYS) {
            JsonNode value = node.path(key);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return "";
    }

    private static Map<String, Object> legacyArguments(JsonNode node) {
        for (String key : ARGUMENT_KEYS) {
            JsonNode value = node.get(key);
            if (value == null) {
                continue;
            }
            if (value.isTextual()) {
                String text = value.asText().trim();
                if (text.isEmpty()) {
                    return Map.of();
                }
                var parsed = parseLenientObject(text);
                if (parsed.isPresent()) {
                    return parsed.get();
                }
                continue;
            }
            return parseArguments(value);
        }
        return null;
    }

    private static Optional<Map<String, Object>> parseLenientObject(String text) {
        try {
            JsonNode node = LENIENT.readTree(text);
            if (node != null && node.isObject()) {
                return Optional.of(LENIENT.convertValue(node, MAP_TYPE));
            }
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Maps a model-supplied tool name onto a declared tool: exact match ignoring case,
     * then substring match, then the only declared tool, then a tool named in the content.
     */
    static String resolveToolName(String candidate, List<ToolDefinition> available, String content) {
        String trimmed = candidate == null ? "" : candidate.trim();
        if (!trimmed.isEmpty()) {
            String lowerCandidate = trimmed.toLowerCase(Locale.ROOT);
            for (ToolDefinition tool : available) {
                if (tool.name().toLowerCase(Locale.ROOT).equals(lowerCandidate)) {
                    return tool.name();
                }
            }
            for (ToolDefinition tool : available) {
                String lowerTool = tool.name().toLowerCase(Locale.ROOT);
                if (lowerTool.contains(lowerCandidate) || lowerCandidate.contains(lowerTool)) {
                    return tool.name();
                }
            }
        }
        if (available.size() == 1) {
            return available.get(0).name();
        }
        String lowerContent = content.toLowerCase(Locale.ROOT);
        for (ToolDefinition tool : available) {
            if (lowerContent.contains(tool.name().toLowerCase(Locale.ROOT))) {
                return tool.name();
            }
        }
        return trimmed;
    }

    /**
     * Backend reply saying the model cannot use tools, matched on the raw text or on
     * the {@code error}/{@code message} fields of a JSON body.
     */
    public static boolean isNoToolCapabilityResponse(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        if (mentionsMissingToolSupport(body)) {
            return true;
        }
        try {
            JsonNode node = LENIENT.readTree(body);
            if (node != null && node.isObject()) {
                return mentionsMissingToolSupport(node.path("error").asText("") + " " + node.path("message").asText(""));
            }
        } catch (JsonProcessingException e) {
            return false;
        }
        return false;
    }

    private static boolean mentionsMissingToolSupport(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return lower.contains("tool") && (lower.contains("support") || lower.contains("capab"));
    }

    /**
     * Calls extracted from content, and the content left once the block is removed.
     */
    public record LegacyResult(List<ToolCall> calls, String remainingContent) {
        public boolean found() {
            return !calls.isEmpty();
        }
    }
}
