package fr.lapetina.inferencebench.infrastructure.provider.llamacpp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fr.lapetina.inferencebench.domain.model.ChatMessage;
import fr.lapetina.inferencebench.domain.model.ErrorType;
import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;
import fr.lapetina.inferencebench.domain.model.StreamRequest;
import fr.lapetina.inferencebench.domain.model.ToolCall;
import fr.lapetina.inferencebench.domain.model.ToolDefinition;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ChatProvider;
import fr.lapetina.inferencebench.domain.provider.ProviderException;
import fr.lapetina.inferencebench.domain.provider.StreamCallbacks;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;
import fr.lapetina.inferencebench.infrastructure.provider.ToolCallParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapter for llama.cpp servers.
 *
 * Exchanges go through the OpenAI-compatible {@code /v1/chat/completions} endpoint
 * (SSE when streaming). Model management uses the router endpoints {@code /models},
 * {@code /models/load} and {@code /models/unload}; servers without them load models
 * on first use, so their absence is not an error.
 */
public final class LlamaCppChatProvider implements ChatProvider {

    private static final Logger log = LoggerFactory.getLogger(LlamaCppChatProvider.class);

    static final Duration LOAD_POLL_INTERVAL = Duration.ofMillis(200);
    static final String NO_TOOL_CAPABILITY_MESSAGE = "This model does not have tool capabilities.";

    private static final String SSE_DATA = "data:";
    private static final String SSE_DONE = "[DONE]";
    private static final List<String> RESERVED_KEYS =
            List.of("model", "messages", "stream", "tools", "tool_choice", "response_format");

    private final JsonHttpClient http;

    public LlamaCppChatProvider(JsonHttpClient http) {
        this.http = http;
    }

    @Override
    public List<String> loadedModels(CallContext ctx, Host host) {
        List<String> loaded = new ArrayList<>();
        for (JsonNode model : fetchModels(ctx, host)) {
            if ("loaded".equalsIgnoreCase(statusOf(model))) {
                String name = displayName(model);
                if (!name.isEmpty()) {
                    loaded.add(name);
                }
            }
        }
        log.debug("Loaded models: host={}, models={}", host.getName(), loaded);
        return loaded;
    }

    @Override
    public void ensureModelReady(CallContext ctx, Host host, String model) {
        String operation = "llama.cpp: /models/load";
        try (CallContext call = ctx.withTimeout(http.requestTimeout())) {
            JsonHttpClient.Result result = http.post(call, host.resolve("models/load"), Map.of("model", model), operation);
            int status = result.statusCode();
            if (status == 404 || status == 405) {
                log.debug("Router endpoints unavailable, relying on auto-load: host={}, model={}", host.getName(), model);
                return;
            }
            if (status >= 400 && !isAlreadyLoaded(status, result.body())) {
                throw ProviderException.badStatus(operation, status, result.body());
            }
            waitForModelLoaded(call, host, model);
        }
    }

    @Override
    public void unloadModel(CallContext ctx, Host host, String model) {
        String operation = "llama.cpp: /models/unload";
        JsonHttpClient.Result result = http.post(ctx, host.resolve("models/unload"), Map.of("model", model), operation);
        int status = result.statusCode();
        if (status == 404 || status == 405) {
            log.debug("Router endpoints unavailable, nothing to unload: host={}, model={}", host.getName(), model);
            return;
        }
        if (status >= 400) {
            throw ProviderException.badStatus(operation, status, result.body());
        }
        log.info("Model unloaded: host={}, model={}", host.getName(), model);
    }

    @Override
    public void stream(CallContext ctx, StreamRequest request, StreamCallbacks callbacks) {
        String operation = "llama.cpp: /v1/chat/completions";
        boolean streaming = !request.disableStreaming();

        if (!request.model().isBlank()) {
            ensureModelReady(ctx, request.host(), request.model());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        request.parameters().forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) {
                payload.put(key, value);
            }
        });
        payload.put("model", request.model());
        payload.put("messages", sanitize(request));
        payload.put("stream", streaming);
        if (request.jsonMode()) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        if (request.hasTools()) {
            payload.put("tools", request.tools().stream().map(ToolDefinition::toPayload).toList());
            payload.put("tool_choice", "auto");
            log.debug("Tools offered: host={}, tools={}",
                    request.host().getName(), request.tools().stream().map(ToolDefinition::name).toList());
        }

        try (JsonHttpClient.Streaming response = http.openStream(ctx, request.host().resolve("v1/chat/completions"),
                payload, streaming ? "text/event-stream" : null, operation)) {

            if (response.statusCode() != 200) {
                String body = response.readBody();
                if (!streaming && ToolCallParsing.isNoToolCapabilityResponse(body)) {
                    log.info("Model has no tool support: host={}, model={}", request.host().getName(), request.model());
                    callbacks.chunk(ChatMessage.assistant(NO_TOOL_CAPABILITY_MESSAGE));
                    callbacks.complete(StreamMetadata.builder()
                            .model(request.model())
                            .createdAt(Instant.now())
                            .done(true)
                            .build());
                    return;
                }
                throw ProviderException.badStatus(operation, response.statusCode(), body);
            }

            if (streaming) {
                readEvents(response, request, callbacks, operation);
            } else {
                readDocument(readRoot(response, request, callbacks, operation), request, callbacks);
            }
        }
    }

    /**
     * Reads and validates a non-streamed reply. A failure here completes with {@code done=false}
     * before rethrowing, as an aborted event stream does.
     */
    private JsonNode readRoot(JsonHttpClient.Streaming response, StreamRequest request,
                              StreamCallbacks callbacks, String operation) {
        try {
            String body = response.readBody();
            JsonNode root = http.parse(body, operation);
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new ProviderException(ErrorType.PROTOCOL_ERROR,
                        "llama.cpp: chat response contained no choices", 200, body, null);
            }
            return root;
        } catch (ProviderException e) {
            log.warn("Response aborted: host={}, model={}, errorType={}, error={}",
                    request.host().getName(), request.model(), e.getErrorType(), e.getMessage());
            callbacks.complete(StreamMetadata.builder()
                    .model(request.model())
                    .createdAt(Instant.now())
                    .done(false)
                    .build());
            throw e;
        }
    }

    private void readDocument(JsonNode root, StreamRequest request, StreamCallbacks callbacks) {
        JsonNode message = root.path("choices").get(0).path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = ToolCallParsing.fromToolCallsNode(message.path("tool_calls"));
        if (!toolCalls.isEmpty()) {
            content = ToolCallParsing.summarize(toolCalls);
        }
        if (!content.isBlank()) {
            String role = message.path("role").asText("");
            callbacks.chunk(new ChatMessage(role.isEmpty() ? ChatMessage.ASSISTANT : role, content));
        }
        callbacks.complete(withTimings(root.path("timings"), StreamMetadata.builder()
                .model(modelOr(root, request))
                .createdAt(Instant.now())
                .done(true)
                .toolCalls(toolCalls)
                .rawResponse(root))
                .build());
    }

    private void readEvents(JsonHttpClient.Streaming response, StreamRequest request,
                            StreamCallbacks callbacks, String operation) {
        String model = request.model();
        JsonNode last = null;
        JsonNode timings = null;
        boolean done = false;
        List<ToolCall> toolCalls = new ArrayList<>();
        try {
            String line;
            while ((line = response.readLine()) != null) {
                line = line.trim();
                if (!line.startsWith(SSE_DATA)) {
                    continue;
                }
                String data = line.substring(SSE_DATA.length()).trim();
                if (SSE_DONE.equals(data)) {
                    done = true;
                    break;
                }
                JsonNode chunk = http.parse(data, operation);
                last = chunk;
                model = modelOr(chunk, request);
                if (chunk.has("timings")) {
                    timings = chunk.get("timings");
                }
                JsonNode choices = chunk.path("choices");
                if (!choices.isArray() || choices.isEmpty()) {
                    continue;
                }
                JsonNode delta = choices.get(0).path("delta");
                JsonNode message = choices.get(0).path("message");
                toolCalls.addAll(ToolCallParsing.fromToolCallsNode(delta.path("tool_calls")));
                toolCalls.addAll(ToolCallParsing.fromToolCallsNode(message.path("tool_calls")));

                String content = delta.path("content").asText("");
                String role = delta.path("role").asText("");
                if (content.isEmpty() && !message.path("content").asText("").isEmpty()) {
                    content = message.path("content").asText("");
                    role = message.path("role").asText("");
                }
                if (!content.isBlank()) {
                    callbacks.chunk(new ChatMessage(role.isEmpty() ? ChatMessage.ASSISTANT : role, content));
                }
            }
            if (!toolCalls.isEmpty()) {
                callbacks.chunk(ChatMessage.assistant(ToolCallParsing.summarize(toolCalls)));
            }
        } catch (ProviderException e) {
            log.warn("Stream aborted: host={}, model={}, errorType={}, error={}",
                    request.host().getName(), request.model(), e.getErrorType(), e.getMessage());
            callbacks.complete(withTimings(timings, StreamMetadata.builder()
                    .model(model)
                    .createdAt(Instant.now())
                    .done(false)
                    .toolCalls(toolCalls)
                    .rawResponse(last))
                    .build());
            throw e;
        }
        callbacks.complete(withTimings(timings, StreamMetadata.builder()
                .model(model)
                .createdAt(Instant.now())
                .done(true)
                .toolCalls(toolCalls)
                .rawResponse(last))
                .build());
        if (!done) {
            log.debug("Event stream closed without [DONE]: host={}, model={}", request.host().getName(), model);
        }
    }

    private static StreamMetadata.Builder withTimings(JsonNode timings, StreamMetadata.Builder builder) {
        if (timings == null || !timings.isObject()) {
            return builder;
        }
        double promptMs = timings.path("prompt_ms").asDouble();
        double predictedMs = timings.path("predicted_ms").asDouble();
        return builder
                .totalDuration(millisToNanos(promptMs + predictedMs))
                .promptEvalCount(timings.path("prompt_n").asInt())
                .promptEvalDuration(millisToNanos(promptMs))
                .evalCount(timings.path("predicted_n").asInt())
                .evalDuration(millisToNanos(predictedMs));
    }

    static long millisToNanos(double millis) {
        if (millis <= 0) {
            return 0;
        }
        return (long) (millis * 1_000_000d);
    }

    private static String modelOr(JsonNode node, StreamRequest request) {
        String model = node.path("model").asText("");
        return model.isEmpty() ? request.model() : model;
    }

    /**
     * Trims messages, defaults a missing role to {@code user} and drops empty
     * non-assistant turns, which llama.cpp rejects.
     */
    static List<ChatMessage> sanitize(StreamRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isEmpty()) {
            messages.add(ChatMessage.system(request.systemPrompt()));
        }
        messages.addAll(request.messages());

        List<ChatMessage> sanitized = new ArrayList<>();
        for (ChatMessage message : messages) {
            String role = message.role().trim();
            String content = message.content().trim();
            if (role.isEmpty()) {
                role = ChatMessage.USER;
            }
            if (!ChatMessage.ASSISTANT.equals(role) && content.isEmpty()) {
                continue;
            }
            sanitized.add(new ChatMessage(role, content));
        }
        return sanitized;
    }

    private List<JsonNode> fetchModels(CallContext ctx, Host host) {
        String operation = "llama.cpp: /models";
        JsonHttpClient.Result result = http.get(ctx, host.resolve("models"), operation);
        if (result.statusCode() != 200) {
            throw ProviderException.badStatus(operation, result.statusCode(), result.body());
        }
        return parseModels(http.parse(result.body(), operation), result.body());
    }

    /**
     * Accepts {@code {"data": [...]}}, {@code {"models": [...]}}, a bare array, or a
     * {@code {"models": ["name", ...]}} list of names. A non-empty {@code models} wins over {@code data}.
     */
    static List<JsonNode> parseModels(JsonNode root, String body) {
        List<JsonNode> models = new ArrayList<>();
        JsonNode entries;
        if (root.path("models").isArray() && !root.path("models").isEmpty()) {
            entries = root.path("models");
        } else if (root.path("data").isArray()) {
            entries = root.path("data");
        } else if (root.path("models").isArray() || root.isArray()) {
            entries = root.isArray() ? root : root.path("models");
        } else {
            throw new ProviderException(ErrorType.PROTOCOL_ERROR,
                    "llama.cpp: unrecognized /models response", 200, body, null);
        }
        for (JsonNode entry : entries) {
            if (entry.isTextual()) {
                models.add(JsonNodeFactory.instance.objectNode()
                        .put("name", entry.asText()));
            } else if (entry.isObject()) {
                models.add(entry);
            }
        }
        return models;
    }

    static String displayName(JsonNode model) {
        for (String key : List.of("id", "name", "model", "path")) {
            String value = model.path(key).asText("").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    /**
     * Status is either a plain string or an object with a {@code value} field.
     */
    static String statusOf(JsonNode model) {
        JsonNode status = model.path("status");
        if (status.isTextual()) {
            return status.asText().trim();
        }
        return status.path("value").asText("").trim();
    }

    private boolean isModelLoaded(CallContext ctx, Host host, String model) {
        for (JsonNode item : fetchModels(ctx, host)) {
            if (displayName(item).equalsIgnoreCase(model)) {
                return "loaded".equals(statusOf(item).toLowerCase(Locale.ROOT));
            }
        }
        return false;
    }

    private void waitForModelLoaded(CallContext call, Host host, String model) {
        String operation = "llama.cpp: model " + model + " did not load";
        while (!isModelLoaded(call, host, model)) {
            try {
                if (call.await(LOAD_POLL_INTERVAL)) {
                    throw call.doneException(operation, null);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(ErrorType.CANCELLED, operation + ": interrupted", e);
            }
        }
        log.info("Model ready: host={}, model={}", host.getName(), model);
    }

    static boolean isAlreadyLoaded(int status, String body) {
        return status == 400 && body != null && body.toLowerCase(Locale.ROOT).contains("already loaded");
    }

    @Override
    public void close() {
        http.close();
    }
}
