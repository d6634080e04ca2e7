package fr.lapetina.inferencebench.infrastructure.provider.ollama;

import com.fasterxml.jackson.databind.JsonNode;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for Ollama hosts.
 *
 * Uses {@code /api/chat} for exchanges (NDJSON when streaming), {@code /api/ps} for
 * loaded models and {@code /api/generate} to warm a model.
 */
public final class OllamaChatProvider implements ChatProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatProvider.class);

    static final String NO_TOOL_CAPABILITY_MESSAGE = "This model does not have tool capabilities.";

    private final JsonHttpClient http;

    public OllamaChatProvider(JsonHttpClient http) {
        this.http = http;
    }

    @Override
    public List<String> loadedModels(CallContext ctx, Host host) {
        String operation = "ollama: /api/ps";
        JsonHttpClient.Result result = http.get(ctx, host.resolve("api/ps"), operation);
        if (!result.isSuccess()) {
            throw ProviderException.badStatus(operation, result.statusCode(), result.body());
        }
        List<String> names = new ArrayList<>();
        for (JsonNode model : http.parse(result.body(), operation).path("models")) {
            String name = model.path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        log.debug("Loaded models: host={}, models={}", host.getName(), names);
        return names;
    }

    @Override
    public void ensureModelReady(CallContext ctx, Host host, String model) {
        String operation = "ollama: /api/generate";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", ".");
        payload.put("stream", false);

        log.info("Warming model: host={}, model={}", host.getName(), model);
        JsonHttpClient.Result result = http.post(ctx, host.resolve("api/generate"), payload, operation);
        if (result.statusCode() != 200) {
            throw ProviderException.badStatus(operation, result.statusCode(), result.body());
        }
    }

    @Override
    public void unloadModel(CallContext ctx, Host host, String model) {
        String operation = "ollama: unload " + model;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("keep_alive", 0);

        JsonHttpClient.Result result = http.post(ctx, host.resolve("api/chat"), payload, operation);
        if (result.statusCode() >= 400) {
            throw ProviderException.badStatus(operation, result.statusCode(), result.body());
        }
        log.info("Model unloaded: host={}, model={}", host.getName(), model);
    }

    @Override
    public void stream(CallContext ctx, StreamRequest request, StreamCallbacks callbacks) {
        String operation = "ollama: /api/chat";
        boolean streaming = !request.disableStreaming();

        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isEmpty()) {
            messages.add(ChatMessage.system(request.systemPrompt()));
        }
        messages.addAll(request.messages());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", messages);
        payload.put("options", request.parameters());
        payload.put("stream", streaming);
        if (request.hasTools()) {
            payload.put("tools", request.tools().stream().map(ToolDefinition::toPayload).toList());
            log.debug("Tools offered: host={}, tools={}",
                    request.host().getName(), request.tools().stream().map(ToolDefinition::name).toList());
        }
        if (request.jsonMode()) {
            payload.put("format", "json");
        }

        try (JsonHttpClient.Streaming response = http.openStream(
                ctx, request.host().resolve("api/chat"), payload, null, operation)) {

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
                readStream(response, request, callbacks, operation);
            } else {
                readDocument(readRoot(response, request, callbacks, operation), request, callbacks);
            }
        }
    }

    /**
     * Reads and parses a non-streamed reply. A failure here completes with {@code done=false}
     * before rethrowing, as an aborted stream does.
     */
    private JsonNode readRoot(JsonHttpClient.Streaming response, StreamRequest request,
                              StreamCallbacks callbacks, String operation) {
        try {
            return http.parse(response.readBody(), operation);
        } catch (ProviderException e) {
            log.warn("Response aborted: host={}, model={}, errorType={}, error={}",
                    request.host().getName(), request.model(), e.getErrorType(), e.getMessage());
            callbacks.complete(metadata(null, request, List.of(), false));
            throw e;
        }
    }

    private void readDocument(JsonNode root, StreamRequest request, StreamCallbacks callbacks) {
        JsonNode message = root.path("message");
        String output = message.path("content").asText("");

        List<ToolCall> toolCalls = ToolCallParsing.fromToolCallsNode(message.path("tool_calls"));
        if (toolCalls.isEmpty()) {
            ToolCallParsing.LegacyResult legacy = ToolCallParsing.parseLegacy(output, request.tools());
            if (legacy.found()) {
                toolCalls = legacy.calls();
                output = legacy.remainingContent();
            }
        }
        if (!toolCalls.isEmpty()) {
            output = ToolCallParsing.summarize(toolCalls);
        }

        if (!output.isBlank()) {
            String role = message.path("role").asText("");
            callbacks.chunk(new ChatMessage(role.isEmpty() ? ChatMessage.ASSISTANT : role, output));
        }
        callbacks.complete(metadata(root, request, toolCalls, true));
    }

    private void readStream(JsonHttpClient.Streaming response, StreamRequest request,
                            StreamCallbacks callbacks, String operation) {
        JsonNode last = null;
        boolean done = false;
        List<ToolCall> toolCalls = new ArrayList<>();
        try {
            String line;
            while ((line = response.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode chunk = http.parse(line, operation);
                if (chunk.hasNonNull("error")) {
                    throw new ProviderException(ErrorType.PROTOCOL_ERROR,
                            operation + ": stream error: " + chunk.path("error").asText(),
                            response.statusCode(), line, null);
                }
                last = chunk;
                JsonNode message = chunk.path("message");
                toolCalls.addAll(ToolCallParsing.fromToolCallsNode(message.path("tool_calls")));
                callbacks.chunk(new ChatMessage(message.path("role").asText(ChatMessage.ASSISTANT),
                        message.path("content").asText("")));
                if (chunk.path("done").asBoolean(false)) {
                    done = true;
                    break;
                }
            }
        } catch (ProviderException e) {
            log.warn("Stream aborted: host={}, model={}, errorType={}, error={}",
                    request.host().getName(), request.model(), e.getErrorType(), e.getMessage());
            callbacks.complete(metadata(last, request, toolCalls, false));
            throw e;
        }
        if (!done) {
            log.warn("Stream ended without a final chunk: host={}, model={}", request.host().getName(), request.model());
        }
        callbacks.complete(metadata(last, request, toolCalls, done));
    }

    private static StreamMetadata metadata(JsonNode node, StreamRequest request, List<ToolCall> toolCalls, boolean done) {
        StreamMetadata.Builder builder = StreamMetadata.builder()
                .model(request.model())
                .createdAt(Instant.now())
                .done(done)
                .toolCalls(toolCalls)
                .rawResponse(node);
        if (node == null) {
            return builder.build();
        }
        String model = node.path("model").asText("");
        return builder
                .model(model.isEmpty() ? request.model() : model)
                .totalDuration(node.path("total_duration").asLong())
                .loadDuration(node.path("load_duration").asLong())
                .promptEvalCount(node.path("prompt_eval_count").asInt())
                .promptEvalDuration(node.path("prompt_eval_duration").asLong())
                .evalCount(node.path("eval_count").asInt())
                .evalDuration(node.path("eval_duration").asLong())
                .build();
    }

    @Override
    public void close() {
        http.close();
    }
}
