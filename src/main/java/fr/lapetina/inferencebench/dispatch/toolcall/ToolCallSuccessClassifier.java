package fr.lapetina.inferencebench.dispatch.toolcall;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inferencebench.dispatch.Job;
import fr.lapetina.inferencebench.dispatch.SuccessClassifier;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;
import fr.lapetina.inferencebench.infrastructure.provider.ToolCallParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts a response when the model called the expected tool with the expected argument.
 *
 * <p>Two forms count:
 * <ol>
 *   <li>a structured call: the first entry of {@code tool_calls} names the tool and carries the argument;</li>
 *   <li>a call written into the content as {@code {"name": ..., "arguments": {...}}}.</li>
 * </ol>
 * The message is looked up at {@code choices[0].message} (OpenAI shape), then
 * {@code message} (Ollama shape), then the document root.
 *
 * <p>Embedded calls are found with a greedy single-line {@code \{.*\}} match, so two
 * objects on one line are read as one span and fail to parse.
 */
public final class ToolCallSuccessClassifier implements SuccessClassifier {

    private static final Logger log = LoggerFactory.getLogger(ToolCallSuccessClassifier.class);

    private static final Pattern EMBEDDED_OBJECT = Pattern.compile("\\{.*\\}");

    private final ToolCallScenario scenario;
    private final ObjectMapper objectMapper = JsonHttpClient.createObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public ToolCallSuccessClassifier(ToolCallScenario scenario) {
        this.scenario = scenario;
    }

    @Override
    public boolean isSuccess(Job job, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.info("Response is not JSON: job={}", job.id());
            return false;
        }
        if (root == null || !root.isObject()) {
            return false;
        }
        JsonNode message = locateMessage(root);

        JsonNode toolCalls = message.path("tool_calls");
        if (toolCalls.isArray() && !toolCalls.isEmpty()) {
            JsonNode function = toolCalls.get(0).path("function");
            if (matches(function.path("name").asText(""), ToolCallParsing.parseArguments(function.path("arguments")))) {
                log.info("Success via structured tool call: job={}", job.id());
                return true;
            }
        }

        String content = message.path("content").asText("");
        Matcher matcher = EMBEDDED_OBJECT.matcher(content);
        while (matcher.find()) {
            try {
                JsonNode embedded = objectMapper.readTree(matcher.group());
                if (embedded != null && embedded.isObject()
                        && matches(embedded.path("name").asText(""),
                        ToolCallParsing.parseArguments(embedded.path("arguments")))) {
                    log.info("Success via embedded JSON: job={}", job.id());
                    return true;
                }
            } catch (JsonProcessingException e) {
                log.debug("Embedded candidate is not JSON: job={}, candidate={}", job.id(), matcher.group());
            }
        }

        log.info("No valid tool call found: job={}", job.id());
        return false;
    }

    private boolean matches(String name, Map<String, Object> arguments) {
        return scenario.toolName().equals(name)
                && Objects.equals(scenario.expectedArgument(), stringValue(arguments.get(scenario.argumentName())));
    }

    private static String stringValue(Object value) {
        return value instanceof String ? (String) value : null;
    }

    static JsonNode locateMessage(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (choices.isArray() && !choices.isEmpty() && choices.get(0).path("message").isObject()) {
            return choices.get(0).path("message");
        }
        if (root.path("message").isObject()) {
            return root.path("message");
        }
        return root;
    }
}
