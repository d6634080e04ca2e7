package fr.lapetina.inferencebench.dispatch.toolcall;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.inferencebench.dispatch.Job;
import fr.lapetina.inferencebench.dispatch.JobExecutor;
import fr.lapetina.inferencebench.domain.model.ChatMessage;
import fr.lapetina.inferencebench.domain.model.Host;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;
import fr.lapetina.inferencebench.domain.model.StreamRequest;
import fr.lapetina.inferencebench.domain.provider.CallContext;
import fr.lapetina.inferencebench.domain.provider.ChatProvider;
import fr.lapetina.inferencebench.domain.provider.StreamCallbacks;
import fr.lapetina.inferencebench.infrastructure.http.JsonHttpClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends the scenario prompt with its tool to the job's model, as one non-streamed
 * exchange, and returns the backend's raw response document.
 */
public final class ToolCallJobExecutor implements JobExecutor {

    private final ChatProvider provider;
    private final ToolCallScenario scenario;
    private final ObjectMapper objectMapper = JsonHttpClient.createObjectMapper();

    public ToolCallJobExecutor(ChatProvider provider, ToolCallScenario scenario) {
        this.provider = provider;
        this.scenario = scenario;
    }

    @Override
    public String execute(CallContext ctx, Host host, Job job) {
        StreamRequest request = StreamRequest.builder()
                .host(host)
                .model(job.model())
                .message(ChatMessage.user(scenario.prompt()))
                .tools(List.of(scenario.tool()))
                .disableStreaming(true)
                .build();

        StringBuilder content = new StringBuilder();
        AtomicReference<StreamMetadata> completed = new AtomicReference<>();
        provider.stream(ctx, request, new StreamCallbacks(
                chunk -> content.append(chunk.content()),
                completed::set));

        StreamMetadata metadata = completed.get();
        if (metadata != null && metadata.rawResponse() != null) {
            return metadata.rawResponse().toString();
        }
        // Backend answered without a document, e.g. a model without tool support.
        ObjectNode message = objectMapper.createObjectNode()
                .put("role", ChatMessage.ASSISTANT)
                .put("content", content.toString());
        ObjectNode document = objectMapper.createObjectNode().put("model", job.model());
        document.set("message", message);
        return document.toString();
    }
}
