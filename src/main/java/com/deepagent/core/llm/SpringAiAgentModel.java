package com.deepagent.core.llm;

import com.deepagent.core.run.AgentMessage;
import com.deepagent.core.run.AgentModel;
import com.deepagent.core.run.ModelRequest;
import com.deepagent.core.run.ModelTurn;
import com.deepagent.core.run.ToolCall;
import com.deepagent.core.tools.ToolSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link AgentModel} over a Spring AI {@link ChatModel}, streaming tokens as they arrive.
 * <p>
 * Tools are advertised to the model but never executed by Spring AI: internal tool
 * execution is disabled so that proposed calls come back to the run loop, which decides
 * whether they run now or wait for review.
 */
public class SpringAiAgentModel implements AgentModel {

    private static final Logger log = LoggerFactory.getLogger(SpringAiAgentModel.class);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final ChatModel chatModel;
    private final LlmProperties properties;
    private final ObjectMapper objectMapper;

    public SpringAiAgentModel(ChatModel chatModel, LlmProperties properties, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ModelTurn next(ModelRequest request, Consumer<String> tokenSink) {
        ModelCatalog.ModelInfo model = ModelCatalog.resolve(request.modelId());
        Prompt prompt = new Prompt(toMessages(request.messages()), options(model, request.tools()));
        log.debug("Streaming {} message(s) to {} with {} tool(s)",
                request.messages().size(), model.endpointModel(), request.tools().size());

        var text = new StringBuilder();
        var calls = new LinkedHashMap<String, PartialCall>();
        String lastCallId = null;
        for (ChatResponse response : chatModel.stream(prompt).toIterable()) {
            if (response == null) {
                continue;
            }
            for (Generation generation : response.getResults()) {
                AssistantMessage output = generation.getOutput();
                if (output == null) {
                    continue;
                }
                String chunk = output.getText();
                if (chunk != null && !chunk.isEmpty()) {
                    text.append(chunk);
                    tokenSink.accept(chunk);
                }
                for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                    String id = call.id();
                    if (id == null || id.isBlank()) {
                        // continuation chunk of the previous call
                        if (lastCallId == null) {
                            lastCallId = "call_" + UUID.randomUUID();
                            calls.put(lastCallId, new PartialCall(lastCallId));
                        }
                        calls.get(lastCallId).merge(call);
                    } else {
                        calls.computeIfAbsent(id, PartialCall::new).merge(call);
                        lastCallId = id;
                    }
                }
            }
        }

        List<ToolCall> toolCalls = calls.values().stream()
                .filter(c -> c.name.length() > 0)
                .map(c -> new ToolCall(c.id, c.name.toString(), parseArguments(c.arguments.toString())))
                .toList();
        if (text.length() == 0 && toolCalls.isEmpty()) {
            throw new LlmEmptyResponseException("Model " + model.endpointModel() + " returned an empty response");
        }
        return new ModelTurn(text.toString(), toolCalls);
    }

    private ChatOptions options(ModelCatalog.ModelInfo model, List<ToolSpec> tools) {
        List<ToolCallback> callbacks = tools.stream()
                .map(spec -> (ToolCallback) new AdvertisedTool(ToolDefinition.builder()
                        .name(spec.name())
                        .description(spec.description())
                        .inputSchema(toJson(spec.inputSchema()))
                        .build()))
                .toList();
        return ToolCallingChatOptions.builder()
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false)
                .model(model.endpointModel())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .build();
    }

    List<Message> toMessages(List<AgentMessage> messages) {
        var out = new ArrayList<Message>(messages.size());
        for (AgentMessage m : messages) {
            switch (m.role()) {
                case SYSTEM -> out.add(new SystemMessage(m.content()));
                case USER -> out.add(new UserMessage(m.content()));
                case ASSISTANT -> out.add(new AssistantMessage(m.content(), Map.of(),
                        m.toolCalls().stream()
                                .map(c -> new AssistantMessage.ToolCall(c.id(), "function", c.name(),
                                        toJson(c.arguments())))
                                .toList()));
                case TOOL -> out.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(m.toolCallId(), m.toolName(), m.content()))));
            }
        }
        return out;
    }

    private Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, ARGS_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("Model produced unparseable tool arguments: {}", e.getOriginalMessage());
            return Map.of("input", json);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value, e);
        }
    }

    private static final class PartialCall {
        private final String id;
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();

        PartialCall(String id) {
            this.id = id;
        }

        void merge(AssistantMessage.ToolCall chunk) {
            if (chunk.name() != null && name.length() == 0) {
                name.append(chunk.name());
            }
            if (chunk.arguments() != null) {
                arguments.append(chunk.arguments());
            }
        }
    }

    /**
     * Carries a tool definition to the model. Execution stays with the run loop.
     */
    private record AdvertisedTool(ToolDefinition definition) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException(
                    "Tool " + definition.name() + " is executed by the agent runner, not the chat model");
        }
    }
}
