package me.golemcore.datapilot.adapter.outbound.provider;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderKind;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderProfileProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OpenAI and Anthropic backends through langchain4j chat models.
 *
 * <p>
 * Models are built once per profile and cached. Library-level retries are
 * disabled ({@code maxRetries(0)}); the {@link ProviderRouter} owns the retry
 * policy.
 *
 * <p>
 * Turns map onto chat messages as follows:
 * <ul>
 * <li>USER turns become user messages</li>
 * <li>ASSISTANT turns carrying tool calls become AI messages with tool
 * execution requests; other assistant turns become plain AI messages</li>
 * <li>TOOL turns become tool execution results keyed by the call id</li>
 * </ul>
 */
@Component
@Slf4j
public class Langchain4jProviderAdapter implements ProviderAdapter {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final ToolArgumentsJson argumentsJson;
    private final ChatModelFactory modelFactory;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Autowired
    public Langchain4jProviderAdapter(ObjectMapper objectMapper) {
        this(objectMapper, Langchain4jProviderAdapter::createModel);
    }

    Langchain4jProviderAdapter(ObjectMapper objectMapper, ChatModelFactory modelFactory) {
        this.argumentsJson = new ToolArgumentsJson(objectMapper);
        this.modelFactory = modelFactory;
    }

    @Override
    public Set<ProviderKind> kinds() {
        return Set.of(ProviderKind.OPENAI, ProviderKind.ANTHROPIC);
    }

    @Override
    public ModelResponse complete(ResolvedProfile profile, ProviderRequest request, List<ToolDescriptor> catalog) {
        ChatModel model = models.computeIfAbsent(profile.name(), name -> modelFactory.create(profile));

        List<ChatMessage> messages = convertMessages(request);
        List<ToolSpecification> tools = convertTools(catalog);

        ChatResponse response;
        if (!tools.isEmpty()) {
            log.trace("[Provider] Calling {} with {} tools", profile.name(), tools.size());
            response = model.chat(ChatRequest.builder()
                    .messages(messages)
                    .toolSpecifications(tools)
                    .build());
        } else {
            response = model.chat(ChatRequest.builder()
                    .messages(messages)
                    .build());
        }
        return convertResponse(response, profile.settings().getModel());
    }

    static ChatModel createModel(ResolvedProfile profile) {
        ProviderProfileProperties settings = profile.settings();
        Duration timeout = Duration.ofMillis(settings.getTimeoutMs());
        if (settings.getKind() == ProviderKind.ANTHROPIC) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(profile.apiKey())
                    .modelName(settings.getModel())
                    .maxRetries(0)
                    .maxTokens(settings.getMaxTokens())
                    .timeout(timeout);
            if (settings.getBaseUrl() != null) {
                builder.baseUrl(settings.getBaseUrl());
            }
            if (settings.getTemperature() != null) {
                builder.temperature(settings.getTemperature());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(profile.apiKey())
                .modelName(settings.getModel())
                .maxRetries(0)
                .maxTokens(settings.getMaxTokens())
                .timeout(timeout);
        if (settings.getBaseUrl() != null) {
            builder.baseUrl(settings.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(ProviderRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Turn turn : request.getTurns()) {
            String content = turn.getContent() != null ? turn.getContent() : "";
            switch (turn.getRole()) {
            case USER -> messages.add(UserMessage.from(content));
            case ASSISTANT -> {
                if (turn.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = turn.getToolCalls().stream()
                            .map(call -> ToolExecutionRequest.builder()
                                    .id(call.getId())
                                    .name(call.getName())
                                    .arguments(argumentsJson.write(call.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case TOOL -> messages.add(ToolExecutionResultMessage.from(
                    turn.getToolCallId(), turn.getToolName(), content));
            default -> log.warn("[Provider] Unknown turn role: {}, skipping", turn.getRole());
            }
        }
        return messages;
    }

    List<ToolSpecification> convertTools(List<ToolDescriptor> catalog) {
        if (catalog == null || catalog.isEmpty()) {
            return List.of();
        }
        return catalog.stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDescriptor descriptor) {
        Map<String, Object> schema = descriptor.toInputSchema();
        JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
        Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
        }
        List<String> required = (List<String>) schema.get("required");
        if (required != null && !required.isEmpty()) {
            schemaBuilder.required(required);
        }
        return ToolSpecification.builder()
                .name(descriptor.getName())
                .description(descriptor.getDescription())
                .parameters(schemaBuilder.build())
                .build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> parameterSchema) {
        String type = (String) parameterSchema.getOrDefault("type", "string");
        String description = (String) parameterSchema.get("description");
        List<String> enumValues = (List<String>) parameterSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            Map<String, Object> items = (Map<String, Object>) parameterSchema.get("items");
            builder.items(items != null ? toJsonSchemaElement(items) : JsonStringSchema.builder().build());
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private ModelResponse convertResponse(ChatResponse response, String configuredModel) {
        AiMessage aiMessage = response.aiMessage();
        ProviderUsage usage = convertUsage(response.tokenUsage());
        String model = response.metadata() != null && response.metadata().modelName() != null
                ? response.metadata().modelName()
                : configuredModel;

        ModelResponse result;
        if (aiMessage.hasToolExecutionRequests()) {
            List<ToolCall> calls = aiMessage.toolExecutionRequests().stream()
                    .map(request -> argumentsJson.toCall(request.id(), request.name(), request.arguments()))
                    .toList();
            log.trace("[Provider] Parsed {} tool calls from response", calls.size());
            result = ModelResponse.toolCalls(aiMessage.text(), calls);
        } else {
            result = ModelResponse.plainText(aiMessage.text() != null ? aiMessage.text() : "");
        }
        result.setUsage(usage);
        result.setModel(model);
        return result;
    }

    private static ProviderUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        int input = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        int output = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        return new ProviderUsage(input, output);
    }

    /**
     * Builds the chat model for a profile. Replaced in tests.
     */
    @FunctionalInterface
    interface ChatModelFactory {
        ChatModel create(ResolvedProfile profile);
    }
}
