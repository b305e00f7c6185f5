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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ApiFunction;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ApiMessage;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ApiTool;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ApiToolCall;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ApiToolFunction;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ChatCompletionRequest;
import me.golemcore.datapilot.adapter.outbound.provider.AzureChatApi.ChatCompletionResponse;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderKind;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderProfileProperties;
import me.golemcore.datapilot.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Azure OpenAI backend over a Feign client.
 *
 * <p>
 * Azure addresses models by deployment rather than model name: the profile's
 * {@code deployment} (falling back to {@code model}) goes into the request
 * path and {@code api-version} into the query string. One client is kept per
 * endpoint and timeout.
 */
@Component
@Slf4j
public class AzureOpenAiProviderAdapter implements ProviderAdapter {

    private final FeignClientFactory feignClientFactory;
    private final ToolArgumentsJson argumentsJson;
    private final Map<String, AzureChatApi> clients = new ConcurrentHashMap<>();

    public AzureOpenAiProviderAdapter(FeignClientFactory feignClientFactory, ObjectMapper objectMapper) {
        this.feignClientFactory = feignClientFactory;
        this.argumentsJson = new ToolArgumentsJson(objectMapper);
    }

    @Override
    public Set<ProviderKind> kinds() {
        return Set.of(ProviderKind.AZURE_OPENAI);
    }

    @Override
    public ModelResponse complete(ResolvedProfile profile, ProviderRequest request, List<ToolDescriptor> catalog) {
        ProviderProfileProperties settings = profile.settings();
        if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("Azure OpenAI profile '" + profile.name() + "' has no base-url");
        }
        String deployment = settings.getDeployment() != null ? settings.getDeployment() : settings.getModel();
        if (deployment == null || deployment.isBlank()) {
            throw new IllegalArgumentException("Azure OpenAI profile '" + profile.name() + "' has no deployment");
        }

        AzureChatApi client = clients.computeIfAbsent(settings.getBaseUrl() + "#" + settings.getTimeoutMs(),
                key -> feignClientFactory.create(AzureChatApi.class, settings.getBaseUrl(), settings.getTimeoutMs()));

        log.trace("[Provider] Azure deployment {} (api-version {})", deployment, settings.getApiVersion());
        ChatCompletionResponse response = client.chatCompletion(deployment, settings.getApiVersion(),
                profile.apiKey(), buildRequest(settings, request, catalog));
        return convertResponse(response, deployment);
    }

    ChatCompletionRequest buildRequest(ProviderProfileProperties settings, ProviderRequest request,
            List<ToolDescriptor> catalog) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setTemperature(settings.getTemperature());
        apiRequest.setMaxTokens(settings.getMaxTokens());

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(message("system", request.getSystemPrompt()));
        }
        for (Turn turn : request.getTurns()) {
            messages.add(convertTurn(turn));
        }
        apiRequest.setMessages(messages);

        if (catalog != null && !catalog.isEmpty()) {
            apiRequest.setTools(catalog.stream()
                    .map(descriptor -> {
                        ApiToolFunction function = new ApiToolFunction();
                        function.setName(descriptor.getName());
                        function.setDescription(descriptor.getDescription());
                        function.setParameters(descriptor.toInputSchema());
                        ApiTool tool = new ApiTool();
                        tool.setType("function");
                        tool.setFunction(function);
                        return tool;
                    })
                    .toList());
        }
        return apiRequest;
    }

    private ApiMessage convertTurn(Turn turn) {
        String content = turn.getContent() != null ? turn.getContent() : "";
        return switch (turn.getRole()) {
        case USER -> message("user", content);
        case ASSISTANT -> {
            ApiMessage message = message("assistant", content);
            if (turn.hasToolCalls()) {
                message.setContent(content.isBlank() ? null : content);
                message.setToolCalls(turn.getToolCalls().stream()
                        .map(call -> {
                            ApiFunction function = new ApiFunction();
                            function.setName(call.getName());
                            function.setArguments(argumentsJson.write(call.getArguments()));
                            ApiToolCall apiCall = new ApiToolCall();
                            apiCall.setId(call.getId());
                            apiCall.setType("function");
                            apiCall.setFunction(function);
                            return apiCall;
                        })
                        .toList());
            }
            yield message;
        }
        case TOOL -> {
            ApiMessage message = message("tool", content);
            message.setToolCallId(turn.getToolCallId());
            yield message;
        }
        };
    }

    private static ApiMessage message(String role, String content) {
        ApiMessage message = new ApiMessage();
        message.setRole(role);
        message.setContent(content);
        return message;
    }

    private ModelResponse convertResponse(ChatCompletionResponse apiResponse, String deployment) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            throw new IllegalStateException("Azure OpenAI returned no choices");
        }
        ApiMessage message = apiResponse.getChoices().get(0).getMessage();

        ModelResponse result;
        if (message != null && message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            List<ToolCall> calls = message.getToolCalls().stream()
                    .map(apiCall -> argumentsJson.toCall(apiCall.getId(), apiCall.getFunction().getName(),
                            apiCall.getFunction().getArguments()))
                    .toList();
            result = ModelResponse.toolCalls(message.getContent(), calls);
        } else {
            String text = message != null && message.getContent() != null ? message.getContent() : "";
            result = ModelResponse.plainText(text);
        }

        if (apiResponse.getUsage() != null) {
            result.setUsage(new ProviderUsage(apiResponse.getUsage().getPromptTokens(),
                    apiResponse.getUsage().getCompletionTokens()));
        }
        result.setModel(apiResponse.getModel() != null ? apiResponse.getModel() : deployment);
        return result;
    }
}
