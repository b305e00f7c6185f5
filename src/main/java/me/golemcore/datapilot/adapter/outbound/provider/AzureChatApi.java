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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Feign contract of the Azure OpenAI chat completions endpoint. Deployments
 * are addressed by path and every call carries an {@code api-version}.
 */
public interface AzureChatApi {

    @RequestLine("POST /openai/deployments/{deployment}/chat/completions?api-version={apiVersion}")
    @Headers({
            "Content-Type: application/json",
            "api-key: {apiKey}"
    })
    ChatCompletionResponse chatCompletion(@Param("deployment") String deployment,
            @Param("apiVersion") String apiVersion,
            @Param("apiKey") String apiKey,
            ChatCompletionRequest request);

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ChatCompletionRequest {
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
