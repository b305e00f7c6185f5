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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.model.ToolCall;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tool-call arguments travel as JSON text on every provider wire format.
 */
@Slf4j
final class ToolArgumentsJson {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    ToolArgumentsJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[Provider] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    /**
     * Build a call from the provider's wire fields. Argument text that is not a
     * JSON object leaves the arguments empty and is reported through
     * {@link ToolCall#getArgumentsError()}.
     */
    ToolCall toCall(String id, String name, String json) {
        ToolCall call = ToolCall.builder()
                .id(id != null ? id : "call_" + UUID.randomUUID())
                .name(name)
                .build();
        if (json == null || json.isBlank()) {
            return call;
        }
        try {
            call.setArguments(objectMapper.readValue(json, MAP_TYPE_REF));
        } catch (JsonProcessingException e) {
            log.warn("[Provider] Failed to parse arguments of {}: {}", name, e.getOriginalMessage());
            call.setArguments(new LinkedHashMap<>());
            call.setArgumentsError(e.getOriginalMessage());
        }
        return call;
    }
}
