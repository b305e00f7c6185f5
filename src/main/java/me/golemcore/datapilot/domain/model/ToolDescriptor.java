package me.golemcore.datapilot.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of one catalog tool: its parameter schema, side
 * effects, and the entry point the sandbox runner dispatches to.
 */
@Value
@Builder(toBuilder = true)
public class ToolDescriptor {

    String name;
    String description;
    @Singular
    List<ToolParameter> parameters;
    ToolSideEffects sideEffects;
    String entryPoint;
    // Overrides the configured sandbox timeout when set.
    Duration timeout;

    public Optional<ToolParameter> parameter(String parameterName) {
        return parameters.stream()
                .filter(parameter -> parameter.getName().equals(parameterName))
                .findFirst();
    }

    public PipelineStage stage() {
        return sideEffects != null ? sideEffects.getStage() : null;
    }

    /**
     * JSON schema of the arguments object, in the shape model providers expect
     * for function parameters.
     */
    public Map<String, Object> toInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter parameter : parameters) {
            properties.put(parameter.getName(), parameterSchema(parameter));
            if (parameter.isRequired()) {
                required.add(parameter.getName());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static Map<String, Object> parameterSchema(ToolParameter parameter) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", parameter.getType().jsonType());
        String description = parameter.getDescription();
        if (parameter.getType() == ParameterType.ARTIFACT) {
            String example = parameter.getArtifactName() != null ? parameter.getArtifactName() : "dataset";
            String hint = "Artifact reference such as " + example + "@latest or " + example + "@1";
            description = description == null ? hint : description + ". " + hint;
        }
        if (description != null) {
            schema.put("description", description);
        }
        if (!parameter.getAllowedValues().isEmpty()) {
            schema.put("enum", parameter.getAllowedValues());
        }
        if (parameter.getMinimum() != null) {
            schema.put("minimum", parameter.getMinimum());
        }
        if (parameter.getMaximum() != null) {
            schema.put("maximum", parameter.getMaximum());
        }
        if (parameter.getType() == ParameterType.STRING_LIST) {
            schema.put("items", Map.of("type", "string"));
        }
        if (parameter.getDefaultValue() != null) {
            schema.put("default", parameter.getDefaultValue());
        }
        return schema;
    }
}
