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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized model reply: either plain text or a list of tool calls
 * (optionally with accompanying text).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelResponse {

    public enum Kind {
        PLAIN_TEXT, TOOL_CALLS
    }

    private Kind kind;
    private String text;
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();
    private ProviderUsage usage;
    private String model;

    public static ModelResponse plainText(String text) {
        return ModelResponse.builder()
                .kind(Kind.PLAIN_TEXT)
                .text(text)
                .build();
    }

    public static ModelResponse toolCalls(String text, List<ToolCall> calls) {
        return ModelResponse.builder()
                .kind(Kind.TOOL_CALLS)
                .text(text)
                .toolCalls(new ArrayList<>(calls))
                .build();
    }

    public boolean hasToolCalls() {
        return kind == Kind.TOOL_CALLS && toolCalls != null && !toolCalls.isEmpty();
    }
}
