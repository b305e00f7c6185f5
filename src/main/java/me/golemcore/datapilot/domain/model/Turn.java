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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a project's conversation history.
 *
 * <p>
 * Turns are totally ordered by {@link #sequence}, which the state service
 * assigns on append. Once appended a turn is never modified; readers only ever
 * see copies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Turn {

    private Long sequence;
    private String projectId;
    private TurnRole role;
    @Builder.Default
    private TurnKind kind = TurnKind.MESSAGE;
    private String content;

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    // Set on TOOL turns: which call this answers.
    private String toolCallId;
    private String toolName;
    private ToolInvocation invocation;

    @Builder.Default
    private List<Artifact> artifacts = new ArrayList<>();
    @Builder.Default
    private TurnVisibility visibility = TurnVisibility.ALL;
    private Instant timestamp;

    // Set on assistant turns produced by a model call.
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ProviderUsage usage;

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    @JsonIgnore
    public boolean isVisibleToModel() {
        return visibility == null || visibility.visibleToModel();
    }

    @JsonIgnore
    public boolean isVisibleToUser() {
        return visibility == null || visibility.visibleToUser();
    }
}
