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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated tool call being (or having been) executed.
 *
 * <p>
 * Created by the orchestration loop in {@link InvocationStatus#PENDING},
 * advanced by the execution sandbox, and retained in the history of the tool
 * result turn for audit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    private String id;
    private String toolName;
    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();
    private Long originTurn;
    @Builder.Default
    private InvocationStatus status = InvocationStatus.PENDING;
    private FailureKind failureKind;
    private Instant startedAt;
    private Instant finishedAt;

    public void markRunning(Instant now) {
        this.status = InvocationStatus.RUNNING;
        this.startedAt = now;
    }

    public void markSucceeded(Instant now) {
        this.status = InvocationStatus.SUCCEEDED;
        this.failureKind = null;
        this.finishedAt = now;
    }

    public void markFailed(FailureKind kind, Instant now) {
        this.status = InvocationStatus.FAILED;
        this.failureKind = kind;
        this.finishedAt = now;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == InvocationStatus.SUCCEEDED || status == InvocationStatus.FAILED;
    }
}
