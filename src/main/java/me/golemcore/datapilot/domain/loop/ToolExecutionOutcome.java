package me.golemcore.datapilot.domain.loop;

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

import me.golemcore.datapilot.domain.model.ExecutionResult;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.ToolInvocation;

/**
 * Result of one dispatched tool call, with the stage the tool belongs to.
 */
public record ToolExecutionOutcome(String toolCallId, ToolInvocation invocation, ExecutionResult result,
        PipelineStage stage) {

    public boolean isSuccess() {
        return result != null && result.isSuccess();
    }

    public String toolName() {
        return invocation.getToolName();
    }
}
