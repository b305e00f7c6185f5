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

import me.golemcore.datapilot.domain.exception.Violation;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.Turn;

import java.util.List;

/**
 * Appends the turns of one orchestration step to the project history. Every
 * method returns the stored turn with its assigned sequence.
 */
public interface HistoryWriter {

    Turn appendUser(String projectId, String text);

    Turn appendAssistantToolCalls(String projectId, ModelResponse response);

    /**
     * Tells the model why a proposed call was rejected. An empty violation
     * list means the call itself was valid but another call of the same
     * response was not.
     */
    Turn appendCorrection(String projectId, ToolCall call, List<Violation> violations);

    Turn appendToolResult(String projectId, ToolExecutionOutcome outcome, List<ToolCall> notExecuted);

    Turn appendSkipped(String projectId, ToolCall call, String reason);

    Turn appendAssistantText(String projectId, String text, ProviderUsage usage);

    Turn appendSummary(String projectId, List<ToolExecutionOutcome> outcomes, PipelineStage stage);

    Turn appendFailure(String projectId, String message);
}
