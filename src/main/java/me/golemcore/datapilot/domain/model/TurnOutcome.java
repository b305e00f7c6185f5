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

import java.util.List;

/**
 * Result of processing one user turn through the orchestration loop.
 *
 * @param projectId
 *            project the turn belongs to
 * @param completed
 *            {@code false} when the turn ended with a failure turn
 * @param turns
 *            every turn appended while processing, user turn first
 * @param stage
 *            pipeline stage after the turn
 * @param modelCalls
 *            provider completions made
 * @param toolExecutions
 *            tool invocations dispatched to the sandbox
 * @param usage
 *            tokens reported by the provider across all model calls
 */
public record TurnOutcome(String projectId, boolean completed, List<Turn> turns, PipelineStage stage,
        int modelCalls, int toolExecutions, ProviderUsage usage) {

    public Turn finalTurn() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }
}
