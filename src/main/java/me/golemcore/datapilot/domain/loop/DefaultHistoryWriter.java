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
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ExecutionResult;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnKind;
import me.golemcore.datapilot.domain.model.TurnRole;
import me.golemcore.datapilot.domain.model.TurnVisibility;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.LoopProperties;
import me.golemcore.datapilot.port.outbound.ProjectPort;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class DefaultHistoryWriter implements HistoryWriter {

    private final ProjectPort projects;
    private final LoopProperties settings;

    public DefaultHistoryWriter(ProjectPort projects, LoopProperties settings) {
        this.projects = projects;
        this.settings = settings;
    }

    @Override
    public Turn appendUser(String projectId, String text) {
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.USER)
                .kind(TurnKind.MESSAGE)
                .content(text)
                .build());
    }

    @Override
    public Turn appendAssistantToolCalls(String projectId, ModelResponse response) {
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.TOOL_CALLS)
                .content(response.getText())
                .toolCalls(new ArrayList<>(response.getToolCalls()))
                .usage(response.getUsage())
                .build());
    }

    @Override
    public Turn appendCorrection(String projectId, ToolCall call, List<Violation> violations) {
        String content;
        if (violations.isEmpty()) {
            content = "Not executed: another call in the same response was rejected. "
                    + "Send all calls again once every call is valid.";
        } else {
            content = "Rejected call to '" + call.getName() + "':\n"
                    + violations.stream()
                            .map(violation -> "- " + violation)
                            .collect(Collectors.joining("\n"))
                    + "\nFix these arguments and call the tool again.";
        }
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.TOOL)
                .kind(TurnKind.CORRECTION)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .content(content)
                .visibility(TurnVisibility.MODEL_ONLY)
                .build());
    }

    @Override
    public Turn appendToolResult(String projectId, ToolExecutionOutcome outcome, List<ToolCall> notExecuted) {
        ExecutionResult result = outcome.result();
        StringBuilder content = new StringBuilder();
        if (outcome.isSuccess()) {
            content.append("Tool ").append(outcome.toolName()).append(" succeeded.");
            if (!result.getArtifacts().isEmpty()) {
                content.append("\nArtifacts: ").append(references(result.getArtifacts()));
            }
            if (result.isRemediated()) {
                content.append("\nA missing dependency was installed before the run.");
            }
            if (result.getOutput() != null && !result.getOutput().isBlank()) {
                content.append("\nOutput:\n").append(result.getOutput());
            }
        } else {
            content.append("Tool ").append(outcome.toolName()).append(" failed (")
                    .append(result.getFailureKind()).append("): ").append(result.getFailureSummary());
            if (result.getErrorExcerpt() != null && !result.getErrorExcerpt().isBlank()) {
                content.append("\nError detail:\n")
                        .append(tail(result.getErrorExcerpt(), settings.getFailureExcerptChars()));
            }
            if (!notExecuted.isEmpty()) {
                content.append("\nNot executed: ")
                        .append(notExecuted.stream().map(ToolCall::getName).collect(Collectors.joining(", ")));
            }
        }

        Turn turn = Turn.builder()
                .role(TurnRole.TOOL)
                .kind(TurnKind.TOOL_RESULT)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .invocation(outcome.invocation())
                .content(content.toString())
                .build();
        List<Artifact> artifacts = result.getArtifacts() != null ? result.getArtifacts() : List.of();
        return projects.recordToolOutcome(projectId, turn, artifacts, outcome.isSuccess() ? outcome.stage() : null);
    }

    @Override
    public Turn appendSkipped(String projectId, ToolCall call, String reason) {
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.TOOL)
                .kind(TurnKind.TOOL_RESULT)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .content("Not executed: " + reason)
                .build());
    }

    @Override
    public Turn appendAssistantText(String projectId, String text, ProviderUsage usage) {
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.MESSAGE)
                .content(text)
                .usage(usage)
                .build());
    }

    @Override
    public Turn appendSummary(String projectId, List<ToolExecutionOutcome> outcomes, PipelineStage stage) {
        StringBuilder content = new StringBuilder();
        for (ToolExecutionOutcome outcome : outcomes) {
            content.append("Ran ").append(outcome.toolName());
            List<Artifact> artifacts = outcome.result().getArtifacts();
            if (artifacts != null && !artifacts.isEmpty()) {
                content.append(": produced ").append(references(artifacts));
            }
            content.append(".\n");
            String output = outcome.result().getOutput();
            if (output != null && !output.isBlank()) {
                content.append(head(output.strip(), settings.getSummaryOutputChars())).append('\n');
            }
        }
        if (stage != null) {
            content.append("Stage: ").append(stage.displayName()).append('.');
        }
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.SUMMARY)
                .content(content.toString().strip())
                .visibility(TurnVisibility.USER_ONLY)
                .build());
    }

    @Override
    public Turn appendFailure(String projectId, String message) {
        return projects.append(projectId, Turn.builder()
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.FAILURE)
                .content(message)
                .build());
    }

    private static String references(List<Artifact> artifacts) {
        return artifacts.stream().map(Artifact::reference).collect(Collectors.joining(", "));
    }

    private static String head(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, Math.max(0, limit - 3)) + "...";
    }

    // Error output ends with the most useful lines.
    private static String tail(String text, int limit) {
        return text.length() <= limit ? text : "..." + text.substring(text.length() - Math.max(0, limit - 3));
    }
}
