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

import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.PrivacyMode;
import me.golemcore.datapilot.domain.model.Project;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnKind;
import me.golemcore.datapilot.domain.model.TurnRole;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.LoopProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the bounded model view of a project.
 *
 * <p>
 * Only turns visible to the model are considered. The most recent
 * {@code contextWindowTurns} of them are sent verbatim; tool results at the
 * start of the window whose call fell outside it are dropped, since providers
 * reject a tool result without its call. For the same reason a tool-call turn
 * with a call that never got a result is dropped together with its partial
 * results. Everything older is condensed into a deterministic summary inside
 * the system prompt.
 */
public class DefaultConversationViewBuilder implements ConversationViewBuilder {

    private static final int SUMMARY_MAX_ENTRIES = 20;
    private static final int SUMMARY_TEXT_CHARS = 160;

    private final LoopProperties settings;

    public DefaultConversationViewBuilder(LoopProperties settings) {
        this.settings = settings;
    }

    @Override
    public ConversationView buildView(Project project, List<ToolDescriptor> catalog) {
        List<String> diagnostics = new ArrayList<>();
        List<Turn> visible = dropUnansweredCalls(project.getTurns().stream()
                .filter(Turn::isVisibleToModel)
                .toList(), diagnostics);
        int windowSize = Math.max(1, settings.getContextWindowTurns());
        int start = Math.max(0, visible.size() - windowSize);

        int orphans = 0;
        while (start < visible.size() && visible.get(start).getRole() == TurnRole.TOOL) {
            start++;
            orphans++;
        }
        if (orphans > 0) {
            diagnostics.add("dropped " + orphans + " tool result(s) whose call is outside the window");
        }

        List<Turn> omitted = visible.subList(0, start);
        List<Turn> window = visible.subList(start, visible.size());
        if (!omitted.isEmpty()) {
            diagnostics.add("summarized " + omitted.size() + " older turn(s)");
        }

        String systemPrompt = systemPrompt(project, catalog, summarize(omitted));
        return new ConversationView(systemPrompt, window, diagnostics);
    }

    private static List<Turn> dropUnansweredCalls(List<Turn> turns, List<String> diagnostics) {
        Set<String> answered = new HashSet<>();
        for (Turn turn : turns) {
            if (turn.getRole() == TurnRole.TOOL && turn.getToolCallId() != null) {
                answered.add(turn.getToolCallId());
            }
        }

        Set<String> droppedCalls = new HashSet<>();
        List<Turn> kept = new ArrayList<>();
        int droppedTurns = 0;
        for (Turn turn : turns) {
            if (turn.getKind() == TurnKind.TOOL_CALLS && turn.hasToolCalls()
                    && !turn.getToolCalls().stream().allMatch(call -> answered.contains(call.getId()))) {
                turn.getToolCalls().forEach(call -> droppedCalls.add(call.getId()));
                droppedTurns++;
            } else if (turn.getRole() == TurnRole.TOOL && droppedCalls.contains(turn.getToolCallId())) {
                droppedTurns++;
            } else {
                kept.add(turn);
            }
        }
        if (droppedTurns > 0) {
            diagnostics.add("dropped " + droppedTurns + " turn(s) of tool calls left without results");
        }
        return kept;
    }

    private String systemPrompt(Project project, List<ToolDescriptor> catalog, String summary) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are DataPilot, an assistant that carries a data-science project through its pipeline ")
                .append("by calling the available analysis tools on the user's behalf.\n");
        prompt.append("Pipeline stages in order: ")
                .append(Arrays.stream(PipelineStage.values())
                        .filter(stage -> stage != PipelineStage.DONE)
                        .map(PipelineStage::displayName)
                        .collect(Collectors.joining(", ")))
                .append(".\n");
        PipelineStage stage = project.getStage() != null ? project.getStage() : PipelineStage.INGEST;
        prompt.append("Current stage: ").append(stage.displayName()).append(".\n");

        Map<String, Integer> index = project.getArtifactIndex();
        if (index == null || index.isEmpty()) {
            prompt.append("Artifacts: none yet. Ask the user to upload a dataset before running analysis tools.\n");
        } else {
            prompt.append("Artifacts (latest versions): ")
                    .append(index.entrySet().stream()
                            .map(entry -> entry.getKey() + "@" + entry.getValue())
                            .collect(Collectors.joining(", ")))
                    .append(".\n");
        }
        prompt.append("Available tools: ").append(catalog.size()).append(".\n");

        prompt.append("\nRules:\n");
        prompt.append("- Call tools only with the parameters they declare.\n");
        prompt.append("- Refer to artifacts as name@version or name@latest.\n");
        prompt.append("- When a tool call is rejected, fix the arguments named in the error and call it again.\n");
        prompt.append("- When a tool fails, read the error and either retry with different arguments ")
                .append("or explain the problem to the user.\n");

        if (project.getPrivacyMode() == PrivacyMode.GUARDRAIL) {
            prompt.append("\nPrivacy: never request, print or reconstruct individual rows of the user's data. ")
                    .append("Work from schemas, summaries and statistics only.\n");
        }

        if (summary != null) {
            prompt.append("\nEarlier in this project:\n").append(summary);
        }
        return prompt.toString();
    }

    private String summarize(List<Turn> omitted) {
        if (omitted.isEmpty()) {
            return null;
        }
        List<String> entries = new ArrayList<>();
        for (Turn turn : omitted) {
            String entry = summaryEntry(turn);
            if (entry != null) {
                entries.add(entry);
            }
        }
        if (entries.isEmpty()) {
            return "(" + omitted.size() + " earlier turns without tool activity)\n";
        }

        StringBuilder summary = new StringBuilder();
        int skipped = Math.max(0, entries.size() - SUMMARY_MAX_ENTRIES);
        if (skipped > 0) {
            summary.append("(").append(skipped).append(" earlier entries)\n");
        }
        for (String entry : entries.subList(skipped, entries.size())) {
            summary.append("- ").append(entry).append('\n');
        }
        return summary.toString();
    }

    private static String summaryEntry(Turn turn) {
        if (turn.getRole() == TurnRole.USER && turn.getKind() == TurnKind.MESSAGE) {
            return "User: " + abbreviate(turn.getContent());
        }
        if (turn.getRole() == TurnRole.TOOL && turn.getKind() == TurnKind.TOOL_RESULT
                && turn.getInvocation() != null) {
            StringBuilder entry = new StringBuilder("Tool ")
                    .append(turn.getInvocation().getToolName())
                    .append(' ')
                    .append(String.valueOf(turn.getInvocation().getStatus()).toLowerCase(Locale.ROOT));
            if (turn.getInvocation().getFailureKind() != null) {
                entry.append(" (").append(turn.getInvocation().getFailureKind()).append(')');
            }
            if (turn.getArtifacts() != null && !turn.getArtifacts().isEmpty()) {
                entry.append(", produced ")
                        .append(turn.getArtifacts().stream()
                                .map(Artifact::reference)
                                .collect(Collectors.joining(", ")));
            }
            return entry.toString();
        }
        if (turn.getRole() == TurnRole.ASSISTANT && turn.getKind() == TurnKind.FAILURE) {
            return "Turn failed: " + abbreviate(turn.getContent());
        }
        return null;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= SUMMARY_TEXT_CHARS ? flat : flat.substring(0, SUMMARY_TEXT_CHARS) + "...";
    }
}
