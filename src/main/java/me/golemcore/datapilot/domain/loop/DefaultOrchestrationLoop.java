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

import me.golemcore.datapilot.domain.exception.DataPilotException;
import me.golemcore.datapilot.domain.exception.ProviderException;
import me.golemcore.datapilot.domain.exception.SchemaValidationException;
import me.golemcore.datapilot.domain.exception.UnknownToolException;
import me.golemcore.datapilot.domain.exception.Violation;
import me.golemcore.datapilot.domain.model.FailureKind;
import me.golemcore.datapilot.domain.model.LoopState;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.Project;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.ToolInvocation;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnOutcome;
import me.golemcore.datapilot.domain.registry.ToolRegistry;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.LoopProperties;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import me.golemcore.datapilot.port.outbound.ProviderPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Orchestration state machine for one user turn.
 *
 * <pre>
 * AWAITING_USER -> MODEL_THINKING -> RESPONDING -> AWAITING_USER
 *                        |  ^
 *                        v  |
 *                  TOOL_DISPATCH -> RECOVERING
 * </pre>
 *
 * <p>
 * Contract of {@link #processTurn}:
 * <ul>
 * <li>Every call of a model response is validated before any of them runs. A
 * single invalid call rejects the whole response with one correction per call,
 * and the model gets {@code maxCorrectionRetries} further attempts.</li>
 * <li>Valid calls run sequentially in the order given. After a failure the
 * remaining calls are not executed and the model is asked to recover, at most
 * {@code maxRecoveries} times.</li>
 * <li>Model calls per user turn are capped at {@code maxModelCalls}.</li>
 * <li>Every way of ending a turn other than success appends a user-visible
 * failure turn. When a history write fails mid-turn, every call of the
 * current response still gets a result before the failure turn, so the
 * history stays replayable.</li>
 * </ul>
 */
public class DefaultOrchestrationLoop implements OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultOrchestrationLoop.class);

    private final ProjectPort projects;
    private final ProviderPort provider;
    private final ToolRegistry registry;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ConversationViewBuilder viewBuilder;
    private final LoopStateTracker stateTracker;
    private final LoopProperties settings;

    public DefaultOrchestrationLoop(ProjectPort projects, ProviderPort provider, ToolRegistry registry,
            ToolExecutorPort toolExecutor, HistoryWriter historyWriter, ConversationViewBuilder viewBuilder,
            LoopStateTracker stateTracker, LoopProperties settings) {
        this.projects = projects;
        this.provider = provider;
        this.registry = registry;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.viewBuilder = viewBuilder;
        this.stateTracker = stateTracker;
        this.settings = settings;
    }

    @Override
    public TurnOutcome processTurn(String projectId, String userText) {
        projects.snapshot(projectId);
        stateTracker.enter(projectId);
        try {
            TurnRun run = new TurnRun(projectId);
            run.turns.add(historyWriter.appendUser(projectId, userText));
            try {
                return drive(run);
            } catch (DataPilotException e) {
                return abort(run, e);
            }
        } finally {
            stateTracker.release(projectId);
        }
    }

    private TurnOutcome drive(TurnRun run) {
        String projectId = run.projectId;
        List<ToolDescriptor> catalog = registry.catalog();

        while (true) {
            if (run.modelCalls >= settings.getMaxModelCalls()) {
                return fail(run, "Stopped after " + run.modelCalls
                        + " model calls without finishing the request. Try a more specific request.");
            }
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(run);
            }

            stateTracker.transition(projectId, LoopState.MODEL_THINKING);
            Project project = projects.snapshot(projectId);
            ConversationView view = viewBuilder.buildView(project, catalog);
            if (!view.diagnostics().isEmpty()) {
                log.debug("[Loop] {} view: {}", projectId, view.diagnostics());
            }

            ModelResponse response;
            try {
                run.modelCalls++;
                response = provider.complete(ProviderRequest.builder()
                        .projectId(projectId)
                        .profile(project.getProfile())
                        .systemPrompt(view.systemPrompt())
                        .turns(view.turns())
                        .build(), catalog);
            } catch (ProviderException e) {
                if (e.isCancelled()) {
                    return cancelled(run);
                }
                log.warn("[Loop] {} provider failure: {}", projectId, e.getMessage());
                return fail(run, "The model provider could not be reached: " + e.getMessage());
            }
            run.usage = run.usage.plus(response.getUsage());

            if (!response.hasToolCalls()) {
                stateTracker.transition(projectId, LoopState.RESPONDING);
                String text = response.getText() != null ? response.getText() : "";
                run.turns.add(historyWriter.appendAssistantText(projectId, text, response.getUsage()));
                return completed(run);
            }

            Turn callsTurn = historyWriter.appendAssistantToolCalls(projectId, response);
            run.turns.add(callsTurn);
            List<ToolCall> calls = response.getToolCalls();
            run.unanswered = new ArrayList<>(calls);

            List<List<Violation>> violations = new ArrayList<>();
            List<Map<String, Object>> validated = new ArrayList<>();
            int rejected = 0;
            for (ToolCall call : calls) {
                List<Violation> callViolations = List.of();
                Map<String, Object> arguments = null;
                try {
                    if (call.hasArgumentsError() && registry.contains(call.getName())) {
                        callViolations = List.of(malformedArguments(call));
                    } else {
                        arguments = registry.validate(call.getName(), call.getArguments());
                    }
                } catch (SchemaValidationException e) {
                    callViolations = e.getViolations();
                } catch (UnknownToolException e) {
                    callViolations = List.of(unknownTool(call.getName(), catalog));
                }
                if (!callViolations.isEmpty()) {
                    rejected++;
                }
                violations.add(callViolations);
                validated.add(arguments);
            }

            if (rejected > 0) {
                for (int i = 0; i < calls.size(); i++) {
                    answered(run, calls.get(i),
                            historyWriter.appendCorrection(projectId, calls.get(i), violations.get(i)));
                }
                run.corrections++;
                log.info("[Loop] {} rejected {} of {} call(s) (correction {}/{})", projectId, rejected,
                        calls.size(), run.corrections, settings.getMaxCorrectionRetries());
                if (run.corrections > settings.getMaxCorrectionRetries()) {
                    return fail(run, "The requested tool calls were still invalid after "
                            + settings.getMaxCorrectionRetries() + " correction attempt(s):\n"
                            + describe(calls, violations));
                }
                continue;
            }

            stateTracker.transition(projectId, LoopState.TOOL_DISPATCH);
            DispatchResult dispatch = dispatch(run, calls, validated, callsTurn.getSequence());
            if (dispatch == DispatchResult.CANCELLED) {
                return cancelled(run);
            }
            if (dispatch == DispatchResult.FAILED) {
                stateTracker.transition(projectId, LoopState.RECOVERING);
                run.recoveries++;
                if (run.recoveries > settings.getMaxRecoveries()) {
                    return fail(run, "Stopped after " + settings.getMaxRecoveries()
                            + " unsuccessful recovery attempt(s). The last tool error is shown above.");
                }
                continue;
            }

            if (settings.isFollowUpAfterTools()) {
                continue;
            }
            stateTracker.transition(projectId, LoopState.RESPONDING);
            PipelineStage stage = projects.currentStage(projectId);
            run.turns.add(historyWriter.appendSummary(projectId, run.lastDispatched, stage));
            return completed(run);
        }
    }

    private DispatchResult dispatch(TurnRun run, List<ToolCall> calls, List<Map<String, Object>> validated,
            Long originTurn) {
        String projectId = run.projectId;
        run.lastDispatched = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            List<ToolCall> remaining = calls.subList(i + 1, calls.size());
            if (Thread.currentThread().isInterrupted()) {
                skipAll(run, calls.subList(i, calls.size()), "the turn was cancelled");
                return DispatchResult.CANCELLED;
            }

            ToolInvocation invocation = ToolInvocation.builder()
                    .id(UUID.randomUUID().toString())
                    .toolName(call.getName())
                    .arguments(new LinkedHashMap<>(validated.get(i)))
                    .originTurn(originTurn)
                    .build();
            stateTracker.invocationStarted(projectId, invocation.getId());
            ToolExecutionOutcome outcome;
            try {
                outcome = toolExecutor.execute(projectId, call.getId(), invocation);
            } finally {
                stateTracker.invocationFinished(projectId, invocation.getId());
            }
            run.toolExecutions++;
            run.lastDispatched.add(outcome);
            run.unrecorded = outcome;

            if (outcome.isSuccess()) {
                answered(run, call, historyWriter.appendToolResult(projectId, outcome, List.of()));
                continue;
            }

            answered(run, call, historyWriter.appendToolResult(projectId, outcome, remaining));
            boolean cancelled = outcome.result().getFailureKind() == FailureKind.CANCELLED;
            skipAll(run, remaining, cancelled
                    ? "the turn was cancelled"
                    : "an earlier call in this response (" + call.getName() + ") failed");
            log.info("[Loop] {} {} failed ({}), {} call(s) not executed", projectId, call.getName(),
                    outcome.result().getFailureKind(), remaining.size());
            return cancelled ? DispatchResult.CANCELLED : DispatchResult.FAILED;
        }
        return DispatchResult.SUCCEEDED;
    }

    private void skipAll(TurnRun run, List<ToolCall> calls, String reason) {
        for (ToolCall call : calls) {
            answered(run, call, historyWriter.appendSkipped(run.projectId, call, reason));
        }
    }

    private static void answered(TurnRun run, ToolCall call, Turn turn) {
        run.turns.add(turn);
        run.unanswered.remove(call);
        if (run.unrecorded != null && Objects.equals(run.unrecorded.toolCallId(), call.getId())) {
            run.unrecorded = null;
        }
    }

    // A history write failed: record what already ran, answer the open calls,
    // then close the turn. The original error propagates if this fails too.
    private TurnOutcome abort(TurnRun run, DataPilotException error) {
        String projectId = run.projectId;
        log.warn("[Loop] {} turn aborted: {}", projectId, error.getMessage());
        try {
            if (run.unrecorded != null) {
                ToolExecutionOutcome outcome = run.unrecorded;
                ToolCall call = run.unanswered.stream()
                        .filter(candidate -> Objects.equals(candidate.getId(), outcome.toolCallId()))
                        .findFirst()
                        .orElse(null);
                Turn turn = historyWriter.appendToolResult(projectId, outcome, List.of());
                if (call != null) {
                    answered(run, call, turn);
                } else {
                    run.turns.add(turn);
                    run.unrecorded = null;
                }
            }
            skipAll(run, List.copyOf(run.unanswered), "the turn was aborted by an error");
            run.turns.add(historyWriter.appendFailure(projectId,
                    "The turn was aborted because the project could not be updated: " + error.getMessage()));
        } catch (DataPilotException e) {
            error.addSuppressed(e);
            throw error;
        }
        return outcome(run, false);
    }

    private TurnOutcome completed(TurnRun run) {
        log.info("[Loop] {} turn completed: {} model call(s), {} tool execution(s)", run.projectId,
                run.modelCalls, run.toolExecutions);
        return outcome(run, true);
    }

    private TurnOutcome fail(TurnRun run, String message) {
        log.warn("[Loop] {} turn failed: {}", run.projectId, message);
        run.turns.add(historyWriter.appendFailure(run.projectId, message));
        return outcome(run, false);
    }

    private TurnOutcome cancelled(TurnRun run) {
        // Cleared while the failure turn is written, restored for the executor.
        boolean interrupted = Thread.interrupted();
        try {
            log.info("[Loop] {} turn cancelled", run.projectId);
            run.turns.add(historyWriter.appendFailure(run.projectId, "The turn was cancelled."));
            return outcome(run, false);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private TurnOutcome outcome(TurnRun run, boolean completed) {
        PipelineStage stage = projects.currentStage(run.projectId);
        return new TurnOutcome(run.projectId, completed, List.copyOf(run.turns), stage, run.modelCalls,
                run.toolExecutions, run.usage);
    }

    private static Violation unknownTool(String name, List<ToolDescriptor> catalog) {
        String available = catalog.stream().map(ToolDescriptor::getName).collect(Collectors.joining(", "));
        return new Violation("tool", Violation.Code.UNKNOWN_TOOL,
                "unknown tool '" + name + "'; available tools: " + available);
    }

    private static Violation malformedArguments(ToolCall call) {
        return new Violation("arguments", Violation.Code.WRONG_TYPE,
                "arguments are not a valid JSON object (" + call.getArgumentsError()
                        + "); send all arguments again as one JSON object");
    }

    private static String describe(List<ToolCall> calls, List<List<Violation>> violations) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < calls.size(); i++) {
            for (Violation violation : violations.get(i)) {
                text.append("- ").append(calls.get(i).getName()).append(' ').append(violation).append('\n');
            }
        }
        return text.toString().strip();
    }

    private enum DispatchResult {
        SUCCEEDED, FAILED, CANCELLED
    }

    private static final class TurnRun {
        private final String projectId;
        private final List<Turn> turns = new ArrayList<>();
        private List<ToolExecutionOutcome> lastDispatched = new ArrayList<>();
        private List<ToolCall> unanswered = new ArrayList<>();
        private ToolExecutionOutcome unrecorded;
        private ProviderUsage usage = ProviderUsage.NONE;
        private int modelCalls;
        private int corrections;
        private int recoveries;
        private int toolExecutions;

        private TurnRun(String projectId) {
            this.projectId = projectId;
        }
    }
}
