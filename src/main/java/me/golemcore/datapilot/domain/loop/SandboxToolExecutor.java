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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.exception.ArtifactNotFoundException;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactReference;
import me.golemcore.datapilot.domain.model.ExecutionResult;
import me.golemcore.datapilot.domain.model.FailureKind;
import me.golemcore.datapilot.domain.model.ParameterType;
import me.golemcore.datapilot.domain.model.SandboxRequest;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.ToolInvocation;
import me.golemcore.datapilot.domain.model.ToolParameter;
import me.golemcore.datapilot.domain.registry.ToolRegistry;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.SandboxPort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dispatches invocations to the {@link SandboxPort}.
 *
 * <p>
 * Artifact arguments are pinned before the run: {@code dataset@latest} is
 * resolved to a concrete version, the resolved artifact is handed to the
 * sandbox as an input, and the invocation records the exact reference that was
 * used.
 */
@Slf4j
public class SandboxToolExecutor implements ToolExecutorPort {

    private final ToolRegistry registry;
    private final ArtifactStorePort artifactStore;
    private final SandboxPort sandbox;
    private final Clock clock;

    public SandboxToolExecutor(ToolRegistry registry, ArtifactStorePort artifactStore, SandboxPort sandbox,
            Clock clock) {
        this.registry = registry;
        this.artifactStore = artifactStore;
        this.sandbox = sandbox;
        this.clock = clock;
    }

    @Override
    public ToolExecutionOutcome execute(String projectId, String toolCallId, ToolInvocation invocation) {
        ToolDescriptor descriptor = registry.resolve(invocation.getToolName());

        SandboxRequest.SandboxRequestBuilder request = SandboxRequest.builder()
                .projectId(projectId)
                .descriptor(descriptor)
                .invocation(invocation);

        Map<String, Object> arguments = new LinkedHashMap<>(invocation.getArguments());
        for (ToolParameter parameter : descriptor.getParameters()) {
            if (parameter.getType() != ParameterType.ARTIFACT || arguments.get(parameter.getName()) == null) {
                continue;
            }
            String raw = String.valueOf(arguments.get(parameter.getName()));
            Artifact input;
            try {
                input = artifactStore.resolve(projectId, ArtifactReference.parse(raw, parameter.getArtifactName()));
            } catch (ArtifactNotFoundException e) {
                return missingInput(toolCallId, invocation, descriptor, raw);
            }
            arguments.put(parameter.getName(), input.reference());
            request.input(parameter.getName(), input);
        }
        invocation.setArguments(arguments);

        ExecutionResult result = sandbox.execute(request.build());
        return new ToolExecutionOutcome(toolCallId, invocation, result, descriptor.stage());
    }

    private ToolExecutionOutcome missingInput(String toolCallId, ToolInvocation invocation,
            ToolDescriptor descriptor, String reference) {
        boolean needsModel = descriptor.getSideEffects() != null
                && descriptor.getSideEffects().isRequiresTrainedModel()
                && reference.startsWith("model");
        String summary = needsModel
                ? "No trained model is available (" + reference + "). Run a modelling tool first."
                : "Input artifact " + reference + " does not exist";
        log.info("[Loop] {} not dispatched: {}", invocation.getToolName(), summary);
        invocation.markFailed(FailureKind.RUNTIME_ERROR, clock.instant());
        ExecutionResult result = ExecutionResult.failed(invocation.getId(), FailureKind.RUNTIME_ERROR, summary, null);
        return new ToolExecutionOutcome(toolCallId, invocation, result, descriptor.stage());
    }
}
