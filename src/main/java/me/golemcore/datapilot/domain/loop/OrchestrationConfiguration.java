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

import me.golemcore.datapilot.domain.registry.ToolRegistry;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import me.golemcore.datapilot.port.outbound.ProviderPort;
import me.golemcore.datapilot.port.outbound.SandboxPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the orchestration loop from its ports so that the loop classes stay
 * free of container annotations.
 */
@Configuration
public class OrchestrationConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolRegistry toolRegistry, ArtifactStorePort artifactStore,
            SandboxPort sandbox, Clock clock) {
        return new SandboxToolExecutor(toolRegistry, artifactStore, sandbox, clock);
    }

    @Bean
    public HistoryWriter historyWriter(ProjectPort projects, DataPilotProperties properties) {
        return new DefaultHistoryWriter(projects, properties.getLoop());
    }

    @Bean
    public ConversationViewBuilder conversationViewBuilder(DataPilotProperties properties) {
        return new DefaultConversationViewBuilder(properties.getLoop());
    }

    @Bean
    public OrchestrationLoop orchestrationLoop(ProjectPort projects, ProviderPort provider,
            ToolRegistry toolRegistry, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ConversationViewBuilder viewBuilder, LoopStateTracker stateTracker, DataPilotProperties properties) {
        return new DefaultOrchestrationLoop(projects, provider, toolRegistry, toolExecutor, historyWriter,
                viewBuilder, stateTracker, properties.getLoop());
    }
}
