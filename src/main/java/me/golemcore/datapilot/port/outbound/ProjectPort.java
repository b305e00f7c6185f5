package me.golemcore.datapilot.port.outbound;

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
import me.golemcore.datapilot.domain.model.Turn;

import java.util.List;

/**
 * Durable project state: conversation history, artifact index and pipeline
 * stage. Every method returning a {@link Project} or {@link Turn} returns a
 * copy.
 */
public interface ProjectPort {

    Project create(String name, String profile, PrivacyMode privacyMode);

    Turn append(String projectId, Turn turn);

    Turn recordToolOutcome(String projectId, Turn turn, List<Artifact> artifacts, PipelineStage stage);

    PipelineStage currentStage(String projectId);

    List<Artifact> artifacts(String projectId, String name);

    Artifact artifact(String projectId, String name, Integer version);

    Project snapshot(String projectId);

    Project restore(String projectId);

    List<Project> list();

    Project rename(String projectId, String name);

    void delete(String projectId);

    Artifact registerUpload(String projectId, String fileName, byte[] content);
}
