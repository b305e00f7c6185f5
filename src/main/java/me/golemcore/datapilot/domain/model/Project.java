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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A data-science project: the durable unit of conversation and pipeline
 * progress.
 *
 * <p>
 * Holds the full, append-only turn history, the artifact index (artifact name
 * to latest version), the pipeline stage, which only moves forward, and the
 * tokens spent on model calls so far.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    private String id;
    private String name;
    private String profile;
    @Builder.Default
    private PipelineStage stage = PipelineStage.INGEST;
    @Builder.Default
    private PrivacyMode privacyMode = PrivacyMode.DEFAULT;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<Turn> turns = new ArrayList<>();
    @Builder.Default
    private Map<String, Integer> artifactIndex = new LinkedHashMap<>();
    @Builder.Default
    private long nextSequence = 1;
    @Builder.Default
    private ProviderUsage tokenUsage = ProviderUsage.NONE;

    @JsonIgnore
    public Turn lastTurn() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }
}
