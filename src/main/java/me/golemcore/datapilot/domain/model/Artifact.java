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

/**
 * One immutable version of a named project artifact (dataset, model, figure,
 * report or log). Versions of a name start at 1 and only grow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Artifact {

    private String projectId;
    private String name;
    private int version;
    private ArtifactKind kind;
    private String fileName;
    private String location;
    private String contentHash;
    private long size;
    private String producedBy;
    private Instant createdAt;

    /**
     * Canonical reference, e.g. {@code dataset@2}.
     */
    @JsonIgnore
    public String reference() {
        return ArtifactReference.of(name, version).format();
    }
}
