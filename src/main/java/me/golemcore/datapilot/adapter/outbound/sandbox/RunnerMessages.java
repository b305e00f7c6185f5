package me.golemcore.datapilot.adapter.outbound.sandbox;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire format between the orchestrator and the runner process: the runner
 * reads {@code request.json} and writes {@code response.json} in its working
 * directory. Field names are snake_case for the runner's benefit.
 */
final class RunnerMessages {

    private RunnerMessages() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class RunnerRequest {
        @JsonProperty("invocation_id")
        private String invocationId;
        @JsonProperty("project_id")
        private String projectId;
        private String tool;
        @JsonProperty("entry_point")
        private String entryPoint;
        @Builder.Default
        private Map<String, Object> arguments = new LinkedHashMap<>();
        @Builder.Default
        private Map<String, RunnerInput> inputs = new LinkedHashMap<>();
        @JsonProperty("output_dir")
        private String outputDir;
        @JsonProperty("declared_outputs")
        @Builder.Default
        private List<String> declaredOutputs = new ArrayList<>();
        private boolean network;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class RunnerInput {
        private String name;
        private int version;
        private String kind;
        private String file;
        @JsonProperty("content_hash")
        private String contentHash;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class RunnerResponse {
        private String status;
        private String output;
        private RunnerError error;
        private List<RunnerOutput> outputs = new ArrayList<>();

        boolean isSucceeded() {
            return "succeeded".equalsIgnoreCase(status);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class RunnerError {
        private String kind;
        private String message;
        private String detail;
        @JsonProperty("missing_package")
        private String missingPackage;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class RunnerOutput {
        private String name;
        private String file;
        private String kind;
    }
}
