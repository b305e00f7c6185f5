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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one sandboxed tool invocation. Failures are values, never
 * exceptions: a failed result always carries a {@link FailureKind} and a
 * human-readable summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {

    private String invocationId;
    private InvocationStatus status;
    private String output;
    private FailureKind failureKind;
    private String failureSummary;
    private String errorExcerpt;
    @Builder.Default
    private List<Artifact> artifacts = new ArrayList<>();
    private Duration duration;
    // True when a missing dependency was installed and the tool re-run.
    private boolean remediated;

    public static ExecutionResult succeeded(String invocationId, String output, List<Artifact> artifacts) {
        return ExecutionResult.builder()
                .invocationId(invocationId)
                .status(InvocationStatus.SUCCEEDED)
                .output(output)
                .artifacts(new ArrayList<>(artifacts))
                .build();
    }

    public static ExecutionResult failed(String invocationId, FailureKind kind, String summary, String excerpt) {
        return ExecutionResult.builder()
                .invocationId(invocationId)
                .status(InvocationStatus.FAILED)
                .failureKind(kind)
                .failureSummary(summary)
                .errorExcerpt(excerpt)
                .build();
    }

    public boolean isSuccess() {
        return status == InvocationStatus.SUCCEEDED;
    }
}
