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

import me.golemcore.datapilot.domain.model.FailureKind;

/**
 * Outcome of one start of the runner process, before outputs are collected.
 */
record RunnerAttempt(
        FailureKind failureKind,
        String summary,
        String detail,
        String missingPackage,
        RunnerMessages.RunnerResponse response,
        String stdout,
        String stderr) {

    static RunnerAttempt success(RunnerMessages.RunnerResponse response, String stdout, String stderr) {
        return new RunnerAttempt(null, null, null, null, response, stdout, stderr);
    }

    static RunnerAttempt failure(FailureKind kind, String summary, String detail, String stdout, String stderr) {
        return new RunnerAttempt(kind, summary, detail, null, null, stdout, stderr);
    }

    static RunnerAttempt missingDependency(String packageName, String summary, String detail, String stdout,
            String stderr) {
        return new RunnerAttempt(FailureKind.DEPENDENCY_MISSING, summary, detail, packageName, null, stdout, stderr);
    }

    boolean succeeded() {
        return failureKind == null;
    }
}
