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

/**
 * Why a tool invocation failed. Every failed result carries exactly one kind.
 */
public enum FailureKind {

    /**
     * A package the tool needs is not installed in the runner environment.
     */
    DEPENDENCY_MISSING,

    /**
     * The tool raised an error, exited with a non-zero status, or did not
     * produce a declared output.
     */
    RUNTIME_ERROR,

    /**
     * The invocation exceeded its time budget and was terminated.
     */
    TIMEOUT,

    /**
     * The runner ran out of memory or was killed by the operating system.
     */
    RESOURCE_EXHAUSTED,

    /**
     * The invocation was cancelled before it completed.
     */
    CANCELLED
}
