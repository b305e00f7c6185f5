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

import me.golemcore.datapilot.domain.model.ExecutionResult;
import me.golemcore.datapilot.domain.model.SandboxRequest;

/**
 * Port for running tool code outside the orchestrator process.
 *
 * <p>
 * Implementations never throw for tool failures: every outcome, including
 * timeouts and cancellation, is reported as an {@link ExecutionResult}.
 */
public interface SandboxPort {

    ExecutionResult execute(SandboxRequest request);

    /**
     * Stops a running invocation. Its result becomes a
     * {@code CANCELLED} failure.
     *
     * @return {@code false} if no invocation with that id is running
     */
    boolean cancel(String invocationId);
}
