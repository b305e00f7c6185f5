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

import me.golemcore.datapilot.domain.model.TurnOutcome;

/**
 * Drives one user turn of a project from the user message to the point where
 * the project awaits the next user message.
 */
public interface OrchestrationLoop {

    /**
     * @throws me.golemcore.datapilot.domain.exception.ProjectNotFoundException
     *             if the project does not exist
     * @throws me.golemcore.datapilot.domain.exception.ConcurrentModificationException
     *             if the project is already processing a turn
     */
    TurnOutcome processTurn(String projectId, String userText);
}
