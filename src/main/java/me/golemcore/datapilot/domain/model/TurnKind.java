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
 * What a turn carries.
 */
public enum TurnKind {

    /** Free text from the user or the assistant. */
    MESSAGE,

    /** Assistant turn proposing one or more tool calls. */
    TOOL_CALLS,

    /** Outcome of one tool call, successful or not. */
    TOOL_RESULT,

    /** Rejection of a tool call that failed validation, addressed to the model. */
    CORRECTION,

    /** Terminal failure of a user turn, addressed to the user. */
    FAILURE,

    /** Deterministic summary of a successful dispatch. */
    SUMMARY
}
