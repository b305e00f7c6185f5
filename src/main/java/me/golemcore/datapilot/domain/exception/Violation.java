package me.golemcore.datapilot.domain.exception;

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
 * One way in which tool arguments fail their schema.
 *
 * @param field
 *            parameter name
 * @param code
 *            category of the violation
 * @param message
 *            human-readable explanation, suitable for the model
 */
public record Violation(String field, Code code, String message) {

    public enum Code {
        MISSING_REQUIRED, WRONG_TYPE, OUT_OF_RANGE, NOT_ALLOWED, UNKNOWN_PARAMETER, UNKNOWN_TOOL
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
