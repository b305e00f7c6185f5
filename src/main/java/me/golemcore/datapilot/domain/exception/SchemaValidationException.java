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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tool arguments violate the tool's schema. Carries every violation found,
 * never just the first.
 */
public class SchemaValidationException extends DataPilotException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final transient List<Violation> violations;

    public SchemaValidationException(String toolName, List<Violation> violations) {
        super("Invalid arguments for tool '" + toolName + "': " + describe(violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String getToolName() {
        return toolName;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String describe(List<Violation> violations) {
        return violations.stream().map(Violation::toString).collect(Collectors.joining("; "));
    }
}
