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

import java.util.Locale;

/**
 * Stage of the data-science pipeline a project has reached.
 *
 * <p>
 * Stages are ordered; a project only ever moves forward. Tools declare the
 * stage their successful execution completes.
 */
public enum PipelineStage {

    INGEST, EXPLORE, ENGINEER, MODEL, EXPLAIN, DONE;

    /**
     * Returns the later of two stages, treating {@code null} as "no stage".
     */
    public static PipelineStage latest(PipelineStage current, PipelineStage candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null) {
            return candidate;
        }
        return candidate.ordinal() > current.ordinal() ? candidate : current;
    }

    public boolean isAfter(PipelineStage other) {
        return other == null || ordinal() > other.ordinal();
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
