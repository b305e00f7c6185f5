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
 * Category of a stored artifact.
 */
public enum ArtifactKind {

    DATASET, MODEL, FIGURE, REPORT, LOG, FILE;

    /**
     * Infers the kind from a file extension.
     */
    public static ArtifactKind fromFileName(String fileName) {
        if (fileName == null) {
            return FILE;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String extension = dot >= 0 ? lower.substring(dot + 1) : "";
        return switch (extension) {
        case "csv", "tsv", "parquet", "xlsx", "xls", "feather" -> DATASET;
        case "p", "pkl", "pickle", "joblib", "onnx" -> MODEL;
        case "png", "jpg", "jpeg", "svg", "gif" -> FIGURE;
        case "html", "md", "pdf", "json" -> REPORT;
        case "log", "txt" -> LOG;
        default -> FILE;
        };
    }

    /**
     * Parses a kind reported by the sandbox runner, or {@code null} when the
     * value is absent or unknown.
     */
    public static ArtifactKind parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
