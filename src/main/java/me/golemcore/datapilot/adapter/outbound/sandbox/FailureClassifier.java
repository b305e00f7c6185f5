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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps how a runner process ended to exactly one {@link FailureKind}.
 *
 * <p>
 * A kind reported by the runner itself wins. Otherwise the exit status and
 * stderr are inspected: exit code 137 and out-of-memory markers mean
 * {@link FailureKind#RESOURCE_EXHAUSTED}, a missing Python module means
 * {@link FailureKind#DEPENDENCY_MISSING}, anything else is a runtime error.
 */
class FailureClassifier {

    private static final int SIGKILL_EXIT_CODE = 137;
    private static final Pattern MISSING_MODULE = Pattern.compile(
            "No module named ['\"]?([A-Za-z_][A-Za-z0-9_.]*)['\"]?");
    private static final List<String> OOM_MARKERS = List.of(
            "MemoryError", "OutOfMemoryError", "Cannot allocate memory", "std::bad_alloc", "Killed");
    // Import names whose pip distribution is named differently.
    private static final Map<String, String> DISTRIBUTIONS = Map.of(
            "sklearn", "scikit-learn",
            "cv2", "opencv-python",
            "PIL", "pillow",
            "yaml", "pyyaml",
            "skimage", "scikit-image");

    RunnerAttempt classify(int exitCode, RunnerMessages.RunnerResponse response, String stdout, String stderr) {
        if (response != null && response.isSucceeded() && exitCode == 0) {
            return RunnerAttempt.success(response, stdout, stderr);
        }

        if (response != null && response.getError() != null) {
            return fromRunnerError(response.getError(), exitCode, stdout, stderr);
        }

        if (exitCode == SIGKILL_EXIT_CODE || containsOomMarker(stderr)) {
            return RunnerAttempt.failure(FailureKind.RESOURCE_EXHAUSTED,
                    "Runner ran out of resources (exit code " + exitCode + ")", stderr, stdout, stderr);
        }

        String missing = missingPackage(stderr);
        if (missing != null) {
            return RunnerAttempt.missingDependency(missing, "Missing dependency: " + missing, stderr, stdout, stderr);
        }

        if (exitCode == 0) {
            return RunnerAttempt.failure(FailureKind.RUNTIME_ERROR,
                    "Runner exited without reporting a result", stderr, stdout, stderr);
        }
        return RunnerAttempt.failure(FailureKind.RUNTIME_ERROR,
                "Runner exited with code " + exitCode + lastLine(stderr), stderr, stdout, stderr);
    }

    private RunnerAttempt fromRunnerError(RunnerMessages.RunnerError error, int exitCode, String stdout,
            String stderr) {
        FailureKind kind = parseKind(error.getKind());
        String detail = error.getDetail() != null && !error.getDetail().isBlank() ? error.getDetail() : stderr;
        String message = error.getMessage() != null && !error.getMessage().isBlank()
                ? error.getMessage()
                : "Tool failed (exit code " + exitCode + ")";
        if (kind == FailureKind.DEPENDENCY_MISSING) {
            String packageName = error.getMissingPackage() != null
                    ? error.getMissingPackage()
                    : missingPackage(message + "\n" + detail);
            return RunnerAttempt.missingDependency(packageName, message, detail, stdout, stderr);
        }
        return RunnerAttempt.failure(kind, message, detail, stdout, stderr);
    }

    static FailureKind parseKind(String kind) {
        if (kind == null || kind.isBlank()) {
            return FailureKind.RUNTIME_ERROR;
        }
        try {
            FailureKind parsed = FailureKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
            // Only the orchestrator decides about timeouts and cancellation.
            return parsed == FailureKind.TIMEOUT || parsed == FailureKind.CANCELLED
                    ? FailureKind.RUNTIME_ERROR
                    : parsed;
        } catch (IllegalArgumentException e) {
            return FailureKind.RUNTIME_ERROR;
        }
    }

    static String missingPackage(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = MISSING_MODULE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String module = matcher.group(1);
        int dot = module.indexOf('.');
        String topLevel = dot > 0 ? module.substring(0, dot) : module;
        return DISTRIBUTIONS.getOrDefault(topLevel, topLevel);
    }

    private static boolean containsOomMarker(String stderr) {
        if (stderr == null) {
            return false;
        }
        return OOM_MARKERS.stream().anyMatch(stderr::contains);
    }

    private static String lastLine(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String[] lines = text.strip().split("\\R");
        return ": " + lines[lines.length - 1].strip();
    }
}
