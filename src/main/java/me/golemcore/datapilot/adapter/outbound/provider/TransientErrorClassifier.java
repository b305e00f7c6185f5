package me.golemcore.datapilot.adapter.outbound.provider;

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

import feign.FeignException;
import feign.RetryableException;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a provider failure is worth retrying and extracts the
 * server's reset hint when one is present.
 */
final class TransientErrorClassifier {

    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("(?i)retry[- ]after[\"']?\\s*[:=]?\\s*(\\d+)");
    private static final List<String> TRANSIENT_MARKERS = List.of(
            "rate_limit", "rate limit", "token_quota_exceeded", "Too Many Requests", "429",
            "overloaded", "Service Unavailable", "Bad Gateway", "Gateway Timeout", "timed out",
            "timeout", "Connection reset", "model_cooldown");

    private TransientErrorClassifier() {
    }

    static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof dev.langchain4j.exception.RateLimitException
                    || current instanceof RetryableException
                    || current instanceof TimeoutException
                    || current instanceof IOException) {
                return true;
            }
            if (current instanceof FeignException feignException) {
                int status = feignException.status();
                return status == 408 || status == 429 || status >= 500;
            }
            String message = current.getMessage();
            if (message != null && TRANSIENT_MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * @return seconds until the server accepts requests again, or -1 when no
     *         hint is present
     */
    static long resetHintSeconds(Throwable error) {
        Throwable current = error;
        while (current != null) {
            String message = current.getMessage();
            if (message != null) {
                long seconds = firstNumber(RESET_SECONDS_PATTERN, message);
                if (seconds < 0) {
                    seconds = firstNumber(RETRY_AFTER_PATTERN, message);
                }
                if (seconds >= 0) {
                    return seconds;
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    private static long firstNumber(Pattern pattern, String message) {
        Matcher matcher = pattern.matcher(message);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
