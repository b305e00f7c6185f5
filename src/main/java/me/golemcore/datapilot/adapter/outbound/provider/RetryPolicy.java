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

import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.RetryProperties;

/**
 * Bounded exponential backoff for transient provider failures.
 *
 * <p>
 * The delay before retry {@code n} (zero-based) is
 * {@code initialBackoff * multiplier^n}, capped at {@code maxBackoff}. A reset
 * hint from the server extends the delay to the hinted time plus one second,
 * still within the cap.
 */
public class RetryPolicy {

    private final int maxRetries;
    private final long initialBackoffMs;
    private final double multiplier;
    private final long maxBackoffMs;

    public RetryPolicy(RetryProperties properties) {
        this(properties.getMaxRetries(), properties.getInitialBackoffMs(), properties.getMultiplier(),
                properties.getMaxBackoffMs());
    }

    public RetryPolicy(int maxRetries, long initialBackoffMs, double multiplier, long maxBackoffMs) {
        this.maxRetries = Math.max(0, maxRetries);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    public long backoffMs(int retry, long resetHintSeconds) {
        long exponential = (long) Math.min(maxBackoffMs, initialBackoffMs * Math.pow(multiplier, retry));
        if (resetHintSeconds > 0) {
            long hinted = resetHintSeconds * 1000 + 1000;
            return Math.min(maxBackoffMs, Math.max(hinted, exponential));
        }
        return exponential;
    }

    /**
     * Waits between attempts. Replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
