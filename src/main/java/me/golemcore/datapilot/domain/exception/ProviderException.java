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
 * The model provider could not produce a completion, either because the error
 * is not transient or because the retry budget ran out.
 */
public class ProviderException extends DataPilotException {

    private static final long serialVersionUID = 1L;

    private final String profile;
    private final int attempts;
    private final boolean cancelled;

    public ProviderException(String profile, String message, int attempts, Throwable cause) {
        this(profile, message, attempts, false, cause);
    }

    private ProviderException(String profile, String message, int attempts, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.profile = profile;
        this.attempts = attempts;
        this.cancelled = cancelled;
    }

    public static ProviderException cancelled(String profile, int attempts, Throwable cause) {
        return new ProviderException(profile, "Provider call cancelled", attempts, true, cause);
    }

    public String getProfile() {
        return profile;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
