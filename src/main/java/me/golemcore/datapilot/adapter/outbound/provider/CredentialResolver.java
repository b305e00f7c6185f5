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

import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Resolves credential references ({@code api-key-ref}) against the Spring
 * {@link Environment}, so a reference may name an environment variable, a
 * system property or an application property.
 */
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final Environment environment;

    /**
     * @return the credential value, or {@code null} when the reference is
     *         blank or not set
     */
    public String resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String value = environment.getProperty(reference.trim());
        return value == null || value.isBlank() ? null : value;
    }
}
