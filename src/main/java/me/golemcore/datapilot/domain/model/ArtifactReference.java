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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reference to an artifact by name and version, where a {@code null} version
 * means "latest".
 *
 * <p>
 * Accepted spellings: {@code dataset@2}, {@code dataset@v2},
 * {@code dataset@latest}, {@code dataset}, and, when a default name is known,
 * {@code 2}, {@code v2} and {@code latest}.
 */
public record ArtifactReference(String name, Integer version) {

    public static final String LATEST = "latest";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");
    private static final Pattern VERSION = Pattern.compile("[vV]?(\\d{1,9})");

    public static ArtifactReference of(String name, Integer version) {
        return new ArtifactReference(name, version);
    }

    /**
     * Parses a reference.
     *
     * @param raw
     *            user or model supplied text
     * @param defaultName
     *            name to use when only a version is given, may be {@code null}
     * @throws IllegalArgumentException
     *             if the text is not a valid reference
     */
    public static ArtifactReference parse(String raw, String defaultName) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("artifact reference is empty");
        }
        String text = raw.trim();
        int at = text.indexOf('@');
        if (at >= 0) {
            String name = text.substring(0, at).trim();
            String version = text.substring(at + 1).trim();
            return new ArtifactReference(requireName(name), parseVersion(version, raw));
        }
        if (LATEST.equalsIgnoreCase(text) || VERSION.matcher(text).matches()) {
            if (defaultName == null) {
                throw new IllegalArgumentException("artifact reference '" + raw + "' does not name an artifact");
            }
            return new ArtifactReference(defaultName, parseVersion(text, raw));
        }
        return new ArtifactReference(requireName(text), null);
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public boolean isLatest() {
        return version == null;
    }

    public String format() {
        return name + "@" + (version == null ? LATEST : version.toString());
    }

    private static String requireName(String name) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("invalid artifact name '" + name + "'");
        }
        return name;
    }

    private static Integer parseVersion(String text, String raw) {
        if (LATEST.equalsIgnoreCase(text)) {
            return null;
        }
        Matcher matcher = VERSION.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("invalid artifact version in '" + raw + "'");
        }
        int version = Integer.parseInt(matcher.group(1));
        if (version < 1) {
            throw new IllegalArgumentException("artifact versions start at 1: '" + raw + "'");
        }
        return version;
    }

    @Override
    public String toString() {
        return format();
    }
}
