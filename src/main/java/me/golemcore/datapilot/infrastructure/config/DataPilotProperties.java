package me.golemcore.datapilot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for DataPilot, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code datapilot.*} prefix:
 * <ul>
 * <li>{@link ProviderProfileProperties} - named model provider profiles</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * <li>{@link SandboxProperties} - runner process and isolation settings</li>
 * <li>{@link LoopProperties} - orchestration loop bounds</li>
 * <li>{@link RetryProperties} - provider retry policy</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * <p>
 * This object is the only source of configuration. Components receive it by
 * injection and never read environment state on their own, except for
 * credential references resolved through the Spring environment.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "datapilot")
@Data
public class DataPilotProperties {

    private String defaultProfile = "none";
    private Map<String, ProviderProfileProperties> providers = new LinkedHashMap<>();
    private StorageProperties storage = new StorageProperties();
    private SandboxProperties sandbox = new SandboxProperties();
    private LoopProperties loop = new LoopProperties();
    private RetryProperties retry = new RetryProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Backend family of a provider profile.
     */
    public enum ProviderKind {
        OPENAI, ANTHROPIC, AZURE_OPENAI, NONE
    }

    @Data
    public static class ProviderProfileProperties {
        private ProviderKind kind = ProviderKind.NONE;
        private String baseUrl;
        private String apiKeyRef;
        private String model;
        private String deployment;
        private String apiVersion = "2024-06-01";
        private Double temperature;
        private Integer maxTokens = 4096;
        private long timeoutMs = 120_000;
    }

    @Data
    public static class StorageProperties {
        private String basePath = System.getProperty("user.home") + "/.datapilot/workspace";
    }

    @Data
    public static class SandboxProperties {
        private String workspacePath = System.getProperty("user.home") + "/.datapilot/sandbox";
        private List<String> command = new ArrayList<>(List.of("python3", "-m", "datapilot_runner"));
        private List<String> networkIsolationPrefix = new ArrayList<>();
        private List<String> allowedEnvironment = new ArrayList<>(
                List.of("PATH", "LANG", "LC_ALL", "TZ", "PYTHONPATH", "VIRTUAL_ENV", "CONDA_PREFIX"));
        private long defaultTimeoutMs = 600_000;
        private long maxTimeoutMs = 3_600_000;
        private int maxOutputChars = 100_000;
        private boolean autoInstall = true;
        private List<String> installCommand = new ArrayList<>(
                List.of("python3", "-m", "pip", "install", "--quiet", "{package}"));
        private long installTimeoutMs = 300_000;
        private boolean keepWorkspaceOnFailure = false;
    }

    @Data
    public static class LoopProperties {
        private int maxCorrectionRetries = 2;
        private int maxRecoveries = 3;
        private int maxModelCalls = 8;
        private int contextWindowTurns = 24;
        private int failureExcerptChars = 1500;
        private int summaryOutputChars = 500;
        private boolean followUpAfterTools = false;
        private int maxConcurrentProjects = 4;
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 4;
        private long initialBackoffMs = 2_000;
        private double multiplier = 2.0;
        private long maxBackoffMs = 30_000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10_000;
        private long readTimeout = 120_000;
        private long writeTimeout = 60_000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300_000;
    }
}
