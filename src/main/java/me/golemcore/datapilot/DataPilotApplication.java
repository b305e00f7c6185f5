package me.golemcore.datapilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for DataPilot.
 *
 * <p>
 * DataPilot is a conversational orchestration engine that drives a
 * data-science pipeline (ingest, explore, engineer, model, explain) by turning
 * natural-language turns into calls against a fixed catalog of analysis tools.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tool Registry</b> - immutable catalog with exhaustive argument
 * validation</li>
 * <li><b>Execution Sandbox</b> - tools run in a separate runner process with
 * its own interpreter and dependency set</li>
 * <li><b>Artifact Store</b> - versioned, content-hashed datasets, models and
 * figures</li>
 * <li><b>Multi-Provider</b> - OpenAI and Anthropic via langchain4j, Azure
 * OpenAI via Feign</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ProjectsController
 * Domain Layer       → OrchestrationLoop, ToolRegistry, ProjectStateService
 * Infrastructure     → Provider/Storage/Sandbox Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code datapilot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DataPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataPilotApplication.class, args);
    }

}
