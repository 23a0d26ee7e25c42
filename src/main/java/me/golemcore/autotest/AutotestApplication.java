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

package me.golemcore.autotest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the browser automation orchestrator.
 *
 * <p>
 * The service drives an LLM to control a web browser through a Playwright MCP
 * server, enforces that all requested test steps are performed, and captures
 * the video recording of each run.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Agent Loop</b> - LLM-driven tool calling with a step-completion
 * protocol ({@code DONE (completed_steps=X total_steps=Y)})</li>
 * <li><b>Step Executor</b> - deterministic navigate/click/wait/snapshot
 * execution of numbered steps, no LLM involved</li>
 * <li><b>Script Executor</b> - runs stored Playwright scripts through the
 * backend</li>
 * <li><b>Video Finalization</b> - filesystem-observational capture of the
 * recording written by the backend</li>
 * <li><b>MCP Pool</b> - round-robin selection of backend endpoints</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → AutomationController
 * Domain Layer       → ToolLoopSystem, ScriptedStepExecutor, VideoFinalizationWatcher
 * Infrastructure     → MCP / LLM adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code automation.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AutotestApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutotestApplication.class, args);
    }

}
