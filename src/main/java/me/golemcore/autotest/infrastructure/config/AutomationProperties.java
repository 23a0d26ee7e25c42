package me.golemcore.autotest.infrastructure.config;

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
import java.util.List;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code automation.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - completion service connection</li>
 * <li>{@link McpProperties} - tool backend pool</li>
 * <li>{@link AgentProperties} - agent loop budgets</li>
 * <li>{@link BrowserProperties} - tool names and viewport for scripted
 * runs</li>
 * <li>{@link VideoProperties} - video finalization timing</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "automation")
@Data
public class AutomationProperties {

    private LlmProperties llm = new LlmProperties();
    private McpProperties mcp = new McpProperties();
    private AgentProperties agent = new AgentProperties();
    private BrowserProperties browser = new BrowserProperties();
    private VideoProperties video = new VideoProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /**
         * One of {@code ollama}, {@code openai} (any OpenAI-compatible endpoint) or
         * {@code anthropic}.
         */
        private String provider = "ollama";
        private String baseUrl = "http://ollama:11434";
        private String apiKey;
        private String model = "gpt-oss:20b";
        private double temperature = 0.0;
        private double topP = 1.0;
        private int maxTokens = 2048;
        private long timeoutMs = 300000;
        private long probeTimeoutMs = 5000;
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private List<String> pool = new ArrayList<>(List.of("http://playwright-mcp-core:8931/mcp"));
        private String clientName = "golemcore-autotest";
        private String clientVersion = "1.0.0";
        private long requestTimeoutSeconds = 120;
    }

    // ==================== AGENT LOOP ====================

    @Data
    public static class AgentProperties {
        private int defaultMaxIterations = 12;
        private int maxIterationsLimit = 50;
        private int maxToolCallsPerIteration = 8;
        /**
         * Corrective messages sent when a final reply lacks the completion marker.
         */
        private int maxMarkerReminders = 2;
    }

    // ==================== BROWSER ====================

    @Data
    public static class BrowserProperties {
        private String navigateTool = "browser_navigate";
        private String clickTool = "browser_click";
        private String snapshotTool = "browser_snapshot";
        private String waitTool = "browser_wait_for";
        private String runCodeTool = "browser_run_code";
        private String closeTool = "browser_close";
        private int viewportWidth = 1280;
        private int viewportHeight = 720;
        private int settleSeconds = 1;
        /**
         * Host that replaces localhost in navigation URLs; blank disables the
         * rewrite.
         */
        private String localhostRewriteHost = "frontend";
        private int localhostRewritePort = 5173;
    }

    // ==================== VIDEO ====================

    @Data
    public static class VideoProperties {
        private String directory = "/videos";
        private String nestedDirectory = "videos";
        private int maxDepth = 3;
        private List<String> extensions = new ArrayList<>(List.of(".webm", ".mp4"));
        private long minBytes = 50L * 1024;
        private long stableWaitMs = 800;
        private long findTimeoutMs = 10000;
        private long pollIntervalMs = 250;
        private long clockSkewMs = 500;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
