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

package me.golemcore.autotest.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;
import me.golemcore.autotest.port.outbound.ToolBackendPort;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin pool of MCP endpoints.
 *
 * <p>
 * Each {@link #acquire()} advances a shared counter and opens a fresh
 * {@link McpClient} session against the selected endpoint. There is no health
 * checking and no stickiness; the counter only spreads load, so concurrent
 * runs racing on it never affect correctness.
 *
 * <p>
 * Configuration: {@code automation.mcp.pool} - list of endpoint URLs (a
 * single comma-separated value is accepted as well).
 *
 * @see McpClient
 */
@Component
@Slf4j
public class McpConnectionPool implements ToolBackendPort {

    private final AutomationProperties.McpProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger();

    public McpConnectionPool(AutomationProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.config = properties.getMcp();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoints = normalize(config.getPool());
        if (endpoints.isEmpty()) {
            throw new IllegalStateException("automation.mcp.pool must contain at least one endpoint");
        }
        log.info("[McpPool] {} endpoint(s): {}", endpoints.size(), endpoints);
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public ToolBackendConnection acquire() {
        String endpoint = nextEndpoint();
        McpClient client = createClient(endpoint);
        client.start();
        return client;
    }

    @Override
    public List<String> endpoints() {
        return endpoints;
    }

    /**
     * Advances the shared counter and returns the selected endpoint.
     */
    public String nextEndpoint() {
        int slot = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(slot);
    }

    protected McpClient createClient(String endpoint) {
        return new McpClient(endpoint, httpClient, objectMapper, config);
    }

    private static List<String> normalize(List<String> pool) {
        if (pool == null) {
            return List.of();
        }
        return pool.stream()
                .filter(entry -> entry != null)
                .flatMap(entry -> Arrays.stream(entry.split(",")))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }
}
