package me.golemcore.autotest.infrastructure.http;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for the MCP transport and the Feign probe clients.
 *
 * <p>
 * A single tool call (navigation, a long Playwright script) can hold the
 * connection for minutes, so the read timeout is never shorter than
 * {@code automation.mcp.request-timeout-seconds}.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final AutomationProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        AutomationProperties.HttpProperties http = properties.getHttp();
        Duration readTimeout = readTimeout(http.getReadTimeout(), properties.getMcp().getRequestTimeoutSeconds());
        log.debug("[HTTP] connect={}ms read={}ms write={}ms", http.getConnectTimeout(), readTimeout.toMillis(),
                http.getWriteTimeout());

        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeout()))
                .readTimeout(readTimeout)
                .writeTimeout(Duration.ofMillis(http.getWriteTimeout()))
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(), TimeUnit.MILLISECONDS))
                .followRedirects(false)
                .build();
    }

    static Duration readTimeout(long configuredMs, long mcpRequestTimeoutSeconds) {
        return Duration.ofMillis(Math.max(configuredMs, mcpRequestTimeoutSeconds * 1000));
    }
}
