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

package me.golemcore.autotest.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that the configured completion service answers over HTTP.
 *
 * <p>
 * Ollama is probed with {@code GET /api/tags}, OpenAI-compatible services with
 * {@code GET /models}. Anthropic has no free listing call, so it is reported
 * reachable when an API key is configured.
 */
@Component
@Slf4j
public class CompletionServiceProbe {

    private final AutomationProperties.LlmProperties config;
    private final FeignClientFactory feignClientFactory;

    public CompletionServiceProbe(AutomationProperties properties, FeignClientFactory feignClientFactory) {
        this.config = properties.getLlm();
        this.feignClientFactory = feignClientFactory;
    }

    public boolean isReachable() {
        String provider = Langchain4jAdapter.normalizeProvider(config.getProvider());
        if (Langchain4jAdapter.PROVIDER_ANTHROPIC.equals(provider)) {
            return config.getApiKey() != null && !config.getApiKey().isBlank();
        }
        try {
            CompletionServiceApi api = feignClientFactory.create(CompletionServiceApi.class, baseUrl(),
                    config.getProbeTimeoutMs());
            if (Langchain4jAdapter.PROVIDER_OPENAI.equals(provider)) {
                api.openAiModels(config.getApiKey() != null ? config.getApiKey() : "");
            } else {
                api.ollamaTags();
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("[LLM] Completion service {} unreachable: {}", baseUrl(), e.getMessage());
            return false;
        }
    }

    private String baseUrl() {
        String url = config.getBaseUrl();
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
