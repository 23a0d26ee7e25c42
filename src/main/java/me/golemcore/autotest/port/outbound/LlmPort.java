package me.golemcore.autotest.port.outbound;

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

import me.golemcore.autotest.domain.model.LlmRequest;
import me.golemcore.autotest.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the LLM completion service. Provides chat completion with function
 * calling support.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "ollama", "openai").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the model identifier used when a request does not name one.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured: a base URL for Ollama, an API key
     * otherwise. An unconfigured provider is not probed.
     */
    boolean isAvailable();

    /**
     * Probes the completion service over the network. Never throws.
     */
    boolean isReachable();
}
