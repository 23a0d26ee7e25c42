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

import com.fasterxml.jackson.databind.JsonNode;
import feign.Headers;
import feign.Param;
import feign.RequestLine;

/**
 * Feign interface for the listing endpoints of the completion service, used
 * only as a reachability probe.
 */
public interface CompletionServiceApi {

    /**
     * Ollama native API: locally available models.
     */
    @RequestLine("GET /api/tags")
    JsonNode ollamaTags();

    /**
     * OpenAI-compatible API: available models. The base URL already carries the
     * version prefix (e.g. {@code /v1}).
     */
    @RequestLine("GET /models")
    @Headers("Authorization: Bearer {apiKey}")
    JsonNode openAiModels(@Param("apiKey") String apiKey);
}
