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

import me.golemcore.autotest.domain.model.LlmRequest;
import me.golemcore.autotest.domain.model.LlmResponse;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.service.Sleeper;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.LlmPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supported providers ({@code automation.llm.provider}):
 * <ul>
 * <li>{@code ollama} - Ollama through its OpenAI-compatible {@code /v1} API
 * (default)
 * <li>{@code openai} - any OpenAI-compatible endpoint
 * <li>{@code anthropic} - Claude models
 * </ul>
 *
 * <p>
 * Features:
 * <ul>
 * <li>Function calling (tool use) with schemas from {@link ToolSchemaAdapter}
 * <li>Automatic retry with exponential backoff for rate limits
 * <li>Synthetic tool call ids for providers that omit them
 * </ul>
 *
 * @see ToolSchemaAdapter
 * @see CompletionServiceProbe
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    static final String PROVIDER_OLLAMA = "ollama";
    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_ANTHROPIC = "anthropic";

    /**
     * Max retry attempts for rate limit errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String OLLAMA_PLACEHOLDER_KEY = "ollama";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AutomationProperties.LlmProperties config;
    private final CompletionServiceProbe probe;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolSchemaAdapter schemaAdapter = new ToolSchemaAdapter();

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Autowired
    public Langchain4jAdapter(AutomationProperties properties, CompletionServiceProbe probe, Sleeper sleeper) {
        this.config = properties.getLlm();
        this.probe = probe;
        this.sleeper = sleeper;
    }

    // Visible for testing
    Langchain4jAdapter(AutomationProperties properties, ChatModel chatModel, Sleeper sleeper) {
        this(properties, (CompletionServiceProbe) null, sleeper);
        this.chatModel = chatModel;
        this.initialized = true;
    }

    public synchronized void initialize() {
        if (initialized)
            return;

        this.chatModel = createModel(config.getModel());
        initialized = true;
        log.info("[LLM] Langchain4j adapter initialized: provider={}, model={}", config.getProvider(),
                config.getModel());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    /**
     * Create a model instance based on configuration.
     */
    private ChatModel createModel(String modelName) {
        String provider = getProviderId();
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName);
        }
        if (PROVIDER_OPENAI.equals(provider) || PROVIDER_OLLAMA.equals(provider)) {
            return createOpenAiModel(modelName, PROVIDER_OLLAMA.equals(provider));
        }
        throw new IllegalStateException("Unknown LLM provider: " + provider
                + ". Set automation.llm.provider to ollama, openai or anthropic");
    }

    private ChatModel createAnthropicModel(String modelName) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, boolean ollama) {
        String apiKey = config.getApiKey();
        if (ollama && (apiKey == null || apiKey.isBlank())) {
            apiKey = OLLAMA_PLACEHOLDER_KEY;
        }
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(ollama ? ollamaOpenAiUrl(config.getBaseUrl()) : config.getBaseUrl())
                .modelName(modelName)
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .maxTokens(config.getMaxTokens())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
    }

    static String ollamaOpenAiUrl(String baseUrl) {
        String url = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return url.endsWith("/v1") ? url : url + "/v1";
    }

    @Override
    public String getProviderId() {
        return normalizeProvider(config.getProvider());
    }

    static String normalizeProvider(String provider) {
        return provider != null && !provider.isBlank() ? provider.trim().toLowerCase(Locale.ROOT) : PROVIDER_OLLAMA;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = schemaAdapter.toCallSchema(request.getTools());

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response;
                    if (!tools.isEmpty()) {
                        log.trace("[LLM] Calling model with {} tools", tools.size());
                        response = chatModel.chat(ChatRequest.builder()
                                .messages(messages)
                                .toolSpecifications(tools)
                                .build());
                    } else {
                        response = chatModel.chat(messages);
                    }
                    return convertResponse(response);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        try {
                            sleeper.sleep(backoffMs);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
                        }
                    } else {
                        log.error("[LLM] Chat failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public String getCurrentModel() {
        return config.getModel();
    }

    @Override
    public boolean isAvailable() {
        if (PROVIDER_OLLAMA.equals(getProviderId())) {
            return config.getBaseUrl() != null && !config.getBaseUrl().isBlank();
        }
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public boolean isReachable() {
        return probe != null && probe.isReachable();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
            toolCalls = new ArrayList<>(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                ToolExecutionRequest ter = requests.get(i);
                String id = ter.id() != null && !ter.id().isBlank() ? ter.id() : "call-" + (i + 1);
                toolCalls.add(Message.ToolCall.builder()
                        .id(id)
                        .name(ter.name() != null && !ter.name().isBlank() ? ter.name() : null)
                        .arguments(parseJsonArgs(ter.arguments()))
                        .build());
            }
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        Integer inputTokens = null;
        Integer outputTokens = null;
        if (response.tokenUsage() != null) {
            inputTokens = response.tokenUsage().inputTokenCount();
            outputTokens = response.tokenUsage().outputTokenCount();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(response.modelName())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> args = objectMapper.readValue(json, MAP_TYPE_REF);
            return args != null ? args : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments '{}': {}", json, e.getMessage());
            return Map.of();
        }
    }
}
