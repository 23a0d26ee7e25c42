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

import me.golemcore.autotest.domain.model.ToolDefinition;
import me.golemcore.autotest.domain.model.ToolResult;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;
import me.golemcore.autotest.port.outbound.ToolBackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) endpoint over
 * the Streamable HTTP transport.
 *
 * <p>
 * Lifecycle of one run-scoped session:
 * <ol>
 * <li>Send initialize request (JSON-RPC handshake)
 * <li>Send {@code notifications/initialized}
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call), strictly one at a time
 * <li>Terminate the session (HTTP DELETE)
 * </ol>
 *
 * <p>
 * Every request is an HTTP POST. The server answers either with a JSON body or
 * with a {@code text/event-stream} whose {@code data:} lines carry the
 * JSON-RPC messages; the response matching the request id is picked out of the
 * stream. The {@code Mcp-Session-Id} header returned by initialize is echoed
 * on every later request.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean, opened per run by {@link McpConnectionPool}.
 *
 * @see McpConnectionPool
 * @see ToolResultFlattener
 */
public class McpClient implements ToolBackendConnection {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String ACCEPT = "application/json, text/event-stream";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String endpoint;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ToolResultFlattener flattener;
    private final AutomationProperties.McpProperties config;

    private final AtomicInteger nextId = new AtomicInteger(1);

    private volatile String sessionId;
    private volatile boolean running;
    private List<ToolDefinition> cachedTools;

    public McpClient(String endpoint, OkHttpClient httpClient, ObjectMapper objectMapper,
            AutomationProperties.McpProperties config) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.flattener = new ToolResultFlattener(objectMapper);
        this.config = config;
    }

    /**
     * Perform the handshake and fetch available tools.
     *
     * @throws ToolBackendException
     *             if the endpoint is unreachable or rejects the handshake
     */
    public List<ToolDefinition> start() {
        log.info("[MCP:{}] Connecting", endpoint);
        running = true;
        try {
            JsonNode initResult = await(sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", config.getClientName(),
                            "version", config.getClientVersion()))));
            log.debug("[MCP:{}] Initialized: {}", endpoint, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = await(sendRequest("tools/list", Map.of()));
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", endpoint,
                    ToolDefinition.names(cachedTools));
            return cachedTools;
        } catch (ToolBackendException e) {
            log.error("[MCP:{}] Initialization failed: {}", endpoint, e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public List<ToolDefinition> listTools() {
        return cachedTools != null ? cachedTools : List.of();
    }

    @Override
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(result -> flattener.toToolResult(name, result));
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Send a JSON-RPC request and return a future for the result. JSON-RPC errors
     * complete the future with {@link McpException}; HTTP and I/O failures with
     * {@link ToolBackendException}.
     */
    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(config.getRequestTimeoutSeconds(), TimeUnit.SECONDS);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        String json;
        try {
            json = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            future.completeExceptionally(new ToolBackendException("Cannot serialize MCP request: " + method, e));
            return future;
        }
        log.debug("[MCP:{}] → {}", endpoint, json);

        httpClient.newCall(buildPost(json)).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(
                        new ToolBackendException("MCP request " + method + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new ToolBackendException(
                                "MCP request " + method + " failed: HTTP " + response.code()));
                        return;
                    }
                    rememberSession(response);
                    completeFromMessage(future, readMessage(response, id));
                } catch (IOException | RuntimeException e) {
                    future.completeExceptionally(
                            new ToolBackendException("Invalid MCP response to " + method + ": " + e.getMessage(), e));
                }
            }
        });
        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] → (notification) {}", endpoint, json);
            try (Response response = httpClient.newCall(buildPost(json)).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("[MCP:{}] Notification {} rejected: HTTP {}", endpoint, method, response.code());
                }
            }
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", endpoint, e.getMessage());
        }
    }

    private Request buildPost(String json) {
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .header("Accept", ACCEPT)
                .post(RequestBody.create(json, JSON));
        String sid = sessionId;
        if (sid != null) {
            builder.header(SESSION_HEADER, sid);
        }
        return builder.build();
    }

    private void rememberSession(Response response) {
        String sid = response.header(SESSION_HEADER);
        if (sid != null && !sid.isBlank()) {
            sessionId = sid;
        }
    }

    private JsonNode readMessage(Response response, int id) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new IOException("empty body");
        }
        MediaType contentType = body.contentType();
        String text = body.string();
        log.debug("[MCP:{}] ← {}", endpoint, text);
        if (contentType != null && "event-stream".equals(contentType.subtype())) {
            return findInEventStream(text, id);
        }
        if (text.isBlank()) {
            throw new IOException("empty body");
        }
        return objectMapper.readTree(text);
    }

    private JsonNode findInEventStream(String stream, int id) throws IOException {
        StringBuilder data = new StringBuilder();
        for (String line : stream.split("\\r?\\n", -1)) {
            if (line.startsWith("data:")) {
                if (!data.isEmpty()) {
                    data.append('\n');
                }
                data.append(line.substring("data:".length()).stripLeading());
            } else if (line.isEmpty() && !data.isEmpty()) {
                JsonNode message = matchResponse(data.toString(), id);
                if (message != null) {
                    return message;
                }
                data.setLength(0);
            }
        }
        if (!data.isEmpty()) {
            JsonNode message = matchResponse(data.toString(), id);
            if (message != null) {
                return message;
            }
        }
        throw new IOException("no response with id " + id + " in event stream");
    }

    private JsonNode matchResponse(String data, int id) throws JsonProcessingException {
        JsonNode message = objectMapper.readTree(data);
        JsonNode idNode = message.get("id");
        if (idNode != null && idNode.asInt(-1) == id) {
            return message;
        }
        // Server notification interleaved in the stream
        log.debug("[MCP:{}] Skipping stream message: {}", endpoint,
                message.has("method") ? message.get("method").asText() : data);
        return null;
    }

    private void completeFromMessage(CompletableFuture<JsonNode> future, JsonNode message) {
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            future.completeExceptionally(new McpException(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
        } else {
            future.complete(message.get("result"));
        }
    }

    private JsonNode await(CompletableFuture<JsonNode> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolBackendException("Interrupted while talking to " + endpoint, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ToolBackendException tbe) {
                throw tbe;
            }
            if (cause instanceof TimeoutException) {
                throw new ToolBackendException("MCP request timed out: " + endpoint, cause);
            }
            throw new ToolBackendException(cause != null ? cause.getMessage() : e.getMessage(), cause);
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null)
            return List.of();

        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray())
            return List.of();

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.hasNonNull("name") ? toolNode.get("name").asText() : null;
            if (name == null || name.isBlank())
                continue;
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = null;
            JsonNode schemaNode = toolNode.get("inputSchema");
            if (schemaNode != null && schemaNode.isObject()) {
                inputSchema = objectMapper.convertValue(schemaNode, MAP_TYPE_REF);
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        String sid = sessionId;
        if (sid == null) {
            return;
        }
        log.debug("[MCP:{}] Terminating session {}", endpoint, sid);
        Request request = new Request.Builder()
                .url(endpoint)
                .header(SESSION_HEADER, sid)
                .delete()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            log.debug("[MCP:{}] Session closed: HTTP {}", endpoint, response.code());
        } catch (IOException e) {
            log.debug("[MCP:{}] Error closing session: {}", endpoint, e.getMessage());
        }
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends ToolBackendException {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super("MCP error " + code + ": " + message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
