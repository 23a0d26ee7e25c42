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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autotest.domain.model.ToolResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the content blocks of an MCP {@code tools/call} result into plain
 * text. Text blocks contribute their text; any other block (image, resource,
 * structured data) is serialized to JSON instead of being dropped.
 */
public class ToolResultFlattener {

    private final ObjectMapper objectMapper;

    public ToolResultFlattener(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Joins all content blocks with newlines. Returns an empty string when the
     * result carries no content array.
     */
    public String toResultText(JsonNode result) {
        JsonNode content = result != null ? result.get("content") : null;
        if (content == null || !content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            JsonNode text = block.get("text");
            if ("text".equals(block.path("type").asText()) && text != null && text.isTextual()) {
                parts.add(text.asText());
            } else {
                parts.add(serialize(block));
            }
        }
        return String.join("\n", parts);
    }

    /**
     * Wraps the flattened text into a {@link ToolResult}, honoring the
     * {@code isError} flag of the result.
     */
    public ToolResult toToolResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }
        String text = toResultText(result);
        if (result.path("isError").asBoolean(false)) {
            return ToolResult.failure(text.isEmpty() ? "MCP tool error: " + toolName : text);
        }
        return ToolResult.success(text);
    }

    private String serialize(JsonNode block) {
        try {
            return objectMapper.writeValueAsString(block);
        } catch (JsonProcessingException e) {
            return block.toString();
        }
    }
}
