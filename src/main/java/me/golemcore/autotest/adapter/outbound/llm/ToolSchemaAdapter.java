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

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import me.golemcore.autotest.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the tool backend's catalog onto langchain4j function-calling
 * specifications. A tool without an input schema gets an empty object schema;
 * a tool without a name is skipped.
 */
public class ToolSchemaAdapter {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_DESCRIPTION = "description";

    public List<ToolSpecification> toCallSchema(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        List<ToolSpecification> specifications = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            if (tool == null || !tool.isCallable()) {
                continue;
            }
            specifications.add(toCallSchema(tool));
        }
        return specifications;
    }

    public ToolSpecification toCallSchema(ToolDefinition tool) {
        return ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription() != null ? tool.getDescription() : "")
                .parameters(toObjectSchema(tool.getInputSchema(), null))
                .build();
    }

    @SuppressWarnings("unchecked")
    private JsonObjectSchema toObjectSchema(Map<String, Object> schema, String description) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (description != null && !description.isBlank()) {
            builder.description(description);
        }
        if (schema == null) {
            return builder.build();
        }
        Object properties = schema.get(KEY_PROPERTIES);
        if (properties instanceof Map<?, ?> props) {
            for (Map.Entry<?, ?> entry : props.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?> paramSchema) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) paramSchema));
                }
            }
        }
        Object required = schema.get("required");
        if (required instanceof List<?> names && !names.isEmpty()) {
            builder.required(names.stream().map(String::valueOf).toList());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        Object typeValue = paramSchema.get("type");
        String type = typeValue instanceof String s ? s : "string";
        String description = paramSchema.get(KEY_DESCRIPTION) instanceof String d ? d : null;
        Object enumValues = paramSchema.get("enum");

        if (enumValues instanceof List<?> values && !values.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder()
                    .enumValues(values.stream().map(String::valueOf).toList());
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map<?, ?> itemSchema
                    ? toJsonSchemaElement((Map<String, Object>) itemSchema)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object" -> {
            return toObjectSchema(paramSchema, description);
        }
        default -> {
            // Unknown types are offered to the model as strings
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }
}
