package me.golemcore.autotest.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import me.golemcore.autotest.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolSchemaAdapterTest {

    private final ToolSchemaAdapter adapter = new ToolSchemaAdapter();

    @Test
    void shouldMapPlaywrightClickSchema() {
        ToolDefinition click = ToolDefinition.builder()
                .name("browser_click")
                .description("Perform click on a web page")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "element", Map.of("type", "string", "description", "Human-readable element"),
                                "ref", Map.of("type", "string"),
                                "button", Map.of("type", "string", "enum", List.of("left", "right")),
                                "clicks", Map.of("type", "integer"),
                                "modifiers", Map.of("type", "array", "items", Map.of("type", "string"))),
                        "required", List.of("element", "ref")))
                .build();

        ToolSpecification spec = adapter.toCallSchema(click);

        assertEquals("browser_click", spec.name());
        assertEquals(List.of("element", "ref"), spec.parameters().required());
        assertInstanceOf(JsonStringSchema.class, spec.parameters().properties().get("ref"));
        assertInstanceOf(JsonEnumSchema.class, spec.parameters().properties().get("button"));
        assertInstanceOf(JsonIntegerSchema.class, spec.parameters().properties().get("clicks"));
        JsonArraySchema modifiers = assertInstanceOf(JsonArraySchema.class,
                spec.parameters().properties().get("modifiers"));
        assertInstanceOf(JsonStringSchema.class, modifiers.items());
    }

    @Test
    void shouldUseEmptyObjectSchemaWhenToolHasNone() {
        ToolSpecification spec = adapter.toCallSchema(ToolDefinition.builder().name("browser_snapshot").build());

        assertNotNull(spec.parameters());
        assertTrue(spec.parameters().required() == null || spec.parameters().required().isEmpty());
    }

    @Test
    void shouldSkipNamelessTools() {
        List<ToolSpecification> specs = adapter.toCallSchema(Arrays.asList(
                ToolDefinition.builder().name("browser_navigate").build(),
                ToolDefinition.builder().name(" ").build(),
                null));

        assertEquals(1, specs.size());
        assertTrue(adapter.toCallSchema((List<ToolDefinition>) null).isEmpty());
    }
}
