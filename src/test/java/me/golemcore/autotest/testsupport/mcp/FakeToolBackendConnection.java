package me.golemcore.autotest.testsupport.mcp;

import me.golemcore.autotest.domain.model.ToolDefinition;
import me.golemcore.autotest.domain.model.ToolResult;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;
import me.golemcore.autotest.port.outbound.ToolBackendException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Scriptable tool backend. Every call is recorded; responses are looked up by
 * tool name and default to an empty success.
 */
public final class FakeToolBackendConnection implements ToolBackendConnection {

    private final List<ToolDefinition> tools = new ArrayList<>();
    private final Map<String, Function<Map<String, Object>, ToolResult>> handlers = new HashMap<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private boolean closed;

    public FakeToolBackendConnection withTools(String... names) {
        for (String name : names) {
            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(name + " tool")
                    .inputSchema(Map.of("type", "object", "properties", Map.of()))
                    .build());
        }
        return this;
    }

    public FakeToolBackendConnection respond(String tool, String text) {
        handlers.put(tool, args -> ToolResult.success(text));
        return this;
    }

    public FakeToolBackendConnection respond(String tool, Function<Map<String, Object>, ToolResult> handler) {
        handlers.put(tool, handler);
        return this;
    }

    public FakeToolBackendConnection fail(String tool, String message) {
        failures.put(tool, new ToolBackendException(message));
        return this;
    }

    public List<Call> calls() {
        return calls;
    }

    public List<String> calledTools() {
        return calls.stream().map(Call::name).toList();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public List<ToolDefinition> listTools() {
        return tools;
    }

    @Override
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments) {
        calls.add(new Call(name, arguments));
        RuntimeException failure = failures.get(name);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        Function<Map<String, Object>, ToolResult> handler = handlers.get(name);
        return CompletableFuture.completedFuture(handler != null ? handler.apply(arguments) : ToolResult.success(""));
    }

    @Override
    public String endpoint() {
        return "fake://mcp";
    }

    @Override
    public void close() {
        closed = true;
    }

    public record Call(String name, Map<String, Object> arguments) {
    }
}
