package me.golemcore.autotest.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.ToolResult;

import java.util.Map;

/**
 * Executes a tool call against the run's backend connection. Failures never
 * escape: they become tool-result text the model can react to.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    @Override
    public ToolExecutionOutcome execute(AgentRunContext context, Message.ToolCall toolCall) {
        String name = toolCall.getName();
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        try {
            ToolResult result = context.getConnection().invoke(name, args);
            return new ToolExecutionOutcome(toolCall.getId(), name, result, result.asText(), false);
        } catch (RuntimeException e) {
            String reason = "Tool execution failed for " + name + ": " + e.getMessage();
            log.warn("[AgentLoop] {}", reason);
            return ToolExecutionOutcome.synthetic(toolCall, name, reason);
        }
    }
}
