package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.Message;

public interface ToolExecutorPort {

    ToolExecutionOutcome execute(AgentRunContext context, Message.ToolCall toolCall);
}
