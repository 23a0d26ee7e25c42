package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.AgentRunState;

public record ToolLoopResult(AgentRunContext context, AgentRunState state, int iterations, String finalMessage) {
}
