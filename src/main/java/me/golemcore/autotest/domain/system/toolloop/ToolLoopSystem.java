package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;

public interface ToolLoopSystem {

    ToolLoopResult run(AgentRunContext context);
}
