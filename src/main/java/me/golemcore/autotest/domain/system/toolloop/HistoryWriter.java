package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.LlmResponse;
import me.golemcore.autotest.domain.model.Message;

import java.util.List;

/**
 * Appends to the conversation and the transcript of a run; never rewrites
 * either.
 */
public interface HistoryWriter {

    void appendAssistant(AgentRunContext context, LlmResponse llmResponse, List<Message.ToolCall> toolCalls,
            int droppedToolCalls);

    void appendToolResult(AgentRunContext context, ToolExecutionOutcome outcome);

    void appendUserMessage(AgentRunContext context, String text);
}
