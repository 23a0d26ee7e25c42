package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.ToolResult;

/**
 * Result of one tool call as it enters the conversation. Synthetic outcomes
 * were produced by the loop itself, not by the backend.
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, String toolName, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolName, ToolResult.failure(reason), reason, true);
    }
}
