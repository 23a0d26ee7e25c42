package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.LlmResponse;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.TranscriptEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistant(AgentRunContext context, LlmResponse llmResponse, List<Message.ToolCall> toolCalls,
            int droppedToolCalls) {
        String content = llmResponse != null && llmResponse.getContent() != null ? llmResponse.getContent() : "";
        List<Message.ToolCall> calls = toolCalls != null && !toolCalls.isEmpty() ? List.copyOf(toolCalls) : null;

        context.getMessages().add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(calls)
                .timestamp(now())
                .build());

        context.getTranscript().add(TranscriptEntry.builder()
                .iteration(context.getIteration())
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(calls != null ? calls : List.of())
                .droppedToolCalls(droppedToolCalls)
                .build());
    }

    @Override
    public void appendToolResult(AgentRunContext context, ToolExecutionOutcome outcome) {
        context.getMessages().add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());

        context.getTranscript().add(TranscriptEntry.builder()
                .iteration(context.getIteration())
                .role(Message.ROLE_TOOL)
                .name(outcome.toolName())
                .content(outcome.messageContent())
                .build());
    }

    @Override
    public void appendUserMessage(AgentRunContext context, String text) {
        context.getMessages().add(Message.builder()
                .role(Message.ROLE_USER)
                .content(text)
                .timestamp(now())
                .build());

        context.getTranscript().add(TranscriptEntry.builder()
                .iteration(context.getIteration())
                .role(Message.ROLE_USER)
                .content(text)
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
