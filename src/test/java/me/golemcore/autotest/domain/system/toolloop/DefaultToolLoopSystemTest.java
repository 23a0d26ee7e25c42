package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.AgentRunState;
import me.golemcore.autotest.domain.model.LlmRequest;
import me.golemcore.autotest.domain.model.LlmResponse;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.RunRequest;
import me.golemcore.autotest.domain.model.TranscriptEntry;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.LlmPort;
import me.golemcore.autotest.testsupport.mcp.FakeToolBackendConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private LlmPort llmPort;
    private FakeToolBackendConnection connection;
    private AutomationProperties properties;
    private DefaultToolLoopSystem system;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        connection = new FakeToolBackendConnection()
                .withTools("browser_navigate", "browser_click", "browser_snapshot", "browser_close")
                .respond("browser_navigate", "Navigated to http://frontend:5173")
                .respond("browser_snapshot", "- button \"Login\" [ref=e3]");
        properties = new AutomationProperties();
        system = new DefaultToolLoopSystem(llmPort, new DefaultToolExecutor(),
                new DefaultHistoryWriter(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC)),
                properties);
    }

    private AgentRunContext context(Integer totalSteps, int maxIterations, boolean recordVideo) {
        AgentRunContext context = AgentRunContext.builder()
                .request(RunRequest.builder().prompt("Run the login test").recordVideo(recordVideo).build())
                .connection(connection)
                .maxIterations(maxIterations)
                .tools(connection.listTools())
                .totalSteps(totalSteps)
                .build();
        context.getMessages().add(Message.builder().role(Message.ROLE_SYSTEM).content("system").build());
        context.getMessages().add(Message.builder().role(Message.ROLE_USER).content("steps").build());
        return context;
    }

    @SafeVarargs
    private void replies(CompletableFuture<LlmResponse>... responses) {
        if (responses.length == 1) {
            when(llmPort.chat(any(LlmRequest.class))).thenReturn(responses[0]);
            return;
        }
        CompletableFuture<LlmResponse>[] rest = Arrays.copyOfRange(responses, 1, responses.length);
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(responses[0], rest);
    }

    private static CompletableFuture<LlmResponse> text(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    private static CompletableFuture<LlmResponse> calls(Message.ToolCall... toolCalls) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content("").toolCalls(List.of(toolCalls))
                .build());
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> args) {
        return Message.ToolCall.builder().id(id).name(name).arguments(args).build();
    }

    private static List<Message> toolMessages(AgentRunContext context) {
        return context.getMessages().stream().filter(Message::isToolMessage).toList();
    }

    @Test
    void shouldFinishImmediatelyOnCompleteMarker() {
        replies(text("DONE (completed_steps=3 total_steps=3) All steps passed."));
        AgentRunContext context = context(3, 12, false);

        ToolLoopResult result = system.run(context);

        assertEquals(AgentRunState.DONE, result.state());
        assertEquals(1, result.iterations());
        assertEquals(3, context.getCompletedSteps());
        assertEquals(3, context.getTotalSteps());
        assertTrue(context.getTranscript().stream().noneMatch(entry -> Message.ROLE_USER.equals(entry.getRole())));
        assertEquals("DONE (completed_steps=3 total_steps=3) All steps passed.", result.finalMessage());
    }

    @Test
    void shouldExecuteToolCallsInOrderAndAnswerEachOne() {
        replies(
                calls(call("call-1", "browser_navigate", Map.of("url", "http://frontend:5173")),
                        call("call-2", "browser_snapshot", Map.of())),
                text("DONE (completed_steps=1 total_steps=1)"));
        AgentRunContext context = context(1, 12, false);

        ToolLoopResult result = system.run(context);

        assertEquals(AgentRunState.DONE, result.state());
        assertEquals(2, result.iterations());
        assertEquals(List.of("browser_navigate", "browser_snapshot"), connection.calledTools());
        List<Message> tools = toolMessages(context);
        assertEquals(List.of("call-1", "call-2"), tools.stream().map(Message::getToolCallId).toList());
        assertEquals("Navigated to http://frontend:5173", tools.get(0).getContent());
        assertEquals(2, context.getToolInvocations().size());
        assertEquals(1, context.getToolInvocations().get(0).iteration());
    }

    @Test
    void shouldSendFullHistoryToModel() {
        replies(calls(call("call-1", "browser_snapshot", Map.of())), text("DONE (completed_steps=1 total_steps=1)"));

        system.run(context(1, 12, false));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        LlmRequest second = captor.getAllValues().get(1);
        assertEquals(List.of("system", "user", "assistant", "tool"),
                second.getMessages().stream().map(Message::getRole).toList());
        assertEquals(4, second.getTools().size());
    }

    @Test
    void shouldSendExactlyTwoRemindersBeforeDone() {
        replies(text("I am finished."), text("Still finished."),
                text("DONE (completed_steps=2 total_steps=2)"));
        AgentRunContext context = context(2, 12, false);

        ToolLoopResult result = system.run(context);

        List<TranscriptEntry> reminders = context.getTranscript().stream()
                .filter(entry -> Message.ROLE_USER.equals(entry.getRole()))
                .toList();
        assertEquals(2, reminders.size());
        assertTrue(reminders.get(0).getContent().startsWith("You must include progress markers."));
        assertEquals(AgentRunState.DONE, result.state());
        assertEquals(3, result.iterations());
        assertEquals(2, context.getCompletedSteps());
    }

    @Test
    void shouldEndWithUnknownCoverageWhenMarkerNeverArrives() {
        replies(text("a"), text("b"), text("c"));
        AgentRunContext context = context(2, 12, false);

        ToolLoopResult result = system.run(context);

        assertEquals(AgentRunState.DONE, result.state());
        assertEquals(3, result.iterations());
        assertNull(context.getCompletedSteps());
    }

    @Test
    void shouldPushModelToContinueIncompleteRun() {
        replies(text("DONE (completed_steps=1 total_steps=3)"),
                calls(call("call-1", "browser_click", Map.of("element", "Login", "ref", "e3"))),
                text("DONE (completed_steps=3 total_steps=3)"));
        AgentRunContext context = context(3, 12, false);

        ToolLoopResult result = system.run(context);

        assertEquals(AgentRunState.DONE, result.state());
        assertTrue(context.getTranscript().get(1).getContent()
                .startsWith("You reported only 1/3 steps completed. Continue executing from step 2"));
        assertEquals(3, context.getCompletedSteps());
    }

    @Test
    void shouldCapToolCallsPerIteration() {
        properties.getAgent().setMaxToolCallsPerIteration(2);
        Message.ToolCall[] requested = IntStream.rangeClosed(1, 5)
                .mapToObj(i -> call("call-" + i, "browser_snapshot", Map.of()))
                .toArray(Message.ToolCall[]::new);
        replies(calls(requested), text("done"));
        AgentRunContext context = context(null, 12, false);

        system.run(context);

        assertEquals(2, connection.calls().size());
        Message assistant = context.getMessages().get(2);
        assertEquals(2, assistant.getToolCalls().size());
        assertEquals(2, toolMessages(context).size());
        assertEquals(3, context.getTranscript().get(0).getDroppedToolCalls());
    }

    @Test
    void shouldTurnToolFailureIntoToolMessage() {
        connection.fail("browser_click", "MCP error -32602: Ref e9 not found");
        replies(calls(call("call-1", "browser_click", Map.of("ref", "e9"))), text("done"));
        AgentRunContext context = context(null, 12, false);

        ToolLoopResult result = system.run(context);

        assertEquals(AgentRunState.DONE, result.state());
        assertEquals("Tool execution failed for browser_click: MCP error -32602: Ref e9 not found",
                toolMessages(context).get(0).getContent());
    }

    @Test
    void shouldAnswerNamelessCallWithoutInvokingBackend() {
        replies(calls(call("call-1", null, Map.of())), text("done"));
        AgentRunContext context = context(null, 12, false);

        system.run(context);

        Message tool = toolMessages(context).get(0);
        assertEquals("invalid_tool_call", tool.getToolName());
        assertEquals("call-1", tool.getToolCallId());
        assertEquals("Invalid tool call from model (missing function name).", tool.getContent());
        assertTrue(connection.calls().isEmpty());
        assertTrue(context.getToolInvocations().isEmpty());
    }

    @Test
    void shouldStopAtMaxIterations() {
        replies(calls(call("call-1", "browser_snapshot", Map.of())));
        AgentRunContext context = context(2, 3, false);

        ToolLoopResult result = system.run(context);

        assertEquals(AgentRunState.MAX_ITER_STOPPED, result.state());
        assertEquals(3, result.iterations());
        assertEquals("Stopped: max_iterations reached.", result.finalMessage());
        assertEquals(3, connection.calls().size());
        assertFalse(connection.calledTools().contains("browser_close"));
    }

    @Test
    void shouldCloseBrowserWhenRecording() {
        replies(text("DONE (completed_steps=1 total_steps=1)"));

        system.run(context(1, 12, true));

        assertEquals(List.of("browser_close"), connection.calledTools());
    }

    @Test
    void shouldPropagateCompletionServiceFailure() {
        CompletableFuture<LlmResponse> failed = CompletableFuture.failedFuture(
                new IllegalStateException("LLM chat failed: Connection refused"));
        replies(calls(call("call-1", "browser_snapshot", Map.of())), failed);
        AgentRunContext context = context(null, 12, false);

        assertThrows(CompletionException.class, () -> system.run(context));
        assertEquals(2, context.getIteration());
        assertEquals(List.of("assistant", "tool"),
                context.getTranscript().stream().map(TranscriptEntry::getRole).toList());
    }
}
