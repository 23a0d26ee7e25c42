package me.golemcore.autotest.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.autotest.domain.model.AgentRunState;
import me.golemcore.autotest.domain.model.BackendHealth;
import me.golemcore.autotest.domain.model.ExecutionResult;
import me.golemcore.autotest.domain.model.LlmRequest;
import me.golemcore.autotest.domain.model.LlmResponse;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.RunRequest;
import me.golemcore.autotest.domain.system.toolloop.DefaultHistoryWriter;
import me.golemcore.autotest.domain.system.toolloop.DefaultToolExecutor;
import me.golemcore.autotest.domain.system.toolloop.DefaultToolLoopSystem;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.LlmPort;
import me.golemcore.autotest.port.outbound.ToolBackendException;
import me.golemcore.autotest.port.outbound.ToolBackendPort;
import me.golemcore.autotest.testsupport.mcp.FakeToolBackendConnection;
import me.golemcore.autotest.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutomationRunServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path videoDir;

    private ToolBackendPort toolBackend;
    private LlmPort llmPort;
    private FakeToolBackendConnection connection;
    private AutomationProperties properties;
    private MutableClock clock;
    private AutomationRunService service;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        properties.getVideo().setDirectory(videoDir.toString());
        properties.getVideo().setFindTimeoutMs(1000);
        clock = new MutableClock(NOW);
        Sleeper sleeper = millis -> clock.advance(Duration.ofMillis(millis));
        ObjectMapper objectMapper = new ObjectMapper();

        toolBackend = mock(ToolBackendPort.class);
        llmPort = mock(LlmPort.class);
        when(llmPort.getProviderId()).thenReturn("ollama");
        when(llmPort.getCurrentModel()).thenReturn("gpt-oss:20b");
        connection = new FakeToolBackendConnection()
                .withTools("browser_navigate", "browser_click", "browser_snapshot", "browser_wait_for",
                        "browser_run_code", "browser_close")
                .respond("browser_snapshot", "- button \"Login\" [ref=e3]");
        when(toolBackend.acquire()).thenReturn(connection);
        when(toolBackend.endpoints()).thenReturn(List.of("http://playwright-mcp-core:8931/mcp"));

        StepTextAnalyzer analyzer = new StepTextAnalyzer(properties);
        service = new AutomationRunService(
                toolBackend,
                llmPort,
                new DefaultToolLoopSystem(llmPort, new DefaultToolExecutor(), new DefaultHistoryWriter(clock),
                        properties),
                new ScriptedStepExecutor(properties, analyzer, new SnapshotElementMatcher()),
                new ScriptExecutor(properties),
                new VideoFinalizationWatcher(properties, clock, sleeper),
                new ExecutionResultBuilder(objectMapper),
                new PromptBuilder(properties, objectMapper),
                properties,
                objectMapper,
                clock);
    }

    @SuppressWarnings("unchecked")
    private void replies(LlmResponse first, LlmResponse... rest) {
        CompletableFuture<LlmResponse>[] futures = Arrays.stream(rest)
                .map(CompletableFuture::completedFuture)
                .toArray(CompletableFuture[]::new);
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(first), futures);
    }

    private void recording(String name, int bytes) throws IOException {
        Path file = videoDir.resolve(name);
        Files.write(file, new byte[bytes]);
        Files.setLastModifiedTime(file, FileTime.from(NOW.plusSeconds(1)));
    }

    @Test
    void shouldRunAgentWithStepTotalFromInput() {
        replies(LlmResponse.builder().toolCalls(List.of(Message.ToolCall.builder()
                .id("call-1").name("browser_navigate").arguments(Map.of("url", "http://frontend:5173")).build()))
                .build(),
                LlmResponse.builder().content("DONE (completed_steps=2 total_steps=2)").build());

        ExecutionResult result = service.runAgent(RunRequest.builder()
                .prompt("Log in")
                .stepsText("1. Open http://localhost:5173\n2. Click \"Login\"")
                .build());

        assertTrue(result.isSuccess());
        assertEquals(AgentRunState.DONE, result.getState());
        assertEquals(2, result.getTotalSteps());
        assertEquals(2, result.getCompletedSteps());
        assertEquals("iteration 1: browser_navigate {\"url\":\"http://frontend:5173\"}", result.getActionsTaken());
        assertTrue(connection.isClosed());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, atLeastOnce()).chat(captor.capture());
        List<Message> opening = captor.getAllValues().get(0).getMessages();
        assertEquals(Message.ROLE_SYSTEM, opening.get(0).getRole());
        assertTrue(opening.get(1).getContent().contains("Steps:\n1. Open http://localhost:5173"));
    }

    @Test
    void shouldReportAgentFailureWithPartialTranscript() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.failedFuture(
                new IllegalStateException("LLM chat failed: Connection refused")));

        ExecutionResult result = service.runAgent(RunRequest.builder().prompt("Log in").build());

        assertFalse(result.isSuccess());
        assertEquals("LLM chat failed: Connection refused", result.getError());
        assertEquals(1, result.getIterations());
        assertTrue(connection.isClosed());
    }

    @Test
    void shouldReportUnreachableBackendAsFailedRun() {
        when(toolBackend.acquire()).thenThrow(new ToolBackendException("MCP request initialize failed: HTTP 502"));

        ExecutionResult result = service.runAgent(RunRequest.builder().prompt("Log in").build());

        assertFalse(result.isSuccess());
        assertEquals("MCP request initialize failed: HTTP 502", result.getError());
        verify(llmPort, never()).chat(any(LlmRequest.class));
    }

    @Test
    void shouldSaveAgentVideoAfterSuccessfulRun() throws IOException {
        replies(LlmResponse.builder().content("All done").build());
        recording("raw-context.webm", 64 * 1024);

        ExecutionResult result = service.runAgent(RunRequest.builder()
                .prompt("Log in")
                .recordVideo(true)
                .videoPath("runs/login.webm")
                .build());

        assertTrue(result.isVideoSaved());
        assertEquals("runs/login.webm", result.getVideoFilename());
        assertTrue(Files.exists(videoDir.resolve("runs/login.webm")));
        assertTrue(connection.calledTools().contains("browser_close"));
    }

    @Test
    void shouldValidateMaxIterations() {
        assertEquals(12, service.resolveMaxIterations(null));
        assertEquals(50, service.resolveMaxIterations(50));
        assertThrows(IllegalArgumentException.class, () -> service.resolveMaxIterations(0));
        assertThrows(IllegalArgumentException.class, () -> service.resolveMaxIterations(51));
    }

    @Test
    void shouldRejectVideoPathOutsideVideoDirectory() {
        RunRequest request = RunRequest.builder().prompt("x").recordVideo(true).videoPath("../../etc/x.webm").build();

        assertThrows(IllegalArgumentException.class, () -> service.runAgent(request));
        verify(toolBackend, never()).acquire();
    }

    @Test
    void shouldDeriveStepTotalFromInput() {
        assertEquals(3, AutomationRunService.stepTotalFromInput(RunRequest.builder()
                .stepsText("1. a\n2. b\n- c").build()));
        assertEquals(2, AutomationRunService.stepTotalFromInput(RunRequest.builder()
                .stepsList(List.of("a", Map.of("click", "b"))).build()));
        assertNull(AutomationRunService.stepTotalFromInput(RunRequest.builder().stepsText("free text").build()));
    }

    @Test
    void shouldRunLoginStepsDeterministically() {
        ExecutionResult result = service.runSteps(RunRequest.builder()
                .stepsText("1. Open http://localhost:5173/login\n2. Click \"Sign in\"\n3. Observe the page")
                .build());

        assertTrue(result.isSuccess());
        assertEquals(1, result.getCompletedSteps());
        assertEquals(3, result.getTotalSteps());
        assertEquals("Action: navigate(http://frontend:5173/login)\n"
                + "ActionError: could not find ref for \"Sign in\"\n"
                + "Completed 1/3 steps", result.getActionsTaken());
        verify(llmPort, never()).chat(any(LlmRequest.class));
    }

    @Test
    void shouldJoinStepListIntoText() {
        ExecutionResult result = service.runSteps(RunRequest.builder()
                .stepsList(List.of("1. Click \"Login\"", "2. Wait a moment"))
                .build());

        assertEquals(2, result.getCompletedSteps());
        assertTrue(result.getActionsTaken().contains("Action: click(ref=e3, target=Login)"));
    }

    @Test
    void shouldRejectMissingSteps() {
        RunRequest request = RunRequest.builder().stepsText("  ").build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.runSteps(request));
        assertEquals("Missing steps", error.getMessage());
    }

    @Test
    void shouldKeepStepLogOnTransportFailure() {
        connection.fail("browser_navigate", "MCP request tools/call failed: timeout");

        ExecutionResult result = service.runSteps(RunRequest.builder()
                .stepsText("1. Open http://localhost:5173")
                .build());

        assertFalse(result.isSuccess());
        assertEquals("Action: navigate(http://frontend:5173)\n"
                + "Error: MCP request tools/call failed: timeout", result.getActionsTaken());
    }

    @Test
    void shouldReportStepProgressWhenTransportFailsMidRun() {
        connection.fail("browser_click", "MCP request tools/call failed: timeout");

        ExecutionResult result = service.runSteps(RunRequest.builder()
                .stepsText("1. Observe the page\n2. Click \"Login\"")
                .build());

        assertFalse(result.isSuccess());
        assertEquals(1, result.getCompletedSteps());
        assertEquals(2, result.getTotalSteps());
        assertEquals(0.5, result.getStepCoverage().ratio());
        assertTrue(result.getActionsTaken().startsWith("Action: snapshot()\n"));
        assertTrue(result.getActionsTaken().endsWith("Error: MCP request tools/call failed: timeout"));
    }

    @Test
    void shouldTreatVideoPathAsRecordingForSteps() throws IOException {
        recording("raw.webm", 64 * 1024);

        ExecutionResult result = service.runSteps(RunRequest.builder()
                .stepsText("1. Observe the page")
                .videoPath("steps.webm")
                .build());

        assertTrue(result.isVideoSaved());
        assertTrue(connection.calledTools().contains("browser_close"));
    }

    @Test
    void shouldRunScript() {
        connection.respond("browser_run_code", "ok");

        ExecutionResult result = service.runScript("await page.goto('http://frontend:5173');", false, null);

        assertTrue(result.isSuccess());
        assertEquals("Action: browser_run_code(script)\nResult:\nok", result.getActionsTaken());
    }

    @Test
    void shouldRejectMissingScript() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.runScript(" ", false, null));

        assertEquals("Missing script", error.getMessage());
    }

    @Test
    void shouldReportHealth() {
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.isReachable()).thenReturn(true);

        BackendHealth health = service.health();

        assertTrue(health.isLlmReachable());
        assertTrue(health.isToolBackendReachable());
        assertTrue(health.hasTool("browser_run_code"));
        assertEquals(6, health.getToolNames().size());
        assertEquals("fake://mcp", health.getToolBackendEndpoint());
        assertTrue(connection.isClosed());
    }

    @Test
    void shouldNotProbeUnconfiguredLlmInHealth() {
        when(llmPort.isAvailable()).thenReturn(false);

        BackendHealth health = service.health();

        assertFalse(health.isLlmReachable());
        assertTrue(health.isToolBackendReachable());
        verify(llmPort, never()).isReachable();
    }

    @Test
    void shouldReportUnreachableToolBackendInHealth() {
        when(toolBackend.acquire()).thenThrow(new ToolBackendException("Connection refused"));

        BackendHealth health = service.health();

        assertFalse(health.isToolBackendReachable());
        assertEquals("Connection refused", health.getError());
        assertEquals(List.of("http://playwright-mcp-core:8931/mcp"), health.getToolBackendPool());
    }
}
