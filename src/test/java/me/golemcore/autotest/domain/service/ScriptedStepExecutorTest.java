package me.golemcore.autotest.domain.service;

import me.golemcore.autotest.domain.model.StepExecutionReport;
import me.golemcore.autotest.domain.model.TestStep;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.ToolBackendException;
import me.golemcore.autotest.testsupport.mcp.FakeToolBackendConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptedStepExecutorTest {

    private static final String LOGIN_SNAPSHOT = String.join("\n",
            "- heading \"Sign in\" [ref=e1]",
            "- textbox \"Email\" [ref=e2]",
            "- button \"Continue\" [ref=e3]");

    private ScriptedStepExecutor executor;
    private FakeToolBackendConnection connection;

    @BeforeEach
    void setUp() {
        AutomationProperties properties = new AutomationProperties();
        executor = new ScriptedStepExecutor(properties, new StepTextAnalyzer(properties),
                new SnapshotElementMatcher());
        connection = new FakeToolBackendConnection()
                .withTools("browser_navigate", "browser_click", "browser_snapshot", "browser_wait_for")
                .respond("browser_snapshot", LOGIN_SNAPSHOT);
    }

    private StepExecutionReport run(String stepsText, boolean closeBrowser) {
        List<TestStep> steps = StepParser.parse(stepsText);
        return executor.execute(connection, steps, closeBrowser, StepExecutionReport.builder().build());
    }

    @Test
    void shouldStopAtFirstUnresolvableElement() {
        StepExecutionReport report = run(String.join("\n",
                "1. Open http://localhost:5173/login",
                "2. Click the \"Register\" link",
                "3. Click \"Continue\""), false);

        assertEquals(List.of(
                "Action: navigate(http://frontend:5173/login)",
                "ActionError: could not find ref for \"Register\"",
                "Completed 1/3 steps"), report.getActionLog());
        assertEquals(1, report.getCompletedSteps());
        assertEquals(3, report.getTotalSteps());
        assertTrue(report.isHalted());
        assertEquals(1, connection.calledTools().stream().filter("browser_navigate"::equals).count());
        assertFalse(connection.calledTools().contains("browser_click"));
    }

    @Test
    void shouldClickResolvedElementAndSettle() {
        StepExecutionReport report = run(String.join("\n",
                "1. Open http://localhost:5173/login",
                "2. Click \"Continue\"",
                "3. Wait for the dashboard",
                "4. Verify the greeting"), false);

        assertEquals(List.of(
                "Action: navigate(http://frontend:5173/login)",
                "Action: click(ref=e3, target=Continue)",
                "Action: wait(1s)",
                "Action: snapshot()",
                "Completed 4/4 steps"), report.getActionLog());
        assertFalse(report.isHalted());
        assertEquals(List.of(
                "browser_run_code",
                "browser_navigate", "browser_wait_for",
                "browser_snapshot", "browser_click", "browser_wait_for",
                "browser_wait_for",
                "browser_snapshot"), connection.calledTools());
        FakeToolBackendConnection.Call click = connection.calls().get(4);
        assertEquals(Map.of("element", "Continue", "ref", "e3"), click.arguments());
    }

    @Test
    void shouldPresetViewportBestEffort() {
        connection.fail("browser_run_code", "unknown tool");

        StepExecutionReport report = run("1. Verify the page", false);

        assertEquals(1, report.getCompletedSteps());
        String code = (String) connection.calls().get(0).arguments().get("code");
        assertTrue(code.contains("setViewportSize({ width: 1280, height: 720 })"));
    }

    @Test
    void shouldCloseBrowserWhenRecording() {
        run("1. Observe the page", true);

        List<String> tools = connection.calledTools();
        assertEquals("browser_close", tools.get(tools.size() - 1));
    }

    @Test
    void shouldPropagateTransportFailure() {
        connection.fail("browser_navigate", "MCP request tools/call failed: connection reset");
        List<TestStep> steps = StepParser.parse("1. Open http://localhost:5173");
        StepExecutionReport report = StepExecutionReport.builder().build();

        assertThrows(ToolBackendException.class, () -> executor.execute(connection, steps, false, report));
        assertEquals(List.of("Action: navigate(http://frontend:5173)"), report.getActionLog());
    }

    @Test
    void shouldCountFinishedStepsBeforeTransportFailure() {
        connection.fail("browser_click", "MCP request tools/call failed: timeout");
        List<TestStep> steps = StepParser.parse("1. Observe the page\n2. Click \"Continue\"");
        StepExecutionReport report = StepExecutionReport.builder().build();

        assertThrows(ToolBackendException.class, () -> executor.execute(connection, steps, false, report));
        assertEquals(1, report.getCompletedSteps());
        assertEquals(2, report.getTotalSteps());
        assertEquals(List.of("Action: snapshot()", "Action: click(ref=e3, target=Continue)"),
                report.getActionLog());
    }
}
