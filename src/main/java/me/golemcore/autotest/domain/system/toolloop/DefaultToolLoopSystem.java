package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.AgentRunState;
import me.golemcore.autotest.domain.model.LlmRequest;
import me.golemcore.autotest.domain.model.LlmResponse;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.ToolInvocation;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.LlmPort;
import me.golemcore.autotest.port.outbound.ToolBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Agent loop orchestrator.
 *
 * <p>
 * State machine: {@code AWAITING_MODEL} → ({@code EXECUTING_TOOLS} →
 * {@code AWAITING_MODEL})* → {@code CHECKING_COMPLETION} → {@code DONE}, or
 * {@code MAX_ITER_STOPPED} once the iteration budget is spent. Every assistant
 * reply is appended; tool calls beyond the per-iteration cap are dropped before
 * the reply enters the conversation, so each kept call gets exactly one tool
 * message, in call order.
 *
 * <p>
 * Tool failures become tool-result text. A completion-service failure
 * propagates and ends the run.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String INVALID_TOOL_CALL = "invalid_tool_call";
    static final String INVALID_TOOL_CALL_TEXT = "Invalid tool call from model (missing function name).";
    static final String MAX_ITERATIONS_TEXT = "Stopped: max_iterations reached.";

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final CompletionEnforcer completionEnforcer;
    private final AutomationProperties.AgentProperties settings;
    private final AutomationProperties.BrowserProperties browser;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            AutomationProperties properties) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.settings = properties.getAgent();
        this.browser = properties.getBrowser();
        this.completionEnforcer = new CompletionEnforcer(settings.getMaxMarkerReminders());
    }

    @Override
    public ToolLoopResult run(AgentRunContext context) {
        int maxIterations = context.getMaxIterations() > 0 ? context.getMaxIterations()
                : settings.getDefaultMaxIterations();
        int maxToolCalls = Math.max(1, settings.getMaxToolCallsPerIteration());

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            context.setIteration(iteration);
            context.setState(AgentRunState.AWAITING_MODEL);

            // 1) LLM call
            LlmResponse response = llmPort.chat(buildRequest(context)).join();
            List<Message.ToolCall> requested = response != null && response.hasToolCalls()
                    ? response.getToolCalls()
                    : List.of();
            List<Message.ToolCall> toolCalls = requested.size() > maxToolCalls
                    ? new ArrayList<>(requested.subList(0, maxToolCalls))
                    : requested;
            int dropped = requested.size() - toolCalls.size();
            if (dropped > 0) {
                log.info("[AgentLoop] Iteration {}: dropping {} of {} tool calls", iteration, dropped,
                        requested.size());
            }

            // 2) Append assistant reply unconditionally
            historyWriter.appendAssistant(context, response, toolCalls, dropped);

            // 3) Execute tools and append results
            if (!toolCalls.isEmpty()) {
                context.setState(AgentRunState.EXECUTING_TOOLS);
                for (Message.ToolCall tc : toolCalls) {
                    historyWriter.appendToolResult(context, executeToolCall(context, tc));
                }
                continue;
            }

            // 4) Final answer: check the completion marker
            context.setState(AgentRunState.CHECKING_COMPLETION);
            String content = response != null && response.getContent() != null ? response.getContent() : "";
            CompletionEnforcer.Decision decision = completionEnforcer.evaluate(context, content);
            if (decision.done()) {
                log.info("[AgentLoop] Done after {} iteration(s), steps {}/{}", iteration,
                        context.getCompletedSteps(), context.getTotalSteps());
                return finish(context, AgentRunState.DONE, iteration, content);
            }
            historyWriter.appendUserMessage(context, decision.correctiveMessage());
        }

        log.warn("[AgentLoop] Stopped after {} iterations without DONE", maxIterations);
        return finish(context, AgentRunState.MAX_ITER_STOPPED, maxIterations, MAX_ITERATIONS_TEXT);
    }

    private ToolExecutionOutcome executeToolCall(AgentRunContext context, Message.ToolCall tc) {
        if (tc.getName() == null || tc.getName().isBlank()) {
            log.warn("[AgentLoop] Iteration {}: tool call without name", context.getIteration());
            return ToolExecutionOutcome.synthetic(tc, INVALID_TOOL_CALL, INVALID_TOOL_CALL_TEXT);
        }

        Map<String, Object> args = tc.getArguments() != null ? tc.getArguments() : Map.of();
        context.getToolInvocations().add(new ToolInvocation(context.getIteration(), tc.getName(), args));
        log.debug("[AgentLoop] Iteration {}: {} {}", context.getIteration(), tc.getName(), args);

        try {
            return toolExecutor.execute(context, tc);
        } catch (RuntimeException e) {
            return ToolExecutionOutcome.synthetic(tc, tc.getName(),
                    "Tool execution failed for " + tc.getName() + ": " + e.getMessage());
        }
    }

    private ToolLoopResult finish(AgentRunContext context, AgentRunState state, int iterations, String message) {
        context.setState(state);
        context.setFinalMessage(message);
        if (context.isRecordVideo()) {
            closeBrowser(context);
        }
        return new ToolLoopResult(context, state, iterations, message);
    }

    private void closeBrowser(AgentRunContext context) {
        try {
            context.getConnection().invoke(browser.getCloseTool(), Map.of());
        } catch (ToolBackendException e) {
            log.debug("[AgentLoop] Browser close failed: {}", e.getMessage());
        }
    }

    private LlmRequest buildRequest(AgentRunContext context) {
        return LlmRequest.builder()
                .messages(new ArrayList<>(context.getMessages()))
                .tools(context.getTools())
                .build();
    }
}
