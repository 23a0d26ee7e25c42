package me.golemcore.autotest.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.domain.model.StepExecutionReport;
import me.golemcore.autotest.domain.model.TestStep;
import me.golemcore.autotest.domain.model.ToolResult;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;
import me.golemcore.autotest.port.outbound.ToolBackendException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes parsed test steps without an LLM.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>Best-effort viewport preset through the run-code tool
 * <li>One navigation to the first URL found in any step, followed by a settle
 * wait; URL-bearing steps count as done from then on
 * <li>Per step: wait, click (snapshot + {@link ElementMatcher}), or snapshot
 * </ol>
 *
 * <p>
 * A click target that cannot be resolved records an {@code ActionError} entry
 * and stops the run. Transport failures propagate to the caller; everything
 * logged so far stays in the report passed in.
 */
@Service
@Slf4j
public class ScriptedStepExecutor {

    private final AutomationProperties.BrowserProperties browser;
    private final StepTextAnalyzer analyzer;
    private final ElementMatcher elementMatcher;

    public ScriptedStepExecutor(AutomationProperties properties, StepTextAnalyzer analyzer,
            ElementMatcher elementMatcher) {
        this.browser = properties.getBrowser();
        this.analyzer = analyzer;
        this.elementMatcher = elementMatcher;
    }

    /**
     * Runs the steps, filling {@code report} as it goes.
     *
     * @param closeBrowser
     *            close the browser at the end so a recording gets flushed
     */
    public StepExecutionReport execute(ToolBackendConnection connection, List<TestStep> steps,
            boolean closeBrowser, StepExecutionReport report) {
        report.setTotalSteps(steps.size());
        report.setCompletedSteps(0);
        List<String> actionLog = report.getActionLog();

        presetViewport(connection);
        navigateToFirstUrl(connection, steps, actionLog);

        for (TestStep step : steps) {
            String text = step.text() != null ? step.text() : "";
            StepTextAnalyzer.StepKind kind = analyzer.classify(text);
            log.debug("[Steps] Step {} ({}): {}", step.number(), kind, text);

            if (kind == StepTextAnalyzer.StepKind.WAIT) {
                actionLog.add("Action: wait(" + browser.getSettleSeconds() + "s)");
                settle(connection);
            } else if (kind == StepTextAnalyzer.StepKind.CLICK) {
                if (!click(connection, text, actionLog)) {
                    report.setHalted(true);
                    break;
                }
            } else if (kind != StepTextAnalyzer.StepKind.NAVIGATE) {
                actionLog.add("Action: snapshot()");
                connection.invoke(browser.getSnapshotTool(), Map.of());
            }
            report.setCompletedSteps(report.getCompletedSteps() + 1);
        }

        int completed = report.getCompletedSteps();
        actionLog.add("Completed " + completed + "/" + steps.size() + " steps");
        log.info("[Steps] Completed {}/{} steps{}", completed, steps.size(), report.isHalted() ? " (halted)" : "");

        if (closeBrowser) {
            closeQuietly(connection);
        }
        return report;
    }

    private void presetViewport(ToolBackendConnection connection) {
        String code = "async (page) => { try { await page.setViewportSize({ width: "
                + browser.getViewportWidth() + ", height: " + browser.getViewportHeight()
                + " }); } catch(e){} }";
        try {
            connection.invoke(browser.getRunCodeTool(), Map.of("code", code));
        } catch (ToolBackendException e) {
            log.debug("[Steps] Viewport preset skipped: {}", e.getMessage());
        }
    }

    private void navigateToFirstUrl(ToolBackendConnection connection, List<TestStep> steps, List<String> actionLog) {
        for (TestStep step : steps) {
            String url = analyzer.extractUrl(step.text());
            if (url == null) {
                continue;
            }
            String target = analyzer.rewriteLocalhost(url);
            actionLog.add("Action: navigate(" + target + ")");
            connection.invoke(browser.getNavigateTool(), Map.of("url", target));
            settle(connection);
            return;
        }
    }

    private boolean click(ToolBackendConnection connection, String text, List<String> actionLog) {
        String target = analyzer.extractTarget(text);
        ToolResult snapshot = connection.invoke(browser.getSnapshotTool(), Map.of());
        Optional<ElementMatcher.ElementMatch> match = elementMatcher.find(snapshot.asText(), target);
        if (match.isEmpty()) {
            actionLog.add("ActionError: could not find ref for \"" + target + "\"");
            log.warn("[Steps] No element found for \"{}\"", target);
            return false;
        }
        String ref = match.get().ref();
        actionLog.add("Action: click(ref=" + ref + ", target=" + target + ")");
        connection.invoke(browser.getClickTool(), Map.of("element", target, "ref", ref));
        settle(connection);
        return true;
    }

    private void settle(ToolBackendConnection connection) {
        connection.invoke(browser.getWaitTool(), Map.of("time", browser.getSettleSeconds()));
    }

    private void closeQuietly(ToolBackendConnection connection) {
        try {
            connection.invoke(browser.getCloseTool(), Map.of());
        } catch (ToolBackendException e) {
            log.debug("[Steps] Browser close failed: {}", e.getMessage());
        }
    }
}
