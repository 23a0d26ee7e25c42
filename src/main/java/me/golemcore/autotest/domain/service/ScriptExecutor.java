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
import me.golemcore.autotest.domain.model.ToolResult;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;
import me.golemcore.autotest.port.outbound.ToolBackendException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs a stored Playwright script through the backend's run-code tool. The
 * script body is wrapped into {@code async (page) => { ... }} with the
 * recording viewport preset in front of it.
 */
@Service
@Slf4j
public class ScriptExecutor {

    private final AutomationProperties.BrowserProperties browser;

    public ScriptExecutor(AutomationProperties properties) {
        this.browser = properties.getBrowser();
    }

    public void execute(ToolBackendConnection connection, String script, boolean recordVideo,
            List<String> actionLog) {
        actionLog.add("Action: " + browser.getRunCodeTool() + "(script)");
        ToolResult result = connection.invoke(browser.getRunCodeTool(), Map.of("code", wrap(script)));
        String text = result.isSuccess() ? result.getOutput() : result.getError();
        if (text != null && !text.isEmpty()) {
            actionLog.add("Result:");
            actionLog.add(text);
        }
        log.info("[Script] Script finished on {} (success={})", connection.endpoint(), result.isSuccess());

        if (recordVideo) {
            // Let the recorder capture the final UI state before the context closes
            bestEffort(connection, browser.getWaitTool(), Map.of("time", browser.getSettleSeconds()));
            bestEffort(connection, browser.getCloseTool(), Map.of());
        }
    }

    String wrap(String script) {
        return "async (page) => {\n  try { await page.setViewportSize({ width: " + browser.getViewportWidth()
                + ", height: " + browser.getViewportHeight() + " }); } catch (e) {}\n" + script + "\n}";
    }

    private void bestEffort(ToolBackendConnection connection, String tool, Map<String, Object> args) {
        try {
            connection.invoke(tool, args);
        } catch (ToolBackendException e) {
            log.debug("[Script] {} failed: {}", tool, e.getMessage());
        }
    }
}
