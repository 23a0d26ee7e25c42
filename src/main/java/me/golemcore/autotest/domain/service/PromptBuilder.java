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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.domain.model.RunRequest;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the opening system and user messages of an agent run.
 */
@Component
@Slf4j
public class PromptBuilder {

    static final String DEFAULT_USER_PROMPT = "Open the app and perform the described steps.";

    private final AutomationProperties properties;
    private final ObjectMapper objectMapper;

    public PromptBuilder(AutomationProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public String buildSystemPrompt(boolean recordVideo, String videoPath) {
        AutomationProperties.BrowserProperties browser = properties.getBrowser();
        List<String> lines = new ArrayList<>(List.of(
                "You are an automation agent that can control a browser using MCP tools.",
                "You MUST accomplish the user task by calling tools. Prefer tool calls over guessing.",
                "IMPORTANT: Follow the provided steps STRICTLY. Do NOT perform extra actions not requested by the steps.",
                "You MUST complete ALL numbered steps provided by the user. Do not stop early.",
                "Track progress explicitly. Only mark a step complete after you have actually executed it "
                        + "via tool calls and confirmed the result via snapshots/tool output.",
                "Use " + browser.getNavigateTool() + " to open pages. Use " + browser.getSnapshotTool()
                        + " to find elements and refs.",
                "When clicking, prefer providing both element (human description) and ref when available.",
                "After navigation or clicks, use " + browser.getWaitTool() + "(time=" + browser.getSettleSeconds()
                        + ") briefly if needed.",
                "Avoid saving files unless explicitly asked (e.g., do not pass snapshot filenames unless required)."));

        if (recordVideo) {
            lines.add("Video recording is REQUIRED for this run. Ensure the browser context is created with "
                    + "video recording enabled and saved under: " + properties.getVideo().getDirectory() + ".");
            lines.add(videoPath != null && !videoPath.isBlank()
                    ? "The desired final video filename is: " + videoPath + "."
                    : "A deterministic filename will be provided separately.");
            lines.add("IMPORTANT: Close the page/context/browser at the end so the video is finalized on disk.");
        }

        lines.add("When all steps are completed, STOP calling tools and reply with a short summary that begins "
                + "with: DONE (completed_steps=X total_steps=Y)");
        return String.join("\n", lines);
    }

    public String buildUserPrompt(RunRequest request) {
        List<String> parts = new ArrayList<>();
        if (request.getPrompt() != null && !request.getPrompt().isBlank()) {
            parts.add(request.getPrompt().trim());
        }
        if (request.getTestDescription() != null && !request.getTestDescription().isBlank()) {
            parts.add("Test description: " + request.getTestDescription().trim());
        }
        if (request.hasStepsText()) {
            parts.add("Steps:\n" + request.getStepsText().trim());
        } else if (request.hasStepsList()) {
            parts.add("Steps (JSON):\n" + toPrettyJson(request.getStepsList()));
        }
        return parts.isEmpty() ? DEFAULT_USER_PROMPT : String.join("\n\n", parts);
    }

    private String toPrettyJson(List<Object> steps) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(steps);
        } catch (JsonProcessingException e) {
            log.warn("[AgentLoop] Cannot render steps as JSON: {}", e.getMessage());
            return String.valueOf(steps);
        }
    }
}
