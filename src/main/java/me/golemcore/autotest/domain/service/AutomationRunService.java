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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.BackendHealth;
import me.golemcore.autotest.domain.model.ExecutionResult;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.RunRequest;
import me.golemcore.autotest.domain.model.StepExecutionReport;
import me.golemcore.autotest.domain.model.TestStep;
import me.golemcore.autotest.domain.model.ToolDefinition;
import me.golemcore.autotest.domain.model.VideoResolution;
import me.golemcore.autotest.domain.system.toolloop.ToolLoopResult;
import me.golemcore.autotest.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import me.golemcore.autotest.port.outbound.LlmPort;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;
import me.golemcore.autotest.port.outbound.ToolBackendPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns a run end to end: acquire a backend connection, drive it (agent loop,
 * step executor or script), close the connection, capture the video and build
 * the result.
 *
 * <p>
 * Invalid requests throw {@link IllegalArgumentException}. Failures during a
 * run never throw; they are reported as {@code success = false} together with
 * everything logged up to that point. Methods block and are meant to run on a
 * worker scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutomationRunService {

    private final ToolBackendPort toolBackend;
    private final LlmPort llmPort;
    private final ToolLoopSystem toolLoopSystem;
    private final ScriptedStepExecutor stepExecutor;
    private final ScriptExecutor scriptExecutor;
    private final VideoFinalizationWatcher videoWatcher;
    private final ExecutionResultBuilder resultBuilder;
    private final PromptBuilder promptBuilder;
    private final AutomationProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ==================== AGENT LOOP ====================

    @SuppressWarnings("PMD.CloseResource")
    public ExecutionResult runAgent(RunRequest request) {
        int maxIterations = resolveMaxIterations(request.getMaxIterations());
        validateVideoPath(request.getVideoPath());

        Instant runStart = clock.instant();
        AgentRunContext context = AgentRunContext.builder()
                .request(request)
                .maxIterations(maxIterations)
                .totalSteps(stepTotalFromInput(request))
                .build();

        ToolLoopResult loopResult;
        try (ToolBackendConnection connection = toolBackend.acquire()) {
            context.setConnection(connection);
            context.setTools(connection.listTools());
            context.getMessages().add(Message.builder()
                    .role(Message.ROLE_SYSTEM)
                    .content(promptBuilder.buildSystemPrompt(request.isRecordVideo(), request.getVideoPath()))
                    .timestamp(runStart)
                    .build());
            context.getMessages().add(Message.builder()
                    .role(Message.ROLE_USER)
                    .content(promptBuilder.buildUserPrompt(request))
                    .timestamp(runStart)
                    .build());

            log.info("[AgentLoop] Run started on {} with {} tools, max {} iterations, {} steps",
                    connection.endpoint(), context.getTools().size(), maxIterations, context.getTotalSteps());
            loopResult = toolLoopSystem.run(context);
        } catch (RuntimeException e) {
            log.error("[AgentLoop] Run failed at iteration {}: {}", context.getIteration(),
                    ExecutionResultBuilder.describe(e));
            return resultBuilder.agentFailure(context, request.getVideoPath(), e);
        }

        VideoResolution video = request.isRecordVideo() ? finalizeVideo(runStart, request.getVideoPath())
                : VideoResolution.notSaved();
        return resultBuilder.fromAgentRun(loopResult, request.getVideoPath(), video);
    }

    // ==================== STEP EXECUTOR ====================

    public ExecutionResult runSteps(RunRequest request) {
        validateVideoPath(request.getVideoPath());
        List<TestStep> steps = StepParser.parse(stepsAsText(request));
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Missing steps");
        }
        boolean recording = request.isRecordVideo() || request.hasVideoPath();

        Instant runStart = clock.instant();
        StepExecutionReport report = StepExecutionReport.builder().totalSteps(steps.size()).build();
        try (ToolBackendConnection connection = toolBackend.acquire()) {
            log.info("[Steps] Executing {} steps on {}", steps.size(), connection.endpoint());
            stepExecutor.execute(connection, steps, recording, report);
        } catch (RuntimeException e) {
            log.error("[Steps] Run failed: {}", ExecutionResultBuilder.describe(e));
            report.getActionLog().add("Error: " + ExecutionResultBuilder.describe(e));
            return resultBuilder.stepFailure(report, e);
        }

        VideoResolution video = recording ? finalizeVideo(runStart, request.getVideoPath())
                : VideoResolution.notSaved();
        return resultBuilder.fromStepRun(report, video, request.getVideoPath());
    }

    // ==================== SCRIPT EXECUTOR ====================

    public ExecutionResult runScript(String script, boolean recordVideo, String videoPath) {
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("Missing script");
        }
        validateVideoPath(videoPath);

        Instant runStart = clock.instant();
        List<String> actionLog = new ArrayList<>();
        try (ToolBackendConnection connection = toolBackend.acquire()) {
            scriptExecutor.execute(connection, script, recordVideo, actionLog);
        } catch (RuntimeException e) {
            log.error("[Script] Run failed: {}", ExecutionResultBuilder.describe(e));
            actionLog.add("Error: " + ExecutionResultBuilder.describe(e));
            return resultBuilder.logFailure(actionLog, e);
        }

        VideoResolution video = recordVideo ? finalizeVideo(runStart, videoPath) : VideoResolution.notSaved();
        return resultBuilder.fromScriptRun(actionLog, video, videoPath);
    }

    // ==================== HEALTH ====================

    @SuppressWarnings("PMD.CloseResource")
    public BackendHealth health() {
        BackendHealth.BackendHealthBuilder health = BackendHealth.builder()
                .llmProvider(llmPort.getProviderId())
                .llmModel(llmPort.getCurrentModel())
                .llmUrl(properties.getLlm().getBaseUrl())
                .llmReachable(llmPort.isAvailable() && llmPort.isReachable())
                .toolBackendPool(toolBackend.endpoints());

        try (ToolBackendConnection connection = toolBackend.acquire()) {
            List<String> names = ToolDefinition.names(connection.listTools());
            return health.toolBackendReachable(true)
                    .toolBackendEndpoint(connection.endpoint())
                    .toolNames(names)
                    .build();
        } catch (RuntimeException e) {
            log.warn("[API] Tool backend health check failed: {}", e.getMessage());
            return health.toolBackendReachable(false)
                    .toolNames(List.of())
                    .error(ExecutionResultBuilder.describe(e))
                    .build();
        }
    }

    // ==================== HELPERS ====================

    int resolveMaxIterations(Integer requested) {
        AutomationProperties.AgentProperties agent = properties.getAgent();
        if (requested == null) {
            return agent.getDefaultMaxIterations();
        }
        if (requested < 1 || requested > agent.getMaxIterationsLimit()) {
            throw new IllegalArgumentException(
                    "max_iterations must be between 1 and " + agent.getMaxIterationsLimit());
        }
        return requested;
    }

    static Integer stepTotalFromInput(RunRequest request) {
        if (request.hasStepsText()) {
            return StepParser.countSteps(request.getStepsText());
        }
        if (request.hasStepsList()) {
            return request.getStepsList().size();
        }
        return null;
    }

    private void validateVideoPath(String videoPath) {
        if (videoPath == null || videoPath.isBlank()) {
            return;
        }
        if (videoWatcher.targetPath(videoWatcher.videoRoot(), videoPath).isEmpty()) {
            throw new IllegalArgumentException("video_path must be a relative path inside the video directory");
        }
    }

    private VideoResolution finalizeVideo(Instant runStart, String videoPath) {
        if (videoPath == null || videoPath.isBlank()) {
            return VideoResolution.notSaved();
        }
        return videoWatcher.resolve(runStart, videoPath);
    }

    private String stepsAsText(RunRequest request) {
        if (request.hasStepsText()) {
            return request.getStepsText();
        }
        if (!request.hasStepsList()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (Object step : request.getStepsList()) {
            lines.add(step instanceof String text ? text : toJson(step));
        }
        return String.join("\n", lines);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
