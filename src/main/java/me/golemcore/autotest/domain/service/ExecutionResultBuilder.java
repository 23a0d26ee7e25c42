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
import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.ExecutionResult;
import me.golemcore.autotest.domain.model.StepCoverage;
import me.golemcore.autotest.domain.model.StepExecutionReport;
import me.golemcore.autotest.domain.model.ToolInvocation;
import me.golemcore.autotest.domain.model.VideoResolution;
import me.golemcore.autotest.domain.system.toolloop.ToolLoopResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Assembles the {@link ExecutionResult} of a run. Pure aggregation, no side
 * effects.
 */
@Component
public class ExecutionResultBuilder {

    private final ObjectMapper objectMapper;

    public ExecutionResultBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Result of a finished loop. Iterations, end state and final message come
     * from the loop outcome; everything else from its context.
     */
    public ExecutionResult fromAgentRun(ToolLoopResult loopResult, String videoFilename, VideoResolution video) {
        AgentRunContext context = loopResult.context();
        Integer completed = context.getCompletedSteps();
        Integer total = context.getTotalSteps();
        return ExecutionResult.builder()
                .success(true)
                .message(loopResult.finalMessage())
                .iterations(loopResult.iterations())
                .state(loopResult.state())
                .actionsTaken(actionsTaken(context.getToolInvocations()))
                .toolCallsExecuted(List.copyOf(context.getToolInvocations()))
                .transcript(List.copyOf(context.getTranscript()))
                .completedSteps(completed)
                .totalSteps(total)
                .stepCoverage(StepCoverage.of(completed, total))
                .videoSaved(video.saved())
                .videoPath(video.saved() ? video.path().toString() : null)
                .videoFilename(videoFilename)
                .build();
    }

    public ExecutionResult agentFailure(AgentRunContext context, String videoFilename, Throwable error) {
        Integer completed = context.getCompletedSteps();
        Integer total = context.getTotalSteps();
        return ExecutionResult.builder()
                .success(false)
                .error(describe(error))
                .iterations(context.getIteration())
                .state(context.getState())
                .actionsTaken(actionsTaken(context.getToolInvocations()))
                .toolCallsExecuted(List.copyOf(context.getToolInvocations()))
                .transcript(List.copyOf(context.getTranscript()))
                .completedSteps(completed)
                .totalSteps(total)
                .stepCoverage(StepCoverage.of(completed, total))
                .videoSaved(false)
                .videoFilename(videoFilename)
                .build();
    }

    public ExecutionResult fromStepRun(StepExecutionReport report, VideoResolution video, String videoFilename) {
        return ExecutionResult.builder()
                .success(true)
                .message(report.isHalted() ? "Execution stopped at an unresolved element" : "Execution completed")
                .actionsTaken(String.join("\n", report.getActionLog()))
                .completedSteps(report.getCompletedSteps())
                .totalSteps(report.getTotalSteps())
                .stepCoverage(StepCoverage.of(report.getCompletedSteps(), report.getTotalSteps()))
                .videoSaved(video.saved())
                .videoPath(video.saved() ? video.path().toString() : null)
                .videoFilename(videoFilename)
                .build();
    }

    public ExecutionResult fromScriptRun(List<String> actionLog, VideoResolution video, String videoFilename) {
        return ExecutionResult.builder()
                .success(true)
                .message("Execution completed")
                .actionsTaken(String.join("\n", actionLog))
                .videoSaved(video.saved())
                .videoPath(video.saved() ? video.path().toString() : null)
                .videoFilename(video.saved() ? videoFilename : null)
                .build();
    }

    /**
     * Failure of a step run; keeps the log and the steps completed before the
     * failure.
     */
    public ExecutionResult stepFailure(StepExecutionReport report, Throwable error) {
        return ExecutionResult.builder()
                .success(false)
                .error(describe(error))
                .actionsTaken(String.join("\n", report.getActionLog()))
                .completedSteps(report.getCompletedSteps())
                .totalSteps(report.getTotalSteps())
                .stepCoverage(StepCoverage.of(report.getCompletedSteps(), report.getTotalSteps()))
                .videoSaved(false)
                .build();
    }

    /**
     * Failure of a script run; the log keeps everything done before the failure.
     */
    public ExecutionResult logFailure(List<String> actionLog, Throwable error) {
        return ExecutionResult.builder()
                .success(false)
                .error(describe(error))
                .actionsTaken(String.join("\n", actionLog))
                .videoSaved(false)
                .build();
    }

    /**
     * One line per executed tool call: {@code iteration N: name {json args}}.
     */
    public String actionsTaken(List<ToolInvocation> invocations) {
        if (invocations == null || invocations.isEmpty()) {
            return "";
        }
        return invocations.stream()
                .map(call -> "iteration " + call.iteration() + ": " + call.name() + " " + toJson(call.arguments()))
                .collect(Collectors.joining("\n"));
    }

    public static String describe(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null
                && (current instanceof CompletionException
                        || current instanceof ExecutionException)) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }

    private String toJson(Map<String, Object> args) {
        try {
            return objectMapper.writeValueAsString(args != null ? args : Map.of());
        } catch (JsonProcessingException e) {
            return String.valueOf(args);
        }
    }
}
