package me.golemcore.autotest.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.autotest.domain.model.ExecutionResult;
import me.golemcore.autotest.domain.model.Message;
import me.golemcore.autotest.domain.model.StepCoverage;
import me.golemcore.autotest.domain.model.ToolInvocation;
import me.golemcore.autotest.domain.model.TranscriptEntry;

import java.util.List;

/**
 * Result of any run endpoint. Agent-only fields are absent for step and script
 * runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResponse {

    private boolean success;

    @JsonProperty("final_answer")
    private String finalAnswer;

    private String error;
    private Integer iterations;
    private String state;

    @JsonProperty("actions_taken")
    private String actionsTaken;

    @JsonProperty("tool_calls_executed")
    private List<ToolInvocation> toolCallsExecuted;

    private List<TranscriptItem> transcript;

    @JsonProperty("completed_steps")
    private Integer completedSteps;

    @JsonProperty("total_steps")
    private Integer totalSteps;

    @JsonProperty("step_coverage")
    private Coverage stepCoverage;

    @JsonProperty("video_saved")
    private Boolean videoSaved;

    @JsonProperty("video_path")
    private String videoPath;

    @JsonProperty("video_filename")
    private String videoFilename;

    public static RunResponse from(ExecutionResult result) {
        return RunResponse.builder()
                .success(result.isSuccess())
                .finalAnswer(result.getMessage())
                .error(result.getError())
                .iterations(result.getIterations())
                .state(result.getState() != null ? result.getState().name() : null)
                .actionsTaken(result.getActionsTaken())
                .toolCallsExecuted(result.getToolCallsExecuted())
                .transcript(result.getTranscript() != null
                        ? result.getTranscript().stream().map(TranscriptItem::from).toList()
                        : null)
                .completedSteps(result.getCompletedSteps())
                .totalSteps(result.getTotalSteps())
                .stepCoverage(Coverage.from(result.getStepCoverage()))
                .videoSaved(result.isVideoSaved())
                .videoPath(result.getVideoPath())
                .videoFilename(result.getVideoFilename())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TranscriptItem {
        private int iteration;
        private String role;
        private String name;
        private String content;

        @JsonProperty("tool_calls")
        private List<Message.ToolCall> toolCalls;

        @JsonProperty("dropped_tool_calls")
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        private int droppedToolCalls;

        static TranscriptItem from(TranscriptEntry entry) {
            return TranscriptItem.builder()
                    .iteration(entry.getIteration())
                    .role(entry.getRole())
                    .name(entry.getName())
                    .content(entry.getContent())
                    .toolCalls(entry.getToolCalls())
                    .droppedToolCalls(entry.getDroppedToolCalls())
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Coverage {
        @JsonProperty("completed_steps")
        private int completedSteps;

        @JsonProperty("total_steps")
        private int totalSteps;

        private double ratio;

        static Coverage from(StepCoverage coverage) {
            if (coverage == null) {
                return null;
            }
            return new Coverage(coverage.completedSteps(), coverage.totalSteps(), coverage.ratio());
        }
    }
}
