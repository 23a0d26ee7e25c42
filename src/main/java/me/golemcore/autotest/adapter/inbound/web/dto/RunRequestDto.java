package me.golemcore.autotest.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /run}. {@code steps} is either a text block or a JSON
 * array.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequestDto {

    private String prompt;

    @JsonProperty("test_description")
    private String testDescription;

    private Object steps;

    @JsonProperty("max_iterations")
    private Integer maxIterations;

    @JsonProperty("record_video")
    private boolean recordVideo;

    @JsonProperty("video_path")
    private String videoPath;
}
