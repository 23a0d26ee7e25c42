package me.golemcore.autotest.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteScriptRequest {

    private String script;

    @JsonProperty("record_video")
    private boolean recordVideo;

    @JsonProperty("video_path")
    private String videoPath;
}
