package me.golemcore.autotest.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

    private String status;

    @JsonProperty("llm_provider")
    private String llmProvider;

    @JsonProperty("llm_url")
    private String llmUrl;

    @JsonProperty("llm_model")
    private String llmModel;

    @JsonProperty("llm_ok")
    private boolean llmOk;

    @JsonProperty("mcp_pool")
    private List<String> mcpPool;

    @JsonProperty("mcp_endpoint")
    private String mcpEndpoint;

    @JsonProperty("tools_count")
    private Integer toolsCount;

    @JsonProperty("has_browser_navigate")
    private Boolean hasBrowserNavigate;

    @JsonProperty("has_browser_click")
    private Boolean hasBrowserClick;

    @JsonProperty("has_browser_snapshot")
    private Boolean hasBrowserSnapshot;

    @JsonProperty("has_browser_run_code")
    private Boolean hasBrowserRunCode;

    private String error;
}
