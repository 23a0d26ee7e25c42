package me.golemcore.autotest.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.adapter.inbound.web.dto.ExecuteScriptRequest;
import me.golemcore.autotest.adapter.inbound.web.dto.ExecuteTestRequest;
import me.golemcore.autotest.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.autotest.adapter.inbound.web.dto.RunRequestDto;
import me.golemcore.autotest.adapter.inbound.web.dto.RunResponse;
import me.golemcore.autotest.domain.model.BackendHealth;
import me.golemcore.autotest.domain.model.RunRequest;
import me.golemcore.autotest.domain.service.AutomationRunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * HTTP entry points for agent runs, deterministic step runs, stored scripts
 * and the backend health check.
 *
 * <p>
 * Runs block for their whole duration, so each one is moved to the
 * bounded-elastic scheduler. A failed run is still HTTP 200 with
 * {@code success=false}; only invalid requests produce an error status.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AutomationController {

    private static final String STATUS_OK = "ok";
    private static final String STATUS_DEGRADED = "degraded";

    private final AutomationRunService runService;

    @PostMapping("/run")
    public Mono<ResponseEntity<RunResponse>> run(@RequestBody RunRequestDto body) {
        RunRequest.RunRequestBuilder request = RunRequest.builder()
                .prompt(body.getPrompt())
                .testDescription(body.getTestDescription())
                .maxIterations(body.getMaxIterations())
                .recordVideo(body.isRecordVideo())
                .videoPath(body.getVideoPath());
        applySteps(request, body.getSteps());

        log.info("[API] POST /run (record_video={}, video_path={})", body.isRecordVideo(), body.getVideoPath());
        RunRequest runRequest = request.build();
        return Mono.fromCallable(() -> runService.runAgent(runRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(RunResponse.from(result)));
    }

    @PostMapping("/execute-test")
    public Mono<ResponseEntity<RunResponse>> executeTest(@RequestBody ExecuteTestRequest body) {
        RunRequest.RunRequestBuilder request = RunRequest.builder()
                .testDescription(body.getTestDescription())
                .recordVideo(body.isRecordVideo())
                .videoPath(body.getVideoPath());
        applySteps(request, body.getSteps());

        log.info("[API] POST /execute-test (video_path={})", body.getVideoPath());
        RunRequest runRequest = request.build();
        return Mono.fromCallable(() -> runService.runSteps(runRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(RunResponse.from(result)));
    }

    @PostMapping("/execute")
    public Mono<ResponseEntity<RunResponse>> execute(@RequestBody ExecuteScriptRequest body) {
        log.info("[API] POST /execute (record_video={}, video_path={})", body.isRecordVideo(), body.getVideoPath());
        return Mono.fromCallable(() -> runService.runScript(body.getScript(), body.isRecordVideo(),
                body.getVideoPath()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(RunResponse.from(result)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(runService::health)
                .subscribeOn(Schedulers.boundedElastic())
                .map(AutomationController::toHealthResponse);
    }

    static ResponseEntity<HealthResponse> toHealthResponse(BackendHealth health) {
        HealthResponse.HealthResponseBuilder body = HealthResponse.builder()
                .llmProvider(health.getLlmProvider())
                .llmUrl(health.getLlmUrl())
                .llmModel(health.getLlmModel())
                .llmOk(health.isLlmReachable())
                .mcpPool(health.getToolBackendPool());

        if (!health.isToolBackendReachable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(body.status(STATUS_DEGRADED).error(health.getError()).build());
        }

        List<String> names = health.getToolNames();
        return ResponseEntity.ok(body.status(STATUS_OK)
                .mcpEndpoint(health.getToolBackendEndpoint())
                .toolsCount(names.size())
                .hasBrowserNavigate(health.hasTool("browser_navigate"))
                .hasBrowserClick(health.hasTool("browser_click"))
                .hasBrowserSnapshot(health.hasTool("browser_snapshot"))
                .hasBrowserRunCode(health.hasTool("browser_run_code"))
                .build());
    }

    @SuppressWarnings("unchecked")
    private static void applySteps(RunRequest.RunRequestBuilder request, Object steps) {
        if (steps instanceof String text) {
            request.stepsText(text);
        } else if (steps instanceof List<?> list) {
            request.stepsList((List<Object>) list);
        } else if (steps != null) {
            throw new IllegalArgumentException("steps must be a string or an array");
        }
    }
}
