package me.golemcore.autotest.domain.model;

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

import lombok.Builder;
import lombok.Data;
import me.golemcore.autotest.port.outbound.ToolBackendConnection;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one agent run, owned by a single thread for the duration of
 * the run.
 *
 * <p>
 * Holds the append-only conversation, the transcript and executed tool calls
 * returned to the caller, and the step counters maintained by the completion
 * check. On failure the partially filled context is still reported.
 */
@Data
@Builder
public class AgentRunContext {

    private RunRequest request;
    private ToolBackendConnection connection;
    private int maxIterations;

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<TranscriptEntry> transcript = new ArrayList<>();

    @Builder.Default
    private List<ToolInvocation> toolInvocations = new ArrayList<>();

    /**
     * Step total; never decreases once known.
     */
    private Integer totalSteps;
    private Integer completedSteps;
    private int markerReminders;

    private int iteration;

    @Builder.Default
    private AgentRunState state = AgentRunState.AWAITING_MODEL;

    private String finalMessage;

    public boolean isRecordVideo() {
        return request != null && request.isRecordVideo();
    }
}
