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

import java.util.List;

/**
 * Everything a caller learns about one run. Created once per run and returned,
 * never persisted.
 */
@Data
@Builder
public class ExecutionResult {

    private boolean success;
    private String message;
    private String error;
    private Integer iterations;
    private AgentRunState state;

    private String actionsTaken;
    private List<ToolInvocation> toolCallsExecuted;
    private List<TranscriptEntry> transcript;

    private Integer completedSteps;
    private Integer totalSteps;
    private StepCoverage stepCoverage;

    private boolean videoSaved;
    private String videoPath;
    private String videoFilename;
}
