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
import lombok.Value;

import java.util.List;

/**
 * A single automation run as requested by the caller. Steps arrive either as
 * newline-delimited text or as a structured list, never both. Immutable for the
 * duration of the run.
 */
@Value
@Builder
public class RunRequest {

    String prompt;
    String testDescription;
    String stepsText;
    List<Object> stepsList;
    Integer maxIterations;
    boolean recordVideo;
    String videoPath;

    public boolean hasStepsText() {
        return stepsText != null && !stepsText.isBlank();
    }

    public boolean hasStepsList() {
        return stepsList != null && !stepsList.isEmpty();
    }

    public boolean hasVideoPath() {
        return videoPath != null && !videoPath.isBlank();
    }
}
