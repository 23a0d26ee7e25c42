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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a deterministic step run. A halted run stopped at an element it
 * could not resolve; {@code completedSteps} counts the steps attempted
 * successfully before that point.
 */
@Data
@Builder
public class StepExecutionReport {

    @Builder.Default
    private List<String> actionLog = new ArrayList<>();
    private int completedSteps;
    private int totalSteps;
    private boolean halted;
}
