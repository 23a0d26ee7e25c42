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

/**
 * Ratio of completed to requested steps.
 */
public record StepCoverage(int completedSteps, int totalSteps, double ratio) {

    /**
     * Returns null when coverage cannot be derived.
     */
    public static StepCoverage of(Integer completedSteps, Integer totalSteps) {
        if (completedSteps == null || totalSteps == null || totalSteps <= 0) {
            return null;
        }
        return new StepCoverage(completedSteps, totalSteps, (double) completedSteps / totalSteps);
    }
}
