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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Progress marker parsed from a final assistant reply, e.g.
 * {@code DONE (completed_steps=3 total_steps=3)}. Either counter may be
 * missing.
 *
 * @param done
 *            whether the reply starts with the {@code DONE} token
 * @param completedSteps
 *            reported completed steps, or null
 * @param totalSteps
 *            reported total steps, or null
 */
public record StepCompletionMarker(boolean done, Integer completedSteps, Integer totalSteps) {

    private static final Pattern COMPLETED = Pattern.compile("completed_steps\\s*[:=]\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL = Pattern.compile("total_steps\\s*[:=]\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DONE = Pattern.compile("^\\s*DONE\\b", Pattern.CASE_INSENSITIVE);

    public static StepCompletionMarker parse(String text) {
        if (text == null || text.isEmpty()) {
            return new StepCompletionMarker(false, null, null);
        }
        return new StepCompletionMarker(DONE.matcher(text).find(), readInt(COMPLETED, text), readInt(TOTAL, text));
    }

    public boolean hasCompletedSteps() {
        return completedSteps != null;
    }

    private static Integer readInt(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
