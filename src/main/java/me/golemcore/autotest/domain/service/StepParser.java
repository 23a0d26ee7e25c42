package me.golemcore.autotest.domain.service;

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

import me.golemcore.autotest.domain.model.TestStep;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses newline-delimited test steps.
 *
 * <p>
 * Accepted line shapes: {@code 1. Open the page} and {@code - Click "Save"}
 * (or {@code *}). Lines of any other shape are ignored; when no line matches,
 * the whole text becomes a single step. Literal {@code \n} sequences sent by
 * some callers are treated as line breaks.
 */
public final class StepParser {

    private static final Pattern NUMBERED = Pattern.compile("^(\\d+)\\.\\s+(.*)$");
    private static final Pattern BULLETED = Pattern.compile("^[-*]\\s+(.*)$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private StepParser() {
    }

    public static List<TestStep> parse(String stepsText) {
        String text = normalize(stepsText);
        if (text.isBlank()) {
            return List.of();
        }

        List<TestStep> steps = new ArrayList<>();
        for (String rawLine : LINE_BREAK.split(text)) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher numbered = NUMBERED.matcher(line);
            if (numbered.matches()) {
                steps.add(new TestStep(parseNumber(numbered.group(1), steps.size() + 1), numbered.group(2)));
                continue;
            }
            Matcher bulleted = BULLETED.matcher(line);
            if (bulleted.matches()) {
                steps.add(new TestStep(steps.size() + 1, bulleted.group(1)));
            }
        }

        if (steps.isEmpty()) {
            return List.of(new TestStep(1, text.trim()));
        }
        return steps;
    }

    /**
     * Counts enumerated (numbered or bulleted) lines. Returns null when the text
     * has none, i.e. when no step count can be derived from it.
     */
    public static Integer countSteps(String stepsText) {
        String text = normalize(stepsText);
        int count = 0;
        for (String rawLine : LINE_BREAK.split(text)) {
            String line = rawLine.trim();
            if (NUMBERED.matcher(line).matches() || BULLETED.matcher(line).matches()) {
                count++;
            }
        }
        return count > 0 ? count : null;
    }

    static String normalize(String stepsText) {
        if (stepsText == null) {
            return "";
        }
        return stepsText.replace("\\r\\n", "\n").replace("\\n", "\n");
    }

    private static int parseNumber(String digits, int fallback) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
