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

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based matcher over the accessibility snapshot text.
 *
 * <p>
 * Only lines carrying a {@code ref} are eligible. The first line containing the
 * whole target (case-insensitive) wins; otherwise, for targets of two or more
 * words, the first line containing at least 75% of the words. Lines are
 * scanned top to bottom, so the same snapshot always yields the same match.
 */
@Component
public class SnapshotElementMatcher implements ElementMatcher {

    private static final double WORD_OVERLAP = 0.75;
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final List<Pattern> REF_PATTERNS = List.of(
            Pattern.compile("\\bref\\s*=\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bref\\s*=\\s*'([^']+)'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bref\\s*=\\s*([^\\s\\]]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[ref\\s*[:=]\\s*([^\\]]+)\\]", Pattern.CASE_INSENSITIVE));

    @Override
    public Optional<ElementMatch> find(String snapshot, String target) {
        if (snapshot == null || snapshot.isEmpty() || target == null || target.isBlank()) {
            return Optional.empty();
        }
        String[] lines = LINE_BREAK.split(snapshot);
        String targetLower = target.trim().toLowerCase(Locale.ROOT);

        for (String line : lines) {
            if (line.toLowerCase(Locale.ROOT).contains(targetLower)) {
                Optional<ElementMatch> match = withRef(line);
                if (match.isPresent()) {
                    return match;
                }
            }
        }

        List<String> words = Arrays.stream(targetLower.split("\\s+")).filter(w -> !w.isEmpty()).toList();
        if (words.size() < 2) {
            return Optional.empty();
        }
        long required = (long) Math.ceil(words.size() * WORD_OVERLAP);
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            long hits = words.stream().filter(lower::contains).count();
            if (hits >= required) {
                Optional<ElementMatch> match = withRef(line);
                if (match.isPresent()) {
                    return match;
                }
            }
        }
        return Optional.empty();
    }

    static String extractRef(String line) {
        if (line == null) {
            return null;
        }
        for (Pattern pattern : REF_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return matcher.group(1).trim();
            }
        }
        return null;
    }

    private static Optional<ElementMatch> withRef(String line) {
        String ref = extractRef(line);
        return ref != null ? Optional.of(new ElementMatch(ref, line)) : Optional.empty();
    }
}
