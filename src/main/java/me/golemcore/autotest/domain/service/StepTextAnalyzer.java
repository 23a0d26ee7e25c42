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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text heuristics for deterministic step execution: URL extraction, target
 * phrase extraction and step classification.
 */
@Component
@Slf4j
public class StepTextAnalyzer {

    private static final Pattern URL = Pattern.compile("https?://[^\\s)\\]}]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"|'([^']+)'");
    private static final Pattern LABELLED = Pattern.compile(
            "\\b(?:text|named|titled|label(?:led)?|called)\\b\\s*[:=]?\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLICK = Pattern.compile("(click|press|tap|open|select|tick|check)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OBSERVE = Pattern.compile("(observe|verify|assert|expect)",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "0.0.0.0");
    private static final int TRAILING_WORDS = 4;

    /**
     * Kind of action a step maps to. Checked in declaration order.
     */
    public enum StepKind {
        NAVIGATE, WAIT, CLICK, OBSERVE, OTHER
    }

    private final AutomationProperties.BrowserProperties browser;

    public StepTextAnalyzer(AutomationProperties properties) {
        this.browser = properties.getBrowser();
    }

    public StepKind classify(String stepText) {
        String text = stepText != null ? stepText : "";
        if (extractUrl(text) != null) {
            return StepKind.NAVIGATE;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("wait")) {
            return StepKind.WAIT;
        }
        if (CLICK.matcher(lower).find()) {
            return StepKind.CLICK;
        }
        if (OBSERVE.matcher(lower).find()) {
            return StepKind.OBSERVE;
        }
        return StepKind.OTHER;
    }

    /**
     * First http(s) URL in the text, cut at a literal backslash; null if none.
     */
    public String extractUrl(String stepText) {
        if (stepText == null) {
            return null;
        }
        Matcher matcher = URL.matcher(stepText);
        if (!matcher.find()) {
            return null;
        }
        String raw = matcher.group();
        int cut = raw.indexOf('\\');
        return (cut >= 0 ? raw.substring(0, cut) : raw).trim();
    }

    /**
     * Phrase naming the element a step refers to: quoted text first, then the
     * text after a labelling keyword, else the last four words.
     */
    public String extractTarget(String stepText) {
        String text = stepText != null ? stepText : "";
        Matcher quoted = QUOTED.matcher(text);
        if (quoted.find()) {
            String value = quoted.group(1) != null ? quoted.group(1) : quoted.group(2);
            return value.trim();
        }
        Matcher labelled = LABELLED.matcher(text);
        if (labelled.find()) {
            return labelled.group(1).trim();
        }
        String[] words = text.trim().split("\\s+");
        int from = Math.max(0, words.length - TRAILING_WORDS);
        return String.join(" ", Arrays.copyOfRange(words, from, words.length)).trim();
    }

    /**
     * Points loopback URLs at the application host seen from the browser
     * container. Unparseable URLs are returned unchanged.
     */
    public String rewriteLocalhost(String url) {
        String host = browser.getLocalhostRewriteHost();
        if (url == null || host == null || host.isBlank()) {
            return url;
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null || !LOCAL_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT))) {
                return url;
            }
            StringBuilder rewritten = new StringBuilder(uri.getScheme()).append("://");
            if (uri.getRawUserInfo() != null) {
                rewritten.append(uri.getRawUserInfo()).append('@');
            }
            rewritten.append(host).append(':').append(browser.getLocalhostRewritePort());
            rewritten.append(uri.getRawPath() != null ? uri.getRawPath() : "");
            if (uri.getRawQuery() != null) {
                rewritten.append('?').append(uri.getRawQuery());
            }
            if (uri.getRawFragment() != null) {
                rewritten.append('#').append(uri.getRawFragment());
            }
            return rewritten.toString();
        } catch (URISyntaxException e) {
            log.debug("[Steps] Keeping unparseable URL {}: {}", url, e.getMessage());
            return url;
        }
    }
}
