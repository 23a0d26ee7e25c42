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

import java.util.Optional;

/**
 * Resolves a human-readable target phrase to an element reference inside a
 * page snapshot.
 */
public interface ElementMatcher {

    Optional<ElementMatch> find(String snapshot, String target);

    /**
     * @param ref
     *            element reference understood by the click tool
     * @param line
     *            snapshot line the reference was taken from
     */
    record ElementMatch(String ref, String line) {
    }
}
