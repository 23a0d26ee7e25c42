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

import java.nio.file.Path;

/**
 * Result of video finalization.
 *
 * @param saved
 *            whether a recording was promoted to the requested filename
 * @param path
 *            final location of the recording, null when not saved
 */
public record VideoResolution(boolean saved, Path path) {

    public static VideoResolution notSaved() {
        return new VideoResolution(false, null);
    }

    public static VideoResolution saved(Path path) {
        return new VideoResolution(true, path);
    }
}
