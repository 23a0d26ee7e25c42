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
import me.golemcore.autotest.domain.model.VideoCandidate;
import me.golemcore.autotest.domain.model.VideoResolution;
import me.golemcore.autotest.infrastructure.config.AutomationProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Captures the video the tool backend records for a run.
 *
 * <p>
 * The backend gives no signal when a recording is complete, so detection is
 * purely observational:
 * <ol>
 * <li>Discovery: video files under the video root and its nested directory
 * (recursing {@code maxDepth} levels) modified at or after run start minus the
 * clock-skew tolerance; the newest one is the candidate
 * <li>Stability, tier (a), polled until the deadline: at least
 * {@code minBytes} and unchanged across {@code stableWaitMs}
 * <li>Stability, tier (b), once after the deadline: non-empty and unchanged
 * across {@code stableWaitMs}, so short recordings are not lost
 * <li>Promotion: atomic rename to the requested filename under the video root
 * </ol>
 *
 * <p>
 * Concurrent recording runs share the directory; "newest after my start" is a
 * best-effort attribution only.
 *
 * <p>
 * Configuration via {@code automation.video.*}.
 */
@Service
@Slf4j
public class VideoFinalizationWatcher {

    private final AutomationProperties.VideoProperties config;
    private final Clock clock;
    private final Sleeper sleeper;

    public VideoFinalizationWatcher(AutomationProperties properties, Clock clock, Sleeper sleeper) {
        this.config = properties.getVideo();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public VideoResolution resolve(Instant runStart, String desiredFilename) {
        return resolve(runStart, desiredFilename, Duration.ofMillis(config.getFindTimeoutMs()));
    }

    /**
     * Finds, validates and renames the recording of a run. Never throws for a
     * missing or unstable file; reports {@code saved = false} instead.
     */
    public VideoResolution resolve(Instant runStart, String desiredFilename, Duration timeout) {
        Path root = videoRoot();
        Optional<Path> target = targetPath(root, desiredFilename);
        if (target.isEmpty()) {
            log.warn("[Video] Refusing target outside {}: {}", root, desiredFilename);
            return VideoResolution.notSaved();
        }

        long notBefore = runStart.toEpochMilli() - config.getClockSkewMs();
        long deadline = clock.millis() + timeout.toMillis();
        try {
            while (clock.millis() < deadline) {
                Optional<VideoCandidate> newest = findNewest(root, notBefore, target.get());
                if (newest.isPresent() && isStable(newest.get().path(), config.getMinBytes())) {
                    return promote(newest.get(), target.get());
                }
                sleeper.sleep(config.getPollIntervalMs());
            }

            Optional<VideoCandidate> fallback = findNewest(root, notBefore, target.get());
            if (fallback.isPresent() && isStable(fallback.get().path(), 1)) {
                log.info("[Video] Accepting small recording {} ({} bytes)", fallback.get().path(),
                        fallback.get().size());
                return promote(fallback.get(), target.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Video] Interrupted while waiting for {}", desiredFilename);
            return VideoResolution.notSaved();
        }

        log.warn("[Video] No stable recording found within {}ms for {}", timeout.toMillis(), desiredFilename);
        return VideoResolution.notSaved();
    }

    /**
     * Resolves the requested filename under the video root, rejecting paths that
     * escape it.
     */
    public Optional<Path> targetPath(Path root, String desiredFilename) {
        if (desiredFilename == null || desiredFilename.isBlank()) {
            return Optional.empty();
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path target = normalizedRoot.resolve(desiredFilename).normalize();
        if (!target.startsWith(normalizedRoot) || target.equals(normalizedRoot)) {
            return Optional.empty();
        }
        return Optional.of(target);
    }

    public Path videoRoot() {
        return Paths.get(config.getDirectory()).toAbsolutePath().normalize();
    }

    Optional<VideoCandidate> findNewest(Path root, long notBefore, Path exclude) {
        return listCandidates(root).stream()
                .filter(candidate -> candidate.modifiedMillis() >= notBefore)
                .filter(candidate -> !candidate.path().equals(exclude))
                .max(Comparator.comparingLong(VideoCandidate::modifiedMillis));
    }

    List<VideoCandidate> listCandidates(Path root) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path dir : List.of(root, root.resolve(config.getNestedDirectory()))) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> found = Files.find(dir, config.getMaxDepth() + 1,
                    (path, attrs) -> attrs.isRegularFile() && hasVideoExtension(path))) {
                found.map(path -> path.toAbsolutePath().normalize()).forEach(files::add);
            } catch (IOException | UncheckedIOException e) {
                log.debug("[Video] Scan of {} incomplete: {}", dir, e.getMessage());
            }
        }
        return files.stream()
                .map(this::describe)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Size check, settle delay, size check again.
     */
    boolean isStable(Path file, long minBytes) throws InterruptedException {
        long before = sizeOf(file);
        if (before < Math.max(1, minBytes)) {
            return false;
        }
        sleeper.sleep(config.getStableWaitMs());
        long after = sizeOf(file);
        return after == before;
    }

    VideoResolution promote(VideoCandidate candidate, Path target) {
        try {
            Files.createDirectories(target.getParent());
            Files.deleteIfExists(target);
            try {
                Files.move(candidate.path(), target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(candidate.path(), target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("[Video] Saved {} -> {}", candidate.path(), target);
            return VideoResolution.saved(target);
        } catch (IOException e) {
            log.warn("[Video] Failed to move {} to {}: {}", candidate.path(), target, e.getMessage());
            return VideoResolution.notSaved();
        }
    }

    private boolean hasVideoExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return config.getExtensions().stream()
                .anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
    }

    private Optional<VideoCandidate> describe(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return Optional.of(new VideoCandidate(path, attrs.lastModifiedTime().toMillis(), attrs.size()));
        } catch (IOException e) {
            log.debug("[Video] Candidate vanished: {}", path);
            return Optional.empty();
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (NoSuchFileException e) {
            return -1;
        } catch (IOException e) {
            log.debug("[Video] Cannot stat {}: {}", file, e.getMessage());
            return -1;
        }
    }
}
