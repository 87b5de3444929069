package me.golemcore.coder.domain.service;

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
import me.golemcore.coder.domain.model.FileChange;
import me.golemcore.coder.domain.model.FileChangeOperation;
import me.golemcore.coder.domain.model.RollbackPoint;
import me.golemcore.coder.domain.model.TrackedFileSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-session history of file modifications.
 *
 * <p>
 * Keeps bounded snapshot history per file and a bounded list of rollback
 * points, each holding the changes of one tool batch. Not thread-safe: a
 * session runs on a single logical thread.
 */
@Slf4j
public class FileTracker {

    private final Clock clock;
    private final int maxRollbackPoints;
    private final int maxSnapshotsPerFile;

    private final Map<String, Deque<TrackedFileSnapshot>> snapshots = new LinkedHashMap<>();
    private final Map<String, String> pendingBefore = new LinkedHashMap<>();
    private final List<FileChange> changes = new ArrayList<>();
    private final Deque<RollbackPoint> rollbackPoints = new ArrayDeque<>();

    public FileTracker(Clock clock, int maxRollbackPoints, int maxSnapshotsPerFile) {
        this.clock = clock;
        this.maxRollbackPoints = maxRollbackPoints;
        this.maxSnapshotsPerFile = maxSnapshotsPerFile;
    }

    public TrackedFileSnapshot createSnapshot(String filePath, String content) {
        TrackedFileSnapshot snapshot = TrackedFileSnapshot.builder()
                .filePath(filePath)
                .content(content)
                .hash(hash(content))
                .timestamp(clock.instant())
                .size(content.getBytes(StandardCharsets.UTF_8).length)
                .build();
        Deque<TrackedFileSnapshot> history = snapshots.computeIfAbsent(filePath, key -> new ArrayDeque<>());
        history.addLast(snapshot);
        while (history.size() > maxSnapshotsPerFile) {
            history.removeFirst();
        }
        return snapshot;
    }

    /**
     * Remembers the content of a file before a tool touches it. A missing file
     * is remembered as absent.
     */
    public void trackBeforeModify(String filePath) {
        String content = readOrNull(filePath);
        pendingBefore.put(filePath, content);
        if (content != null) {
            createSnapshot(filePath, content);
        }
    }

    /**
     * Records the change made since {@link #trackBeforeModify(String)}.
     * Returns empty when the file is unchanged or was never tracked.
     */
    public Optional<FileChange> trackAfterModify(String filePath) {
        if (!pendingBefore.containsKey(filePath)) {
            return Optional.empty();
        }
        String before = pendingBefore.remove(filePath);
        String after = readOrNull(filePath);
        if (before == null && after == null || before != null && before.equals(after)) {
            return Optional.empty();
        }
        FileChange change = recordChange(filePath, before, after);
        if (after != null) {
            createSnapshot(filePath, after);
        }
        return Optional.of(change);
    }

    public FileChange recordChange(String filePath, String before, String after) {
        FileChangeOperation operation;
        if (before == null) {
            operation = FileChangeOperation.CREATE;
        } else if (after == null) {
            operation = FileChangeOperation.DELETE;
        } else {
            operation = FileChangeOperation.MODIFY;
        }
        FileChange change = FileChange.builder()
                .filePath(filePath)
                .operation(operation)
                .before(before)
                .after(after)
                .diff(simpleDiff(before, after))
                .timestamp(clock.instant())
                .build();
        changes.add(change);
        return change;
    }

    /**
     * Groups the given changes into a rollback point. Only the most recent
     * points are kept.
     */
    public RollbackPoint createRollbackPoint(String description, List<FileChange> pointChanges) {
        RollbackPoint point = RollbackPoint.builder()
                .id("rp-" + UUID.randomUUID())
                .timestamp(clock.instant())
                .description(description)
                .changes(List.copyOf(pointChanges))
                .build();
        rollbackPoints.addLast(point);
        while (rollbackPoints.size() > maxRollbackPoints) {
            rollbackPoints.removeFirst();
        }
        return point;
    }

    /**
     * Reverts the changes of a rollback point in reverse order. Returns the list
     * of paths that could not be reverted.
     */
    public List<String> rollbackTo(String pointId) {
        RollbackPoint point = rollbackPoints.stream()
                .filter(candidate -> candidate.getId().equals(pointId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rollback point: " + pointId));

        List<String> failed = new ArrayList<>();
        List<FileChange> reversed = new ArrayList<>(point.getChanges());
        java.util.Collections.reverse(reversed);
        for (FileChange change : reversed) {
            Path path = Paths.get(change.getFilePath());
            try {
                if (change.getOperation() == FileChangeOperation.CREATE) {
                    Files.deleteIfExists(path);
                } else {
                    if (path.getParent() != null) {
                        Files.createDirectories(path.getParent());
                    }
                    Files.writeString(path, change.getBefore(), StandardCharsets.UTF_8);
                }
            } catch (IOException e) {
                log.warn("[FileTracker] Failed to revert {}: {}", path, e.getMessage());
                failed.add(change.getFilePath());
            }
        }
        log.info("[FileTracker] Rolled back point {} ({} change(s), {} failed)",
                pointId, point.getChanges().size(), failed.size());
        return failed;
    }

    public List<RollbackPoint> getRollbackPoints() {
        return List.copyOf(rollbackPoints);
    }

    public List<TrackedFileSnapshot> getFileHistory(String filePath) {
        Deque<TrackedFileSnapshot> history = snapshots.get(filePath);
        return history != null ? List.copyOf(history) : List.of();
    }

    public boolean wasRecentlyModified(String filePath, Duration window) {
        Instant threshold = clock.instant().minus(window);
        return changes.stream()
                .anyMatch(change -> change.getFilePath().equals(filePath) && change.getTimestamp().isAfter(threshold));
    }

    public String getChangesSummary() {
        if (changes.isEmpty()) {
            return "No file changes";
        }
        long created = changes.stream().filter(c -> c.getOperation() == FileChangeOperation.CREATE).count();
        long modified = changes.stream().filter(c -> c.getOperation() == FileChangeOperation.MODIFY).count();
        long deleted = changes.stream().filter(c -> c.getOperation() == FileChangeOperation.DELETE).count();
        StringBuilder summary = new StringBuilder()
                .append("Created: ").append(created)
                .append(", Modified: ").append(modified)
                .append(", Deleted: ").append(deleted);
        changes.stream()
                .map(FileChange::getFilePath)
                .distinct()
                .forEach(path -> summary.append("\n  - ").append(path));
        return summary.toString();
    }

    public List<FileChange> getChanges() {
        return List.copyOf(changes);
    }

    public void clear() {
        snapshots.clear();
        pendingBefore.clear();
        changes.clear();
        rollbackPoints.clear();
    }

    /**
     * Line-by-line diff: lines that differ at the same index are shown as a
     * removed/added pair.
     */
    static String simpleDiff(String before, String after) {
        String[] oldLines = before != null ? before.split("\n", -1) : new String[0];
        String[] newLines = after != null ? after.split("\n", -1) : new String[0];
        StringBuilder diff = new StringBuilder();
        int max = Math.max(oldLines.length, newLines.length);
        for (int i = 0; i < max; i++) {
            String oldLine = i < oldLines.length ? oldLines[i] : null;
            String newLine = i < newLines.length ? newLines[i] : null;
            if (oldLine != null && oldLine.equals(newLine)) {
                continue;
            }
            if (oldLine != null) {
                diff.append("- ").append(oldLine).append('\n');
            }
            if (newLine != null) {
                diff.append("+ ").append(newLine).append('\n');
            }
        }
        return diff.toString();
    }

    static String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String readOrNull(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[FileTracker] Cannot read {}: {}", filePath, e.getMessage());
            return null;
        }
    }
}
