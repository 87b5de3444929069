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
import me.golemcore.coder.domain.model.WorkspaceDelta;
import me.golemcore.coder.domain.model.WorkspaceFileInfo;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists workspace files with size and modification time so tool batches can be
 * diffed. Build output and VCS directories are skipped and the listing stops
 * at the configured file cap.
 */
@Component
@Slf4j
public class WorkspaceScanner {

    private final int maxFiles;
    private final Set<String> ignoredDirectories;

    public WorkspaceScanner(CoderProperties properties) {
        this.maxFiles = properties.getWorkspace().getMaxFiles();
        this.ignoredDirectories = Set.copyOf(properties.getWorkspace().getIgnoredDirectories());
    }

    /**
     * Returns relative path to file info. An unreadable workspace yields an
     * empty snapshot.
     */
    public Map<String, WorkspaceFileInfo> snapshot(Path root) {
        Map<String, WorkspaceFileInfo> files = new LinkedHashMap<>();
        if (root == null || !Files.isDirectory(root)) {
            return files;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && ignoredDirectories.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String relative = root.relativize(file).toString().replace('\\', '/');
                    files.put(relative, new WorkspaceFileInfo(attrs.size(), attrs.lastModifiedTime().toMillis()));
                    return files.size() >= maxFiles ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("[Workspace] Failed to list {}: {}", root, e.getMessage());
        }
        return files;
    }

    /**
     * A file is modified when it grew, shrank or has a newer modification time.
     */
    public WorkspaceDelta detectChanges(Map<String, WorkspaceFileInfo> before, Map<String, WorkspaceFileInfo> after) {
        List<String> added = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        after.forEach((path, info) -> {
            WorkspaceFileInfo previous = before.get(path);
            if (previous == null) {
                added.add(path);
            } else if (info.modifiedMillis() > previous.modifiedMillis() || info.size() != previous.size()) {
                modified.add(path);
            }
        });
        before.keySet().stream().filter(path -> !after.containsKey(path)).forEach(deleted::add);
        Collections.sort(added);
        Collections.sort(modified);
        Collections.sort(deleted);
        return new WorkspaceDelta(List.copyOf(added), List.copyOf(modified), List.copyOf(deleted));
    }
}
