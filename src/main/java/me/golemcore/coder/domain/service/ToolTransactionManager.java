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
import me.golemcore.coder.domain.model.FileSnapshot;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RollbackResult;
import me.golemcore.coder.domain.model.ToolExecutionTransaction;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshots the files a tool batch may touch and restores them when the batch
 * fails verification.
 */
@Component
@Slf4j
public class ToolTransactionManager {

    private static final List<String> PATH_ARGUMENTS = List.of("path", "file_path", "target_path", "destination");
    private static final List<String> SCRIPT_EXTENSIONS = List.of(".py", ".sh", ".bash");

    private final Clock clock;

    public ToolTransactionManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Captures the current content of every unique file path referenced by the
     * calls. Files that cannot be read are left out of the transaction.
     */
    public ToolExecutionTransaction begin(List<Message.ToolCall> toolCalls, Path workspaceRoot) {
        List<FileSnapshot> snapshots = new ArrayList<>();
        for (Path path : referencedPaths(toolCalls, workspaceRoot)) {
            if (Files.isDirectory(path)) {
                continue;
            }
            if (!Files.exists(path)) {
                snapshots.add(new FileSnapshot(path.toString(), false, null));
                continue;
            }
            try {
                snapshots.add(new FileSnapshot(path.toString(), true, Files.readAllBytes(path)));
            } catch (IOException e) {
                log.warn("[Rollback] Cannot snapshot {}, it will not be restored: {}", path, e.getMessage());
            }
        }
        ToolExecutionTransaction transaction = new ToolExecutionTransaction(
                "tx-" + UUID.randomUUID(), clock.instant(), List.copyOf(snapshots));
        log.debug("[Rollback] Transaction {} covers {} file(s)", transaction.id(), snapshots.size());
        return transaction;
    }

    /**
     * Drops script files so a rollback leaves them in place.
     */
    public ToolExecutionTransaction withoutScripts(ToolExecutionTransaction transaction) {
        List<FileSnapshot> retained = transaction.files().stream()
                .filter(snapshot -> !isScript(snapshot.absolutePath()))
                .toList();
        if (retained.size() < transaction.files().size()) {
            log.info("[Rollback] Preserving {} script file(s) for next iteration",
                    transaction.files().size() - retained.size());
        }
        return transaction.withFiles(retained);
    }

    /**
     * Restores every snapshot. A failure on one file is recorded and the rest
     * are still processed.
     */
    public RollbackResult rollback(ToolExecutionTransaction transaction) {
        int restored = 0;
        int deleted = 0;
        List<String> errors = new ArrayList<>();
        for (FileSnapshot snapshot : transaction.files()) {
            Path path = Paths.get(snapshot.absolutePath());
            try {
                if (snapshot.existed()) {
                    if (path.getParent() != null) {
                        Files.createDirectories(path.getParent());
                    }
                    Files.write(path, snapshot.content());
                    restored++;
                } else if (Files.deleteIfExists(path)) {
                    deleted++;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("[Rollback] Failed to restore {}: {}", path, e.getMessage());
                errors.add(path + ": " + e.getMessage());
            }
        }
        log.info("[Rollback] Transaction {}: restored={}, deleted={}, errors={}",
                transaction.id(), restored, deleted, errors.size());
        return new RollbackResult(restored, deleted, List.copyOf(errors));
    }

    public static boolean isScript(String path) {
        return path != null && SCRIPT_EXTENSIONS.stream().anyMatch(path::endsWith);
    }

    private static Set<Path> referencedPaths(List<Message.ToolCall> toolCalls, Path workspaceRoot) {
        Set<Path> paths = new LinkedHashSet<>();
        if (toolCalls == null) {
            return paths;
        }
        for (Message.ToolCall call : toolCalls) {
            for (String argument : PATH_ARGUMENTS) {
                String value = call.getStringArgument(argument);
                if (value != null && !value.isBlank()) {
                    paths.add(resolve(value.trim(), workspaceRoot));
                }
            }
        }
        return paths;
    }

    private static Path resolve(String value, Path workspaceRoot) {
        Path path = Paths.get(value.replace('\\', '/'));
        if (path.isAbsolute() || workspaceRoot == null) {
            return path.toAbsolutePath().normalize();
        }
        return workspaceRoot.resolve(path).toAbsolutePath().normalize();
    }
}
