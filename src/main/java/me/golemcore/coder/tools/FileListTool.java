package me.golemcore.coder.tools;

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
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists the entries of a directory, directories first.
 */
@Component
@Slf4j
public class FileListTool implements ToolComponent {

    public static final String NAME = "file_list";

    private static final int MAX_FILES_LIST = 200;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List files and directories. Path defaults to the working directory.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "Directory path (default: .)")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathArg = parameters.get("path");
            String pathStr = pathArg instanceof String str && !str.isBlank() ? str : ".";
            Path path = WorkspaceFileSupport.resolveSafePath(context.workingDirectory(), pathStr);
            if (path == null) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within working directory");
            }
            String relative = WorkspaceFileSupport.relativePath(context.workingDirectory(), path);
            if (!Files.isDirectory(path)) {
                return ToolResult.failure("Directory not found: " + relative);
            }
            try (Stream<Path> stream = Files.list(path)) {
                List<Path> entries = stream
                        .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                                .thenComparing(p -> p.getFileName().toString()))
                        .limit(MAX_FILES_LIST)
                        .toList();
                StringBuilder sb = new StringBuilder();
                sb.append("Directory: ").append(relative).append('\n');
                sb.append("Entries: ").append(entries.size()).append("\n\n");
                for (Path entry : entries) {
                    String name = entry.getFileName().toString();
                    if (Files.isDirectory(entry)) {
                        sb.append("[DIR]  ").append(name).append("/\n");
                    } else {
                        sb.append("[FILE] ").append(name).append(" (")
                                .append(WorkspaceFileSupport.formatSize(sizeOf(entry))).append(")\n");
                    }
                }
                return ToolResult.success(sb.toString());
            } catch (IOException e) {
                return ToolResult.failure("Failed to list directory: " + e.getMessage());
            }
        });
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("[Files] Cannot stat {}: {}", file, e.getMessage());
            return 0;
        }
    }
}
