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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes (creates or overwrites) a text file, creating parent directories.
 */
@Component
@Slf4j
public class FileWriteTool implements ToolComponent {

    public static final String NAME = "file_write";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Write content to a file, replacing it if it exists.
                        Paths are relative to the working directory; parent directories are created.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "File path"),
                                "content", Map.of("type", "string", "description", "Full file content")),
                        "required", List.of("path", "content")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathArg = parameters.get("path");
            Object contentArg = parameters.get("content");
            if (!(pathArg instanceof String pathStr) || pathStr.isBlank()) {
                return ToolResult.failure("Missing required parameter: path");
            }
            if (!(contentArg instanceof String content)) {
                return ToolResult.failure("Missing required parameter: content");
            }
            Path path = WorkspaceFileSupport.resolveSafePath(context.workingDirectory(), pathStr);
            if (path == null) {
                log.warn("[Files] Write outside working directory blocked: {}", pathStr);
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within working directory");
            }
            String relative = WorkspaceFileSupport.relativePath(context.workingDirectory(), path);
            try {
                Path parent = path.getParent();
                if (parent != null && !Files.exists(parent)) {
                    Files.createDirectories(parent);
                }
                boolean existed = Files.exists(path);
                Files.writeString(path, content, StandardCharsets.UTF_8);
                log.debug("[Files] Wrote {} ({} chars)", relative, content.length());
                return ToolResult.success((existed ? "Overwrote file: " : "Created file: ") + relative);
            } catch (IOException e) {
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}
