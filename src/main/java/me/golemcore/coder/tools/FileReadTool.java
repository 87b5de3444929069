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
 * Reads a text file from the working directory, optionally a line range.
 */
@Component
@Slf4j
public class FileReadTool implements ToolComponent {

    public static final String NAME = "file_read";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Read a text file. Paths are relative to the working directory.
                        Optionally pass startLine/endLine (1-based, inclusive) to read a range.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "File path"),
                                "startLine", Map.of("type", "integer", "description", "First line to read"),
                                "endLine", Map.of("type", "integer", "description", "Last line to read")),
                        "required", List.of("path")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathArg = parameters.get("path");
            if (!(pathArg instanceof String pathStr) || pathStr.isBlank()) {
                return ToolResult.failure("Missing required parameter: path");
            }
            Path path = WorkspaceFileSupport.resolveSafePath(context.workingDirectory(), pathStr);
            if (path == null) {
                log.warn("[Files] Read outside working directory blocked: {}", pathStr);
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within working directory");
            }
            String relative = WorkspaceFileSupport.relativePath(context.workingDirectory(), path);
            if (!Files.exists(path)) {
                return ToolResult.failure("File not found: " + relative);
            }
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("Not a file: " + relative);
            }
            try {
                long size = Files.size(path);
                if (size > WorkspaceFileSupport.MAX_FILE_SIZE) {
                    return ToolResult.failure("File too large (max 10 MB)");
                }
                String content = Files.readString(path, StandardCharsets.UTF_8);
                String output = sliceLines(content, parameters.get("startLine"), parameters.get("endLine"));
                return ToolResult.success(output);
            } catch (IOException e) {
                return ToolResult.failure("Failed to read file: " + e.getMessage());
            }
        });
    }

    private static String sliceLines(String content, Object start, Object end) {
        if (!(start instanceof Number) && !(end instanceof Number)) {
            return content;
        }
        List<String> lines = content.lines().toList();
        int from = start instanceof Number number ? Math.max(1, number.intValue()) : 1;
        int to = end instanceof Number number ? Math.min(lines.size(), number.intValue()) : lines.size();
        if (from > to) {
            return "";
        }
        return String.join("\n", lines.subList(from - 1, to));
    }
}
