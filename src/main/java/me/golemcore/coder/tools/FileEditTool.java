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
 * Replaces one exact occurrence of a text fragment in a file. The fragment
 * must occur exactly once unless {@code replace_all} is set.
 */
@Component
@Slf4j
public class FileEditTool implements ToolComponent {

    public static final String NAME = "file_edit";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Edit a file by replacing old_str with new_str.
                        old_str must match the file exactly and be unique unless replace_all is true.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of("type", "string", "description", "File path"),
                                "old_str", Map.of("type", "string", "description", "Exact text to replace"),
                                "new_str", Map.of("type", "string", "description", "Replacement text"),
                                "replace_all", Map.of("type", "boolean",
                                        "description", "Replace every occurrence (default: false)")),
                        "required", List.of("path", "old_str", "new_str")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathArg = parameters.get("path");
            Object oldArg = parameters.get("old_str");
            Object newArg = parameters.get("new_str");
            if (!(pathArg instanceof String pathStr) || pathStr.isBlank()) {
                return ToolResult.failure("Missing required parameter: path");
            }
            if (!(oldArg instanceof String oldStr) || oldStr.isEmpty() || !(newArg instanceof String newStr)) {
                return ToolResult.failure("Missing required parameters: old_str and new_str");
            }
            boolean replaceAll = Boolean.TRUE.equals(parameters.get("replace_all"));

            Path path = WorkspaceFileSupport.resolveSafePath(context.workingDirectory(), pathStr);
            if (path == null) {
                log.warn("[Files] Edit outside working directory blocked: {}", pathStr);
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within working directory");
            }
            String relative = WorkspaceFileSupport.relativePath(context.workingDirectory(), path);
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("File not found: " + relative);
            }
            try {
                String content = Files.readString(path, StandardCharsets.UTF_8);
                int occurrences = countOccurrences(content, oldStr);
                if (occurrences == 0) {
                    String preview = oldStr.length() > 50 ? oldStr.substring(0, 50) + "..." : oldStr;
                    return ToolResult.failure("Could not find text to replace: \"" + preview + "\"");
                }
                if (occurrences > 1 && !replaceAll) {
                    return ToolResult.failure("Text to replace occurs " + occurrences
                            + " times; add context or set replace_all");
                }
                String updated = replaceAll ? content.replace(oldStr, newStr) : replaceFirst(content, oldStr, newStr);
                Files.writeString(path, updated, StandardCharsets.UTF_8);
                return ToolResult.success("Edited " + relative + " (" + (replaceAll ? occurrences : 1)
                        + " replacement(s))");
            } catch (IOException e) {
                return ToolResult.failure("Failed to edit file: " + e.getMessage());
            }
        });
    }

    private static int countOccurrences(String content, String fragment) {
        int count = 0;
        int index = content.indexOf(fragment);
        while (index >= 0) {
            count++;
            index = content.indexOf(fragment, index + fragment.length());
        }
        return count;
    }

    private static String replaceFirst(String content, String oldStr, String newStr) {
        int index = content.indexOf(oldStr);
        return content.substring(0, index) + newStr + content.substring(index + oldStr.length());
    }
}
