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
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Searches file contents under a directory with a regular expression and
 * returns {@code path:line: text} matches.
 */
@Component
@Slf4j
public class GrepSearchTool implements ToolComponent {

    public static final String NAME = "grep_search";

    private static final int MAX_MATCHES = 200;
    private static final int MAX_LINE_LENGTH = 300;

    private final Set<String> ignoredDirectories;

    public GrepSearchTool(CoderProperties properties) {
        this.ignoredDirectories = Set.copyOf(properties.getWorkspace().getIgnoredDirectories());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Search file contents with a regular expression.
                        Returns up to 200 matches as path:line: text.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "pattern", Map.of("type", "string", "description", "Regular expression"),
                                "path", Map.of("type", "string", "description", "Directory to search (default: .)"),
                                "ignoreCase", Map.of("type", "boolean", "description", "Case-insensitive match")),
                        "required", List.of("pattern")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object patternArg = parameters.get("pattern");
            if (!(patternArg instanceof String patternStr) || patternStr.isEmpty()) {
                return ToolResult.failure("Missing required parameter: pattern");
            }
            Pattern pattern;
            try {
                pattern = Boolean.TRUE.equals(parameters.get("ignoreCase"))
                        ? Pattern.compile(patternStr, Pattern.CASE_INSENSITIVE)
                        : Pattern.compile(patternStr);
            } catch (PatternSyntaxException e) {
                return ToolResult.failure("Invalid pattern: " + e.getDescription());
            }
            Object pathArg = parameters.get("path");
            String pathStr = pathArg instanceof String str && !str.isBlank() ? str : ".";
            Path root = WorkspaceFileSupport.resolveSafePath(context.workingDirectory(), pathStr);
            if (root == null) {
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within working directory");
            }
            if (!Files.exists(root)) {
                return ToolResult.failure("Path not found: " + pathStr);
            }
            try {
                List<String> matches = search(root, pattern, context.workingDirectory());
                if (matches.isEmpty()) {
                    return ToolResult.success("No matches found");
                }
                String output = String.join("\n", matches)
                        + (matches.size() >= MAX_MATCHES ? "\n[Results truncated]" : "");
                return ToolResult.success(output);
            } catch (IOException | UncheckedIOException e) {
                return ToolResult.failure("Search failed: " + e.getMessage());
            }
        });
    }

    private List<String> search(Path root, Pattern pattern, Path workingDirectory) throws IOException {
        List<String> matches = new ArrayList<>();
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
                if (attrs.size() > WorkspaceFileSupport.MAX_FILE_SIZE) {
                    return FileVisitResult.CONTINUE;
                }
                searchFile(file, pattern, WorkspaceFileSupport.relativePath(workingDirectory, file), matches);
                return matches.size() >= MAX_MATCHES ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        return matches;
    }

    private static void searchFile(Path file, Pattern pattern, String relative, List<String> matches) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            // binary content
            return;
        } catch (IOException e) {
            log.debug("[Grep] Cannot read {}: {}", file, e.getMessage());
            return;
        }
        for (int i = 0; i < lines.size() && matches.size() < MAX_MATCHES; i++) {
            String line = lines.get(i);
            if (pattern.matcher(line).find()) {
                String text = line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) + "..." : line;
                matches.add(relative + ":" + (i + 1) + ": " + text.trim());
            }
        }
    }
}
