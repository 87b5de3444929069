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
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Builds a depth-limited view of a project and recommends files relevant to a
 * task description.
 *
 * <p>
 * Structures are cached per root and depth for the lifetime of the process.
 * The cache is shared scratch data: a stale entry only makes recommendations
 * less accurate. Call {@link #invalidate(Path)} after large workspace changes.
 */
@Service
@Slf4j
public class CodebaseAnalyzer {

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            ".ts", ".tsx", ".js", ".jsx", ".py", ".java", ".go", ".rs", ".c", ".cpp", ".h");
    private static final int MIN_KEYWORD_LENGTH = 4;
    private static final int FILE_MATCH_SCORE = 10;
    private static final int DIRECTORY_MATCH_SCORE = 5;

    private final Set<String> ignoredNames;
    private final Map<String, ProjectStructure> cache = new ConcurrentHashMap<>();

    public CodebaseAnalyzer(CoderProperties properties) {
        this.ignoredNames = Set.copyOf(properties.getWorkspace().getIgnoredDirectories());
    }

    public ProjectStructure analyzeStructure(Path root, int maxDepth) {
        Path normalized = root.toAbsolutePath().normalize();
        return cache.computeIfAbsent(normalized + "#" + maxDepth, key -> {
            log.debug("[Analyzer] Analyzing project structure: {}", normalized);
            DirectoryNode tree = buildTree(normalized, normalized, maxDepth, 0);
            Stats stats = new Stats();
            collectStats(tree, stats);
            return new ProjectStructure(normalized, tree, stats.files, stats.directories, stats.lines,
                    Map.copyOf(stats.byExtension));
        });
    }

    /**
     * Scores every file by the task keywords (words longer than three
     * characters): a match in the relative path adds 10, a match in the parent
     * directory adds 5. Returns the top {@code limit} relative paths.
     */
    public List<String> recommendFiles(String taskDescription, ProjectStructure structure, int limit) {
        if (taskDescription == null || taskDescription.isBlank()) {
            return List.of();
        }
        List<String> keywords = Stream.of(taskDescription.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> word.length() >= MIN_KEYWORD_LENGTH)
                .toList();
        if (keywords.isEmpty()) {
            return List.of();
        }
        List<ScoredFile> scored = new ArrayList<>();
        scoreFiles(structure.tree(), keywords, scored);
        return scored.stream()
                .sorted(Comparator.comparingInt(ScoredFile::score).reversed())
                .limit(limit)
                .map(ScoredFile::path)
                .toList();
    }

    public List<String> recommendFiles(String taskDescription, Path root, int maxDepth, int limit) {
        return recommendFiles(taskDescription, analyzeStructure(root, maxDepth), limit);
    }

    public void invalidate(Path root) {
        String prefix = root.toAbsolutePath().normalize() + "#";
        cache.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public String formatAsTree(DirectoryNode node) {
        StringBuilder builder = new StringBuilder();
        appendTree(node, "", true, builder);
        return builder.toString();
    }

    private void appendTree(DirectoryNode node, String prefix, boolean last, StringBuilder builder) {
        builder.append(prefix).append(last ? "└── " : "├── ")
                .append(node.name()).append(node.directory() ? "/" : "").append('\n');
        String childPrefix = prefix + (last ? "    " : "│   ");
        for (int i = 0; i < node.children().size(); i++) {
            appendTree(node.children().get(i), childPrefix, i == node.children().size() - 1, builder);
        }
    }

    private DirectoryNode buildTree(Path root, Path path, int maxDepth, int depth) {
        String relative = root.relativize(path).toString().replace('\\', '/');
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        if (!Files.isDirectory(path)) {
            return new DirectoryNode(relative, name, false, countLines(path), List.of());
        }
        List<DirectoryNode> children = new ArrayList<>();
        if (depth < maxDepth) {
            try (Stream<Path> entries = Files.list(path)) {
                entries.filter(entry -> !ignoredNames.contains(entry.getFileName().toString()))
                        .forEach(entry -> children.add(buildTree(root, entry, maxDepth, depth + 1)));
            } catch (IOException e) {
                log.warn("[Analyzer] Cannot read directory {}: {}", path, e.getMessage());
            }
            children.sort(Comparator.comparing((DirectoryNode child) -> !child.directory())
                    .thenComparing(DirectoryNode::name));
        }
        return new DirectoryNode(relative, name, true, 0, List.copyOf(children));
    }

    private void scoreFiles(DirectoryNode node, List<String> keywords, List<ScoredFile> scored) {
        if (!node.directory()) {
            String pathLower = node.path().toLowerCase(Locale.ROOT);
            int slash = pathLower.lastIndexOf('/');
            String directory = slash >= 0 ? pathLower.substring(0, slash) : "";
            int score = 0;
            for (String keyword : keywords) {
                if (pathLower.contains(keyword)) {
                    score += FILE_MATCH_SCORE;
                }
                if (directory.contains(keyword)) {
                    score += DIRECTORY_MATCH_SCORE;
                }
            }
            if (score > 0) {
                scored.add(new ScoredFile(node.path(), score));
            }
            return;
        }
        for (DirectoryNode child : node.children()) {
            scoreFiles(child, keywords, scored);
        }
    }

    private void collectStats(DirectoryNode node, Stats stats) {
        if (node.directory()) {
            stats.directories++;
            node.children().forEach(child -> collectStats(child, stats));
            return;
        }
        stats.files++;
        stats.lines += node.lines();
        stats.byExtension.merge(extension(node.name()), 1, Integer::sum);
    }

    private static int countLines(Path file) {
        if (!CODE_EXTENSIONS.contains(extension(file.getFileName().toString()))) {
            return 0;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8).split("\n", -1).length;
        } catch (CharacterCodingException e) {
            // binary content
            return 0;
        } catch (IOException e) {
            log.debug("[Analyzer] Cannot read {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    public record DirectoryNode(String path, String name, boolean directory, int lines, List<DirectoryNode> children) {
    }

    public record ProjectStructure(Path root, DirectoryNode tree, int fileCount, int directoryCount, long totalLines,
            Map<String, Integer> filesByExtension) {
    }

    private record ScoredFile(String path, int score) {
    }

    private static final class Stats {
        private int files;
        private int directories;
        private long lines;
        private final Map<String, Integer> byExtension = new TreeMap<>();
    }
}
