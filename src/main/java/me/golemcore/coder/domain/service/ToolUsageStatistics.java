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

import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.ToolUsageStats;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Process-wide tool usage statistics shared by all conversations.
 *
 * <p>
 * Statistics are advisory: concurrent updates may interleave, which only
 * skews averages slightly. Entries unused for 24 hours are pruned on every
 * update.
 */
@Service
public class ToolUsageStatistics {

    private static final Duration RETENTION = Duration.ofHours(24);
    private static final double DEFAULT_RELIABILITY = 0.5;
    private static final int MAX_FILE_OPERATIONS = 5;
    private static final double SLOW_TOOL_MS = 30_000;
    private static final int TOP_TOOLS = 5;

    private static final Map<String, Pattern> TASK_PATTERNS = createTaskPatterns();

    private final Clock clock;
    private final Map<String, ToolUsageStats> stats = new ConcurrentHashMap<>();

    public ToolUsageStatistics(Clock clock) {
        this.clock = clock;
    }

    public void recordUsage(String toolName, boolean success, long durationMs, String error) {
        ToolUsageStats entry = stats.computeIfAbsent(toolName, ToolUsageStats::new);
        synchronized (entry) {
            if (success) {
                entry.setSuccessCount(entry.getSuccessCount() + 1);
            } else {
                entry.setFailureCount(entry.getFailureCount() + 1);
                if (error != null && !entry.getErrorPatterns().contains(error)) {
                    entry.getErrorPatterns().add(error);
                }
            }
            int total = entry.getTotalCount();
            entry.setAvgDurationMs((entry.getAvgDurationMs() * (total - 1) + durationMs) / total);
            entry.setLastUsed(clock.instant());
        }
        pruneOldStats();
    }

    public double getReliabilityScore(String toolName) {
        ToolUsageStats entry = stats.get(toolName);
        if (entry == null || entry.getTotalCount() == 0) {
            return DEFAULT_RELIABILITY;
        }
        return (double) entry.getSuccessCount() / entry.getTotalCount();
    }

    public Optional<ToolUsageStats> getStats(String toolName) {
        return Optional.ofNullable(stats.get(toolName));
    }

    /**
     * Picks the most reliable available tool whose name matches a task
     * category detected in the description.
     */
    public Optional<ToolRecommendation> recommendTool(String taskDescription, List<String> availableTools) {
        List<ToolRecommendation> candidates = new ArrayList<>();
        TASK_PATTERNS.forEach((toolType, pattern) -> {
            if (!pattern.matcher(taskDescription).find()) {
                return;
            }
            for (String tool : availableTools) {
                if (tool.contains(toolType)) {
                    double reliability = getReliabilityScore(tool);
                    candidates.add(new ToolRecommendation(tool, reliability,
                            String.format(Locale.ROOT, "suited for '%s' tasks, reliability %.0f%%", toolType,
                                    reliability * 100),
                            List.of()));
                }
            }
        });
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(Comparator.comparingDouble(ToolRecommendation::confidence).reversed());
        ToolRecommendation best = candidates.get(0);
        List<String> alternatives = candidates.stream()
                .skip(1)
                .limit(2)
                .map(ToolRecommendation::toolName)
                .toList();
        return Optional.of(new ToolRecommendation(best.toolName(), best.confidence(), best.reason(), alternatives));
    }

    /**
     * Calls with the same name and arguments as an earlier call in the batch.
     */
    public List<Message.ToolCall> detectRedundantCalls(List<Message.ToolCall> toolCalls) {
        Set<String> seen = new HashSet<>();
        List<Message.ToolCall> redundant = new ArrayList<>();
        for (Message.ToolCall call : toolCalls) {
            String signature = call.getName() + ":" + call.getArguments();
            if (!seen.add(signature)) {
                redundant.add(call);
            }
        }
        return redundant;
    }

    public List<String> suggestOptimization(List<Message.ToolCall> toolCalls) {
        List<String> suggestions = new ArrayList<>();
        long fileOps = toolCalls.stream()
                .filter(call -> call.getName().contains("file_read") || call.getName().contains("file_write"))
                .count();
        if (fileOps > MAX_FILE_OPERATIONS) {
            suggestions.add(fileOps + " file operations in one batch. Consider batching them.");
        }
        for (Message.ToolCall call : toolCalls) {
            ToolUsageStats entry = stats.get(call.getName());
            if (entry != null && entry.getAvgDurationMs() > SLOW_TOOL_MS) {
                suggestions.add(String.format(Locale.ROOT, "'%s' takes %.1fs on average. Consider caching or an alternative.",
                        call.getName(), entry.getAvgDurationMs() / 1000));
            }
        }
        for (Message.ToolCall call : toolCalls) {
            double reliability = getReliabilityScore(call.getName());
            if (reliability < DEFAULT_RELIABILITY) {
                suggestions.add(String.format(Locale.ROOT, "'%s' has a low success rate (%.0f%%). Consider an alternative.",
                        call.getName(), reliability * 100));
            }
        }
        return suggestions;
    }

    public StatsSummary getStatsSummary() {
        List<ToolUsageStats> all = new ArrayList<>(stats.values());
        int totalCalls = all.stream().mapToInt(ToolUsageStats::getTotalCount).sum();
        double averageReliability = all.stream()
                .mapToDouble(entry -> getReliabilityScore(entry.getToolName()))
                .average()
                .orElse(0);
        List<ToolSummary> topTools = all.stream()
                .sorted(Comparator.comparingInt(ToolUsageStats::getTotalCount).reversed())
                .limit(TOP_TOOLS)
                .map(entry -> new ToolSummary(entry.getToolName(), entry.getTotalCount(),
                        getReliabilityScore(entry.getToolName())))
                .toList();
        return new StatsSummary(all.size(), totalCalls, averageReliability, topTools);
    }

    private void pruneOldStats() {
        Instant threshold = clock.instant().minus(RETENTION);
        stats.values().removeIf(entry -> entry.getLastUsed() != null && entry.getLastUsed().isBefore(threshold));
    }

    private static Map<String, Pattern> createTaskPatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("file_search", Pattern.compile("find|search|locate.*file", Pattern.CASE_INSENSITIVE));
        patterns.put("file_read", Pattern.compile("read|view|check.*content|see.*file", Pattern.CASE_INSENSITIVE));
        patterns.put("file_write", Pattern.compile("write|create|modify|update.*file", Pattern.CASE_INSENSITIVE));
        patterns.put("command_execute", Pattern.compile("run|execute|build|test|install|compile",
                Pattern.CASE_INSENSITIVE));
        patterns.put("grep_search", Pattern.compile("search.*content|find.*text|grep|pattern",
                Pattern.CASE_INSENSITIVE));
        patterns.put("git", Pattern.compile("git|commit|push|pull|branch", Pattern.CASE_INSENSITIVE));
        return patterns;
    }

    public record ToolRecommendation(String toolName, double confidence, String reason, List<String> alternatives) {
    }

    public record ToolSummary(String name, int calls, double reliability) {
    }

    public record StatsSummary(int totalTools, int totalCalls, double averageReliability, List<ToolSummary> topTools) {
    }
}
