package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.ToolUsageStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolUsageStatisticsTest {

    private ToolUsageStatistics statistics;

    @BeforeEach
    void setUp() {
        statistics = new ToolUsageStatistics(Clock.fixed(Instant.parse("2026-05-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static Message.ToolCall call(String name, String path) {
        return Message.ToolCall.builder().id(name + path).name(name).arguments(Map.of("path", path)).build();
    }

    @Test
    void unknownToolHasNeutralReliability() {
        assertEquals(0.5, statistics.getReliabilityScore("file_read"));
    }

    @Test
    void recordsSuccessFailureAndAverageDuration() {
        statistics.recordUsage("command_execute", true, 100, null);
        statistics.recordUsage("command_execute", false, 300, "exit code 1");
        statistics.recordUsage("command_execute", false, 200, "exit code 1");

        ToolUsageStats stats = statistics.getStats("command_execute").orElseThrow();
        assertEquals(3, stats.getTotalCount());
        assertEquals(200.0, stats.getAvgDurationMs(), 0.001);
        assertEquals(List.of("exit code 1"), stats.getErrorPatterns());
        assertEquals(1.0 / 3, statistics.getReliabilityScore("command_execute"), 0.001);
    }

    @Test
    void detectsRedundantCalls() {
        List<Message.ToolCall> redundant = statistics.detectRedundantCalls(List.of(
                call("file_read", "a.ts"), call("file_read", "b.ts"), call("file_read", "a.ts")));

        assertEquals(1, redundant.size());
        assertEquals("a.ts", redundant.get(0).getStringArgument("path"));
    }

    @Test
    void suggestsBatchingAndFlagsUnreliableTools() {
        statistics.recordUsage("grep_search", false, 10, "bad pattern");
        List<Message.ToolCall> calls = List.of(
                call("file_read", "1"), call("file_read", "2"), call("file_read", "3"),
                call("file_write", "4"), call("file_write", "5"), call("file_write", "6"),
                call("grep_search", "7"));

        List<String> suggestions = statistics.suggestOptimization(calls);

        assertTrue(suggestions.contains("6 file operations in one batch. Consider batching them."));
        assertTrue(suggestions.stream().anyMatch(s -> s.startsWith("'grep_search' has a low success rate (0%)")));
    }

    @Test
    void recommendsMostReliableMatchingTool() {
        statistics.recordUsage("file_read", true, 5, null);

        Optional<ToolUsageStatistics.ToolRecommendation> recommendation = statistics.recommendTool(
                "read the config", List.of("file_read", "file_write"));

        assertEquals("file_read", recommendation.orElseThrow().toolName());
        assertEquals(1.0, recommendation.get().confidence());
    }

    @Test
    void summaryListsTopTools() {
        statistics.recordUsage("file_read", true, 5, null);
        statistics.recordUsage("file_read", true, 5, null);
        statistics.recordUsage("file_write", true, 5, null);

        ToolUsageStatistics.StatsSummary summary = statistics.getStatsSummary();

        assertEquals(2, summary.totalTools());
        assertEquals(3, summary.totalCalls());
        assertEquals("file_read", summary.topTools().get(0).name());
    }
}
