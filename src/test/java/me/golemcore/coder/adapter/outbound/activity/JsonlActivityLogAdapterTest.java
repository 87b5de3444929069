package me.golemcore.coder.adapter.outbound.activity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ActivityLogPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonlActivityLogAdapterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-07-01T09:30:00Z"), ZoneOffset.UTC);

    private JsonlActivityLogAdapter adapter(boolean enabled, Path file) {
        CoderProperties properties = new CoderProperties();
        properties.getActivityLog().setEnabled(enabled);
        properties.getActivityLog().setPath(file.toString());
        return new JsonlActivityLogAdapter(properties, objectMapper, clock);
    }

    @Test
    void appendsOneJsonLinePerRecord() throws Exception {
        Path file = tempDir.resolve("logs/activity.jsonl");
        JsonlActivityLogAdapter adapter = adapter(true, file);

        adapter.record(new ActivityLogPort.ActivityRecord("conv-1", "file_read", Map.of("path", "a.ts"), "ok",
                "success", 12));
        adapter.record(new ActivityLogPort.ActivityRecord("conv-1", "command_execute", Map.of("command", "ls"),
                "boom", "error", 40));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("2026-07-01T09:30:00Z", first.get("timestamp").asText());
        assertEquals("file_read", first.get("toolName").asText());
        assertEquals("a.ts", first.get("arguments").get("path").asText());
        assertEquals(12, first.get("durationMs").asLong());
        assertEquals("error", objectMapper.readTree(lines.get(1)).get("status").asText());
    }

    @Test
    void disabledLogWritesNothing() {
        Path file = tempDir.resolve("activity.jsonl");

        adapter(false, file).record(new ActivityLogPort.ActivityRecord("c", "file_list", Map.of(), "", "success", 1));

        assertFalse(Files.exists(file));
    }

    @Test
    void homePlaceholderIsExpanded() {
        Path resolved = JsonlActivityLogAdapter.resolvePath("${user.home}/.golemcore/coder/activity.jsonl");

        assertEquals(Path.of(System.getProperty("user.home"), ".golemcore", "coder", "activity.jsonl"), resolved);
        assertEquals(Path.of(System.getProperty("user.home"), "x.jsonl"), JsonlActivityLogAdapter.resolvePath("~/x.jsonl"));
    }
}
