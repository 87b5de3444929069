package me.golemcore.coder.domain.graph;

import me.golemcore.coder.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepeatedCallGuardTest {

    private static Message.ToolCall read(String path) {
        return Message.ToolCall.builder().id("id-" + System.nanoTime()).name("file_read")
                .arguments(Map.of("path", path)).build();
    }

    @Test
    void stopsOnThirdIdenticalBatch() {
        RepeatedCallGuard guard = new RepeatedCallGuard(2);

        assertFalse(guard.recordAndCheck(List.of(read("a.ts"))));
        assertFalse(guard.recordAndCheck(List.of(read("a.ts"))));
        assertTrue(guard.recordAndCheck(List.of(read("a.ts"))));
        assertEquals(2, guard.getConsecutiveRepeats());
    }

    @Test
    void differentBatchResetsCounter() {
        RepeatedCallGuard guard = new RepeatedCallGuard(2);

        guard.recordAndCheck(List.of(read("a.ts")));
        guard.recordAndCheck(List.of(read("a.ts")));
        assertFalse(guard.recordAndCheck(List.of(read("b.ts"))));
        assertEquals(0, guard.getConsecutiveRepeats());
    }

    @Test
    void signatureIgnoresCallIdsOrderAndKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("path", "a.ts");
        first.put("content", "x");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("content", "x");
        second.put("path", "a.ts");
        Message.ToolCall write1 = Message.ToolCall.builder().id("1").name("file_write").arguments(first).build();
        Message.ToolCall write2 = Message.ToolCall.builder().id("2").name("file_write").arguments(second).build();

        assertEquals(RepeatedCallGuard.signature(List.of(write1, read("b.ts"))),
                RepeatedCallGuard.signature(List.of(read("b.ts"), write2)));
    }
}
