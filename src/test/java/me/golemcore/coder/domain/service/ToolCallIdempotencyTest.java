package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallIdempotencyTest {

    private final ToolCallIdempotency idempotency = new ToolCallIdempotency();

    private static Message.ToolCall call(String id) {
        return Message.ToolCall.builder().id(id).name("file_read").arguments(Map.of("path", id)).build();
    }

    @Test
    void executedCallsAreFilteredOut() {
        List<Message.ToolCall> pending = idempotency.filterUnexecuted(
                List.of(call("a"), call("b"), call("c")), Set.of("b"));

        assertEquals(List.of("a", "c"), pending.stream().map(Message.ToolCall::getId).toList());
    }

    @Test
    void callsWithoutIdAreAlwaysPending() {
        Message.ToolCall anonymous = Message.ToolCall.builder().name("file_list").build();

        List<Message.ToolCall> pending = idempotency.filterUnexecuted(List.of(anonymous), Set.of("x"));

        assertEquals(1, pending.size());
    }

    @Test
    void batchSplitAcrossTwoDeliveriesNeverRepeatsACall() {
        List<Message.ToolCall> batch = List.of(call("a"), call("b"), call("c"));

        Set<String> executed = idempotency.merge(Set.of(), batch.subList(0, 2));
        List<Message.ToolCall> second = idempotency.filterUnexecuted(batch, executed);

        assertEquals(List.of("c"), second.stream().map(Message.ToolCall::getId).toList());
        executed = idempotency.merge(executed, second);
        assertTrue(idempotency.filterUnexecuted(batch, executed).isEmpty());
    }

    @Test
    void mergeKeepsExistingIdsAndSkipsBlankOnes() {
        Message.ToolCall blank = Message.ToolCall.builder().id("").name("file_list").build();

        Set<String> merged = idempotency.merge(Set.of("old"), List.of(call("new"), blank));

        assertEquals(Set.of("old", "new"), merged);
    }

    @Test
    void pendingToolCallsComeFromLastAssistantMessage() {
        Message assistant = Message.assistant("", Instant.EPOCH).toBuilder()
                .toolCalls(List.of(call("a"), call("b")))
                .build();
        AgentState state = AgentState.builder()
                .messages(new ArrayList<>(List.of(Message.user("task", Instant.EPOCH), assistant)))
                .build();
        state.getExecutedToolCallIds().add("a");

        List<Message.ToolCall> pending = idempotency.pendingToolCalls(state);

        assertEquals(List.of("b"), pending.stream().map(Message.ToolCall::getId).toList());
    }

    @Test
    void noPendingCallsAfterToolReply() {
        Message assistant = Message.assistant("", Instant.EPOCH).toBuilder()
                .toolCalls(List.of(call("a")))
                .build();
        AgentState state = AgentState.builder()
                .messages(new ArrayList<>(List.of(assistant,
                        Message.toolResult("a", "file_read", "ok", Instant.EPOCH))))
                .build();

        assertTrue(idempotency.pendingToolCalls(state).isEmpty());
    }
}
