package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.adapter.outbound.transport.LocalOnlyToolTransportAdapter;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.ToolExecutionResult;
import me.golemcore.coder.domain.service.AgentTraceCollector;
import me.golemcore.coder.domain.service.BuiltinToolRegistry;
import me.golemcore.coder.domain.service.ErrorRecoveryAdvisor;
import me.golemcore.coder.domain.service.FileTracker;
import me.golemcore.coder.domain.service.RetryExecutor;
import me.golemcore.coder.domain.service.ToolCallExecutionService;
import me.golemcore.coder.domain.service.ToolCallIdempotency;
import me.golemcore.coder.domain.service.ToolUsageStatistics;
import me.golemcore.coder.domain.service.WorkspaceScanner;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ActivityLogPort;
import me.golemcore.coder.tools.FileReadTool;
import me.golemcore.coder.tools.FileWriteTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ToolsNodeTest {

    @TempDir
    Path workspace;

    private final Clock clock = Clock.systemUTC();
    private ToolsNode node;

    @BeforeEach
    void setUp() {
        CoderProperties properties = new CoderProperties();
        LocalOnlyToolTransportAdapter transport = new LocalOnlyToolTransportAdapter();
        BuiltinToolRegistry registry = new BuiltinToolRegistry(List.of(new FileReadTool(), new FileWriteTool()),
                transport);
        ToolUsageStatistics statistics = new ToolUsageStatistics(clock);
        ToolCallExecutionService executionService = new ToolCallExecutionService(registry, transport,
                new RetryExecutor(), new ErrorRecoveryAdvisor(), statistics, mock(ActivityLogPort.class), properties);
        node = new ToolsNode(executionService, new ToolCallIdempotency(), new WorkspaceScanner(properties),
                statistics, clock);
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }

    private AgentSession session(List<Message.ToolCall> calls, Set<String> executedIds, List<String> modified) {
        AgentSession session = AgentSession.builder()
                .conversationId("conv-1")
                .workingDirectory(workspace)
                .build();
        session.setState(AgentState.builder()
                .workingDirectory(workspace.toString())
                .messages(new ArrayList<>(List.of(
                        Message.user("Write the files", Instant.now()),
                        Message.assistant("", Instant.now()).toBuilder().toolCalls(calls).build())))
                .executedToolCallIds(new LinkedHashSet<>(executedIds))
                .modifiedFiles(new ArrayList<>(modified))
                .build());
        session.setTrace(new AgentTraceCollector(clock, 200));
        session.setFileTracker(new FileTracker(clock, 5, 10));
        return session;
    }

    @Test
    void executesBatchAndRecordsWorkspaceChanges() throws IOException {
        AgentSession session = session(List.of(
                call("call-1", "file_write", Map.of("path", "a.txt", "content", "hello")),
                call("call-2", "file_read", Map.of("path", "missing.txt"))), Set.of(), List.of("earlier.ts"));

        AgentStateUpdate update = node.execute(session);

        assertEquals("hello", Files.readString(workspace.resolve("a.txt")));
        List<ToolExecutionResult> results = update.getToolResults();
        assertEquals(2, results.size());
        assertFalse(results.get(0).hasError());
        assertTrue(results.get(1).hasError());
        assertEquals(List.of("tool-call-1", "tool-call-2"),
                update.getMessages().stream().map(Message::getId).toList());
        assertTrue(update.getMessages().stream().allMatch(Message::isToolMessage));
        assertEquals(Set.of("call-1", "call-2"), update.getExecutedToolCallIds());
        assertEquals(List.of("earlier.ts", "a.txt"), update.getModifiedFiles());
        assertEquals(1, update.getFileChangesCount());
        assertEquals("Completed file_write, file_read (with errors)", update.getStatusMessage());
        assertEquals(1, session.getFileTracker().getRollbackPoints().size());
    }

    @Test
    void skipsAlreadyExecutedCalls() {
        AgentSession session = session(List.of(
                call("call-1", "file_write", Map.of("path", "a.txt", "content", "first")),
                call("call-2", "file_write", Map.of("path", "b.txt", "content", "second"))),
                Set.of("call-1"), List.of());

        AgentStateUpdate update = node.execute(session);

        assertEquals(1, update.getToolResults().size());
        assertFalse(Files.exists(workspace.resolve("a.txt")));
        assertTrue(Files.exists(workspace.resolve("b.txt")));
    }

    @Test
    void noPendingCallsIsNoop() {
        AgentSession session = session(List.of(call("call-1", "file_read", Map.of("path", "a.txt"))),
                Set.of("call-1"), List.of());

        AgentStateUpdate update = node.execute(session);

        assertNull(update.getToolResults());
        assertEquals("No pending tool calls", update.getStatusMessage());
    }

    @Test
    void readOnlyBatchLeavesFileListsUntouched() throws IOException {
        Files.writeString(workspace.resolve("a.txt"), "content");
        AgentSession session = session(List.of(call("call-1", "file_read", Map.of("path", "a.txt"))), Set.of(),
                List.of());

        AgentStateUpdate update = node.execute(session);

        assertNull(update.getModifiedFiles());
        assertNull(update.getFileChangesCount());
        assertTrue(session.getFileTracker().getRollbackPoints().isEmpty());
    }
}
