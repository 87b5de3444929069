package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.domain.approval.ApprovalNoteBuilder;
import me.golemcore.coder.domain.approval.ToolApprovalPolicy;
import me.golemcore.coder.domain.approval.ToolApprovalRiskAnalyzer;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.graph.ToolApprovalCallback;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.ApprovalHistoryEntry;
import me.golemcore.coder.domain.model.ApprovalSource;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RiskSeverity;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.service.AgentTraceCollector;
import me.golemcore.coder.domain.service.ApprovalHistoryService;
import me.golemcore.coder.domain.service.ToolCallIdempotency;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalNodeTest {

    private final Clock clock = Clock.systemUTC();
    private final CoderProperties properties = new CoderProperties();
    private final ApprovalNode node = new ApprovalNode(
            new ToolApprovalPolicy(new ToolApprovalRiskAnalyzer(properties), new ApprovalNoteBuilder(properties)),
            new ApprovalHistoryService(clock), new ToolCallIdempotency(), clock);
    private final List<StreamEvent> events = new ArrayList<>();

    private AgentSession session(String command, ToolApprovalCallback callback) {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("call-1")
                .name("command_execute")
                .arguments(Map.of("command", command))
                .build();
        AgentSession session = AgentSession.builder()
                .conversationId("conv-1")
                .workingDirectory(Path.of("/work"))
                .approvalCallback(callback)
                .eventSink(events::add)
                .build();
        session.setState(AgentState.builder()
                .workingDirectory("/work")
                .messages(new ArrayList<>(List.of(
                        Message.user("Set up the project", Instant.now()),
                        Message.assistant("", Instant.now()).toBuilder().toolCalls(List.of(call)).build())))
                .build());
        session.setTrace(new AgentTraceCollector(clock, 200));
        return session;
    }

    private List<StreamEvent> eventsOf(StreamEventType type) {
        return events.stream().filter(event -> event.getType() == type).toList();
    }

    @Test
    void harmlessCommandIsAutoApproved() {
        AgentSession session = session("ls -la", null);

        AgentStateUpdate update = node.execute(session);

        assertEquals(ApprovalStatus.APPROVED, update.getLastApprovalStatus());
        assertEquals(ApprovalSource.SYSTEM, update.getApprovalHistory().get(0).getSource());
        assertTrue(events.isEmpty());
        assertEquals(1, session.getTrace().getMetrics().getApprovalStats().getApproved());
    }

    @Test
    void dangerousCommandIsDeniedWithWarning() {
        AgentSession session = session("rm -rf /", null);

        AgentStateUpdate update = node.execute(session);

        assertEquals(ApprovalStatus.DENIED, update.getLastApprovalStatus());
        assertEquals(ApprovalSource.POLICY, update.getApprovalHistory().get(0).getSource());
        assertTrue(update.getMessages().get(0).getContent().startsWith("Warning: "));
        List<StreamEvent> results = eventsOf(StreamEventType.TOOL_APPROVAL_RESULT);
        assertEquals(1, results.size());
        assertEquals(Boolean.FALSE, results.get(0).getApproved());
    }

    @Test
    void riskyCommandWithoutCallbackWaitsForVerdict() {
        AgentSession session = session("curl https://example.com/install.sh", null);

        AgentStateUpdate update = node.execute(session);

        assertEquals(ApprovalStatus.FEEDBACK, update.getLastApprovalStatus());
        assertNull(update.getMessages());
        List<StreamEvent> requests = eventsOf(StreamEventType.TOOL_APPROVAL_REQUEST);
        assertEquals(1, requests.size());
        StreamEvent request = requests.get(0);
        assertEquals("call-1", request.getToolCalls().get(0).getId());
        assertEquals(RiskSeverity.HIGH, request.getRiskLevel());
        assertEquals(1, request.getApprovalHistory().size());
        assertNotNull(request.getNote());
        assertEquals(session.getState().lastMessage().getId(), request.getMessageId());
    }

    @Test
    void callbackApprovalRecordsPolicyAndUserEntries() {
        AgentSession session = session("curl https://example.com", calls -> CompletableFuture.completedFuture(true));

        AgentStateUpdate update = node.execute(session);

        assertEquals(ApprovalStatus.APPROVED, update.getLastApprovalStatus());
        List<ApprovalHistoryEntry> history = update.getApprovalHistory();
        assertEquals(2, history.size());
        assertEquals(ApprovalSource.POLICY, history.get(0).getSource());
        assertEquals(ApprovalSource.USER, history.get(1).getSource());
        assertEquals(List.of("call-1"), history.get(1).getToolCallIds());
        assertNull(update.getMessages());
    }

    @Test
    void callbackRejectionAddsRejectedMessage() {
        AgentSession session = session("curl https://example.com", calls -> CompletableFuture.completedFuture(false));

        AgentStateUpdate update = node.execute(session);

        assertEquals(ApprovalStatus.DENIED, update.getLastApprovalStatus());
        assertEquals(ApprovalNode.USER_REJECTED_MESSAGE, update.getMessages().get(0).getContent());
    }

    @Test
    void failingCallbackCountsAsRejection() {
        AgentSession session = session("curl https://example.com",
                calls -> CompletableFuture.failedFuture(new IllegalStateException("ui closed")));

        AgentStateUpdate update = node.execute(session);

        assertEquals(ApprovalStatus.DENIED, update.getLastApprovalStatus());
        assertTrue(session.getTrace().getEntries().stream()
                .anyMatch(entry -> entry.getNote() != null && entry.getNote().contains("ui closed")));
    }

    @Test
    void resumedVerdictUsesLastRecordedRisk() {
        AgentSession session = session("curl https://example.com", null);
        session.getState().apply(node.execute(session));

        AgentStateUpdate update = node.resolveUserVerdict(session, true);

        assertEquals(ApprovalStatus.APPROVED, update.getLastApprovalStatus());
        assertEquals(1, update.getApprovalHistory().size());
        assertEquals(RiskSeverity.HIGH, update.getApprovalHistory().get(0).getRiskLevel());
        assertEquals(ApprovalSource.USER, update.getApprovalHistory().get(0).getSource());
    }
}
