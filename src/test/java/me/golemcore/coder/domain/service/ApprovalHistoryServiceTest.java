package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalHistoryEntry;
import me.golemcore.coder.domain.model.ApprovalSource;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RiskSeverity;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalHistoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T08:00:00Z");

    private final ApprovalHistoryService service = new ApprovalHistoryService(Clock.fixed(NOW, ZoneOffset.UTC));

    private static final List<Message.ToolCall> CALLS = List.of(
            Message.ToolCall.builder().id("c1").name("command_execute").arguments(Map.of("command", "ls")).build(),
            Message.ToolCall.builder().id("").name("file_list").build());

    @Test
    void emptyBatchIsAutoApprovedBySystem() {
        ApprovalHistoryEntry entry = service.fromDecision(
                ApprovalDecision.builder().status(ApprovalStatus.APPROVED).build(), List.of());

        assertEquals(ApprovalStatus.APPROVED, entry.getDecision());
        assertEquals(ApprovalSource.SYSTEM, entry.getSource());
        assertEquals("no tools -> auto-approved", entry.getSummary());
        assertEquals(RiskSeverity.LOW, entry.getRiskLevel());
    }

    @Test
    void policyOutcomeIsAttributedToPolicyWithSanitizedNote() {
        ApprovalDecision decision = ApprovalDecision.builder()
                .status(ApprovalStatus.FEEDBACK)
                .note("[UNTRUSTED_INPUT] Approval needed for network access")
                .build();

        ApprovalHistoryEntry entry = service.fromDecision(decision, CALLS);

        assertEquals(ApprovalSource.POLICY, entry.getSource());
        assertEquals("Approval needed for network access", entry.getSummary());
        assertEquals(List.of("c1"), entry.getToolCallIds());
        assertEquals(false, entry.getMetadata().get("alwaysApproveTools"));
        assertEquals(NOW, entry.getTimestamp());
        assertTrue(entry.getId().startsWith("approval-"));
    }

    @Test
    void userVerdictIsAttributedToUser() {
        ApprovalHistoryEntry denied = service.fromUser(false, RiskSeverity.HIGH, CALLS);

        assertEquals(ApprovalStatus.DENIED, denied.getDecision());
        assertEquals(ApprovalSource.USER, denied.getSource());
        assertEquals("denied by user", denied.getSummary());
        assertEquals(RiskSeverity.HIGH, denied.getRiskLevel());
    }

    @Test
    void blankSummaryFallsBackToDecisionValue() {
        ApprovalHistoryEntry entry = service.create(ApprovalStatus.DENIED, ApprovalSource.POLICY, " ",
                RiskSeverity.MEDIUM, null, null);

        assertEquals("denied", entry.getSummary());
        assertTrue(entry.getToolCallIds().isEmpty());
        assertTrue(entry.getMetadata().isEmpty());
    }

    @Test
    void appendNeverMutatesInput() {
        List<ApprovalHistoryEntry> history = List.of(service.fromUser(true, RiskSeverity.LOW, CALLS));

        List<ApprovalHistoryEntry> appended = service.append(history,
                service.fromUser(false, RiskSeverity.LOW, CALLS));

        assertEquals(1, history.size());
        assertEquals(2, appended.size());
    }
}
