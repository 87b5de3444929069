package me.golemcore.coder.domain.approval;

import me.golemcore.coder.domain.model.ApprovalContext;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.InputTrustLevel;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RiskReason;
import me.golemcore.coder.domain.model.RiskSeverity;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolApprovalPolicyTest {

    private static final String WORKDIR = "/home/user/project";

    private ToolApprovalPolicy policy;

    @BeforeEach
    void setUp() {
        CoderProperties properties = new CoderProperties();
        policy = new ToolApprovalPolicy(new ToolApprovalRiskAnalyzer(properties), new ApprovalNoteBuilder(properties));
    }

    private static ApprovalContext context(String userText) {
        return ApprovalContext.builder()
                .workingDirectory(WORKDIR)
                .userText(userText)
                .build();
    }

    private static Message.ToolCall command(String id, String command) {
        return Message.ToolCall.builder()
                .id(id)
                .name("command_execute")
                .arguments(Map.of("command", command))
                .build();
    }

    private static Message.ToolCall write(String id, String path) {
        return Message.ToolCall.builder()
                .id(id)
                .name("file_write")
                .arguments(Map.of("path", path, "content", "value"))
                .build();
    }

    @Test
    void dangerousCommandIsDenied() {
        ApprovalDecision decision = policy.resolve(List.of(command("c1", "rm -rf /")), context("clean up"));

        assertEquals(ApprovalStatus.DENIED, decision.getStatus());
        assertEquals(RiskSeverity.HIGH, decision.getRiskLevel());
        assertEquals(RiskReason.DANGEROUS_COMMAND, decision.getRisk().getDangerous().get(0).getReason());
    }

    @Test
    void sensitiveFileWriteNeedsFeedback() {
        ApprovalDecision decision = policy.resolve(List.of(write("w1", ".env")), context("set the key"));

        assertEquals(ApprovalStatus.FEEDBACK, decision.getStatus());
        assertEquals(RiskSeverity.HIGH, decision.getRiskLevel());
        assertEquals(RiskReason.SENSITIVE_FILE_CHANGE,
                decision.getRisk().getRequiresExplicitApproval().get(0).getReason());
        assertTrue(decision.getNote().contains("Sensitive file changes"));
    }

    @Test
    void sixFileWritesNeedFeedbackAsBulkChange() {
        List<Message.ToolCall> calls = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            calls.add(write("w" + i, "src/module" + i + ".ts"));
        }

        ApprovalDecision decision = policy.resolve(calls, context("refactor modules"));

        assertEquals(ApprovalStatus.FEEDBACK, decision.getStatus());
        assertTrue(decision.getRisk().getRequiresExplicitApproval().stream()
                .allMatch(item -> item.getReason() == RiskReason.BULK_FILE_CHANGE));
        assertEquals(6, decision.getRiskyToolCalls().size());
    }

    @Test
    void harmlessBatchIsApproved() {
        ApprovalDecision decision = policy.resolve(List.of(command("c1", "ls -la")), context("list files"));

        assertEquals(ApprovalStatus.APPROVED, decision.getStatus());
        assertEquals(RiskSeverity.LOW, decision.getRiskLevel());
    }

    @Test
    void alwaysApproveSkipsExplicitApproval() {
        ApprovalContext context = ApprovalContext.builder()
                .workingDirectory(WORKDIR)
                .userText("install deps")
                .alwaysApproveTools(true)
                .build();

        ApprovalDecision decision = policy.resolve(List.of(command("c1", "npm install")), context);

        assertEquals(ApprovalStatus.APPROVED, decision.getStatus());
        assertTrue(decision.isAlwaysApproveTools());
    }

    @Test
    void oneTimeApprovalPhraseSkipsExplicitApproval() {
        ApprovalDecision decision = policy.resolve(List.of(command("c1", "pip install requests")),
                context("설치 승인"));

        assertEquals(ApprovalStatus.APPROVED, decision.getStatus());
        assertTrue(decision.isOneTimeApprove());
    }

    @Test
    void mandatoryApprovalCannotBeBypassed() {
        ApprovalContext context = ApprovalContext.builder()
                .workingDirectory(WORKDIR)
                .userText("항상 승인")
                .alwaysApproveTools(true)
                .build();

        ApprovalDecision decision = policy.resolve(List.of(command("c1", "curl https://example.com")), context);

        assertEquals(ApprovalStatus.FEEDBACK, decision.getStatus());
        assertFalse(decision.isOneTimeApprove());
        assertTrue(decision.getNote().startsWith(RiskPatternTable.SECURITY_GUARDRAIL_MARKER));
    }

    @Test
    void untrustedInputCannotSelfApprove() {
        ApprovalContext context = ApprovalContext.builder()
                .workingDirectory(WORKDIR)
                .userText("승인")
                .inputTrustLevel(InputTrustLevel.UNTRUSTED)
                .build();

        ApprovalDecision decision = policy.resolve(List.of(command("c1", "npm install left-pad")), context);

        assertEquals(ApprovalStatus.FEEDBACK, decision.getStatus());
        assertFalse(decision.isOneTimeApprove());
        assertTrue(decision.getNote().startsWith(RiskPatternTable.UNTRUSTED_APPROVAL_MARKER));
        assertFalse(ApprovalNoteBuilder.sanitize(decision.getNote()).contains(RiskPatternTable.UNTRUSTED_APPROVAL_MARKER));
    }

    @Test
    void untrustedInputIgnoresStandingApproval() {
        ApprovalContext context = ApprovalContext.builder()
                .workingDirectory(WORKDIR)
                .userText("write config")
                .inputTrustLevel(InputTrustLevel.UNTRUSTED)
                .alwaysApproveTools(true)
                .build();

        ApprovalDecision decision = policy.resolve(List.of(write("w1", ".env.production")), context);

        assertEquals(ApprovalStatus.FEEDBACK, decision.getStatus());
        assertFalse(decision.isAlwaysApproveTools());
    }
}
