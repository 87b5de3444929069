package me.golemcore.coder.domain.graph.node;

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
import me.golemcore.coder.domain.approval.ApprovalNoteBuilder;
import me.golemcore.coder.domain.approval.ToolApprovalPolicy;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.graph.ToolApprovalCallback;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.ApprovalContext;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalHistoryEntry;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RiskSeverity;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.service.ApprovalHistoryService;
import me.golemcore.coder.domain.service.ToolCallIdempotency;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Gates the pending tool batch behind the approval policy.
 *
 * <p>
 * A {@code feedback} decision is put to the session's approval callback when
 * there is one; otherwise the node leaves the status at {@code feedback} and
 * the orchestrator pauses the run.
 */
@Component
@Slf4j
public class ApprovalNode implements PhaseNode {

    static final String USER_REJECTED_MESSAGE = "Tool execution was rejected by the user.";

    private final ToolApprovalPolicy approvalPolicy;
    private final ApprovalHistoryService historyService;
    private final ToolCallIdempotency idempotency;
    private final Clock clock;

    public ApprovalNode(ToolApprovalPolicy approvalPolicy, ApprovalHistoryService historyService,
            ToolCallIdempotency idempotency, Clock clock) {
        this.approvalPolicy = approvalPolicy;
        this.historyService = historyService;
        this.idempotency = idempotency;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "approval";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.APPROVAL;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        List<Message.ToolCall> pending = idempotency.pendingToolCalls(state);
        ApprovalDecision decision = approvalPolicy.resolve(pending, ApprovalContext.builder()
                .workingDirectory(state.getWorkingDirectory())
                .userText(state.lastUserText())
                .inputTrustLevel(state.getInputTrustLevel())
                .alwaysApproveTools(state.isAlwaysApproveTools())
                .build());
        ApprovalHistoryEntry policyEntry = historyService.fromDecision(decision, pending);
        String userNote = ApprovalNoteBuilder.sanitize(decision.getNote());
        int iteration = state.getIterationCount();

        return switch (decision.getStatus()) {
        case DENIED -> {
            log.warn("[Approval] Blocking dangerous tool execution");
            session.getTrace().approvalStatus(ApprovalStatus.DENIED, userNote, iteration);
            emitResult(session, false);
            yield AgentStateUpdate.builder()
                    .lastApprovalStatus(ApprovalStatus.DENIED)
                    .alwaysApproveTools(decision.isAlwaysApproveTools())
                    .approvalHistory(List.of(policyEntry))
                    .messages(List.of(Message.assistant("Warning: " + userNote, clock.instant())))
                    .statusMessage("Tool execution denied")
                    .build();
        }
        case FEEDBACK -> requestApproval(session, decision, policyEntry, userNote, pending);
        case APPROVED -> {
            log.info("[Approval] Auto-approving {} tool(s)", pending.size());
            session.getTrace().approvalStatus(ApprovalStatus.APPROVED, "auto_approved", iteration);
            yield AgentStateUpdate.builder()
                    .lastApprovalStatus(ApprovalStatus.APPROVED)
                    .alwaysApproveTools(decision.isAlwaysApproveTools())
                    .approvalHistory(List.of(policyEntry))
                    .statusMessage("Approved " + pending.size() + " tool call(s)")
                    .build();
        }
        };
    }

    /**
     * Applies a user's verdict on the pending batch, either from the callback
     * or from a resumed run.
     */
    public AgentStateUpdate resolveUserVerdict(AgentSession session, boolean approved) {
        AgentState state = session.getState();
        List<Message.ToolCall> pending = idempotency.pendingToolCalls(state);
        List<ApprovalHistoryEntry> history = state.getApprovalHistory();
        RiskSeverity riskLevel = history.isEmpty() ? RiskSeverity.LOW : history.get(history.size() - 1).getRiskLevel();
        return userVerdict(session, approved, riskLevel, pending, List.of());
    }

    private AgentStateUpdate requestApproval(AgentSession session, ApprovalDecision decision,
            ApprovalHistoryEntry policyEntry, String userNote, List<Message.ToolCall> pending) {
        AgentState state = session.getState();
        log.info("[Approval] Explicit approval required for risky tools");
        session.getTrace().approvalStatus(ApprovalStatus.FEEDBACK, userNote, state.getIterationCount());

        List<ApprovalHistoryEntry> historyForCaller = new ArrayList<>(state.getApprovalHistory());
        historyForCaller.add(policyEntry);
        Message last = state.lastMessage();
        session.emit(StreamEvent.builder()
                .type(StreamEventType.TOOL_APPROVAL_REQUEST)
                .conversationId(session.getConversationId())
                .node(getName())
                .messageId(last != null ? last.getId() : null)
                .toolCalls(pending)
                .note(userNote)
                .riskLevel(decision.getRiskLevel())
                .approvalHistory(historyForCaller)
                .build());

        ToolApprovalCallback callback = session.getApprovalCallback();
        if (callback == null) {
            return AgentStateUpdate.builder()
                    .lastApprovalStatus(ApprovalStatus.FEEDBACK)
                    .alwaysApproveTools(decision.isAlwaysApproveTools())
                    .approvalHistory(List.of(policyEntry))
                    .statusMessage("Waiting for tool approval")
                    .build();
        }

        boolean approved;
        try {
            approved = Boolean.TRUE.equals(callback.requestApproval(pending).join());
        } catch (RuntimeException e) {
            log.warn("[Approval] Approval callback failed, treating as rejection: {}", e.getMessage());
            session.getTrace().error(TracePhase.APPROVAL, "Approval callback failed: " + e.getMessage(),
                    state.getIterationCount());
            approved = false;
        }
        AgentStateUpdate verdict = userVerdict(session, approved, decision.getRiskLevel(), pending,
                List.of(policyEntry));
        verdict.setAlwaysApproveTools(decision.isAlwaysApproveTools());
        return verdict;
    }

    private AgentStateUpdate userVerdict(AgentSession session, boolean approved, RiskSeverity riskLevel,
            List<Message.ToolCall> pending, List<ApprovalHistoryEntry> priorEntries) {
        List<ApprovalHistoryEntry> entries = new ArrayList<>(priorEntries);
        entries.add(historyService.fromUser(approved, riskLevel, pending));
        ApprovalStatus status = approved ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED;
        session.getTrace().approvalStatus(status, approved ? "approved by user" : "denied by user",
                session.getState().getIterationCount());
        emitResult(session, approved);
        log.info("[Approval] User {} {} tool call(s)", approved ? "approved" : "rejected", pending.size());

        AgentStateUpdate.AgentStateUpdateBuilder update = AgentStateUpdate.builder()
                .lastApprovalStatus(status)
                .approvalHistory(entries)
                .statusMessage(approved ? "Approved by user" : "Rejected by user");
        if (!approved) {
            update.messages(List.of(Message.assistant(USER_REJECTED_MESSAGE, clock.instant())));
        }
        return update.build();
    }

    private void emitResult(AgentSession session, boolean approved) {
        session.emit(StreamEvent.builder()
                .type(StreamEventType.TOOL_APPROVAL_RESULT)
                .conversationId(session.getConversationId())
                .node(getName())
                .approved(approved)
                .build());
    }
}
