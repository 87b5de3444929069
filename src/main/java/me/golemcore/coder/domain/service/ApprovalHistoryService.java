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

import me.golemcore.coder.domain.approval.ApprovalNoteBuilder;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalHistoryEntry;
import me.golemcore.coder.domain.model.ApprovalSource;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RiskSeverity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates normalized approval history entries.
 */
@Component
public class ApprovalHistoryService {

    private static final String NO_TOOLS_SUMMARY = "no tools -> auto-approved";

    private final Clock clock;

    public ApprovalHistoryService(Clock clock) {
        this.clock = clock;
    }

    public ApprovalHistoryEntry create(ApprovalStatus decision, ApprovalSource source, String summary,
            RiskSeverity riskLevel, List<String> toolCallIds, Map<String, Object> metadata) {
        return ApprovalHistoryEntry.builder()
                .id("approval-" + UUID.randomUUID())
                .timestamp(clock.instant())
                .decision(decision)
                .source(source)
                .summary(summary != null && !summary.isBlank() ? summary.trim() : decision.getValue())
                .riskLevel(riskLevel)
                .toolCallIds(toolCallIds != null ? List.copyOf(toolCallIds) : List.of())
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .build();
    }

    /**
     * Entry for a policy resolution. Policy-driven outcomes (feedback, denied)
     * are attributed to the policy, plain approvals to the system.
     */
    public ApprovalHistoryEntry fromDecision(ApprovalDecision decision, List<Message.ToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return create(ApprovalStatus.APPROVED, ApprovalSource.SYSTEM, NO_TOOLS_SUMMARY, RiskSeverity.LOW,
                    List.of(), null);
        }
        ApprovalSource source = decision.getStatus() == ApprovalStatus.APPROVED
                ? ApprovalSource.SYSTEM
                : ApprovalSource.POLICY;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("alwaysApproveTools", decision.isAlwaysApproveTools());
        metadata.put("oneTimeApprove", decision.isOneTimeApprove());
        return create(decision.getStatus(), source, ApprovalNoteBuilder.sanitize(decision.getNote()),
                decision.getRiskLevel(), toolCallIds(toolCalls), metadata);
    }

    public ApprovalHistoryEntry fromUser(boolean approved, RiskSeverity riskLevel, List<Message.ToolCall> toolCalls) {
        return create(approved ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED, ApprovalSource.USER,
                approved ? "approved after user confirmation" : "denied by user", riskLevel,
                toolCallIds(toolCalls), null);
    }

    public List<ApprovalHistoryEntry> append(List<ApprovalHistoryEntry> history, ApprovalHistoryEntry entry) {
        List<ApprovalHistoryEntry> result = new ArrayList<>(history != null ? history : List.of());
        result.add(entry);
        return result;
    }

    private static List<String> toolCallIds(List<Message.ToolCall> toolCalls) {
        return toolCalls.stream()
                .map(Message.ToolCall::getId)
                .filter(id -> id != null && !id.isEmpty())
                .toList();
    }
}
