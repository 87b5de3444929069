package me.golemcore.coder.domain.approval;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.ApprovalContext;
import me.golemcore.coder.domain.model.ApprovalDecision;
import me.golemcore.coder.domain.model.ApprovalRiskAnalysis;
import me.golemcore.coder.domain.model.ApprovalRiskItem;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.InputTrustLevel;
import me.golemcore.coder.domain.model.Message;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves a pending batch into approved, feedback or denied.
 *
 * <p>
 * Dangerous commands are denied. Mandatory items always need user feedback,
 * whatever the standing approvals say. Explicit items need feedback unless the
 * user enabled "always approve" or approved in the same turn. Text from
 * untrusted input can never approve anything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolApprovalPolicy {

    private final ToolApprovalRiskAnalyzer riskAnalyzer;
    private final ApprovalNoteBuilder noteBuilder;

    public ApprovalDecision resolve(List<Message.ToolCall> toolCalls, ApprovalContext context) {
        List<Message.ToolCall> calls = toolCalls != null ? toolCalls : List.of();
        String userText = context.getUserText() != null ? context.getUserText() : "";
        boolean untrusted = context.getInputTrustLevel() == InputTrustLevel.UNTRUSTED;

        boolean wantsAlwaysApprove = !untrusted
                && RiskPatternTable.ALWAYS_APPROVE_PHRASE.matcher(userText).find();
        boolean oneTimeApprove = !untrusted
                && RiskPatternTable.ONE_TIME_APPROVE_PHRASE.matcher(userText).find();
        boolean alwaysApprove = !untrusted && (context.isAlwaysApproveTools() || wantsAlwaysApprove);

        ApprovalRiskAnalysis risk = riskAnalyzer.analyze(calls, context.getWorkingDirectory());
        List<Message.ToolCall> riskyToolCalls = dedupeCalls(
                Stream.concat(risk.getMandatoryApproval().stream(), risk.getRequiresExplicitApproval().stream())
                        .map(ApprovalRiskItem::getCall)
                        .toList());

        String note = noteBuilder.build(risk);
        if (untrusted && (risk.hasExplicitApproval() || risk.hasMandatoryApproval())) {
            note = noteBuilder.markUntrusted(note);
        }

        ApprovalDecision.ApprovalDecisionBuilder decision = ApprovalDecision.builder()
                .note(note)
                .risk(risk)
                .riskyToolCalls(riskyToolCalls)
                .alwaysApproveTools(alwaysApprove)
                .oneTimeApprove(oneTimeApprove);

        if (risk.hasDangerous()) {
            log.warn("[Approval] Denied {} dangerous call(s)", risk.getDangerous().size());
            return decision.status(ApprovalStatus.DENIED).build();
        }
        if (risk.hasMandatoryApproval()) {
            log.info("[Approval] Mandatory review for {} call(s)", risk.getMandatoryApproval().size());
            return decision.status(ApprovalStatus.FEEDBACK).oneTimeApprove(false).build();
        }
        if (risk.hasExplicitApproval() && !alwaysApprove && !oneTimeApprove) {
            log.info("[Approval] Explicit approval needed for {} call(s)", risk.getRequiresExplicitApproval().size());
            return decision.status(ApprovalStatus.FEEDBACK).build();
        }
        return decision.status(ApprovalStatus.APPROVED).build();
    }

    private static List<Message.ToolCall> dedupeCalls(List<Message.ToolCall> calls) {
        Set<String> seen = new LinkedHashSet<>();
        List<Message.ToolCall> result = new ArrayList<>();
        for (Message.ToolCall call : calls) {
            String id = call.getId();
            if (id == null || id.isEmpty() || seen.add(id)) {
                result.add(call);
            }
        }
        return result;
    }
}
