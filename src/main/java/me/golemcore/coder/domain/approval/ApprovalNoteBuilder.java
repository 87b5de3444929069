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

import me.golemcore.coder.domain.model.ApprovalRiskAnalysis;
import me.golemcore.coder.domain.model.ApprovalRiskItem;
import me.golemcore.coder.domain.model.RiskReason;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the human-readable note attached to an approval decision.
 */
@Component
public class ApprovalNoteBuilder {

    private final int previewLimit;

    public ApprovalNoteBuilder(CoderProperties properties) {
        this.previewLimit = properties.getApproval().getNotePreviewLimit();
    }

    public String build(ApprovalRiskAnalysis risk) {
        if (risk.hasDangerous()) {
            return "Dangerous commands detected. Execution is blocked until reviewed.\n"
                    + preview(risk.getDangerous());
        }

        if (risk.hasMandatoryApproval()) {
            boolean outside = hasReason(risk.getMandatoryApproval(), RiskReason.OUTSIDE_WORKDIR_COMMAND);
            boolean http = hasReason(risk.getMandatoryApproval(), RiskReason.HTTP_REQUEST_COMMAND);
            StringBuilder note = new StringBuilder(RiskPatternTable.SECURITY_GUARDRAIL_MARKER).append('\n');
            if (outside && http) {
                note.append("Access outside the working directory and HTTP requests detected.");
            } else if (outside) {
                note.append("Commands targeting paths outside the working directory detected.");
            } else {
                note.append("Outbound HTTP requests detected.");
            }
            note.append(" User review is required.\n").append(preview(risk.getMandatoryApproval()));
            return note.toString();
        }

        if (risk.hasExplicitApproval()) {
            List<ApprovalRiskItem> items = risk.getRequiresExplicitApproval();
            if (hasReason(items, RiskReason.SENSITIVE_FILE_CHANGE)) {
                return "Sensitive file changes included. Runs after approval.\n" + preview(items);
            }
            if (hasReason(items, RiskReason.NETWORK_INSTALL_COMMAND)) {
                return "Network or package install commands included. Runs after approval.\n" + preview(items);
            }
            return "Risky tool executions included. Runs after approval.\n" + preview(items);
        }

        return "User approval is required before running tools.";
    }

    public String markUntrusted(String note) {
        return RiskPatternTable.UNTRUSTED_APPROVAL_MARKER
                + "\nUntrusted input mode: user confirmation is required, automatic approval is disabled.\n"
                + note;
    }

    /**
     * Removes the untrusted-input marker before a note is shown to the user.
     */
    public static String sanitize(String note) {
        if (note == null) {
            return "";
        }
        return note.replace(RiskPatternTable.UNTRUSTED_APPROVAL_MARKER, "").trim();
    }

    private String preview(List<ApprovalRiskItem> items) {
        return items.stream()
                .limit(previewLimit)
                .map(item -> "- " + item.getSummary())
                .collect(Collectors.joining("\n"));
    }

    private static boolean hasReason(List<ApprovalRiskItem> items, RiskReason reason) {
        return items.stream().anyMatch(item -> item.getReason() == reason);
    }
}
