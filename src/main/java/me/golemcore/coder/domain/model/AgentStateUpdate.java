package me.golemcore.coder.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * Partial state produced by a phase node. Null fields leave the state
 * untouched.
 */
@Data
@Builder
public class AgentStateUpdate {

    private List<Message> messages;
    private List<String> planSteps;
    private Integer currentPlanStep;
    private Boolean planCreated;
    private List<String> requiredFiles;

    private List<String> modifiedFiles;
    private List<String> deletedFiles;
    private List<ToolExecutionResult> toolResults;
    private Set<String> executedToolCallIds;
    private Integer fileChangesCount;

    private Integer iterationCount;
    private Boolean forceTermination;
    private TriageDecision triageDecision;

    private ApprovalStatus lastApprovalStatus;
    private Boolean alwaysApproveTools;
    private List<ApprovalHistoryEntry> approvalHistory;

    private VerificationStatus verificationStatus;
    private List<String> verificationFailedChecks;
    private List<String> verificationNotes;
    private Boolean needsAdditionalIteration;

    private CompletionChecklist completionChecklist;
    private WorkingMemory workingMemory;

    private Boolean awaitingDiscussInput;
    private String agentError;
    private Long tokensUsed;

    /**
     * Human-readable progress text for the node event; not merged into state.
     */
    private String statusMessage;

    public static AgentStateUpdate empty() {
        return AgentStateUpdate.builder().build();
    }
}
