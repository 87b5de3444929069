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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The single record threaded through every phase of one coding-agent turn.
 *
 * <p>
 * Phase nodes never modify it directly: they return an
 * {@link AgentStateUpdate} that the orchestrator merges with
 * {@link #apply(AgentStateUpdate)}. Messages and approval history are
 * append-only, executed tool-call ids only grow, everything else is replaced.
 */
@Data
@Builder(toBuilder = true)
public class AgentState {

    private String conversationId;
    private String workingDirectory;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    // Plan
    @Builder.Default
    private List<String> planSteps = new ArrayList<>();
    private int currentPlanStep;
    private boolean planCreated;
    @Builder.Default
    private List<String> requiredFiles = new ArrayList<>();

    // Execution
    @Builder.Default
    private List<String> modifiedFiles = new ArrayList<>();
    @Builder.Default
    private List<String> deletedFiles = new ArrayList<>();
    @Builder.Default
    private List<ToolExecutionResult> toolResults = new ArrayList<>();
    @Builder.Default
    private Set<String> executedToolCallIds = new LinkedHashSet<>();
    private int fileChangesCount;

    // Loop bounds
    private int iterationCount;
    @Builder.Default
    private int maxIterations = 50;
    private boolean forceTermination;

    @Builder.Default
    private TriageDecision triageDecision = TriageDecision.GRAPH;

    // Approval
    private ApprovalStatus lastApprovalStatus;
    private boolean alwaysApproveTools;
    @Builder.Default
    private InputTrustLevel inputTrustLevel = InputTrustLevel.TRUSTED;
    @Builder.Default
    private List<ApprovalHistoryEntry> approvalHistory = new ArrayList<>();

    // Verification
    @Builder.Default
    private VerificationStatus verificationStatus = VerificationStatus.NOT_RUN;
    @Builder.Default
    private List<String> verificationFailedChecks = new ArrayList<>();
    @Builder.Default
    private List<String> verificationNotes = new ArrayList<>();
    private boolean needsAdditionalIteration;

    // Bookkeeping
    private CompletionChecklist completionChecklist;
    private WorkingMemory workingMemory;
    @Builder.Default
    private List<AgentTraceEntry> agentTrace = new ArrayList<>();
    @Builder.Default
    private AgentTraceMetrics traceMetrics = new AgentTraceMetrics();

    private boolean awaitingDiscussInput;
    private String agentError;
    private long totalTokensUsed;

    public void apply(AgentStateUpdate update) {
        if (update == null) {
            return;
        }
        if (update.getMessages() != null) {
            messages.addAll(update.getMessages());
        }
        if (update.getPlanSteps() != null) {
            planSteps = new ArrayList<>(update.getPlanSteps());
        }
        if (update.getCurrentPlanStep() != null) {
            currentPlanStep = update.getCurrentPlanStep();
        }
        if (update.getPlanCreated() != null) {
            planCreated = update.getPlanCreated();
        }
        if (update.getRequiredFiles() != null) {
            requiredFiles = new ArrayList<>(update.getRequiredFiles());
        }
        if (update.getModifiedFiles() != null) {
            modifiedFiles = new ArrayList<>(update.getModifiedFiles());
        }
        if (update.getDeletedFiles() != null) {
            deletedFiles = new ArrayList<>(update.getDeletedFiles());
        }
        if (update.getToolResults() != null) {
            toolResults = new ArrayList<>(update.getToolResults());
        }
        if (update.getExecutedToolCallIds() != null) {
            executedToolCallIds.addAll(update.getExecutedToolCallIds());
        }
        if (update.getFileChangesCount() != null) {
            fileChangesCount += update.getFileChangesCount();
        }
        if (update.getIterationCount() != null) {
            iterationCount = update.getIterationCount();
        }
        if (update.getForceTermination() != null) {
            forceTermination = update.getForceTermination();
        }
        if (update.getTriageDecision() != null) {
            triageDecision = update.getTriageDecision();
        }
        if (update.getLastApprovalStatus() != null) {
            lastApprovalStatus = update.getLastApprovalStatus();
        }
        if (update.getAlwaysApproveTools() != null) {
            alwaysApproveTools = update.getAlwaysApproveTools();
        }
        if (update.getApprovalHistory() != null) {
            approvalHistory.addAll(update.getApprovalHistory());
        }
        if (update.getVerificationStatus() != null) {
            verificationStatus = update.getVerificationStatus();
        }
        if (update.getVerificationFailedChecks() != null) {
            verificationFailedChecks = new ArrayList<>(update.getVerificationFailedChecks());
        }
        if (update.getVerificationNotes() != null) {
            verificationNotes = new ArrayList<>(update.getVerificationNotes());
        }
        if (update.getNeedsAdditionalIteration() != null) {
            needsAdditionalIteration = update.getNeedsAdditionalIteration();
        }
        if (update.getCompletionChecklist() != null) {
            completionChecklist = update.getCompletionChecklist();
        }
        if (update.getWorkingMemory() != null) {
            workingMemory = update.getWorkingMemory();
        }
        if (update.getAwaitingDiscussInput() != null) {
            awaitingDiscussInput = update.getAwaitingDiscussInput();
        }
        if (update.getAgentError() != null) {
            agentError = update.getAgentError();
        }
        if (update.getTokensUsed() != null) {
            totalTokensUsed += update.getTokensUsed();
        }
    }

    public Message lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    /**
     * Content of the most recent user message, or an empty string.
     */
    public String lastUserText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isUserMessage() && message.getContent() != null) {
                return message.getContent();
            }
        }
        return "";
    }

    /**
     * Content of the first user message, which describes the task.
     */
    public String firstUserText() {
        return messages.stream()
                .filter(Message::isUserMessage)
                .map(Message::getContent)
                .filter(content -> content != null && !content.isBlank())
                .findFirst()
                .orElse("");
    }

    public String currentPlanStepText() {
        if (currentPlanStep >= 0 && currentPlanStep < planSteps.size()) {
            return planSteps.get(currentPlanStep);
        }
        return null;
    }

    public boolean hasToolErrors() {
        return toolResults.stream().anyMatch(ToolExecutionResult::hasError);
    }

    public boolean hasAgentError() {
        return agentError != null && !agentError.isEmpty();
    }
}
