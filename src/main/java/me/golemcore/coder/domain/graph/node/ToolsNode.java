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
import me.golemcore.coder.domain.approval.RiskPatternTable;
import me.golemcore.coder.domain.approval.ToolApprovalRiskAnalyzer;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.FileChange;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolExecutionResult;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.model.WorkspaceDelta;
import me.golemcore.coder.domain.model.WorkspaceFileInfo;
import me.golemcore.coder.domain.service.FileTracker;
import me.golemcore.coder.domain.service.ToolCallExecutionService;
import me.golemcore.coder.domain.service.ToolCallIdempotency;
import me.golemcore.coder.domain.service.ToolStatusMessages;
import me.golemcore.coder.domain.service.ToolUsageStatistics;
import me.golemcore.coder.domain.service.WorkspaceScanner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Executes the approved tool batch one call at a time and records what it
 * changed in the workspace.
 */
@Component
@Slf4j
public class ToolsNode implements PhaseNode {

    private final ToolCallExecutionService executionService;
    private final ToolCallIdempotency idempotency;
    private final WorkspaceScanner workspaceScanner;
    private final ToolUsageStatistics usageStatistics;
    private final Clock clock;

    public ToolsNode(ToolCallExecutionService executionService, ToolCallIdempotency idempotency,
            WorkspaceScanner workspaceScanner, ToolUsageStatistics usageStatistics, Clock clock) {
        this.executionService = executionService;
        this.idempotency = idempotency;
        this.workspaceScanner = workspaceScanner;
        this.usageStatistics = usageStatistics;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "tools";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.TOOLS;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        List<Message.ToolCall> pending = idempotency.pendingToolCalls(state);
        if (pending.isEmpty()) {
            log.debug("[Tools] No pending tool calls");
            return AgentStateUpdate.builder()
                    .statusMessage("No pending tool calls")
                    .build();
        }

        Path workingDirectory = session.getWorkingDirectory();
        Map<String, WorkspaceFileInfo> before = workspaceScanner.snapshot(workingDirectory);
        reportOptimizations(session, pending);

        ToolExecutionContext context = new ToolExecutionContext(workingDirectory, session.getConversationId());
        FileTracker fileTracker = session.getFileTracker();
        List<ToolExecutionResult> results = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        List<FileChange> changes = new ArrayList<>();

        for (Message.ToolCall call : pending) {
            session.emit(StreamEvent.builder()
                    .type(StreamEventType.NODE)
                    .conversationId(session.getConversationId())
                    .node(getName())
                    .status("executing")
                    .statusMessage(ToolStatusMessages.describe(List.of(call), false))
                    .iteration(state.getIterationCount())
                    .build());

            String trackedPath = isFileMutation(call) ? resolveTrackedPath(workingDirectory, call) : null;
            if (trackedPath != null) {
                fileTracker.trackBeforeModify(trackedPath);
            }
            ToolExecutionResult result = executionService.execute(call, context, session.getAllowedTools());
            if (trackedPath != null && !result.hasError()) {
                fileTracker.trackAfterModify(trackedPath).ifPresent(changes::add);
            }
            results.add(result);
            messages.add(Message.toolResult(call.getId(), call.getName(),
                    ToolCallExecutionService.toMessageContent(result), clock.instant()).toBuilder()
                    .id("tool-" + call.getId())
                    .build());
        }

        if (!changes.isEmpty()) {
            fileTracker.createRollbackPoint("After iteration " + state.getIterationCount(), changes);
        }

        WorkspaceDelta delta = workspaceScanner.detectChanges(before, workspaceScanner.snapshot(workingDirectory));
        if (delta.size() > 0) {
            log.info("[Tools] Workspace changes: {} added, {} modified, {} deleted", delta.added().size(),
                    delta.modified().size(), delta.deleted().size());
        }

        AgentStateUpdate.AgentStateUpdateBuilder update = AgentStateUpdate.builder()
                .toolResults(results)
                .messages(messages)
                .executedToolCallIds(idempotency.merge(Set.of(), pending))
                .statusMessage(completionStatus(results));
        if (delta.size() > 0) {
            update.fileChangesCount(delta.size())
                    .modifiedFiles(mergeModified(state.getModifiedFiles(), delta))
                    .deletedFiles(mergeDeleted(state.getDeletedFiles(), delta));
        }
        return update.build();
    }

    private void reportOptimizations(AgentSession session, List<Message.ToolCall> pending) {
        List<Message.ToolCall> redundant = usageStatistics.detectRedundantCalls(pending);
        if (!redundant.isEmpty()) {
            log.info("[Tools] {} redundant tool call(s) in batch", redundant.size());
        }
        List<String> suggestions = usageStatistics.suggestOptimization(pending);
        if (!suggestions.isEmpty()) {
            session.emit(StreamEvent.builder()
                    .type(StreamEventType.NODE)
                    .conversationId(session.getConversationId())
                    .node(getName())
                    .status("suggestion")
                    .content(String.join("\n", suggestions))
                    .build());
        }
    }

    private static boolean isFileMutation(Message.ToolCall call) {
        return RiskPatternTable.FILE_MUTATION_TOOLS.contains(call.getName());
    }

    private static String resolveTrackedPath(Path workingDirectory, Message.ToolCall call) {
        String path = ToolApprovalRiskAnalyzer.extractPath(call);
        if (path == null || path.isBlank()) {
            return null;
        }
        Path candidate = Path.of(path);
        Path resolved = candidate.isAbsolute() || workingDirectory == null
                ? candidate
                : workingDirectory.resolve(candidate);
        return resolved.normalize().toString();
    }

    private static List<String> mergeModified(List<String> existing, WorkspaceDelta delta) {
        Set<String> merged = new LinkedHashSet<>(existing);
        merged.addAll(delta.changed());
        delta.deleted().forEach(merged::remove);
        return new ArrayList<>(merged);
    }

    private static List<String> mergeDeleted(List<String> existing, WorkspaceDelta delta) {
        Set<String> merged = new LinkedHashSet<>(existing);
        merged.addAll(delta.deleted());
        delta.added().forEach(merged::remove);
        return new ArrayList<>(merged);
    }

    private static String completionStatus(List<ToolExecutionResult> results) {
        String names = results.stream()
                .map(ToolExecutionResult::getToolName)
                .distinct()
                .collect(Collectors.joining(", "));
        boolean errors = results.stream().anyMatch(ToolExecutionResult::hasError);
        return "Completed " + names + (errors ? " (with errors)" : "");
    }
}
