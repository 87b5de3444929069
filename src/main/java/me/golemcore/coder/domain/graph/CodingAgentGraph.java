package me.golemcore.coder.domain.graph;

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
import me.golemcore.coder.domain.graph.node.AgentNode;
import me.golemcore.coder.domain.graph.node.ApprovalNode;
import me.golemcore.coder.domain.graph.node.DirectResponseNode;
import me.golemcore.coder.domain.graph.node.DiscussCheckNode;
import me.golemcore.coder.domain.graph.node.IterationGuardNode;
import me.golemcore.coder.domain.graph.node.PhaseNode;
import me.golemcore.coder.domain.graph.node.PlannerNode;
import me.golemcore.coder.domain.graph.node.ReporterNode;
import me.golemcore.coder.domain.graph.node.ToolsNode;
import me.golemcore.coder.domain.graph.node.TriageNode;
import me.golemcore.coder.domain.graph.node.VerifierNode;
import me.golemcore.coder.domain.model.AgentRunResult;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.PauseReason;
import me.golemcore.coder.domain.model.PausedRun;
import me.golemcore.coder.domain.model.ResumeInput;
import me.golemcore.coder.domain.model.RollbackResult;
import me.golemcore.coder.domain.model.RunStatus;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.model.ToolExecutionResult;
import me.golemcore.coder.domain.model.ToolExecutionTransaction;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.model.TriageDecision;
import me.golemcore.coder.domain.model.VerificationStatus;
import me.golemcore.coder.domain.model.WorkspaceDelta;
import me.golemcore.coder.domain.service.AgentTraceCollector;
import me.golemcore.coder.domain.service.FileTracker;
import me.golemcore.coder.domain.service.ToolCallIdempotency;
import me.golemcore.coder.domain.service.ToolTransactionManager;
import me.golemcore.coder.domain.service.WorkingMemoryService;
import me.golemcore.coder.domain.service.WorkspaceScanner;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The coding agent workflow: triage, then either a direct answer or a planned
 * tool-using loop of guard, agent, approval, tools and verifier, closed by a
 * report.
 *
 * <p>
 * A run ends in one of four ways. It completes with a report, halts on a
 * denied approval, pauses when approval or a discussion answer is needed and
 * no callback is registered, or stops on abort or an unexpected failure. A
 * paused session is parked in {@link SuspendedRunRegistry} and continues from
 * {@link #resume(String, ResumeInput)}.
 */
@Component
@Slf4j
public class CodingAgentGraph implements AgentGraph {

    public static final String TYPE = "coding";

    private final TriageNode triageNode;
    private final DirectResponseNode directResponseNode;
    private final PlannerNode plannerNode;
    private final IterationGuardNode iterationGuardNode;
    private final AgentNode agentNode;
    private final DiscussCheckNode discussCheckNode;
    private final ApprovalNode approvalNode;
    private final ToolsNode toolsNode;
    private final VerifierNode verifierNode;
    private final ReporterNode reporterNode;
    private final ToolTransactionManager transactionManager;
    private final WorkspaceScanner workspaceScanner;
    private final WorkingMemoryService workingMemoryService;
    private final ToolCallIdempotency idempotency;
    private final SuspendedRunRegistry suspendedRuns;
    private final CoderProperties properties;
    private final Clock clock;

    @SuppressWarnings("java:S107")
    public CodingAgentGraph(TriageNode triageNode, DirectResponseNode directResponseNode, PlannerNode plannerNode,
            IterationGuardNode iterationGuardNode, AgentNode agentNode, DiscussCheckNode discussCheckNode,
            ApprovalNode approvalNode, ToolsNode toolsNode, VerifierNode verifierNode, ReporterNode reporterNode,
            ToolTransactionManager transactionManager, WorkspaceScanner workspaceScanner,
            WorkingMemoryService workingMemoryService, ToolCallIdempotency idempotency,
            SuspendedRunRegistry suspendedRuns, CoderProperties properties, Clock clock) {
        this.triageNode = triageNode;
        this.directResponseNode = directResponseNode;
        this.plannerNode = plannerNode;
        this.iterationGuardNode = iterationGuardNode;
        this.agentNode = agentNode;
        this.discussCheckNode = discussCheckNode;
        this.approvalNode = approvalNode;
        this.toolsNode = toolsNode;
        this.verifierNode = verifierNode;
        this.reporterNode = reporterNode;
        this.transactionManager = transactionManager;
        this.workspaceScanner = workspaceScanner;
        this.workingMemoryService = workingMemoryService;
        this.idempotency = idempotency;
        this.suspendedRuns = suspendedRuns;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public AgentRunResult start(AgentSession session, String userMessage) {
        log.info("[Orchestrator] Starting run for conversation {}", session.getConversationId());
        return guarded(session, () -> {
            initialize(session, userMessage);
            AgentState state = session.getState();

            runNode(session, triageNode);
            session.getTrace().decision(TracePhase.TRIAGE,
                    "triage: " + state.getTriageDecision().name().toLowerCase(Locale.ROOT), 0);
            if (state.getTriageDecision() == TriageDecision.DIRECT_RESPONSE) {
                runNode(session, directResponseNode);
                end(session, "completed", null);
                return AgentRunResult.of(RunStatus.DIRECT_RESPONSE, state);
            }

            runNode(session, plannerNode);
            return runLoop(session, false);
        });
    }

    @Override
    public AgentRunResult resume(String resumeToken, ResumeInput input) {
        return continueRun(suspendedRuns.claim(resumeToken), input);
    }

    @Override
    public Flux<StreamEvent> stream(AgentSession session, String userMessage) {
        return events(session, () -> start(session, userMessage));
    }

    @Override
    public Flux<StreamEvent> resumeStream(String resumeToken, ResumeInput input) {
        return Flux.defer(() -> {
            SuspendedRunRegistry.SuspendedRun run = suspendedRuns.claim(resumeToken);
            return events(run.session(), () -> continueRun(run, input));
        });
    }

    private Flux<StreamEvent> events(AgentSession session, Supplier<AgentRunResult> run) {
        return Flux.create(sink -> {
            session.setEventSink(sink::next);
            sink.onCancel(session::abort);
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    AgentRunResult result = run.get();
                    log.debug("[Orchestrator] Stream for {} finished with {}", session.getConversationId(),
                            result.status());
                } finally {
                    session.setEventSink(null);
                    sink.complete();
                }
            });
        });
    }

    private AgentRunResult continueRun(SuspendedRunRegistry.SuspendedRun run, ResumeInput input) {
        AgentSession session = run.session();
        log.info("[Orchestrator] Resuming {} after {}", session.getConversationId(), run.reason());
        return guarded(session, () -> switch (run.reason()) {
        case TOOL_APPROVAL -> resumeAfterApproval(session, input);
        case DISCUSSION -> resumeAfterDiscussion(session, input);
        });
    }

    private AgentRunResult resumeAfterApproval(AgentSession session, ResumeInput input) {
        boolean approved = input != null && Boolean.TRUE.equals(input.approved());
        AgentState state = session.getState();
        state.apply(approvalNode.resolveUserVerdict(session, approved));
        refreshMemory(session, approved ? "User approved tool execution" : "User denied tool approval", null);
        if (!approved) {
            return halt(session);
        }
        return runLoop(session, true);
    }

    private AgentRunResult resumeAfterDiscussion(AgentSession session, ResumeInput input) {
        AgentState state = session.getState();
        int stepIndex = Math.max(0, state.getCurrentPlanStep() - 1);
        state.apply(discussCheckNode.answer(session, stepIndex, input != null ? input.answer() : null));
        session.setJustResumedFromDiscuss(true);
        return runLoop(session, false);
    }

    private void initialize(AgentSession session, String userMessage) {
        int maxIterations = session.getMaxIterations() != null
                ? session.getMaxIterations()
                : properties.getLoop().getMaxIterations();
        List<Message> messages = new ArrayList<>(session.getHistory());
        messages.add(Message.user(userMessage, clock.instant()));

        AgentState state = AgentState.builder()
                .conversationId(session.getConversationId())
                .workingDirectory(session.getWorkingDirectory().toString())
                .messages(messages)
                .maxIterations(maxIterations)
                .inputTrustLevel(session.getInputTrustLevel())
                .alwaysApproveTools(session.isAlwaysApproveTools())
                .build();
        session.setState(state);
        session.setTrace(new AgentTraceCollector(clock, properties.getTrace().getMaxEntries()));
        session.setFileTracker(new FileTracker(clock, properties.getTransaction().getMaxRollbackPoints(),
                properties.getTransaction().getMaxSnapshotsPerFile()));
        session.setRepeatGuard(new RepeatedCallGuard(properties.getLoop().getMaxConsecutiveRepeats()));
        session.setBaselineSnapshot(workspaceScanner.snapshot(session.getWorkingDirectory()));
        refreshMemory(session, "Starting coding agent execution", null);
    }

    /**
     * The planned execution loop. With {@code approvedBatchPending} the first
     * pass skips straight to executing the batch the user just approved.
     */
    private AgentRunResult runLoop(AgentSession session, boolean approvedBatchPending) {
        AgentState state = session.getState();
        boolean executeWithoutAgent = approvedBatchPending;

        while (true) {
            if (!executeWithoutAgent) {
                runNode(session, iterationGuardNode);
                if (state.isForceTermination()) {
                    break;
                }

                AgentStateUpdate agentUpdate = runNode(session, agentNode);
                refreshMemory(session, agentUpdate.getStatusMessage(), null);
                if (state.hasAgentError()) {
                    log.info("[Orchestrator] Agent error detected, ending loop");
                    session.getTrace().error(TracePhase.AGENT, state.getAgentError(), state.getIterationCount());
                    break;
                }

                if (discussCheckNode.isPending(state)) {
                    runNode(session, discussCheckNode);
                    if (state.isAwaitingDiscussInput()) {
                        return pause(session, PauseReason.DISCUSSION);
                    }
                    session.setJustResumedFromDiscuss(true);
                    continue;
                }

                List<Message.ToolCall> pending = idempotency.pendingToolCalls(state);
                if (pending.isEmpty()) {
                    runNode(session, verifierNode);
                    if (state.isAwaitingDiscussInput()) {
                        if (askDiscussFallback(session)) {
                            return pause(session, PauseReason.DISCUSSION);
                        }
                        continue;
                    }
                    if (!state.isNeedsAdditionalIteration()) {
                        break;
                    }
                    if (!session.isJustResumedFromDiscuss() && hasExistingWork(state)
                            && state.getVerificationStatus() != VerificationStatus.FAILED) {
                        log.info("[Orchestrator] No tool calls with existing work done, treating as completion");
                        break;
                    }
                    session.setJustResumedFromDiscuss(false);
                    continue;
                }

                if (session.getRepeatGuard().recordAndCheck(pending)) {
                    int count = session.getRepeatGuard().getConsecutiveRepeats() + 1;
                    log.info("[Orchestrator] {} consecutive identical tool calls, ending loop", count);
                    state.apply(AgentStateUpdate.builder()
                            .messages(List.of(Message.assistant("Identical tool call detected " + count
                                    + " times in a row, stopping execution.", clock.instant())))
                            .build());
                    break;
                }

                runNode(session, approvalNode);
                ApprovalStatus approval = state.getLastApprovalStatus();
                refreshMemory(session, "Approval: " + approval.getValue(), null);
                if (approval == ApprovalStatus.DENIED) {
                    return halt(session);
                }
                if (approval == ApprovalStatus.FEEDBACK) {
                    return pause(session, PauseReason.TOOL_APPROVAL);
                }
            }
            executeWithoutAgent = false;

            executeBatch(session);
            if (state.isAwaitingDiscussInput()) {
                if (askDiscussFallback(session)) {
                    return pause(session, PauseReason.DISCUSSION);
                }
                continue;
            }
            if (!state.isNeedsAdditionalIteration()) {
                log.info("[Orchestrator] Verification indicates completion, ending loop");
                break;
            }
        }
        return report(session);
    }

    private void executeBatch(AgentSession session) {
        AgentState state = session.getState();
        List<Message.ToolCall> pending = idempotency.pendingToolCalls(state);
        ToolExecutionTransaction transaction = transactionManager.begin(pending, session.getWorkingDirectory());

        AgentStateUpdate toolsUpdate = runNode(session, toolsNode);
        List<ToolExecutionResult> results = toolsUpdate.getToolResults() != null
                ? toolsUpdate.getToolResults()
                : List.of();
        for (ToolExecutionResult result : results) {
            session.getTrace().toolResult(result.getToolName(), !result.hasError(), result.getDurationMs(),
                    state.getIterationCount());
        }
        refreshMemory(session, null, results.isEmpty()
                ? "No tool results"
                : results.stream()
                        .map(result -> result.getToolName() + (result.hasError() ? ": error" : ": success"))
                        .collect(Collectors.joining(", ")));

        runNode(session, verifierNode);
        if (state.getVerificationStatus() == VerificationStatus.FAILED) {
            rollbackBatch(session, transaction);
        }
    }

    private void rollbackBatch(AgentSession session, ToolExecutionTransaction transaction) {
        AgentState state = session.getState();
        boolean scriptPending = state.getVerificationFailedChecks()
                .contains(VerifierNode.FAILED_CHECK_SCRIPT_NOT_EXECUTED);
        ToolExecutionTransaction target = scriptPending ? transactionManager.withoutScripts(transaction) : transaction;
        RollbackResult result = transactionManager.rollback(target);

        String reasons = String.join("\n", state.getVerificationNotes());
        String reasonSuffix = reasons.isEmpty() ? "" : "\n\nFailure reasons:\n" + reasons;
        String content;
        if (result.hasErrors()) {
            content = "Verification failed and some changes could not be rolled back:\n"
                    + String.join("\n", result.errors()) + reasonSuffix;
        } else if (scriptPending && result.restored() == 0 && result.deleted() == 0) {
            content = "Verification failed: a script was written but not executed. The script files are kept. "
                    + "Run them with command_execute in the next attempt." + reasonSuffix;
        } else {
            content = "Verification failed, staged changes were rolled back. Restored: " + result.restored()
                    + ", removed: " + result.deleted() + reasonSuffix;
        }

        WorkspaceDelta delta = workspaceScanner.detectChanges(session.getBaselineSnapshot(),
                workspaceScanner.snapshot(session.getWorkingDirectory()));
        state.setModifiedFiles(new ArrayList<>(delta.changed()));
        state.setDeletedFiles(new ArrayList<>(delta.deleted()));
        state.setFileChangesCount(delta.size());
        state.apply(AgentStateUpdate.builder()
                .messages(List.of(Message.assistant(content, clock.instant())))
                .build());
        refreshMemory(session, "Verification failed; rolled back staged tool changes", null);
        syncTrace(session);
    }

    /**
     * Asks about a discussion step the verifier stopped on. Returns true when
     * the run has to wait for the answer.
     */
    private boolean askDiscussFallback(AgentSession session) {
        AgentState state = session.getState();
        int stepIndex = Math.max(0, state.getCurrentPlanStep() - 1);
        state.apply(discussCheckNode.request(session, stepIndex));
        if (state.isAwaitingDiscussInput()) {
            return true;
        }
        state.setNeedsAdditionalIteration(true);
        session.setJustResumedFromDiscuss(true);
        return false;
    }

    private static boolean hasExistingWork(AgentState state) {
        return !state.getToolResults().isEmpty() || !state.getModifiedFiles().isEmpty();
    }

    private AgentStateUpdate runNode(AgentSession session, PhaseNode node) {
        session.checkNotAborted();
        AgentState state = session.getState();
        TracePhase phase = node.getTracePhase();
        session.setActivePhase(phase);
        emitNode(session, node.getName(), "starting", null);
        if (phase != null) {
            session.getTrace().startNode(phase, state.getIterationCount());
        }

        AgentStateUpdate update = node.execute(session);
        state.apply(update);

        if (phase != null) {
            session.getTrace().endNode(phase, state.getIterationCount(), traceMetadata(update));
        }
        syncTrace(session);
        emitNode(session, node.getName(), "completed", update.getStatusMessage());
        return update;
    }

    private AgentRunResult pause(AgentSession session, PauseReason reason) {
        session.checkNotAborted();
        String token = suspendedRuns.suspend(session, reason);
        log.info("[Orchestrator] Stream paused: awaiting {}", reason == PauseReason.DISCUSSION
                ? "discuss input"
                : "tool approval");
        end(session, "paused", token);
        return AgentRunResult.paused(session.getState(), new PausedRun(reason, token));
    }

    private AgentRunResult halt(AgentSession session) {
        log.info("[Orchestrator] Stream halted: tool execution rejected");
        session.getTrace().decision(TracePhase.APPROVAL, "halted", session.currentIteration());
        end(session, "halted", null);
        return AgentRunResult.of(RunStatus.HALTED, session.getState());
    }

    private AgentRunResult report(AgentSession session) {
        AgentState state = session.getState();
        log.info("[Orchestrator] Loop finished after {} iteration(s)", state.getIterationCount());
        runNode(session, reporterNode);
        Message report = state.lastMessage();
        if (report != null && report.isAssistantMessage()) {
            session.emit(StreamEvent.builder()
                    .type(StreamEventType.NODE)
                    .conversationId(session.getConversationId())
                    .node(reporterNode.getName())
                    .status("streaming")
                    .content(report.getContent())
                    .build());
        }
        refreshMemory(session, "Reporter generated final output", null);
        end(session, "completed", null);
        return AgentRunResult.of(RunStatus.COMPLETED, state);
    }

    private AgentRunResult guarded(AgentSession session, Supplier<AgentRunResult> run) {
        try {
            return run.get();
        } catch (AgentAbortedException e) {
            log.info("[Orchestrator] Run for {} aborted", session.getConversationId());
            return AgentRunResult.of(RunStatus.ABORTED, session.getState());
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : "Graph execution failed";
            log.error("[Orchestrator] Run for {} failed", session.getConversationId(), e);
            if (session.getTrace() != null) {
                TracePhase phase = session.getActivePhase() != null ? session.getActivePhase() : TracePhase.REPORTER;
                session.getTrace().error(phase, message, session.currentIteration());
                syncTrace(session);
            }
            if (!session.isAborted()) {
                session.emit(StreamEvent.builder()
                        .type(StreamEventType.ERROR)
                        .conversationId(session.getConversationId())
                        .error(message)
                        .build());
            }
            return AgentRunResult.failed(session.getState(), message);
        }
    }

    private void end(AgentSession session, String status, String resumeToken) {
        syncTrace(session);
        session.emit(StreamEvent.builder()
                .type(StreamEventType.END)
                .conversationId(session.getConversationId())
                .status(status)
                .iteration(session.currentIteration())
                .traceMetrics(session.getTrace().getMetrics())
                .resumeToken(resumeToken)
                .build());
    }

    private void emitNode(AgentSession session, String node, String status, String statusMessage) {
        AgentState state = session.getState();
        session.emit(StreamEvent.builder()
                .type(StreamEventType.NODE)
                .conversationId(session.getConversationId())
                .node(node)
                .status(status)
                .statusMessage(statusMessage)
                .iteration(state.getIterationCount())
                .maxIterations(state.getMaxIterations())
                .traceMetrics(state.getTraceMetrics())
                .build());
    }

    private void refreshMemory(AgentSession session, String decisionNote, String toolOutcome) {
        AgentState state = session.getState();
        state.setWorkingMemory(workingMemoryService.refresh(state, decisionNote, toolOutcome));
    }

    private static void syncTrace(AgentSession session) {
        AgentState state = session.getState();
        state.setAgentTrace(session.getTrace().getEntries());
        state.setTraceMetrics(session.getTrace().getMetrics());
    }

    private static Map<String, Object> traceMetadata(AgentStateUpdate update) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (update.getVerificationStatus() != null) {
            metadata.put("verificationStatus", update.getVerificationStatus().name().toLowerCase(Locale.ROOT));
        }
        if (update.getNeedsAdditionalIteration() != null) {
            metadata.put("needsAdditionalIteration", update.getNeedsAdditionalIteration());
        }
        if (update.getLastApprovalStatus() != null) {
            metadata.put("status", update.getLastApprovalStatus().getValue());
        }
        if (update.getToolResults() != null) {
            metadata.put("toolCalls", update.getToolResults().size());
            metadata.put("errors", update.getToolResults().stream().filter(ToolExecutionResult::hasError).count());
        }
        if (update.getAgentError() != null) {
            metadata.put("hasAgentError", true);
        }
        return metadata;
    }
}
