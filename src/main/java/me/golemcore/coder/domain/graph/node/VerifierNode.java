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
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.model.VerificationCheck;
import me.golemcore.coder.domain.model.VerificationResult;
import me.golemcore.coder.domain.model.VerificationStatus;
import me.golemcore.coder.domain.service.CompletionChecklistBuilder;
import me.golemcore.coder.domain.service.PlanParser;
import me.golemcore.coder.domain.service.VerificationPipeline;
import me.golemcore.coder.domain.service.WorkingMemoryService;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether the run is done after a turn.
 *
 * <p>
 * Checks run in a fixed order: a pending {@code [DISCUSS]} step, a plan that
 * has not been acted on yet, the automated verification pipeline, required
 * files that were never touched, and finally plan progress. The first check
 * that has something to say determines the update. Every outcome carries a
 * freshly built completion checklist and working memory.
 */
@Component
@Slf4j
public class VerifierNode implements PhaseNode {

    public static final String FAILED_CHECK_REQUIRED_FILES = "required_files";
    public static final String FAILED_CHECK_SCRIPT_NOT_EXECUTED = "script_not_executed";

    static final String PLAN_NOT_EXECUTED_REMINDER = "The plan is ready. "
            + "Now use the tools to actually carry out the work.";
    private static final String SCRIPT_NOT_EXECUTED_HINT = "A script was written but never executed. "
            + "Call file_write and command_execute in the same response. "
            + "Install script dependencies from inside the script instead of asking the user to run pip install.";
    private static final int FAILURE_DETAILS_PREVIEW = 200;

    private final VerificationPipeline verificationPipeline;
    private final CompletionChecklistBuilder checklistBuilder;
    private final WorkingMemoryService workingMemoryService;
    private final CoderProperties properties;
    private final Clock clock;

    public VerifierNode(VerificationPipeline verificationPipeline, CompletionChecklistBuilder checklistBuilder,
            WorkingMemoryService workingMemoryService, CoderProperties properties, Clock clock) {
        this.verificationPipeline = verificationPipeline;
        this.checklistBuilder = checklistBuilder;
        this.workingMemoryService = workingMemoryService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "verifier";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.VERIFIER;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        List<String> planSteps = state.getPlanSteps();
        int currentStep = state.getCurrentPlanStep();

        if (PlanParser.isDiscussStep(state.currentPlanStepText())) {
            log.info("[Verifier] Discuss step at {}/{}, awaiting user input", currentStep + 1, planSteps.size());
            AgentStateUpdate update = AgentStateUpdate.builder()
                    .currentPlanStep(currentStep + 1)
                    .awaitingDiscussInput(true)
                    .needsAdditionalIteration(false)
                    .statusMessage("Waiting for user input")
                    .build();
            return withBookkeeping(state, update, VerificationStatus.PASSED, List.of(),
                    "Discuss step: awaiting user input");
        }

        if (state.isPlanCreated() && state.getToolResults().isEmpty()) {
            log.info("[Verifier] Plan created but no tools executed yet");
            AgentStateUpdate update = AgentStateUpdate.builder()
                    .messages(List.of(Message.user(PLAN_NOT_EXECUTED_REMINDER, clock.instant())))
                    .verificationNotes(List.of("Plan ready, awaiting execution"))
                    .needsAdditionalIteration(true)
                    .statusMessage("Need more iterations")
                    .build();
            return withBookkeeping(state, update, VerificationStatus.NOT_RUN, List.of(),
                    "Plan exists but no tool execution yet");
        }

        AgentStateUpdate pipelineFailure = runPipeline(session);
        if (pipelineFailure != null) {
            return pipelineFailure;
        }

        List<String> modifiedFiles = state.getModifiedFiles();
        List<String> missing = state.getRequiredFiles().stream()
                .filter(required -> modifiedFiles.stream()
                        .noneMatch(changed -> PlanParser.pathMatchesRequirement(changed, required)))
                .toList();
        if (!modifiedFiles.isEmpty() && !missing.isEmpty()
                && state.getIterationCount() < properties.getLoop().getRequiredFilesIterationLimit()) {
            return requiredFilesMissing(state, missing);
        }

        if (!planSteps.isEmpty() && currentStep < planSteps.size() - 1) {
            log.info("[Verifier] Advancing to next plan step ({}/{})", currentStep + 1, planSteps.size());
            emitContent(session, "Step " + (currentStep + 1) + "/" + planSteps.size() + " done. Next: "
                    + planSteps.get(currentStep + 1));
            AgentStateUpdate update = AgentStateUpdate.builder()
                    .currentPlanStep(currentStep + 1)
                    .verificationNotes(List.of("Step completed, moving to next"))
                    .needsAdditionalIteration(true)
                    .statusMessage("Verification complete - continuing")
                    .build();
            return withBookkeeping(state, update, VerificationStatus.PASSED, List.of(),
                    "Plan step " + (currentStep + 1) + " completed");
        }

        log.info("[Verifier] Execution validated");
        AgentStateUpdate update = AgentStateUpdate.builder()
                .verificationNotes(List.of("Execution complete"))
                .needsAdditionalIteration(false)
                .statusMessage("Verification complete - task finished")
                .build();
        return withBookkeeping(state, update, VerificationStatus.PASSED, List.of(), "Execution validated as complete");
    }

    /**
     * Runs the automated checks over the modified files. Returns the failure
     * update, or null when the checks passed, were skipped or could not run.
     */
    private AgentStateUpdate runPipeline(AgentSession session) {
        AgentState state = session.getState();
        if (state.getModifiedFiles().isEmpty()) {
            return null;
        }
        VerificationResult result;
        try {
            result = verificationPipeline.verify(state.getModifiedFiles(), session.getWorkingDirectory());
        } catch (RuntimeException e) {
            log.warn("[Verifier] Verification pipeline error, continuing: {}", e.getMessage());
            return null;
        }

        if (result.isAllPassed()) {
            String executed = result.getExecutedCommands().isEmpty()
                    ? "- (no checks executed)"
                    : result.getExecutedCommands().stream()
                            .map(command -> "- `" + command + "`")
                            .collect(Collectors.joining("\n"));
            emitContent(session, "Automated verification passed\n" + executed);
            return null;
        }

        List<VerificationCheck> failed = result.failedChecks();
        log.info("[Verifier] Verification failed: {}",
                failed.stream().map(VerificationCheck::getName).collect(Collectors.joining(", ")));
        String content = "Code verification failed:\n"
                + failed.stream().map(VerifierNode::describeFailure).collect(Collectors.joining("\n"))
                + "\n\n" + String.join("\n", result.getSuggestions())
                + "\n\nFix the problems above before continuing.";
        AgentStateUpdate update = AgentStateUpdate.builder()
                .messages(List.of(Message.user(content, clock.instant())))
                .verificationNotes(failed.stream()
                        .map(check -> check.getName() + ": " + check.getMessage()
                                + (check.getCommand() != null ? " (" + check.getCommand() + ")" : ""))
                        .toList())
                .needsAdditionalIteration(true)
                .statusMessage("Verification failed")
                .build();
        return withBookkeeping(state, update, VerificationStatus.FAILED,
                failed.stream().map(VerificationCheck::getName).toList(),
                "Automated verification failed; additional iteration required");
    }

    private AgentStateUpdate requiredFilesMissing(AgentState state, List<String> missing) {
        String missingList = String.join(", ", missing);
        log.info("[Verifier] Missing required files: {}", missingList);
        boolean scriptWritten = state.getModifiedFiles().stream()
                .anyMatch(file -> file.endsWith(".py") || file.endsWith(".sh"));

        String content = "These files have not been modified yet: " + missingList;
        if (scriptWritten) {
            content += "\n\n" + SCRIPT_NOT_EXECUTED_HINT;
        }
        AgentStateUpdate update = AgentStateUpdate.builder()
                .messages(List.of(Message.user(content, clock.instant())))
                .verificationNotes(List.of("Required files not modified"))
                .needsAdditionalIteration(true)
                .statusMessage("Required files missing")
                .build();
        return withBookkeeping(state, update, VerificationStatus.FAILED,
                scriptWritten
                        ? List.of(FAILED_CHECK_REQUIRED_FILES, FAILED_CHECK_SCRIPT_NOT_EXECUTED)
                        : List.of(FAILED_CHECK_REQUIRED_FILES),
                scriptWritten
                        ? "Script created but not executed. Missing output: " + missingList
                        : "Required files still missing: " + missingList);
    }

    private AgentStateUpdate withBookkeeping(AgentState state, AgentStateUpdate update, VerificationStatus status,
            List<String> failedChecks, String decisionNote) {
        int nextStep = update.getCurrentPlanStep() != null ? update.getCurrentPlanStep() : state.getCurrentPlanStep();
        update.setVerificationStatus(status);
        update.setVerificationFailedChecks(failedChecks);
        update.setCompletionChecklist(checklistBuilder.build(CompletionChecklistBuilder.Input.builder()
                .taskSummary(state.lastUserText())
                .requiredFiles(state.getRequiredFiles())
                .modifiedFiles(state.getModifiedFiles())
                .planSteps(state.getPlanSteps())
                .currentPlanStep(nextStep)
                .verificationStatus(status)
                .verificationFailedChecks(failedChecks)
                .hadExecutionError(state.hasAgentError() || state.hasToolErrors())
                .build()));
        update.setWorkingMemory(workingMemoryService.refresh(state, nextStep, state.getModifiedFiles(),
                state.getDeletedFiles(), decisionNote, null));
        return update;
    }

    private void emitContent(AgentSession session, String content) {
        session.emit(StreamEvent.builder()
                .type(StreamEventType.NODE)
                .conversationId(session.getConversationId())
                .node(getName())
                .status("streaming")
                .content(content)
                .build());
    }

    private static String describeFailure(VerificationCheck check) {
        String details = check.getDetails() != null ? check.getDetails() : "";
        if (details.length() > FAILURE_DETAILS_PREVIEW) {
            details = details.substring(0, FAILURE_DETAILS_PREVIEW);
        }
        return "- " + check.getMessage() + (check.getCommand() != null ? " [" + check.getCommand() + "]" : "")
                + ": " + details;
    }
}
