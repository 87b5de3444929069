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
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.service.ErrorRecoveryAdvisor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the final assistant message of a run.
 */
@Component
@Slf4j
public class ReporterNode implements PhaseNode {

    static final String TOOL_ERROR_REPORT = "An error occurred during the task. Check the tool results above.";
    private static final String TOOL_CALLING_HINT = "Make sure the configured model supports tool calling.";
    private static final int MAX_LISTED_FILES = 10;

    private final ErrorRecoveryAdvisor recoveryAdvisor;
    private final Clock clock;

    public ReporterNode(ErrorRecoveryAdvisor recoveryAdvisor, Clock clock) {
        this.recoveryAdvisor = recoveryAdvisor;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "reporter";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.REPORTER;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        String report;
        if (state.hasAgentError()) {
            log.info("[Reporter] Agent error detected, generating error summary");
            report = agentErrorReport(state);
        } else if (state.hasToolErrors()) {
            log.info("[Reporter] Tool error detected, generating error report");
            report = TOOL_ERROR_REPORT;
        } else if (state.getIterationCount() >= state.getMaxIterations()) {
            log.info("[Reporter] Max iterations reached, generating warning");
            report = "Reached the maximum number of iterations (" + state.getMaxIterations()
                    + "). The task may be too complex to finish in one run.";
        } else {
            log.info("[Reporter] Normal completion, generating summary");
            report = successReport(state);
        }
        return AgentStateUpdate.builder()
                .messages(List.of(Message.assistant(report, clock.instant())))
                .statusMessage("Final response ready")
                .build();
    }

    private String agentErrorReport(AgentState state) {
        return "Agent execution stopped\n\n"
                + "Error: " + state.getAgentError() + "\n"
                + recoveryAdvisor.recoverySuggestion(state.getAgentError()) + "\n"
                + "Iterations: " + state.getIterationCount() + "\n"
                + "Plan steps: 0/" + state.getPlanSteps().size() + " completed\n\n"
                + TOOL_CALLING_HINT;
    }

    private static String successReport(AgentState state) {
        List<String> parts = new ArrayList<>();
        parts.add("Task completed\n");

        List<String> modified = state.getModifiedFiles();
        List<String> deleted = state.getDeletedFiles();
        if (!modified.isEmpty() || !deleted.isEmpty()) {
            parts.add("Changed files: " + modified.size() + " modified"
                    + (deleted.isEmpty() ? "" : ", " + deleted.size() + " deleted"));
            modified.stream()
                    .limit(MAX_LISTED_FILES)
                    .map(file -> "  - " + file)
                    .forEach(parts::add);
            if (modified.size() > MAX_LISTED_FILES) {
                parts.add("  ... and " + (modified.size() - MAX_LISTED_FILES) + " more");
            }
        }

        parts.add("\nIterations: " + state.getIterationCount());
        List<String> steps = state.getPlanSteps();
        if (!steps.isEmpty()) {
            parts.add("Plan steps: " + Math.min(state.getCurrentPlanStep(), steps.size()) + "/" + steps.size()
                    + " completed");
        }
        return String.join("\n", parts);
    }
}
