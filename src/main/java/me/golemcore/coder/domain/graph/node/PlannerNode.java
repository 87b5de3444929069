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
import me.golemcore.coder.domain.graph.AgentAbortedException;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.service.BuiltinToolRegistry;
import me.golemcore.coder.domain.service.CodebaseAnalyzer;
import me.golemcore.coder.domain.service.PlanParser;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Asks the model for a tagged step list and derives the files the task is
 * expected to touch. Runs once per turn.
 */
@Component
@Slf4j
public class PlannerNode implements PhaseNode {

    private static final Pattern TASK_TYPE_PREFIX = Pattern.compile("^\\[(MODIFICATION|READ-ONLY)]\\s*");

    private final LlmPort llmPort;
    private final BuiltinToolRegistry toolRegistry;
    private final CodebaseAnalyzer codebaseAnalyzer;
    private final CoderProperties properties;
    private final Clock clock;

    public PlannerNode(LlmPort llmPort, BuiltinToolRegistry toolRegistry, CodebaseAnalyzer codebaseAnalyzer,
            CoderProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.codebaseAnalyzer = codebaseAnalyzer;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "planner";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.PLANNER;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        if (state.isPlanCreated()) {
            log.debug("[Planner] Plan already exists, skipping");
            return AgentStateUpdate.empty();
        }
        String userPrompt = state.lastUserText();
        if (userPrompt.isBlank()) {
            return AgentStateUpdate.empty();
        }

        log.info("[Planner] Creating execution plan");
        String planContent;
        try {
            planContent = streamPlan(session, userPrompt);
        } catch (AgentAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Planner] Planning failed: {}", e.getMessage());
            return AgentStateUpdate.builder()
                    .statusMessage("Planning failed: " + e.getMessage())
                    .build();
        }

        List<String> planSteps = PlanParser.parseSteps(planContent);
        Set<String> requiredFiles = new LinkedHashSet<>(PlanParser.extractRequiredFiles(userPrompt));
        requiredFiles.addAll(recommendFiles(session, userPrompt));
        log.info("[Planner] Plan created with {} steps, {} required file(s)", planSteps.size(),
                requiredFiles.size());

        AgentStateUpdate.AgentStateUpdateBuilder update = AgentStateUpdate.builder()
                .messages(List.of(
                        Message.assistant(planContent, clock.instant()),
                        Message.user(CodingPrompts.executionInstruction(userPrompt), clock.instant())))
                .planCreated(true)
                .planSteps(planSteps)
                .currentPlanStep(0)
                .statusMessage("Plan created with " + planSteps.size() + " steps");
        if (!requiredFiles.isEmpty()) {
            update.requiredFiles(new ArrayList<>(requiredFiles));
        }
        return update.build();
    }

    private String streamPlan(AgentSession session, String userPrompt) {
        List<String> toolLines = toolRegistry.getDefinitions(session.getAllowedTools()).stream()
                .map(tool -> "- " + tool.getName() + ": "
                        + (tool.getDescription() != null ? tool.getDescription() : "No description"))
                .toList();
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .messages(List.of(
                        Message.system(CodingPrompts.PLANNER + CodingPrompts.plannerTools(toolLines),
                                clock.instant()),
                        Message.user(CodingPrompts.plannerRequest(userPrompt), clock.instant())))
                .temperature(properties.getLlm().getTemperature())
                .sessionId(session.getConversationId())
                .build();

        StringBuilder plan = new StringBuilder();
        for (LlmChunk chunk : llmPort.chatStream(request).toIterable()) {
            String text = chunk.getText();
            if (text == null || text.isEmpty()) {
                continue;
            }
            plan.append(text);
            String visible = TASK_TYPE_PREFIX.matcher(text).replaceFirst("");
            if (!visible.isEmpty()) {
                session.emit(StreamEvent.builder()
                        .type(StreamEventType.NODE)
                        .conversationId(session.getConversationId())
                        .node(getName())
                        .status("streaming")
                        .content(visible)
                        .build());
            }
        }
        return plan.toString();
    }

    private List<String> recommendFiles(AgentSession session, String userPrompt) {
        if (session.getWorkingDirectory() == null) {
            return List.of();
        }
        try {
            List<String> recommended = codebaseAnalyzer.recommendFiles(userPrompt, session.getWorkingDirectory(),
                    properties.getWorkspace().getAnalyzerDepth(), properties.getWorkspace().getRecommendedFiles());
            if (!recommended.isEmpty()) {
                log.info("[Planner] Recommended files: {}", recommended);
            }
            return recommended;
        } catch (RuntimeException e) {
            log.warn("[Planner] Failed to analyze codebase: {}", e.getMessage());
            return List.of();
        }
    }
}
