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
import me.golemcore.coder.domain.graph.DiscussInputCallback;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.service.PlanParser;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Handles {@code [DISCUSS]} plan steps: moves the plan cursor past the step and
 * asks the user. Without a discussion callback the run waits for a resume.
 */
@Component
@Slf4j
public class DiscussCheckNode implements PhaseNode {

    static final String SKIPPED_ANSWER = "(skipped - continue)";

    private static final Pattern DISCUSS_TAG = Pattern.compile("(?i)\\[DISCUSS]\\s*");

    private final Clock clock;

    public DiscussCheckNode(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "discuss_check";
    }

    public boolean isPending(AgentState state) {
        return state.isPlanCreated() && PlanParser.isDiscussStep(state.currentPlanStepText());
    }

    /**
     * Advances past the current {@code [DISCUSS]} step and asks about it.
     */
    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        if (!isPending(state)) {
            return AgentStateUpdate.empty();
        }
        int stepIndex = state.getCurrentPlanStep();
        AgentStateUpdate update = request(session, stepIndex);
        update.setCurrentPlanStep(stepIndex + 1);
        return update;
    }

    /**
     * Emits the discussion request for a step and, when a callback is
     * registered, waits for the answer.
     */
    public AgentStateUpdate request(AgentSession session, int stepIndex) {
        List<String> steps = session.getState().getPlanSteps();
        String question = stepIndex < steps.size() ? DISCUSS_TAG.matcher(steps.get(stepIndex)).replaceFirst("") : "";
        log.info("[Discuss] Requesting user input for step {}", stepIndex + 1);
        session.emit(StreamEvent.builder()
                .type(StreamEventType.COWORK_DISCUSS_REQUEST)
                .conversationId(session.getConversationId())
                .node(getName())
                .stepIndex(stepIndex)
                .question(question)
                .build());

        DiscussInputCallback callback = session.getDiscussCallback();
        if (callback == null) {
            return AgentStateUpdate.builder()
                    .awaitingDiscussInput(true)
                    .statusMessage("Waiting for user input on step " + (stepIndex + 1))
                    .build();
        }
        String answer;
        try {
            answer = callback.requestInput(stepIndex, question).join();
        } catch (RuntimeException e) {
            log.warn("[Discuss] Discussion callback failed, continuing without input: {}", e.getMessage());
            answer = null;
        }
        return answer(session, stepIndex, answer);
    }

    /**
     * Records the user's answer as a user message and clears the waiting flag.
     */
    public AgentStateUpdate answer(AgentSession session, int stepIndex, String answer) {
        String text = answer != null && !answer.isBlank() ? answer.trim() : SKIPPED_ANSWER;
        session.emit(StreamEvent.builder()
                .type(StreamEventType.COWORK_DISCUSS_RESPONSE)
                .conversationId(session.getConversationId())
                .node(getName())
                .stepIndex(stepIndex)
                .answer(text)
                .build());
        return AgentStateUpdate.builder()
                .messages(List.of(Message.user(text, clock.instant())))
                .awaitingDiscussInput(false)
                .statusMessage("User answered step " + (stepIndex + 1))
                .build();
    }
}
