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
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Counts loop iterations and forces termination at the cap.
 */
@Component
@Slf4j
public class IterationGuardNode implements PhaseNode {

    @Override
    public String getName() {
        return "iteration_guard";
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        int iteration = state.getIterationCount();
        int max = state.getMaxIterations();
        if (iteration >= max) {
            log.info("[IterationGuard] Max iterations reached ({}/{}), forcing termination", iteration, max);
            return AgentStateUpdate.builder()
                    .forceTermination(true)
                    .verificationNotes(List.of("Iteration limit reached (" + iteration + "/" + max + ")"))
                    .statusMessage("Iteration limit reached")
                    .build();
        }
        log.debug("[IterationGuard] Iteration {}/{}", iteration + 1, max);
        return AgentStateUpdate.builder()
                .iterationCount(iteration + 1)
                .needsAdditionalIteration(false)
                .statusMessage("Iteration " + (iteration + 1) + "/" + max)
                .build();
    }
}
