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

import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.TracePhase;

/**
 * One phase of the coding-agent loop.
 *
 * <p>
 * A node reads the session's current state and returns a partial update; it
 * never mutates the state itself. The orchestrator merges the update, records
 * the trace and emits a {@code node} event.
 */
public interface PhaseNode {

    /**
     * Name used in stream events.
     */
    String getName();

    /**
     * Trace phase recorded around this node, or null when the node is not
     * traced on its own.
     */
    default TracePhase getTracePhase() {
        return null;
    }

    AgentStateUpdate execute(AgentSession session);
}
