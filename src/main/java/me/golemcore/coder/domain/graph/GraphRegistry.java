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
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of agent graphs by type. Every {@link AgentGraph} bean is
 * registered at startup; further graphs can be added with
 * {@link #register(AgentGraph)}. Unknown types fall back to the coding graph.
 */
@Component
@Slf4j
public class GraphRegistry {

    public static final String DEFAULT_TYPE = CodingAgentGraph.TYPE;

    private final Map<String, AgentGraph> graphs = new LinkedHashMap<>();

    public GraphRegistry(List<AgentGraph> graphs) {
        graphs.forEach(this::register);
    }

    public synchronized void register(AgentGraph graph) {
        AgentGraph previous = graphs.put(graph.getType(), graph);
        if (previous != null && previous != graph) {
            log.warn("[Orchestrator] Graph type '{}' re-registered by {}", graph.getType(),
                    graph.getClass().getSimpleName());
        } else {
            log.debug("[Orchestrator] Registered graph '{}'", graph.getType());
        }
    }

    public synchronized AgentGraph get(String type) {
        AgentGraph graph = graphs.get(type);
        if (graph != null) {
            return graph;
        }
        AgentGraph fallback = graphs.get(DEFAULT_TYPE);
        if (fallback == null) {
            throw new IllegalStateException("No graph registered for '" + type + "' and no default graph");
        }
        log.warn("[Orchestrator] Unknown graph type '{}', falling back to '{}'", type, DEFAULT_TYPE);
        return fallback;
    }

    public synchronized Set<String> getTypes() {
        return Set.copyOf(graphs.keySet());
    }
}
