package me.golemcore.coder.domain.service;

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
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.port.outbound.ToolTransportPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of builtin tools, built from every {@link ToolComponent} bean.
 * Also assembles the tool schema offered to the model: enabled builtin tools
 * followed by transport tools, filtered by a per-conversation allow-list.
 */
@Component
@Slf4j
public class BuiltinToolRegistry {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final ToolTransportPort toolTransport;

    public BuiltinToolRegistry(List<ToolComponent> toolComponents, ToolTransportPort toolTransport) {
        this.toolTransport = toolTransport;
        for (ToolComponent tool : toolComponents) {
            ToolComponent previous = tools.put(tool.getToolName(), tool);
            if (previous != null) {
                log.warn("[Tools] Builtin tool '{}' registered twice, keeping {}", tool.getToolName(),
                        tool.getClass().getSimpleName());
            }
        }
        log.info("[Tools] Registered {} builtin tool(s): {}", tools.size(), tools.keySet());
    }

    public Optional<ToolComponent> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean isBuiltin(String name) {
        return tools.containsKey(name);
    }

    public Collection<String> getToolNames() {
        return List.copyOf(tools.keySet());
    }

    /**
     * Tool definitions visible to the model. An empty or null allow-list means
     * every tool is allowed. Transport tools shadowed by a builtin name are
     * dropped.
     */
    public List<ToolDefinition> getDefinitions(Set<String> allowedTools) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            if (tool.isEnabled() && isAllowed(tool.getToolName(), allowedTools)) {
                definitions.add(tool.getDefinition());
            }
        }
        for (ToolDefinition definition : listTransportTools()) {
            if (!tools.containsKey(definition.getName()) && isAllowed(definition.getName(), allowedTools)) {
                definitions.add(definition);
            }
        }
        return definitions;
    }

    public static boolean isAllowed(String toolName, Set<String> allowedTools) {
        return allowedTools == null || allowedTools.isEmpty() || allowedTools.contains(toolName);
    }

    private List<ToolDefinition> listTransportTools() {
        try {
            List<ToolDefinition> transportTools = toolTransport.listTools();
            return transportTools != null ? transportTools : List.of();
        } catch (RuntimeException e) {
            log.warn("[Tools] Failed to list transport tools: {}", e.getMessage());
            return List.of();
        }
    }
}
