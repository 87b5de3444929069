package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port to external tool servers. Tools listed here are offered to the model
 * next to the builtin ones and dispatched by name.
 */
public interface ToolTransportPort {

    /**
     * Lists tools currently exposed by connected servers.
     */
    List<ToolDefinition> listTools();

    /**
     * Checks if a tool with this name is served by the transport.
     */
    default boolean hasTool(String toolName) {
        return listTools().stream().anyMatch(tool -> tool.getName().equals(toolName));
    }

    /**
     * Invokes a tool and returns its text result. The future completes
     * exceptionally when the server reports an error.
     */
    CompletableFuture<String> callTool(String toolName, Map<String, Object> arguments, String conversationId);
}
