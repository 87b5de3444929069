package me.golemcore.coder.adapter.outbound.transport;

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
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.port.outbound.ToolTransportPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Transport used when no external tool server is connected: it exposes no
 * tools, so every call is answered by the builtin registry or rejected as
 * unknown.
 */
@Component
@Slf4j
public class LocalOnlyToolTransportAdapter implements ToolTransportPort {

    @Override
    public List<ToolDefinition> listTools() {
        return List.of();
    }

    @Override
    public boolean hasTool(String toolName) {
        return false;
    }

    @Override
    public CompletableFuture<String> callTool(String toolName, Map<String, Object> arguments, String conversationId) {
        log.warn("[Tools] No tool transport connected, cannot call {}", toolName);
        return CompletableFuture.failedFuture(
                new IllegalStateException("No tool server provides '" + toolName + "'"));
    }
}
