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

import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps tool calls from being executed twice in one run. A call id that is in
 * the executed set is never dispatched again.
 */
@Component
public class ToolCallIdempotency {

    public List<Message.ToolCall> filterUnexecuted(List<Message.ToolCall> toolCalls, Set<String> executedIds) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        Set<String> executed = executedIds != null ? executedIds : Set.of();
        return toolCalls.stream()
                .filter(Objects::nonNull)
                .filter(call -> call.getId() == null || !executed.contains(call.getId()))
                .toList();
    }

    /**
     * Tool calls of the latest assistant message that have not run yet.
     */
    public List<Message.ToolCall> pendingToolCalls(AgentState state) {
        Message last = state.lastMessage();
        if (last == null || !last.isAssistantMessage() || !last.hasToolCalls()) {
            return List.of();
        }
        return filterUnexecuted(last.getToolCalls(), state.getExecutedToolCallIds());
    }

    public Set<String> merge(Set<String> executedIds, Collection<Message.ToolCall> toolCalls) {
        Set<String> merged = new LinkedHashSet<>();
        if (executedIds != null) {
            merged.addAll(executedIds);
        }
        if (toolCalls != null) {
            toolCalls.stream()
                    .map(Message.ToolCall::getId)
                    .filter(id -> id != null && !id.isEmpty())
                    .forEach(merged::add);
        }
        return merged;
    }
}
