package me.golemcore.coder.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Represents a single message in a coding-agent conversation. Supports the
 * user, assistant, system and tool roles and carries tool calls requested by
 * the model and tool results fed back to it.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, system, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Map<String, Object> metadata;
    private Instant timestamp;

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * A message with neither text nor tool calls carries nothing for the model.
     */
    public boolean isBlank() {
        return (content == null || content.isBlank()) && !hasToolCalls();
    }

    public static Message user(String content, Instant timestamp) {
        return of(ROLE_USER, content, timestamp);
    }

    public static Message assistant(String content, Instant timestamp) {
        return of(ROLE_ASSISTANT, content, timestamp);
    }

    public static Message system(String content, Instant timestamp) {
        return of(ROLE_SYSTEM, content, timestamp);
    }

    public static Message toolResult(String toolCallId, String toolName, String content, Instant timestamp) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(ROLE_TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    private static Message of(String role, String content, Instant timestamp) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and arguments.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;

        public String getStringArgument(String key) {
            if (arguments == null) {
                return null;
            }
            Object value = arguments.get(key);
            return value instanceof String str ? str : null;
        }
    }
}
