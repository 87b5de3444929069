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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.graph.AgentAbortedException;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmToolCall;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.service.BuiltinToolRegistry;
import me.golemcore.coder.domain.service.ToolStatusMessages;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One model turn with the tool schema attached. Streams text to the caller and
 * turns the final tool-call list into an assistant message.
 */
@Component
@Slf4j
public class AgentNode implements PhaseNode {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final String RAW_ARGUMENT_KEY = "input";

    private final LlmPort llmPort;
    private final BuiltinToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final CoderProperties.LlmProperties llmProperties;
    private final Clock clock;

    public AgentNode(LlmPort llmPort, BuiltinToolRegistry toolRegistry, ObjectMapper objectMapper,
            CoderProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.llmProperties = properties.getLlm();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "agent";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.AGENT;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        AgentState state = session.getState();
        List<ToolDefinition> tools = toolRegistry.getDefinitions(session.getAllowedTools());
        Set<String> offeredTools = tools.stream().map(ToolDefinition::getName).collect(Collectors.toSet());
        log.info("[Agent] Calling model with {} tool(s), {} message(s)", tools.size(), state.getMessages().size());

        LlmRequest request = LlmRequest.builder()
                .model(llmProperties.getModel())
                .messages(buildContext(state))
                .tools(tools)
                .temperature(llmProperties.getTemperature())
                .maxTokens(llmProperties.getMaxTokens())
                .sessionId(session.getConversationId())
                .build();

        StringBuilder content = new StringBuilder();
        List<LlmToolCall> rawToolCalls = List.of();
        long tokens = 0;
        try {
            for (LlmChunk chunk : llmPort.chatStream(request).toIterable()) {
                if (chunk.getText() != null && !chunk.getText().isEmpty()) {
                    content.append(chunk.getText());
                    emitText(session, chunk.getText());
                }
                if (chunk.isDone()) {
                    if (chunk.getToolCalls() != null) {
                        rawToolCalls = chunk.getToolCalls();
                    }
                    tokens = chunk.getTotalTokens();
                }
            }
        } catch (AgentAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Agent] Model call failed: {}", reason);
            String errorContent = "Model call failed: " + reason + "\n\n"
                    + "The request with tool calling failed. Possible causes:\n"
                    + "- the model does not support tool calling (function calling)\n"
                    + "- max tokens is too low to produce a tool call\n"
                    + "- connection or API key problem\n";
            emitText(session, errorContent);
            return AgentStateUpdate.builder()
                    .messages(List.of(Message.assistant(errorContent, clock.instant())))
                    .agentError(reason)
                    .statusMessage("Model call failed")
                    .build();
        }

        List<Message.ToolCall> toolCalls = normalizeToolCalls(rawToolCalls, offeredTools);
        Message assistant = Message.assistant(content.toString(), clock.instant()).toBuilder()
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .build();
        log.info("[Agent] Response: {} chars, {} tool call(s)", content.length(), toolCalls.size());
        return AgentStateUpdate.builder()
                .messages(List.of(assistant))
                .tokensUsed(tokens)
                .statusMessage(ToolStatusMessages.describe(toolCalls, true))
                .build();
    }

    private List<Message> buildContext(AgentState state) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(CodingPrompts.codingAgent(state.getWorkingDirectory()), clock.instant()));
        List<String> steps = state.getPlanSteps();
        int current = state.getCurrentPlanStep();
        if (!steps.isEmpty() && current < steps.size()) {
            messages.add(Message.system(CodingPrompts.planStep(current, steps.size(), steps.get(current)),
                    clock.instant()));
        }
        // Providers reject assistant messages with neither text nor tool calls
        state.getMessages().stream()
                .filter(message -> message.isToolMessage() || !message.isBlank())
                .forEach(messages::add);
        return messages;
    }

    /**
     * Drops calls to tools that were not offered, synthesizes missing ids and
     * parses arguments. Unparseable arguments are passed on as the raw text.
     */
    List<Message.ToolCall> normalizeToolCalls(List<LlmToolCall> rawToolCalls, Set<String> offeredTools) {
        List<Message.ToolCall> toolCalls = new ArrayList<>();
        long timestamp = clock.millis();
        for (int i = 0; i < rawToolCalls.size(); i++) {
            LlmToolCall raw = rawToolCalls.get(i);
            if (raw.name() == null || !offeredTools.contains(raw.name())) {
                log.warn("[Agent] Ignoring call to tool not offered to the model: {}", raw.name());
                continue;
            }
            String id = raw.id() != null && !raw.id().isBlank() ? raw.id() : "call_" + timestamp + "_" + i;
            toolCalls.add(Message.ToolCall.builder()
                    .id(id)
                    .name(raw.name())
                    .arguments(parseArguments(raw.arguments()))
                    .build());
        }
        return toolCalls;
    }

    private Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE_REF);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("[Agent] Failed to parse tool arguments, using raw value: {}", e.getOriginalMessage());
            return Map.of(RAW_ARGUMENT_KEY, json);
        }
    }

    private void emitText(AgentSession session, String text) {
        session.emit(StreamEvent.builder()
                .type(StreamEventType.NODE)
                .conversationId(session.getConversationId())
                .node(getName())
                .status("streaming")
                .content(text)
                .build());
    }
}
