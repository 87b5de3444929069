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
import me.golemcore.coder.domain.graph.AgentAbortedException;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers a simple request with one tool-less model call.
 */
@Component
@Slf4j
public class DirectResponseNode implements PhaseNode {

    private final LlmPort llmPort;
    private final CoderProperties.LlmProperties llmProperties;
    private final Clock clock;

    public DirectResponseNode(LlmPort llmPort, CoderProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.llmProperties = properties.getLlm();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "direct_response";
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        List<Message> history = session.getState().getMessages();
        if (history.isEmpty()) {
            return AgentStateUpdate.empty();
        }
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(CodingPrompts.DIRECT_RESPONSE, clock.instant()));
        history.stream().filter(message -> !message.isBlank()).forEach(messages::add);

        StringBuilder content = new StringBuilder();
        try {
            LlmRequest request = LlmRequest.builder()
                    .model(llmProperties.getModel())
                    .messages(messages)
                    .temperature(llmProperties.getTemperature())
                    .sessionId(session.getConversationId())
                    .build();
            for (LlmChunk chunk : llmPort.chatStream(request).toIterable()) {
                if (chunk.getText() != null && !chunk.getText().isEmpty()) {
                    content.append(chunk.getText());
                    session.emit(StreamEvent.builder()
                            .type(StreamEventType.NODE)
                            .conversationId(session.getConversationId())
                            .node(getName())
                            .status("streaming")
                            .content(chunk.getText())
                            .build());
                }
            }
        } catch (AgentAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[DirectResponse] Model call failed: {}", e.getMessage());
            content.setLength(0);
            content.append("Error: ").append(e.getMessage() != null ? e.getMessage() : "Failed to generate response");
        }
        return AgentStateUpdate.builder()
                .messages(List.of(Message.assistant(content.toString(), clock.instant())))
                .statusMessage("Answered directly")
                .build();
    }
}
