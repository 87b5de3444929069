package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DirectResponseNodeTest {

    private final LlmPort llmPort = mock(LlmPort.class);
    private final DirectResponseNode node = new DirectResponseNode(llmPort, new CoderProperties(),
            Clock.systemUTC());
    private final List<StreamEvent> events = new ArrayList<>();

    private AgentSession session() {
        AgentSession session = AgentSession.builder().conversationId("conv-1").eventSink(events::add).build();
        session.setState(AgentState.builder()
                .messages(new ArrayList<>(List.of(Message.user("Hi!", Instant.now()))))
                .build());
        return session;
    }

    @Test
    void streamsAnswerIntoAssistantMessage() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmChunk.builder().text("Hello, ").build(),
                LlmChunk.builder().text("how can I help?").done(true).build()));

        AgentStateUpdate update = node.execute(session());

        assertEquals("Hello, how can I help?", update.getMessages().get(0).getContent());
        assertEquals(2, events.size());
    }

    @Test
    void modelFailureBecomesErrorAnswer() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalStateException("rate limited")));

        AgentStateUpdate update = node.execute(session());

        assertEquals("Error: rate limited", update.getMessages().get(0).getContent());
    }
}
