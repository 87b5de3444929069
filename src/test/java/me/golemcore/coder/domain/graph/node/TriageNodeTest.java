package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.TriageDecision;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TriageNodeTest {

    private LlmPort llmPort;
    private TriageNode node;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        node = new TriageNode(llmPort, new CoderProperties(), Clock.systemUTC());
    }

    private static AgentSession session(String prompt) {
        AgentSession session = AgentSession.builder().conversationId("conv-1").build();
        session.setState(AgentState.builder()
                .messages(new ArrayList<>(List.of(Message.user(prompt, Instant.now()))))
                .build());
        return session;
    }

    private void modelAnswers(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }

    @Test
    void technicalPromptsTakeFastPath() {
        assertTrue(TriageNode.requiresPipeline("Fix the login bug"));
        assertTrue(TriageNode.requiresPipeline("what does main.ts do"));
        assertTrue(TriageNode.requiresPipeline("look at @src"));
        assertTrue(TriageNode.requiresPipeline("이 파일 수정해줘"));
        assertFalse(TriageNode.requiresPipeline("Hello there"));
        assertFalse(TriageNode.requiresPipeline(null));
    }

    @Test
    void fastPathSkipsModel() {
        AgentStateUpdate update = node.execute(session("Create a new component"));

        assertEquals(TriageDecision.GRAPH, update.getTriageDecision());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void simpleClassificationGoesToDirectResponse() {
        modelAnswers(" simple\n");

        AgentStateUpdate update = node.execute(session("Hello there"));

        assertEquals(TriageDecision.DIRECT_RESPONSE, update.getTriageDecision());
        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertEquals(10, request.getValue().getMaxTokens());
        assertEquals(0.1, request.getValue().getTemperature());
        assertEquals("conv-1", request.getValue().getSessionId());
    }

    @Test
    void complexClassificationGoesToGraph() {
        modelAnswers("COMPLEX");

        AgentStateUpdate update = node.execute(session("Hello there"));

        assertEquals(TriageDecision.GRAPH, update.getTriageDecision());
    }

    @Test
    void modelFailureFallsBackToGraph() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

        AgentStateUpdate update = node.execute(session("Hello there"));

        assertEquals(TriageDecision.GRAPH, update.getTriageDecision());
        assertEquals("Triage fallback", update.getStatusMessage());
    }
}
