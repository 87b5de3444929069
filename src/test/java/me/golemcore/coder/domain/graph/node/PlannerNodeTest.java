package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.adapter.outbound.transport.LocalOnlyToolTransportAdapter;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.service.BuiltinToolRegistry;
import me.golemcore.coder.domain.service.CodebaseAnalyzer;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import me.golemcore.coder.tools.FileReadTool;
import me.golemcore.coder.tools.FileWriteTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlannerNodeTest {

    @TempDir
    Path workspace;

    private LlmPort llmPort;
    private PlannerNode node;
    private final List<StreamEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        CoderProperties properties = new CoderProperties();
        BuiltinToolRegistry registry = new BuiltinToolRegistry(List.of(new FileReadTool(), new FileWriteTool()),
                new LocalOnlyToolTransportAdapter());
        node = new PlannerNode(llmPort, registry, new CodebaseAnalyzer(properties), properties,
                Clock.systemUTC());
    }

    private AgentSession session(String prompt) {
        AgentSession session = AgentSession.builder()
                .conversationId("conv-1")
                .workingDirectory(workspace)
                .eventSink(events::add)
                .build();
        session.setState(AgentState.builder()
                .messages(new ArrayList<>(List.of(Message.user(prompt, Instant.now()))))
                .build());
        return session;
    }

    private static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    @Test
    void createsPlanFromStreamedSteps() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                text("[MODIFICATION]\n1. [TOOL] Read src/api/client.ts\n"),
                text("2. [TOOL] Fix the retry logic\n"),
                LlmChunk.builder().done(true).build()));

        AgentStateUpdate update = node.execute(session("Fix the retries in src/api/client.ts"));

        assertEquals(Boolean.TRUE, update.getPlanCreated());
        assertEquals(0, update.getCurrentPlanStep());
        assertEquals(List.of("1. [TOOL] Read src/api/client.ts", "2. [TOOL] Fix the retry logic"),
                update.getPlanSteps());
        assertTrue(update.getRequiredFiles().contains("src/api/client.ts"));
        assertEquals(2, update.getMessages().size());
        assertTrue(update.getMessages().get(0).isAssistantMessage());
        assertTrue(update.getMessages().get(1).isUserMessage());
        assertEquals("1. [TOOL] Read src/api/client.ts\n", events.get(0).getContent());
    }

    @Test
    void plannerPromptListsAvailableTools() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(text("1. [TOOL] Do it")));

        node.execute(session("Create the config loader"));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        String system = captor.getValue().getMessages().get(0).getContent();
        assertTrue(system.contains("- file_read: "));
        assertTrue(system.contains("- file_write: "));
        assertNull(captor.getValue().getTools());
    }

    @Test
    void existingPlanIsKept() {
        AgentSession session = session("Create the config loader");
        session.getState().setPlanCreated(true);

        AgentStateUpdate update = node.execute(session);

        assertNull(update.getPlanCreated());
        verify(llmPort, never()).chatStream(any());
    }

    @Test
    void modelFailureLeavesPlanUncreated() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalStateException("timeout")));

        AgentStateUpdate update = node.execute(session("Create the config loader"));

        assertNull(update.getPlanCreated());
        assertEquals("Planning failed: timeout", update.getStatusMessage());
    }
}
