package me.golemcore.coder.domain.graph.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.adapter.outbound.transport.LocalOnlyToolTransportAdapter;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmToolCall;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.service.BuiltinToolRegistry;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import me.golemcore.coder.tools.FileReadTool;
import me.golemcore.coder.tools.FileWriteTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentNodeTest {

    private LlmPort llmPort;
    private AgentNode node;
    private final List<StreamEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        BuiltinToolRegistry registry = new BuiltinToolRegistry(List.of(new FileReadTool(), new FileWriteTool()),
                new LocalOnlyToolTransportAdapter());
        node = new AgentNode(llmPort, registry, new ObjectMapper(), new CoderProperties(), Clock.systemUTC());
    }

    private AgentSession session(Set<String> allowedTools) {
        AgentSession session = AgentSession.builder()
                .conversationId("conv-1")
                .workingDirectory(Path.of("/work"))
                .allowedTools(allowedTools)
                .eventSink(events::add)
                .build();
        session.setState(AgentState.builder()
                .workingDirectory("/work")
                .planSteps(new ArrayList<>(List.of("1. [TOOL] Read app.ts", "2. [TOOL] Edit app.ts")))
                .currentPlanStep(1)
                .messages(new ArrayList<>(List.of(
                        Message.user("Update app.ts", Instant.now()),
                        Message.assistant("", Instant.now()))))
                .build());
        return session;
    }

    private static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    private static LlmChunk done(List<LlmToolCall> toolCalls) {
        return LlmChunk.builder().done(true).toolCalls(toolCalls).totalTokens(42).build();
    }

    @Test
    void streamsTextAndReturnsToolCalls() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(text("Reading "), text("the file."),
                done(List.of(new LlmToolCall("call-1", "file_read", "{\"path\":\"app.ts\"}")))));

        AgentStateUpdate update = node.execute(session(Set.of()));

        Message assistant = update.getMessages().get(0);
        assertEquals("Reading the file.", assistant.getContent());
        assertEquals(1, assistant.getToolCalls().size());
        assertEquals("call-1", assistant.getToolCalls().get(0).getId());
        assertEquals(Map.of("path", "app.ts"), assistant.getToolCalls().get(0).getArguments());
        assertEquals(42L, update.getTokensUsed());
        assertEquals(List.of("Reading ", "the file."), events.stream().map(StreamEvent::getContent).toList());
    }

    @Test
    void requestCarriesPlanStepAndSkipsBlankMessages() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(done(null)));

        node.execute(session(Set.of()));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        LlmRequest request = captor.getValue();
        List<Message> messages = request.getMessages();
        assertTrue(messages.get(0).isSystemMessage());
        assertTrue(messages.get(1).isSystemMessage());
        assertTrue(messages.get(1).getContent().contains("Edit app.ts"));
        assertEquals(3, messages.size());
        assertEquals(List.of("file_read", "file_write"),
                request.getTools().stream().map(ToolDefinition::getName).sorted().toList());
    }

    @Test
    void noToolCallsLeavesAssistantWithoutCalls() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(text("All done."), done(List.of())));

        AgentStateUpdate update = node.execute(session(Set.of()));

        assertFalse(update.getMessages().get(0).hasToolCalls());
        assertNull(update.getMessages().get(0).getToolCalls());
    }

    @Test
    void modelFailureBecomesAgentError() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalStateException("401 Unauthorized")));

        AgentStateUpdate update = node.execute(session(Set.of()));

        assertEquals("401 Unauthorized", update.getAgentError());
        assertTrue(update.getMessages().get(0).getContent().startsWith("Model call failed: 401 Unauthorized"));
    }

    @Test
    void dropsCallsToToolsNotOffered() {
        List<Message.ToolCall> calls = node.normalizeToolCalls(List.of(
                new LlmToolCall("call-1", "file_read", "{}"),
                new LlmToolCall("call-2", "shell", "{}"),
                new LlmToolCall("call-3", null, "{}")), Set.of("file_read"));

        assertEquals(1, calls.size());
        assertEquals("file_read", calls.get(0).getName());
    }

    @Test
    void synthesizesMissingIds() {
        List<Message.ToolCall> calls = node.normalizeToolCalls(List.of(
                new LlmToolCall(null, "file_read", "{}"),
                new LlmToolCall(" ", "file_read", "{}")), Set.of("file_read"));

        assertTrue(calls.get(0).getId().startsWith("call_"));
        assertTrue(calls.get(1).getId().endsWith("_1"));
        assertNotEquals(calls.get(0).getId(), calls.get(1).getId());
    }

    @Test
    void malformedArgumentsArePassedAsRawInput() {
        List<Message.ToolCall> calls = node.normalizeToolCalls(List.of(
                new LlmToolCall("call-1", "file_read", "{not json"),
                new LlmToolCall("call-2", "file_read", null)), Set.of("file_read"));

        assertEquals(Map.of("input", "{not json"), calls.get(0).getArguments());
        assertEquals(Map.of(), calls.get(1).getArguments());
    }

    @Test
    void allowedToolsLimitWhatIsOffered() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                done(List.of(new LlmToolCall("call-1", "file_write", "{\"path\":\"a\",\"content\":\"b\"}")))));

        AgentStateUpdate update = node.execute(session(Set.of("file_read")));

        assertFalse(update.getMessages().get(0).hasToolCalls());
    }
}
