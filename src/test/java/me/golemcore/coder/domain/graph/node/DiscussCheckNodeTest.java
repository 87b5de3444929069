package me.golemcore.coder.domain.graph.node;

import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.graph.DiscussInputCallback;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamEventType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class DiscussCheckNodeTest {

    private static final List<String> PLAN = List.of(
            "1. [TOOL] Read the config",
            "2. [DISCUSS] Which database should we use?",
            "3. [TOOL] Write the migration");

    private final DiscussCheckNode node = new DiscussCheckNode(Clock.systemUTC());
    private final List<StreamEvent> events = new ArrayList<>();

    private AgentSession session(int currentStep, DiscussInputCallback callback) {
        AgentSession session = AgentSession.builder()
                .conversationId("conv-1")
                .discussCallback(callback)
                .eventSink(events::add)
                .build();
        session.setState(AgentState.builder()
                .planCreated(true)
                .planSteps(new ArrayList<>(PLAN))
                .currentPlanStep(currentStep)
                .build());
        return session;
    }

    @Test
    void pendingOnlyOnDiscussStepOfCreatedPlan() {
        assertTrue(node.isPending(session(1, null).getState()));
        assertFalse(node.isPending(session(0, null).getState()));
        assertFalse(node.isPending(session(3, null).getState()));

        AgentState noPlan = session(1, null).getState();
        noPlan.setPlanCreated(false);
        assertFalse(node.isPending(noPlan));
    }

    @Test
    void withoutCallbackWaitsForResume() {
        AgentSession session = session(1, null);

        AgentStateUpdate update = node.execute(session);

        assertEquals(Boolean.TRUE, update.getAwaitingDiscussInput());
        assertEquals(2, update.getCurrentPlanStep());
        assertNull(update.getMessages());
        assertEquals(1, events.size());
        StreamEvent request = events.get(0);
        assertEquals(StreamEventType.COWORK_DISCUSS_REQUEST, request.getType());
        assertEquals(1, request.getStepIndex());
        assertEquals("2. Which database should we use?", request.getQuestion());
    }

    @Test
    void callbackAnswerBecomesUserMessage() {
        AgentSession session = session(1, (step, question) -> CompletableFuture.completedFuture("  Postgres "));

        AgentStateUpdate update = node.execute(session);

        assertEquals(Boolean.FALSE, update.getAwaitingDiscussInput());
        assertEquals(2, update.getCurrentPlanStep());
        assertEquals("Postgres", update.getMessages().get(0).getContent());
        assertTrue(update.getMessages().get(0).isUserMessage());
        assertEquals(StreamEventType.COWORK_DISCUSS_RESPONSE, events.get(1).getType());
        assertEquals("Postgres", events.get(1).getAnswer());
    }

    @Test
    void failedCallbackCountsAsSkipped() {
        AgentSession session = session(1,
                (step, question) -> CompletableFuture.failedFuture(new IllegalStateException("closed")));

        AgentStateUpdate update = node.execute(session);

        assertEquals(DiscussCheckNode.SKIPPED_ANSWER, update.getMessages().get(0).getContent());
        assertEquals(Boolean.FALSE, update.getAwaitingDiscussInput());
    }

    @Test
    void blankAnswerIsSkipped() {
        AgentStateUpdate update = node.answer(session(2, null), 1, "   ");

        assertEquals(DiscussCheckNode.SKIPPED_ANSWER, update.getMessages().get(0).getContent());
    }

    @Test
    void nonDiscussStepIsNoop() {
        AgentStateUpdate update = node.execute(session(0, null));

        assertNull(update.getCurrentPlanStep());
        assertTrue(events.isEmpty());
    }
}
