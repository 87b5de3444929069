package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.AgentTraceEntry;
import me.golemcore.coder.domain.model.AgentTraceMetrics;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.TracePhase;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentTraceCollectorTest {

    private static final Instant START = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void entriesAreBoundedToMaxEntries() {
        AgentTraceCollector trace = new AgentTraceCollector(Clock.fixed(START, ZoneOffset.UTC), 200);

        for (int i = 0; i < 500; i++) {
            trace.decision(TracePhase.AGENT, "note " + i, i);
        }

        List<AgentTraceEntry> entries = trace.getEntries();
        assertEquals(200, entries.size());
        assertEquals("note 499", entries.get(199).getNote());
    }

    @Test
    void nodeLatencyIsMeasuredWithTheClock() {
        MutableClock clock = new MutableClock(START);
        AgentTraceCollector trace = new AgentTraceCollector(clock, 200);

        trace.startNode(TracePhase.TOOLS, 1);
        clock.advance(Duration.ofMillis(250));
        trace.endNode(TracePhase.TOOLS, 1, Map.of("toolCalls", 2));

        assertEquals(250L, trace.getMetrics().getNodeLatencyMs().get(TracePhase.TOOLS));
        assertEquals(250L, trace.getEntries().get(1).getDurationMs());
    }

    @Test
    void toolAndApprovalStatsAreCounted() {
        AgentTraceCollector trace = new AgentTraceCollector(Clock.fixed(START, ZoneOffset.UTC), 200);

        trace.toolResult("file_read", true, 10L, 1);
        trace.toolResult("command_execute", false, 20L, 1);
        trace.approvalStatus(ApprovalStatus.APPROVED, "auto", 1);
        trace.approvalStatus(ApprovalStatus.FEEDBACK, "review", 2);
        trace.approvalStatus(ApprovalStatus.DENIED, "blocked", 3);

        AgentTraceMetrics metrics = trace.getMetrics();
        assertEquals(2, metrics.getToolStats().getTotal());
        assertEquals(1, metrics.getToolStats().getSuccess());
        assertEquals(1, metrics.getToolStats().getFailed());
        assertEquals(1, metrics.getApprovalStats().getApproved());
        assertEquals(1, metrics.getApprovalStats().getFeedback());
        assertEquals(1, metrics.getApprovalStats().getDenied());
    }

    @Test
    void metricsAreACopy() {
        AgentTraceCollector trace = new AgentTraceCollector(Clock.fixed(START, ZoneOffset.UTC), 200);
        AgentTraceMetrics snapshot = trace.getMetrics();

        trace.toolResult("file_read", true, 1L, 1);

        assertEquals(0, snapshot.getToolStats().getTotal());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
