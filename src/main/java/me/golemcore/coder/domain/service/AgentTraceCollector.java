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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.AgentTraceEntry;
import me.golemcore.coder.domain.model.AgentTraceMetrics;
import me.golemcore.coder.domain.model.ApprovalStatus;
import me.golemcore.coder.domain.model.TraceEvent;
import me.golemcore.coder.domain.model.TracePhase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Collects trace entries and aggregate metrics for one run.
 *
 * <p>
 * Entries are bounded: once {@code maxEntries} is reached the oldest entry is
 * evicted. Node latency accumulates across iterations.
 */
@Slf4j
public class AgentTraceCollector {

    private final Clock clock;
    private final int maxEntries;
    private final Deque<AgentTraceEntry> entries = new ArrayDeque<>();
    private final Map<TracePhase, Instant> startedAt = new EnumMap<>(TracePhase.class);
    private final AgentTraceMetrics metrics = new AgentTraceMetrics();

    public AgentTraceCollector(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public void startNode(TracePhase phase, Integer iteration) {
        startedAt.put(phase, clock.instant());
        add(base(phase, TraceEvent.START, iteration).build());
    }

    public void endNode(TracePhase phase, Integer iteration, Map<String, Object> metadata) {
        Instant started = startedAt.remove(phase);
        Long duration = started != null ? Duration.between(started, clock.instant()).toMillis() : null;
        if (duration != null) {
            metrics.getNodeLatencyMs().merge(phase, duration, Long::sum);
        }
        add(base(phase, TraceEvent.END, iteration)
                .durationMs(duration)
                .metadata(metadata != null ? Map.copyOf(metadata) : null)
                .build());
    }

    public void decision(TracePhase phase, String note, Integer iteration) {
        add(base(phase, TraceEvent.DECISION, iteration).note(note).build());
    }

    public void error(TracePhase phase, String message, Integer iteration) {
        log.debug("[Trace] {} error: {}", phase.getValue(), message);
        add(base(phase, TraceEvent.ERROR, iteration).note(message).build());
    }

    public void approvalStatus(ApprovalStatus status, String note, Integer iteration) {
        AgentTraceMetrics.ApprovalStats stats = metrics.getApprovalStats();
        switch (status) {
        case APPROVED -> stats.setApproved(stats.getApproved() + 1);
        case DENIED -> stats.setDenied(stats.getDenied() + 1);
        case FEEDBACK -> stats.setFeedback(stats.getFeedback() + 1);
        }
        add(base(TracePhase.APPROVAL, TraceEvent.DECISION, iteration)
                .approved(status == ApprovalStatus.APPROVED)
                .note(note)
                .metadata(Map.of("status", status.getValue()))
                .build());
    }

    public void toolResult(String toolName, boolean success, Long durationMs, Integer iteration) {
        AgentTraceMetrics.ToolStats stats = metrics.getToolStats();
        stats.setTotal(stats.getTotal() + 1);
        if (success) {
            stats.setSuccess(stats.getSuccess() + 1);
        } else {
            stats.setFailed(stats.getFailed() + 1);
        }
        add(base(TracePhase.TOOLS, success ? TraceEvent.END : TraceEvent.ERROR, iteration)
                .toolName(toolName)
                .durationMs(durationMs)
                .build());
    }

    public List<AgentTraceEntry> getEntries() {
        return List.copyOf(entries);
    }

    public AgentTraceMetrics getMetrics() {
        return metrics.copy();
    }

    private AgentTraceEntry.AgentTraceEntryBuilder base(TracePhase phase, TraceEvent event, Integer iteration) {
        return AgentTraceEntry.builder()
                .id("trace-" + UUID.randomUUID())
                .timestamp(clock.instant())
                .phase(phase)
                .event(event)
                .iteration(iteration);
    }

    private void add(AgentTraceEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }
}
