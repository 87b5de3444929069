package me.golemcore.coder.domain.graph;

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
import lombok.Getter;
import lombok.Setter;
import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.InputTrustLevel;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.model.WorkspaceFileInfo;
import me.golemcore.coder.domain.service.AgentTraceCollector;
import me.golemcore.coder.domain.service.FileTracker;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Everything one conversation's run owns: caller-supplied settings and
 * callbacks, the abort flag, the event sink and the runtime state built up by
 * the orchestrator. A session is confined to the thread driving its run and
 * is dropped when the run ends or its resume token is consumed.
 */
@Getter
public class AgentSession {

    private final String conversationId;
    private final Path workingDirectory;
    private final Integer maxIterations;
    private final Set<String> allowedTools;
    private final ToolApprovalCallback approvalCallback;
    private final DiscussInputCallback discussCallback;
    private final InputTrustLevel inputTrustLevel;
    private final boolean alwaysApproveTools;
    private final List<Message> history;

    private final AtomicBoolean aborted = new AtomicBoolean(false);

    @Setter
    private volatile Consumer<StreamEvent> eventSink;

    // Runtime state, set up by the orchestrator on start
    @Setter
    private AgentState state;
    @Setter
    private AgentTraceCollector trace;
    @Setter
    private FileTracker fileTracker;
    @Setter
    private Map<String, WorkspaceFileInfo> baselineSnapshot;
    @Setter
    private RepeatedCallGuard repeatGuard;
    @Setter
    private boolean justResumedFromDiscuss;
    @Setter
    private TracePhase activePhase;

    @Builder
    private AgentSession(String conversationId, Path workingDirectory, Integer maxIterations,
            Set<String> allowedTools, ToolApprovalCallback approvalCallback, DiscussInputCallback discussCallback,
            InputTrustLevel inputTrustLevel, boolean alwaysApproveTools, List<Message> history,
            Consumer<StreamEvent> eventSink) {
        this.conversationId = conversationId;
        this.workingDirectory = (workingDirectory != null ? workingDirectory : Path.of("")).toAbsolutePath().normalize();
        this.maxIterations = maxIterations;
        this.allowedTools = allowedTools != null ? Set.copyOf(allowedTools) : Set.of();
        this.approvalCallback = approvalCallback;
        this.discussCallback = discussCallback;
        this.inputTrustLevel = inputTrustLevel != null ? inputTrustLevel : InputTrustLevel.TRUSTED;
        this.alwaysApproveTools = alwaysApproveTools;
        this.history = history != null ? List.copyOf(history) : List.of();
        this.eventSink = eventSink;
    }

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public void checkNotAborted() {
        if (aborted.get()) {
            throw new AgentAbortedException(conversationId);
        }
    }

    /**
     * Publishes an event to the caller. Every emission is an abort check.
     */
    public void emit(StreamEvent event) {
        checkNotAborted();
        Consumer<StreamEvent> sink = eventSink;
        if (sink != null) {
            sink.accept(event);
        }
    }

    public int currentIteration() {
        return state != null ? state.getIterationCount() : 0;
    }
}
