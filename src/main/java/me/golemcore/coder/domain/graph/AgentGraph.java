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

import me.golemcore.coder.domain.model.AgentRunResult;
import me.golemcore.coder.domain.model.ResumeInput;
import me.golemcore.coder.domain.model.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * A runnable agent workflow. Implementations are registered in
 * {@link GraphRegistry} under their {@link #getType()}.
 */
public interface AgentGraph {

    String getType();

    /**
     * Runs one conversational turn on the calling thread. Events go to the
     * session's sink.
     */
    AgentRunResult start(AgentSession session, String userMessage);

    /**
     * Re-enters a paused run with the external answer.
     *
     * @throws IllegalArgumentException
     *             if the token is unknown or already used
     */
    AgentRunResult resume(String resumeToken, ResumeInput input);

    /**
     * Runs {@link #start} on a worker thread and publishes its events.
     * Cancelling the subscription aborts the run.
     */
    Flux<StreamEvent> stream(AgentSession session, String userMessage);

    /**
     * Runs {@link #resume} on a worker thread and publishes its events.
     */
    Flux<StreamEvent> resumeStream(String resumeToken, ResumeInput input);
}
