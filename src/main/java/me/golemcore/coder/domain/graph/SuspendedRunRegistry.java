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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.PauseReason;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds paused sessions until they are resumed. Tokens are single-use.
 */
@Component
@Slf4j
public class SuspendedRunRegistry {

    private final Map<String, SuspendedRun> runs = new ConcurrentHashMap<>();

    public String suspend(AgentSession session, PauseReason reason) {
        String token = "resume-" + UUID.randomUUID();
        runs.put(token, new SuspendedRun(session, reason));
        log.info("[Orchestrator] Suspended {} for {}", session.getConversationId(), reason);
        return token;
    }

    /**
     * Removes and returns the paused run.
     *
     * @throws IllegalArgumentException
     *             if the token is unknown or was already used
     */
    public SuspendedRun claim(String resumeToken) {
        SuspendedRun run = resumeToken != null ? runs.remove(resumeToken) : null;
        if (run == null) {
            throw new IllegalArgumentException("Unknown or expired resume token: " + resumeToken);
        }
        return run;
    }

    /**
     * Drops a paused run without resuming it, e.g. when the conversation is
     * closed.
     */
    public boolean discard(String resumeToken) {
        return runs.remove(resumeToken) != null;
    }

    public int size() {
        return runs.size();
    }

    public record SuspendedRun(AgentSession session, PauseReason reason) {
    }
}
