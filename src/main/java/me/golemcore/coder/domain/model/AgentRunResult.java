package me.golemcore.coder.domain.model;

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

/**
 * Result of {@code start} or {@code resume}. {@code paused} is set only when
 * {@code status} is {@link RunStatus#PAUSED}.
 */
public record AgentRunResult(RunStatus status, AgentState state, PausedRun paused, String error) {

    public static AgentRunResult of(RunStatus status, AgentState state) {
        return new AgentRunResult(status, state, null, null);
    }

    public static AgentRunResult paused(AgentState state, PausedRun paused) {
        return new AgentRunResult(RunStatus.PAUSED, state, paused, null);
    }

    public static AgentRunResult failed(AgentState state, String error) {
        return new AgentRunResult(RunStatus.FAILED, state, null, error);
    }

    public boolean isPaused() {
        return status == RunStatus.PAUSED;
    }
}
