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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Progress event emitted by the orchestrator to its caller. Only the fields
 * relevant to the event type are set.
 */
@Value
@Builder
public class StreamEvent {

    StreamEventType type;
    String conversationId;
    String node;
    String status;
    String statusMessage;
    Integer iteration;
    Integer maxIterations;
    String content;

    String messageId;
    List<Message.ToolCall> toolCalls;
    Boolean approved;
    String note;
    RiskSeverity riskLevel;
    List<ApprovalHistoryEntry> approvalHistory;
    AgentTraceMetrics traceMetrics;

    Integer stepIndex;
    String question;
    String answer;

    String error;
    String resumeToken;
}
