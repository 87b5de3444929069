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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTraceMetrics {

    @Builder.Default
    private Map<TracePhase, Long> nodeLatencyMs = new EnumMap<>(TracePhase.class);
    @Builder.Default
    private ToolStats toolStats = new ToolStats();
    @Builder.Default
    private ApprovalStats approvalStats = new ApprovalStats();

    public AgentTraceMetrics copy() {
        Map<TracePhase, Long> latency = new EnumMap<>(TracePhase.class);
        latency.putAll(nodeLatencyMs);
        return AgentTraceMetrics.builder()
                .nodeLatencyMs(latency)
                .toolStats(new ToolStats(toolStats.getTotal(), toolStats.getSuccess(), toolStats.getFailed()))
                .approvalStats(new ApprovalStats(approvalStats.getApproved(), approvalStats.getDenied(),
                        approvalStats.getFeedback()))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolStats {
        private int total;
        private int success;
        private int failed;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApprovalStats {
        private int approved;
        private int denied;
        private int feedback;
    }
}
