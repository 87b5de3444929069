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

import java.time.Instant;
import java.util.List;

/**
 * Bounded rolling summary of task progress. The decision and tool outcome
 * lists keep only their newest entries.
 */
@Value
@Builder(toBuilder = true)
public class WorkingMemory {

    String taskSummary;
    String latestPlanStep;
    List<String> keyDecisions;
    List<String> recentToolOutcomes;
    FileChangeSummary fileChangeSummary;
    Instant lastUpdated;

    @Value
    @Builder
    public static class FileChangeSummary {
        int modified;
        int deleted;
        List<String> files;
    }
}
