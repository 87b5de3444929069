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

import me.golemcore.coder.domain.model.AgentState;
import me.golemcore.coder.domain.model.WorkingMemory;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compacts run progress into a bounded {@link WorkingMemory}.
 *
 * <p>
 * Key decisions and tool outcomes are FIFO lists: once the configured cap is
 * reached the oldest entries are dropped. The file list keeps the most recent
 * paths.
 */
@Component
public class WorkingMemoryService {

    private static final int MAX_TASK_SUMMARY_LENGTH = 300;

    private final Clock clock;
    private final CoderProperties.MemoryProperties properties;

    public WorkingMemoryService(Clock clock, CoderProperties properties) {
        this.clock = clock;
        this.properties = properties.getMemory();
    }

    public WorkingMemory refresh(AgentState state, String decisionNote, String toolOutcome) {
        return refresh(state, state.getCurrentPlanStep(), state.getModifiedFiles(), state.getDeletedFiles(),
                decisionNote, toolOutcome);
    }

    public WorkingMemory refresh(AgentState state, int currentPlanStep, List<String> modifiedFiles,
            List<String> deletedFiles, String decisionNote, String toolOutcome) {
        WorkingMemory previous = state.getWorkingMemory();

        String taskSummary = truncate(state.firstUserText().trim());
        if (taskSummary.isEmpty() && previous != null && previous.getTaskSummary() != null) {
            taskSummary = previous.getTaskSummary();
        }

        List<String> steps = state.getPlanSteps();
        String latestStep = currentPlanStep >= 0 && currentPlanStep < steps.size()
                ? steps.get(currentPlanStep)
                : "";

        List<String> decisions = append(previous != null ? previous.getKeyDecisions() : null, decisionNote,
                properties.getMaxKeyDecisions());
        List<String> outcomes = append(previous != null ? previous.getRecentToolOutcomes() : null, toolOutcome,
                properties.getMaxToolOutcomes());

        List<String> modified = modifiedFiles != null ? modifiedFiles : List.of();
        List<String> deleted = deletedFiles != null ? deletedFiles : List.of();
        Set<String> files = new LinkedHashSet<>(modified);
        files.addAll(deleted);

        return WorkingMemory.builder()
                .taskSummary(taskSummary)
                .latestPlanStep(latestStep)
                .keyDecisions(decisions)
                .recentToolOutcomes(outcomes)
                .fileChangeSummary(WorkingMemory.FileChangeSummary.builder()
                        .modified(modified.size())
                        .deleted(deleted.size())
                        .files(tail(new ArrayList<>(files), properties.getMaxFiles()))
                        .build())
                .lastUpdated(clock.instant())
                .build();
    }

    private static List<String> append(List<String> existing, String entry, int max) {
        List<String> result = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
        if (entry != null && !entry.isBlank()) {
            result.add(entry.trim());
        }
        return tail(result, max);
    }

    private static List<String> tail(List<String> values, int max) {
        if (values.size() <= max) {
            return List.copyOf(values);
        }
        return List.copyOf(values.subList(values.size() - max, values.size()));
    }

    private static String truncate(String value) {
        return value.length() > MAX_TASK_SUMMARY_LENGTH
                ? value.substring(0, MAX_TASK_SUMMARY_LENGTH) + "..."
                : value;
    }
}
