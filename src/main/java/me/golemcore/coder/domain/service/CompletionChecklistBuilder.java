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

import lombok.Builder;
import lombok.Value;
import me.golemcore.coder.domain.model.ChecklistItemStatus;
import me.golemcore.coder.domain.model.CompletionChecklist;
import me.golemcore.coder.domain.model.VerificationStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the completion checklist from a snapshot of run progress. A new
 * checklist is produced on every call; previous checklists are never edited.
 */
@Component
public class CompletionChecklistBuilder {

    private static final int MAX_LISTED_FILES = 5;

    private final Clock clock;

    public CompletionChecklistBuilder(Clock clock) {
        this.clock = clock;
    }

    public CompletionChecklist build(Input input) {
        List<CompletionChecklist.Item> items = new ArrayList<>();
        items.add(taskItem(input));
        items.add(requiredFilesItem(input));
        items.add(planItem(input));
        items.add(verificationItem(input));
        items.add(executionItem(input));

        boolean allPassed = items.stream()
                .allMatch(item -> item.getStatus() == ChecklistItemStatus.PASSED
                        || item.getStatus() == ChecklistItemStatus.SKIPPED);
        return CompletionChecklist.builder()
                .generatedAt(clock.instant())
                .allPassed(allPassed)
                .items(List.copyOf(items))
                .build();
    }

    private CompletionChecklist.Item taskItem(Input input) {
        boolean captured = input.getTaskSummary() != null && !input.getTaskSummary().isBlank();
        return item("task_summary", "Task understood",
                captured ? ChecklistItemStatus.PASSED : ChecklistItemStatus.PENDING,
                captured ? truncate(input.getTaskSummary().trim(), 120) : null);
    }

    private CompletionChecklist.Item requiredFilesItem(Input input) {
        List<String> required = nullSafe(input.getRequiredFiles());
        if (required.isEmpty()) {
            return item("required_files", "Required files produced", ChecklistItemStatus.SKIPPED, null);
        }
        List<String> missing = required.stream()
                .filter(requirement -> nullSafe(input.getModifiedFiles()).stream()
                        .noneMatch(file -> PlanParser.pathMatchesRequirement(file, requirement)))
                .toList();
        if (missing.isEmpty()) {
            return item("required_files", "Required files produced", ChecklistItemStatus.PASSED,
                    required.size() + " file(s) present");
        }
        ChecklistItemStatus status = nullSafe(input.getVerificationFailedChecks()).contains("required_files")
                ? ChecklistItemStatus.FAILED
                : ChecklistItemStatus.PENDING;
        return item("required_files", "Required files produced", status, "Missing: " + listFiles(missing));
    }

    private CompletionChecklist.Item planItem(Input input) {
        List<String> steps = nullSafe(input.getPlanSteps());
        if (steps.isEmpty()) {
            return item("plan_progress", "Plan steps completed", ChecklistItemStatus.SKIPPED, null);
        }
        int current = Math.min(Math.max(input.getCurrentPlanStep(), 0), steps.size());
        boolean finished = current >= steps.size() - 1;
        return item("plan_progress", "Plan steps completed",
                finished ? ChecklistItemStatus.PASSED : ChecklistItemStatus.PENDING,
                "Step " + Math.min(current + 1, steps.size()) + "/" + steps.size());
    }

    private CompletionChecklist.Item verificationItem(Input input) {
        VerificationStatus status = input.getVerificationStatus() != null
                ? input.getVerificationStatus()
                : VerificationStatus.NOT_RUN;
        return switch (status) {
        case PASSED -> item("verification", "Automated verification", ChecklistItemStatus.PASSED, null);
        case FAILED -> item("verification", "Automated verification", ChecklistItemStatus.FAILED,
                "Failed: " + String.join(", ", nullSafe(input.getVerificationFailedChecks())));
        case NOT_RUN -> item("verification", "Automated verification",
                nullSafe(input.getModifiedFiles()).isEmpty() ? ChecklistItemStatus.SKIPPED : ChecklistItemStatus.PENDING,
                "Not run");
        };
    }

    private CompletionChecklist.Item executionItem(Input input) {
        return item("execution", "No execution errors",
                input.isHadExecutionError() ? ChecklistItemStatus.FAILED : ChecklistItemStatus.PASSED,
                input.isHadExecutionError() ? "Agent or tool error occurred" : null);
    }

    private static CompletionChecklist.Item item(String id, String title, ChecklistItemStatus status,
            String detail) {
        return CompletionChecklist.Item.builder()
                .id(id)
                .title(title)
                .status(status)
                .detail(detail)
                .build();
    }

    private static String listFiles(List<String> files) {
        String listed = String.join(", ", files.subList(0, Math.min(files.size(), MAX_LISTED_FILES)));
        return files.size() > MAX_LISTED_FILES
                ? listed + " (+" + (files.size() - MAX_LISTED_FILES) + " more)"
                : listed;
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) + "..." : value;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    /**
     * Progress values the checklist is derived from.
     */
    @Value
    @Builder
    public static class Input {
        String taskSummary;
        List<String> requiredFiles;
        List<String> modifiedFiles;
        List<String> planSteps;
        int currentPlanStep;
        VerificationStatus verificationStatus;
        List<String> verificationFailedChecks;
        boolean hadExecutionError;
    }
}
