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

import me.golemcore.coder.domain.model.PlanStepTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses plan text and task prompts: numbered steps, step tags and the files a
 * task is expected to produce.
 */
public final class PlanParser {

    private static final Pattern NUMBERED_STEP = Pattern.compile("^\\d+[.):].*");
    private static final Pattern STEP_TAG = Pattern.compile("\\[(DISCUSS|TOOL|VERIFY)]", Pattern.CASE_INSENSITIVE);

    private static final String FILE_EXTENSIONS = "py|md|txt|json|yaml|yml|ini|cfg|sh|js|ts|tsx|jsx|java|go|rs|c|cpp|h|hpp";
    private static final Pattern PATH_FILE = Pattern.compile(
            "[@`\"']?([A-Za-z0-9_-]+/[A-Za-z0-9_/.-]+\\.(?:" + FILE_EXTENSIONS + "))[@`\"']?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_FILE = Pattern.compile(
            "[`\"']([A-Za-z0-9_/.-]+\\.(?:" + FILE_EXTENSIONS + "))[`\"']",
            Pattern.CASE_INSENSITIVE);

    private PlanParser() {
    }

    /**
     * Lines starting with a number followed by {@code .}, {@code )} or
     * {@code :}, trimmed.
     */
    public static List<String> parseSteps(String planText) {
        List<String> steps = new ArrayList<>();
        if (planText == null) {
            return steps;
        }
        for (String line : planText.split("\n")) {
            String trimmed = line.trim();
            if (NUMBERED_STEP.matcher(trimmed).matches()) {
                steps.add(trimmed);
            }
        }
        return steps;
    }

    public static Optional<PlanStepTag> tagOf(String stepText) {
        if (stepText == null) {
            return Optional.empty();
        }
        Matcher matcher = STEP_TAG.matcher(stepText);
        return matcher.find()
                ? Optional.of(PlanStepTag.valueOf(matcher.group(1).toUpperCase(Locale.ROOT)))
                : Optional.empty();
    }

    public static boolean isDiscussStep(String stepText) {
        return tagOf(stepText).filter(tag -> tag == PlanStepTag.DISCUSS).isPresent();
    }

    /**
     * Extracts path-like file names and quoted file names from a prompt. A
     * mention of README adds {@code README.md} unless a readme path was already
     * found. Result is sorted.
     */
    public static List<String> extractRequiredFiles(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return List.of();
        }
        Set<String> files = new TreeSet<>();
        Matcher pathMatcher = PATH_FILE.matcher(prompt);
        while (pathMatcher.find()) {
            String cleaned = pathMatcher.group().replaceAll("[@`\"'\\s]", "");
            if (cleaned.contains("/")) {
                files.add(cleaned);
            }
        }
        Matcher quotedMatcher = QUOTED_FILE.matcher(prompt);
        while (quotedMatcher.find()) {
            String cleaned = quotedMatcher.group().replaceAll("[`\"']", "");
            if (!cleaned.isEmpty()) {
                files.add(cleaned);
            }
        }
        if (prompt.contains("README")
                && files.stream().noneMatch(file -> file.toLowerCase(Locale.ROOT).contains("readme"))) {
            files.add("README.md");
        }
        return List.copyOf(files);
    }

    /**
     * A changed path satisfies a requirement when it ends with it, or when its
     * base name equals or contains the requirement's base name
     * (case-insensitive).
     */
    public static boolean pathMatchesRequirement(String changedPath, String requirement) {
        if (changedPath == null || changedPath.isEmpty() || requirement == null || requirement.isEmpty()) {
            return false;
        }
        String changedName = baseName(changedPath).toLowerCase(Locale.ROOT);
        String requiredName = baseName(requirement).toLowerCase(Locale.ROOT);
        return changedPath.endsWith(requirement) || changedName.equals(requiredName)
                || changedName.contains(requiredName);
    }

    private static String baseName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
