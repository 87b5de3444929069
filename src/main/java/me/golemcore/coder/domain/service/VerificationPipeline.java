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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.VerificationCheck;
import me.golemcore.coder.domain.model.VerificationResult;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.CommandExecutionPort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs project checks against modified files: type-check, lint and a focused
 * test gate.
 *
 * <p>
 * The package runner is detected from the lockfile in the working directory
 * and only scripts declared in {@code package.json} are run. Pass or fail is
 * decided by matching the command output.
 */
@Service
@Slf4j
public class VerificationPipeline {

    static final String TYPE_CHECK = "type-check";
    static final String LINT = "lint";
    static final String TEST_GATE = "test-gate";

    private static final String TEST_BACKEND_SCRIPT = "test:backend";
    private static final Pattern TEST_FAILURE = Pattern.compile("(\\bFAIL\\b|Test Suites:\\s+\\d+\\s+failed)",
            Pattern.CASE_INSENSITIVE);

    private final CommandExecutionPort commandExecutor;
    private final ObjectMapper objectMapper;
    private final CoderProperties.VerificationProperties properties;

    public VerificationPipeline(CommandExecutionPort commandExecutor, ObjectMapper objectMapper,
            CoderProperties properties) {
        this.commandExecutor = commandExecutor;
        this.objectMapper = objectMapper;
        this.properties = properties.getVerification();
    }

    public VerificationResult verify(List<String> modifiedFiles, Path workingDirectory) {
        if (!properties.isEnabled() || modifiedFiles == null || modifiedFiles.isEmpty()) {
            log.debug("[Verification] No modified files, skipping verification");
            return VerificationResult.empty();
        }
        log.info("[Verification] Verifying {} modified file(s)", modifiedFiles.size());

        ProjectProfile profile = detectProfile(workingDirectory);
        List<VerificationCheck> checks = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        List<String> executedCommands = new ArrayList<>();

        boolean hasTypeScript = modifiedFiles.stream().anyMatch(f -> f.endsWith(".ts") || f.endsWith(".tsx"));
        String typeCheckCommand = profile.scriptCommand(TYPE_CHECK);
        if (hasTypeScript && typeCheckCommand != null) {
            VerificationCheck check = runCheck(TYPE_CHECK, typeCheckCommand, workingDirectory,
                    output -> !output.contains("error TS"), "Type check passed", "Type errors found");
            checks.add(check);
            executedCommands.add(typeCheckCommand);
            if (!check.isPassed()) {
                suggestions.add("Fix the type errors. Run `" + typeCheckCommand + "` to check them.");
            }
        }

        String lintCommand = profile.scriptCommand(LINT);
        if (lintCommand != null) {
            VerificationCheck check = runLint(lintCommand, modifiedFiles, workingDirectory);
            checks.add(check);
            executedCommands.add(check.getCommand());
            if (!check.isPassed()) {
                suggestions.add("Fix the lint errors. `" + lintCommand + " -- --fix` may fix them automatically.");
            }
        }

        if (shouldRunTestGate(modifiedFiles)) {
            String testCommand = buildTestGateCommand(profile, modifiedFiles);
            if (testCommand != null) {
                VerificationCheck check = runCheck(TEST_GATE, testCommand, workingDirectory,
                        output -> !TEST_FAILURE.matcher(output).find(), "Test gate passed", "Test gate failed");
                checks.add(check);
                executedCommands.add(testCommand);
                if (!check.isPassed()) {
                    suggestions.add("Related tests must pass. Fix the failing tests or narrow the test selection.");
                }
            }
        }

        boolean allPassed = checks.stream().allMatch(VerificationCheck::isPassed);
        log.info("[Verification] Complete: checks={}, failed={}, allPassed={}",
                checks.size(), checks.stream().filter(c -> !c.isPassed()).count(), allPassed);
        return VerificationResult.builder()
                .checks(List.copyOf(checks))
                .allPassed(allPassed)
                .suggestions(List.copyOf(suggestions))
                .executedCommands(List.copyOf(executedCommands))
                .build();
    }

    ProjectProfile detectProfile(Path workingDirectory) {
        Set<String> scripts = new HashSet<>();
        Path packageJson = workingDirectory.resolve("package.json");
        if (Files.isRegularFile(packageJson)) {
            try {
                JsonNode scriptsNode = objectMapper.readTree(packageJson.toFile()).path("scripts");
                Iterator<String> names = scriptsNode.fieldNames();
                while (names.hasNext()) {
                    String name = names.next();
                    if (!scriptsNode.path(name).asText("").isEmpty()) {
                        scripts.add(name);
                    }
                }
            } catch (IOException e) {
                log.warn("[Verification] Cannot read package.json: {}", e.getMessage());
            }
        }

        PackageRunner runner = PackageRunner.NPM;
        if (Files.exists(workingDirectory.resolve("pnpm-lock.yaml"))) {
            runner = PackageRunner.PNPM;
        } else if (Files.exists(workingDirectory.resolve("yarn.lock"))) {
            runner = PackageRunner.YARN;
        }
        return new ProjectProfile(runner, scripts);
    }

    private VerificationCheck runCheck(String name, String command, Path workingDirectory,
            Predicate<String> passes, String passMessage, String failMessage) {
        try {
            String output = commandExecutor.execute(command, workingDirectory);
            boolean passed = passes.test(output);
            return VerificationCheck.builder()
                    .name(name)
                    .passed(passed)
                    .message(passed ? passMessage : failMessage)
                    .details(passed ? null : truncate(output))
                    .command(command)
                    .build();
        } catch (RuntimeException e) {
            log.debug("[Verification] {} command failed: {}", name, e.getMessage());
            return VerificationCheck.builder()
                    .name(name)
                    .passed(false)
                    .message(name + " execution failed")
                    .details(truncate(failureText(e)))
                    .command(command)
                    .build();
        }
    }

    private VerificationCheck runLint(String baseCommand, List<String> modifiedFiles, Path workingDirectory) {
        String filesArg = modifiedFiles.stream()
                .limit(properties.getMaxLintFiles())
                .map(VerificationPipeline::quote)
                .collect(Collectors.joining(" "));
        String command = filesArg.isEmpty() ? baseCommand : baseCommand + " -- " + filesArg;
        try {
            String output = commandExecutor.execute(command, workingDirectory);
            boolean passed = !(output.contains("error") && !output.contains("0 errors"));
            return VerificationCheck.builder()
                    .name(LINT)
                    .passed(passed)
                    .message(passed ? "Lint check passed" : "Lint errors found")
                    .details(passed ? null : truncate(output))
                    .command(command)
                    .build();
        } catch (RuntimeException e) {
            // Linters exit non-zero when they report errors.
            String text = failureText(e);
            boolean hasErrors = text.contains("error");
            return VerificationCheck.builder()
                    .name(LINT)
                    .passed(!hasErrors)
                    .message(hasErrors ? "Lint errors found" : "Lint check could not run")
                    .details(truncate(text))
                    .command(baseCommand)
                    .build();
        }
    }

    private boolean shouldRunTestGate(List<String> modifiedFiles) {
        return modifiedFiles.stream()
                .anyMatch(file -> properties.getTestGatePaths().stream().anyMatch(file::startsWith));
    }

    private String buildTestGateCommand(ProjectProfile profile, List<String> modifiedFiles) {
        String base = profile.scriptCommand(TEST_BACKEND_SCRIPT);
        if (base == null) {
            return null;
        }
        List<String> targets = modifiedFiles.stream()
                .filter(file -> file.endsWith(".ts") || file.endsWith(".tsx") || file.endsWith(".js"))
                .limit(properties.getMaxTestFiles())
                .map(VerificationPipeline::quote)
                .toList();
        if (targets.isEmpty()) {
            return base;
        }
        return base + " -- --runInBand --passWithNoTests --findRelatedTests " + String.join(" ", targets);
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        int max = properties.getDetailsMaxLength();
        return value.length() > max ? value.substring(0, max) : value;
    }

    private static String failureText(RuntimeException e) {
        StringBuilder text = new StringBuilder(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        if (e instanceof CommandExecutionPort.CommandExecutionException commandFailure
                && commandFailure.getOutput() != null && !commandFailure.getOutput().isBlank()) {
            text.append('\n').append(commandFailure.getOutput());
        }
        return text.toString();
    }

    private static String quote(String file) {
        return "\"" + file.replace("\"", "\\\"") + "\"";
    }

    enum PackageRunner {
        PNPM, YARN, NPM
    }

    record ProjectProfile(PackageRunner runner, Set<String> scripts) {

        String scriptCommand(String script) {
            if (!scripts.contains(script)) {
                return null;
            }
            return switch (runner) {
            case PNPM -> "pnpm -s " + script;
            case YARN -> "yarn " + script;
            case NPM -> "npm run " + script;
            };
        }
    }
}
