package me.golemcore.coder.tools;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.approval.RiskPatternTable;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.CommandExecutionPort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs shell commands in the working directory.
 *
 * <p>
 * Commands execute via {@code /bin/sh -c} ({@code cmd.exe /c} on Windows)
 * with a sanitized environment, a timeout and output truncation. Risk gating
 * happens before the call in the approval policy; commands in the dangerous
 * table are still refused here.
 *
 * <p>
 * Also serves as the {@link CommandExecutionPort} used by the verification
 * pipeline.
 */
@Component
@Slf4j
public class CommandExecuteTool implements ToolComponent, CommandExecutionPort {

    public static final String NAME = RiskPatternTable.COMMAND_TOOL;

    private static final String PARAM_COMMAND = "command";
    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "HOME", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME");

    private final int timeoutSeconds;
    private final int maxOutputLength;
    private final Set<String> allowedEnvVars;
    private final ExecutorService executor;

    public CommandExecuteTool(CoderProperties properties) {
        CoderProperties.ToolsProperties config = properties.getTools();
        this.timeoutSeconds = config.getCommandTimeoutSeconds();
        this.maxOutputLength = config.getMaxOutputLength();
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Command] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Execute a shell command in the working directory.
                        Use for running scripts, builds, tests and package managers.
                        Output (stdout and stderr) is returned; a non-zero exit code is reported as an error.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        "type", "string",
                                        "description", "Shell command to execute")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object commandArg = parameters.get(PARAM_COMMAND);
            if (!(commandArg instanceof String command) || command.isBlank()) {
                return ToolResult.failure("Missing required parameter: command");
            }
            if (RiskPatternTable.DANGEROUS_COMMANDS.matches(command)) {
                log.warn("[Command] Blocked dangerous command: {}", truncate(command, 200));
                return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Command blocked for security reasons");
            }
            Path workDir = context.workingDirectory();
            if (workDir == null || !Files.isDirectory(workDir)) {
                return ToolResult.failure("Working directory does not exist: " + workDir);
            }
            log.info("[Command] Running: '{}'", truncate(command, 200));
            ToolResult result = runCommand(command, workDir);
            log.debug("[Command] Result: success={}", result.isSuccess());
            return result;
        }, executor);
    }

    /**
     * Synchronous variant for internal callers. Throws when the command fails
     * to run, times out or exits non-zero.
     */
    @Override
    public String execute(String command, Path workingDirectory) {
        ToolResult result = runCommand(command, workingDirectory);
        if (!result.isSuccess()) {
            throw new CommandExecutionException(result.getError(), result.getOutput());
        }
        return result.getOutput();
    }

    private ToolResult runCommand(String command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder();
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("PWD", workDir.toString());

        long startTime = System.currentTimeMillis();
        try {
            Process process = pb.start();
            Future<String> outputFuture = executor.submit(() -> readOutput(process));

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;
            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                return ToolResult.failure(ToolFailureKind.TIMEOUT,
                        "Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }
            if (output.length() > maxOutputLength) {
                output = output.substring(0, maxOutputLength) + "\n[Output truncated...]";
            }

            int exitCode = process.exitValue();
            log.debug("[Command] Exited with {} after {}ms", exitCode, duration);
            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output);
            }
            return ToolResult.builder()
                    .success(false)
                    .output("Exit code: " + exitCode + "\n" + output)
                    .error("Command failed with exit code " + exitCode + ": " + truncate(output.trim(), 2000))
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .build();
        } catch (IOException e) {
            return ToolResult.failure("Failed to execute command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Command execution interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure("Error reading output: " + e.getMessage());
        }
    }

    private String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < maxOutputLength) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        merged.addAll(Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet()));
        return Collections.unmodifiableSet(merged);
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "<null>";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
