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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.component.ToolComponent;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolExecutionResult;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.domain.model.ToolResult;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ActivityLogPort;
import me.golemcore.coder.port.outbound.ToolTransportPort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Executes a single tool call: allow-list check, builtin or transport
 * dispatch, timeout and retry, usage statistics and activity logging.
 *
 * <p>
 * Never throws for a failing tool: every failure ends up in
 * {@link ToolExecutionResult#getError()}. Does not touch conversation state.
 */
@Service
@Slf4j
public class ToolCallExecutionService {

    private final BuiltinToolRegistry builtinTools;
    private final ToolTransportPort toolTransport;
    private final RetryExecutor retryExecutor;
    private final ErrorRecoveryAdvisor errorRecoveryAdvisor;
    private final ToolUsageStatistics usageStatistics;
    private final ActivityLogPort activityLog;
    private final CoderProperties.ToolsProperties properties;

    public ToolCallExecutionService(BuiltinToolRegistry builtinTools, ToolTransportPort toolTransport,
            RetryExecutor retryExecutor, ErrorRecoveryAdvisor errorRecoveryAdvisor,
            ToolUsageStatistics usageStatistics, ActivityLogPort activityLog, CoderProperties properties) {
        this.builtinTools = builtinTools;
        this.toolTransport = toolTransport;
        this.retryExecutor = retryExecutor;
        this.errorRecoveryAdvisor = errorRecoveryAdvisor;
        this.usageStatistics = usageStatistics;
        this.activityLog = activityLog;
        this.properties = properties.getTools();
    }

    public ToolExecutionResult execute(Message.ToolCall call, ToolExecutionContext context, Set<String> allowedTools) {
        long start = System.currentTimeMillis();
        String toolName = call.getName();
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();

        if (!BuiltinToolRegistry.isAllowed(toolName, allowedTools)) {
            log.warn("[Tools] Blocked disabled tool call: {}", toolName);
            return finish(call, context, null, "Tool '" + toolName + "' is disabled for this conversation", start,
                    false);
        }

        RetryExecutor.RetryPolicy policy = RetryExecutor.RetryPolicy.from(properties);
        RetryExecutor.RetryOutcome<String> outcome;
        if (builtinTools.isBuiltin(toolName)) {
            ToolComponent tool = builtinTools.getTool(toolName).orElseThrow();
            if (!tool.isEnabled()) {
                return finish(call, context, null, "Tool '" + toolName + "' is disabled", start, false);
            }
            log.info("[Tools] Executing builtin tool: {}", toolName);
            outcome = retryExecutor.execute(() -> tool.execute(arguments, context).thenApply(this::unwrap),
                    properties.getTimeoutMs(), policy, "builtin tool '" + toolName + "'");
        } else if (hasTransportTool(toolName)) {
            log.info("[Tools] Executing transport tool: {}", toolName);
            outcome = retryExecutor.execute(
                    () -> toolTransport.callTool(toolName, arguments, context.conversationId()),
                    properties.getTimeoutMs(), policy, "transport tool '" + toolName + "'");
        } else {
            log.warn("[Tools] Unknown tool called: {}", toolName);
            return finish(call, context, null, "Tool '" + toolName + "' not found (neither builtin nor transport)",
                    start, false);
        }

        if (outcome.success()) {
            String result = outcome.result() != null ? outcome.result() : "Tool returned no result";
            return finish(call, context, truncate(result, toolName), null, start, true);
        }
        String error = errorRecoveryAdvisor.formatErrorMessage(outcome.errorMessage(), outcome.attempts())
                + "\n\n" + errorRecoveryAdvisor.recoverySuggestion(outcome.errorMessage());
        return finish(call, context, null, error, start, true);
    }

    /**
     * Tool-role message content fed back to the model.
     */
    public static String toMessageContent(ToolExecutionResult result) {
        if (result.getError() != null) {
            return "Error: " + result.getError();
        }
        if (result.getResult() != null) {
            return result.getResult();
        }
        return "No result";
    }

    public String truncate(String content, String toolName) {
        int maxChars = properties.getMaxOutputLength();
        if (content == null || maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Use a more specific query or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars", toolName, content.length());
        return content.substring(0, cutPoint) + suffix;
    }

    // Builtin failures surface as exceptions so the retry executor can classify
    // them. Only timeouts are retryable: other failures are deterministic.
    private String unwrap(ToolResult result) {
        if (result == null) {
            return null;
        }
        if (result.isSuccess()) {
            return result.getOutput();
        }
        ToolFailureKind kind = result.getFailureKind() != null ? result.getFailureKind()
                : ToolFailureKind.EXECUTION_FAILED;
        String error = result.getError() != null ? result.getError() : "Tool failed";
        if (kind == ToolFailureKind.TIMEOUT) {
            throw new ToolExecutionException(error, kind);
        }
        throw new ToolExecutionException(error, ToolFailureKind.POLICY_DENIED);
    }

    private boolean hasTransportTool(String toolName) {
        try {
            return toolTransport.hasTool(toolName);
        } catch (RuntimeException e) {
            log.warn("[Tools] Tool transport lookup failed for {}: {}", toolName, e.getMessage());
            return false;
        }
    }

    private ToolExecutionResult finish(Message.ToolCall call, ToolExecutionContext context, String result,
            String error, long start, boolean recordStats) {
        long duration = System.currentTimeMillis() - start;
        if (recordStats) {
            usageStatistics.recordUsage(call.getName(), error == null, duration, error);
        }
        recordActivity(call, context, error == null ? result : error, error == null ? "success" : "error", duration);
        return ToolExecutionResult.builder()
                .toolCallId(call.getId())
                .toolName(call.getName())
                .result(result)
                .error(error)
                .durationMs(duration)
                .build();
    }

    private void recordActivity(Message.ToolCall call, ToolExecutionContext context, String result, String status,
            long duration) {
        CompletableFuture.runAsync(() -> activityLog.record(new ActivityLogPort.ActivityRecord(
                context.conversationId(), call.getName(),
                call.getArguments() != null ? call.getArguments() : Map.of(), result, status, duration)))
                .exceptionally(e -> {
                    log.warn("[Tools] Failed to save activity for {}: {}", call.getName(), e.getMessage());
                    return null;
                });
    }
}
