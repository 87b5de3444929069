package me.golemcore.coder.domain.approval;

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
import me.golemcore.coder.domain.model.ApprovalRiskAnalysis;
import me.golemcore.coder.domain.model.ApprovalRiskItem;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.RiskReason;
import me.golemcore.coder.domain.model.RiskSeverity;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies pending tool calls by danger level.
 *
 * <p>
 * For shell commands the order is: dangerous (short-circuits the call), then
 * outside-working-directory and HTTP request (both require mandatory
 * approval), then network/package install (explicit approval). File mutations
 * are checked for sensitive paths, bulk batches and large writes.
 *
 * <p>
 * The analysis is a pure function of the calls and the working directory.
 */
@Component
@Slf4j
public class ToolApprovalRiskAnalyzer {

    private static final int COMMAND_PREVIEW_LENGTH = 200;

    private final int bulkThreshold;
    private final int largeWriteThreshold;

    public ToolApprovalRiskAnalyzer(CoderProperties properties) {
        CoderProperties.ApprovalProperties config = properties.getApproval();
        this.bulkThreshold = config.getBulkFileChangeThreshold();
        this.largeWriteThreshold = config.getLargeWriteThreshold();
    }

    public ApprovalRiskAnalysis analyze(List<Message.ToolCall> toolCalls, String workingDirectory) {
        List<ApprovalRiskItem> dangerous = new ArrayList<>();
        List<ApprovalRiskItem> mandatory = new ArrayList<>();
        List<ApprovalRiskItem> explicit = new ArrayList<>();
        List<Message.ToolCall> calls = toolCalls != null ? toolCalls : List.of();

        long fileMutationCount = calls.stream().filter(this::isFileMutation).count();
        boolean bulkBatch = fileMutationCount >= bulkThreshold;

        for (Message.ToolCall call : calls) {
            String command = extractCommand(call);
            if (command == null) {
                if (isFileMutation(call)) {
                    classifyFileMutation(call, fileMutationCount, bulkBatch, explicit);
                }
                continue;
            }

            if (RiskPatternTable.DANGEROUS_COMMANDS.matches(command)) {
                dangerous.add(commandItem(call, RiskPatternTable.DANGEROUS_COMMANDS, command));
                continue;
            }

            boolean mandatoryForCall = false;
            if (isOutsideWorkingDirectory(command, workingDirectory)) {
                mandatory.add(ApprovalRiskItem.builder()
                        .call(call)
                        .reason(RiskReason.OUTSIDE_WORKDIR_COMMAND)
                        .severity(RiskSeverity.HIGH)
                        .summary(preview(command))
                        .command(command)
                        .build());
                mandatoryForCall = true;
            }
            if (RiskPatternTable.HTTP_REQUEST_COMMANDS.matches(command)) {
                mandatory.add(commandItem(call, RiskPatternTable.HTTP_REQUEST_COMMANDS, command));
                mandatoryForCall = true;
            }
            if (!mandatoryForCall && RiskPatternTable.NETWORK_INSTALL_COMMANDS.matches(command)) {
                explicit.add(commandItem(call, RiskPatternTable.NETWORK_INSTALL_COMMANDS, command));
            }
        }

        List<ApprovalRiskItem> dedupedDangerous = dedupeBySeverity(dangerous);
        List<ApprovalRiskItem> dedupedMandatory = dedupeBySeverity(mandatory);
        List<ApprovalRiskItem> dedupedExplicit = dedupeBySeverity(explicit);

        return ApprovalRiskAnalysis.builder()
                .dangerous(dedupedDangerous)
                .mandatoryApproval(dedupedMandatory)
                .requiresExplicitApproval(dedupedExplicit)
                .riskLevel(riskLevel(dedupedDangerous, dedupedMandatory, dedupedExplicit))
                .build();
    }

    /**
     * Checks whether a command reaches outside the working directory through an
     * absolute path or a {@code cd} target. Without a working directory nothing
     * is considered outside.
     */
    public boolean isOutsideWorkingDirectory(String command, String workingDirectory) {
        if (command == null || workingDirectory == null || workingDirectory.isBlank()) {
            return false;
        }
        String root = stripTrailingSlash(workingDirectory.trim().replace('\\', '/'));

        Matcher absolute = RiskPatternTable.ABSOLUTE_PATH.matcher(command);
        while (absolute.find()) {
            if (isOutsideRoot(absolute.group(1), root)) {
                return true;
            }
        }

        Matcher cd = RiskPatternTable.CD_TARGET.matcher(command);
        while (cd.find()) {
            String target = cd.group(1);
            if ("~".equals(target) || target.startsWith("~/") || isOutsideRoot(target, root)) {
                return true;
            }
        }
        return false;
    }

    public boolean isSensitivePath(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String normalized = normalizePath(path);
        String baseName = normalized.substring(normalized.lastIndexOf('/') + 1);
        for (Pattern pattern : RiskPatternTable.SENSITIVE_PATHS) {
            if (pattern.matcher(normalized).find() || pattern.matcher(baseName).find()) {
                return true;
            }
        }
        return false;
    }

    public static String extractCommand(Message.ToolCall call) {
        if (call == null || !RiskPatternTable.COMMAND_TOOL.equals(call.getName())) {
            return null;
        }
        String command = call.getStringArgument("command");
        return command != null && !command.isBlank() ? command.trim() : null;
    }

    public static String extractPath(Message.ToolCall call) {
        if (call == null) {
            return null;
        }
        String path = call.getStringArgument("path");
        if (path == null || path.isBlank()) {
            path = call.getStringArgument("file_path");
        }
        return path != null && !path.isBlank() ? normalizePath(path) : null;
    }

    private void classifyFileMutation(Message.ToolCall call, long fileMutationCount, boolean bulkBatch,
            List<ApprovalRiskItem> explicit) {
        String filePath = extractPath(call);
        if (filePath != null && isSensitivePath(filePath)) {
            explicit.add(ApprovalRiskItem.builder()
                    .call(call)
                    .reason(RiskReason.SENSITIVE_FILE_CHANGE)
                    .severity(RiskSeverity.HIGH)
                    .summary(call.getName() + ": " + filePath)
                    .filePath(filePath)
                    .build());
        } else if (bulkBatch) {
            explicit.add(ApprovalRiskItem.builder()
                    .call(call)
                    .reason(RiskReason.BULK_FILE_CHANGE)
                    .severity(RiskSeverity.MEDIUM)
                    .summary(call.getName() + ": bulk file change batch (" + fileMutationCount + " calls)")
                    .filePath(filePath)
                    .build());
        } else if ("file_write".equals(call.getName()) && contentLength(call) >= largeWriteThreshold) {
            explicit.add(ApprovalRiskItem.builder()
                    .call(call)
                    .reason(RiskReason.LARGE_FILE_WRITE)
                    .severity(RiskSeverity.MEDIUM)
                    .summary("file_write: large file write (" + Math.round(contentLength(call) / 1024.0) + "KB)")
                    .filePath(filePath)
                    .build());
        }
    }

    private boolean isFileMutation(Message.ToolCall call) {
        return call != null && RiskPatternTable.FILE_MUTATION_TOOLS.contains(call.getName());
    }

    private static int contentLength(Message.ToolCall call) {
        String content = call.getStringArgument("content");
        return content != null ? content.length() : 0;
    }

    private static ApprovalRiskItem commandItem(Message.ToolCall call, RiskPatternTable.CommandRule rule,
            String command) {
        return ApprovalRiskItem.builder()
                .call(call)
                .reason(rule.reason())
                .severity(rule.severity())
                .summary(preview(command))
                .command(command)
                .build();
    }

    /**
     * Resolves {@code path} against the root, collapsing {@code ..} segments,
     * and reports whether the result leaves the root.
     */
    private static boolean isOutsideRoot(String path, String root) {
        try {
            Path rootPath = Paths.get(root).normalize();
            return !rootPath.resolve(path).normalize().startsWith(rootPath);
        } catch (InvalidPathException e) {
            log.debug("[Approval] Unparseable path '{}' treated as outside: {}", path, e.getMessage());
            return true;
        }
    }

    private static String stripTrailingSlash(String path) {
        if (path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }

    private static String normalizePath(String path) {
        return path.trim().replace('\\', '/');
    }

    private static String preview(String command) {
        if (command.length() <= COMMAND_PREVIEW_LENGTH) {
            return command;
        }
        return command.substring(0, COMMAND_PREVIEW_LENGTH) + "...";
    }

    /**
     * Keeps one item per tool-call id, preferring the higher severity. Items
     * without an id are kept as they are.
     */
    static List<ApprovalRiskItem> dedupeBySeverity(List<ApprovalRiskItem> items) {
        Map<String, ApprovalRiskItem> byId = new LinkedHashMap<>();
        List<ApprovalRiskItem> anonymous = new ArrayList<>();
        for (ApprovalRiskItem item : items) {
            String id = item.getCallId();
            if (id == null || id.isEmpty()) {
                anonymous.add(item);
                continue;
            }
            ApprovalRiskItem existing = byId.get(id);
            if (existing == null || item.getSeverity().isHigherThan(existing.getSeverity())) {
                byId.put(id, item);
            }
        }
        List<ApprovalRiskItem> result = new ArrayList<>(byId.values());
        result.addAll(anonymous);
        return result;
    }

    private static RiskSeverity riskLevel(List<ApprovalRiskItem> dangerous, List<ApprovalRiskItem> mandatory,
            List<ApprovalRiskItem> explicit) {
        if (!dangerous.isEmpty() || !mandatory.isEmpty()
                || explicit.stream().anyMatch(item -> item.getSeverity() == RiskSeverity.HIGH)) {
            return RiskSeverity.HIGH;
        }
        if (!explicit.isEmpty()) {
            return RiskSeverity.MEDIUM;
        }
        return RiskSeverity.LOW;
    }
}
