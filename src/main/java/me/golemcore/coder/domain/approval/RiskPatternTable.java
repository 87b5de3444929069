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

import me.golemcore.coder.domain.model.RiskReason;
import me.golemcore.coder.domain.model.RiskSeverity;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pattern tables used to classify pending tool calls.
 *
 * <p>
 * Matching is heuristic: commands are checked as plain text, so quoting,
 * aliases and indirection are not understood. The tables stay data so they can
 * be tested and extended without touching the analyzer.
 */
public final class RiskPatternTable {

    public static final String COMMAND_TOOL = "command_execute";
    public static final Set<String> FILE_MUTATION_TOOLS = Set.of("file_write", "file_edit");

    public static final String UNTRUSTED_APPROVAL_MARKER = "[UNTRUSTED_INPUT]";
    public static final String SECURITY_GUARDRAIL_MARKER = "[SECURITY_GUARDRAIL]";

    public static final CommandRule DANGEROUS_COMMANDS = new CommandRule(
            RiskReason.DANGEROUS_COMMAND, RiskSeverity.HIGH, List.of(
                    ci("rm\\s+-rf"),
                    ci("del\\s+/s"),
                    ci("rd\\s+/s"),
                    ci("format\\s+"),
                    ci("mkfs"),
                    ci("shutdown"),
                    ci("poweroff"),
                    ci("dd\\s+if=")));

    public static final CommandRule HTTP_REQUEST_COMMANDS = new CommandRule(
            RiskReason.HTTP_REQUEST_COMMAND, RiskSeverity.HIGH, List.of(
                    ci("\\bcurl\\b"),
                    ci("\\bwget\\b"),
                    ci("\\bhttpie\\b"),
                    ci("\\bhttp\\s+(GET|POST|PUT|DELETE|PATCH|HEAD)\\b"),
                    ci("\\bfetch\\b.*https?://"),
                    ci("Invoke-WebRequest"),
                    ci("Invoke-RestMethod")));

    public static final CommandRule NETWORK_INSTALL_COMMANDS = new CommandRule(
            RiskReason.NETWORK_INSTALL_COMMAND, RiskSeverity.MEDIUM, List.of(
                    ci("\\bnpm\\s+(install|i)\\b"),
                    ci("\\byarn\\s+add\\b"),
                    ci("\\bpnpm\\s+(add|install)\\b"),
                    ci("\\bpip3?\\s+install\\b"),
                    ci("\\bapt(-get)?\\s+install\\b"),
                    ci("\\bbrew\\s+install\\b"),
                    ci("\\bcurl\\b.*https?://"),
                    ci("\\bwget\\b.*https?://")));

    /**
     * Matched against both the normalized path and its base name.
     */
    public static final List<Pattern> SENSITIVE_PATHS = List.of(
            Pattern.compile("^\\.env(\\..*)?$"),
            Pattern.compile("(^|/)\\.git(/|$)"),
            Pattern.compile("(^|/)(id_rsa|id_ed25519|known_hosts)$"),
            Pattern.compile("(^|/)(package-lock\\.json|pnpm-lock\\.yaml|yarn\\.lock)$"));

    public static final Pattern ABSOLUTE_PATH = Pattern.compile("(?:^|\\s)(/[^\\s;|&>]+)");
    public static final Pattern CD_TARGET = Pattern.compile("\\bcd\\s+([^\\s;|&]+)");

    public static final Pattern ALWAYS_APPROVE_PHRASE = Pattern.compile("항상\\s*승인");
    public static final Pattern ONE_TIME_APPROVE_PHRASE = Pattern.compile("(^|\\s)(승인|허용)(\\s|$)");

    private RiskPatternTable() {
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * A risk class for shell commands: any pattern match assigns the reason.
     */
    public record CommandRule(RiskReason reason, RiskSeverity severity, List<Pattern> patterns) {

        public boolean matches(String command) {
            return patterns.stream().anyMatch(pattern -> pattern.matcher(command).find());
        }
    }
}
