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

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Turns failures into user-facing text with a recovery hint.
 */
@Component
public class ErrorRecoveryAdvisor {

    public String formatErrorMessage(String message, int attempts) {
        String base = message != null && !message.isBlank() ? message : "Unknown error";
        return attempts <= 1 ? base : "Failed after " + attempts + " attempts: " + base;
    }

    public String recoverySuggestion(String errorMessage) {
        String text = errorMessage != null ? errorMessage.toLowerCase(Locale.ROOT) : "";
        if (text.contains("rate_limit") || text.contains("rate limit") || text.contains("429")) {
            return "Suggestion: the API rate limit was reached. Wait a moment and try again.";
        }
        if (text.contains("timeout") || text.contains("timed out") || text.contains("etimedout")
                || text.contains("504")) {
            return "Suggestion: the operation timed out. Split the command into smaller steps or check the network.";
        }
        if (text.contains("network") || text.contains("econnrefused") || text.contains("enotfound")) {
            return "Suggestion: check the network connection. VPN or proxy settings may interfere.";
        }
        if (text.contains("permission") || text.contains("eacces") || text.contains("access denied")) {
            return "Suggestion: this is a file permission problem. Check access rights on the file.";
        }
        if (text.contains("enoent") || text.contains("not found") || text.contains("no such file")) {
            return "Suggestion: a file or directory was not found. Check the path.";
        }
        return "Suggestion: check the logs, fix the problem and try again.";
    }
}
