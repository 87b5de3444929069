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

import me.golemcore.coder.domain.model.Message;

import java.util.List;

/**
 * Short progress text for tool activity, attached to node events. Planning
 * mode describes calls the model just requested, executing mode describes
 * calls being dispatched.
 */
public final class ToolStatusMessages {

    private static final int COMMAND_PREVIEW_LENGTH = 50;

    private ToolStatusMessages() {
    }

    public static String describe(List<Message.ToolCall> toolCalls, boolean planning) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return planning ? "Completed thinking" : "Executing tools";
        }
        if (toolCalls.size() > 1) {
            return planning
                    ? "Planning to use " + toolCalls.size() + " tools"
                    : "Executing " + toolCalls.size() + " tools";
        }
        Message.ToolCall call = toolCalls.get(0);
        String name = call.getName() != null ? call.getName() : "unknown";
        String path = call.getStringArgument("path");
        return switch (name) {
        case "file_read" -> path != null
                ? (planning ? "Planning to read " : "Reading ") + path
                : generic(name, planning);
        case "file_write" -> path != null
                ? (planning ? "Planning to write to " : "Writing to ") + path
                : generic(name, planning);
        case "file_edit" -> path != null
                ? (planning ? "Planning to edit " : "Editing ") + path
                : generic(name, planning);
        case "command_execute" -> {
            String command = call.getStringArgument("command");
            yield command != null
                    ? (planning ? "Planning to run: " : "Running: ") + preview(command)
                    : generic(name, planning);
        }
        case "grep_search" -> {
            String pattern = call.getStringArgument("pattern");
            yield pattern != null
                    ? (planning ? "Planning to search for: " : "Searching for: ") + pattern
                    : generic(name, planning);
        }
        default -> generic(name, planning);
        };
    }

    private static String generic(String name, boolean planning) {
        return (planning ? "Planning to use " : "Executing ") + name;
    }

    private static String preview(String command) {
        return command.length() > COMMAND_PREVIEW_LENGTH
                ? command.substring(0, COMMAND_PREVIEW_LENGTH) + "..."
                : command;
    }
}
