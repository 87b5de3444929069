package me.golemcore.coder.domain.graph.node;

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

import java.util.List;

/**
 * Prompt text sent to the model by the phase nodes.
 */
final class CodingPrompts {

    static final String TRIAGE = """
            You are a triage expert for a coding assistant.
            Determine if the user request requires accessing the codebase, tools, or project context.

            Respond with "COMPLEX" if the request:
            - requires reading or writing files or listing directories
            - requires searching the codebase or answering about project structure
            - requires running commands or using any tools
            - asks a specific question about the code

            Respond with "SIMPLE" only for a greeting, a general programming question unrelated to \
            this project, or a question about your identity.

            Output ONE word: COMPLEX or SIMPLE.""";

    static final String DIRECT_RESPONSE = """
            You are a direct response specialist.
            Answer immediately from your own knowledge, without tools. Keep the answer concise and relevant.""";

    static final String PLANNER = """
            You analyze the user's request and create an execution plan.

            First decide the task type:
            - READ-ONLY tasks (summarize, explain, analyze, review): plan to read files and respond.
            - MODIFICATION tasks (create, write, edit, change, run): plan to make changes with tools.

            Create a focused plan of 3-7 numbered steps. Start each step with a tag:
            [TOOL] for a step done with tools, [VERIFY] for a checking step,
            [DISCUSS] only when the user must decide something before work can continue.

            file_write can only write plain text. For binary formats write a script, \
            then run it with command_execute.""";

    private CodingPrompts() {
    }

    static String plannerTools(List<String> toolLines) {
        return "\n\n## AVAILABLE TOOLS\nYou can ONLY use the following tools in your plan:\n"
                + String.join("\n", toolLines);
    }

    static String plannerRequest(String userPrompt) {
        return "User request:\n" + userPrompt + "\n\nCreate an actionable execution plan:\n"
                + "1. First line: [READ-ONLY] or [MODIFICATION]\n"
                + "2. List numbered steps";
    }

    static String executionInstruction(String userPrompt) {
        return "Follow the plan above to complete the task: '" + userPrompt + "'.";
    }

    static String codingAgent(String workingDirectory) {
        return """
                You are a coding agent working inside the project directory %s.
                Use the available tools to inspect and change files and to run commands. \
                Relative paths are resolved against the project directory.
                Make concrete progress with every response: read before you edit, keep edits minimal, \
                and run scripts you write. When the task is complete, answer without tool calls and \
                summarize what you did.""".formatted(workingDirectory);
    }

    static String planStep(int currentStep, int totalSteps, String stepDescription) {
        return "Current step (" + (currentStep + 1) + "/" + totalSteps + "):\n" + stepDescription
                + "\n\nFocus on completing THIS step before moving to the next. Use tools to make concrete progress.";
    }
}
