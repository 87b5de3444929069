package me.golemcore.coder.domain.component;

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

import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.domain.model.ToolExecutionContext;
import me.golemcore.coder.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a builtin tool the model can call. Tools expose their
 * JSON Schema definition for function calling and implement the execution
 * logic. Every builtin tool bean is picked up by the builtin tool registry.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Failures are reported through the returned
     * {@link ToolResult}; the future is not expected to complete exceptionally.
     *
     * @param parameters
     *            the arguments supplied by the model
     * @param context
     *            working directory and conversation of the call
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context);

    default boolean isEnabled() {
        return true;
    }

    default String getToolName() {
        return getDefinition().getName();
    }
}
