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

import me.golemcore.coder.domain.model.ToolFailureKind;

/**
 * Failure reported by a tool backend, carrying its classification so the retry
 * executor and the coordinator can react to it.
 */
public class ToolExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ToolFailureKind failureKind;

    public ToolExecutionException(String message, ToolFailureKind failureKind) {
        super(message);
        this.failureKind = failureKind;
    }

    public ToolExecutionException(String message, ToolFailureKind failureKind, Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }

    public ToolFailureKind getFailureKind() {
        return failureKind;
    }
}
