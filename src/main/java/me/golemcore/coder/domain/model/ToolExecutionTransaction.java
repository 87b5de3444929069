package me.golemcore.coder.domain.model;

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

import java.time.Instant;
import java.util.List;

/**
 * Pre-execution snapshots of every file a tool batch may touch.
 */
public record ToolExecutionTransaction(String id, Instant createdAt, List<FileSnapshot> files) {

    public ToolExecutionTransaction withFiles(List<FileSnapshot> retained) {
        return new ToolExecutionTransaction(id, createdAt, List.copyOf(retained));
    }

    public boolean isEmpty() {
        return files == null || files.isEmpty();
    }
}
