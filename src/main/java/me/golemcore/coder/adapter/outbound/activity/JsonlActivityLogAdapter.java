package me.golemcore.coder.adapter.outbound.activity;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.ActivityLogPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON object per tool invocation to a {@code .jsonl} file.
 * Writes are serialized; a failed write is logged and dropped.
 */
@Component
@Slf4j
public class JsonlActivityLogAdapter implements ActivityLogPort {

    private static final String NEWLINE = "\n";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;
    private final Path logFile;

    public JsonlActivityLogAdapter(CoderProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = properties.getActivityLog().isEnabled();
        this.logFile = resolvePath(properties.getActivityLog().getPath());
    }

    @Override
    public synchronized void record(ActivityRecord record) {
        if (!enabled) {
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", clock.instant().toString());
        line.put("conversationId", record.conversationId());
        line.put("toolName", record.toolName());
        line.put("arguments", record.arguments());
        line.put("result", record.result());
        line.put("status", record.status());
        line.put("durationMs", record.durationMs());
        try {
            Path parent = logFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, objectMapper.writeValueAsString(line) + NEWLINE, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("[Activity] Failed to append activity for {}: {}", record.toolName(), e.getMessage());
        }
    }

    Path getLogFile() {
        return logFile;
    }

    static Path resolvePath(String configured) {
        String path = configured.replace("${user.home}", System.getProperty("user.home"));
        if (path.startsWith("~/")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        return Path.of(path);
    }
}
