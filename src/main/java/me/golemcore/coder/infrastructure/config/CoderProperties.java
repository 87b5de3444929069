package me.golemcore.coder.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the coding agent engine.
 *
 * <p>
 * Bound from {@code coder.*} in {@code application.yml}. Every nested section
 * has working defaults so the engine can be constructed in tests with
 * {@code new CoderProperties()}.
 */
@Component
@ConfigurationProperties(prefix = "coder")
@Data
public class CoderProperties {

    private LoopProperties loop = new LoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private VerificationProperties verification = new VerificationProperties();
    private WorkspaceProperties workspace = new WorkspaceProperties();
    private MemoryProperties memory = new MemoryProperties();
    private TraceProperties trace = new TraceProperties();
    private TransactionProperties transaction = new TransactionProperties();
    private LlmProperties llm = new LlmProperties();
    private ActivityLogProperties activityLog = new ActivityLogProperties();

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxIterations = 50;
        private int maxConsecutiveRepeats = 2;
        private int requiredFilesIterationLimit = 3;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private long timeoutMs = 360_000L;
        private int maxRetries = 2;
        private long initialRetryDelayMs = 2_000L;
        private long maxRetryDelayMs = 10_000L;
        private double backoffMultiplier = 2.0;
        private int maxOutputLength = 100_000;
        private int commandTimeoutSeconds = 300;
        private String allowedEnvVars = "";
    }

    // ==================== APPROVAL ====================

    @Data
    public static class ApprovalProperties {
        private int bulkFileChangeThreshold = 5;
        private int largeWriteThreshold = 50_000;
        private int notePreviewLimit = 2;
    }

    // ==================== VERIFICATION ====================

    @Data
    public static class VerificationProperties {
        private boolean enabled = true;
        private int maxLintFiles = 10;
        private int maxTestFiles = 8;
        private int detailsMaxLength = 1200;
        private List<String> testGatePaths = new ArrayList<>(List.of("lib/domains/agent/", "tests/lib/langgraph/"));
    }

    // ==================== WORKSPACE ====================

    @Data
    public static class WorkspaceProperties {
        private int maxFiles = 8000;
        private int analyzerDepth = 3;
        private int recommendedFiles = 5;
        private List<String> ignoredDirectories = new ArrayList<>(
                List.of(".git", "node_modules", ".next", "dist", "build", "coverage", ".cache", "out", "release"));
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private int maxKeyDecisions = 12;
        private int maxToolOutcomes = 12;
        private int maxFiles = 20;
    }

    @Data
    public static class TraceProperties {
        private int maxEntries = 200;
    }

    @Data
    public static class TransactionProperties {
        private int maxRollbackPoints = 5;
        private int maxSnapshotsPerFile = 10;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 120_000L;
        private double temperature = 0.2;
        private double triageTemperature = 0.1;
        private int triageMaxTokens = 10;
        private int maxTokens = 4096;
    }

    @Data
    public static class ActivityLogProperties {
        private boolean enabled = true;
        private String path = "${user.home}/.golemcore/coder/activity.jsonl";
    }
}
