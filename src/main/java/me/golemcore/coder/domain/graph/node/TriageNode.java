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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.graph.AgentSession;
import me.golemcore.coder.domain.model.AgentStateUpdate;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.TracePhase;
import me.golemcore.coder.domain.model.TriageDecision;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a request can be answered directly or needs the full tool
 * pipeline. Keyword and file-reference matches skip the model call; anything
 * that goes wrong falls back to the pipeline.
 */
@Component
@Slf4j
public class TriageNode implements PhaseNode {

    // Matched as substrings of the lower-cased prompt
    static final List<String> PIPELINE_KEYWORDS = List.of(
            // actions
            "make", "create", "build", "fix", "implement", "generate", "run ", "install", "edit", "update",
            // inspection
            "test", "debug", "analyze", "review", "check", "verify", "list", "ls", "dir", "show", "read",
            "search", "find", "grep", "tree", "cat", "print", "locate",
            // nouns
            "file", "folder", "directory", "path", "structure", "code", "error", "bug", "issue",
            // Korean actions
            "만들", "생성", "작성", "수정", "변경", "편집", "설치", "실행", "빌드",
            // Korean inspection
            "테스트", "디버그", "분석", "리뷰", "검토", "확인", "목록", "리스트", "보여", "읽어", "검색", "찾아", "구조",
            "무엇", "뭐야", "어때",
            // Korean nouns
            "파일", "폴더", "디렉터리", "디렉토리", "경로", "에러", "오류", "버그", "이슈", "코드");

    private static final Pattern FILE_REFERENCE = Pattern.compile("[a-zA-Z0-9_\\-.]+\\.(ts|js|py|html|css|json|md)");

    private final LlmPort llmPort;
    private final CoderProperties.LlmProperties llmProperties;
    private final Clock clock;

    public TriageNode(LlmPort llmPort, CoderProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.llmProperties = properties.getLlm();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "triage";
    }

    @Override
    public TracePhase getTracePhase() {
        return TracePhase.TRIAGE;
    }

    @Override
    public AgentStateUpdate execute(AgentSession session) {
        String prompt = session.getState().lastUserText();
        if (requiresPipeline(prompt)) {
            log.info("[Triage] Fast path: technical keywords or file references");
            return decide(TriageDecision.GRAPH, "Detected technical keywords or file references");
        }

        try {
            LlmRequest request = LlmRequest.builder()
                    .model(llmProperties.getModel())
                    .messages(List.of(
                            Message.system(CodingPrompts.TRIAGE, clock.instant()),
                            Message.user(prompt, clock.instant())))
                    .temperature(llmProperties.getTriageTemperature())
                    .maxTokens(llmProperties.getTriageMaxTokens())
                    .sessionId(session.getConversationId())
                    .build();
            LlmResponse response = llmPort.chat(request).join();
            String classification = response.getContent() != null
                    ? response.getContent().trim().toUpperCase(Locale.ROOT)
                    : "";
            log.info("[Triage] Model classification: {}", classification);
            if (classification.contains("SIMPLE")) {
                return decide(TriageDecision.DIRECT_RESPONSE, "Classified as a general or simple query");
            }
            return decide(TriageDecision.GRAPH, "Classified as complex or context-dependent");
        } catch (RuntimeException e) {
            log.warn("[Triage] Classification failed, falling back to pipeline: {}", e.getMessage());
            return decide(TriageDecision.GRAPH, "Triage fallback");
        }
    }

    static boolean requiresPipeline(String prompt) {
        if (prompt == null) {
            return false;
        }
        String lower = prompt.toLowerCase(Locale.ROOT);
        boolean keyword = PIPELINE_KEYWORDS.stream().anyMatch(lower::contains);
        return keyword || prompt.contains("@") || FILE_REFERENCE.matcher(prompt).find();
    }

    private AgentStateUpdate decide(TriageDecision decision, String reason) {
        return AgentStateUpdate.builder()
                .triageDecision(decision)
                .statusMessage(reason)
                .build();
    }
}
