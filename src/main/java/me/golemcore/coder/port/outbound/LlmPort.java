package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.model.LlmChunk;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Port for chat-completion providers.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Executes a streaming chat request. Text arrives as deltas; tool calls are
     * attached to the final chunk. The default implementation adapts
     * {@link #chat(LlmRequest)} into a single final chunk.
     */
    default Flux<LlmChunk> chatStream(LlmRequest request) {
        return Mono.fromFuture(() -> chat(request)).flux()
                .map(response -> LlmChunk.builder()
                        .text(response.getContent())
                        .toolCalls(response.getToolCalls())
                        .totalTokens(response.getTotalTokens())
                        .done(true)
                        .build());
    }

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
