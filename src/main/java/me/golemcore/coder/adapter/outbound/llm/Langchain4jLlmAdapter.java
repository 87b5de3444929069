package me.golemcore.coder.adapter.outbound.llm;

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
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.LlmRequest;
import me.golemcore.coder.domain.model.LlmResponse;
import me.golemcore.coder.domain.model.LlmToolCall;
import me.golemcore.coder.domain.model.Message;
import me.golemcore.coder.domain.model.ToolDefinition;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Chat-completion adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic and any OpenAI-compatible endpoint, selected by
 * {@code coder.llm.provider}. Tool-call arguments are handed to the engine as
 * the raw JSON text the model produced; the agent node decides how to parse
 * them.
 */
@Component
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final CoderProperties.LlmProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;

    public Langchain4jLlmAdapter(CoderProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return properties.getProvider();
    }

    @Override
    public boolean isAvailable() {
        return properties.getApiKey() != null && !properties.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getChatModel();
            ChatRequest.Builder chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request.getMessages()));
            List<ToolSpecification> tools = convertTools(request.getTools());
            if (!tools.isEmpty()) {
                log.trace("[LLM] Calling model with {} tools", tools.size());
                chatRequest.toolSpecifications(tools);
            }
            if (request.getTemperature() != null) {
                chatRequest.temperature(request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                chatRequest.maxOutputTokens(request.getMaxTokens());
            }
            try {
                return convertResponse(model.chat(chatRequest.build()));
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed: {}", e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    private synchronized ChatModel getChatModel() {
        if (chatModel == null) {
            if (!isAvailable()) {
                throw new IllegalStateException("LLM provider not configured. Set coder.llm.api-key");
            }
            chatModel = PROVIDER_ANTHROPIC.equals(properties.getProvider())
                    ? createAnthropicModel()
                    : createOpenAiModel();
            log.info("[LLM] Initialized {} model: {}", properties.getProvider(), properties.getModel());
        }
        return chatModel;
    }

    private ChatModel createAnthropicModel() {
        var builder = AnthropicChatModel.builder()
                .apiKey(properties.getApiKey())
                .modelName(properties.getModel())
                .maxRetries(0) // Retry handled by the engine
                .maxTokens(properties.getMaxTokens())
                .temperature(properties.getTemperature())
                .timeout(Duration.ofMillis(properties.getTimeoutMs()));
        if (properties.getBaseUrl() != null) {
            builder.baseUrl(properties.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel() {
        var builder = OpenAiChatModel.builder()
                .apiKey(properties.getApiKey())
                .modelName(properties.getModel())
                .maxRetries(0) // Retry handled by the engine
                .temperature(properties.getTemperature())
                .timeout(Duration.ofMillis(properties.getTimeoutMs()));
        if (properties.getBaseUrl() != null) {
            builder.baseUrl(properties.getBaseUrl());
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(List<Message> source) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : source) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(msg.getContent() != null && !msg.getContent().isBlank()
                            ? AiMessage.from(msg.getContent(), toolRequests)
                            : AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(msg.getContent() != null ? msg.getContent() : ""));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), msg.getContent()));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> props = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");
            if (props != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : props.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<LlmToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> new LlmToolCall(ter.id(), ter.name(), ter.arguments()))
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }
        long totalTokens = 0;
        if (response.tokenUsage() != null && response.tokenUsage().totalTokenCount() != null) {
            totalTokens = response.tokenUsage().totalTokenCount();
        }
        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .totalTokens(totalTokens)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }
}
