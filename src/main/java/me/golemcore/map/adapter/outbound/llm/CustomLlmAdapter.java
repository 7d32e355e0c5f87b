package me.golemcore.map.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.codec.DecodeException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.LlmCallException;
import me.golemcore.map.domain.model.LlmRequest;
import me.golemcore.map.domain.model.LlmResponse;
import me.golemcore.map.domain.model.LlmUsage;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolCallOrigin;
import me.golemcore.map.domain.model.ToolDefinition;
import me.golemcore.map.domain.system.LlmErrorClassifier;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for OpenAI-compatible chat-completion APIs using Feign + OkHttp.
 *
 * <p>
 * Sends the system prompt, the conversation and the tool catalog with
 * {@code tool_choice: "auto"}, and reads back content, native tool calls and the
 * optional {@code reasoning_content} some providers return.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code map.llm.custom.api-url} - Base URL of the API
 * <li>{@code map.llm.custom.api-key} - API key for authentication
 * <li>{@code map.llm.model}, {@code map.llm.temperature},
 * {@code map.llm.max-tokens}
 * </ul>
 *
 * <p>
 * Provider ID: {@code "custom"}. Failures are reported once, never retried.
 *
 * @see LlmProviderAdapter
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomLlmAdapter implements LlmProviderAdapter {

    private static final String FUNCTION_TYPE = "function";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MapAgentProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;

    private CustomLlmApi client;
    private String apiKey;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        MapAgentProperties.CustomProperties customProps = properties.getLlm().getCustom();
        this.apiKey = customProps.getApiKey();
        this.currentModel = properties.getLlm().getModel();

        if (customProps.getApiUrl() != null && !customProps.getApiUrl().isBlank()) {
            this.client = feignClientFactory.create(CustomLlmApi.class, customProps.getApiUrl());
            initialized = true;
            log.info("[LLM] Custom adapter initialized with URL: {}", customProps.getApiUrl());
        } else {
            log.warn("[LLM] Custom adapter has no api-url configured");
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return "custom";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (client == null) {
                throw new LlmCallException(LlmErrorClassifier.withCode(LlmErrorClassifier.PROVIDER_UNAVAILABLE,
                        "Custom LLM adapter not available: map.llm.custom.api-url is not set"));
            }

            ChatCompletionRequest apiRequest = buildRequest(request);
            try {
                ChatCompletionResponse apiResponse = client.chatCompletion(apiKey, apiRequest);
                return convertResponse(apiResponse);
            } catch (RetryableException e) {
                log.warn("[LLM] Custom LLM call failed to reach {}: {}",
                        properties.getLlm().getCustom().getApiUrl(), e.getMessage());
                String code = e.getCause() != null ? LlmErrorClassifier.classifyFromThrowable(e.getCause())
                        : LlmErrorClassifier.NETWORK_ERROR;
                if (LlmErrorClassifier.UNKNOWN.equals(code)) {
                    code = LlmErrorClassifier.NETWORK_ERROR;
                }
                throw new LlmCallException(LlmErrorClassifier.withCode(code, e.getMessage()), e);
            } catch (DecodeException e) {
                log.warn("[LLM] Custom LLM returned an unreadable body: {}", e.getMessage());
                throw new LlmCallException(LlmErrorClassifier.withCode(LlmErrorClassifier.MALFORMED_RESPONSE,
                        "Unreadable response from LLM API"), e);
            } catch (FeignException e) {
                if (e.status() >= 200 && e.status() < 300) {
                    log.warn("[LLM] Custom LLM body could not be read: {}", e.getMessage());
                    throw new LlmCallException(LlmErrorClassifier.withCode(LlmErrorClassifier.MALFORMED_RESPONSE,
                            "Unreadable response from LLM API"), e);
                }
                log.warn("[LLM] Custom LLM returned HTTP {}", e.status());
                throw new LlmCallException(LlmErrorClassifier.withCode(
                        LlmErrorClassifier.classifyHttpStatus(e.status()),
                        "LLM API returned HTTP " + e.status()), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        MapAgentProperties.CustomProperties customProps = properties.getLlm().getCustom();
        return customProps.getApiUrl() != null && !customProps.getApiUrl().isBlank() &&
                customProps.getApiKey() != null && !customProps.getApiKey().isBlank();
    }

    ChatCompletionRequest buildRequest(LlmRequest request) {
        List<ApiMessage> messages = new ArrayList<>();
        String systemPrompt = request.getSystemPrompt();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ApiMessage.of("system", systemPrompt));
        }
        request.getMessages().stream().map(this::toApiMessage).forEach(messages::add);

        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getCurrentModel());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens());
        apiRequest.setMessages(messages);

        List<ToolDefinition> tools = request.getTools();
        if (tools != null && !tools.isEmpty()) {
            apiRequest.setTools(tools.stream().map(CustomLlmAdapter::toApiTool).toList());
            apiRequest.setToolChoice("auto");
        }
        return apiRequest;
    }

    private ApiMessage toApiMessage(Message message) {
        ApiMessage apiMessage = ApiMessage.of(message.getRole(), message.getContent());
        apiMessage.setToolCallId(message.getToolCallId());
        if (message.hasToolCalls()) {
            apiMessage.setToolCalls(message.getToolCalls().stream().map(this::toApiToolCall).toList());
        }
        return apiMessage;
    }

    private ApiToolCall toApiToolCall(Message.ToolCall toolCall) {
        ApiFunction function = new ApiFunction();
        function.setName(toolCall.getName());
        function.setArguments(convertArgsToJson(toolCall.getArguments()));

        ApiToolCall apiToolCall = new ApiToolCall();
        apiToolCall.setId(toolCall.getId());
        apiToolCall.setType(FUNCTION_TYPE);
        apiToolCall.setFunction(function);
        return apiToolCall;
    }

    private static ApiTool toApiTool(ToolDefinition definition) {
        ApiToolFunction function = new ApiToolFunction();
        function.setName(definition.getName());
        function.setDescription(definition.getDescription());
        function.setParameters(definition.getInputSchema());

        ApiTool apiTool = new ApiTool();
        apiTool.setType(FUNCTION_TYPE);
        apiTool.setFunction(function);
        return apiTool;
    }

    private LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()
                || apiResponse.getChoices().get(0).getMessage() == null) {
            throw new LlmCallException(LlmErrorClassifier.withCode(LlmErrorClassifier.MALFORMED_RESPONSE,
                    "LLM API returned no choices"));
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage();
        return LlmResponse.builder()
                .content(message.getContent())
                .reasoningContent(message.getReasoningContent())
                .toolCalls(toToolCalls(message.getToolCalls()))
                .usage(toUsage(apiResponse.getUsage()))
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    private List<Message.ToolCall> toToolCalls(List<ApiToolCall> apiToolCalls) {
        if (apiToolCalls == null || apiToolCalls.isEmpty()) {
            return null;
        }
        List<Message.ToolCall> toolCalls = new ArrayList<>(apiToolCalls.size());
        for (ApiToolCall apiToolCall : apiToolCalls) {
            ApiFunction function = apiToolCall.getFunction();
            if (function == null) {
                continue;
            }
            toolCalls.add(Message.ToolCall.builder()
                    .id(apiToolCall.getId())
                    .name(function.getName())
                    .arguments(parseJsonArgs(function.getArguments()))
                    .origin(ToolCallOrigin.STRUCTURED)
                    .build());
        }
        return toolCalls;
    }

    private static LlmUsage toUsage(ApiUsage apiUsage) {
        if (apiUsage == null) {
            return null;
        }
        return LlmUsage.builder()
                .inputTokens(apiUsage.getPromptTokens())
                .outputTokens(apiUsage.getCompletionTokens())
                .totalTokens(apiUsage.getTotalTokens())
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            // Leave the call in place; the dispatcher reports the missing arguments
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    // Feign API interface
    public interface CustomLlmApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        @JsonProperty("tool_choice")
        private String toolChoice;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("reasoning_content")
        private String reasoningContent;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;

        static ApiMessage of(String role, String content) {
            ApiMessage message = new ApiMessage();
            message.setRole(role);
            message.setContent(content);
            return message;
        }
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
