package me.golemcore.map.adapter.inbound.web;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.RuntimeEvent;
import me.golemcore.map.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket channel. Each connection is its own chat; runtime events of a turn
 * are translated into the outbound notification messages:
 * <ul>
 * <li>{@code tool_call} - before a tool runs
 * <li>{@code tool_result} - after a tool ran, with the map state
 * <li>{@code llm_response} - the final prose answer
 * <li>{@code system-message} - model failures, the gave-up signal and other
 * control messages
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebChannelAdapter implements ChannelPort {

    static final String CHANNEL_TYPE = "web";

    static final String KEY_TYPE = "type";
    static final String KEY_CONTENT = "content";
    static final String VALUE_TOOL_CALL = "tool_call";
    static final String VALUE_TOOL_RESULT = "tool_result";
    static final String VALUE_LLM_RESPONSE = "llm_response";
    static final String VALUE_SYSTEM_MESSAGE = "system-message";

    private static final List<String> TOOL_CALL_FIELDS = List.of("tool", "arguments", "thinking_content",
            "diagnostics");
    private static final List<String> TOOL_RESULT_FIELDS = List.of("tool", "content", "success", "map_state",
            "coordinates", "diagnostics");
    private static final List<String> LLM_RESPONSE_FIELDS = List.of("content", "thinking_content", "diagnostics");

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private volatile boolean running = false;

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        running = true;
        log.info("[WebChannel] Started");
    }

    @Override
    public void stop() {
        running = false;
        sessions.values().forEach(session -> session.close().subscribe());
        sessions.clear();
        log.info("[WebChannel] Stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return sendJsonToChat(chatId, systemMessage(content));
    }

    @Override
    public void sendRuntimeEvent(String chatId, RuntimeEvent event) {
        Map<String, Object> wire = toWireMessage(event);
        if (wire != null) {
            sendJsonToChat(chatId, wire);
        }
    }

    public void registerSession(String connectionId, WebSocketSession session) {
        sessions.put(connectionId, session);
    }

    public void deregisterSession(String connectionId) {
        sessions.remove(connectionId);
    }

    public int getConnectionCount() {
        return sessions.size();
    }

    /**
     * Outbound message for a runtime event, or {@code null} for events that are
     * not shown to the client.
     */
    Map<String, Object> toWireMessage(RuntimeEvent event) {
        if (event == null || event.type() == null) {
            return null;
        }
        Map<String, Object> payload = event.payload() != null ? event.payload() : Map.of();
        return switch (event.type()) {
            case TOOL_STARTED -> project(VALUE_TOOL_CALL, payload, TOOL_CALL_FIELDS);
            case TOOL_FINISHED -> project(VALUE_TOOL_RESULT, payload, TOOL_RESULT_FIELDS);
            case TURN_FINISHED -> project(VALUE_LLM_RESPONSE, payload, LLM_RESPONSE_FIELDS);
            case LLM_FAILED, ITERATION_LIMIT_REACHED, SYSTEM_MESSAGE ->
                systemMessage(String.valueOf(payload.getOrDefault(KEY_CONTENT, "")));
            case TURN_STARTED, LLM_FINISHED -> null;
        };
    }

    private static Map<String, Object> project(String type, Map<String, Object> payload, List<String> fields) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(KEY_TYPE, type);
        for (String field : fields) {
            if (payload.containsKey(field)) {
                message.put(field, payload.get(field));
            }
        }
        return message;
    }

    private static Map<String, Object> systemMessage(String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(KEY_TYPE, VALUE_SYSTEM_MESSAGE);
        message.put(KEY_CONTENT, content != null ? content : "");
        return message;
    }

    private CompletableFuture<Void> sendJsonToChat(String chatId, Map<String, Object> payload) {
        if (chatId == null || chatId.isBlank()) {
            log.debug("[WebChannel] Skip send without chatId");
            return CompletableFuture.completedFuture(null);
        }

        WebSocketSession session = sessions.get(chatId);
        if (session == null || !session.isOpen()) {
            log.debug("[WebChannel] No active session for chatId: {}", chatId);
            return CompletableFuture.completedFuture(null);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[WebChannel] Failed to serialize {} for {}: {}", payload.get(KEY_TYPE), chatId,
                    e.getOriginalMessage());
            json = fallbackJson("Message serialization error: " + e.getOriginalMessage());
        }

        Mono<Void> sendMono = session.send(Mono.just(session.textMessage(json)));
        sendMono.subscribe(
                unused -> {
                },
                error -> log.warn("[WebChannel] Failed to send message to {}: {}", chatId, error.getMessage()));
        return CompletableFuture.completedFuture(null);
    }

    private String fallbackJson(String content) {
        try {
            return objectMapper.writeValueAsString(systemMessage(content));
        } catch (JsonProcessingException e) {
            log.debug("[WebChannel] Fallback serialization failed: {}", e.getOriginalMessage());
            return "{\"type\":\"system-message\",\"content\":\"Message serialization error\"}";
        }
    }
}
