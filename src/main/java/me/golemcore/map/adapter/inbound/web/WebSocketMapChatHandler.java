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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.service.MapSessionService;
import me.golemcore.map.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.map.domain.system.toolloop.ToolLoopTurnResult;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;
import java.util.UUID;

/**
 * Map chat socket. Frames of one connection are processed strictly one after
 * another: a turn runs its whole tool loop before the next frame is read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketMapChatHandler implements WebSocketHandler {

    static final String TYPE_CHAT_MESSAGE = "chat_message";
    static final String INVALID_JSON = "Invalid JSON format received";

    private final WebChannelAdapter webChannelAdapter;
    private final MapSessionService sessionService;
    private final ToolLoopSystem toolLoopSystem;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        if (!webChannelAdapter.isRunning()) {
            log.warn("[WebSocket] Connection rejected: web channel is not running");
            return session.close();
        }

        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: connectionId={}", connectionId);

        webChannelAdapter.registerSession(connectionId, session);
        sessionService.open(WebChannelAdapter.CHANNEL_TYPE, connectionId);

        return session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(payload -> Mono.fromRunnable(() -> handleIncoming(payload, connectionId))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    sessionService.close(connectionId);
                    webChannelAdapter.deregisterSession(connectionId);
                })
                .then();
    }

    void handleIncoming(String payload, String connectionId) {
        JsonNode json;
        try {
            json = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[WebSocket] Invalid JSON from {}: {}", connectionId, e.getOriginalMessage());
            webChannelAdapter.sendMessage(connectionId, INVALID_JSON);
            return;
        }

        if (json == null || !json.isObject() || !TYPE_CHAT_MESSAGE.equals(json.path("type").asText(null))) {
            log.debug("[WebSocket] Ignoring non-chat frame from {}", connectionId);
            return;
        }

        String content = json.path("content").asText("");
        if (content.isBlank()) {
            return;
        }

        Optional<MapSession> session = sessionService.get(connectionId);
        if (session.isEmpty()) {
            log.debug("[WebSocket] No session for {}, dropping message", connectionId);
            return;
        }

        try {
            ToolLoopTurnResult result = toolLoopSystem.processTurn(session.get(), content);
            log.debug("[WebSocket] Turn for {} ended: {} ({} LLM calls, {} tool executions)", connectionId,
                    result.status(), result.llmCalls(), result.toolExecutions());
        } catch (RuntimeException e) { // NOSONAR - keep the connection alive
            log.error("[WebSocket] Failed to process message from {}", connectionId, e);
            webChannelAdapter.sendMessage(connectionId, "Error processing message: " + e.getMessage());
        }
    }
}
