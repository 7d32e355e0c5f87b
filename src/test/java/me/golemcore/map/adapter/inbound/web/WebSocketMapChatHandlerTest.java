package me.golemcore.map.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.service.MapSessionService;
import me.golemcore.map.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.map.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WebSocketMapChatHandlerTest {

    private static final String CONNECTION_ID = "conn-1";

    private WebChannelAdapter webChannelAdapter;
    private MapSessionService sessionService;
    private ToolLoopSystem toolLoopSystem;
    private WebSocketMapChatHandler handler;

    @BeforeEach
    void setUp() {
        webChannelAdapter = mock(WebChannelAdapter.class);
        when(webChannelAdapter.isRunning()).thenReturn(true);
        when(webChannelAdapter.sendMessage(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        sessionService = new MapSessionService(new MapAgentProperties(),
                Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));
        toolLoopSystem = mock(ToolLoopSystem.class);
        when(toolLoopSystem.processTurn(any(), anyString()))
                .thenReturn(new ToolLoopTurnResult(ToolLoopTurnResult.TurnStatus.ANSWERED, "ok", 1, 0));

        handler = new WebSocketMapChatHandler(webChannelAdapter, sessionService, toolLoopSystem, new ObjectMapper());
    }

    private static WebSocketMessage frame(String text) {
        WebSocketMessage message = mock(WebSocketMessage.class);
        when(message.getPayloadAsText()).thenReturn(text);
        return message;
    }

    // ===== handleIncoming =====

    @Test
    void shouldRunTurnForChatMessage() {
        MapSession session = sessionService.open("web", CONNECTION_ID);

        handler.handleIncoming("{\"type\": \"chat_message\", \"content\": \"Show me Tokyo\"}", CONNECTION_ID);

        verify(toolLoopSystem).processTurn(session, "Show me Tokyo");
        verify(webChannelAdapter, never()).sendMessage(anyString(), anyString());
    }

    @Test
    void shouldReportInvalidJson() {
        sessionService.open("web", CONNECTION_ID);

        handler.handleIncoming("{not json", CONNECTION_ID);

        verify(webChannelAdapter).sendMessage(CONNECTION_ID, WebSocketMapChatHandler.INVALID_JSON);
        verifyNoInteractions(toolLoopSystem);
    }

    @Test
    void shouldIgnoreOtherFrameTypes() {
        sessionService.open("web", CONNECTION_ID);

        handler.handleIncoming("{\"type\": \"ping\"}", CONNECTION_ID);
        handler.handleIncoming("[1, 2, 3]", CONNECTION_ID);
        handler.handleIncoming("\"chat_message\"", CONNECTION_ID);

        verifyNoInteractions(toolLoopSystem);
        verify(webChannelAdapter, never()).sendMessage(anyString(), anyString());
    }

    @Test
    void shouldIgnoreBlankContent() {
        sessionService.open("web", CONNECTION_ID);

        handler.handleIncoming("{\"type\": \"chat_message\", \"content\": \"   \"}", CONNECTION_ID);
        handler.handleIncoming("{\"type\": \"chat_message\"}", CONNECTION_ID);

        verifyNoInteractions(toolLoopSystem);
    }

    @Test
    void shouldDropMessageWithoutSession() {
        handler.handleIncoming("{\"type\": \"chat_message\", \"content\": \"hi\"}", "unknown");

        verifyNoInteractions(toolLoopSystem);
    }

    @Test
    void shouldReportUnexpectedTurnFailure() {
        sessionService.open("web", CONNECTION_ID);
        when(toolLoopSystem.processTurn(any(), anyString())).thenThrow(new IllegalStateException("boom"));

        handler.handleIncoming("{\"type\": \"chat_message\", \"content\": \"hi\"}", CONNECTION_ID);

        verify(webChannelAdapter).sendMessage(CONNECTION_ID, "Error processing message: boom");
    }

    // ===== handle =====

    @Test
    void shouldRejectConnectionWhenChannelStopped() {
        when(webChannelAdapter.isRunning()).thenReturn(false);
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.close()).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        verify(session).close();
        verify(webChannelAdapter, never()).registerSession(anyString(), any());
        assertEquals(0, sessionService.getActiveCount());
    }

    @Test
    void shouldProcessFramesInOrderAndCleanUp() {
        WebSocketSession session = mock(WebSocketSession.class);
        Flux<WebSocketMessage> frames = Flux.just(
                frame("{\"type\": \"chat_message\", \"content\": \"first\"}"),
                frame("garbage"),
                frame("{\"type\": \"chat_message\", \"content\": \"second\"}"));
        when(session.receive()).thenReturn(frames);

        StepVerifier.create(handler.handle(session)).verifyComplete();

        ArgumentCaptor<String> connectionId = ArgumentCaptor.forClass(String.class);
        verify(webChannelAdapter).registerSession(connectionId.capture(), eq(session));

        InOrder inOrder = inOrder(toolLoopSystem, webChannelAdapter);
        inOrder.verify(toolLoopSystem).processTurn(any(MapSession.class), eq("first"));
        inOrder.verify(webChannelAdapter).sendMessage(connectionId.getValue(), WebSocketMapChatHandler.INVALID_JSON);
        inOrder.verify(toolLoopSystem).processTurn(any(MapSession.class), eq("second"));

        verify(webChannelAdapter).deregisterSession(connectionId.getValue());
        assertEquals(0, sessionService.getActiveCount());
    }

    @Test
    void shouldGiveEachConnectionItsOwnSession() {
        WebSocketSession first = mock(WebSocketSession.class);
        WebSocketSession second = mock(WebSocketSession.class);
        Flux<WebSocketMessage> firstFrames = Flux.just(frame("{\"type\": \"chat_message\", \"content\": \"a\"}"));
        Flux<WebSocketMessage> secondFrames = Flux.just(frame("{\"type\": \"chat_message\", \"content\": \"b\"}"));
        when(first.receive()).thenReturn(firstFrames);
        when(second.receive()).thenReturn(secondFrames);

        StepVerifier.create(handler.handle(first)).verifyComplete();
        StepVerifier.create(handler.handle(second)).verifyComplete();

        ArgumentCaptor<MapSession> sessions = ArgumentCaptor.forClass(MapSession.class);
        verify(toolLoopSystem, times(2)).processTurn(sessions.capture(), anyString());
        assertNotSame(sessions.getAllValues().get(0), sessions.getAllValues().get(1));
        assertNotSame(sessions.getAllValues().get(0).getMapState(), sessions.getAllValues().get(1).getMapState());
    }
}
