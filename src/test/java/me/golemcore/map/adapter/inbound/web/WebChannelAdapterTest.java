package me.golemcore.map.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.map.domain.model.RuntimeEvent;
import me.golemcore.map.domain.model.RuntimeEventType;
import me.golemcore.map.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class WebChannelAdapterTest {

    private static final String CHAT_ID = "conn-1";

    private ObjectMapper objectMapper;
    private WebChannelAdapter adapter;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        objectMapper = AutoConfiguration.objectMapper();
        adapter = new WebChannelAdapter(objectMapper);

        session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        when(session.send(any())).thenReturn(Mono.empty());
        when(session.textMessage(anyString())).thenReturn(mock(WebSocketMessage.class));
        when(session.close()).thenReturn(Mono.empty());
    }

    private static RuntimeEvent event(RuntimeEventType type, Map<String, Object> payload) {
        return RuntimeEvent.builder()
                .type(type)
                .timestamp(Instant.parse("2026-03-01T00:00:00Z"))
                .sessionId("s1")
                .channelType("web")
                .chatId(CHAT_ID)
                .payload(payload)
                .build();
    }

    private Map<?, ?> lastSent() throws Exception {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(session, atLeastOnce()).textMessage(captor.capture());
        List<String> all = captor.getAllValues();
        return objectMapper.readValue(all.get(all.size() - 1), Map.class);
    }

    // ===== Lifecycle =====

    @Test
    void shouldTrackRunningState() {
        assertEquals("web", adapter.getChannelType());
        assertFalse(adapter.isRunning());

        adapter.start();
        assertTrue(adapter.isRunning());

        adapter.registerSession(CHAT_ID, session);
        adapter.stop();

        assertFalse(adapter.isRunning());
        assertEquals(0, adapter.getConnectionCount());
        verify(session).close();
    }

    // ===== Wire mapping =====

    @Test
    void shouldMapToolStartedToToolCall() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", "zoom_to_level");
        payload.put("arguments", Map.of("zoom_level", 4));
        payload.put("diagnostics", Map.of("iteration", 1));

        Map<String, Object> wire = adapter.toWireMessage(event(RuntimeEventType.TOOL_STARTED, payload));

        assertEquals("tool_call", wire.get("type"));
        assertEquals("zoom_to_level", wire.get("tool"));
        assertEquals(Map.of("zoom_level", 4), wire.get("arguments"));
        assertFalse(wire.containsKey("thinking_content"));
        assertTrue(wire.containsKey("diagnostics"));
    }

    @Test
    void shouldMapToolFinishedToToolResult() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", "navigate_to_location");
        payload.put("content", "Map navigated to coordinates: 48.8566, 2.3522");
        payload.put("success", true);
        payload.put("map_state", Map.of("center", List.of(2.3522, 48.8566), "zoom", 2));
        payload.put("coordinates", Map.of("latitude", 48.8566, "longitude", 2.3522));

        Map<String, Object> wire = adapter.toWireMessage(event(RuntimeEventType.TOOL_FINISHED, payload));

        assertEquals("tool_result", wire.get("type"));
        assertEquals(true, wire.get("success"));
        assertNotNull(wire.get("map_state"));
        assertNotNull(wire.get("coordinates"));
    }

    @Test
    void shouldMapTurnFinishedToLlmResponse() {
        Map<String, Object> wire = adapter.toWireMessage(event(RuntimeEventType.TURN_FINISHED,
                Map.of("content", "Here is Paris.", "thinking_content", "easy")));

        assertEquals("llm_response", wire.get("type"));
        assertEquals("Here is Paris.", wire.get("content"));
        assertEquals("easy", wire.get("thinking_content"));
    }

    @Test
    void shouldMapFailuresToSystemMessages() {
        Map<String, Object> failed = adapter.toWireMessage(event(RuntimeEventType.LLM_FAILED,
                Map.of("content", "LLM Error: LLM API returned HTTP 401", "error_code", "llm.http.authentication")));
        Map<String, Object> gaveUp = adapter.toWireMessage(event(RuntimeEventType.ITERATION_LIMIT_REACHED,
                Map.of("content", "Gave up after 5 iterations without a final answer.", "iterations", 5)));

        assertEquals(Map.of("type", "system-message", "content", "LLM Error: LLM API returned HTTP 401"), failed);
        assertEquals("system-message", gaveUp.get("type"));
        assertFalse(gaveUp.containsKey("iterations"));
    }

    @Test
    void shouldNotForwardInternalEvents() {
        assertNull(adapter.toWireMessage(event(RuntimeEventType.TURN_STARTED, Map.of())));
        assertNull(adapter.toWireMessage(event(RuntimeEventType.LLM_FINISHED, Map.of())));
        assertNull(adapter.toWireMessage(null));
    }

    // ===== Sending =====

    @Test
    void shouldSendRuntimeEventAsJson() throws Exception {
        adapter.registerSession(CHAT_ID, session);

        adapter.sendRuntimeEvent(CHAT_ID, event(RuntimeEventType.TURN_FINISHED, Map.of("content", "Done")));

        Map<?, ?> sent = lastSent();
        assertEquals("llm_response", sent.get("type"));
        assertEquals("Done", sent.get("content"));
        verify(session).send(any());
    }

    @Test
    void shouldSendPlainMessageAsSystemMessage() throws Exception {
        adapter.registerSession(CHAT_ID, session);

        adapter.sendMessage(CHAT_ID, "Invalid JSON format received").join();

        Map<?, ?> sent = lastSent();
        assertEquals("system-message", sent.get("type"));
        assertEquals("Invalid JSON format received", sent.get("content"));
    }

    @Test
    void shouldSkipInternalEventsWithoutSending() {
        adapter.registerSession(CHAT_ID, session);

        adapter.sendRuntimeEvent(CHAT_ID, event(RuntimeEventType.LLM_FINISHED, Map.of()));

        verify(session, never()).send(any());
    }

    @Test
    void shouldSkipClosedOrUnknownSessions() {
        WebSocketSession closed = mock(WebSocketSession.class);
        when(closed.isOpen()).thenReturn(false);
        adapter.registerSession("closed", closed);

        adapter.sendMessage("closed", "hello").join();
        adapter.sendMessage("missing", "hello").join();
        adapter.sendMessage(" ", "hello").join();

        verify(closed, never()).send(any());
    }

    @Test
    void shouldFallBackToSystemMessageWhenPayloadCannotBeSerialized() throws Exception {
        adapter.registerSession(CHAT_ID, session);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", "zoom_to_level");
        payload.put("arguments", new Object());

        adapter.sendRuntimeEvent(CHAT_ID, event(RuntimeEventType.TOOL_STARTED, payload));

        Map<?, ?> sent = lastSent();
        assertEquals("system-message", sent.get("type"));
        assertTrue(((String) sent.get("content")).startsWith("Message serialization error"));
    }

    @Test
    void shouldDeregisterSession() {
        adapter.registerSession(CHAT_ID, session);
        assertEquals(1, adapter.getConnectionCount());

        adapter.deregisterSession(CHAT_ID);

        assertEquals(0, adapter.getConnectionCount());
    }
}
