package me.golemcore.map.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.RuntimeEvent;
import me.golemcore.map.domain.model.RuntimeEventType;
import me.golemcore.map.port.inbound.ChannelPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds turn progress events and forwards them to the channel the session is
 * attached to. Delivery is best effort: a failing channel never breaks the
 * turn.
 */
@Service
@Slf4j
public class RuntimeEventService {

    private final Clock clock;
    private final Map<String, ChannelPort> channelRegistry = new ConcurrentHashMap<>();

    public RuntimeEventService(Clock clock, List<ChannelPort> channelPorts) {
        this.clock = clock;
        if (channelPorts != null) {
            for (ChannelPort channelPort : channelPorts) {
                if (channelPort != null) {
                    channelRegistry.put(channelPort.getChannelType(), channelPort);
                }
            }
        }
    }

    public RuntimeEvent emit(MapSession session, RuntimeEventType type, Map<String, Object> payload) {
        RuntimeEvent event = buildEvent(session, type, payload);
        log.debug("[Events] {} for session {}", type, event.sessionId());
        forwardEventToChannel(session, event);
        return event;
    }

    private RuntimeEvent buildEvent(MapSession session, RuntimeEventType type, Map<String, Object> payload) {
        Map<String, Object> safePayload = payload != null ? new LinkedHashMap<>(payload) : Map.of();

        return RuntimeEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .sessionId(session != null ? session.getId() : null)
                .channelType(session != null ? session.getChannelType() : null)
                .chatId(session != null ? session.getChatId() : null)
                .payload(safePayload)
                .build();
    }

    private void forwardEventToChannel(MapSession session, RuntimeEvent event) {
        if (session == null) {
            return;
        }

        String channelType = session.getChannelType();
        if (channelType == null || channelType.isBlank()) {
            return;
        }

        ChannelPort channelPort = channelRegistry.get(channelType);
        if (channelPort == null) {
            return;
        }

        String chatId = session.getChatId();
        if (chatId == null || chatId.isBlank()) {
            return;
        }

        try {
            channelPort.sendRuntimeEvent(chatId, event);
        } catch (RuntimeException e) { // NOSONAR - runtime event streaming must be best effort
            log.warn("[Events] Failed to deliver {} to {}/{}: {}", event.type(), channelType, chatId,
                    e.getMessage());
        }
    }
}
