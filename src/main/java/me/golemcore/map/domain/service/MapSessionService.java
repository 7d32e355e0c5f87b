package me.golemcore.map.domain.service;

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
import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.MapState;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of open sessions, one per client connection.
 *
 * <p>
 * A session lives as long as its connection. Each gets its own
 * {@link MapState}, starting at the configured default view; nothing is
 * shared between sessions and nothing is persisted.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MapSessionService {

    private final MapAgentProperties properties;
    private final Clock clock;
    private final Map<String, MapSession> sessions = new ConcurrentHashMap<>();

    public MapSessionService(MapAgentProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public MapSession open(String channelType, String chatId) {
        MapAgentProperties.ViewProperties view = properties.getView();
        Instant now = clock.instant();
        MapSession session = MapSession.builder()
                .id(UUID.randomUUID().toString())
                .channelType(channelType)
                .chatId(chatId)
                .mapState(new MapState(view.getDefaultLongitude(), view.getDefaultLatitude(), view.getDefaultZoom()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessions.put(chatId, session);
        log.debug("[Session] Opened {} for {}:{}", session.getId(), channelType, chatId);
        return session;
    }

    public Optional<MapSession> get(String chatId) {
        return Optional.ofNullable(sessions.get(chatId));
    }

    public void close(String chatId) {
        MapSession removed = sessions.remove(chatId);
        if (removed != null) {
            log.debug("[Session] Closed {} ({} messages)", removed.getId(), removed.getMessages().size());
        }
    }

    public int getActiveCount() {
        return sessions.size();
    }
}
