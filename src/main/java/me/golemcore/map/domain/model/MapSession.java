package me.golemcore.map.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state of one client connection.
 *
 * <p>
 * Holds the message history of the current turn and the connection's own
 * {@link MapState}. {@link #startTurn()} drops the previous turn's messages and
 * resets the iteration counter and the terminal flag, so each utterance is sent
 * to the model with only its own context.
 *
 * @since 1.0
 */
@Data
@Builder
public class MapSession {

    private String id;
    private String channelType;
    private String chatId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private MapState mapState;

    private int iterationCount;
    private boolean terminal;

    private Instant createdAt;
    private Instant updatedAt;

    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
        updatedAt = Instant.now();
    }

    public void startTurn() {
        if (messages == null) {
            messages = new ArrayList<>();
        } else {
            messages.clear();
        }
        iterationCount = 0;
        terminal = false;
    }

    public void completeIteration() {
        iterationCount++;
    }

    public void markTerminal() {
        terminal = true;
    }
}
