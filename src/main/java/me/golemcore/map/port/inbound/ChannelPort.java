package me.golemcore.map.port.inbound;

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

import me.golemcore.map.domain.model.RuntimeEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Client-facing transport a session is attached to.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "web").
     */
    String getChannelType();

    /**
     * Starts accepting connections.
     */
    void start();

    /**
     * Stops accepting connections and drops the open ones.
     */
    void stop();

    /**
     * Checks if the channel is currently active.
     */
    boolean isRunning();

    /**
     * Sends a control message (errors, notices) to the specified chat.
     */
    CompletableFuture<Void> sendMessage(String chatId, String content);

    /**
     * Forwards a progress event of a turn to the specified chat.
     */
    default void sendRuntimeEvent(String chatId, RuntimeEvent event) {
        // Default no-op
    }
}
