package me.golemcore.map.domain.system.toolloop;

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

import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolResult;
import me.golemcore.map.domain.service.MapToolDispatcher;

/**
 * Executes tool calls against the session's own map state.
 */
public class DispatcherToolExecutor implements ToolExecutorPort {

    private final MapToolDispatcher dispatcher;

    public DispatcherToolExecutor(MapToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public ToolExecutionOutcome execute(MapSession session, Message.ToolCall toolCall) {
        ToolResult result = dispatcher.dispatch(session.getMapState(), toolCall);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.getMessage(), false);
    }
}
