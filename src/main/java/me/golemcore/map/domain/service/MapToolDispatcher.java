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
import me.golemcore.map.domain.component.ToolComponent;
import me.golemcore.map.domain.model.MapState;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolDefinition;
import me.golemcore.map.domain.model.ToolFailureKind;
import me.golemcore.map.domain.model.ToolResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Routes tool calls to the registered map tools.
 *
 * <p>
 * Unknown names and arguments that fail schema validation are rejected before
 * the tool runs, so the map is never touched by a call that cannot succeed.
 * Exceptions thrown by a tool become {@link ToolFailureKind#EXECUTION_FAILED}
 * results. Every result leaves with a snapshot of the map as it stands after
 * the call.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MapToolDispatcher {

    private final Map<String, ToolComponent> toolRegistry = new ConcurrentHashMap<>();

    public MapToolDispatcher(List<ToolComponent> tools) {
        for (ToolComponent tool : tools) {
            registerTool(tool);
        }
        log.info("[Tools] Registered {} map tools: {}", toolRegistry.size(), toolRegistry.keySet());
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.put(tool.getToolName(), tool);
    }

    public ToolComponent getTool(String name) {
        return toolRegistry.get(name);
    }

    /**
     * Definitions of all enabled tools, in name order.
     */
    public List<ToolDefinition> getToolDefinitions() {
        return toolRegistry.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .toList();
    }

    public ToolResult dispatch(MapState mapState, Message.ToolCall toolCall) {
        ToolResult result = executeToolCall(mapState, toolCall);
        return result.withMapState(mapState.snapshot());
    }

    private ToolResult executeToolCall(MapState mapState, Message.ToolCall toolCall) {
        String toolName = sanitizeToolName(toolCall.getName());
        ToolComponent tool = toolName != null ? toolRegistry.get(toolName) : null;

        if (tool == null || !tool.isEnabled()) {
            String available = String.join(", ", toolRegistry.keySet());
            log.warn("[Tools] Unknown tool requested: '{}'", toolCall.getName());
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolCall.getName() + ". Available tools: " + available);
        }

        Optional<String> violation = ToolArgumentValidator.validate(tool.getDefinition(), toolCall.getArguments());
        if (violation.isPresent()) {
            log.warn("[Tools] Rejected '{}' call: {}", toolName, violation.get());
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments for " + toolName + ": " + violation.get());
        }

        log.debug("[Tools] Executing '{}' with {}", toolName, toolCall.getArguments());
        try {
            CompletableFuture<ToolResult> future = tool.execute(mapState,
                    toolCall.getArguments() != null ? toolCall.getArguments() : Map.of());
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted: " + toolName);
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak tokens
     * like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.trim().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
