package me.golemcore.map.domain.system.toolloop;

import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolFailureKind;
import me.golemcore.map.domain.model.ToolResult;

public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                reason, true);
    }
}
