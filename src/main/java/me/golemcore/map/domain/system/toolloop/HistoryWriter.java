package me.golemcore.map.domain.system.toolloop;

import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.Message;

import java.util.List;

/**
 * Appends conversation turns to the session history in the order the loop
 * produces them.
 */
public interface HistoryWriter {

    void appendUserMessage(MapSession session, String text);

    void appendAssistantToolCalls(MapSession session, String content, List<Message.ToolCall> toolCalls);

    void appendToolResult(MapSession session, ToolExecutionOutcome outcome);

    void appendFinalAssistantAnswer(MapSession session, String finalText);
}
