package me.golemcore.map.domain.system.toolloop;

import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(MapSession session, String text) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .content(text)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendAssistantToolCalls(MapSession session, String content, List<Message.ToolCall> toolCalls) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(List.copyOf(toolCalls))
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(MapSession session, ToolExecutionOutcome outcome) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(MapSession session, String finalText) {
        session.addMessage(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
