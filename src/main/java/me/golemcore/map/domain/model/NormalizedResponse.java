package me.golemcore.map.domain.model;

import java.util.List;

/**
 * LLM reply reduced to one of three shapes: a final answer, tool calls only, or
 * tool calls with accompanying prose.
 *
 * @param kind
 *            shape of the reply
 * @param content
 *            text content; for {@link Kind#TERMINAL_TEXT} the answer shown to
 *            the user
 * @param toolCalls
 *            calls in the order they appeared, empty for terminal replies
 * @param reasoningContent
 *            provider reasoning text, if any
 */
public record NormalizedResponse(Kind kind, String content, List<Message.ToolCall> toolCalls,
        String reasoningContent) {

    public enum Kind {
        TERMINAL_TEXT, TOOL_CALLS, MIXED
    }

    public NormalizedResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static NormalizedResponse terminal(String content, String reasoningContent) {
        return new NormalizedResponse(Kind.TERMINAL_TEXT, content == null ? "" : content, List.of(),
                reasoningContent);
    }

    public static NormalizedResponse ofToolCalls(List<Message.ToolCall> toolCalls, String reasoningContent) {
        return new NormalizedResponse(Kind.TOOL_CALLS, null, toolCalls, reasoningContent);
    }

    public static NormalizedResponse mixed(String content, List<Message.ToolCall> toolCalls,
            String reasoningContent) {
        return new NormalizedResponse(Kind.MIXED, content, toolCalls, reasoningContent);
    }

    public boolean hasToolCalls() {
        return kind != Kind.TERMINAL_TEXT;
    }
}
