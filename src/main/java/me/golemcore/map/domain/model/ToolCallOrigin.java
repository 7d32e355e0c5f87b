package me.golemcore.map.domain.model;

/**
 * Where a tool call came from.
 */
public enum ToolCallOrigin {

    /**
     * Native tool-call payload of the LLM response.
     */
    STRUCTURED,

    /**
     * Recovered from the assistant's text (JSON or natural language).
     */
    TEXT_EXTRACTED
}
