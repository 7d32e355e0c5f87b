package me.golemcore.map.domain.model;

public enum RuntimeEventType {
    TURN_STARTED, LLM_FINISHED, LLM_FAILED, TOOL_STARTED, TOOL_FINISHED, TURN_FINISHED, ITERATION_LIMIT_REACHED, SYSTEM_MESSAGE
}
