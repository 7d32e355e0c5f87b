package me.golemcore.map.domain.system.toolloop;

import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.Message;

public interface ToolExecutorPort {

    ToolExecutionOutcome execute(MapSession session, Message.ToolCall toolCall);
}
