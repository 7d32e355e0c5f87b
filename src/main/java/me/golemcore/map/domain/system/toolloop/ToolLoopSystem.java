package me.golemcore.map.domain.system.toolloop;

import me.golemcore.map.domain.model.MapSession;

/**
 * Runs one user utterance through the call-model / execute-tools cycle until
 * the model answers in prose, the iteration cap is hit or the model call fails.
 */
public interface ToolLoopSystem {

    ToolLoopTurnResult processTurn(MapSession session, String userText);
}
