package me.golemcore.map.domain.system.toolloop;

/**
 * Outcome of one {@link ToolLoopSystem#processTurn} call.
 *
 * @param status
 *            how the turn ended
 * @param finalAnswer
 *            prose answer, or the gave-up / error text for the other statuses
 * @param llmCalls
 *            number of model calls made during the turn
 * @param toolExecutions
 *            number of tool calls dispatched during the turn
 */
public record ToolLoopTurnResult(TurnStatus status, String finalAnswer, int llmCalls, int toolExecutions) {

    public enum TurnStatus {
        ANSWERED, ITERATION_LIMIT_REACHED, LLM_FAILED
    }

    public boolean isAnswered() {
        return status == TurnStatus.ANSWERED;
    }
}
