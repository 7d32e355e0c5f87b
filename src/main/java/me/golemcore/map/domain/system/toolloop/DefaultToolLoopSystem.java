package me.golemcore.map.domain.system.toolloop;

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

import me.golemcore.map.domain.model.LlmRequest;
import me.golemcore.map.domain.model.LlmResponse;
import me.golemcore.map.domain.model.MapSession;
import me.golemcore.map.domain.model.MapSnapshot;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.NormalizedResponse;
import me.golemcore.map.domain.model.RuntimeEventType;
import me.golemcore.map.domain.model.ToolDefinition;
import me.golemcore.map.domain.model.ToolFailureKind;
import me.golemcore.map.domain.model.ToolResult;
import me.golemcore.map.domain.parsing.ResponseNormalizer;
import me.golemcore.map.domain.service.RuntimeEventService;
import me.golemcore.map.domain.system.LlmErrorClassifier;
import me.golemcore.map.domain.system.toolloop.ToolLoopTurnResult.TurnStatus;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * One {@link #processTurn} call drives a single user utterance through:
 * <ol>
 * <li>model call with the full session history and the tool catalogue
 * <li>normalization of the reply into tool calls or prose
 * <li>sequential execution of the tool calls against the session's map state
 * <li>appending the outcomes to history and calling the model again
 * </ol>
 * until the model answers in prose, the iteration cap is reached or the model
 * call fails. Every step is reported through {@link RuntimeEventService}.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private static final String TOOL_CALL_ID_PREFIX = "call_";

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ResponseNormalizer normalizer;
    private final RuntimeEventService runtimeEvents;
    private final Supplier<List<ToolDefinition>> toolCatalog;
    private final MapAgentProperties.LlmProperties llmSettings;
    private final MapAgentProperties.ToolLoopProperties settings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ResponseNormalizer normalizer, RuntimeEventService runtimeEvents,
            Supplier<List<ToolDefinition>> toolCatalog, MapAgentProperties.LlmProperties llmSettings,
            MapAgentProperties.ToolLoopProperties settings) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.normalizer = normalizer;
        this.runtimeEvents = runtimeEvents;
        this.toolCatalog = toolCatalog;
        this.llmSettings = llmSettings;
        this.settings = settings;
    }

    @Override
    public ToolLoopTurnResult processTurn(MapSession session, String userText) {
        session.startTurn();
        historyWriter.appendUserMessage(session, userText);
        runtimeEvents.emit(session, RuntimeEventType.TURN_STARTED, Map.of("user_message", safe(userText)));

        int maxIterations = settings != null ? Math.max(1, settings.getMaxIterations()) : 5;
        boolean stopOnRepeatedToolCall = settings != null && settings.isStopOnRepeatedToolCall();

        int llmCalls = 0;
        int toolExecutions = 0;
        List<Message.ToolCall> previousCalls = null;

        while (session.getIterationCount() < maxIterations) {
            int iteration = session.getIterationCount() + 1;

            // 1) Model call
            LlmResponse response;
            try {
                response = llmPort.chat(buildRequest(session)).join();
                llmCalls++;
            } catch (RuntimeException e) { // NOSONAR - any provider failure ends the turn
                llmCalls++;
                return failTurn(session, userText, e, iteration, llmCalls, toolExecutions);
            }

            NormalizedResponse normalized = normalizer.normalize(response);
            Map<String, Object> diagnostics = buildDiagnostics(userText, response, normalized, iteration);
            runtimeEvents.emit(session, RuntimeEventType.LLM_FINISHED, Map.of("diagnostics", diagnostics));

            // 2) Final answer
            if (!normalized.hasToolCalls()) {
                String answer = normalized.content();
                historyWriter.appendFinalAssistantAnswer(session, answer);
                session.markTerminal();

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("content", answer);
                putThinking(payload, normalized);
                payload.put("diagnostics", diagnostics);
                runtimeEvents.emit(session, RuntimeEventType.TURN_FINISHED, payload);

                log.debug("[ToolLoop] Turn answered after {} LLM call(s), {} tool execution(s)",
                        llmCalls, toolExecutions);
                return new ToolLoopTurnResult(TurnStatus.ANSWERED, answer, llmCalls, toolExecutions);
            }

            List<Message.ToolCall> toolCalls = assignIds(normalized.toolCalls());

            // 3) Repeated-call guard
            if (stopOnRepeatedToolCall && sameCalls(previousCalls, toolCalls)) {
                log.warn("[ToolLoop] Model repeated the same tool calls at iteration {}, giving up", iteration);
                return giveUp(session, "Gave up: the model repeated the same tool calls without reaching an answer.",
                        llmCalls, toolExecutions);
            }
            previousCalls = toolCalls;

            // 4) Execute in emission order, append results
            historyWriter.appendAssistantToolCalls(session, normalized.content(), toolCalls);
            for (Message.ToolCall toolCall : toolCalls) {
                emitToolStarted(session, toolCall, normalized, diagnostics);

                ToolExecutionOutcome outcome = executeTool(session, toolCall);
                toolExecutions++;

                historyWriter.appendToolResult(session, outcome);
                emitToolFinished(session, toolCall, outcome, diagnostics);
            }

            session.completeIteration();
        }

        log.warn("[ToolLoop] Reached max iterations ({}) without a final answer", maxIterations);
        return giveUp(session, "Gave up after " + maxIterations + " iterations without a final answer.",
                llmCalls, toolExecutions);
    }

    private LlmRequest buildRequest(MapSession session) {
        LlmRequest.LlmRequestBuilder builder = LlmRequest.builder()
                .systemPrompt(MapSystemPrompt.TEXT)
                .messages(new ArrayList<>(session.getMessages()))
                .tools(toolCatalog != null ? toolCatalog.get() : List.of())
                .sessionId(session.getId());
        if (llmSettings != null) {
            builder.model(llmSettings.getModel())
                    .temperature(llmSettings.getTemperature())
                    .maxTokens(llmSettings.getMaxTokens());
        }
        return builder.build();
    }

    private ToolExecutionOutcome executeTool(MapSession session, Message.ToolCall toolCall) {
        try {
            ToolExecutionOutcome outcome = toolExecutor.execute(session, toolCall);
            if (outcome != null) {
                return outcome;
            }
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: no result");
        } catch (RuntimeException e) { // NOSONAR - a broken tool must not end the turn
            log.error("[ToolLoop] Tool '{}' threw", toolCall.getName(), e);
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + e.getMessage());
        }
    }

    private ToolLoopTurnResult failTurn(MapSession session, String userText, RuntimeException error, int iteration,
            int llmCalls, int toolExecutions) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        String code = LlmErrorClassifier.classifyFromThrowable(cause);
        String detail = LlmErrorClassifier.stripCode(cause.getMessage());
        if (detail == null || detail.isBlank()) {
            detail = cause.getClass().getSimpleName();
        }
        String content = "LLM Error: " + detail;
        log.warn("[ToolLoop] LLM call failed at iteration {} ({}): {}", iteration, code, detail);

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("user_message", safe(userText));
        diagnostics.put("llm_success", false);
        diagnostics.put("llm_content", "");
        diagnostics.put("llm_error", detail);
        diagnostics.put("has_tool_calls", false);
        diagnostics.put("raw_tool_calls", List.of());
        diagnostics.put("iteration", iteration);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", content);
        payload.put("error_code", code);
        payload.put("diagnostics", diagnostics);

        session.markTerminal();
        runtimeEvents.emit(session, RuntimeEventType.LLM_FAILED, payload);
        return new ToolLoopTurnResult(TurnStatus.LLM_FAILED, content, llmCalls, toolExecutions);
    }

    private ToolLoopTurnResult giveUp(MapSession session, String reason, int llmCalls, int toolExecutions) {
        session.markTerminal();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", reason);
        payload.put("iterations", session.getIterationCount());
        runtimeEvents.emit(session, RuntimeEventType.ITERATION_LIMIT_REACHED, payload);
        return new ToolLoopTurnResult(TurnStatus.ITERATION_LIMIT_REACHED, reason, llmCalls, toolExecutions);
    }

    private void emitToolStarted(MapSession session, Message.ToolCall toolCall, NormalizedResponse normalized,
            Map<String, Object> diagnostics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolCall.getName());
        payload.put("arguments", toolCall.getArguments() != null ? toolCall.getArguments() : Map.of());
        putThinking(payload, normalized);
        payload.put("diagnostics", diagnostics);
        runtimeEvents.emit(session, RuntimeEventType.TOOL_STARTED, payload);
    }

    private void emitToolFinished(MapSession session, Message.ToolCall toolCall, ToolExecutionOutcome outcome,
            Map<String, Object> diagnostics) {
        ToolResult result = outcome.toolResult();
        MapSnapshot snapshot = result != null && result.getMapState() != null
                ? result.getMapState()
                : session.getMapState().snapshot();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolCall.getName());
        payload.put("content", outcome.messageContent());
        payload.put("success", result != null && result.isSuccess());
        payload.put("map_state", Map.of("center", snapshot.center(), "zoom", snapshot.zoom()));
        if (result != null && result.getData() != null && result.getData().get("coordinates") != null) {
            payload.put("coordinates", result.getData().get("coordinates"));
        }
        payload.put("diagnostics", diagnostics);
        runtimeEvents.emit(session, RuntimeEventType.TOOL_FINISHED, payload);
    }

    private Map<String, Object> buildDiagnostics(String userText, LlmResponse response, NormalizedResponse normalized,
            int iteration) {
        List<Map<String, Object>> rawToolCalls = new ArrayList<>();
        for (Message.ToolCall toolCall : normalized.toolCalls()) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("name", toolCall.getName());
            raw.put("arguments", toolCall.getArguments() != null ? toolCall.getArguments() : Map.of());
            raw.put("origin", toolCall.getOrigin() != null ? toolCall.getOrigin().name() : null);
            rawToolCalls.add(raw);
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("user_message", safe(userText));
        diagnostics.put("llm_success", true);
        diagnostics.put("llm_content", response != null ? safe(response.getContent()) : "");
        diagnostics.put("llm_error", null);
        diagnostics.put("has_tool_calls", normalized.hasToolCalls());
        diagnostics.put("raw_tool_calls", rawToolCalls);
        diagnostics.put("iteration", iteration);
        return diagnostics;
    }

    private static void putThinking(Map<String, Object> payload, NormalizedResponse normalized) {
        String reasoning = normalized.reasoningContent();
        if (reasoning != null && !reasoning.isBlank()) {
            payload.put("thinking_content", reasoning);
        }
    }

    private static List<Message.ToolCall> assignIds(List<Message.ToolCall> toolCalls) {
        List<Message.ToolCall> result = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            if (toolCall.getId() == null || toolCall.getId().isBlank()) {
                result.add(toolCall.toBuilder().id(TOOL_CALL_ID_PREFIX + UUID.randomUUID()).build());
            } else {
                result.add(toolCall);
            }
        }
        return result;
    }

    private static boolean sameCalls(List<Message.ToolCall> previous, List<Message.ToolCall> current) {
        if (previous == null || previous.size() != current.size()) {
            return false;
        }
        for (int i = 0; i < current.size(); i++) {
            Message.ToolCall a = previous.get(i);
            Message.ToolCall b = current.get(i);
            if (!Objects.equals(a.getName(), b.getName()) || !Objects.equals(a.getArguments(), b.getArguments())) {
                return false;
            }
        }
        return true;
    }

    private static String safe(String value) {
        return value != null ? value : "";
    }
}
