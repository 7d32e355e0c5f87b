package me.golemcore.map.domain.parsing;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.LlmResponse;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.NormalizedResponse;
import me.golemcore.map.domain.model.ToolCallOrigin;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces a raw LLM reply to a {@link NormalizedResponse}.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>Native tool calls, when present, are authoritative and no text
 * heuristics run.</li>
 * <li>The content is parsed as JSON (a surrounding Markdown code fence is
 * stripped): {@code {"response": ...}} is a final answer, recognized tool-call
 * encodings become calls (see {@link JsonToolCallDecoder}).</li>
 * <li>The text extractors run in order; the first match wins.</li>
 * <li>Anything else is a final answer.</li>
 * </ol>
 *
 * <p>
 * The normalizer holds no mutable state. Extracted calls carry no id; ids are
 * assigned by the tool loop.
 *
 * @since 1.0
 */
@Slf4j
public class ResponseNormalizer {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*\\n?(.*?)\\n?\\s*```$",
            Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final JsonToolCallDecoder jsonDecoder;
    private final List<TextToolCallExtractor> extractors;

    public ResponseNormalizer(ObjectMapper objectMapper, JsonToolCallDecoder jsonDecoder,
            List<TextToolCallExtractor> extractors) {
        this.objectMapper = objectMapper;
        this.jsonDecoder = jsonDecoder;
        this.extractors = List.copyOf(extractors);
    }

    public NormalizedResponse normalize(LlmResponse response) {
        if (response == null) {
            return NormalizedResponse.terminal("", null);
        }
        return normalize(response.getContent(), response.getToolCalls(), response.getReasoningContent());
    }

    public NormalizedResponse normalize(String content, List<Message.ToolCall> structuredCalls,
            String reasoningContent) {
        if (structuredCalls != null && !structuredCalls.isEmpty()) {
            List<Message.ToolCall> calls = new ArrayList<>(structuredCalls.size());
            for (Message.ToolCall call : structuredCalls) {
                calls.add(call.toBuilder().origin(ToolCallOrigin.STRUCTURED).build());
            }
            if (content != null && !content.isBlank()) {
                return NormalizedResponse.mixed(content, calls, reasoningContent);
            }
            return NormalizedResponse.ofToolCalls(calls, reasoningContent);
        }

        if (content == null || content.isBlank()) {
            return NormalizedResponse.terminal(content, reasoningContent);
        }

        Optional<JsonNode> json = parseJson(content);
        if (json.isPresent()) {
            JsonNode node = json.get();
            if (node.isObject() && node.has("response")) {
                JsonNode answer = node.get("response");
                String text;
                if (answer.isNull()) {
                    text = "";
                } else {
                    text = answer.isTextual() ? answer.asText() : answer.toString();
                }
                return NormalizedResponse.terminal(text, reasoningContent);
            }
            Optional<List<Message.ToolCall>> decoded = jsonDecoder.decode(node);
            if (decoded.isPresent()) {
                log.debug("[Normalizer] Decoded {} tool call(s) from JSON content", decoded.get().size());
                return NormalizedResponse.ofToolCalls(decoded.get(), reasoningContent);
            }
        }

        for (TextToolCallExtractor extractor : extractors) {
            Optional<Message.ToolCall> extracted = extractor.extract(content);
            if (extracted.isPresent()) {
                log.debug("[Normalizer] {} extracted {}", extractor.getClass().getSimpleName(),
                        extracted.get().getName());
                return NormalizedResponse.ofToolCalls(List.of(extracted.get()), reasoningContent);
            }
        }

        return NormalizedResponse.terminal(content, reasoningContent);
    }

    private Optional<JsonNode> parseJson(String content) {
        String candidate = stripCodeFence(content.strip());
        if (!candidate.startsWith("{") && !candidate.startsWith("[")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readTree(candidate));
        } catch (JsonProcessingException e) {
            log.trace("[Normalizer] Content is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String stripCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        if (matcher.matches()) {
            return matcher.group(1).strip();
        }
        return text;
    }
}
