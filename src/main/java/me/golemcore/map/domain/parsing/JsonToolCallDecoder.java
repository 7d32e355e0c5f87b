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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.ToolCallOrigin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes the JSON shapes models use to express tool calls in plain content.
 *
 * <p>
 * Recognized object encodings:
 * <ul>
 * <li>{@code {"function_name": N, "parameters": {...}}}</li>
 * <li>{@code {"name"|"tool"|"tool_name": N, "arguments"|"parameters"|"args": {...}}}</li>
 * <li>{@code {"function": {"name": N, "arguments": {...} | "<json>"}}}</li>
 * <li>{@code {"<known tool name>": {...}}}</li>
 * </ul>
 * The {@code name} and {@code function} shapes count only when an arguments
 * key is present or N is a registered tool, so ordinary JSON such as
 * {@code {"name": "Eiffel Tower"}} stays a final answer. A JSON array is
 * accepted when every element is one of the above. Arguments supplied as a
 * JSON-encoded string are decoded.
 *
 * @since 1.0
 */
public class JsonToolCallDecoder {

    private static final List<String> NAME_KEYS = List.of("name", "tool", "tool_name");
    private static final List<String> ARGUMENT_KEYS = List.of("arguments", "parameters", "args");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Set<String> knownToolNames;

    public JsonToolCallDecoder(ObjectMapper objectMapper, Collection<String> knownToolNames) {
        this.objectMapper = objectMapper;
        this.knownToolNames = Set.copyOf(knownToolNames);
    }

    /**
     * @return decoded calls in order, or empty when the node is not a
     *         recognized encoding (an array with any unrecognized element is
     *         rejected as a whole)
     */
    public Optional<List<Message.ToolCall>> decode(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isObject()) {
            return decodeObject(node).map(List::of);
        }
        if (node.isArray() && !node.isEmpty()) {
            List<Message.ToolCall> calls = new ArrayList<>();
            for (JsonNode element : node) {
                Optional<Message.ToolCall> call = element.isObject() ? decodeObject(element) : Optional.empty();
                if (call.isEmpty()) {
                    return Optional.empty();
                }
                calls.add(call.get());
            }
            return Optional.of(calls);
        }
        return Optional.empty();
    }

    private Optional<Message.ToolCall> decodeObject(JsonNode node) {
        JsonNode functionName = node.get("function_name");
        if (isName(functionName)) {
            return toolCall(functionName.asText(), node.get("parameters"));
        }

        JsonNode arguments = firstPresent(node, ARGUMENT_KEYS);
        for (String nameKey : NAME_KEYS) {
            JsonNode name = node.get(nameKey);
            if (isName(name) && (arguments != null || isKnownTool(name))) {
                return toolCall(name.asText(), arguments);
            }
        }

        JsonNode function = node.get("function");
        if (function != null && function.isObject() && isName(function.get("name"))
                && (function.has("arguments") || isKnownTool(function.get("name")))) {
            return toolCall(function.get("name").asText(), function.get("arguments"));
        }

        if (node.size() == 1) {
            String key = node.fieldNames().next();
            if (knownToolNames.contains(key)) {
                return toolCall(key, node.get(key));
            }
        }
        return Optional.empty();
    }

    private Optional<Message.ToolCall> toolCall(String name, JsonNode argumentsNode) {
        Optional<Map<String, Object>> arguments = decodeArguments(argumentsNode);
        return arguments.map(args -> Message.ToolCall.builder()
                .name(name)
                .arguments(args)
                .origin(ToolCallOrigin.TEXT_EXTRACTED)
                .build());
    }

    private Optional<Map<String, Object>> decodeArguments(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.of(new LinkedHashMap<>());
        }
        if (node.isObject()) {
            return Optional.of(objectMapper.convertValue(node, MAP_TYPE));
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return Optional.of(new LinkedHashMap<>());
            }
            try {
                JsonNode parsed = objectMapper.readTree(raw);
                if (parsed != null && parsed.isObject()) {
                    return Optional.of(objectMapper.convertValue(parsed, MAP_TYPE));
                }
            } catch (JsonProcessingException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static JsonNode firstPresent(JsonNode node, List<String> keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private boolean isKnownTool(JsonNode name) {
        return knownToolNames.contains(name.asText());
    }

    private static boolean isName(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }
}
