package me.golemcore.map.domain.service;

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

import me.golemcore.map.domain.model.ToolDefinition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Checks tool arguments against the required keys and primitive types of a
 * tool's JSON schema. Only {@code number}, {@code integer}, {@code string} and
 * {@code boolean} are checked; other types pass.
 */
public final class ToolArgumentValidator {

    private ToolArgumentValidator() {
    }

    /**
     * @return a description of the first violation, or empty when the arguments
     *         are acceptable
     */
    public static Optional<String> validate(ToolDefinition definition, Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        Map<String, Object> properties = definition.getProperties();

        for (String required : definition.getRequired()) {
            if (!args.containsKey(required) || args.get(required) == null) {
                return Optional.of("Missing required parameter: " + required);
            }
        }

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            Object schema = properties.get(entry.getKey());
            if (!(schema instanceof Map<?, ?> propertySchema) || entry.getValue() == null) {
                continue;
            }
            Object type = propertySchema.get("type");
            if (type instanceof String expected && !matchesType(expected, entry.getValue())) {
                return Optional.of("Parameter '" + entry.getKey() + "' must be " + article(expected) + " "
                        + expected + ", got: " + entry.getValue());
            }
        }
        return Optional.empty();
    }

    static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "number" -> value instanceof Number number && Double.isFinite(number.doubleValue());
        case "integer" -> isIntegral(value);
        case "string" -> value instanceof String text && !text.isBlank();
        case "boolean" -> value instanceof Boolean;
        default -> true;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static String article(String type) {
        return type.startsWith("i") ? "an" : "a";
    }
}
