package me.golemcore.map.domain.service;

import me.golemcore.map.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentValidatorTest {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("sample")
            .inputSchema(Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "lat", Map.of("type", "number"),
                            "level", Map.of("type", "integer"),
                            "address", Map.of("type", "string"),
                            "flag", Map.of("type", "boolean")),
                    "required", List.of("lat")))
            .build();

    @Test
    void shouldAcceptValidArguments() {
        assertTrue(ToolArgumentValidator.validate(DEFINITION,
                Map.of("lat", 1.5, "level", 4, "address", "Main St", "flag", true)).isEmpty());
    }

    @Test
    void shouldReportMissingRequiredParameter() {
        Optional<String> violation = ToolArgumentValidator.validate(DEFINITION, Map.of("level", 4));

        assertEquals("Missing required parameter: lat", violation.orElseThrow());
    }

    @Test
    void shouldTreatNullRequiredValueAsMissing() {
        Map<String, Object> args = new HashMap<>();
        args.put("lat", null);

        assertTrue(ToolArgumentValidator.validate(DEFINITION, args).isPresent());
        assertTrue(ToolArgumentValidator.validate(DEFINITION, null).isPresent());
    }

    @Test
    void shouldRejectStringForNumber() {
        Optional<String> violation = ToolArgumentValidator.validate(DEFINITION, Map.of("lat", "north"));

        assertEquals("Parameter 'lat' must be a number, got: north", violation.orElseThrow());
    }

    @Test
    void shouldRejectNonFiniteNumber() {
        assertTrue(ToolArgumentValidator.validate(DEFINITION, Map.of("lat", Double.NaN)).isPresent());
        assertTrue(ToolArgumentValidator.validate(DEFINITION, Map.of("lat", Double.POSITIVE_INFINITY)).isPresent());
    }

    @Test
    void shouldAcceptIntegralValuesForInteger() {
        assertTrue(ToolArgumentValidator.matchesType("integer", 3));
        assertTrue(ToolArgumentValidator.matchesType("integer", 3L));
        assertTrue(ToolArgumentValidator.matchesType("integer", 3.0));
        assertTrue(ToolArgumentValidator.matchesType("integer", new BigInteger("123456789012345678901234567890")));
        assertTrue(ToolArgumentValidator.matchesType("integer", new BigDecimal("7.000")));
    }

    @Test
    void shouldRejectFractionalValuesForInteger() {
        Optional<String> violation = ToolArgumentValidator.validate(DEFINITION, Map.of("lat", 1, "level", 2.5));

        assertEquals("Parameter 'level' must be an integer, got: 2.5", violation.orElseThrow());
        assertFalse(ToolArgumentValidator.matchesType("integer", "3"));
    }

    @Test
    void shouldRejectBlankString() {
        assertTrue(ToolArgumentValidator.validate(DEFINITION, Map.of("lat", 1, "address", "  ")).isPresent());
        assertFalse(ToolArgumentValidator.matchesType("string", 5));
    }

    @Test
    void shouldIgnoreUndeclaredArguments() {
        assertTrue(ToolArgumentValidator.validate(DEFINITION, Map.of("lat", 1, "extra", "anything")).isEmpty());
    }
}
