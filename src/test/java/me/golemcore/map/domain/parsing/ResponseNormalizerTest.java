package me.golemcore.map.domain.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.map.domain.model.LlmResponse;
import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.Message;
import me.golemcore.map.domain.model.NormalizedResponse;
import me.golemcore.map.domain.model.ToolCallOrigin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseNormalizerTest {

    private ResponseNormalizer normalizer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        Gazetteer gazetteer = new Gazetteer(List.of(
                new Gazetteer.Place("tokyo", 35.6762, 139.6503),
                new Gazetteer.Place("paris", 48.8566, 2.3522)));
        normalizer = new ResponseNormalizer(objectMapper,
                new JsonToolCallDecoder(objectMapper, MapToolNames.ALL),
                List.of(new GazetteerExtractor(gazetteer), new CoordinatePairExtractor(), new ZoomPhraseExtractor()));
    }

    // ===== Structured calls =====

    @Test
    void shouldPreferStructuredCallsOverText() {
        Message.ToolCall structured = Message.ToolCall.builder()
                .id("call_1")
                .name(MapToolNames.ZOOM_TO_LEVEL)
                .arguments(Map.of(MapToolNames.PARAM_ZOOM_LEVEL, 3))
                .build();

        NormalizedResponse result = normalizer.normalize(null, List.of(structured), null);

        assertEquals(NormalizedResponse.Kind.TOOL_CALLS, result.kind());
        assertEquals(1, result.toolCalls().size());
        assertEquals("call_1", result.toolCalls().get(0).getId());
        assertEquals(ToolCallOrigin.STRUCTURED, result.toolCalls().get(0).getOrigin());
    }

    @Test
    void shouldReturnMixedWhenStructuredCallsCarryProse() {
        Message.ToolCall structured = Message.ToolCall.builder()
                .id("call_1")
                .name(MapToolNames.NAVIGATE_TO_LOCATION)
                .arguments(Map.of("latitude", 1.0, "longitude", 2.0))
                .build();

        // Prose mentions a zoom phrase, but text heuristics must not run
        NormalizedResponse result = normalizer.normalize("Moving there, then zoom to 5", List.of(structured),
                "thinking");

        assertEquals(NormalizedResponse.Kind.MIXED, result.kind());
        assertEquals("Moving there, then zoom to 5", result.content());
        assertEquals(1, result.toolCalls().size());
        assertEquals(MapToolNames.NAVIGATE_TO_LOCATION, result.toolCalls().get(0).getName());
        assertEquals("thinking", result.reasoningContent());
    }

    // ===== JSON content =====

    @Test
    void shouldReturnTerminalTextForResponseObject() {
        NormalizedResponse result = normalizer.normalize("{\"response\":\"hello\"}", null, null);

        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, result.kind());
        assertEquals("hello", result.content());
        assertFalse(result.hasToolCalls());
        assertTrue(result.toolCalls().isEmpty());
    }

    @Test
    void shouldNotRunHeuristicsOnResponseObject() {
        NormalizedResponse result = normalizer.normalize("{\"response\": \"I can navigate to Tokyo for you\"}",
                null, null);

        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, result.kind());
    }

    @Test
    void shouldTreatNullResponseFieldAsEmptyAnswer() {
        NormalizedResponse result = normalizer.normalize("{\"response\": null}", null, null);

        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, result.kind());
        assertEquals("", result.content());
    }

    @Test
    void shouldKeepJsonProseWithNameFieldTerminal() {
        String content = "{\"name\": \"Eiffel Tower\", \"height_m\": 330}";

        NormalizedResponse result = normalizer.normalize(content, null, null);

        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, result.kind());
        assertEquals(content, result.content());
        assertTrue(result.toolCalls().isEmpty());
    }

    @Test
    void shouldDecodeJsonToolCall() {
        NormalizedResponse result = normalizer.normalize(
                "{\"function_name\": \"geocode_address\", \"parameters\": {\"address\": \"Berlin\"}}", null, null);

        assertEquals(NormalizedResponse.Kind.TOOL_CALLS, result.kind());
        Message.ToolCall call = result.toolCalls().get(0);
        assertEquals(MapToolNames.GEOCODE_ADDRESS, call.getName());
        assertEquals("Berlin", call.getArguments().get(MapToolNames.PARAM_ADDRESS));
        assertEquals(ToolCallOrigin.TEXT_EXTRACTED, call.getOrigin());
    }

    @Test
    void shouldStripMarkdownCodeFence() {
        NormalizedResponse result = normalizer.normalize(
                "```json\n{\"zoom_to_level\": {\"zoom_level\": 11}}\n```", null, null);

        assertEquals(NormalizedResponse.Kind.TOOL_CALLS, result.kind());
        assertEquals(11, result.toolCalls().get(0).getArguments().get(MapToolNames.PARAM_ZOOM_LEVEL));
    }

    @Test
    void shouldLeaveUnfencedTextAlone() {
        assertEquals("plain", ResponseNormalizer.stripCodeFence("plain"));
        assertEquals("{\"a\":1}", ResponseNormalizer.stripCodeFence("```\n{\"a\":1}\n```"));
    }

    // ===== Heuristics =====

    @Test
    void shouldExtractNavigateFromProse() {
        NormalizedResponse result = normalizer.normalize("navigate to Tokyo", null, null);

        assertEquals(NormalizedResponse.Kind.TOOL_CALLS, result.kind());
        Message.ToolCall call = result.toolCalls().get(0);
        assertEquals(MapToolNames.NAVIGATE_TO_LOCATION, call.getName());
        assertEquals(35.6762, call.getArguments().get(MapToolNames.PARAM_LATITUDE));
        assertEquals(139.6503, call.getArguments().get(MapToolNames.PARAM_LONGITUDE));
    }

    @Test
    void shouldPreferGazetteerOverCoordinates() {
        NormalizedResponse result = normalizer.normalize("show me Paris, around 10, 20", null, null);

        assertEquals(48.8566, result.toolCalls().get(0).getArguments().get(MapToolNames.PARAM_LATITUDE));
    }

    @Test
    void shouldExtractUnclampedZoomFromProse() {
        NormalizedResponse result = normalizer.normalize("zoom to 99", null, null);

        assertEquals(MapToolNames.ZOOM_TO_LEVEL, result.toolCalls().get(0).getName());
        assertEquals(99, result.toolCalls().get(0).getArguments().get(MapToolNames.PARAM_ZOOM_LEVEL));
    }

    @Test
    void shouldFallBackToTerminalProse() {
        NormalizedResponse result = normalizer.normalize("Tokyo has about 14 million residents.", null, "why");

        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, result.kind());
        assertEquals("Tokyo has about 14 million residents.", result.content());
        assertEquals("why", result.reasoningContent());
    }

    @Test
    void shouldTreatInvalidJsonAsProse() {
        NormalizedResponse result = normalizer.normalize("{not json at all", null, null);

        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, result.kind());
        assertEquals("{not json at all", result.content());
    }

    @Test
    void shouldReturnEmptyTerminalForBlankOrMissingContent() {
        assertEquals("", normalizer.normalize("  ", List.of(), null).content().trim());
        assertEquals(NormalizedResponse.Kind.TERMINAL_TEXT, normalizer.normalize((LlmResponse) null).kind());
    }

    @Test
    void shouldStopAtFirstMatchingExtractor() {
        TextToolCallExtractor first = text -> Optional.of(Message.ToolCall.builder().name("first").build());
        TextToolCallExtractor second = text -> {
            throw new AssertionError("must not be consulted");
        };
        ObjectMapper objectMapper = new ObjectMapper();
        ResponseNormalizer chain = new ResponseNormalizer(objectMapper,
                new JsonToolCallDecoder(objectMapper, MapToolNames.ALL), List.of(first, second));

        NormalizedResponse result = chain.normalize("anything", null, null);

        assertEquals("first", result.toolCalls().get(0).getName());
    }

    @Test
    void shouldNormalizeLlmResponse() {
        LlmResponse response = LlmResponse.builder()
                .content("{\"response\": \"done\"}")
                .reasoningContent("short")
                .build();

        NormalizedResponse result = normalizer.normalize(response);

        assertEquals("done", result.content());
        assertEquals("short", result.reasoningContent());
    }
}
