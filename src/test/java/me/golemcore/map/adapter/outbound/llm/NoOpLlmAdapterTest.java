package me.golemcore.map.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.map.domain.model.LlmRequest;
import me.golemcore.map.domain.model.LlmResponse;
import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.NormalizedResponse;
import me.golemcore.map.domain.parsing.JsonToolCallDecoder;
import me.golemcore.map.domain.parsing.ResponseNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldReturnCompletedPlaceholderAnswer() throws Exception {
        CompletableFuture<LlmResponse> future = adapter.chat(LlmRequest.builder().build());

        assertTrue(future.isDone());
        LlmResponse response = future.get();
        assertEquals(NoOpLlmAdapter.PLACEHOLDER_ANSWER, response.getContent());
        assertNull(response.getToolCalls());
        assertEquals(0, response.getUsage().getTotalTokens());
    }

    @Test
    void shouldNormalizeToFinalAnswer() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        ResponseNormalizer normalizer = new ResponseNormalizer(objectMapper,
                new JsonToolCallDecoder(objectMapper, MapToolNames.ALL), List.of());

        NormalizedResponse normalized = normalizer.normalize(adapter.chat(LlmRequest.builder().build()).get());

        assertFalse(normalized.hasToolCalls());
        assertEquals("No LLM provider is configured, map commands are unavailable.", normalized.content());
    }

    @Test
    void shouldReportIdentityAndUnavailability() {
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
        assertFalse(adapter.isAvailable());
    }
}
