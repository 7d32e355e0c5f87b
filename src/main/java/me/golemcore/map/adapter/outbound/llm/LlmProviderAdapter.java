package me.golemcore.map.adapter.outbound.llm;

import me.golemcore.map.port.outbound.LlmPort;

/**
 * LLM provider adapter managed by {@link LlmAdapterFactory}.
 *
 * @see LlmAdapterFactory
 */
public interface LlmProviderAdapter extends LlmPort {

    /**
     * Initialize the adapter. Called when adapter is selected.
     */
    default void initialize() {
        // Default no-op
    }
}
