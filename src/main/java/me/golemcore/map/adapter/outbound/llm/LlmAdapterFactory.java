package me.golemcore.map.adapter.outbound.llm;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.LlmRequest;
import me.golemcore.map.domain.model.LlmResponse;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active LLM adapter from {@code map.llm.provider}:
 * <ul>
 * <li>custom - OpenAI-compatible endpoint over Feign
 * <li>langchain4j - OpenAI through langchain4j
 * <li>none - placeholder adapter
 * </ul>
 *
 * <p>
 * All adapters are Spring beans; this factory is the {@link Primary}
 * {@link LlmPort} and delegates to the one selected in {@link #init()}. An
 * unknown provider falls back to {@code none}.
 *
 * @see CustomLlmAdapter
 * @see Langchain4jAdapter
 * @see NoOpLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final MapAgentProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        adapters.forEach(adapter -> adaptersByProvider.put(adapter.getProviderId(), adapter));
        log.debug("[LLM] Known providers: {}", adaptersByProvider.keySet());

        String provider = properties.getLlm().getProvider();
        activeAdapter = resolve(provider);
        if (activeAdapter == null) {
            log.warn("[LLM] No LLM adapter available for provider '{}'", provider);
            return;
        }
        if (!Objects.equals(activeAdapter.getProviderId(), provider)) {
            log.warn("[LLM] Provider '{}' not found, falling back to '{}'", provider, activeAdapter.getProviderId());
        } else {
            log.info("[LLM] Active provider: {} (model: {})", provider, activeAdapter.getCurrentModel());
        }
        activeAdapter.initialize();
    }

    private LlmProviderAdapter resolve(String provider) {
        LlmProviderAdapter selected = provider != null ? adaptersByProvider.get(provider) : null;
        if (selected == null) {
            selected = adaptersByProvider.get(PROVIDER_NONE);
        }
        if (selected == null && !adapters.isEmpty()) {
            selected = adapters.get(0);
        }
        return selected;
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    public LlmPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return activeAdapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
