package me.bantu.agent.adapter.outbound.llm;

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

import me.bantu.agent.domain.model.LlmRequest;
import me.bantu.agent.domain.model.LlmResponse;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.LlmNotConfiguredException;
import me.bantu.agent.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of LLM provider adapters with one active selection.
 *
 * <p>
 * Adapters are indexed by provider id in {@link #init()}, and the one named by
 * {@code bantu.llm.provider} becomes active. The active provider can be
 * switched with {@link #selectProvider} and removed with
 * {@link #unloadProvider}. With no active provider, {@link #chat} fails with
 * {@link LlmNotConfiguredException}.
 *
 * @see LlmProviderAdapter
 * @see Langchain4jAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final BantuProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private volatile LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            registerProvider(adapter);
        }

        String provider = properties.getLlm().getProvider();
        if (!selectProvider(provider)) {
            log.warn("[LLM] Provider '{}' not found, no model is active", provider);
        }
    }

    public void registerProvider(LlmProviderAdapter adapter) {
        adaptersByProvider.put(adapter.getProviderId(), adapter);
        log.debug("[LLM] Registered adapter: {}", adapter.getProviderId());
    }

    /**
     * Makes the named provider active.
     *
     * @return false if no such provider is registered; the selection is then
     *         unchanged
     */
    public boolean selectProvider(String providerId) {
        LlmProviderAdapter adapter = providerId != null ? adaptersByProvider.get(providerId) : null;
        if (adapter == null) {
            return false;
        }
        activeAdapter = adapter;
        log.info("[LLM] Active provider: {}", providerId);
        return true;
    }

    /**
     * Removes a provider. Unloading the active provider leaves none active.
     */
    public boolean unloadProvider(String providerId) {
        LlmProviderAdapter removed = providerId != null ? adaptersByProvider.remove(providerId) : null;
        if (removed == null) {
            return false;
        }
        if (removed == activeAdapter) {
            activeAdapter = null;
            log.info("[LLM] Unloaded active provider: {}", providerId);
        }
        return true;
    }

    public List<String> listProviders() {
        return adaptersByProvider.keySet().stream().sorted().toList();
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        LlmProviderAdapter active = activeAdapter;
        return active != null ? active.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        LlmProviderAdapter active = activeAdapter;
        if (active == null) {
            throw new LlmNotConfiguredException("No active model configured");
        }
        return active.chat(request);
    }

    @Override
    public List<String> getSupportedModels() {
        LlmProviderAdapter active = activeAdapter;
        return active != null ? active.getSupportedModels() : List.of();
    }

    @Override
    public String getCurrentModel() {
        LlmProviderAdapter active = activeAdapter;
        return active != null ? active.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        LlmProviderAdapter active = activeAdapter;
        return active != null && active.isAvailable();
    }
}
