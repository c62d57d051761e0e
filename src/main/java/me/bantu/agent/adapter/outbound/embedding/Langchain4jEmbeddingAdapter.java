package me.bantu.agent.adapter.outbound.embedding;

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

import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and the OpenAI embeddings API.
 *
 * <p>
 * Vectors are requested with {@code bantu.memory.dimension} components so they
 * fit the retrieval memory. The API key comes from
 * {@code bantu.memory.embedding.api-key}, falling back to
 * {@code bantu.llm.api-key}; without either the adapter reports itself
 * unavailable and memory stays off.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final BantuProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;

        String apiKey = resolveApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.info("[Memory] Embedding API key not configured, memory disabled");
            return;
        }

        BantuProperties.EmbeddingProperties embedding = properties.getMemory().getEmbedding();
        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(getModel())
                .dimensions(getDimension())
                .timeout(properties.getLlm().getTimeout());
        if (embedding.getBaseUrl() != null && !embedding.getBaseUrl().isBlank()) {
            builder.baseUrl(embedding.getBaseUrl());
        }

        try {
            embeddingModel = builder.build();
            log.info("[Memory] Embedding model initialized: {} ({} dims)", getModel(), getDimension());
        } catch (RuntimeException e) {
            log.error("[Memory] Failed to initialize embedding model", e);
        }
    }

    private String resolveApiKey() {
        String key = properties.getMemory().getEmbedding().getApiKey();
        if (key != null && !key.isBlank()) {
            return key;
        }
        return properties.getLlm().getApiKey();
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            Response<Embedding> response = requireModel().embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = requireModel().embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return model;
    }

    @Override
    public int getDimension() {
        return properties.getMemory().getDimension();
    }

    @Override
    public String getModel() {
        return properties.getMemory().getEmbedding().getModel();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
