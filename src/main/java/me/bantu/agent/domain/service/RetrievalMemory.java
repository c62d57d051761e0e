package me.bantu.agent.domain.service;

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

import me.bantu.agent.domain.model.MemoryMatch;
import me.bantu.agent.domain.model.MemoryRecord;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.EmbeddingPort;
import me.bantu.agent.port.outbound.VectorStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Embedding-backed retrieval memory.
 *
 * <p>
 * Wraps a {@link VectorStorePort} holding vectors of a fixed dimension and an
 * optional {@link EmbeddingPort}. Raw vectors can always be stored and
 * searched; the text-level operations ({@link #storeText} and
 * {@link #retrieve}) need an available embedder and fail with
 * {@link NotConfiguredException} otherwise.
 *
 * <p>
 * Retrieval is exact: the query is compared against every stored vector.
 */
@Service
@Slf4j
public class RetrievalMemory {

    private final VectorStorePort vectorStore;
    private final int dimension;
    private volatile EmbeddingPort embedder;

    @Autowired
    public RetrievalMemory(VectorStorePort vectorStore, EmbeddingPort embeddingPort, BantuProperties properties) {
        this(vectorStore, properties.getMemory().isEnabled() ? embeddingPort : null,
                properties.getMemory().getDimension());
    }

    public RetrievalMemory(VectorStorePort vectorStore, EmbeddingPort embedder, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Memory dimension must be positive: " + dimension);
        }
        this.vectorStore = vectorStore;
        this.embedder = embedder;
        this.dimension = dimension;
    }

    /**
     * Stores a precomputed embedding together with its source text.
     *
     * @return the assigned record id
     * @throws DimensionMismatchException
     *             if the embedding length differs from the configured dimension;
     *             nothing is stored in that case
     */
    public String store(String text, float[] embedding, Map<String, Object> metadata) {
        checkDimension(embedding);
        return vectorStore.add(embedding, metadata != null ? metadata : Map.of(), text);
    }

    /**
     * Embeds {@code text} with the configured embedder and stores it.
     *
     * @throws NotConfiguredException
     *             if no embedder is available
     */
    public String storeText(String text, Map<String, Object> metadata) {
        float[] embedding = embed(text);
        String id = store(text, embedding, metadata);
        log.debug("[Memory] Stored text as {}", id);
        return id;
    }

    /**
     * Embeds the query and returns up to {@code topK} records by descending
     * similarity.
     *
     * @throws NotConfiguredException
     *             if no embedder is available
     */
    public List<MemoryMatch> retrieve(String query, int topK) {
        return search(embed(query), topK);
    }

    /**
     * Searches with a precomputed query vector.
     */
    public List<MemoryMatch> search(float[] queryVector, int topK) {
        checkDimension(queryVector);
        return vectorStore.search(queryVector, topK);
    }

    public boolean delete(String id) {
        return vectorStore.delete(id);
    }

    public Optional<MemoryRecord> get(String id) {
        return vectorStore.get(id);
    }

    public int size() {
        return vectorStore.size();
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Whether text-level operations can run, i.e. an embedder is set and
     * reports itself available.
     */
    public boolean isConfigured() {
        EmbeddingPort current = embedder;
        return current != null && current.isAvailable();
    }

    public void setEmbedder(EmbeddingPort embedder) {
        this.embedder = embedder;
    }

    private float[] embed(String text) {
        EmbeddingPort current = embedder;
        if (current == null || !current.isAvailable()) {
            throw new NotConfiguredException("Embeddings provider not configured for memory");
        }
        try {
            return current.embed(text).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new DimensionMismatchException(vector == null ? 0 : vector.length, dimension);
        }
    }

    /**
     * Thrown when a text-level memory operation is requested without an
     * embedder.
     */
    public static class NotConfiguredException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public NotConfiguredException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a vector's length differs from the memory's dimension.
     */
    public static class DimensionMismatchException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public DimensionMismatchException(int actual, int expected) {
            super("Embedding dim " + actual + " != expected " + expected);
        }
    }
}
