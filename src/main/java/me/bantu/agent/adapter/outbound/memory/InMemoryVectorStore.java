package me.bantu.agent.adapter.outbound.memory;

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
import me.bantu.agent.port.outbound.VectorStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process vector store with exact cosine search.
 *
 * <p>
 * Records are kept in insertion order so that the stable sort used by
 * {@link #search(float[], int)} breaks similarity ties by age. Ids have the
 * form {@code vec_<n>}, starting at {@code vec_1}, and come from a counter that
 * is never rewound, so a deleted id is not handed out again.
 *
 * <p>
 * Stored metadata is read-only and {@link #get(String)} returns a copy, so
 * callers cannot change a stored record.
 *
 * <p>
 * Every public method holds the store's monitor; search cost is linear in the
 * number of records.
 */
@Component
@Slf4j
public class InMemoryVectorStore implements VectorStorePort {

    private static final String ID_PREFIX = "vec_";

    private final List<MemoryRecord> records = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized String add(float[] vector, Map<String, Object> metadata, String text) {
        String id = ID_PREFIX + sequence.incrementAndGet();
        records.add(MemoryRecord.builder()
                .id(id)
                .vector(vector.clone())
                .metadata(Collections.unmodifiableMap(metadata != null ? new HashMap<>(metadata) : new HashMap<>()))
                .text(text)
                .build());
        log.debug("[Memory] Stored {} (total={})", id, records.size());
        return id;
    }

    @Override
    public synchronized List<MemoryMatch> search(float[] query, int topK) {
        if (topK <= 0 || records.isEmpty()) {
            return List.of();
        }
        List<MemoryMatch> scored = new ArrayList<>(records.size());
        for (MemoryRecord record : records) {
            scored.add(MemoryMatch.of(record, cosineSimilarity(query, record.getVector())));
        }
        // List.sort is stable: equal scores keep insertion order
        scored.sort(Comparator.comparingDouble(MemoryMatch::getSimilarity).reversed());
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    @Override
    public synchronized boolean delete(String id) {
        boolean removed = records.removeIf(record -> record.getId().equals(id));
        if (removed) {
            log.debug("[Memory] Deleted {}", id);
        }
        return removed;
    }

    @Override
    public synchronized Optional<MemoryRecord> get(String id) {
        return records.stream()
                .filter(record -> record.getId().equals(id))
                .findFirst()
                .map(MemoryRecord::copy);
    }

    @Override
    public synchronized int size() {
        return records.size();
    }

    /**
     * Cosine similarity of two equal-length vectors. Returns 0 when either norm is
     * zero or the result is not a number.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length");
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        double similarity = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        return Double.isNaN(similarity) ? 0 : similarity;
    }
}
