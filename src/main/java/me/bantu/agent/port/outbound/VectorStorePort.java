package me.bantu.agent.port.outbound;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for a vector store holding fixed-dimension float vectors with metadata.
 * Ids are assigned by the store and never reused within its lifetime.
 */
public interface VectorStorePort {

    /**
     * Stores a vector with its metadata and source text and returns the assigned
     * id.
     */
    String add(float[] vector, Map<String, Object> metadata, String text);

    /**
     * Returns up to {@code topK} records by descending cosine similarity. Ties
     * keep insertion order.
     */
    List<MemoryMatch> search(float[] query, int topK);

    /**
     * Removes a record, returning whether it existed.
     */
    boolean delete(String id);

    Optional<MemoryRecord> get(String id);

    int size();
}
