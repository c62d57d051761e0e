package me.bantu.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.Map;

/**
 * A similarity search hit: the record id, its cosine similarity to the query,
 * and the record's metadata and source text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryMatch {

    private String id;
    private double similarity;
    private Map<String, Object> metadata;
    private String text;

    public static MemoryMatch of(MemoryRecord record, double similarity) {
        return MemoryMatch.builder()
                .id(record.getId())
                .similarity(similarity)
                .metadata(record.getMetadata() != null ? Collections.unmodifiableMap(record.getMetadata()) : Map.of())
                .text(record.getText())
                .build();
    }
}
