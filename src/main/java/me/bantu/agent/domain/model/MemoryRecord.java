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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A stored memory vector with its assigned id, caller-supplied metadata, and
 * the source text it was embedded from. Records are immutable once stored:
 * stores keep their own copy of the vector and hand out another.
 */
@Value
@Builder
public class MemoryRecord {

    String id;
    float[] vector;
    Map<String, Object> metadata;
    String text;

    public MemoryRecord copy() {
        return MemoryRecord.builder()
                .id(id)
                .vector(vector.clone())
                .metadata(metadata)
                .text(text)
                .build();
    }
}
