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
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request to a language model provider: the ordered prompt plus generation
 * settings.
 */
@Data
@Builder
public class LlmRequest {

    private String model;

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    @Builder.Default
    private double temperature = 0.7;

    private Integer maxTokens;

    @Builder.Default
    private Map<String, Object> extra = new HashMap<>();

    /**
     * Builds a request from the prompt and the caller's generation options.
     */
    public static LlmRequest of(List<ChatMessage> messages, GenerationOptions options) {
        GenerationOptions effective = options != null ? options : GenerationOptions.defaults();
        return LlmRequest.builder()
                .model(effective.getModelOverride())
                .messages(new ArrayList<>(messages))
                .temperature(effective.getTemperature())
                .maxTokens(effective.getMaxTokens())
                .extra(effective.getExtra() != null ? new HashMap<>(effective.getExtra()) : new HashMap<>())
                .build();
    }
}
