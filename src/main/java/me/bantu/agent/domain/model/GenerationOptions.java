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

import java.util.HashMap;
import java.util.Map;

/**
 * Per-call generation settings: sampling temperature, output length bound, and
 * provider-specific passthrough values (e.g. {@code model} override).
 */
@Data
@Builder
public class GenerationOptions {

    public static final String OPTION_MODEL = "model";

    @Builder.Default
    private double temperature = 0.7;

    private Integer maxTokens;

    @Builder.Default
    private Map<String, Object> extra = new HashMap<>();

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }

    /**
     * Returns the passthrough model override, if one was supplied.
     */
    public String getModelOverride() {
        if (extra == null) {
            return null;
        }
        Object model = extra.get(OPTION_MODEL);
        return model != null ? model.toString() : null;
    }
}
