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

/**
 * Response from a language model provider: the generated text plus the raw
 * provider payload for diagnostics.
 */
@Data
@Builder
public class LlmResponse {

    private String text;
    private Object raw;
    private String model;
    private String finishReason;

    /**
     * Returns the generated text, or an empty string when the provider returned
     * none.
     */
    public String textOrEmpty() {
        return text != null ? text : "";
    }
}
