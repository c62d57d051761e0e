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

import me.bantu.agent.domain.model.ActionPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw model text into an {@link ActionPlan}.
 *
 * <p>
 * The whole trimmed text is tried as a JSON object first. If that fails, the
 * substring from the first {@code '{'} to the last {@code '}'} is tried. Either
 * candidate is accepted only if it is an object with an {@code action} key.
 * Multiple objects in one text are not disambiguated. Never throws.
 */
@Component
@Slf4j
public class ActionInterpreter {

    private static final String ACTION_KEY = "action";
    private static final String THOUGHT_KEY = "thought";
    private static final String ARGS_KEY = "args";
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ActionInterpreter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<ActionPlan> parse(String modelText) {
        if (modelText == null) {
            return Optional.empty();
        }
        String text = modelText.trim();

        Optional<ActionPlan> direct = tryParse(text);
        if (direct.isPresent()) {
            return direct;
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start != -1 && end > start) {
            Optional<ActionPlan> embedded = tryParse(text.substring(start, end + 1));
            if (embedded.isPresent()) {
                return embedded;
            }
        }
        log.debug("[Agent] No action found in model output ({} chars)", text.length());
        return Optional.empty();
    }

    private Optional<ActionPlan> tryParse(String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = strictReader.readTree(candidate);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject() || !node.has(ACTION_KEY)) {
            return Optional.empty();
        }
        return Optional.of(ActionPlan.builder()
                .thought(textOf(node.get(THOUGHT_KEY)))
                .action(textOf(node.get(ACTION_KEY)))
                .args(argsOf(node.get(ARGS_KEY)))
                .build());
    }

    private static String textOf(JsonNode node) {
        if (node == null) {
            return null;
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }

    /**
     * Non-object {@code args} are treated as no arguments.
     */
    private Map<String, Object> argsOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(node, ARGS_TYPE_REF);
    }
}
