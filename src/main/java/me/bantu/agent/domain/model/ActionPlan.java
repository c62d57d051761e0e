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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured decision produced by the language model for one user turn: either
 * a direct answer ({@code action = "respond"}) or a call to a registered tool.
 *
 * <p>
 * Wire format:
 *
 * <pre>
 * {"thought": "...", "action": "calculator", "args": {"expression": "2 + 2"}}
 * </pre>
 *
 * The {@code thought} is diagnostic only and never shown to the user.
 */
@Data
@Builder
public class ActionPlan {

    public static final String RESPOND = "respond";
    public static final String MESSAGE_ARG = "message";

    private String thought;
    private String action;

    @Builder.Default
    private Map<String, Object> args = new LinkedHashMap<>();

    /**
     * Whether the model chose to answer directly instead of calling a tool.
     */
    public boolean isRespond() {
        return RESPOND.equals(action);
    }

    /**
     * Returns the direct-answer text, or an empty string when absent.
     */
    public String getMessage() {
        if (args == null) {
            return "";
        }
        Object message = args.get(MESSAGE_ARG);
        return message != null ? String.valueOf(message) : "";
    }
}
