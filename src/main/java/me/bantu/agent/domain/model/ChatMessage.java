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

/**
 * A single message in a prompt. The ordered list of messages forms the prompt:
 * system messages first, the memory block next, the user message last.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role; // system, user, assistant, tool
    private String content;
    private String name;

    public static ChatMessage system(String content) {
        return ChatMessage.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static ChatMessage user(String content) {
        return ChatMessage.builder().role(ROLE_USER).content(content).build();
    }

    public static ChatMessage assistant(String content) {
        return ChatMessage.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    /**
     * Creates a tool result message attributed to the named tool.
     */
    public static ChatMessage tool(String name, String content) {
        return ChatMessage.builder().role(ROLE_TOOL).name(name).content(content).build();
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }
}
