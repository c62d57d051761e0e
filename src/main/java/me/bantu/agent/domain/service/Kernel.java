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

import me.bantu.agent.domain.component.ToolComponent;
import me.bantu.agent.domain.model.ChatMessage;
import me.bantu.agent.domain.model.GenerationOptions;
import me.bantu.agent.domain.model.LlmRequest;
import me.bantu.agent.domain.model.LlmResponse;
import me.bantu.agent.domain.model.MemoryMatch;
import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Orchestrator around the active language model, retrieval memory and tool
 * registry.
 *
 * <p>
 * {@link #processInput} assembles the prompt in a fixed order: system prompt,
 * prior context, a memory block (when memory is configured and something
 * relevant was found), then the user message. After a successful generation
 * the user text and the model output are written to memory. Memory reads and
 * writes are best-effort and never fail the turn; model failures propagate
 * unchanged.
 */
@Service
@Slf4j
public class Kernel {

    static final String MEMORY_BLOCK_HEADER = "Relevant memory items (most similar first):";

    private final LlmPort llmPort;
    private final RetrievalMemory memory;
    private final ToolRegistry toolRegistry;
    private final BantuProperties properties;

    public Kernel(LlmPort llmPort, RetrievalMemory memory, ToolRegistry toolRegistry, BantuProperties properties) {
        this.llmPort = llmPort;
        this.memory = memory;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    /**
     * Generates a reply to {@code text} with default generation settings.
     */
    public String processInput(String text) {
        return processInput(text, null, List.of(), defaultOptions());
    }

    /**
     * Builds the prompt for {@code text}, generates, and returns the model's text
     * output.
     *
     * @param systemPrompt
     *            optional system instruction, placed first
     * @param context
     *            optional prior messages, placed after the system prompt
     * @param options
     *            generation settings; defaults when {@code null}
     */
    public String processInput(String text, String systemPrompt, List<ChatMessage> context,
            GenerationOptions options) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        if (context != null) {
            messages.addAll(context);
        }

        boolean memoryEnabled = isMemoryEnabled();
        if (memoryEnabled) {
            injectMemory(text, messages);
        }
        messages.add(ChatMessage.user(text));

        LlmResponse response = generateResponse(messages, options);
        String output = response.textOrEmpty();

        if (memoryEnabled) {
            rememberInteraction(text, output);
        }
        return output;
    }

    /**
     * Sends the messages to the active model as-is.
     */
    public LlmResponse generateResponse(List<ChatMessage> messages, GenerationOptions options) {
        LlmRequest request = LlmRequest.of(messages, options != null ? options : defaultOptions());
        log.debug("[Kernel] Generating with {} messages (temperature={}, maxTokens={})",
                messages.size(), request.getTemperature(), request.getMaxTokens());
        try {
            return llmPort.chat(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Invokes a registered tool directly, bypassing interpretation.
     *
     * @throws IllegalArgumentException
     *             if no tool is registered under {@code name}
     */
    public CompletableFuture<ToolResult> useTool(String name, Map<String, Object> arguments) {
        ToolComponent tool = toolRegistry.get(name);
        if (tool == null) {
            throw new IllegalArgumentException("Tool not found: " + name);
        }
        return tool.execute(arguments != null ? arguments : Map.of());
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.register(tool);
    }

    public boolean isMemoryEnabled() {
        return memory != null && memory.isConfigured();
    }

    private void injectMemory(String text, List<ChatMessage> messages) {
        try {
            List<MemoryMatch> matches = memory.retrieve(text, properties.getMemory().getTopK());
            List<String> snippets = new ArrayList<>();
            for (MemoryMatch match : matches) {
                String snippet = match.getText();
                if (snippet != null && !snippet.isEmpty()) {
                    snippets.add("- " + snippet);
                }
            }
            if (!snippets.isEmpty()) {
                messages.add(ChatMessage.system(MEMORY_BLOCK_HEADER + "\n" + String.join("\n", snippets)));
                log.debug("[Kernel] Injected {} memory items", snippets.size());
            }
        } catch (RuntimeException e) {
            log.warn("[Kernel] Memory retrieval failed, continuing without it: {}", e.getMessage(), e);
        }
    }

    private void rememberInteraction(String text, String output) {
        try {
            memory.storeText(text, null);
            if (!output.isEmpty()) {
                memory.storeText(output, null);
            }
        } catch (RuntimeException e) {
            log.warn("[Kernel] Failed to store interaction in memory: {}", e.getMessage(), e);
        }
    }

    private GenerationOptions defaultOptions() {
        return GenerationOptions.builder()
                .temperature(properties.getLlm().getTemperature())
                .build();
    }
}
