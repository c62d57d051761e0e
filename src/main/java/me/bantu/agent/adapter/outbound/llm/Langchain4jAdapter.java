package me.bantu.agent.adapter.outbound.llm;

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

import me.bantu.agent.domain.model.LlmRequest;
import me.bantu.agent.domain.model.LlmResponse;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.LlmNotConfiguredException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Models whose id starts with {@code anthropic/} go to the Anthropic API; all
 * other ids go to the OpenAI API or the OpenAI-compatible endpoint at
 * {@code bantu.llm.base-url}. Temperature, output bound and model override are
 * applied per request. Rate-limit errors are retried with exponential backoff.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";
    private static final String ANTHROPIC_PREFIX = "anthropic/";
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 4096;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final BantuProperties properties;

    private volatile ChatModel chatModel;

    @Override
    public synchronized void initialize() {
        if (chatModel != null || !isAvailable()) {
            return;
        }
        String model = properties.getLlm().getModel();
        chatModel = createModel(model);
        log.info("[LLM] Langchain4j adapter initialized with model: {}", model);
    }

    private ChatModel createModel(String model) {
        BantuProperties.LlmProperties llm = properties.getLlm();
        String baseUrl = llm.getBaseUrl();

        if (isAnthropic(model)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(stripProviderPrefix(model))
                    .maxTokens(ANTHROPIC_DEFAULT_MAX_TOKENS)
                    .maxRetries(0)
                    .timeout(llm.getTimeout());
            if (baseUrl != null && !baseUrl.isBlank()) {
                builder.baseUrl(baseUrl);
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(model)
                .maxRetries(0)
                .timeout(llm.getTimeout());
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(
                    new LlmNotConfiguredException("LLM API key not configured: set bantu.llm.api-key"));
        }
        return CompletableFuture.supplyAsync(() -> {
            initialize();
            ChatRequest chatRequest = toChatRequest(request);
            int maxRetries = Math.max(0, properties.getLlm().getMaxRetries());

            for (int attempt = 0;; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(chatRequest);
                    return convertResponse(response);
                } catch (RuntimeException e) {
                    if (!isRateLimitError(e) || attempt >= maxRetries) {
                        log.error("[LLM] Chat failed: {}", e.getMessage());
                        throw e;
                    }
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs);
                }
            }
        });
    }

    ChatRequest toChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request.getMessages()))
                .temperature(request.getTemperature());
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        if (request.getModel() != null && !request.getModel().isBlank()) {
            builder.modelName(stripProviderPrefix(request.getModel()));
        }
        return builder.build();
    }

    /**
     * Tool messages carry no call id here, so they are passed as user messages
     * naming the tool. Blank system and user messages are dropped since
     * langchain4j rejects empty text content.
     */
    static List<ChatMessage> convertMessages(List<me.bantu.agent.domain.model.ChatMessage> messages) {
        List<ChatMessage> converted = new ArrayList<>();
        for (me.bantu.agent.domain.model.ChatMessage msg : messages) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            String role = msg.getRole() != null ? msg.getRole() : "user";
            if (content.isBlank() && !"assistant".equals(role) && !"tool".equals(role)) {
                continue;
            }
            switch (role) {
            case "system" -> converted.add(SystemMessage.from(content));
            case "assistant" -> converted.add(AiMessage.from(content));
            case "tool" -> converted.add(UserMessage.from("Result of tool " + msg.getName() + ":\n" + content));
            default -> converted.add(UserMessage.from(content));
            }
        }
        return converted;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        var metadata = response.metadata();
        return LlmResponse.builder()
                .text(aiMessage != null ? aiMessage.text() : null)
                .raw(response)
                .model(metadata != null ? metadata.modelName() : getCurrentModel())
                .finishReason(metadata != null && metadata.finishReason() != null
                        ? metadata.finishReason().name()
                        : null)
                .build();
    }

    private static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    static boolean isAnthropic(String model) {
        return model != null && model.startsWith(ANTHROPIC_PREFIX);
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of(properties.getLlm().getModel());
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }
}
