package me.bantu.agent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bantu.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - language model provider settings</li>
 * <li>{@link MemoryProperties} - retrieval memory and embeddings</li>
 * <li>{@link AgentProperties} - action interpretation call settings</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * <li>{@link ToolsProperties} - tool sandbox and web search</li>
 * <li>{@link ShellProperties} - interactive console</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "bantu")
@Data
public class BantuProperties {

    private LlmProperties llm = new LlmProperties();
    private MemoryProperties memory = new MemoryProperties();
    private AgentProperties agent = new AgentProperties();
    private StorageProperties storage = new StorageProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ShellProperties shell = new ShellProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";

        /**
         * Model id. An {@code anthropic/} prefix selects the Anthropic API; anything
         * else goes through the OpenAI-compatible API.
         */
        private String model = "gpt-4";
        private String apiKey = "";
        private String baseUrl = "";
        private Duration timeout = Duration.ofSeconds(60);
        private double temperature = 0.7;
        private int maxRetries = 3;
    }

    @Data
    public static class MemoryProperties {
        private boolean enabled = true;
        private int dimension = 768;
        private int topK = 3;
        private EmbeddingProperties embedding = new EmbeddingProperties();
    }

    @Data
    public static class EmbeddingProperties {
        private String model = "text-embedding-3-small";

        /** Falls back to {@code bantu.llm.api-key} when blank. */
        private String apiKey = "";
        private String baseUrl = "";
    }

    @Data
    public static class AgentProperties {
        private double temperature = 0.2;
        private int maxTokens = 256;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.bantu/workspace";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private String workspace = "${user.home}/.bantu/sandbox";
        private Duration timeout = Duration.ofSeconds(30);
        private int readMaxBytes = 4096;
        private WebSearchProperties webSearch = new WebSearchProperties();
    }

    @Data
    public static class WebSearchProperties {
        private String serpApiKey = "";
        private int defaultLimit = 5;
        private String serpApiUrl = "https://serpapi.com";
        private String duckDuckGoUrl = "https://api.duckduckgo.com";
    }

    @Data
    public static class ShellProperties {
        private boolean enabled = true;
        private String prompt = "bantu> ";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
