package me.bantu.agent.tools;

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

import me.bantu.agent.domain.component.ToolArguments;
import me.bantu.agent.domain.component.ToolComponent;
import me.bantu.agent.domain.model.ToolDefinition;
import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for web search.
 *
 * <p>
 * Uses SerpAPI (Google engine) when an API key is available, either as the
 * {@code api_key} argument or {@code bantu.tools.web-search.serp-api-key}.
 * Otherwise falls back to the DuckDuckGo Instant Answer API, which needs no
 * key but only returns a summary and related topics.
 *
 * <p>
 * Output is a numbered list:
 *
 * <pre>
 * 1. Title
 *    https://link
 *    snippet
 * </pre>
 *
 * or {@code No results.} when nothing was found.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_API_KEY = "api_key";
    private static final String TYPE_STRING = "string";

    private static final int SERPAPI_MAX_RESULTS = 10;
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final FeignClientFactory feignClientFactory;
    private final BantuProperties properties;

    private SerpApi serpApi;
    private DuckDuckGoApi duckDuckGoApi;
    private String configuredApiKey;
    private int defaultLimit;

    @PostConstruct
    public void init() {
        BantuProperties.WebSearchProperties config = properties.getTools().getWebSearch();
        this.configuredApiKey = config.getSerpApiKey();
        this.defaultLimit = config.getDefaultLimit();
        this.serpApi = feignClientFactory.create(SerpApi.class, config.getSerpApiUrl());
        this.duckDuckGoApi = feignClientFactory.create(DuckDuckGoApi.class, config.getDuckDuckGoUrl());
        log.info("[WebSearch] Initialized (backend: {}, default results: {})",
                hasText(configuredApiKey) ? "serpapi" : "duckduckgo", defaultLimit);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_search")
                .description("Search the web. Returns titles, links and snippets of the top results.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "The search query"),
                                PARAM_LIMIT, Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of results (default: " + defaultLimit + ")"),
                                PARAM_API_KEY, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "Optional SerpAPI key overriding the configured one")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            String query = args.getString(PARAM_QUERY);
            int limit = args.getInt(PARAM_LIMIT, defaultLimit);
            String apiKey = args.getString(PARAM_API_KEY, configuredApiKey);
            return executeWithRetry(query, apiKey, limit);
        });
    }

    private ToolResult executeWithRetry(String query, String apiKey, int limit) {
        String backend = hasText(apiKey) ? "SerpAPI" : "DuckDuckGo";
        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                log.debug("[WebSearch] {}: query='{}', limit={}, attempt={}", backend, query, limit, attempt);
                List<SearchHit> hits = hasText(apiKey)
                        ? searchSerpApi(query, apiKey, limit)
                        : searchDuckDuckGo(query);
                List<SearchHit> top = hits.subList(0, Math.max(0, Math.min(limit, hits.size())));
                return ToolResult.success(formatResults(top), top);
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[WebSearch] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleep(backoffMs);
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    log.error("[WebSearch] Rate limit exceeded after {} retries for query: {}", MAX_RETRIES, query);
                    return ToolResult.failure(backend + " rate limit exceeded");
                } else {
                    log.error("[WebSearch] {} error (status {}) for query: {}", backend, e.status(), query, e);
                    return ToolResult.failure(backend + " request failed (status " + e.status() + ")");
                }
            }
        }
        return ToolResult.failure(backend + " request failed");
    }

    private List<SearchHit> searchSerpApi(String query, String apiKey, int limit) {
        int num = Math.max(1, Math.min(limit, SERPAPI_MAX_RESULTS));
        SerpApiResponse response = serpApi.search(query, num, apiKey);
        List<SearchHit> hits = new ArrayList<>();
        if (response != null && response.getOrganicResults() != null) {
            for (OrganicResult r : response.getOrganicResults()) {
                hits.add(new SearchHit(r.getTitle(), r.getLink(), r.getSnippet()));
            }
        }
        return hits;
    }

    private List<SearchHit> searchDuckDuckGo(String query) {
        DuckDuckGoResponse response = duckDuckGoApi.instantAnswer(query);
        List<SearchHit> hits = new ArrayList<>();
        if (response == null) {
            return hits;
        }
        String abstractText = firstNonEmpty(response.getAbstractText(), response.getAbstractSummary());
        String abstractUrl = firstNonEmpty(response.getAbstractUrl(), response.getAbstractSourceUrl());
        if (!abstractText.isEmpty()) {
            hits.add(new SearchHit("Summary", abstractUrl, abstractText));
        }
        collectTopics(response.getRelatedTopics(), hits);
        return hits;
    }

    private void collectTopics(List<RelatedTopic> topics, List<SearchHit> hits) {
        if (topics == null) {
            return;
        }
        for (RelatedTopic topic : topics) {
            if (topic.getTopics() != null) {
                collectTopics(topic.getTopics(), hits);
                continue;
            }
            String text = firstNonEmpty(topic.getText(), null);
            String url = firstNonEmpty(topic.getFirstUrl(), null);
            if (!text.isEmpty() || !url.isEmpty()) {
                hits.add(new SearchHit(text, url, ""));
            }
        }
    }

    static String formatResults(List<SearchHit> hits) {
        if (hits.isEmpty()) {
            return "No results.";
        }
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            String title = firstNonEmpty(hit.title(), "(no title)");
            String link = firstNonEmpty(hit.link(), null);
            String snippet = firstNonEmpty(hit.snippet(), null);
            if (!link.isEmpty()) {
                lines.add((i + 1) + ". " + title + "\n   " + link + "\n   " + snippet);
            } else {
                lines.add((i + 1) + ". " + title + "\n   " + snippet);
            }
        }
        return String.join("\n", lines);
    }

    private static String firstNonEmpty(String value, String fallback) {
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return fallback != null ? fallback : "";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("WebSearch retry sleep interrupted", e);
        }
    }

    /**
     * One search result before formatting.
     */
    record SearchHit(String title, String link, String snippet) {
    }

    // Feign API interfaces
    interface SerpApi {
        @RequestLine("GET /search.json?engine=google&q={query}&num={num}&api_key={apiKey}")
        @Headers("Accept: application/json")
        SerpApiResponse search(
                @Param("query") String query,
                @Param("num") int num,
                @Param("apiKey") String apiKey);
    }

    interface DuckDuckGoApi {
        @RequestLine("GET /?q={query}&format=json&no_html=1&no_redirect=1")
        @Headers("User-Agent: bantu-agent")
        DuckDuckGoResponse instantAnswer(@Param("query") String query);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SerpApiResponse {
        @JsonProperty("organic_results")
        private List<OrganicResult> organicResults;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OrganicResult {
        private String title;
        private String link;
        private String snippet;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DuckDuckGoResponse {
        @JsonProperty("AbstractText")
        private String abstractText;
        @JsonProperty("Abstract")
        private String abstractSummary;
        @JsonProperty("AbstractURL")
        private String abstractUrl;
        @JsonProperty("AbstractSourceUrl")
        private String abstractSourceUrl;
        @JsonProperty("RelatedTopics")
        private List<RelatedTopic> relatedTopics;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RelatedTopic {
        @JsonProperty("Text")
        private String text;
        @JsonProperty("FirstURL")
        private String firstUrl;
        @JsonProperty("Topics")
        private List<RelatedTopic> topics;
    }
}
