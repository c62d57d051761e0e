package me.bantu.agent.tools;

import me.bantu.agent.domain.model.ToolDefinition;
import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.infrastructure.config.AutoConfiguration;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.infrastructure.http.FeignClientFactory;
import me.bantu.agent.testsupport.http.OkHttpMockEngine;
import feign.FeignException;
import feign.Request;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSearchToolTest {

    private static final String QUERY = "query";
    private static final String SERP_KEY = "serp-key";

    private FeignClientFactory feignClientFactory;
    private WebSearchTool.SerpApi serpApi;
    private WebSearchTool.DuckDuckGoApi duckDuckGoApi;
    private BantuProperties properties;

    @BeforeEach
    void setUp() {
        feignClientFactory = mock(FeignClientFactory.class);
        serpApi = mock(WebSearchTool.SerpApi.class);
        duckDuckGoApi = mock(WebSearchTool.DuckDuckGoApi.class);
        when(feignClientFactory.create(eq(WebSearchTool.SerpApi.class), anyString())).thenReturn(serpApi);
        when(feignClientFactory.create(eq(WebSearchTool.DuckDuckGoApi.class), anyString())).thenReturn(duckDuckGoApi);
        properties = new BantuProperties();
    }

    private WebSearchTool createTool() {
        WebSearchTool tool = new WebSearchTool(feignClientFactory, properties);
        tool.init();
        return tool;
    }

    private static WebSearchTool.OrganicResult organic(String title, String link, String snippet) {
        WebSearchTool.OrganicResult result = new WebSearchTool.OrganicResult();
        result.setTitle(title);
        result.setLink(link);
        result.setSnippet(snippet);
        return result;
    }

    private static WebSearchTool.RelatedTopic topic(String text, String url) {
        WebSearchTool.RelatedTopic topic = new WebSearchTool.RelatedTopic();
        topic.setText(text);
        topic.setFirstUrl(url);
        return topic;
    }

    // ===== Definition =====

    @Test
    void shouldDescribeTool() {
        ToolDefinition definition = createTool().getDefinition();

        assertEquals("web_search", definition.getName());
        assertNotNull(definition.getDescription());
        assertEquals(List.of(QUERY), definition.getRequired());
    }

    // ===== SerpAPI =====

    @Test
    void shouldUseSerpApiWhenKeyConfigured() {
        properties.getTools().getWebSearch().setSerpApiKey(SERP_KEY);
        WebSearchTool.SerpApiResponse response = new WebSearchTool.SerpApiResponse();
        response.setOrganicResults(List.of(
                organic("Java", "https://java.com", "Download Java"),
                organic("OpenJDK", "https://openjdk.org", "Open source JDK")));
        when(serpApi.search("java", 5, SERP_KEY)).thenReturn(response);

        ToolResult result = createTool().execute(Map.of(QUERY, "java")).join();

        assertTrue(result.isSuccess());
        assertEquals("1. Java\n   https://java.com\n   Download Java\n"
                + "2. OpenJDK\n   https://openjdk.org\n   Open source JDK", result.getOutput());
        verify(duckDuckGoApi, never()).instantAnswer(anyString());
    }

    @Test
    void shouldClampSerpApiResultCountAndTruncate() {
        WebSearchTool.SerpApiResponse response = new WebSearchTool.SerpApiResponse();
        response.setOrganicResults(Collections.nCopies(12, organic("t", "l", "s")));
        when(serpApi.search(anyString(), anyInt(), anyString())).thenReturn(response);

        ToolResult result = createTool().execute(Map.of(QUERY, "q", "limit", 50, "api_key", "arg-key")).join();

        verify(serpApi).search("q", 10, "arg-key");
        assertEquals(12, result.getOutput().split("\n").length / 3);
    }

    @Test
    void shouldRequestAtLeastOneSerpApiResult() {
        properties.getTools().getWebSearch().setSerpApiKey(SERP_KEY);
        when(serpApi.search(anyString(), anyInt(), anyString())).thenReturn(new WebSearchTool.SerpApiResponse());

        ToolResult result = createTool().execute(Map.of(QUERY, "q", "limit", 0)).join();

        verify(serpApi).search("q", 1, SERP_KEY);
        assertEquals("No results.", result.getOutput());
    }

    // ===== DuckDuckGo =====

    @Test
    void shouldFallBackToDuckDuckGoWithoutKey() {
        WebSearchTool.RelatedTopic group = new WebSearchTool.RelatedTopic();
        group.setTopics(List.of(topic("Nested topic", "https://ddg.example/nested")));
        WebSearchTool.DuckDuckGoResponse response = new WebSearchTool.DuckDuckGoResponse();
        response.setAbstractText("Kotlin is a programming language.");
        response.setAbstractUrl("https://en.wikipedia.org/wiki/Kotlin");
        response.setRelatedTopics(List.of(topic("Kotlin docs", "https://kotlinlang.org/docs"), group,
                topic("", "")));
        when(duckDuckGoApi.instantAnswer("kotlin")).thenReturn(response);

        ToolResult result = createTool().execute(Map.of(QUERY, "kotlin")).join();

        assertEquals("1. Summary\n   https://en.wikipedia.org/wiki/Kotlin\n   Kotlin is a programming language.\n"
                + "2. Kotlin docs\n   https://kotlinlang.org/docs\n   \n"
                + "3. Nested topic\n   https://ddg.example/nested\n   ", result.getOutput());
        verify(serpApi, never()).search(anyString(), anyInt(), anyString());
    }

    @Test
    void shouldUseAbstractFallbacks() {
        WebSearchTool.DuckDuckGoResponse response = new WebSearchTool.DuckDuckGoResponse();
        response.setAbstractSummary("Short abstract");
        response.setAbstractSourceUrl("https://source.example");
        when(duckDuckGoApi.instantAnswer("x")).thenReturn(response);

        ToolResult result = createTool().execute(Map.of(QUERY, "x")).join();

        assertEquals("1. Summary\n   https://source.example\n   Short abstract", result.getOutput());
    }

    @Test
    void shouldApplyLimitToDuckDuckGoResults() {
        WebSearchTool.DuckDuckGoResponse response = new WebSearchTool.DuckDuckGoResponse();
        response.setRelatedTopics(List.of(topic("a", "https://a"), topic("b", "https://b"), topic("c", "https://c")));
        when(duckDuckGoApi.instantAnswer("x")).thenReturn(response);

        ToolResult result = createTool().execute(Map.of(QUERY, "x", "limit", 2)).join();

        assertEquals("1. a\n   https://a\n   \n2. b\n   https://b\n   ", result.getOutput());
    }

    @Test
    void shouldReportNoResults() {
        when(duckDuckGoApi.instantAnswer("nothing")).thenReturn(new WebSearchTool.DuckDuckGoResponse());

        assertEquals("No results.", createTool().execute(Map.of(QUERY, "nothing")).join().getOutput());
    }

    // ===== Formatting =====

    @Test
    void shouldFormatMissingTitleAndLink() {
        String output = WebSearchTool.formatResults(List.of(
                new WebSearchTool.SearchHit(null, "", "just a snippet"),
                new WebSearchTool.SearchHit("Titled", null, null)));

        assertEquals("1. (no title)\n   just a snippet\n2. Titled\n   ", output);
    }

    // ===== Errors =====

    @Test
    void shouldReportHttpError() {
        Request request = Request.create(Request.HttpMethod.GET, "https://api.duckduckgo.com/", Map.of(),
                null, StandardCharsets.UTF_8, null);
        when(duckDuckGoApi.instantAnswer(anyString()))
                .thenThrow(new FeignException.InternalServerError("down", request, null, Map.of()));

        ToolResult result = createTool().execute(Map.of(QUERY, "x")).join();

        assertFalse(result.isSuccess());
        assertEquals("DuckDuckGo request failed (status 500)", result.getError());
    }

    // ===== Wire format =====

    @Test
    void shouldSendSerpApiRequestOverHttp() {
        OkHttpMockEngine engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        FeignClientFactory realFactory = new FeignClientFactory(client, AutoConfiguration.objectMapper());
        properties.getTools().getWebSearch().setSerpApiKey(SERP_KEY);
        properties.getTools().getWebSearch().setSerpApiUrl("http://serpapi.test");
        engine.enqueueJson(200, "{\"search_metadata\": {}, \"organic_results\": ["
                + "{\"position\": 1, \"title\": \"Feign\", \"link\": \"https://github.com/OpenFeign/feign\","
                + " \"snippet\": \"Java HTTP client binder\"}]}");

        WebSearchTool tool = new WebSearchTool(realFactory, properties);
        tool.init();
        ToolResult result = tool.execute(Map.of(QUERY, "feign", "limit", 3)).join();

        assertEquals("1. Feign\n   https://github.com/OpenFeign/feign\n   Java HTTP client binder",
                result.getOutput());
        okhttp3.Request sent = engine.takeRequest();
        assertEquals("GET", sent.method());
        assertEquals("/search.json", sent.url().encodedPath());
        assertEquals("google", sent.url().queryParameter("engine"));
        assertEquals("feign", sent.url().queryParameter("q"));
        assertEquals("3", sent.url().queryParameter("num"));
        assertEquals(SERP_KEY, sent.url().queryParameter("api_key"));
    }

    @Test
    void shouldParseDuckDuckGoPayloadOverHttp() {
        OkHttpMockEngine engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        FeignClientFactory realFactory = new FeignClientFactory(client, AutoConfiguration.objectMapper());
        properties.getTools().getWebSearch().setDuckDuckGoUrl("http://ddg.test");
        engine.enqueueText(200, "{\"Abstract\": \"\", \"AbstractText\": \"\", \"AbstractURL\": \"\","
                + " \"RelatedTopics\": [{\"Text\": \"Rust\", \"FirstURL\": \"https://duckduckgo.com/Rust\"},"
                + " {\"Name\": \"Group\", \"Topics\": [{\"Text\": \"Cargo\", \"FirstURL\": \"https://duckduckgo.com/Cargo\"}]}]}",
                "application/x-javascript");

        WebSearchTool tool = new WebSearchTool(realFactory, properties);
        tool.init();
        ToolResult result = tool.execute(Map.of(QUERY, "rust lang")).join();

        assertEquals("1. Rust\n   https://duckduckgo.com/Rust\n   \n"
                + "2. Cargo\n   https://duckduckgo.com/Cargo\n   ", result.getOutput());
        okhttp3.Request sent = engine.takeRequest();
        assertEquals("rust lang", sent.url().queryParameter("q"));
        assertEquals("json", sent.url().queryParameter("format"));
        assertEquals("1", sent.url().queryParameter("no_html"));
        assertEquals("1", sent.url().queryParameter("no_redirect"));
    }
}
