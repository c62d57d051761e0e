package me.bantu.agent.domain.service;

import me.bantu.agent.adapter.outbound.memory.InMemoryVectorStore;
import me.bantu.agent.domain.model.MemoryMatch;
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetrievalMemoryTest {

    private static final int DIM = 4;

    private InMemoryVectorStore store;
    private EmbeddingPort embedder;
    private RetrievalMemory memory;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        embedder = mock(EmbeddingPort.class);
        when(embedder.isAvailable()).thenReturn(true);
        memory = new RetrievalMemory(store, embedder, DIM);
    }

    private void embeds(String text, float... vector) {
        when(embedder.embed(text)).thenReturn(CompletableFuture.completedFuture(vector));
    }

    // ===== Raw vectors =====

    @Test
    void shouldStoreAndSearchRawVectors() {
        String a = memory.store("alpha", new float[] { 1, 0, 0, 0 }, Map.of("kind", "note"));
        String b = memory.store("beta", new float[] { 0, 1, 0, 0 }, null);

        List<MemoryMatch> matches = memory.search(new float[] { 0.9f, 0.1f, 0, 0 }, 2);

        assertEquals(List.of(a, b), matches.stream().map(MemoryMatch::getId).toList());
        assertEquals("alpha", matches.get(0).getText());
        assertEquals(Map.of("kind", "note"), matches.get(0).getMetadata());
        assertTrue(matches.get(0).getSimilarity() > matches.get(1).getSimilarity());
    }

    @Test
    void shouldRejectWrongDimensionOnStore() {
        RetrievalMemory.DimensionMismatchException error = assertThrows(
                RetrievalMemory.DimensionMismatchException.class,
                () -> memory.store("x", new float[] { 1, 2 }, null));

        assertEquals("Embedding dim 2 != expected 4", error.getMessage());
        assertEquals(0, memory.size());
    }

    @Test
    void shouldRejectWrongDimensionOnSearch() {
        assertThrows(RetrievalMemory.DimensionMismatchException.class,
                () -> memory.search(new float[] { 1, 2, 3 }, 1));
    }

    @Test
    void shouldRejectNonPositiveDimension() {
        assertThrows(IllegalArgumentException.class, () -> new RetrievalMemory(store, embedder, 0));
    }

    // ===== Text operations =====

    @Test
    void shouldStoreTextUsingEmbedder() {
        embeds("remember the milk", 1, 0, 0, 0);
        embeds("what should I buy?", 0.8f, 0.2f, 0, 0);
        memory.store("unrelated", new float[] { 0, 0, 1, 0 }, null);

        String id = memory.storeText("remember the milk", Map.of("source", "chat"));
        List<MemoryMatch> matches = memory.retrieve("what should I buy?", 1);

        assertEquals(1, matches.size());
        assertEquals(id, matches.get(0).getId());
        assertEquals("remember the milk", matches.get(0).getText());
        assertEquals("chat", memory.get(id).orElseThrow().getMetadata().get("source"));
    }

    @Test
    void shouldFailTextOperationsWithoutEmbedder() {
        memory.setEmbedder(null);

        assertFalse(memory.isConfigured());
        RetrievalMemory.NotConfiguredException error = assertThrows(RetrievalMemory.NotConfiguredException.class,
                () -> memory.storeText("x", null));
        assertEquals("Embeddings provider not configured for memory", error.getMessage());
        assertThrows(RetrievalMemory.NotConfiguredException.class, () -> memory.retrieve("x", 3));
    }

    @Test
    void shouldTreatUnavailableEmbedderAsNotConfigured() {
        when(embedder.isAvailable()).thenReturn(false);

        assertFalse(memory.isConfigured());
        assertThrows(RetrievalMemory.NotConfiguredException.class, () -> memory.retrieve("x", 3));
    }

    @Test
    void shouldRejectEmbedderReturningWrongDimension() {
        embeds("short", 1, 2);

        assertThrows(RetrievalMemory.DimensionMismatchException.class, () -> memory.storeText("short", null));
        assertEquals(0, memory.size());
    }

    @Test
    void shouldUnwrapEmbedderFailure() {
        when(embedder.embed("boom")).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> memory.storeText("boom", null));
        assertEquals("quota exceeded", error.getMessage());
    }

    // ===== Record management =====

    @Test
    void shouldDeleteAndGetRecords() {
        String id = memory.store("temp", new float[] { 1, 1, 1, 1 }, null);

        assertTrue(memory.get(id).isPresent());
        assertTrue(memory.delete(id));
        assertFalse(memory.delete(id));
        assertTrue(memory.get(id).isEmpty());
    }

    @Test
    void shouldReturnNothingForNonPositiveTopK() {
        memory.store("a", new float[] { 1, 0, 0, 0 }, null);

        assertTrue(memory.search(new float[] { 1, 0, 0, 0 }, 0).isEmpty());
    }

    // ===== Configuration =====

    @Test
    void shouldDropEmbedderWhenMemoryDisabled() {
        BantuProperties properties = new BantuProperties();
        properties.getMemory().setEnabled(false);
        properties.getMemory().setDimension(8);

        RetrievalMemory disabled = new RetrievalMemory(store, embedder, properties);

        assertFalse(disabled.isConfigured());
        assertEquals(8, disabled.getDimension());
    }
}
