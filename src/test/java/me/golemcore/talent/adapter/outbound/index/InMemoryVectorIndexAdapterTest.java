package me.golemcore.talent.adapter.outbound.index;

import me.golemcore.talent.domain.model.IndexHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorIndexAdapterTest {

    private static final String PROJECTS = "projects";

    private InMemoryVectorIndexAdapter index;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndexAdapter();
    }

    // ===== Upsert / delete =====

    @Test
    void shouldKeepSingleEntryWhenUpsertingTwice() {
        index.upsert(PROJECTS, 1L, new float[] { 1f, 0f }, Map.of("title", "A"));
        index.upsert(PROJECTS, 1L, new float[] { 0f, 1f }, Map.of("title", "B"));

        assertEquals(1, index.size(PROJECTS));
        List<IndexHit> hits = index.query(PROJECTS, new float[] { 0f, 1f }, 5);
        assertEquals(1, hits.size());
        assertEquals("B", hits.get(0).getMetadata().get("title"));
        assertEquals(100.0, hits.get(0).getSimilarityScore());
    }

    @Test
    void shouldDeleteIdempotently() {
        index.upsert(PROJECTS, 1L, new float[] { 1f, 0f }, Map.of());

        index.delete(PROJECTS, 1L);
        index.delete(PROJECTS, 1L);

        assertFalse(index.contains(PROJECTS, 1L));
        assertEquals(0, index.size(PROJECTS));
    }

    @Test
    void shouldRejectNullVector() {
        assertThrows(IllegalArgumentException.class, () -> index.upsert(PROJECTS, 1L, null, Map.of()));
    }

    @Test
    void shouldAcceptNullMetadataValues() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("title", null);

        index.upsert(PROJECTS, 1L, new float[] { 1f }, metadata);

        assertTrue(index.contains(PROJECTS, 1L));
    }

    @Test
    void shouldNotBeAffectedByCallerMutatingVector() {
        float[] vector = { 1f, 0f };
        index.upsert(PROJECTS, 1L, vector, Map.of());
        vector[0] = 0f;
        vector[1] = 1f;

        IndexHit hit = index.query(PROJECTS, new float[] { 1f, 0f }, 1).get(0);

        assertEquals(100.0, hit.getSimilarityScore());
    }

    // ===== Query =====

    @Test
    void shouldReturnCollectionSizeWhenKExceedsIt() {
        index.upsert(PROJECTS, 1L, new float[] { 1f, 0f }, Map.of());
        index.upsert(PROJECTS, 2L, new float[] { 1f, 1f }, Map.of());
        index.upsert(PROJECTS, 3L, new float[] { 0f, 1f }, Map.of());

        List<IndexHit> hits = index.query(PROJECTS, new float[] { 1f, 0f }, 10);

        assertEquals(3, hits.size());
        assertEquals(1L, hits.get(0).getEntityId());
        assertEquals(2L, hits.get(1).getEntityId());
        assertEquals(3L, hits.get(2).getEntityId());
        assertTrue(hits.get(0).getSimilarityScore() >= hits.get(1).getSimilarityScore());
        assertTrue(hits.get(1).getSimilarityScore() >= hits.get(2).getSimilarityScore());
    }

    @Test
    void shouldRoundSimilarityToTwoDecimals() {
        index.upsert(PROJECTS, 1L, new float[] { 1f, 1f }, Map.of());

        IndexHit hit = index.query(PROJECTS, new float[] { 1f, 0f }, 1).get(0);

        assertEquals(70.71, hit.getSimilarityScore());
    }

    @Test
    void shouldBreakTiesByInsertionOrderWithUpsertAsNewest() {
        index.upsert(PROJECTS, 1L, new float[] { 1f, 0f }, Map.of());
        index.upsert(PROJECTS, 2L, new float[] { 2f, 0f }, Map.of());
        index.upsert(PROJECTS, 3L, new float[] { 3f, 0f }, Map.of());
        index.upsert(PROJECTS, 1L, new float[] { 1f, 0f }, Map.of());

        List<IndexHit> hits = index.query(PROJECTS, new float[] { 1f, 0f }, 3);

        assertEquals(List.of(2L, 3L, 1L), hits.stream().map(IndexHit::getEntityId).toList());
    }

    @Test
    void shouldReturnEmptyForEmptyCollectionOrNonPositiveK() {
        assertTrue(index.query(PROJECTS, new float[] { 1f }, 5).isEmpty());

        index.upsert(PROJECTS, 1L, new float[] { 1f }, Map.of());

        assertTrue(index.query(PROJECTS, new float[] { 1f }, 0).isEmpty());
        assertTrue(index.query(PROJECTS, new float[] { 1f }, -1).isEmpty());
    }

    @Test
    void shouldKeepCollectionsSeparate() {
        index.upsert("employees", 1L, new float[] { 1f }, Map.of());

        assertTrue(index.contains("employees", 1L));
        assertFalse(index.contains(PROJECTS, 1L));
    }

    @Test
    void shouldClearCollection() {
        index.upsert(PROJECTS, 1L, new float[] { 1f }, Map.of());
        index.upsert(PROJECTS, 2L, new float[] { 1f }, Map.of());

        index.clear(PROJECTS);

        assertEquals(0, index.size(PROJECTS));
    }

    // ===== Cosine =====

    @Test
    void shouldReturnZeroSimilarityForZeroVector() {
        assertEquals(0.0, InMemoryVectorIndexAdapter.cosineSimilarity(new float[] { 0f, 0f }, new float[] { 1f, 0f }));
    }

    @Test
    void shouldRejectVectorsOfDifferentLength() {
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryVectorIndexAdapter.cosineSimilarity(new float[] { 1f }, new float[] { 1f, 0f }));
    }

    // ===== Concurrency =====

    @Test
    void shouldNeverExposeMissingEntryWhileUpsertReplacesIt() throws Exception {
        int iterations = 2000;
        index.upsert(PROJECTS, 1L, new float[] { 1f, 0f }, Map.of("title", "A"));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> writer = executor.submit(() -> {
                start.await();
                for (int i = 0; i < iterations; i++) {
                    float[] vector = i % 2 == 0 ? new float[] { 0f, 1f } : new float[] { 1f, 0f };
                    index.upsert(PROJECTS, 1L, vector, Map.of("title", "v" + i));
                }
                return null;
            });
            Future<Integer> reader = executor.submit(() -> {
                start.await();
                int badQueries = 0;
                for (int i = 0; i < iterations; i++) {
                    if (index.query(PROJECTS, new float[] { 1f, 1f }, 5).size() != 1) {
                        badQueries++;
                    }
                }
                return badQueries;
            });
            start.countDown();

            writer.get(30, TimeUnit.SECONDS);
            assertEquals(0, reader.get(30, TimeUnit.SECONDS));
            assertEquals(1, index.size(PROJECTS));
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }
}
