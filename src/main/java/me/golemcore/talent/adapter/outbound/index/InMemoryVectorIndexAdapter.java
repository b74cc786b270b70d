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

package me.golemcore.talent.adapter.outbound.index;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.talent.domain.model.IndexHit;
import me.golemcore.talent.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index with exact cosine search.
 *
 * <p>
 * Each collection keeps its entries in insertion order; an upsert removes the
 * old entry and appends the new one, so a replaced entity counts as the newest
 * insertion when breaking ties. Queries scan the whole collection, which keeps
 * them bounded by collection size.
 *
 * <p>
 * Thread-safe: collections are created through {@link ConcurrentHashMap} and
 * every operation on a collection holds that collection's monitor, so readers
 * never observe the delete-then-insert gap of an upsert.
 *
 * @see VectorIndexPort
 */
@Component
@Slf4j
public class InMemoryVectorIndexAdapter implements VectorIndexPort {

    private final Map<String, IndexCollection> collections = new ConcurrentHashMap<>();

    @Override
    public void upsert(String collection, long id, float[] vector, Map<String, Object> metadata) {
        if (vector == null) {
            throw new IllegalArgumentException("Vector must not be null");
        }
        IndexCollection target = collection(collection);
        synchronized (target) {
            target.entries.remove(id);
            target.entries.put(id, new IndexEntry(id, vector.clone(),
                    metadata != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                    : Map.of()));
        }
        log.debug("[Index] Upserted {} into '{}'", id, collection);
    }

    @Override
    public void delete(String collection, long id) {
        IndexCollection target = collection(collection);
        synchronized (target) {
            if (target.entries.remove(id) != null) {
                log.debug("[Index] Deleted {} from '{}'", id, collection);
            }
        }
    }

    @Override
    public List<IndexHit> query(String collection, float[] vector, int k) {
        if (k <= 0) {
            return List.of();
        }

        IndexCollection target = collection(collection);
        List<ScoredEntry> scored = new ArrayList<>();
        synchronized (target) {
            for (IndexEntry entry : target.entries.values()) {
                double distance = 1.0 - cosineSimilarity(vector, entry.vector());
                scored.add(new ScoredEntry(entry, distance));
            }
        }

        // List.sort is stable: equal distances keep insertion order
        scored.sort(Comparator.comparingDouble(ScoredEntry::distance));

        List<IndexHit> hits = scored.stream()
                .limit(k)
                .map(s -> IndexHit.builder()
                        .entityId(s.entry().id())
                        .similarityScore(round2((1.0 - s.distance()) * 100.0))
                        .metadata(s.entry().metadata())
                        .build())
                .toList();

        log.debug("[Index] Query on '{}' (k={}, size={}) returned {} hits",
                collection, k, scored.size(), hits.size());
        return hits;
    }

    @Override
    public boolean contains(String collection, long id) {
        IndexCollection target = collection(collection);
        synchronized (target) {
            return target.entries.containsKey(id);
        }
    }

    @Override
    public int size(String collection) {
        IndexCollection target = collection(collection);
        synchronized (target) {
            return target.entries.size();
        }
    }

    @Override
    public void clear(String collection) {
        IndexCollection target = collection(collection);
        synchronized (target) {
            target.entries.clear();
        }
        log.info("[Index] Collection '{}' cleared", collection);
    }

    private IndexCollection collection(String name) {
        return collections.computeIfAbsent(name, n -> {
            log.info("[Index] Created collection '{}'", n);
            return new IndexCollection();
        });
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero norm.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length");
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class IndexCollection {
        private final LinkedHashMap<Long, IndexEntry> entries = new LinkedHashMap<>();
    }

    private record IndexEntry(long id, float[] vector, Map<String, Object> metadata) {
    }

    private record ScoredEntry(IndexEntry entry, double distance) {
    }
}
