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

package me.golemcore.talent.port.outbound;

import me.golemcore.talent.domain.model.IndexHit;

import java.util.List;
import java.util.Map;

/**
 * Port for the similarity index: named collections of (id, vector, metadata)
 * entries searchable by cosine distance.
 *
 * <p>
 * Collections are declared implicitly on first use. Every operation is atomic
 * per collection, and a collection never holds more than one entry per id.
 */
public interface VectorIndexPort {

    /**
     * Replace the entry for {@code id}: any existing entry is removed and the new
     * one inserted, without a reader ever observing the gap.
     *
     * @param collection
     *            collection name (e.g., "employees", "projects")
     * @param id
     *            entity id
     * @param vector
     *            embedding vector
     * @param metadata
     *            metadata snapshot stored with the vector
     */
    void upsert(String collection, long id, float[] vector, Map<String, Object> metadata);

    /**
     * Remove the entry for {@code id}. Absence is not an error.
     */
    void delete(String collection, long id);

    /**
     * Find up to {@code k} entries closest to {@code vector}, by ascending cosine
     * distance. Ties keep insertion order.
     *
     * @return hits sorted by descending similarity, empty for an empty collection
     */
    List<IndexHit> query(String collection, float[] vector, int k);

    /**
     * Check whether the collection holds an entry for {@code id}.
     */
    boolean contains(String collection, long id);

    /**
     * Get the number of entries in the collection.
     */
    int size(String collection);

    /**
     * Remove all entries of the collection.
     */
    void clear(String collection);
}
