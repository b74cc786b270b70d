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

package me.golemcore.talent.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Single nearest-neighbor result returned by the vector index.
 *
 * @see me.golemcore.talent.port.outbound.VectorIndexPort
 */
@Data
@Builder
public class IndexHit {

    private long entityId;

    /**
     * Similarity on a 0-100 scale: {@code (1 - cosineDistance) * 100}, rounded to
     * two decimals.
     */
    private double similarityScore;

    /**
     * Metadata snapshot captured at upsert time.
     */
    private Map<String, Object> metadata;
}
