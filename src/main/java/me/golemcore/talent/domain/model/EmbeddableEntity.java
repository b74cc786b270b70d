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

import java.util.List;
import java.util.Map;

/**
 * Record that can be embedded and placed in the vector index.
 *
 * <p>
 * The embedding is derived solely from {@link #toEmbeddingText()}, so two
 * entities with identical embedding text always share a vector.
 */
public interface EmbeddableEntity {

    Long getId();

    EntityKind getKind();

    /**
     * Display label (employee name or project title).
     */
    String getLabel();

    /**
     * Skill tokens. For projects these are the required skills.
     */
    List<String> getSkills();

    /**
     * Cached embedding, or {@code null} when not generated yet.
     */
    float[] getEmbedding();

    /**
     * Canonical text representation fed to the embedding generator.
     */
    String toEmbeddingText();

    /**
     * Metadata snapshot stored alongside the vector in the index.
     */
    Map<String, Object> toIndexMetadata();
}
