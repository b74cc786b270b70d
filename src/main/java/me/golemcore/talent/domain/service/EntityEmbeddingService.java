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


package me.golemcore.talent.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.talent.domain.model.EmbeddableEntity;
import me.golemcore.talent.domain.model.EntityKind;
import me.golemcore.talent.port.outbound.EmbeddingPort;
import me.golemcore.talent.port.outbound.RecordStorePort;
import me.golemcore.talent.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Service;

/**
 * Sole writer of entity embeddings. Keeps the cached embedding in the record
 * store and the vector index entry in step.
 *
 * <p>
 * There is no transaction spanning store and index. A cached embedding missing
 * from the index is repaired by re-upserting the cached vector; it is never
 * regenerated. A cached embedding of the wrong dimension is treated as absent.
 */
@Service
@Slf4j
public class EntityEmbeddingService {

    private final EmbeddingPort embeddingPort;
    private final VectorIndexPort vectorIndex;
    private final RecordStorePort recordStore;

    public EntityEmbeddingService(EmbeddingPort embeddingPort, VectorIndexPort vectorIndex,
            RecordStorePort recordStore) {
        this.embeddingPort = embeddingPort;
        this.vectorIndex = vectorIndex;
        this.recordStore = recordStore;
    }

    /**
     * Return the entity's embedding, generating and indexing it on first use.
     */
    public float[] ensureEmbedding(EmbeddableEntity entity) {
        long id = requireId(entity);
        float[] cached = entity.getEmbedding();
        if (!hasValidDimension(cached)) {
            if (cached != null) {
                log.warn("[Embedding] Cached {} {} embedding has dimension {}, expected {}; regenerating",
                        entity.getKind(), id, cached.length, embeddingPort.getDimension());
            }
            return refreshEmbedding(entity);
        }

        String collection = entity.getKind().getCollection();
        if (!vectorIndex.contains(collection, id)) {
            vectorIndex.upsert(collection, id, cached, entity.toIndexMetadata());
            log.info("[Embedding] Repaired missing index entry for {} {} in '{}'",
                    entity.getKind(), id, collection);
        }
        return cached;
    }

    /**
     * Regenerate the embedding from the entity's current content, store it and
     * replace the index entry.
     */
    public float[] refreshEmbedding(EmbeddableEntity entity) {
        long id = requireId(entity);
        EntityKind kind = entity.getKind();
        float[] embedding = embeddingPort.embed(entity.toEmbeddingText());
        recordStore.updateEmbedding(kind, id, embedding);
        vectorIndex.upsert(kind.getCollection(), id, embedding, entity.toIndexMetadata());
        log.debug("[Embedding] Generated {} embedding for {} {}", embeddingPort.getModel(), kind, id);
        return embedding;
    }

    /**
     * Rebuild both index collections from the record store, reusing cached
     * embeddings and generating missing ones.
     *
     * @return number of indexed entities
     */
    public int rebuildIndex() {
        int indexed = 0;
        int generated = 0;
        for (EntityKind kind : EntityKind.values()) {
            vectorIndex.clear(kind.getCollection());
            for (EmbeddableEntity entity : recordStore.findAllEntities(kind)) {
                if (entity.getId() == null) {
                    continue;
                }
                if (hasValidDimension(entity.getEmbedding())) {
                    vectorIndex.upsert(kind.getCollection(), entity.getId(), entity.getEmbedding(),
                            entity.toIndexMetadata());
                } else {
                    refreshEmbedding(entity);
                    generated++;
                }
                indexed++;
            }
        }
        log.info("[Embedding] Index rebuilt: {} entities ({} embeddings generated)", indexed, generated);
        return indexed;
    }

    private boolean hasValidDimension(float[] embedding) {
        return embedding != null && embedding.length == embeddingPort.getDimension();
    }

    private static long requireId(EmbeddableEntity entity) {
        if (entity.getId() == null) {
            throw new IllegalArgumentException("Entity must be stored before embedding: " + entity.getLabel());
        }
        return entity.getId();
    }
}
