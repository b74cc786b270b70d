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

/**
 * Port for generating text embeddings (fixed-length vector representations).
 * Used to place employees and projects in the vector index.
 *
 * <p>
 * Implementations must be deterministic: identical text always yields an
 * identical vector of exactly {@link #getDimension()} components. Beyond that
 * the rest of the engine makes no assumption about how vectors are produced.
 */
public interface EmbeddingPort {

    /**
     * Generate embedding for a single text.
     *
     * @param text
     *            the text to embed, may be empty
     * @return vector of {@link #getDimension()} components
     */
    float[] embed(String text);

    /**
     * Get the embedding dimension.
     *
     * @return vector dimension (384 by default)
     */
    int getDimension();

    /**
     * Get the model name.
     *
     * @return model identifier
     */
    String getModel();
}
