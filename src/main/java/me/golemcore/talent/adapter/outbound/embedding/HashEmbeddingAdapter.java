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

package me.golemcore.talent.adapter.outbound.embedding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.talent.infrastructure.config.TalentProperties;
import me.golemcore.talent.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Embedding adapter producing a content fingerprint instead of a learned
 * representation.
 *
 * <p>
 * The text is hashed with MD5 and rendered as hex. Every pair of hex digits
 * becomes one component {@code value / 256}, so components lie in [0, 1). The
 * 16 hash components are zero-padded (or truncated) to the configured
 * dimension.
 *
 * <p>
 * Vectors are reproducible across calls and restarts but carry no semantic
 * meaning. Another {@link EmbeddingPort} can replace this adapter without
 * touching the rest of the engine.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code talent.embedding.dimension} - vector length (default 384)
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HashEmbeddingAdapter implements EmbeddingPort {

    private static final String MODEL = "md5-fingerprint";
    private static final String HASH_ALGORITHM = "MD5";
    private static final double COMPONENT_SCALE = 256.0;

    private final TalentProperties properties;

    @Override
    public float[] embed(String text) {
        String hex = hexDigest(text != null ? text : "");
        float[] embedding = new float[getDimension()];
        int components = Math.min(hex.length() / 2, embedding.length);
        for (int i = 0; i < components; i++) {
            int value = Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
            embedding[i] = (float) (value / COMPONENT_SCALE);
        }
        return embedding;
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        return MODEL;
    }

    private static String hexDigest(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("Hash algorithm unavailable: " + HASH_ALGORITHM, e);
        }
    }
}
