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

package me.golemcore.talent.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the matching engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code talent.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location of persisted records</li>
 * <li>{@link EmbeddingProperties} - vector dimension</li>
 * <li>{@link ScoringProperties} - weights of the combined ranking score</li>
 * <li>{@link MatchingProperties} - result sizes and the growth window</li>
 * <li>{@link CourseProperties} - course recommendation limits</li>
 * <li>{@link BootstrapProperties} - sample data loading on startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "talent")
@Data
public class TalentProperties {

    private StorageProperties storage = new StorageProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private MatchingProperties matching = new MatchingProperties();
    private CourseProperties courses = new CourseProperties();
    private BootstrapProperties bootstrap = new BootstrapProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String recordsDirectory = "records";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/talent";
    }

    @Data
    public static class EmbeddingProperties {
        private int dimension = 384;
    }

    // ==================== SCORING ====================

    @Data
    public static class ScoringProperties {
        /** Share of the vector similarity in the overall score. */
        private double similarityWeight = 0.6;

        /** Share of the skill match percentage in the overall score. */
        private double skillMatchWeight = 0.4;
    }

    // ==================== MATCHING ====================

    @Data
    public static class MatchingProperties {
        private int defaultTopK = 5;

        /** Candidate pool evaluated when building career suggestions. */
        private int careerMatchPoolSize = 10;
        private int careerCurrentMatches = 3;

        /** Skill match window (inclusive) for projects that stretch an employee. */
        private double growthMinPercentage = 40.0;
        private double growthMaxPercentage = 70.0;
        private int growthProjectLimit = 3;
    }

    @Data
    public static class CourseProperties {
        private int maxRecommendations = 3;
    }

    @Data
    public static class BootstrapProperties {
        private boolean sampleDataEnabled = true;
        private String sampleProjects = "classpath:data/sample_projects.json";
        private String sampleCourses = "classpath:data/sample_courses.json";
        private boolean rebuildIndexOnStartup = true;
    }
}
