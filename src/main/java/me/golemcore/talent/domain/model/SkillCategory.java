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

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Skill categories in rule evaluation order. A skill belongs to the first
 * category with a keyword contained in the lower-cased skill; {@link #OTHER}
 * catches everything else.
 *
 * <p>
 * Keyword lists overlap on purpose (e.g. "python" is both programming and data
 * science), so the declaration order decides the outcome. JSON output uses the
 * lower-case key, both as a value and as a map key.
 */
public enum SkillCategory {

    PROGRAMMING("programming",
            List.of("python", "java", "javascript", "typescript", "c++", "c#", "go", "rust")),
    WEB_DEVELOPMENT("web_development",
            List.of("react", "angular", "vue", "html", "css", "node.js", "express")),
    DATA_SCIENCE("data_science",
            List.of("python", "r", "sql", "pandas", "numpy", "tensorflow", "pytorch", "scikit-learn")),
    CLOUD_DEVOPS("cloud_devops",
            List.of("aws", "azure", "gcp", "docker", "kubernetes", "terraform", "jenkins")),
    DATABASES("databases",
            List.of("mysql", "postgresql", "mongodb", "redis", "elasticsearch", "sqlite")),
    MOBILE("mobile",
            List.of("swift", "kotlin", "react native", "flutter", "ios", "android")),
    AI_ML("ai_ml",
            List.of("machine learning", "deep learning", "nlp", "computer vision", "tensorflow", "pytorch")),
    OTHER("other", List.of());

    private final String key;
    private final List<String> keywords;

    SkillCategory(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    @JsonValue
    @JsonKey
    public String getKey() {
        return key;
    }

    /**
     * Whether any keyword of this category occurs in the given skill.
     */
    public boolean covers(String skill) {
        if (skill == null) {
            return false;
        }
        String normalized = skill.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(normalized::contains);
    }

    /**
     * First-match-wins classification of a single skill.
     */
    public static SkillCategory classify(String skill) {
        for (SkillCategory category : values()) {
            if (category.covers(skill)) {
                return category;
            }
        }
        return OTHER;
    }
}
