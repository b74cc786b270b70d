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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Employee profile with the skills extracted from the resume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Employee implements EmbeddableEntity {

    private Long id;
    private String name;

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private List<String> preferences = new ArrayList<>();

    private String resumeText;
    private float[] embedding;

    @Override
    @JsonIgnore
    public EntityKind getKind() {
        return EntityKind.EMPLOYEE;
    }

    @Override
    @JsonIgnore
    public String getLabel() {
        return name;
    }

    @Override
    public String toEmbeddingText() {
        return name + " Skills: " + SkillLists.join(skills) + " Resume: " + resumeText;
    }

    @Override
    public Map<String, Object> toIndexMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("employee_id", id);
        metadata.put("name", name);
        metadata.put("skills", SkillLists.copyOf(skills));
        return metadata;
    }
}
