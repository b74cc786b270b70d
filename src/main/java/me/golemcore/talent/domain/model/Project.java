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
 * Work opportunity with an ordered list of required skills.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project implements EmbeddableEntity {

    private Long id;
    private String title;

    @Builder.Default
    private List<String> requiredSkills = new ArrayList<>();

    private int teamSize;
    private String description;
    private float[] embedding;

    @Override
    @JsonIgnore
    public EntityKind getKind() {
        return EntityKind.PROJECT;
    }

    @Override
    @JsonIgnore
    public String getLabel() {
        return title;
    }

    @Override
    @JsonIgnore
    public List<String> getSkills() {
        return requiredSkills;
    }

    @Override
    public String toEmbeddingText() {
        return title + " Required Skills: " + SkillLists.join(requiredSkills) + " Description: " + description;
    }

    @Override
    public Map<String, Object> toIndexMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_id", id);
        metadata.put("title", title);
        metadata.put("required_skills", SkillLists.copyOf(requiredSkills));
        return metadata;
    }
}
