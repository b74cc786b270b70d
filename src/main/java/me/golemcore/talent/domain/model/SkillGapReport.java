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

import java.util.List;
import java.util.Map;

/**
 * Skill gap analysis of one employee, either scoped to a single project or
 * against the union of all project requirements.
 */
@Data
@Builder
public class SkillGapReport {

    private long employeeId;

    /** Present only for project-scoped reports. */
    private Long projectId;
    private String projectTitle;

    private SkillGapResult skillGap;
    private List<CourseRecommendation> recommendedCourses;

    /** Present only for general reports. */
    private Map<SkillCategory, List<String>> skillCategories;

    public boolean isProjectScoped() {
        return projectId != null;
    }
}
