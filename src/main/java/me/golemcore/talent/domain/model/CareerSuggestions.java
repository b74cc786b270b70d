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
 * Composite career view for one employee.
 */
@Data
@Builder
public class CareerSuggestions {

    private long employeeId;
    private SkillLevel currentLevel;
    private Map<SkillCategory, List<String>> skillCategories;
    private List<EnrichedMatch> currentMatches;
    private SkillGapResult skillGaps;
    private List<CourseRecommendation> recommendedCourses;
    private List<GrowthProject> nextLevelProjects;
    private List<String> careerTrajectory;
}
