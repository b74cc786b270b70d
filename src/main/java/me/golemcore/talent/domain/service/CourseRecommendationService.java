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
import me.golemcore.talent.domain.model.Course;
import me.golemcore.talent.domain.model.CourseRecommendation;
import me.golemcore.talent.infrastructure.config.TalentProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks a course catalog against a list of missing skills.
 *
 * <p>
 * A course's relevance is the number of missing skills that fuzzily match one
 * of its skill tags. Courses with relevance 0 are left out; the rest are ranked
 * by relevance descending, keeping catalog order for ties, and capped at
 * {@code talent.courses.max-recommendations}.
 */
@Service
@Slf4j
public class CourseRecommendationService {

    private final TalentProperties.CourseProperties courseProperties;

    public CourseRecommendationService(TalentProperties properties) {
        this.courseProperties = properties.getCourses();
    }

    public List<CourseRecommendation> recommendCourses(List<String> missingSkills, List<Course> courses) {
        if (missingSkills == null || missingSkills.isEmpty() || courses == null || courses.isEmpty()) {
            return List.of();
        }

        List<CourseRecommendation> recommendations = new ArrayList<>();
        for (Course course : courses) {
            int relevance = 0;
            for (String missing : missingSkills) {
                if (SkillAnalysisService.matchesAny(missing, course.getSkillTags())) {
                    relevance++;
                }
            }
            if (relevance > 0) {
                recommendations.add(CourseRecommendation.builder()
                        .course(course)
                        .relevanceScore(relevance)
                        .relevancePercentage(MatchScoreCalculator.round2(
                                (double) relevance / missingSkills.size() * 100.0))
                        .build());
            }
        }

        // stable sort: equal relevance keeps catalog order
        recommendations.sort(Comparator.comparingInt(CourseRecommendation::getRelevanceScore).reversed());
        List<CourseRecommendation> top = recommendations.stream()
                .limit(courseProperties.getMaxRecommendations())
                .toList();

        log.debug("[Courses] {} of {} courses relevant to {} missing skills, returning {}",
                recommendations.size(), courses.size(), missingSkills.size(), top.size());
        return top;
    }
}
