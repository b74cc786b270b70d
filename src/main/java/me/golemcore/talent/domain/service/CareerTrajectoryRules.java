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

import me.golemcore.talent.domain.model.SkillCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Ordered rule table turning categorized skills into suggested career
 * trajectories.
 *
 * <p>
 * Every rule whose condition holds contributes its trajectory, in table order.
 * When none holds, the general trajectory is returned alone.
 */
@Component
public class CareerTrajectoryRules {

    static final String SOFTWARE_ENGINEERING = "Software Engineer → Senior Software Engineer → Tech Lead";
    static final String DATA_SCIENCE = "Data Analyst → Data Scientist → ML Engineer";
    static final String WEB = "Frontend Developer → Full-stack Developer → Solutions Architect";
    static final String CLOUD = "DevOps Engineer → Cloud Architect → Platform Engineer";
    static final String GENERAL = "General Developer → Specialized Developer → Technical Lead";

    private static final List<Rule> RULES = List.of(
            new Rule(categories -> dominant(categories) == SkillCategory.PROGRAMMING
                    && count(categories, SkillCategory.PROGRAMMING) > 3, SOFTWARE_ENGINEERING),
            new Rule(categories -> count(categories, SkillCategory.DATA_SCIENCE) > 2, DATA_SCIENCE),
            new Rule(categories -> count(categories, SkillCategory.WEB_DEVELOPMENT) > 2, WEB),
            new Rule(categories -> count(categories, SkillCategory.CLOUD_DEVOPS) > 2, CLOUD));

    public List<String> suggest(Map<SkillCategory, List<String>> categories) {
        List<String> trajectories = RULES.stream()
                .filter(rule -> rule.condition().test(categories))
                .map(Rule::trajectory)
                .toList();
        return trajectories.isEmpty() ? List.of(GENERAL) : trajectories;
    }

    /**
     * Category holding the most skills; ties go to the earlier category.
     */
    static SkillCategory dominant(Map<SkillCategory, List<String>> categories) {
        SkillCategory best = SkillCategory.values()[0];
        for (SkillCategory category : SkillCategory.values()) {
            if (count(categories, category) > count(categories, best)) {
                best = category;
            }
        }
        return best;
    }

    private static int count(Map<SkillCategory, List<String>> categories, SkillCategory category) {
        List<String> skills = categories.get(category);
        return skills != null ? skills.size() : 0;
    }

    private record Rule(Predicate<Map<SkillCategory, List<String>>> condition, String trajectory) {
    }
}
