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
import me.golemcore.talent.domain.model.SkillGapResult;
import me.golemcore.talent.domain.model.SkillLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Skill list analysis: gap detection against required skills, categorization
 * and experience level.
 *
 * <p>
 * Skills are compared case-insensitively and fuzzily: a required skill is
 * satisfied when it contains, or is contained in, one of the candidate's
 * skills. So "React" satisfies "React Native" and "Python 3" satisfies
 * "Python".
 *
 * <p>
 * The one departure from plain containment concerns blank tokens: an empty or
 * whitespace-only candidate skill is a substring of every required skill, yet
 * it is dropped before comparison and never satisfies anything. {@code null}
 * entries are dropped the same way. Non-blank skills follow the containment
 * rule above unchanged.
 */
@Service
public class SkillAnalysisService {

    /**
     * Compare a candidate's skills with a required skill list.
     *
     * @return matched and missing skills, both in required order, and the share of
     *         satisfied requirements (0 when nothing is required)
     */
    public SkillGapResult findSkillGaps(List<String> candidateSkills, List<String> requiredSkills) {
        if (requiredSkills == null || requiredSkills.isEmpty()) {
            return SkillGapResult.empty();
        }
        List<String> normalizedCandidate = normalize(candidateSkills);

        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String required : requiredSkills) {
            if (isSatisfied(required, normalizedCandidate)) {
                matched.add(required);
            } else {
                missing.add(required);
            }
        }

        double percentage = MatchScoreCalculator.round2(
                (double) matched.size() / requiredSkills.size() * 100.0);
        return SkillGapResult.builder()
                .matchedSkills(Collections.unmodifiableList(matched))
                .missingSkills(Collections.unmodifiableList(missing))
                .matchPercentage(percentage)
                .build();
    }

    /**
     * Group skills by category. Every category is present in the result, in
     * declaration order, with skills kept in input order.
     */
    public Map<SkillCategory, List<String>> categorizeSkills(List<String> skills) {
        Map<SkillCategory, List<String>> categorized = new EnumMap<>(SkillCategory.class);
        for (SkillCategory category : SkillCategory.values()) {
            categorized.put(category, new ArrayList<>());
        }
        if (skills != null) {
            for (String skill : skills) {
                if (skill != null) {
                    categorized.get(SkillCategory.classify(skill)).add(skill);
                }
            }
        }
        return categorized;
    }

    public SkillLevel assessSkillLevel(List<String> skills) {
        return SkillLevel.fromSkillCount(skills != null ? skills.size() : 0);
    }

    /**
     * Fuzzy containment test between one skill and any of the given skills.
     */
    public static boolean matchesAny(String skill, Collection<String> others) {
        return isSatisfied(skill, normalize(others));
    }

    private static boolean isSatisfied(String required, List<String> normalizedCandidate) {
        if (required == null) {
            return false;
        }
        String requiredLower = required.toLowerCase(Locale.ROOT);
        for (String candidate : normalizedCandidate) {
            if (requiredLower.contains(candidate) || candidate.contains(requiredLower)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(Collection<String> skills) {
        if (skills == null) {
            return List.of();
        }
        return skills.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }
}
