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
import lombok.Value;

import java.util.List;

/**
 * Result of comparing candidate skills against a required skill list.
 *
 * <p>
 * {@code matched} and {@code missing} partition the required skills and both
 * keep their original order.
 */
@Value
@Builder
public class SkillGapResult {

    List<String> missingSkills;
    List<String> matchedSkills;

    /** Share of satisfied required skills, 0-100 with two decimals. */
    double matchPercentage;

    public static SkillGapResult empty() {
        return SkillGapResult.builder()
                .missingSkills(List.of())
                .matchedSkills(List.of())
                .matchPercentage(0)
                .build();
    }
}
