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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Seniority estimated from the number of skills an employee holds.
 */
public enum SkillLevel {

    JUNIOR("Junior", 5), MID_LEVEL("Mid-level", 15), SENIOR("Senior", 25), EXPERT("Expert", Integer.MAX_VALUE);

    private final String displayName;
    private final int upperBoundExclusive;

    SkillLevel(String displayName, int upperBoundExclusive) {
        this.displayName = displayName;
        this.upperBoundExclusive = upperBoundExclusive;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public static SkillLevel fromSkillCount(int skillCount) {
        for (SkillLevel level : values()) {
            if (skillCount < level.upperBoundExclusive) {
                return level;
            }
        }
        return EXPERT;
    }
}
