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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Null-tolerant helpers for skill lists read from records. A {@code null} list
 * reads as empty and {@code null} entries are skipped.
 */
public final class SkillLists {

    private SkillLists() {
    }

    /**
     * Mutable copy without {@code null} entries.
     */
    public static List<String> copyOf(List<String> skills) {
        List<String> copy = new ArrayList<>();
        if (skills == null) {
            return copy;
        }
        for (String skill : skills) {
            if (skill != null) {
                copy.add(skill);
            }
        }
        return copy;
    }

    /**
     * Comma-separated skills as they appear in embedding text.
     */
    public static String join(List<String> skills) {
        if (skills == null) {
            return "";
        }
        return skills.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.joining(", "));
    }
}
