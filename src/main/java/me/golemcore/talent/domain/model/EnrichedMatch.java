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

/**
 * Ranked match enriched with skill gap data, seen from the side of the entity
 * that asked for matches. {@code counterpartId} is a project id when matching
 * an employee and an employee id when matching a project.
 */
@Data
@Builder
public class EnrichedMatch {

    private EntityKind counterpartKind;
    private long counterpartId;

    /** Project title or employee name. */
    private String label;

    /** Project description; null for employee counterparts. */
    private String description;

    /** Project required skills or employee skills. */
    private List<String> skills;

    /** Project team size; 0 for employee counterparts. */
    private int teamSize;

    /** Employee preferences; empty for project counterparts. */
    private List<String> preferences;

    private double similarityScore;
    private double skillMatchPercentage;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private double overallScore;
}
