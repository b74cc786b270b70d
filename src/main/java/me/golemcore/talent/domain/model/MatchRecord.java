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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted outcome of one employee-project comparison. The
 * {@code (employeeId, projectId)} pair is unique: a later computation for the
 * same pair overwrites the previous one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchRecord {

    private Long id;
    private long employeeId;
    private long projectId;

    private double similarityScore;
    private double skillMatchPercentage;
    private double overallScore;

    @Builder.Default
    private List<String> matchedSkills = new ArrayList<>();

    @Builder.Default
    private List<String> missingSkills = new ArrayList<>();

    private Instant updatedAt;

    public boolean isSamePair(MatchRecord other) {
        return other != null && employeeId == other.employeeId && projectId == other.projectId;
    }
}
