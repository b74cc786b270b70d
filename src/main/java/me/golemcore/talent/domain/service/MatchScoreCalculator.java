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

import me.golemcore.talent.infrastructure.config.TalentProperties;
import org.springframework.stereotype.Service;

/**
 * Combines vector similarity and skill overlap into the overall ranking score.
 *
 * <p>
 * Both inputs are on a 0-100 scale, so with weights summing to 1 the result
 * stays within 0-100. Weights come from {@code talent.scoring.*}.
 */
@Service
public class MatchScoreCalculator {

    private final TalentProperties.ScoringProperties scoring;

    public MatchScoreCalculator(TalentProperties properties) {
        this.scoring = properties.getScoring();
    }

    public double overallScore(double similarityScore, double skillMatchPercentage) {
        return round2(scoring.getSimilarityWeight() * similarityScore
                + scoring.getSkillMatchWeight() * skillMatchPercentage);
    }

    /**
     * Half-up rounding to two decimals, used for every reported percentage.
     */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
