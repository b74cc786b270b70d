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

/**
 * Course scored against a set of missing skills. Computed per request and never
 * persisted.
 */
@Data
@Builder
public class CourseRecommendation {

    private Course course;

    /** Number of missing skills the course addresses. */
    private int relevanceScore;

    /** Relevance score divided by the number of missing skills, as a percentage. */
    private double relevancePercentage;
}
