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
import me.golemcore.talent.domain.exception.EntityNotFoundException;
import me.golemcore.talent.domain.model.CareerSuggestions;
import me.golemcore.talent.domain.model.CourseRecommendation;
import me.golemcore.talent.domain.model.EmbeddableEntity;
import me.golemcore.talent.domain.model.Employee;
import me.golemcore.talent.domain.model.EnrichedMatch;
import me.golemcore.talent.domain.model.EntityKind;
import me.golemcore.talent.domain.model.GrowthProject;
import me.golemcore.talent.domain.model.IndexHit;
import me.golemcore.talent.domain.model.MatchRecord;
import me.golemcore.talent.domain.model.Project;
import me.golemcore.talent.domain.model.SkillCategory;
import me.golemcore.talent.domain.model.SkillGapReport;
import me.golemcore.talent.domain.model.SkillGapResult;
import me.golemcore.talent.domain.model.SkillLists;
import me.golemcore.talent.infrastructure.config.TalentProperties;
import me.golemcore.talent.port.outbound.RecordStorePort;
import me.golemcore.talent.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Matching orchestrator between employees and projects.
 *
 * <p>
 * A match request runs through these steps:
 * <ol>
 * <li>Load the source entity, ensuring it has an indexed embedding</li>
 * <li>Query the counterpart collection for the nearest vectors</li>
 * <li>Resolve each candidate and compare the employee's skills with the
 * project's required skills</li>
 * <li>Combine similarity and skill overlap into the overall score</li>
 * <li>Upsert one {@link MatchRecord} per (employee, project) pair</li>
 * <li>Rank by overall score descending, counterpart id ascending on ties</li>
 * </ol>
 *
 * <p>
 * Candidates whose record no longer exists are dropped from the result and
 * their stale index entry is removed. This service is the only writer of match
 * records.
 */
@Service
@Slf4j
public class TalentMatchingService {

    private static final Comparator<EnrichedMatch> RANKING = Comparator
            .comparingDouble(EnrichedMatch::getOverallScore).reversed()
            .thenComparingLong(EnrichedMatch::getCounterpartId);

    private static final Comparator<GrowthProject> GROWTH_ORDER = Comparator
            .comparingDouble(GrowthProject::getSkillMatchPercentage)
            .thenComparingLong(GrowthProject::getProjectId);

    private final RecordStorePort recordStore;
    private final VectorIndexPort vectorIndex;
    private final EntityEmbeddingService embeddingService;
    private final SkillAnalysisService skillAnalysis;
    private final MatchScoreCalculator scoreCalculator;
    private final CourseRecommendationService courseRecommendations;
    private final CareerTrajectoryRules trajectoryRules;
    private final TalentProperties.MatchingProperties matching;
    private final Clock clock;

    public TalentMatchingService(RecordStorePort recordStore, VectorIndexPort vectorIndex,
            EntityEmbeddingService embeddingService, SkillAnalysisService skillAnalysis,
            MatchScoreCalculator scoreCalculator, CourseRecommendationService courseRecommendations,
            CareerTrajectoryRules trajectoryRules, TalentProperties properties, Clock clock) {
        this.recordStore = recordStore;
        this.vectorIndex = vectorIndex;
        this.embeddingService = embeddingService;
        this.skillAnalysis = skillAnalysis;
        this.scoreCalculator = scoreCalculator;
        this.courseRecommendations = courseRecommendations;
        this.trajectoryRules = trajectoryRules;
        this.matching = properties.getMatching();
        this.clock = clock;
    }

    // ==================== MATCHING ====================

    public List<EnrichedMatch> matchEmployeeToProjects(long employeeId) {
        return matchEmployeeToProjects(employeeId, matching.getDefaultTopK());
    }

    /**
     * Rank projects for an employee.
     *
     * @throws EntityNotFoundException
     *             if the employee does not exist
     */
    public List<EnrichedMatch> matchEmployeeToProjects(long employeeId, int topK) {
        return match(EntityKind.EMPLOYEE, employeeId, topK);
    }

    public List<EnrichedMatch> matchProjectToEmployees(long projectId) {
        return matchProjectToEmployees(projectId, matching.getDefaultTopK());
    }

    /**
     * Rank employees for a project.
     *
     * @throws EntityNotFoundException
     *             if the project does not exist
     */
    public List<EnrichedMatch> matchProjectToEmployees(long projectId, int topK) {
        return match(EntityKind.PROJECT, projectId, topK);
    }

    private List<EnrichedMatch> match(EntityKind sourceKind, long sourceId, int topK) {
        EmbeddableEntity source = recordStore.findEntity(sourceKind, sourceId)
                .orElseThrow(() -> new EntityNotFoundException(sourceKind, sourceId));
        float[] embedding = embeddingService.ensureEmbedding(source);

        EntityKind targetKind = sourceKind.counterpart();
        String targetCollection = targetKind.getCollection();
        List<IndexHit> hits = vectorIndex.query(targetCollection, embedding, topK);

        List<EnrichedMatch> matches = new ArrayList<>();
        for (IndexHit hit : hits) {
            Optional<EmbeddableEntity> candidate = recordStore.findEntity(targetKind, hit.getEntityId());
            if (candidate.isEmpty()) {
                vectorIndex.delete(targetCollection, hit.getEntityId());
                log.info("[Matching] Dropped stale index entry {} from '{}'", hit.getEntityId(), targetCollection);
                continue;
            }

            Employee employee = (Employee) (sourceKind == EntityKind.EMPLOYEE ? source : candidate.get());
            Project project = (Project) (sourceKind == EntityKind.PROJECT ? source : candidate.get());
            SkillGapResult gap = skillAnalysis.findSkillGaps(employee.getSkills(), project.getRequiredSkills());
            double overall = scoreCalculator.overallScore(hit.getSimilarityScore(), gap.getMatchPercentage());

            recordMatch(employee.getId(), project.getId(), hit.getSimilarityScore(), gap, overall);
            matches.add(enrich(candidate.get(), hit.getSimilarityScore(), gap, overall));
        }

        List<EnrichedMatch> ranked = matches.stream()
                .sorted(RANKING)
                .limit(Math.max(topK, 0))
                .toList();
        log.debug("[Matching] {} {}: {} hits, {} matches", sourceKind, sourceId, hits.size(), ranked.size());
        return ranked;
    }

    private void recordMatch(long employeeId, long projectId, double similarity, SkillGapResult gap,
            double overall) {
        Instant now = clock.instant();
        recordStore.upsertMatchRecord(MatchRecord.builder()
                .employeeId(employeeId)
                .projectId(projectId)
                .similarityScore(similarity)
                .skillMatchPercentage(gap.getMatchPercentage())
                .overallScore(overall)
                .matchedSkills(new ArrayList<>(gap.getMatchedSkills()))
                .missingSkills(new ArrayList<>(gap.getMissingSkills()))
                .updatedAt(now)
                .build());
    }

    private static EnrichedMatch enrich(EmbeddableEntity counterpart, double similarity, SkillGapResult gap,
            double overall) {
        EnrichedMatch.EnrichedMatchBuilder builder = EnrichedMatch.builder()
                .counterpartKind(counterpart.getKind())
                .counterpartId(counterpart.getId())
                .label(counterpart.getLabel())
                .skills(SkillLists.copyOf(counterpart.getSkills()))
                .similarityScore(similarity)
                .skillMatchPercentage(gap.getMatchPercentage())
                .matchedSkills(gap.getMatchedSkills())
                .missingSkills(gap.getMissingSkills())
                .overallScore(overall);
        if (counterpart instanceof Project project) {
            builder.description(project.getDescription())
                    .teamSize(project.getTeamSize())
                    .preferences(List.of());
        } else if (counterpart instanceof Employee employee) {
            builder.preferences(SkillLists.copyOf(employee.getPreferences()));
        }
        return builder.build();
    }

    // ==================== SKILL GAPS ====================

    /**
     * Analyze an employee's skill gaps, either against one project or against the
     * union of all projects' required skills.
     *
     * @param projectId
     *            project to analyze against, or {@code null} for the general report
     * @throws EntityNotFoundException
     *             if the employee, or the given project, does not exist
     */
    public SkillGapReport analyzeSkillGaps(long employeeId, Long projectId) {
        Employee employee = requireEmployee(employeeId);

        if (projectId != null) {
            Project project = recordStore.findProject(projectId)
                    .orElseThrow(() -> new EntityNotFoundException(EntityKind.PROJECT, projectId));
            SkillGapResult gap = skillAnalysis.findSkillGaps(employee.getSkills(), project.getRequiredSkills());
            return SkillGapReport.builder()
                    .employeeId(employeeId)
                    .projectId(project.getId())
                    .projectTitle(project.getTitle())
                    .skillGap(gap)
                    .recommendedCourses(recommendCourses(gap))
                    .build();
        }

        SkillGapResult gap = generalSkillGap(employee);
        return SkillGapReport.builder()
                .employeeId(employeeId)
                .skillGap(gap)
                .recommendedCourses(recommendCourses(gap))
                .skillCategories(skillAnalysis.categorizeSkills(employee.getSkills()))
                .build();
    }

    private SkillGapResult generalSkillGap(Employee employee) {
        Set<String> allRequired = new LinkedHashSet<>();
        for (Project project : recordStore.findAllProjects()) {
            allRequired.addAll(SkillLists.copyOf(project.getRequiredSkills()));
        }
        return skillAnalysis.findSkillGaps(employee.getSkills(), new ArrayList<>(allRequired));
    }

    private List<CourseRecommendation> recommendCourses(SkillGapResult gap) {
        if (gap.getMissingSkills().isEmpty()) {
            return List.of();
        }
        return courseRecommendations.recommendCourses(gap.getMissingSkills(), recordStore.findAllCourses());
    }

    // ==================== CAREER ====================

    /**
     * Build career suggestions for an employee: level, current matches, growth
     * projects, courses and trajectories. Current matches are recorded in the
     * match history like any other match.
     *
     * @throws EntityNotFoundException
     *             if the employee does not exist
     */
    public CareerSuggestions careerPathSuggestions(long employeeId) {
        Employee employee = requireEmployee(employeeId);
        Map<SkillCategory, List<String>> categories = skillAnalysis.categorizeSkills(employee.getSkills());

        List<EnrichedMatch> currentMatches = matchEmployeeToProjects(employeeId, matching.getCareerMatchPoolSize())
                .stream()
                .limit(matching.getCareerCurrentMatches())
                .toList();
        SkillGapResult gaps = generalSkillGap(employee);

        return CareerSuggestions.builder()
                .employeeId(employeeId)
                .currentLevel(skillAnalysis.assessSkillLevel(employee.getSkills()))
                .skillCategories(categories)
                .currentMatches(currentMatches)
                .skillGaps(gaps)
                .recommendedCourses(recommendCourses(gaps))
                .nextLevelProjects(findGrowthProjects(employee))
                .careerTrajectory(trajectoryRules.suggest(categories))
                .build();
    }

    private List<GrowthProject> findGrowthProjects(Employee employee) {
        List<GrowthProject> growth = new ArrayList<>();
        for (Project project : recordStore.findAllProjects()) {
            SkillGapResult gap = skillAnalysis.findSkillGaps(employee.getSkills(), project.getRequiredSkills());
            double percentage = gap.getMatchPercentage();
            if (percentage >= matching.getGrowthMinPercentage() && percentage <= matching.getGrowthMaxPercentage()) {
                growth.add(GrowthProject.builder()
                        .projectId(project.getId())
                        .title(project.getTitle())
                        .description(project.getDescription())
                        .skillMatchPercentage(percentage)
                        .missingSkills(gap.getMissingSkills())
                        .build());
            }
        }
        return growth.stream()
                .sorted(GROWTH_ORDER)
                .limit(matching.getGrowthProjectLimit())
                .toList();
    }

    // ==================== HISTORY ====================

    /**
     * Get an employee's match history, most recently updated first.
     *
     * @throws EntityNotFoundException
     *             if the employee does not exist
     */
    public List<MatchRecord> getMatchHistory(long employeeId) {
        requireEmployee(employeeId);
        return recordStore.findMatchRecordsByEmployee(employeeId);
    }

    private Employee requireEmployee(long employeeId) {
        return recordStore.findEmployee(employeeId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.EMPLOYEE, employeeId));
    }
}
