package me.golemcore.talent.domain.service;

import me.golemcore.talent.adapter.outbound.index.InMemoryVectorIndexAdapter;
import me.golemcore.talent.domain.exception.EntityNotFoundException;
import me.golemcore.talent.domain.model.CareerSuggestions;
import me.golemcore.talent.domain.model.Course;
import me.golemcore.talent.domain.model.Employee;
import me.golemcore.talent.domain.model.EnrichedMatch;
import me.golemcore.talent.domain.model.EntityKind;
import me.golemcore.talent.domain.model.GrowthProject;
import me.golemcore.talent.domain.model.MatchRecord;
import me.golemcore.talent.domain.model.Project;
import me.golemcore.talent.domain.model.SkillCategory;
import me.golemcore.talent.domain.model.SkillGapReport;
import me.golemcore.talent.domain.model.SkillLevel;
import me.golemcore.talent.infrastructure.config.TalentProperties;
import me.golemcore.talent.port.outbound.EmbeddingPort;
import me.golemcore.talent.port.outbound.RecordStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TalentMatchingServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-04-01T09:00:00Z");

    private RecordStorePort recordStore;
    private InMemoryVectorIndexAdapter vectorIndex;
    private TalentMatchingService service;

    @BeforeEach
    void setUp() {
        recordStore = mock(RecordStorePort.class);
        vectorIndex = new InMemoryVectorIndexAdapter();

        EmbeddingPort embeddingPort = mock(EmbeddingPort.class);
        when(embeddingPort.getDimension()).thenReturn(2);
        when(embeddingPort.getModel()).thenReturn("test-model");

        when(recordStore.findEntity(any(), anyLong())).thenCallRealMethod();
        when(recordStore.findEmployee(anyLong())).thenReturn(Optional.empty());
        when(recordStore.findProject(anyLong())).thenReturn(Optional.empty());
        when(recordStore.findAllProjects()).thenReturn(List.of());
        when(recordStore.findAllCourses()).thenReturn(List.of());

        TalentProperties properties = new TalentProperties();
        service = new TalentMatchingService(
                recordStore,
                vectorIndex,
                new EntityEmbeddingService(embeddingPort, vectorIndex, recordStore),
                new SkillAnalysisService(),
                new MatchScoreCalculator(properties),
                new CourseRecommendationService(properties),
                new CareerTrajectoryRules(),
                properties,
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    // ===== Employee -> projects =====

    @Test
    void shouldRankProjectsByOverallScore() {
        stubEmployee(employee(1L, new float[] { 1f, 0f }, "Python", "React"));
        stubIndexedProject(project(10L, new float[] { 1f, 0f }, "Python", "Django", "Docker"));
        stubIndexedProject(project(11L, new float[] { 1f, 1f }, "Python", "React"));
        stubIndexedProject(project(12L, new float[] { 0f, 1f }, "Go"));

        List<EnrichedMatch> matches = service.matchEmployeeToProjects(1L);

        assertEquals(List.of(11L, 10L, 12L), matches.stream().map(EnrichedMatch::getCounterpartId).toList());

        EnrichedMatch best = matches.get(0);
        assertEquals(EntityKind.PROJECT, best.getCounterpartKind());
        assertEquals("Project 11", best.getLabel());
        assertEquals(70.71, best.getSimilarityScore());
        assertEquals(100.0, best.getSkillMatchPercentage());
        assertEquals(82.43, best.getOverallScore());
        assertEquals(4, best.getTeamSize());

        EnrichedMatch second = matches.get(1);
        assertEquals(100.0, second.getSimilarityScore());
        assertEquals(33.33, second.getSkillMatchPercentage());
        assertEquals(List.of("Django", "Docker"), second.getMissingSkills());
        assertEquals(List.of("Python"), second.getMatchedSkills());
        assertEquals(73.33, second.getOverallScore());
    }

    @Test
    void shouldRecordEveryMatchWithCurrentTimestamp() {
        stubEmployee(employee(1L, new float[] { 1f, 0f }, "Python"));
        stubIndexedProject(project(10L, new float[] { 1f, 0f }, "Python", "Docker"));

        service.matchEmployeeToProjects(1L, 5);

        ArgumentCaptor<MatchRecord> captor = ArgumentCaptor.forClass(MatchRecord.class);
        verify(recordStore).upsertMatchRecord(captor.capture());
        MatchRecord saved = captor.getValue();
        assertEquals(1L, saved.getEmployeeId());
        assertEquals(10L, saved.getProjectId());
        assertEquals(100.0, saved.getSimilarityScore());
        assertEquals(50.0, saved.getSkillMatchPercentage());
        assertEquals(80.0, saved.getOverallScore());
        assertEquals(List.of("Docker"), saved.getMissingSkills());
        assertEquals(FIXED_NOW, saved.getUpdatedAt());
    }

    @Test
    void shouldBreakScoreTiesByProjectId() {
        stubEmployee(employee(1L, new float[] { 1f, 0f }, "Java"));
        stubIndexedProject(project(21L, new float[] { 1f, 0f }, "Java"));
        stubIndexedProject(project(20L, new float[] { 1f, 0f }, "Java"));

        List<EnrichedMatch> matches = service.matchEmployeeToProjects(1L, 5);

        assertEquals(List.of(20L, 21L), matches.stream().map(EnrichedMatch::getCounterpartId).toList());
    }

    @Test
    void shouldLimitResultsToTopK() {
        stubEmployee(employee(1L, new float[] { 1f, 0f }, "Java"));
        stubIndexedProject(project(10L, new float[] { 1f, 0f }, "Java"));
        stubIndexedProject(project(11L, new float[] { 1f, 1f }, "Java"));
        stubIndexedProject(project(12L, new float[] { 0f, 1f }, "Java"));

        assertEquals(2, service.matchEmployeeToProjects(1L, 2).size());
        assertTrue(service.matchEmployeeToProjects(1L, 0).isEmpty());
    }

    @Test
    void shouldDropStaleCandidatesAndCleanIndex() {
        stubEmployee(employee(1L, new float[] { 1f, 0f }, "Java"));
        stubIndexedProject(project(10L, new float[] { 1f, 0f }, "Java"));
        vectorIndex.upsert("projects", 13L, new float[] { 1f, 0f }, Map.of());

        List<EnrichedMatch> matches = service.matchEmployeeToProjects(1L, 5);

        assertEquals(List.of(10L), matches.stream().map(EnrichedMatch::getCounterpartId).toList());
        assertFalse(vectorIndex.contains("projects", 13L));
        verify(recordStore, times(1)).upsertMatchRecord(any());
    }

    @Test
    void shouldRepairMissingEmployeeIndexEntry() {
        stubEmployee(employee(1L, new float[] { 1f, 0f }, "Java"));

        service.matchEmployeeToProjects(1L, 5);

        assertTrue(vectorIndex.contains("employees", 1L));
        verify(recordStore, never()).updateEmployeeEmbedding(anyLong(), any());
    }

    @Test
    void shouldThrowWhenEmployeeNotFound() {
        EntityNotFoundException thrown = assertThrows(EntityNotFoundException.class,
                () -> service.matchEmployeeToProjects(99L, 5));

        assertEquals(EntityKind.EMPLOYEE, thrown.getKind());
        assertEquals(99L, thrown.getEntityId());
    }

    // ===== Project -> employees =====

    @Test
    void shouldRankEmployeesForProject() {
        stubProject(project(10L, new float[] { 1f, 0f }, "Python", "Docker"));
        Employee alice = employee(1L, new float[] { 1f, 0f }, "Python", "Docker");
        alice.setPreferences(List.of("remote"));
        stubIndexedEmployee(alice);
        stubIndexedEmployee(employee(2L, new float[] { 0f, 1f }, "Go"));

        List<EnrichedMatch> matches = service.matchProjectToEmployees(10L);

        assertEquals(2, matches.size());
        EnrichedMatch best = matches.get(0);
        assertEquals(EntityKind.EMPLOYEE, best.getCounterpartKind());
        assertEquals(1L, best.getCounterpartId());
        assertEquals("Employee 1", best.getLabel());
        assertEquals(List.of("remote"), best.getPreferences());
        assertEquals(100.0, best.getOverallScore());
        assertEquals(0.0, matches.get(1).getOverallScore());
        verify(recordStore, times(2)).upsertMatchRecord(any());
    }

    @Test
    void shouldThrowWhenProjectNotFound() {
        EntityNotFoundException thrown = assertThrows(EntityNotFoundException.class,
                () -> service.matchProjectToEmployees(42L));

        assertEquals(EntityKind.PROJECT, thrown.getKind());
    }

    // ===== Skill gaps =====

    @Test
    void shouldAnalyzeGapsForSingleProject() {
        stubEmployee(employee(1L, null, "Python", "React"));
        stubProject(project(10L, null, "Python", "Django", "Docker"));
        Course docker = Course.builder().id(1L).title("Docker Mastery").skillTags(List.of("Docker")).build();
        when(recordStore.findAllCourses()).thenReturn(List.of(docker));

        SkillGapReport report = service.analyzeSkillGaps(1L, 10L);

        assertTrue(report.isProjectScoped());
        assertEquals("Project 10", report.getProjectTitle());
        assertEquals(33.33, report.getSkillGap().getMatchPercentage());
        assertEquals(1, report.getRecommendedCourses().size());
        assertEquals(docker, report.getRecommendedCourses().get(0).getCourse());
        assertEquals(50.0, report.getRecommendedCourses().get(0).getRelevancePercentage());
        assertNull(report.getSkillCategories());
    }

    @Test
    void shouldAnalyzeGapsAgainstAllProjects() {
        stubEmployee(employee(1L, null, "Python", "React"));
        when(recordStore.findAllProjects()).thenReturn(List.of(
                project(10L, null, "Python", "Docker"),
                project(11L, null, "Docker", "AWS", "React")));

        SkillGapReport report = service.analyzeSkillGaps(1L, null);

        assertFalse(report.isProjectScoped());
        assertEquals(List.of("Docker", "AWS"), report.getSkillGap().getMissingSkills());
        assertEquals(List.of("Python", "React"), report.getSkillGap().getMatchedSkills());
        assertEquals(50.0, report.getSkillGap().getMatchPercentage());
        assertEquals(List.of("Python"), report.getSkillCategories().get(SkillCategory.PROGRAMMING));
        assertTrue(report.getRecommendedCourses().isEmpty());
    }

    @Test
    void shouldThrowWhenGapProjectNotFound() {
        stubEmployee(employee(1L, null, "Python"));

        EntityNotFoundException thrown = assertThrows(EntityNotFoundException.class,
                () -> service.analyzeSkillGaps(1L, 77L));

        assertEquals(EntityKind.PROJECT, thrown.getKind());
    }

    // ===== Career =====

    @Test
    void shouldBuildCareerSuggestions() {
        Employee employee = employee(1L, new float[] { 1f, 0f }, "Java", "Python", "Go", "Rust", "Pandas");
        stubEmployee(employee);
        Project stretch = project(10L, new float[] { 1f, 0f }, "Java", "Kafka");
        Project comfortable = project(11L, new float[] { 1f, 1f }, "Java", "Python");
        Project bigStretch = project(12L, new float[] { 0f, 1f }, "Python", "Go", "Kafka");
        Project tooFar = project(13L, new float[] { 0f, 1f }, "Swift", "Kotlin", "Flutter");
        stubIndexedProject(stretch);
        stubIndexedProject(comfortable);
        stubIndexedProject(bigStretch);
        stubIndexedProject(tooFar);
        when(recordStore.findAllProjects()).thenReturn(List.of(stretch, comfortable, bigStretch, tooFar));

        CareerSuggestions suggestions = service.careerPathSuggestions(1L);

        assertEquals(SkillLevel.MID_LEVEL, suggestions.getCurrentLevel());
        assertEquals(3, suggestions.getCurrentMatches().size());
        assertEquals(List.of(10L, 12L), suggestions.getNextLevelProjects().stream()
                .map(GrowthProject::getProjectId).toList());
        assertEquals(50.0, suggestions.getNextLevelProjects().get(0).getSkillMatchPercentage());
        assertEquals(66.67, suggestions.getNextLevelProjects().get(1).getSkillMatchPercentage());
        assertEquals(List.of("Kafka", "Swift", "Kotlin", "Flutter"), suggestions.getSkillGaps().getMissingSkills());
        assertEquals(List.of(CareerTrajectoryRules.SOFTWARE_ENGINEERING), suggestions.getCareerTrajectory());
    }

    // ===== History =====

    @Test
    void shouldReturnMatchHistoryOfExistingEmployee() {
        stubEmployee(employee(1L, null, "Java"));
        MatchRecord matchRecord = MatchRecord.builder().id(3L).employeeId(1L).projectId(2L).build();
        when(recordStore.findMatchRecordsByEmployee(1L)).thenReturn(List.of(matchRecord));

        assertEquals(List.of(matchRecord), service.getMatchHistory(1L));
        assertThrows(EntityNotFoundException.class, () -> service.getMatchHistory(2L));
    }

    private void stubEmployee(Employee employee) {
        when(recordStore.findEmployee(employee.getId())).thenReturn(Optional.of(employee));
    }

    private void stubProject(Project project) {
        when(recordStore.findProject(project.getId())).thenReturn(Optional.of(project));
    }

    private void stubIndexedProject(Project project) {
        stubProject(project);
        vectorIndex.upsert("projects", project.getId(), project.getEmbedding(), project.toIndexMetadata());
    }

    private void stubIndexedEmployee(Employee employee) {
        stubEmployee(employee);
        vectorIndex.upsert("employees", employee.getId(), employee.getEmbedding(), employee.toIndexMetadata());
    }

    private static Employee employee(long id, float[] embedding, String... skills) {
        return Employee.builder()
                .id(id)
                .name("Employee " + id)
                .skills(List.of(skills))
                .resumeText("Resume of employee " + id)
                .embedding(embedding)
                .build();
    }

    private static Project project(long id, float[] embedding, String... requiredSkills) {
        return Project.builder()
                .id(id)
                .title("Project " + id)
                .requiredSkills(List.of(requiredSkills))
                .teamSize(4)
                .description("Description of project " + id)
                .embedding(embedding)
                .build();
    }
}
