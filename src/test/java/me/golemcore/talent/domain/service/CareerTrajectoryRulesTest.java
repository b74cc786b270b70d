package me.golemcore.talent.domain.service;

import me.golemcore.talent.domain.model.SkillCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CareerTrajectoryRulesTest {

    private SkillAnalysisService skillAnalysis;
    private CareerTrajectoryRules rules;

    @BeforeEach
    void setUp() {
        skillAnalysis = new SkillAnalysisService();
        rules = new CareerTrajectoryRules();
    }

    @Test
    void shouldSuggestSoftwareEngineeringForDominantProgramming() {
        List<String> trajectories = suggest("Java", "Python", "Go", "Rust", "Docker");

        assertEquals(List.of(CareerTrajectoryRules.SOFTWARE_ENGINEERING), trajectories);
    }

    @Test
    void shouldNotSuggestSoftwareEngineeringForThreeLanguages() {
        List<String> trajectories = suggest("Java", "Python", "Go");

        assertEquals(List.of(CareerTrajectoryRules.GENERAL), trajectories);
    }

    @Test
    void shouldCombineEveryMatchingRuleInTableOrder() {
        List<String> trajectories = suggest(
                "Pandas", "NumPy", "SQL",
                "React", "Angular", "HTML",
                "AWS", "GCP", "Jenkins");

        assertEquals(List.of(
                CareerTrajectoryRules.DATA_SCIENCE,
                CareerTrajectoryRules.WEB,
                CareerTrajectoryRules.CLOUD), trajectories);
    }

    @Test
    void shouldFallBackToGeneralTrajectory() {
        assertEquals(List.of(CareerTrajectoryRules.GENERAL), suggest());
        assertEquals(List.of(CareerTrajectoryRules.GENERAL), suggest("Leadership", "Communication"));
    }

    @Test
    void shouldResolveDominantTiesByDeclarationOrder() {
        Map<SkillCategory, List<String>> categories = skillAnalysis.categorizeSkills(
                List.of("React", "Vue", "AWS", "GCP"));

        assertEquals(SkillCategory.WEB_DEVELOPMENT, CareerTrajectoryRules.dominant(categories));
    }

    private List<String> suggest(String... skills) {
        return rules.suggest(skillAnalysis.categorizeSkills(List.of(skills)));
    }
}
