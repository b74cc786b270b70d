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
import me.golemcore.talent.domain.model.Course;
import me.golemcore.talent.domain.model.Employee;
import me.golemcore.talent.domain.model.EmployeeProfile;
import me.golemcore.talent.domain.model.EntityKind;
import me.golemcore.talent.domain.model.Project;
import me.golemcore.talent.domain.model.SkillLists;
import me.golemcore.talent.port.outbound.RecordStorePort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Registration and lookup of employees, projects and courses.
 *
 * <p>
 * Employees and projects are embedded eagerly when registered or updated, so
 * the index entry always reflects the latest content. Skills arrive already
 * extracted; this service does not parse resumes.
 */
@Service
@Slf4j
public class TalentCatalogService {

    private final RecordStorePort recordStore;
    private final EntityEmbeddingService embeddingService;

    public TalentCatalogService(RecordStorePort recordStore, EntityEmbeddingService embeddingService) {
        this.recordStore = recordStore;
        this.embeddingService = embeddingService;
    }

    public Employee registerEmployee(String name, List<String> skills, List<String> preferences, String resumeText) {
        requireText(name, "Employee name");
        Employee saved = recordStore.saveEmployee(Employee.builder()
                .name(name)
                .skills(SkillLists.copyOf(skills))
                .preferences(SkillLists.copyOf(preferences))
                .resumeText(resumeText != null ? resumeText : "")
                .build());
        saved.setEmbedding(embeddingService.refreshEmbedding(saved));
        log.info("[Catalog] Registered employee {} '{}' with {} skills", saved.getId(), name, saved.getSkills().size());
        return saved;
    }

    public Project registerProject(String title, List<String> requiredSkills, int teamSize, String description) {
        requireText(title, "Project title");
        Project saved = recordStore.saveProject(Project.builder()
                .title(title)
                .requiredSkills(SkillLists.copyOf(requiredSkills))
                .teamSize(teamSize)
                .description(description != null ? description : "")
                .build());
        saved.setEmbedding(embeddingService.refreshEmbedding(saved));
        log.info("[Catalog] Registered project {} '{}'", saved.getId(), title);
        return saved;
    }

    /**
     * Replace a project's content and regenerate its embedding.
     *
     * @throws EntityNotFoundException
     *             if the project does not exist
     */
    public Project updateProject(long projectId, String title, List<String> requiredSkills, int teamSize,
            String description) {
        requireText(title, "Project title");
        Project project = recordStore.findProject(projectId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.PROJECT, projectId));
        project.setTitle(title);
        project.setRequiredSkills(SkillLists.copyOf(requiredSkills));
        project.setTeamSize(teamSize);
        project.setDescription(description != null ? description : "");
        project.setEmbedding(null);

        Project saved = recordStore.saveProject(project);
        saved.setEmbedding(embeddingService.refreshEmbedding(saved));
        log.info("[Catalog] Updated project {} '{}'", projectId, title);
        return saved;
    }

    public Course registerCourse(String title, List<String> skillTags, String provider, String url,
            String description) {
        requireText(title, "Course title");
        Course saved = recordStore.saveCourse(Course.builder()
                .title(title)
                .skillTags(SkillLists.copyOf(skillTags))
                .provider(provider)
                .url(url)
                .description(description)
                .build());
        log.debug("[Catalog] Registered course {} '{}'", saved.getId(), title);
        return saved;
    }

    public List<Project> listProjects() {
        return recordStore.findAllProjects();
    }

    public List<Course> listCourses() {
        return recordStore.findAllCourses();
    }

    /**
     * Get an employee with skill count and match history, newest match first.
     *
     * @throws EntityNotFoundException
     *             if the employee does not exist
     */
    public EmployeeProfile getEmployeeProfile(long employeeId) {
        Employee employee = recordStore.findEmployee(employeeId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.EMPLOYEE, employeeId));
        return EmployeeProfile.builder()
                .employee(employee)
                .totalSkills(SkillLists.copyOf(employee.getSkills()).size())
                .matchHistory(recordStore.findMatchRecordsByEmployee(employeeId))
                .build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
