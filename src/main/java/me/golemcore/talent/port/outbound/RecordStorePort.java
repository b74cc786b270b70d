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

package me.golemcore.talent.port.outbound;

import me.golemcore.talent.domain.model.Course;
import me.golemcore.talent.domain.model.EmbeddableEntity;
import me.golemcore.talent.domain.model.Employee;
import me.golemcore.talent.domain.model.EntityKind;
import me.golemcore.talent.domain.model.MatchRecord;
import me.golemcore.talent.domain.model.Project;

import java.util.List;
import java.util.Optional;

/**
 * Port for the record store holding employees, projects, courses and match
 * history.
 *
 * <p>
 * Ids are assigned by the store on first save. Match records are unique per
 * {@code (employeeId, projectId)} pair. Implementations signal unreachable
 * storage with {@link me.golemcore.talent.domain.exception.RecordStoreException}.
 */
public interface RecordStorePort {

    Optional<Employee> findEmployee(long employeeId);

    List<Employee> findAllEmployees();

    /**
     * Insert (when the id is null) or replace an employee.
     *
     * @return the saved employee with its id assigned
     */
    Employee saveEmployee(Employee employee);

    /**
     * Replace the cached embedding of an employee. Unknown ids are ignored.
     */
    void updateEmployeeEmbedding(long employeeId, float[] embedding);

    Optional<Project> findProject(long projectId);

    List<Project> findAllProjects();

    /**
     * Insert (when the id is null) or replace a project.
     *
     * @return the saved project with its id assigned
     */
    Project saveProject(Project project);

    /**
     * Replace the cached embedding of a project. Unknown ids are ignored.
     */
    void updateProjectEmbedding(long projectId, float[] embedding);

    List<Course> findAllCourses();

    Course saveCourse(Course course);

    /**
     * Insert or overwrite the match record of the record's
     * {@code (employeeId, projectId)} pair.
     *
     * @return the stored record, keeping the id of an overwritten record
     */
    MatchRecord upsertMatchRecord(MatchRecord matchRecord);

    Optional<MatchRecord> findMatchRecord(long employeeId, long projectId);

    /**
     * Get the match history of an employee, most recently updated first.
     */
    List<MatchRecord> findMatchRecordsByEmployee(long employeeId);

    default Optional<EmbeddableEntity> findEntity(EntityKind kind, long id) {
        return switch (kind) {
        case EMPLOYEE -> findEmployee(id).map(EmbeddableEntity.class::cast);
        case PROJECT -> findProject(id).map(EmbeddableEntity.class::cast);
        };
    }

    default List<? extends EmbeddableEntity> findAllEntities(EntityKind kind) {
        return switch (kind) {
        case EMPLOYEE -> findAllEmployees();
        case PROJECT -> findAllProjects();
        };
    }

    default void updateEmbedding(EntityKind kind, long id, float[] embedding) {
        switch (kind) {
        case EMPLOYEE -> updateEmployeeEmbedding(id, embedding);
        case PROJECT -> updateProjectEmbedding(id, embedding);
        }
    }
}
