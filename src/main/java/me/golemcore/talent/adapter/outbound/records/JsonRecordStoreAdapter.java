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

package me.golemcore.talent.adapter.outbound.records;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.talent.domain.exception.RecordStoreException;
import me.golemcore.talent.domain.model.Course;
import me.golemcore.talent.domain.model.Employee;
import me.golemcore.talent.domain.model.MatchRecord;
import me.golemcore.talent.domain.model.Project;
import me.golemcore.talent.infrastructure.config.TalentProperties;
import me.golemcore.talent.port.outbound.RecordStorePort;
import me.golemcore.talent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Record store keeping each record type as one JSON document in the
 * {@code records/} storage directory:
 * <ul>
 * <li>{@code employees.json}</li>
 * <li>{@code projects.json}</li>
 * <li>{@code courses.json}</li>
 * <li>{@code match-history.json}</li>
 * </ul>
 *
 * <p>
 * Documents are loaded on first access and cached; every mutation rewrites the
 * document atomically. All operations share one monitor, which serializes
 * match record upserts for every {@code (employeeId, projectId)} pair.
 * Records handed out are copies, so callers cannot mutate the cache.
 *
 * @see RecordStorePort
 */
@Component
@Slf4j
public class JsonRecordStoreAdapter implements RecordStorePort {

    private static final String EMPLOYEES_FILE = "employees.json";
    private static final String PROJECTS_FILE = "projects.json";
    private static final String COURSES_FILE = "courses.json";
    private static final String MATCH_HISTORY_FILE = "match-history.json";

    private static final TypeReference<List<Employee>> EMPLOYEE_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<Project>> PROJECT_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<Course>> COURSE_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<MatchRecord>> MATCH_RECORD_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    private final Table<Employee> employees;
    private final Table<Project> projects;
    private final Table<Course> courses;
    private final Table<MatchRecord> matchRecords;

    public JsonRecordStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper, TalentProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getRecordsDirectory();
        this.employees = new Table<>(EMPLOYEES_FILE, Employee.class, EMPLOYEE_LIST_TYPE_REF,
                Employee::getId, Employee::setId);
        this.projects = new Table<>(PROJECTS_FILE, Project.class, PROJECT_LIST_TYPE_REF,
                Project::getId, Project::setId);
        this.courses = new Table<>(COURSES_FILE, Course.class, COURSE_LIST_TYPE_REF,
                Course::getId, Course::setId);
        this.matchRecords = new Table<>(MATCH_HISTORY_FILE, MatchRecord.class, MATCH_RECORD_LIST_TYPE_REF,
                MatchRecord::getId, MatchRecord::setId);
    }

    // ==================== EMPLOYEES ====================

    @Override
    public synchronized Optional<Employee> findEmployee(long employeeId) {
        return employees.find(employeeId).map(employees::copy);
    }

    @Override
    public synchronized List<Employee> findAllEmployees() {
        return employees.copyAll();
    }

    @Override
    public synchronized Employee saveEmployee(Employee employee) {
        return employees.save(employee);
    }

    @Override
    public synchronized void updateEmployeeEmbedding(long employeeId, float[] embedding) {
        Optional<Employee> existing = employees.find(employeeId);
        if (existing.isEmpty()) {
            log.debug("[Records] Embedding update skipped, employee {} not found", employeeId);
            return;
        }
        existing.get().setEmbedding(embedding != null ? embedding.clone() : null);
        employees.persist();
    }

    // ==================== PROJECTS ====================

    @Override
    public synchronized Optional<Project> findProject(long projectId) {
        return projects.find(projectId).map(projects::copy);
    }

    @Override
    public synchronized List<Project> findAllProjects() {
        return projects.copyAll();
    }

    @Override
    public synchronized Project saveProject(Project project) {
        return projects.save(project);
    }

    @Override
    public synchronized void updateProjectEmbedding(long projectId, float[] embedding) {
        Optional<Project> existing = projects.find(projectId);
        if (existing.isEmpty()) {
            log.debug("[Records] Embedding update skipped, project {} not found", projectId);
            return;
        }
        existing.get().setEmbedding(embedding != null ? embedding.clone() : null);
        projects.persist();
    }

    // ==================== COURSES ====================

    @Override
    public synchronized List<Course> findAllCourses() {
        return courses.copyAll();
    }

    @Override
    public synchronized Course saveCourse(Course course) {
        return courses.save(course);
    }

    // ==================== MATCH HISTORY ====================

    @Override
    public synchronized MatchRecord upsertMatchRecord(MatchRecord matchRecord) {
        Optional<MatchRecord> existing = matchRecords.rows().stream()
                .filter(matchRecord::isSamePair)
                .findFirst();
        MatchRecord stored = matchRecords.copy(matchRecord);
        stored.setId(existing.map(MatchRecord::getId).orElse(null));
        MatchRecord saved = matchRecords.save(stored);
        log.debug("[Records] {} match record {} (employee={}, project={})",
                existing.isPresent() ? "Updated" : "Created", saved.getId(),
                saved.getEmployeeId(), saved.getProjectId());
        return saved;
    }

    @Override
    public synchronized Optional<MatchRecord> findMatchRecord(long employeeId, long projectId) {
        return matchRecords.rows().stream()
                .filter(r -> r.getEmployeeId() == employeeId && r.getProjectId() == projectId)
                .findFirst()
                .map(matchRecords::copy);
    }

    @Override
    public synchronized List<MatchRecord> findMatchRecordsByEmployee(long employeeId) {
        return matchRecords.rows().stream()
                .filter(r -> r.getEmployeeId() == employeeId)
                .sorted(Comparator
                        .comparing(MatchRecord::getUpdatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                        .thenComparing(MatchRecord::getId, Comparator.nullsLast(Comparator.<Long>reverseOrder())))
                .map(matchRecords::copy)
                .toList();
    }

    /**
     * One JSON document holding all records of a type. Callers hold the adapter
     * monitor.
     */
    private final class Table<T> {

        private final String file;
        private final Class<T> type;
        private final TypeReference<List<T>> listType;
        private final Function<T, Long> idGetter;
        private final BiConsumer<T, Long> idSetter;

        private List<T> cache;

        Table(String file, Class<T> type, TypeReference<List<T>> listType,
                Function<T, Long> idGetter, BiConsumer<T, Long> idSetter) {
            this.file = file;
            this.type = type;
            this.listType = listType;
            this.idGetter = idGetter;
            this.idSetter = idSetter;
        }

        List<T> rows() {
            if (cache == null) {
                cache = load();
            }
            return cache;
        }

        Optional<T> find(long id) {
            return rows().stream()
                    .filter(row -> idGetter.apply(row) != null && idGetter.apply(row) == id)
                    .findFirst();
        }

        List<T> copyAll() {
            return rows().stream().map(this::copy).toList();
        }

        /**
         * Insert when the id is null or unknown, replace otherwise.
         */
        T save(T record) {
            T stored = copy(record);
            Long id = idGetter.apply(stored);
            List<T> rows = rows();
            if (id == null) {
                idSetter.accept(stored, nextId());
                rows.add(stored);
            } else {
                int index = indexOf(id);
                if (index >= 0) {
                    rows.set(index, stored);
                } else {
                    rows.add(stored);
                }
            }
            persist();
            return copy(stored);
        }

        void persist() {
            String json;
            try {
                json = objectMapper.writeValueAsString(rows());
            } catch (JsonProcessingException e) {
                throw new RecordStoreException("Failed to serialize " + file, e);
            }
            try {
                storagePort.putTextAtomic(directory, file, json, true).join();
            } catch (CompletionException e) {
                // keep the cache in sync with the last document that reached disk
                cache = null;
                throw new RecordStoreException("Failed to write " + directory + "/" + file, e.getCause());
            }
        }

        T copy(T record) {
            try {
                return objectMapper.readValue(objectMapper.writeValueAsBytes(record), type);
            } catch (IOException e) {
                throw new RecordStoreException("Failed to copy record from " + file, e);
            }
        }

        private int indexOf(long id) {
            List<T> rows = rows();
            for (int i = 0; i < rows.size(); i++) {
                Long rowId = idGetter.apply(rows.get(i));
                if (rowId != null && rowId == id) {
                    return i;
                }
            }
            return -1;
        }

        private long nextId() {
            return rows().stream()
                    .map(idGetter)
                    .filter(id -> id != null)
                    .mapToLong(Long::longValue)
                    .max()
                    .orElse(0L) + 1;
        }

        private List<T> load() {
            String json;
            try {
                json = storagePort.getText(directory, file).join();
            } catch (CompletionException e) {
                throw new RecordStoreException("Failed to read " + directory + "/" + file, e.getCause());
            }
            if (json == null || json.isBlank()) {
                return new ArrayList<>();
            }
            try {
                List<T> loaded = new ArrayList<>(objectMapper.readValue(json, listType));
                log.debug("[Records] Loaded {} rows from {}", loaded.size(), file);
                return loaded;
            } catch (IOException e) {
                throw new RecordStoreException("Failed to parse " + directory + "/" + file, e);
            }
        }
    }
}
