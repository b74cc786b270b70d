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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.talent.domain.model.Course;
import me.golemcore.talent.domain.model.Project;
import me.golemcore.talent.infrastructure.config.TalentProperties;
import me.golemcore.talent.port.outbound.RecordStorePort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Startup preparation of the catalog and the vector index.
 *
 * <p>
 * When sample data is enabled and the store holds neither projects nor
 * courses, sample projects and courses are loaded from the configured
 * resources. The in-memory index is then rebuilt from the record store, since
 * it does not survive restarts.
 */
@Service
@Slf4j
public class CatalogBootstrapService {

    private static final TypeReference<List<Project>> PROJECT_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<Course>> COURSE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final RecordStorePort recordStore;
    private final TalentCatalogService catalogService;
    private final EntityEmbeddingService embeddingService;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final TalentProperties.BootstrapProperties bootstrap;

    public CatalogBootstrapService(RecordStorePort recordStore, TalentCatalogService catalogService,
            EntityEmbeddingService embeddingService, ResourceLoader resourceLoader, ObjectMapper objectMapper,
            TalentProperties properties) {
        this.recordStore = recordStore;
        this.catalogService = catalogService;
        this.embeddingService = embeddingService;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.bootstrap = properties.getBootstrap();
    }

    public void bootstrap() {
        if (bootstrap.isRebuildIndexOnStartup()) {
            embeddingService.rebuildIndex();
        }
        if (bootstrap.isSampleDataEnabled() && isCatalogEmpty()) {
            loadSampleData();
        }
    }

    /**
     * Load sample projects and courses. A missing or unreadable resource is
     * skipped with a warning.
     *
     * @return number of loaded records
     */
    public int loadSampleData() {
        int loaded = 0;
        for (Project project : readList(bootstrap.getSampleProjects(), PROJECT_LIST_TYPE_REF)) {
            catalogService.registerProject(project.getTitle(), project.getRequiredSkills(),
                    project.getTeamSize(), project.getDescription());
            loaded++;
        }
        for (Course course : readList(bootstrap.getSampleCourses(), COURSE_LIST_TYPE_REF)) {
            catalogService.registerCourse(course.getTitle(), course.getSkillTags(), course.getProvider(),
                    course.getUrl(), course.getDescription());
            loaded++;
        }
        log.info("[Bootstrap] Loaded {} sample records", loaded);
        return loaded;
    }

    private boolean isCatalogEmpty() {
        return recordStore.findAllProjects().isEmpty() && recordStore.findAllCourses().isEmpty();
    }

    private <T> List<T> readList(String location, TypeReference<List<T>> typeRef) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[Bootstrap] Sample resource not found: {}", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, typeRef);
        } catch (IOException e) {
            log.warn("[Bootstrap] Failed to read sample resource {}: {}", location, e.getMessage());
            return List.of();
        }
    }
}
