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


package me.golemcore.talent.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.talent.domain.service.CatalogBootstrapService;
import me.golemcore.talent.port.outbound.EmbeddingPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that provides shared infrastructure beans and prepares
 * the engine on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Exposes the {@link Clock} used for match timestamps</li>
 * <li>Exposes the {@link ObjectMapper} used for persisted records</li>
 * <li>Logs startup information (embedding model, storage location)</li>
 * <li>Loads sample data and rebuilds the vector index via
 * {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final TalentProperties properties;
    private final EmbeddingPort embeddingPort;
    private final CatalogBootstrapService bootstrapService;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Talent Matcher v{} starting...", version);
        log.info("Embedding Model: {} ({} dimensions)", embeddingPort.getModel(), embeddingPort.getDimension());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());

        bootstrapService.bootstrap();

        log.info("Talent Matcher started successfully");
    }
}
