package me.bantu.agent.infrastructure.config;

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

import me.bantu.agent.domain.service.RetrievalMemory;
import me.bantu.agent.domain.service.ToolRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * Provides the system {@link Clock} (replaced in tests for deterministic time
 * parsing) and the {@link ObjectMapper} used for event persistence and HTTP
 * clients.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BantuProperties properties;
    private final ToolRegistry toolRegistry;
    private final RetrievalMemory memory;
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
        log.info("Bantu Agent v{} starting...", version);
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Model: {}", properties.getLlm().getModel());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Memory: {} (dimension {})",
                memory.isConfigured() ? "enabled" : "disabled", memory.getDimension());
        log.info("Tools: {}", String.join(", ", toolRegistry.names()));
    }
}
