package me.golemcore.router.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.h2.jdbcx.JdbcDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Shared infrastructure beans and startup logging.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RouterProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Source of randomness for feedback sampling, dataset shuffling and
     * synthesizer fallback.
     */
    @Bean
    public static Random routerRandom() {
        return new SecureRandom();
    }

    @Bean
    public DataSource feedbackDataSource() {
        Path dbPath = RouterProperties.resolvePath(properties.getStorage().getDbPath());
        try {
            Files.createDirectories(dbPath.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create feedback database directory " + dbPath.getParent(), e);
        }
        return h2DataSource(dbPath);
    }

    /**
     * Embedded H2 file database at {@code dbPath} (H2 appends {@code .mv.db}).
     */
    public static DataSource h2DataSource(Path dbPath) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:file:" + dbPath + ";NON_KEYWORDS=VALUE");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Router starting...");
        log.info("Optimization enabled: {}", properties.getOptimization().isEnabled());
        log.info("Feedback collection enabled: {}", properties.getFeedback().isEnabled());
        log.info("Inference provider: {}", properties.getInference().getProvider());
        log.info("Feedback database: {}", RouterProperties.resolvePath(properties.getStorage().getDbPath()));
    }
}
