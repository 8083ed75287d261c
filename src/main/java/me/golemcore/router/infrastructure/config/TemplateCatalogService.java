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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.TemplateDefinition;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads prompt templates from {@code prompt-templates.yml}, with the same
 * override rules as {@link ModelCatalogService}.
 */
@Service
@Slf4j
public class TemplateCatalogService {

    private static final String CLASSPATH_FILE = "prompt-templates.yml";

    private final RouterProperties properties;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private volatile List<TemplateDefinition> templates = List.of();

    public TemplateCatalogService(RouterProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    public void reload() {
        replaceTemplates(loadFile().getTemplates());
        log.info("[TemplateCatalog] Loaded {} templates", templates.size());
    }

    public void replaceTemplates(List<TemplateDefinition> definitions) {
        List<TemplateDefinition> valid = new ArrayList<>();
        if (definitions != null) {
            for (TemplateDefinition definition : definitions) {
                if (definition == null || definition.getName() == null || definition.getTemplate() == null) {
                    log.warn("[TemplateCatalog] Skipping template without name or text");
                    continue;
                }
                valid.add(definition);
            }
        }
        templates = List.copyOf(valid);
    }

    /**
     * Templates in declaration order.
     */
    public List<TemplateDefinition> getTemplates() {
        return templates;
    }

    private TemplatesFile loadFile() {
        String override = properties.getCatalog().getTemplatesPath();
        if (override != null && !override.isBlank()) {
            Path path = RouterProperties.resolvePath(override);
            if (Files.isRegularFile(path)) {
                try (InputStream is = Files.newInputStream(path)) {
                    return parse(is);
                } catch (IOException e) {
                    log.warn("[TemplateCatalog] Failed to read {}: {}", path, e.getMessage());
                }
            } else {
                log.warn("[TemplateCatalog] Configured templates file not found: {}", path);
            }
        }

        ClassPathResource resource = new ClassPathResource(CLASSPATH_FILE);
        if (resource.exists()) {
            try (InputStream is = resource.getInputStream()) {
                return parse(is);
            } catch (IOException e) {
                log.warn("[TemplateCatalog] Failed to read classpath {}: {}", CLASSPATH_FILE, e.getMessage());
            }
        }
        return new TemplatesFile();
    }

    private TemplatesFile parse(InputStream is) throws IOException {
        TemplatesFile file = yamlMapper.readValue(is, TemplatesFile.class);
        return file != null ? file : new TemplatesFile();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TemplatesFile {
        private List<TemplateDefinition> templates = new ArrayList<>();
    }
}
